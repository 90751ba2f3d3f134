package com.hunt.scout.browser.config;

import lombok.extern.slf4j.Slf4j;
import org.java_websocket.client.WebSocketClient;
import org.java_websocket.exceptions.WebsocketNotConnectedException;
import org.java_websocket.handshake.ServerHandshake;

import java.net.URI;
import java.util.Objects;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * CDP over WebSocket (java-websocket).
 * Поток java-websocket только складывает кадры в очередь, разбирает их вызывающий поток.
 */
@Slf4j
public class WebSocketCdpTransport implements CdpTransport {

    private final String wsUrl;
    private final BlockingQueue<Inbound> inbox = new LinkedBlockingQueue<>();
    private final WebSocketClient ws;

    private WebSocketCdpTransport(String wsUrl, int connectionLostTimeoutSec) {
        this.wsUrl = Objects.requireNonNull(wsUrl, "wsUrl");
        this.ws = new WebSocketClient(URI.create(wsUrl)) {

            @Override
            public void onOpen(ServerHandshake handshake) {
                log.debug("CDP WS opened: {}", wsUrl);
            }

            @Override
            public void onMessage(String message) {
                inbox.offer(new Inbound(message, null));
            }

            @Override
            public void onClose(int code, String reason, boolean remote) {
                log.debug("CDP WS closed: {} {} remote={}", code, reason, remote);
                inbox.offer(new Inbound(null, new CdpConnectionException("CDP WS closed: " + code + " " + reason)));
            }

            @Override
            public void onError(Exception ex) {
                log.debug("CDP WS error: {}", ex.getMessage());
                inbox.offer(new Inbound(null, new CdpConnectionException("CDP WS error: " + ex.getMessage(), ex)));
            }
        };
        this.ws.setConnectionLostTimeout(connectionLostTimeoutSec);
    }

    /**
     * Открывает соединение и блокируется до handshake.
     */
    public static WebSocketCdpTransport open(String wsUrl, long connectTimeoutMs) {
        if (!DevToolsTargetsResolver.isValidWebSocketUrl(wsUrl)) {
            throw new CdpConnectionException("Not a WebSocket URL: " + wsUrl);
        }

        WebSocketCdpTransport transport = new WebSocketCdpTransport(wsUrl, 30);
        try {
            boolean ok = transport.ws.connectBlocking(connectTimeoutMs, TimeUnit.MILLISECONDS);
            if (!ok || !transport.ws.isOpen()) {
                transport.close();
                throw new CdpConnectionException("CDP connectBlocking timeout: " + wsUrl);
            }
            return transport;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            transport.close();
            throw new CdpConnectionException("Interrupted while connecting to " + wsUrl, ie);
        }
    }

    @Override
    public String getWsUrl() {
        return wsUrl;
    }

    @Override
    public boolean isOpen() {
        return ws.isOpen();
    }

    @Override
    public void send(String message) {
        if (!ws.isOpen()) {
            throw new CdpConnectionException("CDP WS is not open: " + wsUrl);
        }
        try {
            ws.send(message);
        } catch (WebsocketNotConnectedException e) {
            throw new CdpConnectionException("CDP WS write failed: " + wsUrl, e);
        }
    }

    @Override
    public String receive(long timeoutMs) {
        Inbound next;
        try {
            next = inbox.poll(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new CdpConnectionException("Interrupted while reading from " + wsUrl, ie);
        }
        if (next == null) return null;
        if (next.failure() != null) {
            // оставляем маркер, чтобы следующие чтения тоже падали сразу
            inbox.offer(next);
            throw next.failure();
        }
        return next.text();
    }

    @Override
    public void close() {
        try {
            if (ws.isOpen()) ws.closeBlocking();
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
    }

    private record Inbound(String text, CdpConnectionException failure) {}
}
