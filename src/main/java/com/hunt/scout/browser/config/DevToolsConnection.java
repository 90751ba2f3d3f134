package com.hunt.scout.browser.config;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Одна "эпоха" соединения: транспорт, endpoint и счётчик id.
 * При переподключении создаётся новый экземпляр, старый только закрывается.
 */
@Slf4j
public final class DevToolsConnection {

    @Getter
    private final String wsUrl;
    @Getter
    private final CdpTransport transport;
    private final AtomicInteger idGen = new AtomicInteger(0);

    public DevToolsConnection(String wsUrl, CdpTransport transport) {
        this.wsUrl = wsUrl;
        this.transport = transport;
    }

    public int nextId() {
        return idGen.incrementAndGet();
    }

    public boolean isOpen() {
        return transport.isOpen();
    }

    public void close() {
        try {
            transport.close();
        } catch (RuntimeException e) {
            log.debug("CDP transport close failed for {}: {}", wsUrl, e.getMessage());
        }
    }
}
