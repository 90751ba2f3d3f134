package com.hunt.scout.browser.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Диспетчер команд поверх одного {@link DevToolsConnection}.
 * Состояния: DISCONNECTED -> CONNECTED, при сбое CONNECTED -> RECONNECTING -> CONNECTED | DISCONNECTED.
 */
@Component
@Slf4j
public class DevToolsCdpClient implements DevToolsSession {

    static final List<String> REQUIRED_DOMAINS = List.of("Page", "DOM", "Runtime");

    private final ObjectMapper objectMapper;
    private final DevToolsTargetsResolver targets;
    private final CdpTransportFactory transportFactory;
    private final DevToolsProperties properties;

    private DevToolsConnection connection;
    private ConnectionState state = ConnectionState.DISCONNECTED;

    public DevToolsCdpClient(ObjectMapper objectMapper,
                             DevToolsTargetsResolver targets,
                             CdpTransportFactory transportFactory,
                             DevToolsProperties properties) {
        this.objectMapper = objectMapper;
        this.targets = targets;
        this.transportFactory = transportFactory;
        this.properties = properties;
    }

    @Override
    public void connect() {
        if (state == ConnectionState.CONNECTED && connection != null && connection.isOpen()) return;
        DevToolsConnection dead = connection;
        connection = null;
        if (dead != null) dead.close();
        openConnection();
    }

    @Override
    public CdpResponse send(String method, Map<String, Object> params) {
        // первое подключение: ошибки discovery уходят как есть
        if (connection == null) connect();

        int attempts = 1 + Math.max(0, properties.getMaxReconnectAttempts());
        RuntimeException last = null;

        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                if (attempt > 1) {
                    reconnect(method);
                } else if (!connection.isOpen()) {
                    // сокет закрылся, пока клиент простаивал
                    throw new CdpConnectionException("CDP connection lost before " + method + ": " + connection.getWsUrl());
                }
                return exchange(connection, method, params);
            } catch (CdpConnectionException | NoTargetAvailableException e) {
                last = e;
                log.debug("CDP {} attempt {}/{} failed: {}", method, attempt, attempts, e.getMessage());
            }
        }

        teardown();
        throw new CdpCommandException(method, last);
    }

    @Override
    public ConnectionState getState() {
        return state;
    }

    @Override
    public String getWsUrl() {
        DevToolsConnection c = connection;
        return c == null ? null : c.getWsUrl();
    }

    @Override
    public void close() {
        teardown();
    }

    private void reconnect(String method) {
        log.info("Reconnecting to DevTools to retry {}", method);
        state = ConnectionState.RECONNECTING;
        DevToolsConnection old = connection;
        connection = null;
        if (old != null) old.close();
        openConnection();
    }

    private void openConnection() {
        DevToolsConnection fresh = null;
        try {
            String wsUrl = targets.discover();
            fresh = new DevToolsConnection(wsUrl, transportFactory.open(wsUrl));

            for (String domain : REQUIRED_DOMAINS) {
                CdpResponse resp = exchange(fresh, domain + ".enable", Map.of());
                if (resp.isError()) {
                    log.warn("{}.enable returned error: {}", domain, resp.errorMessage());
                }
            }
        } catch (RuntimeException e) {
            if (fresh != null) fresh.close();
            state = ConnectionState.DISCONNECTED;
            throw e;
        }

        connection = fresh;
        state = ConnectionState.CONNECTED;
        log.debug("CDP connected: {}", fresh.getWsUrl());
    }

    private void teardown() {
        DevToolsConnection c = connection;
        connection = null;
        state = ConnectionState.DISCONNECTED;
        if (c != null) c.close();
    }

    /**
     * Пишет команду и читает входящие, пока не придёт ответ с нашим id.
     * События ({method, params} без id) и чужие ответы отбрасываются.
     */
    private CdpResponse exchange(DevToolsConnection c, String method, Map<String, Object> params) {
        if (c == null) throw new CdpConnectionException("CDP not connected (method=" + method + ")");

        int id = c.nextId();
        String json = serialize(id, method, params);
        CdpTransport transport = c.getTransport();
        transport.send(json);

        long deadline = System.currentTimeMillis() + properties.getCommandTimeoutMs();
        while (true) {
            long remaining = deadline - System.currentTimeMillis();
            if (remaining <= 0) {
                throw new CdpConnectionException("CDP timeout for " + method + " (" + properties.getCommandTimeoutMs() + "ms)");
            }

            String raw = transport.receive(remaining);
            if (raw == null) continue;

            JsonNode node;
            try {
                node = objectMapper.readTree(raw);
            } catch (JsonProcessingException e) {
                log.debug("CDP parse error: {}", e.getMessage());
                continue;
            }

            JsonNode idNode = node.get("id");
            if (idNode == null || !idNode.canConvertToInt()) {
                log.trace("CDP event dropped: {}", node.path("method").asText());
                continue;
            }
            if (idNode.asInt() != id) {
                log.trace("CDP response for stale id {} dropped (waiting for {})", idNode.asInt(), id);
                continue;
            }

            return new CdpResponse(id, node.get("result"), node.get("error"));
        }
    }

    private String serialize(int id, String method, Map<String, Object> params) {
        ObjectNode msg = objectMapper.createObjectNode();
        msg.put("id", id);
        msg.put("method", method);
        msg.set("params", objectMapper.valueToTree(params == null ? Map.of() : params));
        try {
            return objectMapper.writeValueAsString(msg);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize CDP params for " + method, e);
        }
    }
}
