package com.hunt.scout.browser.config;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpMethod;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

@Slf4j
@Component
public class DevToolsTargetsResolver {

    private final RestTemplate rt;
    private final DevToolsProperties properties;

    @Autowired
    public DevToolsTargetsResolver(DevToolsProperties properties) {
        this(properties, buildRestTemplate(
                Duration.ofMillis(properties.getDiscoveryTimeoutMs()),
                Duration.ofMillis(properties.getDiscoveryTimeoutMs())));
    }

    DevToolsTargetsResolver(DevToolsProperties properties, RestTemplate rt) {
        this.properties = properties;
        this.rt = rt;
    }

    /**
     * ws://.../devtools/page/... для работы.
     * Порядок: page с webSocketDebuggerUrl, потом любой target с ним, потом /json/new и ещё один /json.
     */
    public String discover() {
        String base = normalize(properties.getDiscoveryBaseUrl());
        JsonNode list = listTargets(base);

        String ws = firstPageWsUrl(list);
        if (ws == null) ws = firstAnyWsUrl(list);
        if (ws != null) return ws;

        log.debug("No debuggable targets at {}, requesting a new one", base);
        requestNewTarget(base);
        sleep(properties.getNewTargetSettleMs());

        ws = firstAnyWsUrl(listTargets(base));
        if (ws != null) return ws;

        throw new NoTargetAvailableException("No CDP targets found at " + base
                + ". Start Chrome with --remote-debugging-port=" + properties.getPort());
    }

    /** null если /json недоступен */
    public JsonNode listTargets(String devToolsBaseUrl) {
        try {
            String u = normalize(devToolsBaseUrl) + "/json";
            return rt.getForObject(u, JsonNode.class);
        } catch (Exception e) {
            log.debug("listTargets failed: {}", e.getMessage());
            return null;
        }
    }

    /** Chrome 111+ принимает /json/new только через PUT */
    void requestNewTarget(String devToolsBaseUrl) {
        try {
            rt.exchange(normalize(devToolsBaseUrl) + "/json/new?about:blank", HttpMethod.PUT, null, JsonNode.class);
        } catch (Exception e) {
            log.debug("requestNewTarget failed: {}", e.getMessage());
        }
    }

    private String firstPageWsUrl(JsonNode list) {
        if (list == null || !list.isArray()) return null;
        for (JsonNode n : list) {
            if ("page".equals(text(n, "type"))) {
                String ws = text(n, "webSocketDebuggerUrl");
                if (isValidWebSocketUrl(ws)) return ws;
            }
        }
        return null;
    }

    private String firstAnyWsUrl(JsonNode list) {
        if (list == null || !list.isArray()) return null;
        for (JsonNode n : list) {
            String ws = text(n, "webSocketDebuggerUrl");
            if (isValidWebSocketUrl(ws)) return ws;
        }
        return null;
    }

    public static boolean isValidWebSocketUrl(String url) {
        if (url == null || url.trim().isEmpty()) {
            return false;
        }
        return url.startsWith("ws://") || url.startsWith("wss://");
    }

    private String normalize(String base) {
        if (base == null) return "";
        base = base.trim();
        if (base.endsWith("/")) return base.substring(0, base.length() - 1);
        return base;
    }

    private String text(JsonNode n, String field) {
        JsonNode v = n.get(field);
        return (v != null && !v.isNull()) ? v.asText() : null;
    }

    private void sleep(long ms) {
        if (ms <= 0) return;
        try { Thread.sleep(ms); } catch (InterruptedException ie) { Thread.currentThread().interrupt(); }
    }

    private static RestTemplate buildRestTemplate(Duration connectTimeout, Duration readTimeout) {
        SimpleClientHttpRequestFactory f = new SimpleClientHttpRequestFactory();
        f.setConnectTimeout((int) connectTimeout.toMillis());
        f.setReadTimeout((int) readTimeout.toMillis());
        RestTemplate rt = new RestTemplate();
        rt.setRequestFactory(f);
        return rt;
    }
}
