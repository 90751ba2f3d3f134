package com.hunt.scout.browser.config;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class DevToolsTargetsResolverTest {

    private static final String LIST = "http://localhost:9222/json";
    private static final String NEW = "http://localhost:9222/json/new?about:blank";

    private MockRestServiceServer server;
    private DevToolsTargetsResolver resolver;

    @BeforeEach
    void setUp() {
        RestTemplate rt = new RestTemplate();
        server = MockRestServiceServer.bindTo(rt).build();

        DevToolsProperties properties = new DevToolsProperties();
        properties.setNewTargetSettleMs(0);
        resolver = new DevToolsTargetsResolver(properties, rt);
    }

    @Test
    void prefersPageTarget() {
        server.expect(requestTo(LIST)).andRespond(withSuccess("""
                [
                  {"type":"service_worker","webSocketDebuggerUrl":"ws://localhost:9222/devtools/page/SW"},
                  {"type":"page","webSocketDebuggerUrl":"ws://localhost:9222/devtools/page/P1"}
                ]
                """, MediaType.APPLICATION_JSON));

        assertEquals("ws://localhost:9222/devtools/page/P1", resolver.discover());
        server.verify();
    }

    @Test
    void fallsBackToAnyTargetWithDebuggerUrl() {
        server.expect(requestTo(LIST)).andRespond(withSuccess("""
                [
                  {"type":"page"},
                  {"type":"iframe","webSocketDebuggerUrl":"ws://localhost:9222/devtools/page/IF"}
                ]
                """, MediaType.APPLICATION_JSON));

        assertEquals("ws://localhost:9222/devtools/page/IF", resolver.discover());
    }

    @Test
    void createsNewTargetAndListsAgainOnce() {
        server.expect(requestTo(LIST)).andRespond(withSuccess("[]", MediaType.APPLICATION_JSON));
        server.expect(requestTo(NEW)).andExpect(method(HttpMethod.PUT))
                .andRespond(withSuccess("{\"id\":\"N1\"}", MediaType.APPLICATION_JSON));
        server.expect(requestTo(LIST)).andRespond(withSuccess("""
                [{"type":"page","webSocketDebuggerUrl":"ws://localhost:9222/devtools/page/N1"}]
                """, MediaType.APPLICATION_JSON));

        assertEquals("ws://localhost:9222/devtools/page/N1", resolver.discover());
        server.verify();
    }

    @Test
    void noTargetAfterRetryFails() {
        server.expect(requestTo(LIST)).andRespond(withServerError());
        server.expect(requestTo(NEW)).andRespond(withServerError());
        server.expect(requestTo(LIST)).andRespond(withSuccess("[]", MediaType.APPLICATION_JSON));

        NoTargetAvailableException e = assertThrows(NoTargetAvailableException.class, () -> resolver.discover());
        assertTrue(e.getMessage().contains("9222"));
        server.verify();
    }

    @Test
    void validatesWebSocketUrls() {
        assertTrue(DevToolsTargetsResolver.isValidWebSocketUrl("ws://127.0.0.1:9222/devtools/page/X"));
        assertTrue(DevToolsTargetsResolver.isValidWebSocketUrl("wss://host/devtools/page/X"));
        assertFalse(DevToolsTargetsResolver.isValidWebSocketUrl("http://host/json"));
        assertFalse(DevToolsTargetsResolver.isValidWebSocketUrl(" "));
        assertFalse(DevToolsTargetsResolver.isValidWebSocketUrl(null));
    }
}
