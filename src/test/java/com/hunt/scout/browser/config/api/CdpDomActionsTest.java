package com.hunt.scout.browser.config.api;

import com.hunt.scout.browser.config.DevToolsProperties;
import com.hunt.scout.browser.config.DevToolsSession;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static com.hunt.scout.browser.config.api.CdpTestResponses.error;
import static com.hunt.scout.browser.config.api.CdpTestResponses.ok;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class CdpDomActionsTest {

    private DevToolsSession session;
    private CdpDomActions actions;

    @BeforeEach
    void setUp() {
        session = mock(DevToolsSession.class);
        when(session.send(eq("DOM.getDocument"), anyMap())).thenReturn(ok("{\"root\":{\"nodeId\":1}}"));
        when(session.send(eq("Input.dispatchMouseEvent"), anyMap())).thenReturn(ok("{}"));
        when(session.send(eq("Input.dispatchKeyEvent"), anyMap())).thenReturn(ok("{}"));

        DevToolsProperties properties = new DevToolsProperties();
        properties.setWaitPollMs(10);
        actions = new CdpDomActions(session, properties);
    }

    private void nodeFound(int nodeId) {
        when(session.send(eq("DOM.querySelector"), anyMap())).thenReturn(ok("{\"nodeId\":" + nodeId + "}"));
    }

    @Test
    void querySelectorFetchesFreshDocumentEveryTime() {
        nodeFound(7);

        Optional<NodeRef> first = actions.querySelector("#q");
        Optional<NodeRef> second = actions.querySelector("#q");

        assertEquals(7, first.orElseThrow().nodeId());
        assertEquals(7, second.orElseThrow().nodeId());
        verify(session, times(2)).send(eq("DOM.getDocument"), anyMap());
    }

    @Test
    void querySelectorEmptyOnInvalidSelector() {
        when(session.send(eq("DOM.querySelector"), anyMap())).thenReturn(error("DOM Error while querying"));

        assertTrue(actions.querySelector("###").isEmpty());
    }

    @Test
    void clickReturnsFalseWhenNothingMatches() {
        nodeFound(0);

        assertFalse(actions.click(".missing"));
        verify(session, never()).send(eq("DOM.getBoxModel"), anyMap());
        verify(session, never()).send(eq("Input.dispatchMouseEvent"), anyMap());
    }

    @Test
    void clickReturnsFalseWithoutBoxModel() {
        nodeFound(5);
        when(session.send(eq("DOM.getBoxModel"), anyMap())).thenReturn(error("Could not compute box model."));

        assertFalse(actions.click(".hidden"));
        verify(session, never()).send(eq("Input.dispatchMouseEvent"), anyMap());
    }

    @Test
    @SuppressWarnings("unchecked")
    void clickPressesAndReleasesAtBoxCenter() {
        nodeFound(5);
        when(session.send(eq("DOM.getBoxModel"), anyMap())).thenReturn(ok(
                "{\"model\":{\"content\":[10,20,30,20,30,40,10,40]}}"));

        assertTrue(actions.click("button"));

        ArgumentCaptor<Map<String, Object>> captor = ArgumentCaptor.forClass(Map.class);
        verify(session, times(2)).send(eq("Input.dispatchMouseEvent"), captor.capture());
        List<Map<String, Object>> events = captor.getAllValues();

        assertEquals("mousePressed", events.get(0).get("type"));
        assertEquals("mouseReleased", events.get(1).get("type"));
        for (Map<String, Object> e : events) {
            assertEquals(20.0, (Double) e.get("x"), 0.001);
            assertEquals(30.0, (Double) e.get("y"), 0.001);
            assertEquals("left", e.get("button"));
        }
    }

    @Test
    void fillIsNoOpWhenClickFails() {
        nodeFound(0);

        assertFalse(actions.fill("input[name=q]", "hello"));
        verify(session, never()).send(eq("Input.dispatchKeyEvent"), anyMap());
    }

    @Test
    void fillSelectsAllWithCtrlThenTypesEachCharacter() {
        nodeFound(5);
        when(session.send(eq("DOM.getBoxModel"), anyMap())).thenReturn(ok(
                "{\"model\":{\"content\":[0,0,10,0,10,10,0,10]}}"));

        assertTrue(actions.fill("input[name=q]", "abc"));

        InOrder order = inOrder(session);
        order.verify(session).send(eq("Input.dispatchKeyEvent"),
                argThat(m -> "keyDown".equals(m.get("type")) && "a".equals(m.get("key"))
                        && Integer.valueOf(2).equals(m.get("modifiers"))));
        order.verify(session, times(3)).send(eq("Input.dispatchKeyEvent"),
                argThat(m -> "char".equals(m.get("type"))));
    }

    @Test
    void fillUsesCtrlEvenWhenJvmRunsOnMac() {
        nodeFound(5);
        when(session.send(eq("DOM.getBoxModel"), anyMap())).thenReturn(ok(
                "{\"model\":{\"content\":[0,0,10,0,10,10,0,10]}}"));
        String os = System.getProperty("os.name");
        System.setProperty("os.name", "Mac OS X");
        try {
            actions.fill("input[name=q]", "x");
        } finally {
            System.setProperty("os.name", os);
        }

        verify(session).send("Input.dispatchKeyEvent", Map.of(
                "type", "keyDown", "key", "a", "code", "KeyA", "modifiers", CdpDomActions.Mod.CTRL));
        verify(session, never()).send(eq("Input.dispatchKeyEvent"),
                argThat(m -> Integer.valueOf(CdpDomActions.Mod.META).equals(m.get("modifiers"))));
    }

    @Test
    void typeTextSendsOneCharEventPerCharacter() {
        actions.typeText("hi!");

        verify(session).send("Input.dispatchKeyEvent", Map.of("type", "char", "text", "h"));
        verify(session).send("Input.dispatchKeyEvent", Map.of("type", "char", "text", "i"));
        verify(session).send("Input.dispatchKeyEvent", Map.of("type", "char", "text", "!"));
    }

    @Test
    void keyPressSendsKeyDownOnly() {
        actions.keyPress("Enter");

        verify(session).send("Input.dispatchKeyEvent", Map.of("type", "keyDown", "key", "Enter"));
        verify(session, times(1)).send(eq("Input.dispatchKeyEvent"), anyMap());
    }

    @Test
    void waitForSelectorReturnsTrueOnceNodeAppears() {
        when(session.send(eq("DOM.querySelector"), anyMap()))
                .thenReturn(ok("{\"nodeId\":0}"), ok("{\"nodeId\":0}"), ok("{\"nodeId\":9}"));

        assertTrue(actions.waitForSelector(".results", Duration.ofSeconds(5)));
        verify(session, times(3)).send(eq("DOM.querySelector"), anyMap());
    }

    @Test
    void waitForSelectorTimesOut() {
        nodeFound(0);

        long start = System.currentTimeMillis();
        assertFalse(actions.waitForSelector(".never", Duration.ofMillis(60)));
        assertTrue(System.currentTimeMillis() - start < 2000);
    }

    @Test
    void waitForSelectorStopsWhenDeadlineCancelled() {
        nodeFound(0);
        Deadline deadline = Deadline.after(Duration.ofMinutes(1));
        deadline.cancel();

        assertFalse(actions.waitForSelector(".never", deadline));
        verify(session, never()).send(eq("DOM.querySelector"), anyMap());
    }
}
