package com.hunt.scout.browser.config.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.hunt.scout.browser.config.CdpResponse;
import com.hunt.scout.browser.config.DevToolsProperties;
import com.hunt.scout.browser.config.DevToolsSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

//ищем узел через DOM.getDocument + DOM.querySelector (корень каждый раз свежий)
//считаем центр по DOM.getBoxModel
//кликаем через Input.dispatchMouseEvent
//печатаем по символу через Input.dispatchKeyEvent type=char

@Slf4j
@Component
@RequiredArgsConstructor
public class CdpDomActions {

    private final DevToolsSession page;
    private final DevToolsProperties properties;

    // =========================
    // 0) QUERY
    // =========================

    /**
     * Каждый раз берёт свежий корень документа: nodeId после навигации невалидны.
     */
    public Optional<NodeRef> querySelector(String css) {
        Objects.requireNonNull(css, "css");

        CdpResponse doc = page.send("DOM.getDocument", Map.of("depth", 1));
        int rootId = doc.result().path("root").path("nodeId").asInt(0);
        if (doc.isError() || rootId == 0) {
            log.debug("DOM.getDocument: no root ({})", doc.errorMessage());
            return Optional.empty();
        }

        CdpResponse q = page.send("DOM.querySelector", Map.of(
                "nodeId", rootId,
                "selector", css
        ));
        if (q.isError()) {
            log.debug("DOM.querySelector failed for {}: {}", css, q.errorMessage());
            return Optional.empty();
        }

        int nodeId = q.result().path("nodeId").asInt(0);
        return nodeId == 0 ? Optional.empty() : Optional.of(new NodeRef(nodeId, css));
    }

    // =========================
    // 1) WAIT FOR SELECTOR (APPEAR)
    // =========================

    public boolean waitForSelector(String css, Duration timeout) {
        return waitForSelector(css, Deadline.after(timeout));
    }

    /**
     * Опрашивает querySelector раз в app.devtools.wait-poll-ms, пока узел не найден или deadline не истёк/отменён.
     */
    public boolean waitForSelector(String css, Deadline deadline) {
        Objects.requireNonNull(deadline, "deadline");

        while (!deadline.isDone() && !Thread.currentThread().isInterrupted()) {
            if (querySelector(css).isPresent()) return true;
            sleep(Math.min(properties.getWaitPollMs(), deadline.remainingMillis()));
        }
        return false;
    }

    // =========================
    // 2) CLICK SELECTOR
    // =========================

    /**
     * mousePressed + mouseReleased в центре box model.
     * false если узла нет или у него нет box model (скрыт, нулевой размер). В видимую область не скроллит.
     */
    public boolean click(String css) {
        Optional<NodeRef> node = querySelector(css);
        if (node.isEmpty()) {
            log.debug("click: element not found: {}", css);
            return false;
        }

        Optional<Point> center = getNodeCenter(node.get());
        if (center.isEmpty()) {
            log.debug("click: no box model for {}", css);
            return false;
        }

        clickXY(center.get().x(), center.get().y());
        return true;
    }

    // =========================
    // 3) TYPE / FILL / KEY
    // =========================

    /** по одному char-событию на символ, только печатные символы */
    public void typeText(String text) {
        if (text == null || text.isEmpty()) return;
        text.codePoints().forEach(cp -> page.send("Input.dispatchKeyEvent", Map.of(
                "type", "char",
                "text", new String(Character.toChars(cp))
        )));
    }

    /**
     * Клик в поле, Ctrl+A, ввод текста. Если клик не удался, ничего не делает.
     * Модификатор всегда Ctrl: клавиши обрабатывает удалённый Chrome, ОС этой JVM не важна.
     */
    public boolean fill(String css, String text) {
        if (!click(css)) return false;

        page.send("Input.dispatchKeyEvent", Map.of(
                "type", "keyDown",
                "key", "a",
                "code", "KeyA",
                "modifiers", Mod.CTRL
        ));
        typeText(text);
        return true;
    }

    /**
     * Только keyDown, без keyUp.
     */
    public void keyPress(String keyName) {
        // TODO: решить, нужен ли парный keyUp; часть страниц реагирует только на keyup
        page.send("Input.dispatchKeyEvent", Map.of(
                "type", "keyDown",
                "key", keyName
        ));
    }

    // =========================
    // INTERNAL
    // =========================

    private Optional<Point> getNodeCenter(NodeRef node) {
        CdpResponse bm = page.send("DOM.getBoxModel", Map.of("nodeId", node.nodeId()));
        if (bm.isError()) return Optional.empty();

        JsonNode quad = bm.result().path("model").path("content");
        if (!quad.isArray() || quad.size() < 8) {
            quad = bm.result().path("model").path("border");
        }
        if (!quad.isArray() || quad.size() < 8) {
            return Optional.empty();
        }

        double cx = (quad.get(0).asDouble() + quad.get(2).asDouble() + quad.get(4).asDouble() + quad.get(6).asDouble()) / 4.0;
        double cy = (quad.get(1).asDouble() + quad.get(3).asDouble() + quad.get(5).asDouble() + quad.get(7).asDouble()) / 4.0;
        return Optional.of(new Point(cx, cy));
    }

    private void clickXY(double x, double y) {
        page.send("Input.dispatchMouseEvent", Map.of(
                "type", "mousePressed",
                "x", x,
                "y", y,
                "button", "left",
                "clickCount", 1
        ));

        page.send("Input.dispatchMouseEvent", Map.of(
                "type", "mouseReleased",
                "x", x,
                "y", y,
                "button", "left",
                "clickCount", 1
        ));
    }

    private void sleep(long ms) {
        if (ms <= 0) return;
        try { Thread.sleep(ms); } catch (InterruptedException ie) { Thread.currentThread().interrupt(); }
    }

    private record Point(double x, double y) {}

    public static final class Mod {
        public static final int ALT   = 1;
        public static final int CTRL  = 2;
        public static final int META  = 4;
        public static final int SHIFT = 8;
        private Mod() {}
    }
}
