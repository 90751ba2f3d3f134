package com.hunt.scout.browser.config.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.hunt.scout.browser.config.CdpResponse;
import com.hunt.scout.browser.config.DevToolsProperties;
import com.hunt.scout.browser.config.DevToolsSession;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Base64;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Навигация, выполнение JS и скриншоты.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CdpPageApi {

    private final DevToolsSession page;
    private final DevToolsProperties properties;

    /**
     * Page.navigate + фиксированная пауза. Событий загрузки не ждём:
     * кому нужна готовность страницы, тот вызывает waitForSelector.
     */
    public void navigate(String url) {
        CdpResponse resp = page.send("Page.navigate", Map.of("url", url));
        if (resp.isError()) {
            throw new NavigationException("Page.navigate failed for " + url + ": " + resp.errorMessage());
        }
        String errorText = resp.result().path("errorText").asText("");
        if (!errorText.isBlank()) {
            throw new NavigationException("Page.navigate failed for " + url + ": " + errorText);
        }
        sleep(properties.getNavigationSettleMs());
    }

    public EvalResult evaluate(String script) {
        CdpResponse resp;
        try {
            resp = page.send("Runtime.evaluate", Map.of(
                    "expression", script,
                    "returnByValue", true
            ));
        } catch (RuntimeException e) {
            log.debug("Runtime.evaluate failed: {}", e.getMessage());
            return EvalResult.none("send failed: " + e.getMessage());
        }

        if (resp.isError()) {
            return EvalResult.none("protocol error: " + resp.errorMessage());
        }

        JsonNode details = resp.result().get("exceptionDetails");
        if (details != null && !details.isNull()) {
            String text = details.path("exception").path("description").asText(details.path("text").asText("exception"));
            return EvalResult.none("script threw: " + text);
        }

        // {result: {result: {type, value?, subtype?, description?}}}
        JsonNode inner = resp.result().path("result");
        if (inner.has("value")) {
            return new EvalResult.Primitive(inner.get("value"));
        }

        String type = inner.path("type").asText("undefined");
        if ("object".equals(type) && "null".equals(inner.path("subtype").asText())) {
            return new EvalResult.Primitive(NullNode.getInstance());
        }
        if ("undefined".equals(type)) {
            return EvalResult.none("undefined");
        }

        String description = inner.path("description").asText(null);
        return description != null ? new EvalResult.Opaque(description) : EvalResult.none("no value for type " + type);
    }

    /** значение или null, для тех, кому тег не нужен */
    public JsonNode evaluateValue(String script) {
        return evaluate(script).valueOrNull();
    }

    public void scrollBy(int deltaY) {
        evaluate("(function(){try{window.scrollBy(0," + deltaY + ");return true}catch(e){return false}})()");
    }

    /** base64 картинки как её вернул Page.captureScreenshot */
    public String screenshot(int quality, ScreenshotFormat format) {
        Map<String, Object> params = new HashMap<>();
        params.put("format", format.cdpName);
        if (format == ScreenshotFormat.JPEG) {
            params.put("quality", quality);
        }

        CdpResponse resp = page.send("Page.captureScreenshot", params);
        String b64 = resp.result().path("data").asText(null);
        if (resp.isError() || b64 == null || b64.isBlank()) {
            throw new IllegalStateException("captureScreenshot returned empty data"
                    + (resp.isError() ? ": " + resp.errorMessage() : ""));
        }
        return b64;
    }

    public Path screenshot(Path path, int quality, ScreenshotFormat format) {
        byte[] bytes = Base64.getDecoder().decode(screenshot(quality, format));
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) Files.createDirectories(parent);
            Files.write(path, bytes);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot write screenshot to " + path, e);
        }
        log.debug("Screenshot saved: {} ({} bytes)", path, bytes.length);
        return path;
    }

    /** случайная пауза между действиями, app.devtools.min/max-delay-ms */
    public void humanPause() {
        long min = Math.max(0, properties.getMinDelayMs());
        long max = Math.max(min, properties.getMaxDelayMs());
        sleep(min == max ? min : ThreadLocalRandom.current().nextLong(min, max + 1));
    }

    private void sleep(long ms) {
        if (ms <= 0) return;
        try { Thread.sleep(ms); } catch (InterruptedException ie) { Thread.currentThread().interrupt(); }
    }
}
