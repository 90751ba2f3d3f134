package com.hunt.scout.browser.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Настройки подключения к Chrome DevTools (app.devtools.*).
 */
@Component
@ConfigurationProperties(prefix = "app.devtools")
@Validated
@Getter
@Setter
public class DevToolsProperties {

    @NotBlank
    private String host = "localhost";

    @Min(1)
    private int port = 9222;

    /** таймауты HTTP /json */
    private long discoveryTimeoutMs = 1000;

    /** пауза после /json/new перед повторным /json */
    private long newTargetSettleMs = 200;

    private long connectTimeoutMs = 3000;

    /** сколько ждём ответ с нашим id */
    private long commandTimeoutMs = 30000;

    @Min(0)
    private int maxReconnectAttempts = 1;

    /** фиксированная пауза после Page.navigate */
    private long navigationSettleMs = 2000;

    private long waitPollMs = 500;

    private long minDelayMs = 1000;
    private long maxDelayMs = 3000;

    public String getDiscoveryBaseUrl() {
        return "http://" + host + ":" + port;
    }
}
