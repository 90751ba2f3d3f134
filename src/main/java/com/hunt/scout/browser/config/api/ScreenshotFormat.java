package com.hunt.scout.browser.config.api;

public enum ScreenshotFormat {
    JPEG("jpeg"),
    PNG("png"),
    WEBP("webp");

    public final String cdpName;

    ScreenshotFormat(String cdpName) {
        this.cdpName = cdpName;
    }
}
