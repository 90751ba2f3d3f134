package com.hunt.scout.browser.config;

public enum ConnectionState {
    DISCONNECTED,
    CONNECTED,
    RECONNECTING
}
