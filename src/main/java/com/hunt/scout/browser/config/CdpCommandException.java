package com.hunt.scout.browser.config;

import lombok.Getter;

/**
 * Терминальная ошибка команды: и исходная попытка, и попытка после переподключения упали.
 */
@Getter
public class CdpCommandException extends RuntimeException {

    private final String method;

    public CdpCommandException(String method, Throwable cause) {
        super("CDP command failed for " + method + ": " + (cause == null ? "unknown" : cause.getMessage()), cause);
        this.method = method;
    }
}
