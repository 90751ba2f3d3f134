package com.hunt.scout.browser.config;

/**
 * Ошибка транспорта: не смогли открыть WS, записать, прочитать или соединение закрылось.
 * Диспетчер на неё отвечает одним переподключением.
 */
public class CdpConnectionException extends RuntimeException {

    public CdpConnectionException(String message) {
        super(message);
    }

    public CdpConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
