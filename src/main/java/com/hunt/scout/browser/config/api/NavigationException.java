package com.hunt.scout.browser.config.api;

/**
 * Браузер отклонил Page.navigate (ошибка протокола или errorText в ответе).
 */
public class NavigationException extends RuntimeException {

    public NavigationException(String message) {
        super(message);
    }
}
