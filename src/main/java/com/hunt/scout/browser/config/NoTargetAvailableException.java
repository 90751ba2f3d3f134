package com.hunt.scout.browser.config;

/**
 * /json не отдал ни одного target с webSocketDebuggerUrl, даже после /json/new.
 */
public class NoTargetAvailableException extends RuntimeException {

    public NoTargetAvailableException(String message) {
        super(message);
    }
}
