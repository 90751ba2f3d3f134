package com.hunt.scout.browser.config.api;

import java.time.Duration;

/**
 * Срок ожидания с возможностью отмены извне. Ожидания в {@link CdpDomActions} крутятся, пока он не истёк.
 */
public final class Deadline {

    private final long deadlineNanos;
    private volatile boolean cancelled;

    private Deadline(long deadlineNanos) {
        this.deadlineNanos = deadlineNanos;
    }

    public static Deadline after(Duration timeout) {
        long nanos = timeout == null || timeout.isNegative() ? 0 : timeout.toNanos();
        return new Deadline(System.nanoTime() + nanos);
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled;
    }

    public boolean isExpired() {
        return System.nanoTime() - deadlineNanos >= 0;
    }

    public boolean isDone() {
        return cancelled || isExpired();
    }

    public long remainingMillis() {
        long left = deadlineNanos - System.nanoTime();
        return left <= 0 ? 0 : Duration.ofNanos(left).toMillis();
    }
}
