package com.dredd.core;

import java.util.concurrent.atomic.AtomicReference;

/**
 * One-shot cooperative cancellation signal.
 * <p>
 * The runner checks the token each time a rule is about to fire; a hook that is already
 * running is not interrupted. Once cancelled a token stays cancelled.
 */
public final class CancellationToken {

    private static final String DEFAULT_REASON = "cancelled";

    private static final CancellationToken NONE = new CancellationToken(false);

    private final boolean cancellable;
    private final AtomicReference<String> reason = new AtomicReference<>();

    private CancellationToken(boolean cancellable) {
        this.cancellable = cancellable;
    }

    public static CancellationToken create() {
        return new CancellationToken(true);
    }

    /**
     * Shared token that is never signalled. Calling {@code cancel} on it does nothing and returns false.
     */
    public static CancellationToken none() {
        return NONE;
    }

    /**
     * Signal cancellation.
     *
     * @return true if this call cancelled the token, false if it was already cancelled
     *         or is the {@link #none()} token
     */
    public boolean cancel() {
        return cancel(DEFAULT_REASON);
    }

    /**
     * Signal cancellation with a reason. Only the first reason is kept.
     *
     * @return true if this call cancelled the token, false if it was already cancelled
     *         or is the {@link #none()} token
     */
    public boolean cancel(String reason) {
        if (!cancellable) {
            return false;
        }
        return this.reason.compareAndSet(null, reason != null ? reason : DEFAULT_REASON);
    }

    public boolean isCancelled() {
        return reason.get() != null;
    }

    /**
     * Reason given on cancellation, or null while not cancelled.
     */
    public String getReason() {
        return reason.get();
    }

    @Override
    public String toString() {
        if (!cancellable) {
            return "CancellationToken{none}";
        }
        return "CancellationToken{cancelled=" + isCancelled() + '}';
    }
}
