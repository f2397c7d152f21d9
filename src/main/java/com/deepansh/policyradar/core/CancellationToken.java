package com.deepansh.policyradar.core;

import com.deepansh.policyradar.exception.ChatCancelledException;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation signal for one chat turn. Checked at every suspension point
 * of the orchestrator; never interrupts a call already in flight.
 */
public class CancellationToken {

    private final String requestId;
    private final AtomicBoolean cancelled = new AtomicBoolean();

    public CancellationToken(String requestId) {
        this.requestId = requestId;
    }

    /** Token for requests without an id; nothing can cancel it. */
    public static CancellationToken untracked() {
        return new CancellationToken(null);
    }

    public String requestId() {
        return requestId;
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    public void throwIfCancelled() {
        if (cancelled.get()) throw new ChatCancelledException(requestId);
    }
}
