package com.auditeng.backend.service;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag shared between a running pipeline and whoever cancels it.
 */
public final class CancellationToken {

    private final int attempt;
    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public CancellationToken(int attempt) {
        this.attempt = attempt;
    }

    public int attempt() {
        return attempt;
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
