package com.redpanda.operator.controllers;

import java.time.Duration;
import java.util.Optional;

/**
 * Successful outcome of a reconciliation, optionally asking to be called again after a delay
 */
public final class ReconcileResult {

    private static final ReconcileResult DONE = new ReconcileResult(null);

    private final Duration requeueAfter;

    private ReconcileResult(Duration requeueAfter) {
        this.requeueAfter = requeueAfter;
    }

    public static ReconcileResult done() {
        return DONE;
    }

    public static ReconcileResult requeueAfter(Duration delay) {
        return new ReconcileResult(delay);
    }

    public Optional<Duration> getRequeueAfter() {
        return Optional.ofNullable(requeueAfter);
    }

    @Override
    public String toString() {
        return requeueAfter == null ? "ReconcileResult [done]" : "ReconcileResult [requeueAfter=" + requeueAfter + "]";
    }
}
