package com.redpanda.operator.operands;

import com.redpanda.operator.resources.v1alpha1.ReadyState;

/**
 * Hysteresis over the readiness of a dependent. Only a change of state is worth an event, and the
 * first observation counts as ready so that a dependent found ready right away stays silent.
 */
public final class ReadinessLatch {

    private ReadinessLatch() {
    }

    /**
     * @param previous state recorded by the last reconciliation, null when never observed
     * @param generationFresh the dependent controller has observed the latest generation
     * @param conditionReady the dependent reports a Ready condition with status True
     */
    public static ReadinessTransition latch(ReadyState previous, boolean generationFresh, boolean conditionReady) {
        ReadyState prev = ReadyState.orUnknown(previous);
        if (!generationFresh || !conditionReady) {
            return new ReadinessTransition(ReadyState.NotReady, prev != ReadyState.NotReady);
        }
        return new ReadinessTransition(ReadyState.Ready, prev == ReadyState.NotReady);
    }
}
