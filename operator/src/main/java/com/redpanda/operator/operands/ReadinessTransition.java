package com.redpanda.operator.operands;

import com.redpanda.operator.resources.v1alpha1.ReadyState;
import io.fabric8.kubernetes.api.model.HasMetadata;

import java.util.Objects;

/**
 * Outcome of {@link ReadinessLatch#latch}: the state to record and whether the change deserves an event
 */
public class ReadinessTransition {

    static final String READY_FORMAT = "%s '%s/%s' is ready";
    static final String NOT_READY_FORMAT = "%s '%s/%s' is not ready";

    private final ReadyState next;
    private final boolean eventEmitted;

    public ReadinessTransition(ReadyState next, boolean eventEmitted) {
        Objects.requireNonNull(next);
        this.next = next;
        this.eventEmitted = eventEmitted;
    }

    public ReadyState getNext() {
        return next;
    }

    public boolean isEventEmitted() {
        return eventEmitted;
    }

    public boolean isReady() {
        return next == ReadyState.Ready;
    }

    public String message(String kind, HasMetadata resource) {
        return String.format(isReady() ? READY_FORMAT : NOT_READY_FORMAT, kind,
                resource.getMetadata().getNamespace(), resource.getMetadata().getName());
    }

    @Override
    public String toString() {
        return "ReadinessTransition [next=" + next + ", eventEmitted=" + eventEmitted + "]";
    }
}
