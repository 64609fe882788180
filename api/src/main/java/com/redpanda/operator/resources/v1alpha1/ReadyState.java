package com.redpanda.operator.resources.v1alpha1;

/**
 * Readiness of a dependent resource as last recorded on the Redpanda status
 */
@SuppressWarnings({ "java:S115" }) // Ignore Sonar rule considering camel-case enums to be non-compliant
public enum ReadyState {
    Unknown,
    Ready,
    NotReady;

    /**
     * A missing value has never been observed
     */
    public static ReadyState orUnknown(ReadyState state) {
        return state == null ? Unknown : state;
    }
}
