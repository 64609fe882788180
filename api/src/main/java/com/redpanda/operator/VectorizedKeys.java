package com.redpanda.operator;

/**
 * Coordinates of the resources written by the vectorized Cluster and Console controllers
 */
public final class VectorizedKeys {

    public static final String GROUP = "redpanda.vectorized.io";
    public static final String VERSION = "v1alpha1";

    public static final String CLUSTER_KIND = "Cluster";
    public static final String CLUSTER_PLURAL = "clusters";
    public static final String CONSOLE_KIND = "Console";
    public static final String CONSOLE_PLURAL = "consoles";

    /**
     * Setting this annotation to {@code false} stops the vectorized controllers from reconciling.
     */
    public static final String MANAGED = GROUP + "/managed";

    public static final String CONSOLE_SA_FINALIZER = "consoles.redpanda.vectorized.io/service-account";
    public static final String CONSOLE_ACL_FINALIZER = "consoles.redpanda.vectorized.io/acl";

    private VectorizedKeys() {
    }
}
