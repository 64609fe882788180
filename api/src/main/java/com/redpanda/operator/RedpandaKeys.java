package com.redpanda.operator;

public final class RedpandaKeys {

    public static final String GROUP = "cluster.redpanda.com";
    static final String RP_PREFIX = GROUP + "/";

    /**
     * Finalizer placed on every managed Redpanda, released once the HelmRelease is gone.
     */
    public static final String FINALIZER = "operator.redpanda.com/finalizer";

    /**
     * Value of a managed annotation that disables reconciliation.
     */
    public static final String NOT_MANAGED = "false";

    public static final class Annotations {
        /**
         * Setting this annotation to {@code false} on a Redpanda resource takes it out of management.
         */
        public static final String MANAGED = RP_PREFIX + "managed";

        /**
         * Attached to emitted events with the last attempted revision of the HelmRelease.
         */
        public static final String REVISION = RP_PREFIX + "revision";

        /**
         * Helm release ownership annotations, checked and stamped during migration.
         */
        public static final String HELM_RELEASE_NAME = "meta.helm.sh/release-name";
        public static final String HELM_RELEASE_NAMESPACE = "meta.helm.sh/release-namespace";

        private Annotations() {
        }
    }

    public static final class Labels {

        public static final String INSTANCE = "app.kubernetes.io/instance";
        public static final String NAME = "app.kubernetes.io/name";
        public static final String COMPONENT = "app.kubernetes.io/component";
        public static final String MANAGED_BY = "app.kubernetes.io/managed-by";

        public static final String MANAGED_BY_HELM = "Helm";

        private Labels() {
        }
    }

    private RedpandaKeys() {
    }
}
