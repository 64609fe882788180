package com.redpanda.operator.resources.flux;

/**
 * API coordinates of the Flux kinds the operator writes to
 */
public final class FluxKeys {

    public static final String SOURCE_GROUP = "source.toolkit.fluxcd.io";
    public static final String SOURCE_VERSION = "v1beta2";
    public static final String HELM_GROUP = "helm.toolkit.fluxcd.io";
    public static final String HELM_VERSION = "v2beta1";

    public static final String HELM_REPOSITORY_KIND = "HelmRepository";
    public static final String HELM_RELEASE_KIND = "HelmRelease";

    public static final String READY_CONDITION = "Ready";

    private FluxKeys() {
    }
}
