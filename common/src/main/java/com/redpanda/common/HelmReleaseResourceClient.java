package com.redpanda.common;

import com.redpanda.operator.resources.flux.HelmRelease;
import com.redpanda.operator.resources.flux.HelmReleaseList;

import jakarta.enterprise.context.ApplicationScoped;

/**
 * Represents a wrapper around a Kubernetes client for handling operations on a Flux HelmRelease
 */
@ApplicationScoped
public class HelmReleaseResourceClient extends AbstractCustomResourceClient<HelmRelease, HelmReleaseList> {

    @Override
    protected Class<HelmRelease> getCustomResourceClass() {
        return HelmRelease.class;
    }

    @Override
    protected Class<HelmReleaseList> getCustomResourceListClass() {
        return HelmReleaseList.class;
    }

}
