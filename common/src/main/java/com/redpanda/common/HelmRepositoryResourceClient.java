package com.redpanda.common;

import com.redpanda.operator.resources.flux.HelmRepository;
import com.redpanda.operator.resources.flux.HelmRepositoryList;

import jakarta.enterprise.context.ApplicationScoped;

/**
 * Represents a wrapper around a Kubernetes client for handling operations on a Flux HelmRepository
 */
@ApplicationScoped
public class HelmRepositoryResourceClient extends AbstractCustomResourceClient<HelmRepository, HelmRepositoryList> {

    @Override
    protected Class<HelmRepository> getCustomResourceClass() {
        return HelmRepository.class;
    }

    @Override
    protected Class<HelmRepositoryList> getCustomResourceListClass() {
        return HelmRepositoryList.class;
    }

}
