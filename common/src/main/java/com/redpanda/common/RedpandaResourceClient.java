package com.redpanda.common;

import com.redpanda.operator.resources.v1alpha1.Redpanda;
import com.redpanda.operator.resources.v1alpha1.RedpandaList;

import jakarta.enterprise.context.ApplicationScoped;

/**
 * Represents a wrapper around a Kubernetes client for handling operations on a Redpanda custom resource
 */
@ApplicationScoped
public class RedpandaResourceClient extends AbstractCustomResourceClient<Redpanda, RedpandaList> {

    @Override
    protected Class<Redpanda> getCustomResourceClass() {
        return Redpanda.class;
    }

    @Override
    protected Class<RedpandaList> getCustomResourceListClass() {
        return RedpandaList.class;
    }

}
