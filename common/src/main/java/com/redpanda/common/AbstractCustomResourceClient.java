package com.redpanda.common;

import io.fabric8.kubernetes.api.model.DeletionPropagation;
import io.fabric8.kubernetes.api.model.KubernetesResourceList;
import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.MixedOperation;
import io.fabric8.kubernetes.client.dsl.Resource;
import org.jboss.logging.Logger;

import jakarta.annotation.PostConstruct;
import jakarta.inject.Inject;

/**
 * Thin wrapper around the fabric8 client for one custom resource kind. A missing resource is
 * returned as null, every other failure surfaces as a {@link io.fabric8.kubernetes.client.KubernetesClientException}.
 */
public abstract class AbstractCustomResourceClient<T extends CustomResource<?, ?>, L extends KubernetesResourceList<T>> {

    @Inject
    Logger log;

    @Inject
    protected KubernetesClient kubernetesClient;

    protected MixedOperation<T, L, Resource<T>> resourceClient;

    protected abstract Class<T> getCustomResourceClass();

    protected abstract Class<L> getCustomResourceListClass();

    protected MixedOperation<T, L, Resource<T>> getResourceClient() {
        return kubernetesClient.resources(getCustomResourceClass(), getCustomResourceListClass());
    }

    @PostConstruct
    void onStart() {
        resourceClient = getResourceClient();
    }

    public void delete(String namespace, String name, DeletionPropagation propagation) {
        log.debugf("Deleting %s %s/%s with %s propagation", getCustomResourceClass().getSimpleName(), namespace, name, propagation);
        resourceClient
                .inNamespace(namespace)
                .withName(name)
                .withPropagationPolicy(propagation)
                .delete();
    }

    public T getByName(String namespace, String name) {
        return resourceClient
                .inNamespace(namespace)
                .withName(name).get();
    }

    public T create(T resource) {
        return resourceClient.inNamespace(resource.getMetadata().getNamespace()).resource(resource).create();
    }

    /**
     * Replace the resource, failing with a conflict when its resourceVersion is stale
     */
    public T update(T resource) {
        return resourceClient.inNamespace(resource.getMetadata().getNamespace()).resource(resource).update();
    }

    /**
     * Merge patch the status subresource with the status carried by the resource
     */
    public T patchStatus(T resource) {
        return resourceClient.inNamespace(resource.getMetadata().getNamespace()).resource(resource).patchStatus();
    }

}
