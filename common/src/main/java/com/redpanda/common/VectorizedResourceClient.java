package com.redpanda.common;

import com.redpanda.operator.VectorizedKeys;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.dsl.base.ResourceDefinitionContext;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Access to the Cluster and Console resources of the vectorized operator. They are handled as generic
 * resources so that fields unknown to this operator survive an update.
 */
@ApplicationScoped
public class VectorizedResourceClient {

    static final ResourceDefinitionContext CLUSTER = context(VectorizedKeys.CLUSTER_KIND, VectorizedKeys.CLUSTER_PLURAL);
    static final ResourceDefinitionContext CONSOLE = context(VectorizedKeys.CONSOLE_KIND, VectorizedKeys.CONSOLE_PLURAL);

    @Inject
    protected KubernetesClient kubernetesClient;

    private static ResourceDefinitionContext context(String kind, String plural) {
        return new ResourceDefinitionContext.Builder()
                .withGroup(VectorizedKeys.GROUP)
                .withVersion(VectorizedKeys.VERSION)
                .withKind(kind)
                .withPlural(plural)
                .withNamespaced(true)
                .build();
    }

    public GenericKubernetesResource getCluster(String namespace, String name) {
        return kubernetesClient.genericKubernetesResources(CLUSTER).inNamespace(namespace).withName(name).get();
    }

    public GenericKubernetesResource getConsole(String namespace, String name) {
        return kubernetesClient.genericKubernetesResources(CONSOLE).inNamespace(namespace).withName(name).get();
    }

    public GenericKubernetesResource updateCluster(GenericKubernetesResource cluster) {
        return kubernetesClient.genericKubernetesResources(CLUSTER)
                .inNamespace(cluster.getMetadata().getNamespace())
                .resource(cluster)
                .update();
    }

    public GenericKubernetesResource updateConsole(GenericKubernetesResource console) {
        return kubernetesClient.genericKubernetesResources(CONSOLE)
                .inNamespace(console.getMetadata().getNamespace())
                .resource(console)
                .update();
    }
}
