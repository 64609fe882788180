package com.redpanda.operator.migration;

import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.client.dsl.Resource;

import java.util.function.Function;

/**
 * Stamps the Helm ownership on an object so the release adopts it in place
 */
public class AdoptStep<T extends HasMetadata> extends NamedResourceStep<T> {

    private final String message;

    public AdoptStep(String name, Class<T> type, Function<MigrationContext, String> resourceName, boolean console, String message) {
        super(name, type, resourceName, console);
        this.message = message;
    }

    @Override
    protected void migrate(MigrationContext context, Resource<T> resource, T object) {
        HelmOwnership.setLabelsAndAnnotations(object, context.getRedpanda());
        adapt(context, object);
        T updated = context.getKubernetesClient()
                .resource(object)
                .inNamespace(context.getNamespace())
                .update();
        context.mutated(updated, message);
    }

    /**
     * Hook for kind specific changes applied before the update
     */
    protected void adapt(MigrationContext context, T object) {
    }
}
