package com.redpanda.operator.migration;

import io.fabric8.kubernetes.api.model.DeletionPropagation;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.client.dsl.Resource;

import java.util.function.Function;

/**
 * Deletes an object that cannot be adopted in place because of immutable fields, the release
 * then recreates it
 */
public class DeleteStep<T extends HasMetadata> extends NamedResourceStep<T> {

    private final DeletionPropagation propagation;
    private final String message;

    public DeleteStep(String name, Class<T> type, Function<MigrationContext, String> resourceName, boolean console,
            DeletionPropagation propagation, String message) {
        super(name, type, resourceName, console);
        this.propagation = propagation;
        this.message = message;
    }

    /**
     * An object already terminating is left to the garbage collector
     */
    @Override
    protected boolean requiresMigration(MigrationContext context, T object) {
        if (object.isMarkedForDeletion()) {
            context.getLog().debugf("%s %s/%s is already being deleted", object.getKind(), context.getNamespace(),
                    object.getMetadata().getName());
            return false;
        }
        return super.requiresMigration(context, object);
    }

    @Override
    protected void migrate(MigrationContext context, Resource<T> resource, T object) {
        context.getLog().infof("Deleting %s %s/%s with %s propagation", object.getKind(), context.getNamespace(),
                object.getMetadata().getName(), propagation);
        resource.withPropagationPolicy(propagation).delete();
        context.mutated(object, message);
    }
}
