package com.redpanda.operator.migration;

import com.redpanda.operator.resources.v1alpha1.Redpanda;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.client.dsl.Resource;

import java.util.function.Function;

/**
 * Step handling a single object looked up by a name derived from the Redpanda
 *
 * @param <T> type of the handled object
 */
public abstract class NamedResourceStep<T extends HasMetadata> implements MigrationStep {

    private final String name;
    private final Class<T> type;
    private final Function<MigrationContext, String> resourceName;
    private final boolean console;

    protected NamedResourceStep(String name, Class<T> type, Function<MigrationContext, String> resourceName, boolean console) {
        this.name = name;
        this.type = type;
        this.resourceName = resourceName;
        this.console = console;
    }

    @Override
    public String getName() {
        return name;
    }

    /**
     * Console resources are only handed over when the console is enabled
     */
    @Override
    public boolean isApplicable(Redpanda redpanda) {
        return !console || redpanda.isConsoleEnabled();
    }

    @Override
    public int migrate(MigrationContext context) {
        String objectName = resourceName.apply(context);
        Resource<T> resource = resource(context, objectName);
        T object = resource.get();
        if (object == null) {
            context.getLog().debugf("%s %s/%s not found", type.getSimpleName(), context.getNamespace(), objectName);
            return 0;
        }
        if (!requiresMigration(context, object)) {
            return 0;
        }
        migrate(context, resource, object);
        return 1;
    }

    protected Resource<T> resource(MigrationContext context, String objectName) {
        return context.getKubernetesClient().resources(type).inNamespace(context.getNamespace()).withName(objectName);
    }

    protected boolean requiresMigration(MigrationContext context, T object) {
        return !HelmOwnership.hasLabelsAndAnnotations(object, context.getRedpanda());
    }

    protected abstract void migrate(MigrationContext context, Resource<T> resource, T object);

}
