package com.redpanda.operator.migration;

import com.redpanda.operator.RedpandaKeys;
import io.fabric8.kubernetes.api.model.Service;
import io.fabric8.kubernetes.api.model.ServiceSpec;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Adopts a Service. When a selector is expected it must match the chart pods exactly, a
 * legacy selector would leave the Service without endpoints after the hand over.
 */
public class ServiceStep extends AdoptStep<Service> {

    static final String REDPANDA_NAME = "redpanda";
    static final String CONSOLE_NAME = "console";

    private final String selectedName;

    /**
     * @param selectedName value of the name label the selector must match, null to leave the selector alone
     */
    public ServiceStep(String name, Function<MigrationContext, String> resourceName, boolean console, String selectedName, String message) {
        super(name, Service.class, resourceName, console, message);
        this.selectedName = selectedName;
    }

    Map<String, String> selector(MigrationContext context) {
        Map<String, String> selector = new HashMap<>();
        selector.put(RedpandaKeys.Labels.INSTANCE, context.getRedpanda().getMetadata().getName());
        selector.put(RedpandaKeys.Labels.NAME, selectedName);
        return selector;
    }

    @Override
    protected boolean requiresMigration(MigrationContext context, Service service) {
        if (super.requiresMigration(context, service)) {
            return true;
        }
        return selectedName != null
                && (service.getSpec() == null || !Objects.equals(service.getSpec().getSelector(), selector(context)));
    }

    @Override
    protected void adapt(MigrationContext context, Service service) {
        if (selectedName == null) {
            return;
        }
        if (service.getSpec() == null) {
            service.setSpec(new ServiceSpec());
        }
        service.getSpec().setSelector(selector(context));
    }
}
