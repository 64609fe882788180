package com.redpanda.operator.migration;

import com.redpanda.operator.RedpandaKeys;
import io.fabric8.kubernetes.api.model.Pod;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Labels the broker Pods with the component the chart selects them by and releases the
 * operator finalizer the vectorized controller placed on them
 */
public class PodLabelStep implements MigrationStep {

    static final String STATEFULSET_COMPONENT = "redpanda-statefulset";

    @Override
    public String getName() {
        return "pods";
    }

    @Override
    public int migrate(MigrationContext context) {
        Map<String, String> selector = Map.of(
                RedpandaKeys.Labels.INSTANCE, context.getRedpanda().getMetadata().getName(),
                RedpandaKeys.Labels.NAME, ServiceStep.REDPANDA_NAME);
        List<Pod> pods = context.getKubernetesClient()
                .pods()
                .inNamespace(context.getNamespace())
                .withLabels(selector)
                .list()
                .getItems();

        int mutations = 0;
        List<MigrationException.StepFailure> failures = new ArrayList<>();
        for (Pod pod : pods) {
            Map<String, String> labels = pod.getMetadata().getLabels() == null
                    ? new HashMap<>() : new HashMap<>(pod.getMetadata().getLabels());
            if (STATEFULSET_COMPONENT.equals(labels.get(RedpandaKeys.Labels.COMPONENT))
                    && !pod.hasFinalizer(RedpandaKeys.FINALIZER)) {
                continue;
            }
            labels.put(RedpandaKeys.Labels.COMPONENT, STATEFULSET_COMPONENT);
            pod.getMetadata().setLabels(labels);
            pod.removeFinalizer(RedpandaKeys.FINALIZER);
            try {
                Pod updated = context.getKubernetesClient().pods().inNamespace(context.getNamespace()).resource(pod).update();
                context.mutated(updated, "update Redpanda Pod");
                mutations++;
            } catch (RuntimeException e) {
                failures.add(new MigrationException.StepFailure(getName() + "/" + pod.getMetadata().getName(), e));
            }
        }
        if (!failures.isEmpty()) {
            throw new MigrationException(getName(), failures);
        }
        return mutations;
    }
}
