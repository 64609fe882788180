package com.redpanda.operator.migration;

import com.redpanda.operator.RedpandaKeys;
import com.redpanda.operator.resources.v1alpha1.Redpanda;
import io.fabric8.kubernetes.api.model.HasMetadata;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Labels and annotations Helm relies on to consider an existing object part of a release
 */
public final class HelmOwnership {

    private HelmOwnership() {
    }

    public static boolean hasLabelsAndAnnotations(HasMetadata object, Redpanda redpanda) {
        Map<String, String> labels = object.getMetadata().getLabels();
        Map<String, String> annotations = object.getMetadata().getAnnotations();
        return labels != null && annotations != null
                && RedpandaKeys.Labels.MANAGED_BY_HELM.equals(labels.get(RedpandaKeys.Labels.MANAGED_BY))
                && Objects.equals(redpanda.getMetadata().getName(), annotations.get(RedpandaKeys.Annotations.HELM_RELEASE_NAME))
                && Objects.equals(redpanda.getMetadata().getNamespace(), annotations.get(RedpandaKeys.Annotations.HELM_RELEASE_NAMESPACE));
    }

    /**
     * Replaces the labels and annotations of the object with the Helm release ones
     */
    public static void setLabelsAndAnnotations(HasMetadata object, Redpanda redpanda) {
        Map<String, String> labels = new HashMap<>();
        labels.put(RedpandaKeys.Labels.MANAGED_BY, RedpandaKeys.Labels.MANAGED_BY_HELM);
        object.getMetadata().setLabels(labels);

        Map<String, String> annotations = new HashMap<>();
        annotations.put(RedpandaKeys.Annotations.HELM_RELEASE_NAME, redpanda.getMetadata().getName());
        annotations.put(RedpandaKeys.Annotations.HELM_RELEASE_NAMESPACE, redpanda.getMetadata().getNamespace());
        object.getMetadata().setAnnotations(annotations);
    }
}
