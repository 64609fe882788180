package com.redpanda.operator.migration;

import com.redpanda.operator.RedpandaKeys;
import com.redpanda.operator.VectorizedKeys;
import com.redpanda.operator.resources.v1alpha1.ObjectReference;
import io.fabric8.kubernetes.api.model.HasMetadata;

import java.util.HashMap;
import java.util.Map;

final class LegacyRefs {

    private LegacyRefs() {
    }

    static String namespace(ObjectReference ref, MigrationContext context) {
        return ref == null || ref.getNamespace() == null || ref.getNamespace().isEmpty()
                ? context.getNamespace() : ref.getNamespace();
    }

    static String name(ObjectReference ref, MigrationContext context) {
        return ref == null || ref.getName() == null || ref.getName().isEmpty()
                ? context.getRedpanda().getMetadata().getName() : ref.getName();
    }

    static boolean isManaged(HasMetadata resource) {
        Map<String, String> annotations = resource.getMetadata().getAnnotations();
        return annotations == null || !RedpandaKeys.NOT_MANAGED.equals(annotations.get(VectorizedKeys.MANAGED));
    }

    static void disableReconciliation(HasMetadata resource) {
        Map<String, String> annotations = resource.getMetadata().getAnnotations() == null
                ? new HashMap<>() : new HashMap<>(resource.getMetadata().getAnnotations());
        annotations.put(VectorizedKeys.MANAGED, RedpandaKeys.NOT_MANAGED);
        resource.getMetadata().setAnnotations(annotations);
    }
}
