package com.redpanda.operator.migration;

import com.redpanda.operator.resources.v1alpha1.ObjectReference;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;

/**
 * Disables reconciliation of the vectorized Cluster
 */
public class LegacyClusterStep implements MigrationStep {

    @Override
    public String getName() {
        return "legacy-cluster";
    }

    @Override
    public int migrate(MigrationContext context) {
        ObjectReference ref = context.getRedpanda().getSpec().getMigration().getClusterRef();
        String namespace = LegacyRefs.namespace(ref, context);
        String name = LegacyRefs.name(ref, context);

        GenericKubernetesResource cluster = context.getVectorizedClient().getCluster(namespace, name);
        if (cluster == null) {
            context.getLog().debugf("Cluster %s/%s not found", namespace, name);
            return 0;
        }
        if (!LegacyRefs.isManaged(cluster)) {
            return 0;
        }
        LegacyRefs.disableReconciliation(cluster);
        cluster = context.getVectorizedClient().updateCluster(cluster);
        context.mutated(cluster, "update Cluster custom resource");
        return 1;
    }
}
