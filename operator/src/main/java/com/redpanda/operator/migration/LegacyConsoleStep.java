package com.redpanda.operator.migration;

import com.redpanda.operator.VectorizedKeys;
import com.redpanda.operator.resources.v1alpha1.ObjectReference;
import io.fabric8.kubernetes.api.model.GenericKubernetesResource;

/**
 * Disables reconciliation of the vectorized Console and releases its finalizers, the vectorized
 * controller would otherwise keep it from being deleted
 */
public class LegacyConsoleStep implements MigrationStep {

    @Override
    public String getName() {
        return "legacy-console";
    }

    @Override
    public int migrate(MigrationContext context) {
        ObjectReference ref = context.getRedpanda().getSpec().getMigration().getConsoleRef();
        String namespace = LegacyRefs.namespace(ref, context);
        String name = LegacyRefs.name(ref, context);

        GenericKubernetesResource console = context.getVectorizedClient().getConsole(namespace, name);
        if (console == null) {
            context.getLog().debugf("Console %s/%s not found", namespace, name);
            return 0;
        }
        if (!LegacyRefs.isManaged(console)
                && !console.hasFinalizer(VectorizedKeys.CONSOLE_SA_FINALIZER)
                && !console.hasFinalizer(VectorizedKeys.CONSOLE_ACL_FINALIZER)) {
            return 0;
        }
        LegacyRefs.disableReconciliation(console);
        console.removeFinalizer(VectorizedKeys.CONSOLE_SA_FINALIZER);
        console.removeFinalizer(VectorizedKeys.CONSOLE_ACL_FINALIZER);
        console = context.getVectorizedClient().updateConsole(console);
        context.mutated(console, "update Console custom resource");
        return 1;
    }
}
