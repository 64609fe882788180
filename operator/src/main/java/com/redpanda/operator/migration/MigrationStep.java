package com.redpanda.operator.migration;

import com.redpanda.operator.resources.v1alpha1.Redpanda;

/**
 * One independent unit of the hand over of legacy resources to the HelmRelease. A step re-checks
 * the state of its resources every time, so a resource already migrated is left untouched.
 */
public interface MigrationStep {

    String getName();

    default boolean isApplicable(Redpanda redpanda) {
        return true;
    }

    /**
     * @return the number of mutations issued
     */
    int migrate(MigrationContext context);

}
