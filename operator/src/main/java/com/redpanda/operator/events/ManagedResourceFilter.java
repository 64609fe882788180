package com.redpanda.operator.events;

import com.redpanda.operator.RedpandaKeys;
import com.redpanda.operator.resources.v1alpha1.Redpanda;
import io.javaoperatorsdk.operator.processing.event.source.filter.GenericFilter;

/**
 * Drops events of a Redpanda taken out of management once its finalizer has been released,
 * otherwise the finalizer would be added back before every reconciliation.
 */
public class ManagedResourceFilter implements GenericFilter<Redpanda> {

    @Override
    public boolean accept(Redpanda redpanda) {
        return redpanda.isManaged() || redpanda.hasFinalizer(RedpandaKeys.FINALIZER);
    }
}
