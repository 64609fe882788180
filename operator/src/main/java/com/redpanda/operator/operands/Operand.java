package com.redpanda.operator.operands;

import com.redpanda.common.ConditionUtils;
import com.redpanda.operator.resources.flux.FluxStatus;
import com.redpanda.operator.resources.v1alpha1.ReadyState;
import com.redpanda.operator.resources.v1alpha1.Redpanda;
import com.redpanda.operator.resources.v1alpha1.RedpandaStatus;
import io.fabric8.kubernetes.client.CustomResource;

/**
 * Define common behaviour across the Flux resources a Redpanda depends on
 * @param <D> dependent resource type
 */
public interface Operand<D extends CustomResource<?, ? extends FluxStatus>> {

    /**
     * Kind used in logs and event messages
     */
    String getKind();

    /**
     * Create or update the operand based on the provided Redpanda. The name of the operand
     * is recorded on the Redpanda status, which the caller persists.
     *
     * @param redpanda working copy of the Redpanda, never a cached instance
     * @return the live operand
     */
    D createOrUpdate(Redpanda redpanda);

    ReadyState getReadyState(RedpandaStatus status);

    void setReadyState(RedpandaStatus status, ReadyState state);

    /**
     * Get the readiness transition for this operand, the new state is not recorded yet
     * @return the readiness information, never null
     */
    default ReadinessTransition getReadiness(Redpanda redpanda, D operand) {
        FluxStatus status = operand.getStatus();
        return ReadinessLatch.latch(getReadyState(redpanda.getStatus()),
                ConditionUtils.isGenerationObserved(operand, status),
                ConditionUtils.isFluxReady(status));
    }
}
