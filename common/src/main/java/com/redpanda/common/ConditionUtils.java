package com.redpanda.common;

import com.redpanda.operator.resources.flux.FluxKeys;
import com.redpanda.operator.resources.flux.FluxStatus;
import com.redpanda.operator.resources.v1alpha1.RedpandaCondition;
import com.redpanda.operator.resources.v1alpha1.RedpandaConditionBuilder;
import com.redpanda.operator.resources.v1alpha1.RedpandaStatus;
import io.fabric8.kubernetes.api.model.Condition;
import io.fabric8.kubernetes.api.model.HasMetadata;

import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public class ConditionUtils {

    /**
     * Search for a specific condition type in the provided conditions list
     *
     * @param conditions conditions list in which to search for the provided condition type
     * @param type condition type to search for in the list
     * @return condition found if any
     */
    public static Optional<RedpandaCondition> findRedpandaCondition(List<RedpandaCondition> conditions,
                                                                    RedpandaCondition.Type type) {
        return conditions == null ? Optional.empty()
                : conditions.stream().filter(c -> type.name().equals(c.getType())).findFirst();
    }

    /**
     * Build and return a RedpandaCondition with provided type and status
     *
     * @param type condition type
     * @param status condition status
     * @return created RedpandaCondition
     */
    public static RedpandaCondition buildCondition(RedpandaCondition.Type type, RedpandaCondition.Status status) {
        return new RedpandaConditionBuilder()
                .withType(type.name())
                .withStatus(status.name())
                .withLastTransitionTime(ConditionUtils.iso8601Now())
                .build();
    }

    /**
     * Update a condition to the provided status, reason and message only if any of them changed.
     * The last transition time moves only when the status changes.
     */
    public static void updateConditionStatus(RedpandaCondition condition, RedpandaCondition.Status newStatus,
            RedpandaCondition.Reason newReason, String newMessage) {
        if (!Objects.equals(condition.getStatus(), newStatus.name())) {
            condition.setStatus(newStatus);
            condition.setLastTransitionTime(ConditionUtils.iso8601Now());
        }
        if (!Objects.equals(condition.getReason(), newReason.name())) {
            condition.reason(newReason);
        }
        condition.setMessage(newMessage);
    }

    /**
     * Set the Ready condition on the status, adding it when missing
     */
    public static RedpandaCondition setReadyCondition(RedpandaStatus status, RedpandaCondition.Status newStatus,
            RedpandaCondition.Reason newReason, String newMessage) {
        List<RedpandaCondition> conditions = status.getConditions();
        if (conditions == null) {
            conditions = new ArrayList<>();
            status.setConditions(conditions);
        }
        Optional<RedpandaCondition> existing = findRedpandaCondition(conditions, RedpandaCondition.Type.Ready);
        RedpandaCondition ready;
        if (existing.isPresent()) {
            ready = existing.get();
        } else {
            ready = buildCondition(RedpandaCondition.Type.Ready, newStatus);
            conditions.add(ready);
        }
        updateConditionStatus(ready, newStatus, newReason, newMessage);
        ready.setObservedGeneration(status.getObservedGeneration());
        return ready;
    }

    /**
     * @return true when the Flux controller has already observed the latest generation of the resource
     */
    public static boolean isGenerationObserved(HasMetadata resource, FluxStatus status) {
        return status != null
                && resource.getMetadata().getGeneration() != null
                && resource.getMetadata().getGeneration().equals(status.getObservedGeneration());
    }

    /**
     * @return true when the Flux Ready condition is present with status True
     */
    public static boolean isFluxReady(FluxStatus status) {
        if (status == null || status.getConditions() == null) {
            return false;
        }
        return status.getConditions()
                .stream()
                .filter(c -> FluxKeys.READY_CONDITION.equals(c.getType()))
                .map(Condition::getStatus)
                .anyMatch("True"::equals);
    }

    /**
     * Returns the current timestamp in ISO 8601 format, for example "2019-07-23T09:08:12.356Z".
     * @return the current timestamp in ISO 8601 format, for example "2019-07-23T09:08:12.356Z".
     */
    public static String iso8601Now() {
        return ZonedDateTime.now(ZoneOffset.UTC).format(DateTimeFormatter.ISO_INSTANT);
    }
}
