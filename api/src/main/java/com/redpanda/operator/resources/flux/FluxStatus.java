package com.redpanda.operator.resources.flux;

import io.fabric8.kubernetes.api.model.Condition;

import java.util.List;

/**
 * Status fields shared by every Flux object, enough to decide readiness
 */
public interface FluxStatus {

    List<Condition> getConditions();

    Long getObservedGeneration();

}
