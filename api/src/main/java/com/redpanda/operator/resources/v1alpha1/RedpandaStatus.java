package com.redpanda.operator.resources.v1alpha1;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.sundr.builder.annotations.Buildable;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

import java.util.List;

/**
 * Defines the current status with related conditions of a Redpanda instance
 */
@Buildable(
        builderPackage = "io.fabric8.kubernetes.api.builder",
        editableEnabled = false
)
@EqualsAndHashCode
@ToString
@JsonInclude(JsonInclude.Include.NON_NULL)
@Getter
@Setter
public class RedpandaStatus {

    private List<RedpandaCondition> conditions;
    private Long observedGeneration;
    private String helmRepository;
    private ReadyState helmRepositoryReady;
    private String helmRelease;
    private ReadyState helmReleaseReady;
    private String lastAttemptedRevision;
    private String lastAppliedRevision;

}
