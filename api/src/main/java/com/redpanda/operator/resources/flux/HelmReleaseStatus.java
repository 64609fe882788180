package com.redpanda.operator.resources.flux;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import io.sundr.builder.annotations.Buildable;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;
import io.fabric8.kubernetes.api.model.Condition;

import java.util.List;

@Buildable(
        builderPackage = "io.fabric8.kubernetes.api.builder",
        editableEnabled = false
)
@ToString
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
@Getter
@Setter
public class HelmReleaseStatus implements FluxStatus {

    private List<Condition> conditions;
    private Long observedGeneration;
    private String lastAttemptedRevision;
    private String lastAppliedRevision;
    private String lastAttemptedValuesChecksum;
    private String helmChart;

}
