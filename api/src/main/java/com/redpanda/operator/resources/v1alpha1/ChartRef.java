package com.redpanda.operator.resources.v1alpha1;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.sundr.builder.annotations.Buildable;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * Identifies the chart to install and how the HelmRelease should drive it.
 * Durations use the Kubernetes duration format, for example "15m" or "30s".
 */
@Buildable(
        builderPackage = "io.fabric8.kubernetes.api.builder",
        editableEnabled = false
)
@ToString
@EqualsAndHashCode
@JsonInclude(JsonInclude.Include.NON_NULL)
@Getter
@Setter
public class ChartRef {

    private String chartName;
    private String chartVersion;
    private String helmRepositoryName;
    private String timeout;
    private String interval;
    private HelmUpgrade upgrade;

}
