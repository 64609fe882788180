package com.redpanda.operator.resources.v1alpha1;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.redpanda.operator.resources.flux.UpgradeRemediation;
import io.sundr.builder.annotations.Buildable;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * Caller supplied upgrade policy. Only the fields set here override the defaults of the HelmRelease.
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
public class HelmUpgrade {

    private Boolean force;
    private Boolean cleanupOnFail;
    private Boolean preserveValues;
    private UpgradeRemediation remediation;

}
