package com.redpanda.operator.resources.v1alpha1;

import com.fasterxml.jackson.annotation.JsonInclude;
import io.sundr.builder.annotations.Buildable;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * Hands over resources created by the vectorized Cluster and Console controllers to the HelmRelease
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
public class Migration {

    private boolean enabled;
    private ObjectReference clusterRef = new ObjectReference();
    private ObjectReference consoleRef = new ObjectReference();

    public void setClusterRef(ObjectReference clusterRef) {
        this.clusterRef = clusterRef == null ? new ObjectReference() : clusterRef;
    }

    public void setConsoleRef(ObjectReference consoleRef) {
        this.consoleRef = consoleRef == null ? new ObjectReference() : consoleRef;
    }
}
