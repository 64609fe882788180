package com.redpanda.operator.resources.v1alpha1;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import io.fabric8.kubernetes.api.model.KubernetesResource;
import io.sundr.builder.annotations.Buildable;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * Defines the specification of the Redpanda instance
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
public class RedpandaSpec implements KubernetesResource {

    private static final long serialVersionUID = 1L;

    private ChartRef chartRef = new ChartRef();

    /**
     * Helm values handed to the chart as-is
     */
    private JsonNode clusterSpec;

    private Migration migration;

    /**
     * Never null
     */
    public ChartRef getChartRef() {
        return chartRef;
    }

    /**
     * A null value will be treated as empty instead
     */
    public void setChartRef(ChartRef chartRef) {
        if (chartRef == null) {
            chartRef = new ChartRef();
        }
        this.chartRef = chartRef;
    }
}
