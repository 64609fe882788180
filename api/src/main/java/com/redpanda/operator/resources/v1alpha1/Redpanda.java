package com.redpanda.operator.resources.v1alpha1;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import com.redpanda.operator.RedpandaKeys;
import io.fabric8.kubernetes.api.model.Namespaced;
import io.fabric8.kubernetes.client.CustomResource;
import io.fabric8.kubernetes.model.annotation.Group;
import io.fabric8.kubernetes.model.annotation.ShortNames;
import io.fabric8.kubernetes.model.annotation.Version;
import io.sundr.builder.annotations.Buildable;
import io.sundr.builder.annotations.BuildableReference;

import java.util.Optional;

/**
 * Represents a Redpanda cluster declaration, delivered through a Flux HelmRelease
 */
@Buildable(
        builderPackage = "io.fabric8.kubernetes.api.builder",
        refs = @BuildableReference(CustomResource.class),
        editableEnabled = false
)
@Group(RedpandaKeys.GROUP)
@Version("v1alpha1")
@ShortNames("rp")
public class Redpanda extends CustomResource<RedpandaSpec, RedpandaStatus> implements Namespaced {

    public static final String DEFAULT_HELM_REPOSITORY_NAME = "redpanda-repository";
    public static final String DEFAULT_CHART_NAME = "redpanda";

    static final String FULLNAME_OVERRIDE = "fullnameOverride";
    static final String CONSOLE = "console";
    static final String ENABLED = "enabled";

    @Override
    protected RedpandaSpec initSpec() {
        return new RedpandaSpec();
    }

    /**
     * A null value will be treated as empty instead
     */
    @Override
    public void setSpec(RedpandaSpec spec) {
        if (spec == null) {
            spec = initSpec();
        }
        super.setSpec(spec);
    }

    @Override
    protected RedpandaStatus initStatus() {
        return new RedpandaStatus();
    }

    @Override
    public void setStatus(RedpandaStatus status) {
        if (status == null) {
            status = initStatus();
        }
        super.setStatus(status);
    }

    /**
     * Get a specific annotation value on the current Redpanda instance
     *
     * @param annotation annotation to look for in the current Redpanda instance metadata
     * @return annotation value or empty if not present
     */
    public Optional<String> getAnnotation(String annotation) {
        return Optional.ofNullable(this.getMetadata().getAnnotations())
                        .map(annotations -> annotations.get(annotation));
    }

    /**
     * @return false when the managed annotation disables reconciliation
     */
    @JsonIgnore
    public boolean isManaged() {
        return !getAnnotation(RedpandaKeys.Annotations.MANAGED)
                .filter(RedpandaKeys.NOT_MANAGED::equals)
                .isPresent();
    }

    @JsonIgnore
    public String getHelmReleaseName() {
        return getMetadata().getName();
    }

    @JsonIgnore
    public String getHelmRepositoryName() {
        ChartRef chartRef = getSpec().getChartRef();
        if (chartRef != null && chartRef.getHelmRepositoryName() != null && !chartRef.getHelmRepositoryName().isEmpty()) {
            return chartRef.getHelmRepositoryName();
        }
        return DEFAULT_HELM_REPOSITORY_NAME;
    }

    @JsonIgnore
    public String getChartName() {
        ChartRef chartRef = getSpec().getChartRef();
        if (chartRef != null && chartRef.getChartName() != null && !chartRef.getChartName().isEmpty()) {
            return chartRef.getChartName();
        }
        return DEFAULT_CHART_NAME;
    }

    /**
     * Name shared by the Services, ServiceAccount, PodDisruptionBudget and StatefulSet
     * the chart renders for the cluster.
     */
    @JsonIgnore
    public String getResourcesName() {
        return textValue(getSpec().getClusterSpec(), FULLNAME_OVERRIDE)
                .orElse(getMetadata().getName());
    }

    @JsonIgnore
    public String getConsoleResourcesName() {
        return console()
                .flatMap(console -> textValue(console, FULLNAME_OVERRIDE))
                .orElse(getMetadata().getName());
    }

    /**
     * The console sub-chart is enabled unless explicitly disabled
     */
    @JsonIgnore
    public boolean isConsoleEnabled() {
        return console()
                .map(console -> console.get(ENABLED))
                .filter(JsonNode::isBoolean)
                .map(JsonNode::booleanValue)
                .orElse(true);
    }

    @JsonIgnore
    public boolean isMigrationEnabled() {
        Migration migration = getSpec().getMigration();
        return migration != null && migration.isEnabled();
    }

    private Optional<JsonNode> console() {
        return Optional.ofNullable(getSpec().getClusterSpec())
                .map(clusterSpec -> clusterSpec.get(CONSOLE))
                .filter(JsonNode::isObject);
    }

    private static Optional<String> textValue(JsonNode node, String field) {
        return Optional.ofNullable(node)
                .map(n -> n.get(field))
                .filter(JsonNode::isTextual)
                .map(JsonNode::textValue)
                .filter(s -> !s.isEmpty());
    }
}
