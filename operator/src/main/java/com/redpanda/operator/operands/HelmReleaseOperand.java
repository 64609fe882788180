package com.redpanda.operator.operands;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.redpanda.common.HelmReleaseResourceClient;
import com.redpanda.common.OperandUtils;
import com.redpanda.operator.events.EventRecorder;
import com.redpanda.operator.resources.flux.FluxKeys;
import com.redpanda.operator.resources.flux.HelmChartTemplateSpec;
import com.redpanda.operator.resources.flux.HelmRelease;
import com.redpanda.operator.resources.flux.HelmReleaseBuilder;
import com.redpanda.operator.resources.flux.HelmReleaseSpec;
import com.redpanda.operator.resources.flux.HelmReleaseStatus;
import com.redpanda.operator.resources.flux.Upgrade;
import com.redpanda.operator.resources.flux.UpgradeBuilder;
import com.redpanda.operator.resources.flux.UpgradeRemediationBuilder;
import com.redpanda.operator.resources.v1alpha1.ChartRef;
import com.redpanda.operator.resources.v1alpha1.HelmUpgrade;
import com.redpanda.operator.resources.v1alpha1.ReadyState;
import com.redpanda.operator.resources.v1alpha1.Redpanda;
import com.redpanda.operator.resources.v1alpha1.RedpandaStatus;
import io.fabric8.kubernetes.client.KubernetesClientException;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.net.HttpURLConnection;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Base64;
import java.util.Objects;
import java.util.Optional;

/**
 * Provides the HelmRelease installing the Redpanda chart. The release is named after the Redpanda
 * and the name recorded on the status decides whether it was ever created.
 */
@ApplicationScoped
public class HelmReleaseOperand implements Operand<HelmRelease> {

    static final String REMEDIATION_STRATEGY = "rollback";
    static final int REMEDIATION_RETRIES = 1;

    @Inject
    Logger log;

    @Inject
    HelmReleaseResourceClient releaseClient;

    @Inject
    EventRecorder events;

    @ConfigProperty(name = "redpanda.helm.release-interval")
    String releaseInterval;

    @ConfigProperty(name = "redpanda.helm.release-timeout")
    String releaseTimeout;

    @ConfigProperty(name = "redpanda.helm.chart-interval")
    String chartInterval;

    @Override
    public String getKind() {
        return FluxKeys.HELM_RELEASE_KIND;
    }

    @Override
    public HelmRelease createOrUpdate(Redpanda redpanda) {
        RedpandaStatus status = redpanda.getStatus();
        String namespace = redpanda.getMetadata().getNamespace();

        HelmRelease release;
        if (isBlank(status.getHelmRelease())) {
            release = create(redpanda);
        } else {
            HelmRelease current = releaseClient.getByName(namespace, status.getHelmRelease());
            if (current == null) {
                log.infof("HelmRelease %s/%s recorded on the status no longer exists", namespace, status.getHelmRelease());
                status.setHelmRelease(null);
                release = create(redpanda);
            } else {
                release = updateIfRequired(redpanda, current);
            }
        }

        copyRevisions(release, status);
        return release;
    }

    private HelmRelease create(Redpanda redpanda) {
        String namespace = redpanda.getMetadata().getNamespace();
        String name = redpanda.getHelmReleaseName();

        HelmRelease desired = helmReleaseFrom(redpanda);

        HelmRelease release;
        try {
            release = releaseClient.create(desired);
        } catch (KubernetesClientException e) {
            if (e.getCode() != HttpURLConnection.HTTP_CONFLICT) {
                events.error(redpanda, e.getMessage());
                throw e;
            }
            log.infof("HelmRelease %s/%s already exists", namespace, name);
            release = Optional.ofNullable(releaseClient.getByName(namespace, name)).orElse(desired);
        }

        events.info(redpanda, String.format("HelmRelease '%s/%s' created", namespace, name));
        redpanda.getStatus().setHelmRelease(name);
        return release;
    }

    private HelmRelease updateIfRequired(Redpanda redpanda, HelmRelease current) {
        HelmRelease desired = helmReleaseFrom(redpanda);

        if (!requiresUpdate(current, desired)) {
            return current;
        }

        HelmRelease updated = new HelmReleaseBuilder(current)
                .withSpec(desired.getSpec())
                .build();
        try {
            updated = releaseClient.update(updated);
        } catch (KubernetesClientException e) {
            events.error(redpanda, e.getMessage());
            throw e;
        }
        String namespace = redpanda.getMetadata().getNamespace();
        log.infof("Updated HelmRelease %s/%s", namespace, redpanda.getHelmReleaseName());
        events.info(redpanda, String.format("HelmRelease '%s/%s' updated", namespace, redpanda.getHelmReleaseName()));
        redpanda.getStatus().setHelmRelease(redpanda.getHelmReleaseName());
        return updated;
    }

    /**
     * Compares the fields the operator owns: values, chart name, chart version when one is
     * requested, and the reconcile interval
     */
    boolean requiresUpdate(HelmRelease current, HelmRelease desired) {
        HelmReleaseSpec currentSpec = Optional.ofNullable(current.getSpec()).orElseGet(HelmReleaseSpec::new);
        HelmReleaseSpec desiredSpec = desired.getSpec();

        if (!Objects.equals(currentSpec.getValues(), desiredSpec.getValues())) {
            log.info("values found different");
            return true;
        }
        HelmChartTemplateSpec currentChart = chartSpec(currentSpec);
        HelmChartTemplateSpec desiredChart = chartSpec(desiredSpec);
        if (!Objects.equals(currentChart.getChart(), desiredChart.getChart())) {
            log.info("chart is different");
            return true;
        }
        if (!isBlank(desiredChart.getVersion()) && !desiredChart.getVersion().equals(currentChart.getVersion())) {
            log.info("spec version is different");
            return true;
        }
        if (!Objects.equals(currentSpec.getInterval(), desiredSpec.getInterval())) {
            log.info("interval found different");
            return true;
        }
        return false;
    }

    private static HelmChartTemplateSpec chartSpec(HelmReleaseSpec spec) {
        if (spec.getChart() == null || spec.getChart().getSpec() == null) {
            return new HelmChartTemplateSpec();
        }
        return spec.getChart().getSpec();
    }

    /**
     * Build the desired HelmRelease of the Redpanda
     */
    HelmRelease helmReleaseFrom(Redpanda redpanda) {
        String namespace = redpanda.getMetadata().getNamespace();
        ChartRef chartRef = redpanda.getSpec().getChartRef();
        JsonNode values = valuesOf(redpanda);

        // TODO record the fingerprint on the status so that value changes can be traced to revisions
        log.infof("SHA of values file to use: %s", fingerprint(values));

        HelmRelease release = new HelmReleaseBuilder()
                .withNewMetadata()
                    .withName(redpanda.getHelmReleaseName())
                    .withNamespace(namespace)
                .endMetadata()
                .withNewSpec()
                    .withNewChart()
                        .withNewSpec()
                            .withChart(redpanda.getChartName())
                            .withVersion(chartRef.getChartVersion())
                            .withInterval(chartInterval)
                            .withNewSourceRef()
                                .withKind(FluxKeys.HELM_REPOSITORY_KIND)
                                .withName(redpanda.getHelmRepositoryName())
                                .withNamespace(namespace)
                            .endSourceRef()
                        .endSpec()
                    .endChart()
                    .withValues(values)
                    .withInterval(isBlank(chartRef.getInterval()) ? releaseInterval : chartRef.getInterval())
                    .withTimeout(isBlank(chartRef.getTimeout()) ? releaseTimeout : chartRef.getTimeout())
                    .withUpgrade(upgradeFrom(chartRef.getUpgrade()))
                .endSpec()
                .build();

        OperandUtils.setAsOwner(redpanda, release);
        return release;
    }

    /**
     * Defaults to a single rollback retry, each field set by the user replaces only its own default
     */
    static Upgrade upgradeFrom(HelmUpgrade helmUpgrade) {
        Upgrade upgrade = new UpgradeBuilder()
                .withNewRemediation()
                    .withStrategy(REMEDIATION_STRATEGY)
                    .withRetries(REMEDIATION_RETRIES)
                .endRemediation()
                .build();

        if (helmUpgrade != null) {
            if (helmUpgrade.getForce() != null) {
                upgrade.setForce(helmUpgrade.getForce());
            }
            if (helmUpgrade.getCleanupOnFail() != null) {
                upgrade.setCleanupOnFail(helmUpgrade.getCleanupOnFail());
            }
            if (helmUpgrade.getPreserveValues() != null) {
                upgrade.setPreserveValues(helmUpgrade.getPreserveValues());
            }
            if (helmUpgrade.getRemediation() != null) {
                upgrade.setRemediation(new UpgradeRemediationBuilder(helmUpgrade.getRemediation()).build());
            }
        }
        return upgrade;
    }

    private static JsonNode valuesOf(Redpanda redpanda) {
        JsonNode clusterSpec = redpanda.getSpec().getClusterSpec();
        if (clusterSpec == null || clusterSpec.isNull()) {
            return JsonNodeFactory.instance.objectNode();
        }
        return clusterSpec.deepCopy();
    }

    /**
     * SHA-256 of the compact json of the values, url safe base64 encoded
     */
    static String fingerprint(JsonNode values) {
        try {
            byte[] digest = MessageDigest.getInstance("SHA-256").digest(values.toString().getBytes(StandardCharsets.UTF_8));
            return Base64.getUrlEncoder().encodeToString(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }

    private static void copyRevisions(HelmRelease release, RedpandaStatus status) {
        HelmReleaseStatus releaseStatus = release.getStatus();
        if (releaseStatus == null) {
            return;
        }
        if (!isBlank(releaseStatus.getLastAttemptedRevision())) {
            status.setLastAttemptedRevision(releaseStatus.getLastAttemptedRevision());
        }
        if (!isBlank(releaseStatus.getLastAppliedRevision())) {
            status.setLastAppliedRevision(releaseStatus.getLastAppliedRevision());
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    @Override
    public ReadyState getReadyState(RedpandaStatus status) {
        return status.getHelmReleaseReady();
    }

    @Override
    public void setReadyState(RedpandaStatus status, ReadyState state) {
        status.setHelmReleaseReady(state);
    }
}
