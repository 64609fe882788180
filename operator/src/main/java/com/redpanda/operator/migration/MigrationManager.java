package com.redpanda.operator.migration;

import com.redpanda.common.OperandUtils;
import com.redpanda.common.VectorizedResourceClient;
import com.redpanda.operator.events.EventRecorder;
import com.redpanda.operator.resources.v1alpha1.Redpanda;
import io.fabric8.kubernetes.api.model.DeletionPropagation;
import io.fabric8.kubernetes.api.model.ServiceAccount;
import io.fabric8.kubernetes.api.model.apps.Deployment;
import io.fabric8.kubernetes.api.model.apps.StatefulSet;
import io.fabric8.kubernetes.api.model.networking.v1.Ingress;
import io.fabric8.kubernetes.api.model.policy.v1.PodDisruptionBudget;
import io.fabric8.kubernetes.client.KubernetesClient;
import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.ArrayList;
import java.util.List;

/**
 * Hands the resources created by the vectorized controllers over to the HelmRelease of a Redpanda.
 * Every step runs even when a previous one failed, the failures are reported together.
 */
@ApplicationScoped
public class MigrationManager {

    static final List<MigrationStep> STEPS = List.of(
            new LegacyClusterStep(),
            new LegacyConsoleStep(),
            new PodLabelStep(),
            new ServiceStep("internal-service", MigrationContext::getResourcesName, false,
                    ServiceStep.REDPANDA_NAME, "update internal Service"),
            new ServiceStep("external-service", c -> c.getResourcesName() + "-external", false,
                    null, "update external Service"),
            new AdoptStep<>("service-account", ServiceAccount.class, MigrationContext::getResourcesName, false,
                    "update ServiceAccount"),
            new AdoptStep<>("pod-disruption-budget", PodDisruptionBudget.class, MigrationContext::getResourcesName, false,
                    "update PodDisruptionBudget"),
            new DeleteStep<>("statefulset", StatefulSet.class, MigrationContext::getResourcesName, false,
                    DeletionPropagation.ORPHAN, "delete StatefulSet with orphan propagation mode"),
            new AdoptStep<>("console-service-account", ServiceAccount.class, MigrationContext::getConsoleResourcesName, true,
                    "update console ServiceAccount"),
            new ServiceStep("console-service", MigrationContext::getConsoleResourcesName, true,
                    ServiceStep.CONSOLE_NAME, "update console Service"),
            new DeleteStep<>("console-deployment", Deployment.class, MigrationContext::getConsoleResourcesName, true,
                    DeletionPropagation.BACKGROUND, "delete console Deployment"),
            new AdoptStep<>("console-ingress", Ingress.class, MigrationContext::getConsoleResourcesName, true,
                    "update console Ingress"));

    @Inject
    Logger log;

    @Inject
    KubernetesClient kubernetesClient;

    @Inject
    VectorizedResourceClient vectorizedClient;

    @Inject
    EventRecorder events;

    /**
     * @return the number of mutations issued
     * @throws MigrationException listing every failed step
     */
    public int migrate(Redpanda redpanda) {
        MigrationContext context = new MigrationContext(redpanda, kubernetesClient, vectorizedClient, events, log);
        List<MigrationException.StepFailure> failures = new ArrayList<>();
        int mutations = 0;

        for (MigrationStep step : STEPS) {
            if (!step.isApplicable(redpanda)) {
                log.debugf("Skipping migration step %s", step.getName());
                continue;
            }
            try {
                mutations += step.migrate(context);
            } catch (MigrationException e) {
                failures.addAll(e.getFailures());
            } catch (RuntimeException e) {
                failures.add(new MigrationException.StepFailure(step.getName(), e));
            }
        }

        log.infof("Migration of Redpanda %s issued %d mutations", OperandUtils.key(redpanda), mutations);
        if (!failures.isEmpty()) {
            throw new MigrationException(OperandUtils.key(redpanda), failures);
        }
        return mutations;
    }
}
