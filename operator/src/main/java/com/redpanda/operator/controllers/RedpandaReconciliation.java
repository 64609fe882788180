package com.redpanda.operator.controllers;

import com.redpanda.common.ConditionUtils;
import com.redpanda.common.HelmReleaseResourceClient;
import com.redpanda.common.RedpandaResourceClient;
import com.redpanda.operator.RedpandaKeys;
import com.redpanda.operator.events.EventRecorder;
import com.redpanda.operator.migration.MigrationException;
import com.redpanda.operator.migration.MigrationManager;
import com.redpanda.operator.operands.HelmReleaseOperand;
import com.redpanda.operator.operands.HelmRepositoryOperand;
import com.redpanda.operator.operands.Operand;
import com.redpanda.operator.operands.ReadinessTransition;
import com.redpanda.operator.resources.flux.FluxStatus;
import com.redpanda.operator.resources.flux.HelmRelease;
import com.redpanda.operator.resources.v1alpha1.Redpanda;
import com.redpanda.operator.resources.v1alpha1.RedpandaCondition.Reason;
import com.redpanda.operator.resources.v1alpha1.RedpandaCondition.Status;
import com.redpanda.operator.resources.v1alpha1.RedpandaStatus;
import io.fabric8.kubernetes.api.model.DeletionPropagation;
import io.fabric8.kubernetes.client.CustomResource;
import io.javaoperatorsdk.operator.processing.event.ResourceID;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.time.Duration;
import java.util.Objects;

/**
 * Drives a Redpanda towards its HelmRepository and HelmRelease. Every call starts from a fresh
 * read of the Redpanda, so the object handed over by the informer cache is never mutated.
 */
@ApplicationScoped
public class RedpandaReconciliation {

    static final String PROGRESSING_MESSAGE = "Reconciliation in progress";
    static final String READY_MESSAGE = "Redpanda reconciliation succeeded";

    @Inject
    Logger log;

    @Inject
    RedpandaResourceClient redpandaClient;

    @Inject
    HelmReleaseResourceClient releaseClient;

    @Inject
    HelmRepositoryOperand repositoryOperand;

    @Inject
    HelmReleaseOperand releaseOperand;

    @Inject
    MigrationManager migrationManager;

    @Inject
    EventRecorder events;

    @ConfigProperty(name = "redpanda.helm.requeue-delay")
    Duration requeueDelay;

    public ReconcileResult reconcile(ResourceID key) {
        long start = System.nanoTime();
        String namespace = key.getNamespace().orElse(null);

        Redpanda redpanda = redpandaClient.getByName(namespace, key.getName());
        if (redpanda == null) {
            log.debugf("Redpanda %s/%s no longer exists", namespace, key.getName());
            return ReconcileResult.done();
        }

        if (redpanda.isMarkedForDeletion()) {
            return reconcileDelete(redpanda);
        }

        if (!redpanda.isManaged()) {
            log.infof("management is disabled; to enable it, change the '%s' annotation to true or remove it",
                    RedpandaKeys.Annotations.MANAGED);
            if (redpanda.removeFinalizer(RedpandaKeys.FINALIZER)) {
                redpandaClient.update(redpanda);
            }
            return ReconcileResult.done();
        }

        if (!redpanda.hasFinalizer(RedpandaKeys.FINALIZER)) {
            redpanda.addFinalizer(RedpandaKeys.FINALIZER);
            redpanda = redpandaClient.update(redpanda);
        }

        if (redpanda.isMigrationEnabled()) {
            try {
                migrationManager.migrate(redpanda);
            } catch (MigrationException e) {
                log.errorf(e, "migration of Redpanda %s/%s", namespace, key.getName());
            }
        }

        ReconcileResult result;
        try {
            result = reconcileDependents(redpanda);
        } catch (RuntimeException e) {
            try {
                persistStatus(redpanda);
            } catch (RuntimeException statusError) {
                log.errorf(statusError, "unable to update status of Redpanda %s/%s after reconciliation", namespace, key.getName());
                statusError.addSuppressed(e);
                throw statusError;
            }
            throw e;
        }

        try {
            persistStatus(redpanda);
        } catch (RuntimeException e) {
            log.errorf(e, "unable to update status of Redpanda %s/%s after reconciliation", namespace, key.getName());
            throw e;
        }

        String duration = String.format("reconciliation finished in %d ms", Duration.ofNanos(System.nanoTime() - start).toMillis());
        if (result.getRequeueAfter().isPresent()) {
            duration = String.format("%s, next run in %s", duration, result.getRequeueAfter().get());
        }
        log.info(duration);
        return result;
    }

    private ReconcileResult reconcileDependents(Redpanda redpanda) {
        RedpandaStatus status = redpanda.getStatus();
        Long generation = redpanda.getMetadata().getGeneration();
        if (!Objects.equals(status.getObservedGeneration(), generation)) {
            status.setObservedGeneration(generation);
            ConditionUtils.setReadyCondition(status, Status.Unknown, Reason.Progressing, PROGRESSING_MESSAGE);
            persistStatus(redpanda);
        }

        ReadinessTransition repository = resolve(redpanda, repositoryOperand);
        if (!repository.isReady()) {
            return ReconcileResult.requeueAfter(requeueDelay);
        }

        ReadinessTransition release = resolve(redpanda, releaseOperand);
        if (!release.isReady()) {
            return ReconcileResult.requeueAfter(requeueDelay);
        }

        ConditionUtils.setReadyCondition(status, Status.True, Reason.RedpandaClusterDeployed, READY_MESSAGE);
        return ReconcileResult.done();
    }

    private <D extends CustomResource<?, ? extends FluxStatus>> ReadinessTransition resolve(Redpanda redpanda, Operand<D> operand) {
        D dependent = operand.createOrUpdate(redpanda);
        ReadinessTransition transition = operand.getReadiness(redpanda, dependent);
        operand.setReadyState(redpanda.getStatus(), transition.getNext());

        String message = transition.message(operand.getKind(), dependent);
        if (transition.isEventEmitted()) {
            events.info(redpanda, message);
        }
        if (!transition.isReady()) {
            log.info(message);
            ConditionUtils.setReadyCondition(redpanda.getStatus(), Status.False, Reason.ArtifactFailed, message);
        }
        return transition;
    }

    /**
     * Removes the HelmRelease before releasing the finalizer
     *
     * @throws DeletionPendingException while the HelmRelease still exists
     */
    ReconcileResult reconcileDelete(Redpanda redpanda) {
        String namespace = redpanda.getMetadata().getNamespace();
        RedpandaStatus status = redpanda.getStatus();
        String releaseName = status.getHelmRelease();

        if (releaseName != null && !releaseName.isEmpty()) {
            HelmRelease release = releaseClient.getByName(namespace, releaseName);
            if (release != null) {
                if (!release.isMarkedForDeletion()) {
                    log.infof("Deleting HelmRelease %s/%s of Redpanda %s", namespace, releaseName, redpanda.getMetadata().getName());
                    releaseClient.delete(namespace, releaseName, DeletionPropagation.FOREGROUND);
                }
                throw new DeletionPendingException(String.format("wait for helm release %s/%s deletion", namespace, releaseName));
            }
        }

        status.setHelmRelease(null);
        status.setHelmRepository(null);
        if (redpanda.removeFinalizer(RedpandaKeys.FINALIZER)) {
            log.infof("Releasing finalizer of Redpanda %s/%s", namespace, redpanda.getMetadata().getName());
            redpandaClient.update(redpanda);
        }
        return ReconcileResult.done();
    }

    /**
     * Records the failure of the last reconciliation on the Ready condition
     */
    public void recordFailure(ResourceID key, Exception e) {
        Redpanda latest = redpandaClient.getByName(key.getNamespace().orElse(null), key.getName());
        if (latest == null || latest.isMarkedForDeletion()) {
            return;
        }
        ConditionUtils.setReadyCondition(latest.getStatus(), Status.False, Reason.Error, e.getMessage());
        redpandaClient.patchStatus(latest);
    }

    /**
     * Merge patch the status on top of the latest version of the Redpanda
     */
    void persistStatus(Redpanda redpanda) {
        Redpanda latest = redpandaClient.getByName(redpanda.getMetadata().getNamespace(), redpanda.getMetadata().getName());
        if (latest == null) {
            return;
        }
        latest.setStatus(redpanda.getStatus());
        redpandaClient.patchStatus(latest);
    }
}
