package com.redpanda.operator.controllers;

import com.redpanda.operator.RedpandaKeys;
import com.redpanda.operator.events.ControllerEventFilter;
import com.redpanda.operator.events.ManagedResourceFilter;
import com.redpanda.operator.resources.flux.HelmRelease;
import com.redpanda.operator.resources.flux.HelmRepository;
import com.redpanda.operator.resources.v1alpha1.Redpanda;
import io.javaoperatorsdk.operator.api.config.informer.InformerConfiguration;
import io.javaoperatorsdk.operator.api.reconciler.Cleaner;
import io.javaoperatorsdk.operator.api.reconciler.Context;
import io.javaoperatorsdk.operator.api.reconciler.ControllerConfiguration;
import io.javaoperatorsdk.operator.api.reconciler.DeleteControl;
import io.javaoperatorsdk.operator.api.reconciler.ErrorStatusHandler;
import io.javaoperatorsdk.operator.api.reconciler.ErrorStatusUpdateControl;
import io.javaoperatorsdk.operator.api.reconciler.EventSourceContext;
import io.javaoperatorsdk.operator.api.reconciler.EventSourceInitializer;
import io.javaoperatorsdk.operator.api.reconciler.Reconciler;
import io.javaoperatorsdk.operator.api.reconciler.UpdateControl;
import io.javaoperatorsdk.operator.processing.event.ResourceID;
import io.javaoperatorsdk.operator.processing.event.source.EventSource;
import io.javaoperatorsdk.operator.processing.event.source.informer.InformerEventSource;
import io.javaoperatorsdk.operator.processing.event.source.informer.Mappers;
import io.micrometer.core.annotation.Counted;
import io.micrometer.core.annotation.Timed;
import org.jboss.logging.Logger;
import org.jboss.logging.NDC;

import jakarta.inject.Inject;

import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Adapts {@link RedpandaReconciliation} to the operator sdk. The finalizer is handled by the
 * reconciliation itself, the sdk only routes deleted resources to {@link #cleanup}.
 */
@ControllerConfiguration(
        finalizerName = RedpandaKeys.FINALIZER,
        onUpdateFilter = ControllerEventFilter.class,
        genericFilter = ManagedResourceFilter.class)
public class RedpandaController implements Reconciler<Redpanda>, Cleaner<Redpanda>, ErrorStatusHandler<Redpanda>,
        EventSourceInitializer<Redpanda> {

    @Inject
    Logger log;

    @Inject
    RedpandaReconciliation reconciliation;

    /**
     * Level based: any change of the Redpanda or of an owned Flux resource runs the full
     * reconciliation against a fresh read of the Redpanda.
     */
    @Timed(value = "controller.update", extraTags = {"resource", "Redpanda"}, description = "Time spent processing reconcile calls")
    @Counted(value = "controller.update", extraTags = {"resource", "Redpanda"}, description = "The number of reconcile calls")
    @Override
    public UpdateControl<Redpanda> reconcile(Redpanda redpanda, Context<Redpanda> context) {
        NDC.push(logKey(redpanda));
        try {
            ReconcileResult result = reconciliation.reconcile(ResourceID.fromResource(redpanda));
            UpdateControl<Redpanda> control = UpdateControl.noUpdate();
            if (result.getRequeueAfter().isPresent()) {
                control.rescheduleAfter(result.getRequeueAfter().get().toMillis(), TimeUnit.MILLISECONDS);
            }
            return control;
        } finally {
            NDC.pop();
        }
    }

    @Timed(value = "controller.delete", extraTags = {"resource", "Redpanda"}, description = "Time spent processing cleanup calls")
    @Counted(value = "controller.delete", extraTags = {"resource", "Redpanda"}, description = "The number of cleanup calls")
    @Override
    public DeleteControl cleanup(Redpanda redpanda, Context<Redpanda> context) {
        NDC.push(logKey(redpanda));
        try {
            reconciliation.reconcile(ResourceID.fromResource(redpanda));
            return DeleteControl.noFinalizerRemoval();
        } catch (DeletionPendingException e) {
            log.info(e.getMessage());
            throw e;
        } finally {
            NDC.pop();
        }
    }

    @Override
    public ErrorStatusUpdateControl<Redpanda> updateErrorStatus(Redpanda redpanda, Context<Redpanda> context, Exception e) {
        log.errorf(e, "reconciliation of Redpanda %s failed", logKey(redpanda));
        try {
            reconciliation.recordFailure(ResourceID.fromResource(redpanda), e);
        } catch (RuntimeException statusError) {
            log.errorf(statusError, "unable to record failure on Redpanda %s", logKey(redpanda));
        }
        return ErrorStatusUpdateControl.noStatusUpdate();
    }

    @Override
    public Map<String, EventSource> prepareEventSources(EventSourceContext<Redpanda> context) {
        InformerEventSource<HelmRelease, Redpanda> releases = new InformerEventSource<>(
                InformerConfiguration.from(HelmRelease.class, context)
                        .withSecondaryToPrimaryMapper(Mappers.fromOwnerReference())
                        .build(), context);
        InformerEventSource<HelmRepository, Redpanda> repositories = new InformerEventSource<>(
                InformerConfiguration.from(HelmRepository.class, context)
                        .withSecondaryToPrimaryMapper(Mappers.fromOwnerReference())
                        .build(), context);
        return EventSourceInitializer.nameEventSources(releases, repositories);
    }

    private static String logKey(Redpanda redpanda) {
        return redpanda.getMetadata().getNamespace() + "/" + redpanda.getMetadata().getName();
    }
}
