package com.redpanda.operator.controllers;

import com.redpanda.operator.operands.OperandTestUtils;
import com.redpanda.operator.resources.v1alpha1.Redpanda;
import io.javaoperatorsdk.operator.api.reconciler.Context;
import io.javaoperatorsdk.operator.api.reconciler.DeleteControl;
import io.javaoperatorsdk.operator.api.reconciler.ErrorStatusUpdateControl;
import io.javaoperatorsdk.operator.api.reconciler.UpdateControl;
import io.javaoperatorsdk.operator.processing.event.ResourceID;
import io.quarkus.test.common.QuarkusTestResource;
import io.quarkus.test.junit.QuarkusTest;
import io.quarkus.test.junit.mockito.InjectMock;
import io.quarkus.test.kubernetes.client.KubernetesServerTestResource;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import jakarta.inject.Inject;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@QuarkusTestResource(KubernetesServerTestResource.class)
@QuarkusTest
class RedpandaControllerTest {

    @Inject
    RedpandaController controller;

    @InjectMock
    RedpandaReconciliation reconciliation;

    Redpanda redpanda = OperandTestUtils.redpanda("ns", "basic");

    @SuppressWarnings("unchecked")
    Context<Redpanda> context = Mockito.mock(Context.class);

    @Test
    void testRequeueIsRescheduled() {
        Mockito.when(reconciliation.reconcile(new ResourceID("basic", "ns")))
                .thenReturn(ReconcileResult.requeueAfter(Duration.ofSeconds(10)));

        UpdateControl<Redpanda> control = controller.reconcile(redpanda, context);

        assertFalse(control.isUpdateResource());
        assertFalse(control.isUpdateStatus());
        assertEquals(10000L, control.getScheduleDelay().get());
    }

    @Test
    void testDoneIsNotRescheduled() {
        Mockito.when(reconciliation.reconcile(new ResourceID("basic", "ns"))).thenReturn(ReconcileResult.done());

        assertTrue(controller.reconcile(redpanda, context).getScheduleDelay().isEmpty());
    }

    @Test
    void testCleanupKeepsFinalizerManagement() {
        Mockito.when(reconciliation.reconcile(new ResourceID("basic", "ns"))).thenReturn(ReconcileResult.done());

        DeleteControl control = controller.cleanup(redpanda, context);

        assertFalse(control.isRemoveFinalizer());
    }

    @Test
    void testPendingDeletionIsRetried() {
        Mockito.when(reconciliation.reconcile(new ResourceID("basic", "ns")))
                .thenThrow(new DeletionPendingException("wait for helm release ns/basic deletion"));

        assertThrows(DeletionPendingException.class, () -> controller.cleanup(redpanda, context));
    }

    @Test
    void testErrorRecordedWithoutStatusUpdate() {
        Exception e = new IllegalStateException("boom");

        ErrorStatusUpdateControl<Redpanda> control = controller.updateErrorStatus(redpanda, context, e);

        Mockito.verify(reconciliation).recordFailure(new ResourceID("basic", "ns"), e);
        assertTrue(control.getResource().isEmpty());
    }
}
