package com.redpanda.common;

import com.redpanda.operator.resources.flux.HelmReleaseStatus;
import com.redpanda.operator.resources.flux.HelmRepository;
import com.redpanda.operator.resources.flux.HelmRepositoryStatus;
import com.redpanda.operator.resources.v1alpha1.RedpandaCondition;
import com.redpanda.operator.resources.v1alpha1.RedpandaCondition.Reason;
import com.redpanda.operator.resources.v1alpha1.RedpandaCondition.Status;
import com.redpanda.operator.resources.v1alpha1.RedpandaStatus;
import io.fabric8.kubernetes.api.model.ConditionBuilder;
import io.fabric8.kubernetes.api.model.ObjectMetaBuilder;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ConditionUtilsTest {

    @Test
    void testBuildUpdateCondition() {
        RedpandaCondition condition = ConditionUtils.buildCondition(RedpandaCondition.Type.Ready, Status.True);
        assertEquals("True", condition.getStatus());
        assertEquals("Ready", condition.getType());
        ConditionUtils.updateConditionStatus(condition, Status.False, Reason.ArtifactFailed, "not yet");
        assertEquals("False", condition.getStatus());
        assertEquals("ArtifactFailed", condition.getReason());
        assertEquals("not yet", condition.getMessage());

        var mockCondition = Mockito.mock(RedpandaCondition.class, Mockito.CALLS_REAL_METHODS);
        ConditionUtils.updateConditionStatus(mockCondition, Status.False, Reason.ArtifactFailed, null);
        Mockito.verify(mockCondition, Mockito.times(1)).setLastTransitionTime(Mockito.anyString());
        // a changed reason alone keeps the transition time
        ConditionUtils.updateConditionStatus(mockCondition, Status.False, Reason.Error, "boom");
        Mockito.verify(mockCondition, Mockito.times(1)).setLastTransitionTime(Mockito.anyString());
    }

    @Test
    void testSetReadyCondition() {
        RedpandaStatus status = new RedpandaStatus();
        status.setObservedGeneration(3L);

        ConditionUtils.setReadyCondition(status, Status.Unknown, Reason.Progressing, "Reconciliation in progress");
        ConditionUtils.setReadyCondition(status, Status.True, Reason.RedpandaClusterDeployed, "done");

        assertEquals(1, status.getConditions().size());
        RedpandaCondition ready = ConditionUtils.findRedpandaCondition(status.getConditions(), RedpandaCondition.Type.Ready).get();
        assertEquals("True", ready.getStatus());
        assertEquals("RedpandaClusterDeployed", ready.getReason());
        assertEquals(3L, ready.getObservedGeneration());
    }

    @Test
    void testFluxReadiness() {
        HelmRepository repository = new HelmRepository();
        repository.setMetadata(new ObjectMetaBuilder().withName("repo").withGeneration(2L).build());
        HelmRepositoryStatus status = new HelmRepositoryStatus();

        assertFalse(ConditionUtils.isFluxReady(null));
        assertFalse(ConditionUtils.isFluxReady(status));
        assertFalse(ConditionUtils.isGenerationObserved(repository, status));

        status.setObservedGeneration(2L);
        status.setConditions(List.of(new ConditionBuilder().withType("Ready").withStatus("True").build()));
        assertTrue(ConditionUtils.isFluxReady(status));
        assertTrue(ConditionUtils.isGenerationObserved(repository, status));

        HelmReleaseStatus releaseStatus = new HelmReleaseStatus();
        releaseStatus.setConditions(List.of(new ConditionBuilder().withType("Ready").withStatus("False").build()));
        assertFalse(ConditionUtils.isFluxReady(releaseStatus));
    }
}
