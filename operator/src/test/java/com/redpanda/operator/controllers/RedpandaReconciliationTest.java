package com.redpanda.operator.controllers;

import com.redpanda.common.ConditionUtils;
import com.redpanda.common.HelmReleaseResourceClient;
import com.redpanda.common.HelmRepositoryResourceClient;
import com.redpanda.common.OperandUtils;
import com.redpanda.common.RedpandaResourceClient;
import com.redpanda.operator.RedpandaKeys;
import com.redpanda.operator.events.EventRecorder;
import com.redpanda.operator.migration.MigrationException;
import com.redpanda.operator.migration.MigrationManager;
import com.redpanda.operator.operands.OperandTestUtils;
import com.redpanda.operator.resources.flux.FluxKeys;
import com.redpanda.operator.resources.flux.HelmRelease;
import com.redpanda.operator.resources.flux.HelmReleaseStatus;
import com.redpanda.operator.resources.flux.HelmRepository;
import com.redpanda.operator.resources.flux.HelmRepositoryStatus;
import com.redpanda.operator.resources.v1alpha1.ChartRef;
import com.redpanda.operator.resources.v1alpha1.ReadyState;
import com.redpanda.operator.resources.v1alpha1.Redpanda;
import com.redpanda.operator.resources.v1alpha1.RedpandaCondition;
import io.fabric8.kubernetes.api.model.ConditionBuilder;
import io.fabric8.kubernetes.api.model.DeletionPropagation;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.client.KubernetesClientException;
import io.fabric8.kubernetes.client.utils.Serialization;
import io.javaoperatorsdk.operator.processing.event.ResourceID;
import io.quarkus.test.common.QuarkusTestResource;
import io.quarkus.test.junit.QuarkusTest;
import io.quarkus.test.junit.mockito.InjectMock;
import io.quarkus.test.kubernetes.client.KubernetesServerTestResource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import jakarta.inject.Inject;

import java.time.Duration;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;

@QuarkusTestResource(KubernetesServerTestResource.class)
@QuarkusTest
class RedpandaReconciliationTest {

    static final String NAMESPACE = "ns";
    static final ResourceID KEY = new ResourceID("basic", NAMESPACE);

    Map<String, Redpanda> redpandas = new HashMap<>();
    Map<String, HelmRepository> repositories = new HashMap<>();
    Map<String, HelmRelease> releases = new HashMap<>();

    @InjectMock
    RedpandaResourceClient redpandaClient;

    @InjectMock
    HelmRepositoryResourceClient repositoryClient;

    @InjectMock
    HelmReleaseResourceClient releaseClient;

    @InjectMock
    MigrationManager migrationManager;

    @InjectMock
    EventRecorder events;

    @Inject
    RedpandaReconciliation reconciliation;

    @BeforeEach
    void setup() {
        redpandas.clear();
        repositories.clear();
        releases.clear();

        Mockito.when(redpandaClient.getByName(anyString(), anyString())).thenAnswer(i -> read(redpandas, i.getArgument(0), i.getArgument(1)));
        Mockito.when(redpandaClient.update(any())).thenAnswer(i -> write(redpandas, i.getArgument(0)));
        Mockito.when(redpandaClient.patchStatus(any())).thenAnswer(i -> {
            Redpanda patch = i.getArgument(0);
            Redpanda stored = redpandas.get(OperandUtils.key(patch));
            stored.setStatus(Serialization.clone(patch.getStatus()));
            return Serialization.clone(stored);
        });

        Mockito.when(repositoryClient.getByName(anyString(), anyString())).thenAnswer(i -> read(repositories, i.getArgument(0), i.getArgument(1)));
        Mockito.when(repositoryClient.create(any())).thenAnswer(i -> create(repositories, i.getArgument(0)));

        Mockito.when(releaseClient.getByName(anyString(), anyString())).thenAnswer(i -> read(releases, i.getArgument(0), i.getArgument(1)));
        Mockito.when(releaseClient.create(any())).thenAnswer(i -> create(releases, i.getArgument(0)));
        Mockito.when(releaseClient.update(any())).thenAnswer(i -> write(releases, i.getArgument(0)));
        Mockito.doAnswer(i -> {
            // foreground deletion, the release stays until its dependents are gone
            releases.get(i.getArgument(0) + "/" + i.getArgument(1)).getMetadata().setDeletionTimestamp(ConditionUtils.iso8601Now());
            return null;
        }).when(releaseClient).delete(anyString(), anyString(), any());
    }

    private static <T extends HasMetadata> T read(Map<String, T> store, String namespace, String name) {
        T stored = store.get(namespace + "/" + name);
        return stored == null ? null : Serialization.clone(stored);
    }

    private static <T extends HasMetadata> T write(Map<String, T> store, T resource) {
        T copy = Serialization.clone(resource);
        store.put(OperandUtils.key(copy), copy);
        return Serialization.clone(copy);
    }

    private static <T extends HasMetadata> T create(Map<String, T> store, T resource) {
        if (store.containsKey(OperandUtils.key(resource))) {
            throw new KubernetesClientException("already exists", 409, null);
        }
        resource.getMetadata().setGeneration(1L);
        return write(store, resource);
    }

    private Redpanda stored() {
        return redpandas.get(NAMESPACE + "/basic");
    }

    private RedpandaCondition ready() {
        return ConditionUtils.findRedpandaCondition(stored().getStatus().getConditions(), RedpandaCondition.Type.Ready).get();
    }

    private static void markReady(HelmRepository repository) {
        HelmRepositoryStatus status = new HelmRepositoryStatus();
        status.setObservedGeneration(repository.getMetadata().getGeneration());
        status.setConditions(List.of(new ConditionBuilder().withType(FluxKeys.READY_CONDITION).withStatus("True").build()));
        repository.setStatus(status);
    }

    private static void markReady(HelmRelease release) {
        HelmReleaseStatus status = new HelmReleaseStatus();
        status.setObservedGeneration(release.getMetadata().getGeneration());
        status.setConditions(List.of(new ConditionBuilder().withType(FluxKeys.READY_CONDITION).withStatus("True").build()));
        status.setLastAttemptedRevision("5.0.1");
        status.setLastAppliedRevision("5.0.1");
        release.setStatus(status);
    }

    private void deployed() {
        write(redpandas, OperandTestUtils.redpanda(NAMESPACE, "basic"));
        reconciliation.reconcile(KEY);
        markReady(repositories.get(NAMESPACE + "/redpanda-repository"));
        reconciliation.reconcile(KEY);
        markReady(releases.get(NAMESPACE + "/basic"));
        assertTrue(reconciliation.reconcile(KEY).getRequeueAfter().isEmpty());
    }

    @Test
    void testMissingRedpanda() {
        assertTrue(reconciliation.reconcile(KEY).getRequeueAfter().isEmpty());
        Mockito.verifyNoInteractions(repositoryClient, releaseClient, events);
    }

    @Test
    void testReleaseWaitsForRepository() {
        write(redpandas, OperandTestUtils.redpanda(NAMESPACE, "basic"));

        ReconcileResult result = reconciliation.reconcile(KEY);

        // redpanda.helm.requeue-delay
        assertEquals(Duration.ofSeconds(10), result.getRequeueAfter().get());
        assertTrue(stored().hasFinalizer(RedpandaKeys.FINALIZER));
        assertNotNull(repositories.get(NAMESPACE + "/redpanda-repository"));
        assertTrue(releases.isEmpty());
        assertEquals("redpanda-repository", stored().getStatus().getHelmRepository());
        assertEquals(ReadyState.NotReady, stored().getStatus().getHelmRepositoryReady());
        assertEquals(1L, stored().getStatus().getObservedGeneration());
        assertEquals("False", ready().getStatus());
        assertEquals("ArtifactFailed", ready().getReason());
        assertEquals("HelmRepository 'ns/redpanda-repository' is not ready", ready().getMessage());

        markReady(repositories.get(NAMESPACE + "/redpanda-repository"));
        result = reconciliation.reconcile(KEY);

        assertTrue(result.getRequeueAfter().isPresent());
        assertNotNull(releases.get(NAMESPACE + "/basic"));
        assertEquals("basic", stored().getStatus().getHelmRelease());
        assertEquals(ReadyState.Ready, stored().getStatus().getHelmRepositoryReady());
        assertEquals(ReadyState.NotReady, stored().getStatus().getHelmReleaseReady());
        assertEquals("HelmRelease 'ns/basic' is not ready", ready().getMessage());
    }

    @Test
    void testDeployed() {
        deployed();

        assertEquals("True", ready().getStatus());
        assertEquals("RedpandaClusterDeployed", ready().getReason());
        assertEquals(RedpandaReconciliation.READY_MESSAGE, ready().getMessage());
        assertEquals(ReadyState.Ready, stored().getStatus().getHelmReleaseReady());
        assertEquals("5.0.1", stored().getStatus().getLastAppliedRevision());

        Mockito.verify(events).info(any(), eq("HelmRepository 'ns/redpanda-repository' created"));
        Mockito.verify(events).info(any(), eq("HelmRepository 'ns/redpanda-repository' is not ready"));
        Mockito.verify(events).info(any(), eq("HelmRepository 'ns/redpanda-repository' is ready"));
        Mockito.verify(events).info(any(), eq("HelmRelease 'ns/basic' created"));
        Mockito.verify(events).info(any(), eq("HelmRelease 'ns/basic' is not ready"));
        Mockito.verify(events).info(any(), eq("HelmRelease 'ns/basic' is ready"));
        Mockito.verifyNoMoreInteractions(events);
    }

    @Test
    void testSteadyStateIsIdempotent() {
        deployed();
        Mockito.clearInvocations(events, repositoryClient, releaseClient);
        Redpanda before = Serialization.clone(stored());

        assertTrue(reconciliation.reconcile(KEY).getRequeueAfter().isEmpty());

        Mockito.verifyNoInteractions(events);
        Mockito.verify(repositoryClient, Mockito.never()).create(any());
        Mockito.verify(releaseClient, Mockito.never()).create(any());
        Mockito.verify(releaseClient, Mockito.never()).update(any());
        assertEquals(before.getStatus(), stored().getStatus());
    }

    @Test
    void testSpecChangeUpdatesRelease() {
        deployed();
        Redpanda changed = stored();
        changed.getMetadata().setGeneration(2L);
        changed.getSpec().setChartRef(Serialization.unmarshal("chartVersion: 5.0.2\n",
                ChartRef.class));

        reconciliation.reconcile(KEY);

        assertEquals("5.0.2", releases.get(NAMESPACE + "/basic").getSpec().getChart().getSpec().getVersion());
        assertEquals(2L, stored().getStatus().getObservedGeneration());
        Mockito.verify(events).info(any(), eq("HelmRelease 'ns/basic' updated"));
    }

    @Test
    void testDeletionWaitsForRelease() {
        deployed();
        stored().getMetadata().setDeletionTimestamp(ConditionUtils.iso8601Now());

        assertThrows(DeletionPendingException.class, () -> reconciliation.reconcile(KEY));
        assertThrows(DeletionPendingException.class, () -> reconciliation.reconcile(KEY));

        Mockito.verify(releaseClient, Mockito.times(1)).delete(NAMESPACE, "basic", DeletionPropagation.FOREGROUND);
        assertTrue(stored().hasFinalizer(RedpandaKeys.FINALIZER));

        releases.clear();
        assertTrue(reconciliation.reconcile(KEY).getRequeueAfter().isEmpty());

        assertFalse(stored().hasFinalizer(RedpandaKeys.FINALIZER));
        assertNull(stored().getStatus().getHelmRelease());
        assertNull(stored().getStatus().getHelmRepository());
    }

    @Test
    void testUnmanagedReleasesFinalizer() {
        Redpanda redpanda = OperandTestUtils.redpanda(NAMESPACE, "basic");
        redpanda.getMetadata().setAnnotations(Map.of(RedpandaKeys.Annotations.MANAGED, RedpandaKeys.NOT_MANAGED));
        redpanda.addFinalizer(RedpandaKeys.FINALIZER);
        write(redpandas, redpanda);

        assertTrue(reconciliation.reconcile(KEY).getRequeueAfter().isEmpty());

        assertFalse(stored().hasFinalizer(RedpandaKeys.FINALIZER));
        Mockito.verifyNoInteractions(repositoryClient, releaseClient, events);
    }

    @Test
    void testMigrationFailureDoesNotStopReconciliation() {
        Redpanda redpanda = OperandTestUtils.redpanda(NAMESPACE, "basic", "migration:\n  enabled: true\n");
        write(redpandas, redpanda);
        Mockito.when(migrationManager.migrate(any())).thenThrow(new MigrationException("ns/basic",
                List.of(new MigrationException.StepFailure("pods", new KubernetesClientException("boom")))));

        reconciliation.reconcile(KEY);

        Mockito.verify(migrationManager).migrate(any());
        assertNotNull(repositories.get(NAMESPACE + "/redpanda-repository"));
    }

    @Test
    void testRecordFailure() {
        write(redpandas, OperandTestUtils.redpanda(NAMESPACE, "basic"));

        reconciliation.recordFailure(KEY, new KubernetesClientException("forbidden"));

        assertEquals("False", ready().getStatus());
        assertEquals("Error", ready().getReason());
        assertEquals("forbidden", ready().getMessage());
    }
}
