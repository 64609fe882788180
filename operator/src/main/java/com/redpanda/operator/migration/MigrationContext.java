package com.redpanda.operator.migration;

import com.redpanda.common.VectorizedResourceClient;
import com.redpanda.operator.events.EventRecorder;
import com.redpanda.operator.resources.v1alpha1.Redpanda;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.client.KubernetesClient;
import org.jboss.logging.Logger;

/**
 * What a {@link MigrationStep} works with during one migration pass
 */
public class MigrationContext {

    private final Redpanda redpanda;
    private final KubernetesClient kubernetesClient;
    private final VectorizedResourceClient vectorizedClient;
    private final EventRecorder events;
    private final Logger log;

    public MigrationContext(Redpanda redpanda, KubernetesClient kubernetesClient,
            VectorizedResourceClient vectorizedClient, EventRecorder events, Logger log) {
        this.redpanda = redpanda;
        this.kubernetesClient = kubernetesClient;
        this.vectorizedClient = vectorizedClient;
        this.events = events;
        this.log = log;
    }

    public Redpanda getRedpanda() {
        return redpanda;
    }

    public KubernetesClient getKubernetesClient() {
        return kubernetesClient;
    }

    public VectorizedResourceClient getVectorizedClient() {
        return vectorizedClient;
    }

    public Logger getLog() {
        return log;
    }

    public String getNamespace() {
        return redpanda.getMetadata().getNamespace();
    }

    public String getResourcesName() {
        return redpanda.getResourcesName();
    }

    public String getConsoleResourcesName() {
        return redpanda.getConsoleResourcesName();
    }

    /**
     * Informational event on the mutated object, tagged with the last attempted revision
     */
    public void mutated(HasMetadata object, String message) {
        log.debugf("%s %s/%s: labels %s, annotations %s", message, object.getMetadata().getNamespace(),
                object.getMetadata().getName(), object.getMetadata().getLabels(), object.getMetadata().getAnnotations());
        events.record(object, redpanda.getStatus().getLastAttemptedRevision(), EventRecorder.Severity.INFO, message);
    }
}
