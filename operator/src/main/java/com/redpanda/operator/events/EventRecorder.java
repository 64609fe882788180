package com.redpanda.operator.events;

import com.redpanda.common.ConditionUtils;
import com.redpanda.operator.RedpandaKeys;
import com.redpanda.operator.resources.v1alpha1.Redpanda;
import io.fabric8.kubernetes.api.model.Event;
import io.fabric8.kubernetes.api.model.EventBuilder;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.KubernetesClientException;
import org.jboss.logging.Logger;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import java.util.Map;

/**
 * Emits core/v1 Events attached to the affected object. Events are best effort, a failure to
 * record one is logged and never fails the reconciliation.
 */
@ApplicationScoped
public class EventRecorder {

    static final String COMPONENT = "redpanda-operator";

    public enum Severity {
        INFO("info", "Normal"),
        ERROR("error", "Warning");

        private final String reason;
        private final String type;

        Severity(String reason, String type) {
            this.reason = reason;
            this.type = type;
        }

        public String getReason() {
            return reason;
        }

        public String getType() {
            return type;
        }
    }

    @Inject
    Logger log;

    @Inject
    KubernetesClient kubernetesClient;

    public void info(Redpanda redpanda, String message) {
        record(redpanda, redpanda.getStatus().getLastAttemptedRevision(), Severity.INFO, message);
    }

    public void error(Redpanda redpanda, String message) {
        record(redpanda, redpanda.getStatus().getLastAttemptedRevision(), Severity.ERROR, message);
    }

    /**
     * @param involved object the event is about
     * @param revision last attempted revision of the release, omitted when empty
     */
    public void record(HasMetadata involved, String revision, Severity severity, String message) {
        String namespace = involved.getMetadata().getNamespace();
        String now = ConditionUtils.iso8601Now();

        Event event = new EventBuilder()
                .withNewMetadata()
                    .withGenerateName(involved.getMetadata().getName() + ".")
                    .withNamespace(namespace)
                    .withAnnotations(revision == null || revision.isEmpty() ? null : Map.of(RedpandaKeys.Annotations.REVISION, revision))
                .endMetadata()
                .withNewInvolvedObject()
                    .withApiVersion(involved.getApiVersion())
                    .withKind(involved.getKind())
                    .withName(involved.getMetadata().getName())
                    .withNamespace(namespace)
                    .withUid(involved.getMetadata().getUid())
                    .withResourceVersion(involved.getMetadata().getResourceVersion())
                .endInvolvedObject()
                .withType(severity.getType())
                .withReason(severity.getReason())
                .withMessage(message)
                .withFirstTimestamp(now)
                .withLastTimestamp(now)
                .withCount(1)
                .withNewSource()
                    .withComponent(COMPONENT)
                .endSource()
                .withReportingComponent(COMPONENT)
                .build();

        log.debugf("Recording %s event on %s %s/%s: %s", severity.getReason(), involved.getKind(), namespace,
                involved.getMetadata().getName(), message);
        try {
            kubernetesClient.v1().events().inNamespace(namespace).resource(event).create();
        } catch (KubernetesClientException e) {
            log.errorf(e, "Error creating event on %s %s/%s", involved.getKind(), namespace, involved.getMetadata().getName());
        }
    }
}
