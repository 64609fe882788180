package com.redpanda.operator.events;

import com.redpanda.operator.RedpandaKeys;
import com.redpanda.operator.operands.OperandTestUtils;
import com.redpanda.operator.resources.v1alpha1.Redpanda;
import io.fabric8.kubernetes.api.model.Event;
import io.fabric8.kubernetes.api.model.EventBuilder;
import io.fabric8.kubernetes.client.KubernetesClient;
import io.fabric8.kubernetes.client.server.mock.EnableKubernetesMockClient;
import io.fabric8.kubernetes.client.server.mock.KubernetesMockServer;
import io.fabric8.kubernetes.client.utils.Serialization;
import org.jboss.logging.Logger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.HttpURLConnection;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@EnableKubernetesMockClient(https = false)
class EventRecorderTest {

    static KubernetesClient client;
    static KubernetesMockServer server;

    EventRecorder recorder;

    @BeforeEach
    void setup() {
        recorder = new EventRecorder();
        recorder.log = Logger.getLogger(EventRecorder.class);
        recorder.kubernetesClient = client;
    }

    private static Event lastEvent() throws Exception {
        return Serialization.unmarshal(server.getLastRequest().getBody().readUtf8(), Event.class);
    }

    @Test
    void testInfoEventCarriesRevision() throws Exception {
        server.expect().post().withPath("/api/v1/namespaces/events/events")
                .andReturn(HttpURLConnection.HTTP_CREATED, new EventBuilder().withNewMetadata().withName("basic.1").endMetadata().build())
                .once();
        Redpanda redpanda = OperandTestUtils.redpanda("events", "basic");
        redpanda.getStatus().setLastAttemptedRevision("5.0.1");

        recorder.info(redpanda, "HelmRelease 'events/basic' created");

        Event event = lastEvent();
        assertEquals("basic.", event.getMetadata().getGenerateName());
        assertEquals("Normal", event.getType());
        assertEquals("info", event.getReason());
        assertEquals("HelmRelease 'events/basic' created", event.getMessage());
        assertEquals("5.0.1", event.getMetadata().getAnnotations().get(RedpandaKeys.Annotations.REVISION));
        assertEquals("Redpanda", event.getInvolvedObject().getKind());
        assertEquals("basic", event.getInvolvedObject().getName());
        assertEquals("uid-basic", event.getInvolvedObject().getUid());
        assertEquals(EventRecorder.COMPONENT, event.getSource().getComponent());
    }

    @Test
    void testErrorEventWithoutRevision() throws Exception {
        server.expect().post().withPath("/api/v1/namespaces/errors/events")
                .andReturn(HttpURLConnection.HTTP_CREATED, new EventBuilder().withNewMetadata().withName("basic.2").endMetadata().build())
                .once();
        Redpanda redpanda = OperandTestUtils.redpanda("errors", "basic");

        recorder.error(redpanda, "error getting HelmRepository: forbidden");

        Event event = lastEvent();
        assertEquals("Warning", event.getType());
        assertEquals("error", event.getReason());
        assertTrue(event.getMetadata().getAnnotations() == null || event.getMetadata().getAnnotations().isEmpty());
    }

    @Test
    void testFailureIsNotPropagated() {
        server.expect().post().withPath("/api/v1/namespaces/failing/events")
                .andReturn(HttpURLConnection.HTTP_FORBIDDEN, "forbidden")
                .once();
        Redpanda redpanda = OperandTestUtils.redpanda("failing", "basic");

        assertDoesNotThrow(() -> recorder.info(redpanda, "ignored"));
    }
}
