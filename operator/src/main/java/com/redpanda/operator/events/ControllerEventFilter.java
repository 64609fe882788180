package com.redpanda.operator.events;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.fabric8.kubernetes.api.model.HasMetadata;
import io.fabric8.kubernetes.api.model.ObjectMeta;
import io.fabric8.kubernetes.client.utils.Serialization;
import io.fabric8.zjsonpatch.JsonDiff;
import io.javaoperatorsdk.operator.processing.event.source.filter.OnUpdateFilter;
import org.jboss.logging.Logger;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Update filter of the {@code Redpanda} controller, see
 * {@link io.javaoperatorsdk.operator.api.reconciler.ControllerConfiguration#onUpdateFilter onUpdateFilter}.
 * An update passes when one of the {@link #TRACKED} metadata attributes differs. Status only updates,
 * including the ones the reconciliation writes on every pass, are dropped.
 */
public class ControllerEventFilter implements OnUpdateFilter<HasMetadata> {

    private static final Logger log = Logger.getLogger(ControllerEventFilter.class);

    static final Map<String, Function<ObjectMeta, Object>> TRACKED;

    static {
        Map<String, Function<ObjectMeta, Object>> tracked = new LinkedHashMap<>();
        tracked.put("generation", ObjectMeta::getGeneration);
        tracked.put("annotations", meta -> orEmpty(meta.getAnnotations()));
        tracked.put("labels", meta -> orEmpty(meta.getLabels()));
        tracked.put("finalizers", meta -> Optional.ofNullable(meta.getFinalizers()).orElse(Collections.emptyList()));
        // the only attribute a delete request changes on a resource holding our finalizer
        tracked.put("deletionTimestamp", ObjectMeta::getDeletionTimestamp);
        TRACKED = Collections.unmodifiableMap(tracked);
    }

    @Override
    public boolean accept(HasMetadata newResource, HasMetadata oldResource) {
        if (oldResource == null) {
            return true;
        }

        List<String> changed = changedAttributes(oldResource.getMetadata(), newResource.getMetadata());
        if (changed.isEmpty()) {
            return false;
        }

        if (log.isDebugEnabled()) {
            ObjectMapper objectMapper = Serialization.yamlMapper();
            JsonNode patch = JsonDiff.asJson(objectMapper.convertValue(oldResource, JsonNode.class),
                    objectMapper.convertValue(newResource, JsonNode.class));
            log.debugf("%s %s/%s changed %s =>\n%s", newResource.getKind(), newResource.getMetadata().getNamespace(),
                    newResource.getMetadata().getName(), changed, patch.toPrettyString());
        }
        return true;
    }

    /**
     * @return names of the tracked attributes that differ, in {@link #TRACKED} order
     */
    static List<String> changedAttributes(ObjectMeta oldMeta, ObjectMeta newMeta) {
        ObjectMeta before = Optional.ofNullable(oldMeta).orElseGet(ObjectMeta::new);
        ObjectMeta after = Optional.ofNullable(newMeta).orElseGet(ObjectMeta::new);
        return TRACKED.entrySet()
                .stream()
                .filter(e -> !Objects.equals(e.getValue().apply(before), e.getValue().apply(after)))
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());
    }

    private static Map<String, String> orEmpty(Map<String, String> map) {
        return map == null ? Collections.emptyMap() : map;
    }
}
