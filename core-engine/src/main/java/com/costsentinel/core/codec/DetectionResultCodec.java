package com.costsentinel.core.codec;

import com.costsentinel.core.model.CostObservation;
import com.costsentinel.core.model.CustomEvent;
import com.costsentinel.core.model.DetectionRequest;
import com.costsentinel.core.model.DetectionResult;
import com.costsentinel.core.model.UtilizationObservation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * JSON contract of the engine for its HTTP collaborator.
 *
 * <ul>
 * <li>Writes {@link DetectionResult} with snake_case fields and ISO-8601
 * dates.</li>
 * <li>Reads cost observations, utilization rows, the custom-event map
 * {@code {name: {date, services, description, ...}}} and whole detection
 * requests.</li>
 * </ul>
 *
 * <p>
 * Unknown properties are ignored. Malformed input is rejected with
 * {@link IllegalArgumentException}. The codec is thread-safe once
 * constructed.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionResultCodec {

    private static final Logger LOG = LoggerFactory.getLogger(DetectionResultCodec.class);

    private static final TypeReference<List<CostObservation>> OBSERVATIONS = new TypeReference<>() {
    };
    private static final TypeReference<List<UtilizationObservation>> UTILIZATION = new TypeReference<>() {
    };

    private final ObjectMapper mapper;

    public DetectionResultCodec() {
        this.mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    // ---------------------------------------------------------------
    // Writing
    // ---------------------------------------------------------------

    /**
     * @param result detection result; must not be {@code null}
     * @return the JSON document
     * @throws IllegalStateException if the result cannot be serialized
     */
    public String write(DetectionResult result) {
        Objects.requireNonNull(result, "DetectionResult must not be null");
        try {
            return mapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            LOG.error("Failed to serialize detection result: {}", e.getMessage(), e);
            throw new IllegalStateException("Failed to serialize detection result", e);
        }
    }

    // ---------------------------------------------------------------
    // Reading
    // ---------------------------------------------------------------

    /**
     * @param json array of {@code {date, cost, service, provider, resource_id}}
     * @return the observations in document order
     */
    public List<CostObservation> readObservations(String json) {
        return readObservations(tree(json));
    }

    /**
     * @param json array of {@code {date, service, resource_id, <metric>...}}
     * @return the rows in document order
     */
    public List<UtilizationObservation> readUtilization(String json) {
        return readUtilization(tree(json));
    }

    /**
     * @param json object {@code {name: {date, services, description, ...}}}
     * @return the events in document order
     */
    public List<CustomEvent> readCustomEvents(String json) {
        return readCustomEvents(tree(json));
    }

    /**
     * Read a whole request:
     *
     * <pre>
     * {
     *   "cost_data": [...],
     *   "method": "ensemble",
     *   "threshold": 2.0,
     *   "analyze_root_cause": true,
     *   "analyze_cloud_context": true,
     *   "utilization_data": [...],
     *   "custom_events": {...}
     * }
     * </pre>
     *
     * Absent fields take the request defaults.
     */
    public DetectionRequest readRequest(String json) {
        JsonNode root = tree(json);
        if (!root.isObject()) {
            throw new IllegalArgumentException("Detection request must be a JSON object");
        }
        DetectionRequest.Builder builder = DetectionRequest.builder()
                .observations(readObservations(root.path("cost_data")));
        if (root.hasNonNull("method")) {
            builder.methodName(root.get("method").asText());
        }
        if (root.hasNonNull("threshold")) {
            JsonNode threshold = root.get("threshold");
            if (!threshold.isNumber()) {
                throw new IllegalArgumentException("threshold must be a number, got: " + threshold);
            }
            builder.threshold(threshold.asDouble());
        }
        if (root.hasNonNull("analyze_root_cause")) {
            builder.analyzeRootCause(root.get("analyze_root_cause").asBoolean());
        }
        if (root.hasNonNull("analyze_cloud_context")) {
            builder.analyzeCloudContext(root.get("analyze_cloud_context").asBoolean());
        }
        if (root.hasNonNull("utilization_data")) {
            builder.utilization(readUtilization(root.get("utilization_data")));
        }
        if (root.hasNonNull("custom_events")) {
            builder.customEvents(readCustomEvents(root.get("custom_events")));
        }
        return builder.build();
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private List<CostObservation> readObservations(JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return List.of();
        }
        requireArray(node, "cost data");
        return convert(node, OBSERVATIONS, "cost data");
    }

    private List<UtilizationObservation> readUtilization(JsonNode node) {
        requireArray(node, "utilization data");
        return convert(node, UTILIZATION, "utilization data");
    }

    private List<CustomEvent> readCustomEvents(JsonNode node) {
        if (!node.isObject()) {
            throw new IllegalArgumentException("Custom events must be a JSON object keyed by event name");
        }
        List<CustomEvent> events = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            events.add(readCustomEvent(field.getKey(), field.getValue()));
        }
        return events;
    }

    private CustomEvent readCustomEvent(String name, JsonNode info) {
        if (!info.isObject() || !info.hasNonNull("date")) {
            throw new IllegalArgumentException("Custom event '" + name + "' requires a 'date'");
        }
        CustomEvent.Builder builder = CustomEvent.builder()
                .name(name)
                .date(convert(info.get("date"), LocalDate.class, "custom event '" + name + "' date"));
        List<String> services = new ArrayList<>();
        for (JsonNode service : info.path("services")) {
            services.add(service.asText());
        }
        builder.services(services);
        if (info.hasNonNull("description")) {
            builder.description(info.get("description").asText());
        }
        Iterator<Map.Entry<String, JsonNode>> fields = info.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String key = field.getKey();
            if (!key.equals("date") && !key.equals("services") && !key.equals("description")) {
                builder.attribute(key, convert(field.getValue(), Object.class, "custom event '" + name + "'"));
            }
        }
        return builder.build();
    }

    private JsonNode tree(String json) {
        Objects.requireNonNull(json, "JSON input must not be null");
        try {
            return mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed JSON: " + e.getOriginalMessage(), e);
        }
    }

    private <T> T convert(JsonNode node, TypeReference<T> type, String what) {
        try {
            return mapper.convertValue(node, type);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid " + what + ": " + e.getMessage(), e);
        }
    }

    private <T> T convert(JsonNode node, Class<T> type, String what) {
        try {
            return mapper.convertValue(node, type);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid " + what + ": " + e.getMessage(), e);
        }
    }

    private static void requireArray(JsonNode node, String what) {
        if (!node.isArray()) {
            throw new IllegalArgumentException("Expected a JSON array of " + what);
        }
    }
}
