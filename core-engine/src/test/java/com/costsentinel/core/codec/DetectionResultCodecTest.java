package com.costsentinel.core.codec;

import com.costsentinel.core.config.DetectionConfig;
import com.costsentinel.core.config.TaxonomyLoader;
import com.costsentinel.core.engine.CostAnomalyEngine;
import com.costsentinel.core.model.CostObservation;
import com.costsentinel.core.model.CustomEvent;
import com.costsentinel.core.model.DetectionMethod;
import com.costsentinel.core.model.DetectionRequest;
import com.costsentinel.core.model.DetectionResult;
import com.costsentinel.core.model.UtilizationObservation;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static com.costsentinel.core.CostFixtures.ec2Spike;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link DetectionResultCodec}.
 */
class DetectionResultCodecTest {

    private DetectionResultCodec codec;

    @BeforeEach
    void setUp() {
        codec = new DetectionResultCodec();
    }

    // ---------------------------------------------------------------
    // Reading
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should read cost rows with defaults for missing names")
    void shouldReadObservations() {
        List<CostObservation> observations = codec.readObservations("""
                [
                  {"date": "2024-01-01", "cost": 12.5, "service": "EC2", "provider": "AWS", "extra": true},
                  {"date": "2024-01-02", "cost": null},
                  {"cost": 3}
                ]
                """);

        assertThat(observations).hasSize(3);
        assertThat(observations.get(0).getCost()).isEqualByComparingTo(new BigDecimal("12.5"));
        assertThat(observations.get(1).hasCost()).isFalse();
        assertThat(observations.get(1).getService()).isEqualTo(CostObservation.UNKNOWN);
        assertThat(observations.get(2).getDate()).isNull();
    }

    @Test
    @DisplayName("Should read a full request with side data")
    void shouldReadRequest() {
        DetectionRequest request = codec.readRequest("""
                {
                  "cost_data": [{"date": "2024-01-05", "cost": 500, "service": "EC2", "provider": "AWS"}],
                  "method": "isolation_forest",
                  "threshold": 2.5,
                  "analyze_cloud_context": false,
                  "utilization_data": [
                    {"date": "2024-01-05", "service": "EC2", "resource_id": "i-1", "instance_count": 12, "zone": "a"}
                  ],
                  "custom_events": {
                    "release": {"date": "2024-01-04", "services": ["EC2"], "ticket": "OPS-7"}
                  }
                }
                """);

        assertThat(request.getObservations()).hasSize(1);
        assertThat(request.getMethod()).contains(DetectionMethod.ISOLATION);
        assertThat(request.getThreshold()).hasValue(2.5);
        assertThat(request.isAnalyzeRootCause()).isTrue();
        assertThat(request.isAnalyzeCloudContext()).isFalse();

        UtilizationObservation row = request.getUtilization().get(0);
        assertThat(row.getResourceId()).isEqualTo("i-1");
        assertThat(row.getMetric("instance_count")).hasValue(12.0);
        assertThat(row.getMetrics()).doesNotContainKey("zone");

        CustomEvent event = request.getCustomEvents().get(0);
        assertThat(event.getName()).isEqualTo("release");
        assertThat(event.getDate()).isEqualTo(LocalDate.of(2024, 1, 4));
        assertThat(event.getAttributes()).containsEntry("ticket", "OPS-7");
    }

    @Test
    @DisplayName("Absent request fields should take the defaults")
    void shouldApplyRequestDefaults() {
        DetectionRequest request = codec.readRequest("{\"cost_data\": []}");

        assertThat(request.getMethod()).contains(DetectionMethod.ENSEMBLE);
        assertThat(request.getThreshold()).isEmpty();
        assertThat(request.getCustomEvents()).isEmpty();
    }

    @Test
    @DisplayName("Should reject malformed or invalid input")
    void shouldRejectInvalidInput() {
        assertThatThrownBy(() -> codec.readObservations("[{"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Malformed JSON");
        assertThatThrownBy(() -> codec.readObservations("{\"cost\": 1}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("array");
        assertThatThrownBy(() -> codec.readObservations("[{\"date\": \"2024-01-01\", \"cost\": -4}]"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageStartingWith("Invalid cost data");
        assertThatThrownBy(() -> codec.readRequest("{\"threshold\": \"high\"}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("threshold must be a number");
        assertThatThrownBy(() -> codec.readCustomEvents("{\"release\": {\"services\": []}}"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("requires a 'date'");
    }

    // ---------------------------------------------------------------
    // Writing
    // ---------------------------------------------------------------

    @Test
    @DisplayName("Should write results with snake_case fields and ISO dates")
    void shouldWriteResult() throws Exception {
        CostAnomalyEngine engine = new CostAnomalyEngine(DetectionConfig.defaults(), TaxonomyLoader.bundled(),
                Clock.fixed(Instant.parse("2024-02-01T08:00:00Z"), ZoneOffset.UTC), null);
        DetectionResult result = engine.detect(ec2Spike(), "zscore", 2.0, true);

        JsonNode json = new ObjectMapper().readTree(codec.write(result));

        assertThat(json.get("success").asBoolean()).isTrue();
        assertThat(json.get("detection_method").asText()).isEqualTo("zscore");
        assertThat(json.get("method_name").asText()).isEqualTo("Z-Score Statistical");
        assertThat(json.get("anomaly_count").asInt()).isEqualTo(1);
        assertThat(json.get("data_points").asInt()).isEqualTo(7);
        assertThat(json.get("detection_timestamp").asText()).isEqualTo("2024-02-01T08:00:00Z");
        assertThat(json.get("cloud_context_applied").asBoolean()).isTrue();
        assertThat(json.has("error")).isFalse();

        JsonNode anomaly = json.get("anomalies").get(0);
        assertThat(anomaly.get("date").asText()).isEqualTo("2024-01-05");
        assertThat(anomaly.get("baseline_cost").asDouble()).isEqualTo(100.5);
        assertThat(anomaly.get("percentage_increase").asDouble()).isEqualTo(397.51);
        assertThat(anomaly.get("detection_methods").get(0).asText()).isEqualTo("zscore");
        assertThat(anomaly.get("root_cause").get("primary_cause").asText()).startsWith("Extreme cost spike");
        assertThat(anomaly.get("cloud_context").get("pattern_type").asText()).isEqualTo("temporary_spike");
        assertThat(anomaly.get("cloud_context").get("probable_causes").get(0).get("confidence").asText())
                .isEqualTo("high");
    }
}
