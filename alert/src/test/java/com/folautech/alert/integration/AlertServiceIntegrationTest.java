package com.folautech.alert.integration;

import com.folautech.alert.model.EvaluationResponse;
import com.folautech.alert.model.RangeResponse;
import com.folautech.metric.model.MetricKind;
import com.folautech.metric.model.Severity;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@ActiveProfiles("test")
class AlertServiceIntegrationTest {

    @LocalServerPort
    private int port;

    private WebTestClient webTestClient;

    @BeforeEach
    void setUp() {
        webTestClient = WebTestClient.bindToServer()
                .baseUrl("http://localhost:" + port)
                .responseTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Test
    @DisplayName("End-to-end test: heart rate batch yields CRITICAL then ABNORMAL alert")
    void testHeartRateBatch() {
        String patientId = "p-test-" + UUID.randomUUID();
        String takenAt = LocalDateTime.now().withNano(0).toString();

        String requestBody = """
            [
                {"readingId": "r-1", "patientId": "%1$s", "metricType": "HEART_RATE", "value": 75, "takenAt": "%2$s"},
                {"readingId": "r-2", "patientId": "%1$s", "metricType": "HEART_RATE", "value": 35, "takenAt": "%2$s"},
                {"readingId": "r-3", "patientId": "%1$s", "metricType": "HEART_RATE", "value": 110, "takenAt": "%2$s"}
            ]
            """.formatted(patientId, takenAt);

        webTestClient.post()
                .uri("/evaluate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(requestBody)
                .exchange()
                .expectStatus().isOk()
                .expectBody(EvaluationResponse.class)
                .value(response -> {
                    assertThat(response.getAlerts()).hasSize(2);
                    assertThat(response.getAlerts().get(0).getReadingId()).isEqualTo("r-2");
                    assertThat(response.getAlerts().get(0).getSeverity()).isEqualTo(Severity.CRITICAL);
                    assertThat(response.getAlerts().get(0).getViolatedRange().getMin()).isEqualTo(40);
                    assertThat(response.getAlerts().get(1).getReadingId()).isEqualTo("r-3");
                    assertThat(response.getAlerts().get(1).getSeverity()).isEqualTo(Severity.ABNORMAL);
                    assertThat(response.getAlerts().get(1).getPatientId()).isEqualTo(patientId);
                    assertThat(response.getAlerts().get(1).getTakenAt()).isEqualTo(LocalDateTime.parse(takenAt));
                });
    }

    @ParameterizedTest
    @DisplayName("Metric types trigger the expected tier")
    @CsvSource({
        "BLOOD_PRESSURE_SYSTOLIC, 130, ABNORMAL, 90, 120",
        "BLOOD_PRESSURE_DIASTOLIC, 125, CRITICAL, 40, 120",
        "BLOOD_GLUCOSE_RANDOM, 260, CRITICAL, 54, 250",
        "TEMPERATURE, 34.5, CRITICAL, 35, 39.5",
        "OXYGEN_SATURATION, 90, ABNORMAL, 95, 100",
        "BMI, 27, ABNORMAL, 18.5, 24.9",
        "CHOLESTEROL_HDL, 150, ABNORMAL, 40, 100",
        "WEIGHT, 20, ABNORMAL, 40, 150"
    })
    void testMetricTypes(String metricType, double value, Severity expected, double violatedMin, double violatedMax) {
        String requestBody = """
            [{"readingId": "%s", "metricType": "%s", "value": %s}]
            """.formatted(UUID.randomUUID(), metricType, value);

        webTestClient.post()
                .uri("/evaluate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(requestBody)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.alerts.length()").isEqualTo(1)
                .jsonPath("$.alerts[0].severity").isEqualTo(expected.name())
                .jsonPath("$.alerts[0].violatedRange.min").isEqualTo(violatedMin)
                .jsonPath("$.alerts[0].violatedRange.max").isEqualTo(violatedMax);
    }

    @Test
    @DisplayName("Invalid and unknown readings are reported without suppressing other alerts")
    void testPartialBatch() {
        String requestBody = """
            [
                {"readingId": "r-1", "metricType": "PULSE_PRESSURE", "value": 45},
                {"readingId": "r-2", "metricType": "HEART_RATE"},
                {"readingId": "r-3", "metricType": "RESPIRATORY_RATE", "value": 6}
            ]
            """;

        webTestClient.post()
                .uri("/evaluate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(requestBody)
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.alerts.length()").isEqualTo(1)
                .jsonPath("$.alerts[0].readingId").isEqualTo("r-3")
                .jsonPath("$.alerts[0].severity").isEqualTo("CRITICAL")
                .jsonPath("$.unrecognized[0].readingId").isEqualTo("r-1")
                .jsonPath("$.unrecognized[0].code").isEqualTo("UNKNOWN_METRIC_TYPE")
                .jsonPath("$.rejected[0].readingId").isEqualTo("r-2")
                .jsonPath("$.rejected[0].code").isEqualTo("MISSING_VALUE");
    }

    @Test
    @DisplayName("Empty batch returns no alerts")
    void testEmptyBatch() {
        webTestClient.post()
                .uri("/evaluate")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("[]")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.alerts.length()").isEqualTo(0)
                .jsonPath("$.criticalCount").isEqualTo(0);
    }

    @Test
    @DisplayName("Classify endpoint distinguishes unrecognized metric types")
    void testClassifyUnrecognized() {
        webTestClient.get()
                .uri("/classify?metricType=PULSE_PRESSURE&value=500")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.severity").isEqualTo("NORMAL")
                .jsonPath("$.recognized").isEqualTo(false);
    }

    @Test
    @DisplayName("Classify endpoint rejects non-finite values")
    void testClassifyInfinity() {
        webTestClient.get()
                .uri("/classify?metricType=HEART_RATE&value=Infinity")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.code").isEqualTo("INVALID_VALUE");
    }

    @Test
    @DisplayName("Ranges endpoint exposes the loaded catalog")
    void testRanges() {
        webTestClient.get()
                .uri("/ranges")
                .exchange()
                .expectStatus().isOk()
                .expectBodyList(RangeResponse.class)
                .hasSize(MetricKind.values().length);

        webTestClient.get()
                .uri("/ranges/heart_rate")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.label").isEqualTo("Heart Rate")
                .jsonPath("$.critical.min").isEqualTo(40.0);
    }
}
