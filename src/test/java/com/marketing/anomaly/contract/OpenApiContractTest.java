package com.marketing.anomaly.contract;

import com.marketing.anomaly.config.TestAerospikeConfig;
import com.jayway.jsonpath.DocumentContext;
import com.jayway.jsonpath.JsonPath;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.context.annotation.Import;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.ActiveProfiles;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Contract test that validates the OpenAPI document structure.
 * Ensures all endpoints and critical schemas are present,
 * protecting dashboard consumers from accidental schema drift.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@Import(TestAerospikeConfig.class)
@ActiveProfiles("test")
class OpenApiContractTest {

    @Autowired
    private TestRestTemplate restTemplate;

    @Test
    void openApiSpec_isAccessible() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody()).isNotEmpty();
    }

    @Test
    void openApiSpec_containsAllEndpointPaths() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        DocumentContext json = JsonPath.parse(response.getBody());
        Map<String, Object> paths = json.read("$.paths");

        assertThat(paths).containsKey("/api/v1/anomalies/baseline");
        assertThat(paths).containsKey("/api/v1/anomalies/monitor");
        assertThat(paths).containsKey("/api/v1/anomalies/detect");
        assertThat(paths).containsKey("/api/v1/anomalies/alerts");
        assertThat(paths).containsKey("/api/v1/anomalies/context/{metric}");
        assertThat(paths).containsKey("/api/v1/anomalies/report");
        assertThat(paths).containsKey("/api/v1/anomalies/summary");
        assertThat(paths).containsKey("/api/v1/anomalies/metrics");
        assertThat(paths).containsKey("/api/v1/anomalies/methods");
        assertThat(paths).containsKey("/api/v1/anomalies/cache/clear");
    }

    @Test
    void openApiSpec_detectSupportsGetAndPost() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        DocumentContext json = JsonPath.parse(response.getBody());
        Map<String, Object> detect = json.read("$.paths['/api/v1/anomalies/detect']");

        assertThat(detect).containsKeys("get", "post");
    }

    @Test
    void openApiSpec_containsCriticalSchemas() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        DocumentContext json = JsonPath.parse(response.getBody());
        Map<String, Object> schemas = json.read("$.components.schemas");

        assertThat(schemas).containsKey("Baseline");
        assertThat(schemas).containsKey("Statistics");
        assertThat(schemas).containsKey("AnomalyDetectionResult");
        assertThat(schemas).containsKey("Anomaly");
        assertThat(schemas).containsKey("Alert");
        assertThat(schemas).containsKey("AnomalyReport");
        assertThat(schemas).containsKey("AnomalyContext");
        assertThat(schemas).containsKey("AlertGenerationRequest");
    }

    @Test
    void openApiSpec_resultSchemas_haveRequiredFields() {
        ResponseEntity<String> response = restTemplate.getForEntity("/v3/api-docs", String.class);
        DocumentContext json = JsonPath.parse(response.getBody());

        Map<String, Object> baselineProps = json.read("$.components.schemas.Baseline.properties");
        assertThat(baselineProps).containsKey("metric");
        assertThat(baselineProps).containsKey("dataPoints");
        assertThat(baselineProps).containsKey("statistics");
        assertThat(baselineProps).containsKey("values");
        assertThat(baselineProps).containsKey("timestamps");

        Map<String, Object> resultProps = json.read("$.components.schemas.AnomalyDetectionResult.properties");
        assertThat(resultProps).containsKey("totalAnomalies");
        assertThat(resultProps).containsKey("anomalies");
        assertThat(resultProps).containsKey("severityCounts");
        assertThat(resultProps).containsKey("statistics");
    }
}
