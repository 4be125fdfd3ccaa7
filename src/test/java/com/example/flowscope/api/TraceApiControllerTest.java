package com.example.flowscope.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class TraceApiControllerTest {

    private final ObjectMapper om = new ObjectMapper();

    @Autowired
    private TestRestTemplate rest;

    @BeforeEach
    void clearStore() {
        rest.delete("/api/traces");
    }

    private JsonNode json(ResponseEntity<String> res) throws Exception {
        return om.readTree(res.getBody());
    }

    private void startAndComplete(String id) {
        rest.postForEntity("/api/traces", Map.of("eventId", id, "eventType", "click"), String.class);
        rest.postForEntity("/api/traces/" + id + "/checkpoints", Map.of("name", "frontend_emit"), Void.class);
        rest.postForEntity("/api/traces/" + id + "/checkpoints", Map.of("name", "backend_receive"), Void.class);
        rest.postForEntity("/api/traces/" + id + "/complete", null, String.class);
    }

    @Test
    void traceLifecycle() throws Exception {
        ResponseEntity<String> started = rest.postForEntity("/api/traces",
                Map.of("eventId", "evt-1", "eventType", "click", "metadata", Map.of("x", 3)), String.class);
        assertThat(started.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(json(started).get("eventId").asText()).isEqualTo("evt-1");
        assertThat(json(started).get("completed").asBoolean()).isFalse();

        ResponseEntity<Void> cp = rest.postForEntity("/api/traces/evt-1/checkpoints",
                Map.of("name", "frontend_emit", "metadata", Map.of("seq", 1)), Void.class);
        assertThat(cp.getStatusCode()).isEqualTo(HttpStatus.NO_CONTENT);

        ResponseEntity<String> done = rest.postForEntity("/api/traces/evt-1/complete", null, String.class);
        assertThat(done.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(json(done).get("completed").asBoolean()).isTrue();

        JsonNode fetched = json(rest.getForEntity("/api/traces/evt-1", String.class));
        assertThat(fetched.get("checkpoints")).hasSize(2);
        assertThat(fetched.get("checkpoints").get(0).get("name").asText()).isEqualTo("trace_start");
        assertThat(fetched.get("checkpoints").get(1).get("metadata").get("seq").asInt()).isEqualTo(1);

        assertThat(json(rest.getForEntity("/api/traces", String.class))).hasSize(1);
    }

    @Test
    void unknownTraceIs404() throws Exception {
        ResponseEntity<String> get = rest.getForEntity("/api/traces/missing", String.class);
        assertThat(get.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
        assertThat(json(get).get("error").asText()).isEqualTo("not_found");

        ResponseEntity<String> complete = rest.postForEntity("/api/traces/missing/complete", null, String.class);
        assertThat(complete.getStatusCode()).isEqualTo(HttpStatus.NOT_FOUND);
    }

    @Test
    void missingEventIdIs400() throws Exception {
        ResponseEntity<String> res = rest.postForEntity("/api/traces", Map.of("eventType", "click"), String.class);

        assertThat(res.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(json(res).get("error").asText()).isEqualTo("bad_request");
    }

    @Test
    void blankCheckpointNameIs400() {
        rest.postForEntity("/api/traces", Map.of("eventId", "evt-1"), String.class);

        ResponseEntity<String> res = rest.postForEntity("/api/traces/evt-1/checkpoints", Map.of("name", " "), String.class);

        assertThat(res.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    }

    @Test
    void checkpointOnUnknownIdOpensATrace() throws Exception {
        rest.postForEntity("/api/traces/late/checkpoints", Map.of("name", "backend_receive"), Void.class);

        JsonNode trace = json(rest.getForEntity("/api/traces/late", String.class));
        assertThat(trace.get("eventType").asText()).isEqualTo("unknown");
    }

    @Test
    void analysisEndpoints() throws Exception {
        startAndComplete("a");
        startAndComplete("b");

        JsonNode flow = json(rest.getForEntity("/api/traces/flow", String.class));
        assertThat(flow.get("totalEvents").asInt()).isEqualTo(2);
        assertThat(flow.get("completedEvents").asInt()).isEqualTo(2);
        assertThat(flow.get("lostEvents").asInt()).isZero();

        JsonNode latencies = json(rest.getForEntity("/api/traces/latencies", String.class));
        assertThat(latencies.has("frontend_emit -> backend_receive")).isTrue();
        assertThat(latencies.get("frontend_emit -> backend_receive").get("count").asInt()).isEqualTo(2);

        JsonNode bottleneck = json(rest.getForEntity("/api/traces/bottleneck", String.class));
        assertThat(bottleneck.get("bottleneck_stage").asText()).isNotBlank();

        JsonNode compare = json(rest.getForEntity("/api/traces/compare?a=a&b=b", String.class));
        assertThat(compare.get("frontend_emit -> backend_receive").has("diff_pct")).isTrue();

        assertThat(json(rest.getForEntity("/api/traces/throughput?windowSec=60", String.class))).hasSize(1);
        assertThat(json(rest.getForEntity("/api/traces/anomalies", String.class)).isArray()).isTrue();
        assertThat(json(rest.getForEntity("/api/traces/lost?timeoutSec=0", String.class))).isEmpty();

        JsonNode stats = json(rest.getForEntity("/api/traces/stats", String.class));
        assertThat(stats.get("total_traces").asInt()).isEqualTo(2);
        assertThat(stats.get("max_traces").asInt()).isEqualTo(10000);
    }

    @Test
    void invalidThroughputWindowIs400() {
        ResponseEntity<String> res = rest.getForEntity("/api/traces/throughput?windowSec=0", String.class);

        assertThat(res.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
    }

    @Test
    void throughputWindowTooFineForTheRangeIs400() throws Exception {
        rest.postForEntity("/api/traces", Map.of("eventId", "early"), String.class);
        Thread.sleep(20);
        rest.postForEntity("/api/traces", Map.of("eventId", "late"), String.class);

        ResponseEntity<String> res = rest.getForEntity("/api/traces/throughput?windowSec=1e-9", String.class);

        assertThat(res.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(json(res).get("error").asText()).isEqualTo("bad_request");
    }

    @Test
    void reportIsPlainText() {
        startAndComplete("a");

        ResponseEntity<String> res = rest.getForEntity("/api/traces/report", String.class);

        assertThat(res.getHeaders().getContentType().toString()).startsWith("text/plain");
        assertThat(res.getBody()).contains("Total Events: 1").contains("Bottleneck Stage: ");
    }

    @Test
    void exports() throws Exception {
        startAndComplete("a");

        JsonNode chrome = json(rest.getForEntity("/api/traces/export/chrome", String.class));
        // 3 checkpoints: metadata + 2 spans + 3 instants
        assertThat(chrome.get("traceEvents")).hasSize(6);

        ResponseEntity<String> html = rest.getForEntity("/api/traces/export/html", String.class);
        assertThat(html.getHeaders().getContentType().toString()).startsWith("text/html");
        assertThat(html.getBody()).contains("Event Timeline").contains("\"event_id\":\"a\"");
    }

    @Test
    void clearEmptiesTheStore() throws Exception {
        startAndComplete("a");

        rest.delete("/api/traces");

        assertThat(json(rest.getForEntity("/api/traces", String.class))).isEmpty();
    }

    @Test
    void dashboardPageIsServed() {
        ResponseEntity<String> res = rest.getForEntity("/", String.class);

        assertThat(res.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(res.getBody()).contains("Performance Dashboard").contains("const wsPath");
    }
}
