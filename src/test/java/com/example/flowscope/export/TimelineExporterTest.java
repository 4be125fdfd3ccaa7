package com.example.flowscope.export;

import com.example.flowscope.MutableClock;
import com.example.flowscope.model.EventTrace;
import com.example.flowscope.store.TraceStore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.ClassLoaderTemplateResolver;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class TimelineExporterTest {

    private final ObjectMapper om = new ObjectMapper();
    private MutableClock clock;
    private TraceStore store;
    private TimelineExporter exporter;

    @BeforeEach
    void setUp() {
        ClassLoaderTemplateResolver resolver = new ClassLoaderTemplateResolver();
        resolver.setPrefix("templates/");
        resolver.setSuffix(".html");
        resolver.setTemplateMode(TemplateMode.HTML);
        resolver.setCharacterEncoding("UTF-8");
        TemplateEngine engine = new TemplateEngine();
        engine.setTemplateResolver(resolver);

        clock = new MutableClock();
        store = new TraceStore(100, true, true, clock);
        exporter = new TimelineExporter(engine);
    }

    private List<EventTrace> twoTraces() {
        store.startTrace("evt-1", "click", Map.of("x", 10));
        clock.advanceMillis(2);
        store.checkpoint("evt-1", "frontend_emit");
        clock.advanceMillis(3);
        store.checkpoint("evt-1", "backend_receive", Map.of("queue", "main"));
        clock.advanceMillis(5);
        store.completeTrace("evt-1");

        store.startTrace("evt-2", "type");
        clock.advanceMillis(4);
        store.checkpoint("evt-2", "frontend_emit");
        return store.getAllTraces();
    }

    @Test
    void emitsTwoEventsPerCheckpointForEachTrace() {
        List<EventTrace> traces = twoTraces();

        JsonNode root = exporter.toChromeTrace(traces);

        // evt-1 has 3 checkpoints, evt-2 has 2
        assertThat(root.get("traceEvents")).hasSize(2 * 3 + 2 * 2);
        assertThat(root.get("displayTimeUnit").asText()).isEqualTo("ms");
        assertThat(root.get("otherData").get("version").asText()).isEqualTo(TimelineExporter.FORMAT_VERSION);
        assertThat(root.get("otherData").get("trace_count").asInt()).isEqualTo(2);
    }

    @Test
    void spansCoverConsecutiveCheckpointsInMicroseconds() {
        JsonNode events = exporter.toChromeTrace(twoTraces()).get("traceEvents");

        List<JsonNode> spans = new ArrayList<>();
        events.forEach(e -> {
            if ("X".equals(e.get("ph").asText())) spans.add(e);
        });

        assertThat(spans).hasSize(3);
        JsonNode first = spans.get(0);
        assertThat(first.get("name").asText()).isEqualTo("trace_start");
        assertThat(first.get("cat").asText()).isEqualTo("click");
        assertThat(first.get("ts").asLong()).isEqualTo(1_700_000_000_000_000L);
        assertThat(first.get("dur").asLong()).isBetween(1999L, 2001L);
        assertThat(first.get("tid").asLong()).isEqualTo(Thread.currentThread().getId());

        JsonNode meta = events.get(0);
        assertThat(meta.get("cat").asText()).isEqualTo("metadata");
        assertThat(meta.get("s").asText()).isEqualTo("g");
        assertThat(meta.get("args").get("event_id").asText()).isEqualTo("evt-1");
        assertThat(meta.get("args").get("completed").asBoolean()).isTrue();
    }

    @Test
    void checkpointInstantsCarryMetadata() {
        JsonNode events = exporter.toChromeTrace(twoTraces()).get("traceEvents");

        JsonNode receive = null;
        for (JsonNode e : events) {
            if ("checkpoint:backend_receive".equals(e.get("name").asText())) receive = e;
        }

        assertThat(receive).isNotNull();
        assertThat(receive.get("ph").asText()).isEqualTo("i");
        assertThat(receive.get("s").asText()).isEqualTo("t");
        assertThat(receive.get("args").get("queue").asText()).isEqualTo("main");
    }

    @Test
    void emptySnapshotStillProducesAValidDocument() throws Exception {
        JsonNode root = om.readTree(exporter.exportChromeTrace(List.of()));

        assertThat(root.get("traceEvents")).isEmpty();
        assertThat(root.get("otherData").get("trace_count").asInt()).isZero();
    }

    @Test
    void writesChromeTraceToFile(@TempDir Path dir) throws Exception {
        Path out = dir.resolve("trace.json");

        exporter.exportChromeTrace(twoTraces(), out);

        JsonNode root = om.readTree(Files.readString(out, StandardCharsets.UTF_8));
        assertThat(root.get("traceEvents")).hasSize(10);
    }

    @Test
    void htmlTimelineEmbedsTheTraces(@TempDir Path dir) throws Exception {
        Path out = dir.resolve("timeline.html");

        exporter.exportTimelineHtml(twoTraces(), out);

        String html = Files.readString(out, StandardCharsets.UTF_8);
        assertThat(html)
                .startsWith("<!DOCTYPE html>")
                .contains("\"event_id\":\"evt-1\"")
                .contains("\"event_id\":\"evt-2\"")
                .contains("backend_receive")
                .doesNotContain("/*[(");
    }

    @Test
    void scriptClosingTagInMetadataCannotBreakOutOfTheScript() {
        store.startTrace("evt-x", "click", Map.of("label", "</script><b>"));

        String json = exporter.tracesJson(store.getAllTraces());
        String html = exporter.exportTimelineHtml(store.getAllTraces());

        assertThat(json).doesNotContain("</").contains("<\\/script>");
        assertThat(html.indexOf("</script>")).isEqualTo(html.lastIndexOf("</script>"));
    }
}
