package com.example.flowscope.export;

import com.example.flowscope.model.Checkpoint;
import com.example.flowscope.model.EventTrace;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;
import org.thymeleaf.ITemplateEngine;
import org.thymeleaf.context.Context;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Offline export of a trace snapshot.
 * <ul>
 *   <li>Chrome Trace Event JSON, loadable in chrome://tracing or ui.perfetto.dev</li>
 *   <li>a self-contained HTML timeline rendered from the {@code timeline-export} template</li>
 * </ul>
 */
@Component
public class TimelineExporter {

    public static final String FORMAT_VERSION = "flowscope-1.0";
    static final String HTML_TEMPLATE = "timeline-export";
    private static final double MICROS_PER_SECOND = 1_000_000.0;

    private final ITemplateEngine templateEngine;
    private final ObjectMapper om = new ObjectMapper();

    public TimelineExporter(ITemplateEngine templateEngine) {
        this.templateEngine = templateEngine;
    }

    /**
     * Per trace: one global instant for the trace itself, one complete ("X") event per
     * consecutive checkpoint pair and one thread-scoped instant per checkpoint.
     */
    public ObjectNode toChromeTrace(List<EventTrace> traces) {
        ArrayNode events = om.createArrayNode();

        for (EventTrace trace : traces) {
            ObjectNode meta = events.addObject();
            meta.put("name", trace.getEventType() + ":" + trace.getEventId());
            meta.put("cat", "metadata");
            meta.put("ph", "i");
            meta.put("ts", micros(trace.getCreatedAt()));
            meta.put("pid", 0);
            meta.put("tid", 0);
            meta.put("s", "g");
            ObjectNode args = meta.putObject("args");
            args.put("event_id", trace.getEventId());
            args.put("event_type", trace.getEventType());
            args.put("completed", trace.isCompleted());
            args.put("total_latency", trace.getTotalLatency());

            List<Checkpoint> cps = trace.getCheckpoints();
            for (int i = 0; i < cps.size(); i++) {
                Checkpoint cp = cps.get(i);
                if (i + 1 < cps.size()) {
                    Checkpoint next = cps.get(i + 1);
                    ObjectNode span = events.addObject();
                    span.put("name", cp.getName());
                    span.put("cat", trace.getEventType());
                    span.put("ph", "X");
                    span.put("ts", micros(cp.getTimestamp()));
                    span.put("dur", micros(next.getTimestamp() - cp.getTimestamp()));
                    span.put("pid", 0);
                    span.put("tid", cp.getOwner());
                    span.set("args", om.valueToTree(cp.getMetadata()));
                }

                ObjectNode instant = events.addObject();
                instant.put("name", "checkpoint:" + cp.getName());
                instant.put("cat", trace.getEventType());
                instant.put("ph", "i");
                instant.put("ts", micros(cp.getTimestamp()));
                instant.put("pid", 0);
                instant.put("tid", cp.getOwner());
                instant.put("s", "t");
                instant.set("args", om.valueToTree(cp.getMetadata()));
            }
        }

        ObjectNode root = om.createObjectNode();
        root.set("traceEvents", events);
        root.put("displayTimeUnit", "ms");
        ObjectNode other = root.putObject("otherData");
        other.put("version", FORMAT_VERSION);
        other.put("trace_count", traces.size());
        return root;
    }

    public String exportChromeTrace(List<EventTrace> traces) {
        try {
            return om.writerWithDefaultPrettyPrinter().writeValueAsString(toChromeTrace(traces));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("chrome trace serialization failed", e);
        }
    }

    public void exportChromeTrace(List<EventTrace> traces, Path output) throws IOException {
        Files.writeString(output, exportChromeTrace(traces), StandardCharsets.UTF_8);
    }

    public String exportTimelineHtml(List<EventTrace> traces) {
        Context ctx = new Context();
        ctx.setVariable("traceCount", traces.size());
        ctx.setVariable("tracesJson", tracesJson(traces));
        return templateEngine.process(HTML_TEMPLATE, ctx);
    }

    public void exportTimelineHtml(List<EventTrace> traces, Path output) throws IOException {
        Files.writeString(output, exportTimelineHtml(traces), StandardCharsets.UTF_8);
    }

    String tracesJson(List<EventTrace> traces) {
        List<Map<String, Object>> data = new ArrayList<>(traces.size());
        for (EventTrace t : traces) {
            Map<String, Object> m = new LinkedHashMap<>();
            m.put("event_id", t.getEventId());
            m.put("event_type", t.getEventType());
            m.put("created_at", t.getCreatedAt());
            m.put("completed", t.isCompleted());
            m.put("total_latency", t.getTotalLatency());
            List<Map<String, Object>> cps = new ArrayList<>();
            for (Checkpoint cp : t.getCheckpoints()) {
                Map<String, Object> c = new LinkedHashMap<>();
                c.put("name", cp.getName());
                c.put("timestamp", cp.getTimestamp());
                c.put("thread_id", cp.getOwner());
                c.put("metadata", cp.getMetadata());
                cps.add(c);
            }
            m.put("checkpoints", cps);
            data.add(m);
        }
        try {
            // "</" would end the embedding <script> element early
            return om.writeValueAsString(data).replace("</", "<\\/");
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("timeline serialization failed", e);
        }
    }

    private static long micros(double seconds) {
        return (long) (seconds * MICROS_PER_SECOND);
    }
}
