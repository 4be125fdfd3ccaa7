package com.example.flowscope.api;

import com.example.flowscope.analysis.StageComparison;
import com.example.flowscope.analysis.StageStats;
import com.example.flowscope.analysis.TraceAnomaly;
import com.example.flowscope.model.CheckpointRequest;
import com.example.flowscope.model.EventFlow;
import com.example.flowscope.model.EventTrace;
import com.example.flowscope.model.StartTraceRequest;
import com.example.flowscope.service.TraceService;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.util.Collections;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/traces")
public class TraceApiController {

    private final TraceService service;

    public TraceApiController(TraceService service) {
        this.service = service;
    }

    @PostMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public EventTrace start(@RequestBody StartTraceRequest req) {
        return service.start(req);
    }

    @PostMapping("/{eventId}/checkpoints")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void checkpoint(@PathVariable String eventId, @RequestBody CheckpointRequest req) {
        service.checkpoint(eventId, req);
    }

    @PostMapping(value = "/{eventId}/complete", produces = MediaType.APPLICATION_JSON_VALUE)
    public EventTrace complete(@PathVariable String eventId) {
        return service.complete(eventId);
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public List<EventTrace> list() {
        return service.list();
    }

    @GetMapping(value = "/{eventId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public EventTrace get(@PathVariable String eventId) {
        return service.get(eventId);
    }

    /**
     * Open traces older than {@code timeoutSec}. Reporting only, nothing is removed.
     */
    @GetMapping(value = "/lost", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<EventTrace> lost(@RequestParam(required = false, defaultValue = "5.0") double timeoutSec) {
        return service.lost(timeoutSec);
    }

    @GetMapping(value = "/flow", produces = MediaType.APPLICATION_JSON_VALUE)
    public EventFlow flow() {
        return service.flow();
    }

    @GetMapping(value = "/latencies", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, StageStats> latencies() {
        return service.latencies();
    }

    @GetMapping(value = "/bottleneck", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, String> bottleneck() {
        return Collections.singletonMap("bottleneck_stage", service.bottleneck());
    }

    @GetMapping(value = "/anomalies", produces = MediaType.APPLICATION_JSON_VALUE)
    public List<TraceAnomaly> anomalies(@RequestParam(required = false, defaultValue = "2.0") double threshold) {
        return service.anomalies(threshold);
    }

    @GetMapping(value = "/throughput", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Double> throughput(@RequestParam(required = false, defaultValue = "1.0") double windowSec) {
        return service.throughput(windowSec);
    }

    @GetMapping(value = "/compare", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, StageComparison> compare(@RequestParam String a, @RequestParam String b) {
        return service.compare(a, b);
    }

    @GetMapping(value = "/report", produces = MediaType.TEXT_PLAIN_VALUE)
    public String report() {
        return service.report();
    }

    @GetMapping(value = "/stats", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> stats() {
        return service.statistics();
    }

    @GetMapping(value = "/export/chrome", produces = MediaType.APPLICATION_JSON_VALUE)
    public ObjectNode exportChrome() {
        return service.chromeTrace();
    }

    @GetMapping(value = "/export/html", produces = MediaType.TEXT_HTML_VALUE)
    public String exportHtml() {
        return service.timelineHtml();
    }

    @DeleteMapping
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void clear() {
        service.clear();
    }
}
