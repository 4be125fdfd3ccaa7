package com.example.flowscope.api;

import com.example.flowscope.model.ActionRecordRequest;
import com.example.flowscope.model.CurrentActionRequest;
import com.example.flowscope.model.EventRecordRequest;
import com.example.flowscope.model.MetricsSnapshot;
import com.example.flowscope.model.QueueDepthRequest;
import com.example.flowscope.sampler.MetricsSampler;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

/**
 * Recorder endpoints for producers outside this process, plus the current snapshot
 * in the same shape the dashboard socket streams.
 */
@RestController
@RequestMapping("/api/metrics")
public class MetricsApiController {

    private final MetricsSampler sampler;

    public MetricsApiController(MetricsSampler sampler) {
        this.sampler = sampler;
    }

    @GetMapping(produces = MediaType.APPLICATION_JSON_VALUE)
    public MetricsSnapshot latest() {
        return sampler.getLatestMetrics();
    }

    @PostMapping("/actions")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void recordAction(@RequestBody ActionRecordRequest req) {
        if (req.getName() == null || req.getName().isBlank()) {
            throw new IllegalArgumentException("action name is required");
        }
        if (req.getDurationSec() < 0) {
            throw new IllegalArgumentException("durationSec must be >= 0");
        }
        sampler.recordAction(req.getName(), req.getDurationSec(), req.isSuccess());
    }

    @PutMapping("/actions/current")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void setCurrentAction(@RequestBody CurrentActionRequest req) {
        String name = (req.getName() == null || req.getName().isBlank()) ? null : req.getName();
        sampler.setCurrentAction(name);
    }

    @PutMapping("/actions/queue-depth")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void setActionQueueDepth(@RequestBody QueueDepthRequest req) {
        sampler.setActionQueueDepth(nonNegative(req.getDepth()));
    }

    @PostMapping("/events")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void recordEvent(@RequestBody EventRecordRequest req) {
        if (req.getProcessingTimeSec() < 0) {
            throw new IllegalArgumentException("processingTimeSec must be >= 0");
        }
        sampler.recordEvent(req.getProcessingTimeSec(), req.isSuccess());
    }

    @PutMapping("/events/queue-depth")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void setEventQueueDepth(@RequestBody QueueDepthRequest req) {
        sampler.setEventQueueDepth(nonNegative(req.getDepth()));
    }

    private static int nonNegative(int depth) {
        if (depth < 0) throw new IllegalArgumentException("depth must be >= 0");
        return depth;
    }
}
