package com.schedq.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.schedq.exception.ResourceNotFoundException;
import com.schedq.queue.QueueHealth;
import com.schedq.queue.QueueItem;
import com.schedq.queue.QueueItemState;
import com.schedq.queue.QueueOptions;
import com.schedq.queue.QueueRouter;
import com.schedq.queue.QueueStats;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Operational view of the three queues.
 */
@RestController
@RequestMapping("/queues")
public class QueueController {

    private final QueueRouter queueRouter;

    public QueueController(QueueRouter queueRouter) {
        this.queueRouter = queueRouter;
    }

    @GetMapping("/stats")
    public QueueStats getStats() {
        return queueRouter.getQueueStats();
    }

    @GetMapping("/health")
    public QueueHealth getHealth() {
        return queueRouter.getQueueHealth();
    }

    @GetMapping("/jobs/failed")
    public List<QueueItem> getFailedJobs(@RequestParam(name = "limit", defaultValue = "50") int limit) {
        return queueRouter.getFailedJobs(limit);
    }

    @GetMapping("/jobs/state/{state}")
    public List<QueueItem> getJobsByState(
            @PathVariable("state") String state,
            @RequestParam(name = "limit", defaultValue = "50") int limit,
            @RequestParam(name = "offset", defaultValue = "0") int offset) {
        return queueRouter.getJobsByState(QueueItemState.fromValue(state), limit, offset);
    }

    @GetMapping("/jobs/{id}")
    public QueueItem getJob(@PathVariable("id") String id) {
        return queueRouter.getJob(id).orElseThrow(() -> new ResourceNotFoundException("Queue item", id));
    }

    @PostMapping("/jobs")
    @ResponseStatus(HttpStatus.CREATED)
    public QueueItem addJob(@RequestBody AddItemRequest request) {
        return queueRouter.addJob(request.name(), request.data(), request.options());
    }

    @DeleteMapping("/jobs/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void removeJob(@PathVariable("id") String id) {
        if (!queueRouter.removeJob(id)) {
            throw new ResourceNotFoundException("Queue item", id);
        }
    }

    @PostMapping("/{name}/pause")
    public Map<String, Object> pauseQueue(@PathVariable("name") String name) {
        queueRouter.pauseQueue(name);
        return Map.of("queue", name, "paused", true);
    }

    @PostMapping("/{name}/resume")
    public Map<String, Object> resumeQueue(@PathVariable("name") String name) {
        queueRouter.resumeQueue(name);
        return Map.of("queue", name, "paused", false);
    }

    @PostMapping("/clean")
    public Map<String, Integer> cleanQueues(@RequestBody CleanRequest request) {
        if (request.status() == null) {
            throw new IllegalArgumentException("status is required");
        }
        long olderThanMs = request.olderThanMs() == null ? 0L : request.olderThanMs();
        return queueRouter.cleanQueue(QueueItemState.fromValue(request.status()), olderThanMs);
    }

    @PostMapping("/retry-failed")
    public Map<String, Integer> retryFailed(@RequestParam(name = "limit", defaultValue = "100") int limit) {
        return Map.of("retried", queueRouter.retryFailedJobs(limit));
    }

    public record AddItemRequest(String name, JsonNode data, QueueOptions options) {
    }

    public record CleanRequest(String status, Long olderThanMs) {
    }
}
