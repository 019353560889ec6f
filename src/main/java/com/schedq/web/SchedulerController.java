package com.schedq.web;

import com.schedq.Job;
import com.schedq.JobExecution;
import com.schedq.JobPatch;
import com.schedq.JobSpec;
import com.schedq.JobStatistics;
import com.schedq.JobStatus;
import com.schedq.JobType;
import com.schedq.Schedule;
import com.schedq.ScheduleSpec;
import com.schedq.SchedulerEngine;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.UUID;

@RestController
@RequestMapping("/scheduler")
public class SchedulerController {

    static final int DEFAULT_HISTORY_LIMIT = 20;

    private final SchedulerEngine engine;

    public SchedulerController(SchedulerEngine engine) {
        this.engine = engine;
    }

    @PostMapping("/jobs")
    @ResponseStatus(HttpStatus.CREATED)
    public Job createJob(@RequestBody JobSpec spec) {
        return engine.createJob(spec);
    }

    @GetMapping("/jobs")
    public JobList listJobs(
            @RequestParam(name = "status", required = false) String status,
            @RequestParam(name = "type", required = false) String type,
            @RequestParam(name = "limit", required = false) Integer limit) {
        JobStatus statusFilter = status == null || status.isBlank() ? null : JobStatus.fromValue(status);
        JobType typeFilter = type == null || type.isBlank() ? null : JobType.fromValue(type);
        List<Job> jobs = engine.listJobs(statusFilter, typeFilter, limit);
        return new JobList(jobs, jobs.size(), limit);
    }

    @GetMapping("/jobs/{id}")
    public Job getJob(@PathVariable("id") UUID id) {
        return engine.getJob(id);
    }

    @PutMapping("/jobs/{id}")
    public Job updateJob(@PathVariable("id") UUID id, @RequestBody JobPatch patch) {
        return engine.updateJob(id, patch);
    }

    @DeleteMapping("/jobs/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void deleteJob(@PathVariable("id") UUID id) {
        engine.deleteJob(id);
    }

    @PostMapping("/jobs/{id}/schedule")
    @ResponseStatus(HttpStatus.CREATED)
    public Schedule scheduleJob(@PathVariable("id") UUID id, @RequestBody ScheduleSpec spec) {
        return engine.scheduleJob(id, spec);
    }

    @GetMapping("/jobs/{id}/schedule")
    public Schedule getSchedule(@PathVariable("id") UUID id) {
        return engine.getSchedule(id);
    }

    @DeleteMapping("/jobs/{id}/schedule")
    public Schedule deactivateSchedule(@PathVariable("id") UUID id) {
        return engine.deactivateSchedule(id);
    }

    @PostMapping("/jobs/{id}/schedule/pause")
    public Schedule pauseSchedule(@PathVariable("id") UUID id) {
        return engine.pauseSchedule(id);
    }

    @PostMapping("/jobs/{id}/schedule/resume")
    public Schedule resumeSchedule(@PathVariable("id") UUID id) {
        return engine.resumeSchedule(id);
    }

    @PostMapping("/jobs/{id}/execute")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public JobExecution executeJob(@PathVariable("id") UUID id) {
        return engine.executeJob(id);
    }

    @GetMapping("/jobs/{id}/executions")
    public List<JobExecution> getExecutions(
            @PathVariable("id") UUID id,
            @RequestParam(name = "limit", defaultValue = "" + DEFAULT_HISTORY_LIMIT) int limit) {
        return engine.getJobHistory(id, limit);
    }

    @PostMapping("/jobs/{id}/pause")
    public Job pauseJob(@PathVariable("id") UUID id) {
        return engine.pauseJob(id);
    }

    @PostMapping("/jobs/{id}/resume")
    public Job resumeJob(@PathVariable("id") UUID id) {
        return engine.resumeJob(id);
    }

    @PostMapping("/jobs/{id}/cancel")
    public Job cancelJob(@PathVariable("id") UUID id) {
        return engine.cancelJob(id);
    }

    @PostMapping("/jobs/{id}/retry")
    public Job retryJob(@PathVariable("id") UUID id) {
        return engine.retryJob(id);
    }

    @PostMapping("/jobs/{id}/requeue")
    @ResponseStatus(HttpStatus.ACCEPTED)
    public JobExecution requeueJob(@PathVariable("id") UUID id) {
        return engine.requeueJob(id);
    }

    @GetMapping("/statistics")
    public JobStatistics getStatistics() {
        return engine.getJobStatistics();
    }

    public record JobList(List<Job> jobs, int total, Integer limit) {
    }
}
