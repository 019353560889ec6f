package com.schedq;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.schedq.config.SchedQProperties;
import com.schedq.exception.DuplicateResourceException;
import com.schedq.exception.InvalidJobStateException;
import com.schedq.exception.QueueBackendException;
import com.schedq.exception.ResourceNotFoundException;
import com.schedq.queue.QueueOptions;
import com.schedq.queue.QueueRouter;
import com.schedq.util.CronValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Orchestrates jobs, their schedules and executions.
 * <p>
 * Every read-modify-write of a job or execution runs in one transaction holding a row lock on the rows it
 * touches. Queue items are added after the transaction commits, except schedule registration, which must roll
 * back together with the schedule it belongs to.
 */
@Service
public class SchedulerEngine {

    private static final Logger log = LoggerFactory.getLogger(SchedulerEngine.class);

    public static final String SCHEDULE_ITEM_NAME = "schedule";
    static final int MAX_NAME_LENGTH = 255;
    static final int MAX_RETRIES_LIMIT = 100;
    static final int DEFAULT_LIST_LIMIT = 50;
    static final int MAX_LIST_LIMIT = 200;
    static final int MAX_TIMEZONE_LENGTH = 50;

    private final JobRepository jobRepository;
    private final ScheduleRepository scheduleRepository;
    private final JobExecutionRepository executionRepository;
    private final QueueRouter queueRouter;
    private final TransactionTemplate transactionTemplate;
    private final ObjectMapper objectMapper;
    private final SchedQProperties properties;

    public SchedulerEngine(
            JobRepository jobRepository,
            ScheduleRepository scheduleRepository,
            JobExecutionRepository executionRepository,
            QueueRouter queueRouter,
            TransactionTemplate transactionTemplate,
            @Qualifier("schedqObjectMapper") ObjectMapper objectMapper,
            SchedQProperties properties) {
        this.jobRepository = jobRepository;
        this.scheduleRepository = scheduleRepository;
        this.executionRepository = executionRepository;
        this.queueRouter = queueRouter;
        this.transactionTemplate = transactionTemplate;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    // ---------------------------------------------------------------- jobs

    public Job createJob(JobSpec spec) {
        if (spec == null) {
            throw new IllegalArgumentException("Job spec must not be null");
        }
        String name = normalizeRequiredName(spec.name());
        if (spec.type() == null) {
            throw new IllegalArgumentException("Job type must not be null");
        }
        int priority = spec.priority() != null ? spec.priority() : properties.getJobs().getDefaultPriority();
        int maxRetries = spec.maxRetries() != null ? spec.maxRetries() : properties.getJobs().getDefaultMaxRetries();
        validatePriority(priority);
        validateMaxRetries(maxRetries);
        validateTimeout(spec.timeoutMs());

        Job job = new Job(UUID.randomUUID(), name, spec.type(), normalizeObject(spec.payload(), "payload"), priority,
                maxRetries);
        job.setMetadata(normalizeObject(spec.metadata(), "metadata"));
        job.setTimeoutMs(spec.timeoutMs());
        Job saved = jobRepository.save(job);
        log.info("Created job {} ({}) of type {}", saved.getId(), saved.getName(), saved.getType().getValue());
        return saved;
    }

    public Optional<Job> findJobById(UUID jobId) {
        return jobRepository.findById(jobId);
    }

    public Job getJob(UUID jobId) {
        return jobRepository.findById(jobId).orElseThrow(() -> new ResourceNotFoundException("Job", jobId));
    }

    /**
     * Newest first. {@code limit} defaults to 50 and is clamped to [1, 200].
     */
    public List<Job> listJobs(JobStatus status, JobType type, Integer limit) {
        int effectiveLimit = limit == null ? DEFAULT_LIST_LIMIT : Math.max(1, Math.min(MAX_LIST_LIMIT, limit));
        Pageable page = PageRequest.of(0, effectiveLimit);
        if (status != null && type != null) {
            return jobRepository.findByStatusAndTypeOrderByCreatedAtDesc(status, type, page);
        }
        if (status != null) {
            return jobRepository.findByStatusOrderByCreatedAtDesc(status, page);
        }
        if (type != null) {
            return jobRepository.findByTypeOrderByCreatedAtDesc(type, page);
        }
        return jobRepository.findAllByOrderByCreatedAtDesc(page);
    }

    public Job updateJob(UUID jobId, JobPatch patch) {
        if (patch == null) {
            throw new IllegalArgumentException("Job patch must not be null");
        }
        return transactionTemplate.execute(status -> {
            Job job = lockJob(jobId);
            if (patch.name() != null) {
                job.setName(normalizeRequiredName(patch.name()));
            }
            if (patch.type() != null) {
                job.setType(patch.type());
            }
            if (patch.payload() != null) {
                job.setPayload(normalizeObject(patch.payload(), "payload"));
            }
            if (patch.priority() != null) {
                validatePriority(patch.priority());
                job.setPriority(patch.priority());
            }
            if (patch.maxRetries() != null) {
                validateMaxRetries(patch.maxRetries());
                if (patch.maxRetries() < job.getRetryCount()) {
                    throw new IllegalArgumentException("maxRetries must not be lower than the " + job.getRetryCount()
                            + " retries already used");
                }
                job.setMaxRetries(patch.maxRetries());
            }
            if (patch.metadata() != null) {
                job.setMetadata(normalizeObject(patch.metadata(), "metadata"));
            }
            if (patch.timeoutMs() != null) {
                validateTimeout(patch.timeoutMs());
                job.setTimeoutMs(patch.timeoutMs());
            }
            Job saved = jobRepository.save(job);
            log.debug("Updated job {}", jobId);
            return saved;
        });
    }

    /**
     * Removes the job, its schedule and its executions. Queue cleanup is best effort; the store is authoritative.
     */
    public void deleteJob(UUID jobId) {
        Job job = getJob(jobId);
        Optional<Schedule> schedule = scheduleRepository.findByJobId(jobId);

        removeQueueItemsQuietly(job.getId());
        schedule.ifPresent(existing -> removeQueueItemsQuietly(existing.getId()));

        transactionTemplate.executeWithoutResult(status -> {
            Job locked = lockJob(jobId);
            int executions = executionRepository.deleteByJobId(jobId);
            scheduleRepository.deleteByJobId(jobId);
            jobRepository.delete(locked);
            log.info("Deleted job {} with {} execution record(s)", jobId, executions);
        });
    }

    // ---------------------------------------------------------------- schedules

    /**
     * Attaches a cron schedule and registers its first occurrence. A finished (expired or deactivated) schedule
     * is replaced; a live one is a conflict. If the occurrence cannot be registered nothing is persisted.
     */
    public Schedule scheduleJob(UUID jobId, ScheduleSpec spec) {
        if (spec == null) {
            throw new IllegalArgumentException("Schedule spec must not be null");
        }
        CronValidator.validate(spec.cronExpression());
        String timezone = spec.timezone() == null ? "UTC" : spec.timezone().trim();
        if (timezone.isEmpty() || timezone.length() > MAX_TIMEZONE_LENGTH) {
            throw new IllegalArgumentException("timezone must be between 1 and " + MAX_TIMEZONE_LENGTH + " characters");
        }
        ZoneId zone = CronValidator.parseZone(timezone);
        if (spec.maxExecutions() != null && spec.maxExecutions() < 1) {
            throw new IllegalArgumentException("maxExecutions must be >= 1");
        }
        OffsetDateTime now = OffsetDateTime.now();
        if (spec.startAt() != null && spec.endAt() != null && spec.endAt().isBefore(spec.startAt())) {
            throw new IllegalArgumentException("endAt must not be before startAt");
        }
        if (spec.endAt() != null && spec.endAt().isBefore(now)) {
            throw new IllegalArgumentException("endAt must be in the future");
        }

        return transactionTemplate.execute(status -> {
            Job job = lockJob(jobId);
            Optional<Schedule> existing = scheduleRepository.findByJobIdForUpdate(jobId);
            if (existing.isPresent()) {
                if (!existing.get().isFinished()) {
                    throw new DuplicateResourceException("Job " + jobId + " already has an active schedule "
                            + existing.get().getId());
                }
                scheduleRepository.delete(existing.get());
                scheduleRepository.flush();
            }

            Schedule schedule = new Schedule(UUID.randomUUID(), jobId, spec.cronExpression().trim(), zone.getId());
            schedule.initWindow(spec.startAt(), spec.endAt());
            schedule.setMaxExecutions(spec.maxExecutions());
            schedule.setMetadata(normalizeObject(spec.metadata(), "metadata"));
            if (Boolean.FALSE.equals(spec.isActive())) {
                schedule.pause();
            } else {
                advance(schedule, now);
            }
            Schedule saved = scheduleRepository.save(schedule);
            if (saved.getNextExecution() != null) {
                registerOccurrence(saved, job);
            }
            log.info("Scheduled job {} with cron '{}' ({}), next execution {}", jobId, saved.getCronExpression(),
                    saved.getTimezone(), saved.getNextExecution());
            return saved;
        });
    }

    public Schedule getSchedule(UUID jobId) {
        return scheduleRepository.findByJobId(jobId)
                .orElseThrow(() -> new ResourceNotFoundException("Schedule for job " + jobId + " not found"));
    }

    public Schedule pauseSchedule(UUID jobId) {
        Schedule paused = transactionTemplate.execute(status -> {
            Schedule schedule = lockSchedule(jobId);
            if (!schedule.pause()) {
                throw new InvalidJobStateException("Schedule " + schedule.getId() + " cannot be paused from status "
                        + schedule.getStatus().getValue());
            }
            return scheduleRepository.save(schedule);
        });
        removeQueueItemsQuietly(paused.getId());
        log.info("Paused schedule {} of job {}", paused.getId(), jobId);
        return paused;
    }

    /**
     * Resumes a paused schedule from the next cron occurrence after now.
     */
    public Schedule resumeSchedule(UUID jobId) {
        return transactionTemplate.execute(status -> {
            Schedule schedule = lockSchedule(jobId);
            if (!schedule.resume()) {
                throw new InvalidJobStateException("Schedule " + schedule.getId() + " cannot be resumed from status "
                        + schedule.getStatus().getValue());
            }
            Job job = lockJob(jobId);
            advance(schedule, OffsetDateTime.now());
            Schedule saved = scheduleRepository.save(schedule);
            if (saved.getNextExecution() != null) {
                registerOccurrence(saved, job);
            }
            log.info("Resumed schedule {} of job {}, next execution {}", saved.getId(), jobId,
                    saved.getNextExecution());
            return saved;
        });
    }

    public Schedule deactivateSchedule(UUID jobId) {
        Schedule deactivated = transactionTemplate.execute(status -> {
            Schedule schedule = lockSchedule(jobId);
            schedule.deactivate();
            return scheduleRepository.save(schedule);
        });
        removeQueueItemsQuietly(deactivated.getId());
        log.info("Deactivated schedule {} of job {}", deactivated.getId(), jobId);
        return deactivated;
    }

    /**
     * Handles a delivered schedule occurrence: advances the schedule, registers the next occurrence and
     * dispatches the job. A finished job is re-armed; a running, paused or cancelled job skips this occurrence.
     *
     * @return the dispatched execution, empty when nothing ran
     */
    public Optional<JobExecution> fireSchedule(UUID scheduleId) {
        Dispatch dispatch = transactionTemplate.execute(status -> {
            Schedule schedule = scheduleRepository.findByIdForUpdate(scheduleId).orElse(null);
            if (schedule == null) {
                log.debug("Ignoring occurrence of deleted schedule {}", scheduleId);
                return null;
            }
            OffsetDateTime now = OffsetDateTime.now();
            if (schedule.getStatus() != ScheduleStatus.ACTIVE || !schedule.isActive()) {
                log.debug("Ignoring occurrence of schedule {} in status {}", scheduleId,
                        schedule.getStatus().getValue());
                return null;
            }
            if (schedule.getEndAt() != null && now.isAfter(schedule.getEndAt())) {
                schedule.expire();
                scheduleRepository.save(schedule);
                log.info("Schedule {} expired: window ended at {}", scheduleId, schedule.getEndAt());
                return null;
            }
            Job job = jobRepository.findByIdForUpdate(schedule.getJobId()).orElse(null);
            if (job == null) {
                schedule.deactivate();
                scheduleRepository.save(schedule);
                return null;
            }
            boolean early = (schedule.getStartAt() != null && now.isBefore(schedule.getStartAt()))
                    || (schedule.getNextExecution() != null && now.isBefore(schedule.getNextExecution()));
            if (early) {
                if (schedule.getNextExecution() == null) {
                    advance(schedule, now);
                    scheduleRepository.save(schedule);
                }
                if (schedule.getNextExecution() != null) {
                    // The delivered item is still active under the regular occurrence id.
                    registerOccurrence(schedule, job, "_r" + now.toInstant().toEpochMilli());
                }
                return null;
            }

            if (job.getStatus() == JobStatus.COMPLETED || job.getStatus() == JobStatus.FAILED) {
                job.reset();
            }
            boolean runnable = job.isExecutable();
            if (runnable) {
                schedule.recordExecution(now);
            } else {
                log.info("Skipping occurrence of schedule {}: job {} is {}", scheduleId, job.getId(),
                        job.getStatus().getValue());
            }
            if (schedule.getStatus() == ScheduleStatus.ACTIVE) {
                advance(schedule, now);
            }
            scheduleRepository.save(schedule);
            if (schedule.getNextExecution() != null) {
                registerOccurrence(schedule, job);
            }
            if (!runnable) {
                jobRepository.save(job);
                return null;
            }

            job.markAsRunning();
            JobExecution execution = JobExecution.start(job);
            ObjectNode context = objectMapper.createObjectNode();
            context.put("scheduleId", scheduleId.toString());
            context.put("occurrence", schedule.getExecutionCount());
            execution.setExecutionContext(context);
            jobRepository.save(job);
            executionRepository.save(execution);
            return new Dispatch(job, execution);
        });
        if (dispatch == null) {
            return Optional.empty();
        }
        enqueueExecution(dispatch);
        return Optional.of(dispatch.execution());
    }

    // ---------------------------------------------------------------- lifecycle

    /**
     * Marks the job running, commits a RUNNING execution and only then hands it to the queue. If the queue
     * rejects it, the execution is failed through the normal failure path and the error is rethrown.
     */
    public JobExecution executeJob(UUID jobId) {
        Dispatch dispatch = transactionTemplate.execute(status -> {
            Job job = lockJob(jobId);
            if (!job.isExecutable()) {
                throw new InvalidJobStateException("Job " + jobId + " cannot be executed in status "
                        + job.getStatus().getValue());
            }
            job.markAsRunning();
            JobExecution execution = JobExecution.start(job);
            jobRepository.save(job);
            executionRepository.save(execution);
            return new Dispatch(job, execution);
        });
        enqueueExecution(dispatch);
        log.info("Dispatched job {} as execution {}", jobId, dispatch.execution().getId());
        return dispatch.execution();
    }

    public Job pauseJob(UUID jobId) {
        Job job = transactionTemplate.execute(status -> {
            Job locked = lockJob(jobId);
            if (locked.isTerminal()) {
                throw new InvalidJobStateException("Job " + jobId + " cannot be paused in status "
                        + locked.getStatus().getValue());
            }
            if (locked.isPaused()) {
                return locked;
            }
            locked.markAsPaused();
            return jobRepository.save(locked);
        });
        try {
            int paused = queueRouter.pauseOwnedItems(jobId);
            log.info("Paused job {} ({} queued item(s) held)", jobId, paused);
        } catch (RuntimeException e) {
            log.warn("Paused job {} but failed to hold its queued items: {}", jobId, e.getMessage());
        }
        return job;
    }

    /**
     * PAUSED back to PENDING; any other status returns the job unchanged.
     */
    public Job resumeJob(UUID jobId) {
        Resumed resumed = transactionTemplate.execute(status -> {
            Job locked = lockJob(jobId);
            if (!locked.resume()) {
                return new Resumed(locked, false);
            }
            return new Resumed(jobRepository.save(locked), true);
        });
        if (resumed.changed()) {
            try {
                int released = queueRouter.resumeOwnedItems(jobId);
                log.info("Resumed job {} ({} queued item(s) released)", jobId, released);
            } catch (RuntimeException e) {
                log.warn("Resumed job {} but failed to release its queued items: {}", jobId, e.getMessage());
            }
        }
        return resumed.job();
    }

    /**
     * Cancels the job and its running executions. A handler that is already running is not interrupted; its
     * eventual result is ignored.
     */
    public Job cancelJob(UUID jobId) {
        Job job = transactionTemplate.execute(status -> {
            Job locked = lockJob(jobId);
            if (locked.isTerminal()) {
                throw new InvalidJobStateException("Job " + jobId + " cannot be cancelled in status "
                        + locked.getStatus().getValue());
            }
            locked.markAsCancelled();
            List<JobExecution> running = executionRepository.findByJobIdAndStatus(jobId, ExecutionStatus.RUNNING);
            for (JobExecution execution : running) {
                execution.markAsCancelled();
            }
            executionRepository.saveAll(running);
            return jobRepository.save(locked);
        });
        removeQueueItemsQuietly(jobId);
        log.info("Cancelled job {}", jobId);
        return job;
    }

    /**
     * Dispatches a pending retry now. A terminally failed job is granted one more attempt only while
     * {@link Job#canRetry()} holds, e.g. after raising {@code maxRetries}.
     */
    public Job retryJob(UUID jobId) {
        Job job = transactionTemplate.execute(status -> {
            Job locked = lockJob(jobId);
            if (locked.getStatus() == JobStatus.FAILED) {
                if (!locked.canRetry()) {
                    throw new InvalidJobStateException("Job " + jobId + " has used all " + locked.getMaxRetries()
                            + " retries");
                }
                locked.markForRetry();
                return jobRepository.save(locked);
            }
            if (locked.getStatus() != JobStatus.RETRY) {
                throw new InvalidJobStateException("Job " + jobId + " cannot be retried in status "
                        + locked.getStatus().getValue());
            }
            return locked;
        });
        removeQueueItemsQuietly(jobId);
        enqueueRetry(job, 0L);
        log.info("Retrying job {} now (retry {}/{})", jobId, job.getRetryCount(), job.getMaxRetries());
        return job;
    }

    /**
     * Resets a failed or cancelled job to a fresh PENDING state and dispatches it.
     */
    public JobExecution requeueJob(UUID jobId) {
        transactionTemplate.executeWithoutResult(status -> {
            Job locked = lockJob(jobId);
            if (locked.getStatus() != JobStatus.FAILED && locked.getStatus() != JobStatus.CANCELLED) {
                throw new InvalidJobStateException("Job " + jobId + " cannot be requeued in status "
                        + locked.getStatus().getValue());
            }
            locked.reset();
            jobRepository.save(locked);
        });
        log.info("Requeued job {}", jobId);
        return executeJob(jobId);
    }

    // ---------------------------------------------------------------- executions

    /**
     * Worker side claim of a delivered job item. Adopts the execution created by {@link #executeJob(UUID)} or,
     * for retry items, starts a new one. Returns empty when the job is no longer runnable; a pre-created
     * execution is then cancelled.
     */
    public Optional<ClaimedExecution> startExecution(UUID jobId, UUID executionId, String workerId,
            String queueName) {
        return transactionTemplate.execute(status -> {
            Job job = jobRepository.findByIdForUpdate(jobId).orElse(null);
            if (job == null) {
                log.debug("Job {} no longer exists; dropping its queue item", jobId);
                return Optional.<ClaimedExecution>empty();
            }
            if (executionId != null) {
                JobExecution execution = executionRepository.findByIdForUpdate(executionId).orElse(null);
                if (execution == null || execution.isFinished()) {
                    return Optional.<ClaimedExecution>empty();
                }
                if (job.isExecutable()) {
                    job.markAsRunning();
                    jobRepository.save(job);
                } else if (!job.isRunning()) {
                    execution.markAsCancelled();
                    executionRepository.save(execution);
                    log.info("Cancelled execution {}: job {} is {}", executionId, jobId, job.getStatus().getValue());
                    return Optional.<ClaimedExecution>empty();
                }
                execution.setWorkerInfo(workerId, queueName);
                return Optional.of(new ClaimedExecution(job, executionRepository.save(execution)));
            }
            if (!job.isExecutable()) {
                log.debug("Skipping retry item of job {} in status {}", jobId, job.getStatus().getValue());
                return Optional.<ClaimedExecution>empty();
            }
            job.markAsRunning();
            JobExecution execution = JobExecution.start(job);
            execution.setWorkerInfo(workerId, queueName);
            jobRepository.save(job);
            executionRepository.save(execution);
            return Optional.of(new ClaimedExecution(job, execution));
        });
    }

    public JobExecution completeJobExecution(UUID executionId, String output) {
        Outcome outcome = transactionTemplate.execute(status -> {
            JobExecution execution = lockExecution(executionId);
            if (!execution.markAsCompleted(output)) {
                log.debug("Ignoring completion of execution {} already {}", executionId,
                        execution.getStatus().getValue());
                return new Outcome(execution, null);
            }
            executionRepository.save(execution);
            Job job = jobRepository.findByIdForUpdate(execution.getJobId()).orElse(null);
            if (job != null && job.isRunning()) {
                job.markAsCompleted();
                jobRepository.save(job);
            }
            return new Outcome(execution, job);
        });
        if (outcome.job() != null) {
            log.info("Execution {} of job {} completed in {} ms", executionId, outcome.job().getId(),
                    outcome.execution().getDurationMs());
        }
        return outcome.execution();
    }

    public JobExecution failJobExecution(UUID executionId, String error, JsonNode details) {
        Outcome outcome = transactionTemplate.execute(status -> {
            JobExecution execution = lockExecution(executionId);
            if (!execution.markAsFailed(error, details)) {
                log.debug("Ignoring failure of execution {} already {}", executionId,
                        execution.getStatus().getValue());
                return new Outcome(execution, null);
            }
            executionRepository.save(execution);
            return new Outcome(execution, failOwningJob(execution, error, details));
        });
        scheduleRetryIfNeeded(outcome);
        return outcome.execution();
    }

    /**
     * Called by the worker when a handler overran its timeout.
     */
    public JobExecution timeoutJobExecution(UUID executionId) {
        Outcome outcome = transactionTemplate.execute(status -> {
            JobExecution execution = lockExecution(executionId);
            if (!execution.markAsTimeout()) {
                return new Outcome(execution, null);
            }
            executionRepository.save(execution);
            ObjectNode details = objectMapper.createObjectNode();
            details.put("timeout", true);
            return new Outcome(execution, failOwningJob(execution, execution.getErrorMessage(), details));
        });
        log.warn("Execution {} timed out", executionId);
        scheduleRetryIfNeeded(outcome);
        return outcome.execution();
    }

    public boolean isCancellationRequested(UUID jobId) {
        return jobRepository.findById(jobId)
                .map(job -> job.getStatus() == JobStatus.CANCELLED)
                .orElse(true);
    }

    // ---------------------------------------------------------------- queries

    public JobStatistics getJobStatistics() {
        Map<String, Long> byStatus = new LinkedHashMap<>();
        for (JobStatus status : JobStatus.values()) {
            byStatus.put(status.getValue(), 0L);
        }
        long total = 0;
        for (JobRepository.StatusCount row : jobRepository.countGroupedByStatus()) {
            long count = row.getCount() == null ? 0L : row.getCount();
            byStatus.put(row.getStatus().getValue(), count);
            total += count;
        }
        return new JobStatistics(byStatus, total);
    }

    public List<JobExecution> getJobExecutions(UUID jobId) {
        requireJob(jobId);
        return executionRepository.findByJobIdOrderByStartedAtDesc(jobId);
    }

    public List<JobExecution> getJobHistory(UUID jobId, int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be >= 1");
        }
        requireJob(jobId);
        return executionRepository.findByJobIdOrderByStartedAtDesc(jobId, PageRequest.of(0, limit));
    }

    // ---------------------------------------------------------------- internals

    private Job failOwningJob(JobExecution execution, String error, JsonNode details) {
        Job job = jobRepository.findByIdForUpdate(execution.getJobId()).orElse(null);
        if (job == null || !job.isRunning()) {
            return null;
        }
        job.markAsFailed(error, details);
        Job saved = jobRepository.save(job);
        if (saved.getStatus() == JobStatus.RETRY) {
            log.info("Job {} failed attempt {}; retry {}/{} at {}", job.getId(), execution.getRetryAttempt(),
                    saved.getRetryCount(), saved.getMaxRetries(), saved.getNextRetryAt());
        } else {
            log.warn("Job {} failed permanently after {} retries: {}", job.getId(), saved.getRetryCount(), error);
        }
        return saved;
    }

    private void scheduleRetryIfNeeded(Outcome outcome) {
        Job job = outcome.job();
        if (job == null || job.getStatus() != JobStatus.RETRY) {
            return;
        }
        long delay = job.getNextRetryAt() == null ? 0L
                : Math.max(0L, Duration.between(OffsetDateTime.now(), job.getNextRetryAt()).toMillis());
        try {
            enqueueRetry(job, delay);
        } catch (RuntimeException e) {
            // The RETRY status and nextRetryAt are committed; retryJob re-dispatches it.
            log.error("Failed to enqueue retry {} of job {}", job.getRetryCount(), job.getId(), e);
        }
    }

    private void enqueueRetry(Job job, long delayMs) {
        queueRouter.addJob(job.getType().getValue(), dispatchData(job, null),
                QueueOptions.none()
                        .withPriority(job.getPriority())
                        .withDelayMs(delayMs)
                        .withAttempts(1)
                        .withItemId("retry_" + job.getId() + "_" + job.getRetryCount() + "_" + System.currentTimeMillis())
                        .withOwnerId(job.getId()));
    }

    private void enqueueExecution(Dispatch dispatch) {
        Job job = dispatch.job();
        JobExecution execution = dispatch.execution();
        try {
            queueRouter.addJob(job.getType().getValue(), dispatchData(job, execution.getId()),
                    QueueOptions.none()
                            .withPriority(job.getPriority())
                            .withAttempts(1)
                            .withItemId(execution.getId().toString())
                            .withOwnerId(job.getId()));
        } catch (RuntimeException e) {
            log.error("Failed to enqueue execution {} of job {}", execution.getId(), job.getId(), e);
            failJobExecution(execution.getId(), "Failed to enqueue execution: " + e.getMessage(), null);
            if (e instanceof QueueBackendException queueFailure) {
                throw queueFailure;
            }
            throw new QueueBackendException("Failed to enqueue job " + job.getId(), e);
        }
    }

    private void registerOccurrence(Schedule schedule, Job job) {
        registerOccurrence(schedule, job, "");
    }

    private void registerOccurrence(Schedule schedule, Job job, String itemIdSuffix) {
        OffsetDateTime next = schedule.getNextExecution();
        // Rounded up so the item never becomes due before nextExecution.
        long delayNanos = Duration.between(OffsetDateTime.now(), next).toNanos();
        long delay = Math.max(0L, (delayNanos + 999_999L) / 1_000_000L);
        ObjectNode data = objectMapper.createObjectNode();
        data.put("scheduleId", schedule.getId().toString());
        data.put("jobId", job.getId().toString());
        queueRouter.addJob(SCHEDULE_ITEM_NAME, data,
                QueueOptions.none()
                        .withDelayMs(delay)
                        .withItemId(occurrenceItemId(schedule.getId(), next) + itemIdSuffix)
                        .withOwnerId(schedule.getId()));
        log.debug("Registered occurrence of schedule {} at {}", schedule.getId(), next);
    }

    static String occurrenceItemId(UUID scheduleId, OffsetDateTime occurrence) {
        return "schedule_" + scheduleId + "_" + occurrence.toInstant().toEpochMilli();
    }

    /**
     * Moves {@code nextExecution} to the first cron occurrence after now (and not before {@code startAt}).
     * A schedule with no occurrence left inside its window expires.
     */
    private void advance(Schedule schedule, OffsetDateTime now) {
        OffsetDateTime base = now;
        if (schedule.getStartAt() != null && schedule.getStartAt().isAfter(now)) {
            base = schedule.getStartAt().minusSeconds(1);
        }
        OffsetDateTime next = CronValidator.nextExecution(schedule.getCronExpression(),
                CronValidator.parseZone(schedule.getTimezone()), base);
        if (next == null || (schedule.getEndAt() != null && next.isAfter(schedule.getEndAt()))) {
            schedule.expire();
            return;
        }
        schedule.setNextExecution(next);
    }

    private ObjectNode dispatchData(Job job, UUID executionId) {
        ObjectNode data = objectMapper.createObjectNode();
        data.put("jobId", job.getId().toString());
        if (executionId != null) {
            data.put("executionId", executionId.toString());
        }
        data.put("type", job.getType().getValue());
        data.set("payload", job.getPayload());
        data.put("attempt", job.getRetryCount() + 1);
        return data;
    }

    private void removeQueueItemsQuietly(UUID ownerId) {
        try {
            int removed = queueRouter.removeOwnedItems(ownerId);
            if (removed > 0) {
                log.debug("Removed {} queued item(s) owned by {}", removed, ownerId);
            }
        } catch (RuntimeException e) {
            log.warn("Failed to remove queued items owned by {}: {}", ownerId, e.getMessage());
        }
    }

    private Job lockJob(UUID jobId) {
        return jobRepository.findByIdForUpdate(jobId).orElseThrow(() -> new ResourceNotFoundException("Job", jobId));
    }

    private Schedule lockSchedule(UUID jobId) {
        return scheduleRepository.findByJobIdForUpdate(jobId)
                .orElseThrow(() -> new ResourceNotFoundException("Schedule for job " + jobId + " not found"));
    }

    private JobExecution lockExecution(UUID executionId) {
        return executionRepository.findByIdForUpdate(executionId)
                .orElseThrow(() -> new ResourceNotFoundException("Job execution", executionId));
    }

    private void requireJob(UUID jobId) {
        if (!jobRepository.existsById(jobId)) {
            throw new ResourceNotFoundException("Job", jobId);
        }
    }

    private String normalizeRequiredName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Job name must not be blank");
        }
        String trimmed = name.trim();
        if (trimmed.length() > MAX_NAME_LENGTH) {
            throw new IllegalArgumentException("Job name must be at most " + MAX_NAME_LENGTH + " characters");
        }
        return trimmed;
    }

    private JsonNode normalizeObject(JsonNode value, String field) {
        if (value == null || value.isNull()) {
            return objectMapper.createObjectNode();
        }
        if (!value.isObject()) {
            throw new IllegalArgumentException(field + " must be a JSON object");
        }
        return value;
    }

    private static void validatePriority(int priority) {
        if (!JobPriority.isInRange(priority)) {
            throw new IllegalArgumentException("priority must be between " + JobPriority.LOW.getValue() + " and "
                    + JobPriority.CRITICAL.getValue() + " but was " + priority);
        }
    }

    private static void validateMaxRetries(int maxRetries) {
        if (maxRetries < 0 || maxRetries > MAX_RETRIES_LIMIT) {
            throw new IllegalArgumentException("maxRetries must be between 0 and " + MAX_RETRIES_LIMIT
                    + " but was " + maxRetries);
        }
    }

    private static void validateTimeout(Long timeoutMs) {
        if (timeoutMs != null && timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive");
        }
    }

    private record Dispatch(Job job, JobExecution execution) {
    }

    private record Outcome(JobExecution execution, Job job) {
    }

    private record Resumed(Job job, boolean changed) {
    }
}
