package com.schedq;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.schedq.config.SchedQProperties;
import com.schedq.exception.DuplicateResourceException;
import com.schedq.exception.InvalidCronExpressionException;
import com.schedq.exception.InvalidJobStateException;
import com.schedq.exception.QueueBackendException;
import com.schedq.exception.ResourceNotFoundException;
import com.schedq.queue.InMemoryQueueBackend;
import com.schedq.queue.QueueCounts;
import com.schedq.queue.QueueItem;
import com.schedq.queue.QueueItemState;
import com.schedq.queue.QueueName;
import com.schedq.queue.QueueRouter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.data.domain.Pageable;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SchedulerEngineTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final Map<UUID, Job> jobs = new HashMap<>();
    private final Map<UUID, Schedule> schedules = new HashMap<>();
    private final Map<UUID, JobExecution> executions = new HashMap<>();

    private JobRepository jobRepository;
    private ScheduleRepository scheduleRepository;
    private JobExecutionRepository executionRepository;
    private InMemoryQueueBackend backend;
    private QueueRouter queueRouter;
    private SchedulerEngine engine;

    @BeforeEach
    void setUp() {
        jobRepository = mock(JobRepository.class);
        scheduleRepository = mock(ScheduleRepository.class);
        executionRepository = mock(JobExecutionRepository.class);
        wireJobStore();
        wireScheduleStore();
        wireExecutionStore();

        backend = new InMemoryQueueBackend();
        queueRouter = new QueueRouter(backend, new SchedQProperties());
        engine = newEngine(queueRouter);
    }

    private SchedulerEngine newEngine(QueueRouter router) {
        TransactionTemplate transactionTemplate = new TransactionTemplate(mock(PlatformTransactionManager.class));
        return new SchedulerEngine(jobRepository, scheduleRepository, executionRepository, router,
                transactionTemplate, objectMapper, new SchedQProperties());
    }

    private void wireJobStore() {
        when(jobRepository.save(any(Job.class))).thenAnswer(invocation -> {
            Job job = invocation.getArgument(0);
            jobs.put(job.getId(), job);
            return job;
        });
        when(jobRepository.findById(any())).thenAnswer(invocation -> Optional.ofNullable(jobs.get(invocation.getArgument(0))));
        when(jobRepository.findByIdForUpdate(any()))
                .thenAnswer(invocation -> Optional.ofNullable(jobs.get(invocation.getArgument(0))));
        when(jobRepository.existsById(any())).thenAnswer(invocation -> jobs.containsKey(invocation.getArgument(0)));
    }

    private void wireScheduleStore() {
        when(scheduleRepository.save(any(Schedule.class))).thenAnswer(invocation -> {
            Schedule schedule = invocation.getArgument(0);
            schedules.put(schedule.getId(), schedule);
            return schedule;
        });
        when(scheduleRepository.findByIdForUpdate(any()))
                .thenAnswer(invocation -> Optional.ofNullable(schedules.get(invocation.getArgument(0))));
        when(scheduleRepository.findByJobId(any())).thenAnswer(invocation -> scheduleOf(invocation.getArgument(0)));
        when(scheduleRepository.findByJobIdForUpdate(any()))
                .thenAnswer(invocation -> scheduleOf(invocation.getArgument(0)));
        doAnswer(invocation -> {
            Schedule schedule = invocation.getArgument(0);
            schedules.remove(schedule.getId());
            return null;
        }).when(scheduleRepository).delete(any(Schedule.class));
    }

    private Optional<Schedule> scheduleOf(UUID jobId) {
        return schedules.values().stream().filter(schedule -> schedule.getJobId().equals(jobId)).findFirst();
    }

    private void wireExecutionStore() {
        when(executionRepository.save(any(JobExecution.class))).thenAnswer(invocation -> {
            JobExecution execution = invocation.getArgument(0);
            executions.put(execution.getId(), execution);
            return execution;
        });
        when(executionRepository.findByIdForUpdate(any()))
                .thenAnswer(invocation -> Optional.ofNullable(executions.get(invocation.getArgument(0))));
        when(executionRepository.findByJobIdAndStatus(any(), any())).thenAnswer(invocation -> executions.values()
                .stream()
                .filter(execution -> execution.getJobId().equals(invocation.getArgument(0)))
                .filter(execution -> execution.getStatus().equals(invocation.getArgument(1)))
                .toList());
    }

    private ObjectNode payload() {
        return objectMapper.createObjectNode().put("recipient", "ops@example.com");
    }

    private Job createJob(int maxRetries) {
        return engine.createJob(new JobSpec("Nightly digest", JobType.NOTIFICATION, payload(), null, maxRetries, null,
                null));
    }

    @Test
    void shouldApplyDefaultsWhenCreatingJob() {
        Job job = engine.createJob(new JobSpec("  Nightly digest  ", JobType.REPORT, null, null, null, null, null));

        assertEquals("Nightly digest", job.getName());
        assertEquals(JobStatus.PENDING, job.getStatus());
        assertEquals(1, job.getPriority());
        assertEquals(3, job.getMaxRetries());
        assertEquals(0, job.getRetryCount());
        assertTrue(job.getPayload().isObject());
        assertTrue(jobs.containsKey(job.getId()));
    }

    @Test
    void shouldRejectInvalidJobWithoutSavingIt() {
        assertThrows(IllegalArgumentException.class, () -> engine.createJob(JobSpec.of(" ", JobType.SYNC, payload())));
        assertThrows(IllegalArgumentException.class, () -> engine.createJob(JobSpec.of("x".repeat(256), JobType.SYNC,
                payload())));
        assertThrows(IllegalArgumentException.class, () -> engine.createJob(JobSpec.of("sync", null, payload())));
        assertThrows(IllegalArgumentException.class,
                () -> engine.createJob(new JobSpec("sync", JobType.SYNC, payload(), 0, null, null, null)));
        assertThrows(IllegalArgumentException.class,
                () -> engine.createJob(new JobSpec("sync", JobType.SYNC, payload(), 16, null, null, null)));
        assertThrows(IllegalArgumentException.class,
                () -> engine.createJob(new JobSpec("sync", JobType.SYNC, payload(), null, 101, null, null)));
        assertThrows(IllegalArgumentException.class,
                () -> engine.createJob(new JobSpec("sync", JobType.SYNC, payload(), null, null, null, 0L)));
        assertThrows(IllegalArgumentException.class,
                () -> engine.createJob(JobSpec.of("sync", JobType.SYNC, objectMapper.createArrayNode())));

        verify(jobRepository, never()).save(any(Job.class));
    }

    @Test
    void shouldClampListLimit() {
        ArgumentCaptor<Pageable> page = ArgumentCaptor.forClass(Pageable.class);

        engine.listJobs(null, null, 500);
        engine.listJobs(JobStatus.FAILED, null, 0);
        engine.listJobs(null, JobType.BACKUP, null);
        engine.listJobs(JobStatus.PENDING, JobType.BACKUP, 20);

        verify(jobRepository).findAllByOrderByCreatedAtDesc(page.capture());
        assertEquals(200, page.getValue().getPageSize());
        verify(jobRepository).findByStatusOrderByCreatedAtDesc(any(), page.capture());
        assertEquals(1, page.getValue().getPageSize());
        verify(jobRepository).findByTypeOrderByCreatedAtDesc(any(), page.capture());
        assertEquals(50, page.getValue().getPageSize());
        verify(jobRepository).findByStatusAndTypeOrderByCreatedAtDesc(any(), any(), page.capture());
        assertEquals(20, page.getValue().getPageSize());
    }

    @Test
    void shouldThrowNotFoundForUnknownJob() {
        UUID missing = UUID.randomUUID();

        assertThrows(ResourceNotFoundException.class, () -> engine.getJob(missing));
        assertThrows(ResourceNotFoundException.class, () -> engine.executeJob(missing));
        assertThrows(ResourceNotFoundException.class, () -> engine.getJobExecutions(missing));
        assertTrue(engine.findJobById(missing).isEmpty());
        assertTrue(engine.isCancellationRequested(missing));
    }

    @Test
    void shouldUpdateOnlyProvidedFields() {
        Job job = createJob(3);

        Job updated = engine.updateJob(job.getId(), new JobPatch(null, null, null, 12, null, null, 30_000L));

        assertEquals("Nightly digest", updated.getName());
        assertEquals(JobType.NOTIFICATION, updated.getType());
        assertEquals(12, updated.getPriority());
        assertEquals(30_000L, updated.getTimeoutMs());
    }

    @Test
    void shouldNotLowerMaxRetriesBelowRetriesUsed() {
        Job job = createJob(3);
        job.setRetryCount(2);

        assertThrows(IllegalArgumentException.class,
                () -> engine.updateJob(job.getId(), new JobPatch(null, null, null, null, 1, null, null)));
        assertEquals(3, jobs.get(job.getId()).getMaxRetries());
    }

    @Test
    void shouldDispatchExecutionAfterMarkingJobRunning() {
        Job job = createJob(3);

        JobExecution execution = engine.executeJob(job.getId());

        assertEquals(JobStatus.RUNNING, jobs.get(job.getId()).getStatus());
        assertEquals(ExecutionStatus.RUNNING, execution.getStatus());
        assertEquals(1, execution.getRetryAttempt());
        QueueItem item = queueRouter.getJob(execution.getId().toString()).orElseThrow();
        assertEquals(QueueName.SCHEDULER, item.queue());
        assertEquals("notification", item.name());
        assertEquals(job.getId(), item.ownerId());
        assertEquals(1, item.attempts());
        assertEquals(job.getId().toString(), item.data().get("jobId").asText());
        assertEquals(execution.getId().toString(), item.data().get("executionId").asText());
        assertEquals("ops@example.com", item.data().get("payload").get("recipient").asText());
    }

    @Test
    void shouldRouteHighPriorityJobsToPriorityQueue() {
        Job job = engine.createJob(new JobSpec("Page on-call", JobType.NOTIFICATION, payload(), 15, null, null, null));

        JobExecution execution = engine.executeJob(job.getId());

        assertEquals(QueueName.PRIORITY, queueRouter.getJob(execution.getId().toString()).orElseThrow().queue());
    }

    @Test
    void shouldRejectExecutingRunningJob() {
        Job job = createJob(3);
        engine.executeJob(job.getId());

        assertThrows(InvalidJobStateException.class, () -> engine.executeJob(job.getId()));
    }

    @Test
    void shouldConsumeRetriesUntilJobFailsPermanently() {
        Job job = createJob(2);

        JobExecution first = engine.executeJob(job.getId());
        engine.failJobExecution(first.getId(), "SMTP unavailable", null);

        Job afterFirst = jobs.get(job.getId());
        assertEquals(JobStatus.RETRY, afterFirst.getStatus());
        assertEquals(1, afterFirst.getRetryCount());
        assertThat(Duration.between(OffsetDateTime.now(), afterFirst.getNextRetryAt()))
                .isBetween(Duration.ofSeconds(110), Duration.ofMinutes(2));
        List<QueueItem> delayed = queueRouter.getJobsByState(QueueItemState.DELAYED, 10, 0);
        assertEquals(1, delayed.size());
        assertThat(delayed.get(0).id()).startsWith("retry_" + job.getId() + "_1_");
        assertFalse(delayed.get(0).data().has("executionId"));

        ClaimedExecution second = engine.startExecution(job.getId(), null, "worker-1", "delayed").orElseThrow();
        assertEquals(2, second.execution().getRetryAttempt());
        assertEquals("worker-1", second.execution().getWorkerId());
        engine.failJobExecution(second.execution().getId(), "SMTP unavailable", null);

        Job afterSecond = jobs.get(job.getId());
        assertEquals(JobStatus.RETRY, afterSecond.getStatus());
        assertEquals(2, afterSecond.getRetryCount());
        assertThat(Duration.between(OffsetDateTime.now(), afterSecond.getNextRetryAt()))
                .isBetween(Duration.ofSeconds(230), Duration.ofMinutes(4));

        ClaimedExecution third = engine.startExecution(job.getId(), null, "worker-1", "delayed").orElseThrow();
        assertEquals(3, third.execution().getRetryAttempt());
        engine.failJobExecution(third.execution().getId(), "SMTP unavailable", null);

        Job failed = jobs.get(job.getId());
        assertEquals(JobStatus.FAILED, failed.getStatus());
        assertEquals(2, failed.getRetryCount());
        assertNull(failed.getNextRetryAt());
        assertEquals("SMTP unavailable", failed.getErrorMessage());
        assertEquals(2, queueRouter.getJobsByState(QueueItemState.DELAYED, 10, 0).size());
    }

    @Test
    void shouldFailPermanentlyWithoutRetriesWhenMaxRetriesIsZero() {
        Job job = createJob(0);
        JobExecution execution = engine.executeJob(job.getId());

        engine.failJobExecution(execution.getId(), "boom", null);

        assertEquals(JobStatus.FAILED, jobs.get(job.getId()).getStatus());
        assertTrue(queueRouter.getJobsByState(QueueItemState.DELAYED, 10, 0).isEmpty());
    }

    @Test
    void shouldMarkTimeoutAndScheduleRetry() {
        Job job = createJob(1);
        JobExecution execution = engine.executeJob(job.getId());

        JobExecution timedOut = engine.timeoutJobExecution(execution.getId());

        assertEquals(ExecutionStatus.TIMEOUT, timedOut.getStatus());
        Job retrying = jobs.get(job.getId());
        assertEquals(JobStatus.RETRY, retrying.getStatus());
        assertTrue(retrying.getErrorDetails().get("timeout").asBoolean());
    }

    @Test
    void shouldIgnoreCompletionOfCancelledExecution() {
        Job job = createJob(3);
        JobExecution execution = engine.executeJob(job.getId());

        engine.cancelJob(job.getId());
        JobExecution result = engine.completeJobExecution(execution.getId(), "sent");

        assertEquals(ExecutionStatus.CANCELLED, result.getStatus());
        assertNull(result.getOutput());
        assertEquals(JobStatus.CANCELLED, jobs.get(job.getId()).getStatus());
        assertTrue(engine.isCancellationRequested(job.getId()));
        assertTrue(queueRouter.getJob(execution.getId().toString()).isEmpty());
    }

    @Test
    void shouldCompleteRunningExecution() {
        Job job = createJob(3);
        JobExecution execution = engine.executeJob(job.getId());

        JobExecution completed = engine.completeJobExecution(execution.getId(), "sent");

        assertEquals(ExecutionStatus.COMPLETED, completed.getStatus());
        assertEquals("sent", completed.getOutput());
        assertEquals(JobStatus.COMPLETED, jobs.get(job.getId()).getStatus());
        assertThrows(InvalidJobStateException.class, () -> engine.cancelJob(job.getId()));
    }

    @Test
    void shouldCancelPreCreatedExecutionWhenJobWasPausedBeforeDelivery() {
        Job job = createJob(3);
        JobExecution execution = engine.executeJob(job.getId());
        engine.pauseJob(job.getId());

        Optional<ClaimedExecution> claimed = engine.startExecution(job.getId(), execution.getId(), "worker-1",
                "scheduler");

        assertTrue(claimed.isEmpty());
        assertEquals(ExecutionStatus.CANCELLED, executions.get(execution.getId()).getStatus());
    }

    @Test
    void shouldAdoptPreCreatedExecutionForRunningJob() {
        Job job = createJob(3);
        JobExecution execution = engine.executeJob(job.getId());

        ClaimedExecution claimed = engine.startExecution(job.getId(), execution.getId(), "worker-7", "scheduler")
                .orElseThrow();

        assertEquals(execution.getId(), claimed.execution().getId());
        assertEquals("worker-7", claimed.execution().getWorkerId());
        assertEquals("scheduler", claimed.execution().getQueueName());
    }

    @Test
    void shouldHoldAndReleaseQueuedItemsOnPauseAndResume() {
        Job job = createJob(3);
        JobExecution execution = engine.executeJob(job.getId());

        Job paused = engine.pauseJob(job.getId());
        assertEquals(JobStatus.PAUSED, paused.getStatus());
        assertEquals(QueueItemState.PAUSED, queueRouter.getJob(execution.getId().toString()).orElseThrow().state());

        Job resumed = engine.resumeJob(job.getId());
        assertEquals(JobStatus.PENDING, resumed.getStatus());
        assertEquals(QueueItemState.WAITING, queueRouter.getJob(execution.getId().toString()).orElseThrow().state());

        assertEquals(JobStatus.PENDING, engine.resumeJob(job.getId()).getStatus());
    }

    @Test
    void shouldGrantExtraAttemptOnlyWhileRetriesRemain() {
        Job job = createJob(0);
        JobExecution execution = engine.executeJob(job.getId());
        engine.failJobExecution(execution.getId(), "boom", null);

        assertThrows(InvalidJobStateException.class, () -> engine.retryJob(job.getId()));

        engine.updateJob(job.getId(), new JobPatch(null, null, null, null, 1, null, null));
        Job retried = engine.retryJob(job.getId());

        assertEquals(JobStatus.RETRY, retried.getStatus());
        assertEquals(1, retried.getRetryCount());
        List<QueueItem> waiting = queueRouter.getJobsByState(QueueItemState.WAITING, 10, 0);
        assertEquals(1, waiting.size());
        assertThat(waiting.get(0).id()).startsWith("retry_" + job.getId());
    }

    @Test
    void shouldRequeueFailedJobAsFreshExecution() {
        Job job = createJob(0);
        JobExecution first = engine.executeJob(job.getId());
        engine.failJobExecution(first.getId(), "boom", null);

        JobExecution second = engine.requeueJob(job.getId());

        Job requeued = jobs.get(job.getId());
        assertEquals(JobStatus.RUNNING, requeued.getStatus());
        assertEquals(0, requeued.getRetryCount());
        assertNull(requeued.getErrorMessage());
        assertEquals(1, second.getRetryAttempt());
        assertThrows(InvalidJobStateException.class, () -> engine.requeueJob(job.getId()));
    }

    @Test
    void shouldFailExecutionWhenQueueRejectsIt() {
        QueueRouter failingRouter = mock(QueueRouter.class);
        when(failingRouter.addJob(anyString(), any(), any())).thenThrow(new IllegalStateException("queue down"));
        SchedulerEngine failingEngine = newEngine(failingRouter);
        Job job = failingEngine.createJob(JobSpec.of("Sync", JobType.SYNC, payload()));

        QueueBackendException error = assertThrows(QueueBackendException.class,
                () -> failingEngine.executeJob(job.getId()));

        assertThat(error.getMessage()).contains(job.getId().toString());
        JobExecution execution = executions.values().iterator().next();
        assertEquals(ExecutionStatus.FAILED, execution.getStatus());
        assertThat(execution.getErrorMessage()).startsWith("Failed to enqueue execution");
        assertEquals(JobStatus.RETRY, jobs.get(job.getId()).getStatus());
    }

    @Test
    void shouldNotPersistScheduleWithInvalidCron() {
        Job job = createJob(3);

        assertThrows(InvalidCronExpressionException.class,
                () -> engine.scheduleJob(job.getId(), ScheduleSpec.cron("every five minutes")));

        verify(scheduleRepository, never()).save(any(Schedule.class));
        assertEquals(0, queueRouter.getQueueStats().total().total());
    }

    @Test
    void shouldRejectScheduleWithClosedOrInvertedWindow() {
        Job job = createJob(3);
        OffsetDateTime now = OffsetDateTime.now();

        assertThrows(IllegalArgumentException.class, () -> engine.scheduleJob(job.getId(),
                new ScheduleSpec("*/5 * * * *", null, null, null, now.minusMinutes(1), null, null)));
        assertThrows(IllegalArgumentException.class, () -> engine.scheduleJob(job.getId(),
                new ScheduleSpec("*/5 * * * *", null, null, now.plusDays(2), now.plusDays(1), null, null)));
        assertThrows(IllegalArgumentException.class, () -> engine.scheduleJob(job.getId(),
                new ScheduleSpec("*/5 * * * *", "Mars/Olympus", null, null, null, null, null)));
        assertThrows(IllegalArgumentException.class, () -> engine.scheduleJob(job.getId(),
                new ScheduleSpec("*/5 * * * *", null, null, null, null, 0, null)));
    }

    @Test
    void shouldScheduleJobAndRegisterFirstOccurrence() {
        Job job = createJob(3);

        Schedule schedule = engine.scheduleJob(job.getId(),
                new ScheduleSpec("*/5 * * * *", "Europe/Berlin", null, null, null, 3, null));

        assertEquals(ScheduleStatus.ACTIVE, schedule.getStatus());
        assertEquals("Europe/Berlin", schedule.getTimezone());
        assertThat(schedule.getNextExecution()).isAfter(OffsetDateTime.now());
        String itemId = "schedule_" + schedule.getId() + "_" + schedule.getNextExecution().toInstant().toEpochMilli();
        QueueItem occurrence = queueRouter.getJob(itemId).orElseThrow();
        assertEquals(SchedulerEngine.SCHEDULE_ITEM_NAME, occurrence.name());
        assertEquals(schedule.getId(), occurrence.ownerId());
        assertEquals(schedule.getId().toString(), occurrence.data().get("scheduleId").asText());
    }

    @Test
    void shouldCreateInactiveScheduleAsPausedWithoutOccurrence() {
        Job job = createJob(3);

        Schedule schedule = engine.scheduleJob(job.getId(),
                new ScheduleSpec("0 9 * * *", null, false, null, null, null, null));

        assertEquals(ScheduleStatus.PAUSED, schedule.getStatus());
        assertFalse(schedule.isActive());
        assertEquals(0, queueRouter.getQueueStats().total().total());
    }

    @Test
    void shouldRejectSecondLiveScheduleButReplaceFinishedOne() {
        Job job = createJob(3);
        Schedule first = engine.scheduleJob(job.getId(), ScheduleSpec.cron("0 9 * * *"));

        assertThrows(DuplicateResourceException.class,
                () -> engine.scheduleJob(job.getId(), ScheduleSpec.cron("0 10 * * *")));

        first.expire();
        Schedule replacement = engine.scheduleJob(job.getId(), ScheduleSpec.cron("0 10 * * *"));

        verify(scheduleRepository).delete(first);
        assertEquals("0 10 * * *", replacement.getCronExpression());
        assertEquals(replacement.getId(), engine.getSchedule(job.getId()).getId());
    }

    @Test
    void shouldPauseResumeAndDeactivateSchedule() {
        Job job = createJob(3);
        Schedule schedule = engine.scheduleJob(job.getId(), ScheduleSpec.cron("0 9 * * *"));

        assertEquals(ScheduleStatus.PAUSED, engine.pauseSchedule(job.getId()).getStatus());
        assertEquals(0, queueRouter.getQueueStats().total().total());
        assertThrows(InvalidJobStateException.class, () -> engine.pauseSchedule(job.getId()));

        Schedule resumed = engine.resumeSchedule(job.getId());
        assertEquals(ScheduleStatus.ACTIVE, resumed.getStatus());
        assertEquals(1, queueRouter.getQueueStats().total().total());

        Schedule deactivated = engine.deactivateSchedule(job.getId());
        assertEquals(ScheduleStatus.INACTIVE, deactivated.getStatus());
        assertNull(deactivated.getNextExecution());
        assertEquals(0, queueRouter.getQueueStats().total().total());
        assertThrows(InvalidJobStateException.class, () -> engine.resumeSchedule(job.getId()));
        assertEquals(schedule.getId(), engine.getSchedule(job.getId()).getId());
    }

    @Test
    void shouldDispatchJobWhenScheduleFires() {
        Job job = createJob(3);
        Schedule schedule = engine.scheduleJob(job.getId(),
                new ScheduleSpec("*/5 * * * *", null, null, null, null, 2, null));
        schedule.setNextExecution(OffsetDateTime.now().minusSeconds(1));

        JobExecution execution = engine.fireSchedule(schedule.getId()).orElseThrow();

        assertEquals(JobStatus.RUNNING, jobs.get(job.getId()).getStatus());
        assertEquals(schedule.getId().toString(), execution.getExecutionContext().get("scheduleId").asText());
        assertEquals(1, execution.getExecutionContext().get("occurrence").asInt());
        assertEquals(1, schedule.getExecutionCount());
        assertThat(schedule.getNextExecution()).isAfter(OffsetDateTime.now());
        assertTrue(queueRouter.getJob(execution.getId().toString()).isPresent());
    }

    @Test
    void shouldExpireScheduleWhenMaxExecutionsReached() {
        Job job = createJob(3);
        Schedule schedule = engine.scheduleJob(job.getId(),
                new ScheduleSpec("*/5 * * * *", null, null, null, null, 1, null));
        schedule.setNextExecution(OffsetDateTime.now().minusSeconds(1));

        assertTrue(engine.fireSchedule(schedule.getId()).isPresent());

        assertEquals(ScheduleStatus.EXPIRED, schedule.getStatus());
        assertNull(schedule.getNextExecution());
    }

    @Test
    void shouldRearmFinishedJobWhenScheduleFires() {
        Job job = createJob(3);
        job.setStatus(JobStatus.COMPLETED);
        Schedule schedule = engine.scheduleJob(job.getId(), ScheduleSpec.cron("*/5 * * * *"));
        schedule.setNextExecution(OffsetDateTime.now().minusSeconds(1));

        assertTrue(engine.fireSchedule(schedule.getId()).isPresent());
        assertEquals(JobStatus.RUNNING, jobs.get(job.getId()).getStatus());
    }

    @Test
    void shouldSkipOccurrenceWhileJobIsPaused() {
        Job job = createJob(3);
        Schedule schedule = engine.scheduleJob(job.getId(), ScheduleSpec.cron("*/5 * * * *"));
        engine.pauseJob(job.getId());
        schedule.setNextExecution(OffsetDateTime.now().minusSeconds(1));

        Optional<JobExecution> fired = engine.fireSchedule(schedule.getId());

        assertTrue(fired.isEmpty());
        assertEquals(0, schedule.getExecutionCount());
        assertEquals(JobStatus.PAUSED, jobs.get(job.getId()).getStatus());
        assertThat(schedule.getNextExecution()).isAfter(OffsetDateTime.now());
    }

    @Test
    void shouldIgnoreOccurrencesOfUnknownOrPausedSchedules() {
        assertTrue(engine.fireSchedule(UUID.randomUUID()).isEmpty());

        Job job = createJob(3);
        Schedule schedule = engine.scheduleJob(job.getId(), ScheduleSpec.cron("*/5 * * * *"));
        engine.pauseSchedule(job.getId());

        assertTrue(engine.fireSchedule(schedule.getId()).isEmpty());
        assertEquals(0, schedule.getExecutionCount());
    }

    @Test
    void shouldReRegisterEarlyOccurrenceWithoutFiring() {
        Job job = createJob(3);
        Schedule schedule = engine.scheduleJob(job.getId(), ScheduleSpec.cron("0 9 * * *"));
        OffsetDateTime next = schedule.getNextExecution();

        assertTrue(engine.fireSchedule(schedule.getId()).isEmpty());

        assertEquals(0, schedule.getExecutionCount());
        assertEquals(next, schedule.getNextExecution());
        assertEquals(JobStatus.PENDING, jobs.get(job.getId()).getStatus());
    }

    @Test
    void shouldKeepOccurrenceQueuedWhenDeliveredItemArrivesEarly() {
        InMemoryQueueBackend aheadBackend = new InMemoryQueueBackend(
                Clock.offset(Clock.systemUTC(), Duration.ofHours(25)));
        QueueRouter aheadRouter = new QueueRouter(aheadBackend, new SchedQProperties());
        SchedulerEngine aheadEngine = newEngine(aheadRouter);
        Job job = createJob(3);
        Schedule schedule = aheadEngine.scheduleJob(job.getId(), ScheduleSpec.cron("0 9 * * *"));
        OffsetDateTime next = schedule.getNextExecution();

        List<QueueItem> delivered = aheadRouter.claim(QueueName.DELAYED, 1, "worker-1");
        assertEquals(1, delivered.size());
        assertEquals(SchedulerEngine.occurrenceItemId(schedule.getId(), next), delivered.get(0).id());

        assertTrue(aheadEngine.fireSchedule(schedule.getId()).isEmpty());
        aheadRouter.completeItem(delivered.get(0), null);

        assertEquals(0, schedule.getExecutionCount());
        assertEquals(ScheduleStatus.ACTIVE, schedule.getStatus());
        assertEquals(next, schedule.getNextExecution());
        QueueCounts counts = aheadBackend.counts(QueueName.DELAYED);
        assertEquals(1, counts.completed());
        assertEquals(1, counts.waiting() + counts.delayed());
    }

    @Test
    void shouldDeleteJobWithScheduleExecutionsAndQueuedItems() {
        Job job = createJob(3);
        Schedule schedule = engine.scheduleJob(job.getId(), ScheduleSpec.cron("0 9 * * *"));
        engine.pauseJob(job.getId());

        engine.deleteJob(job.getId());

        verify(executionRepository).deleteByJobId(job.getId());
        verify(scheduleRepository).deleteByJobId(job.getId());
        verify(jobRepository).delete(job);
        assertTrue(backend.find(QueueName.DELAYED, "schedule_" + schedule.getId() + "_"
                + schedule.getNextExecution().toInstant().toEpochMilli()).isEmpty());
    }

    @Test
    void shouldZeroFillStatistics() {
        JobRepository.StatusCount pending = statusCount(JobStatus.PENDING, 4L);
        JobRepository.StatusCount failed = statusCount(JobStatus.FAILED, 1L);
        when(jobRepository.countGroupedByStatus()).thenReturn(List.of(pending, failed));

        JobStatistics statistics = engine.getJobStatistics();

        assertEquals(5, statistics.total());
        assertEquals(JobStatus.values().length, statistics.byStatus().size());
        assertEquals(4L, statistics.byStatus().get("pending"));
        assertEquals(0L, statistics.byStatus().get("running"));
        assertEquals(1L, statistics.byStatus().get("failed"));
    }

    @Test
    void shouldReturnExecutionHistoryNewestFirst() {
        Job job = createJob(3);
        JobExecution first = engine.executeJob(job.getId());
        engine.completeJobExecution(first.getId(), null);
        job.setStatus(JobStatus.PENDING);
        JobExecution second = engine.executeJob(job.getId());
        List<JobExecution> newestFirst = executions.values().stream()
                .sorted(Comparator.comparing(JobExecution::getStartedAt).reversed())
                .toList();
        when(executionRepository.findByJobIdOrderByStartedAtDesc(any(UUID.class), any(Pageable.class)))
                .thenReturn(newestFirst.subList(0, 1));

        List<JobExecution> history = engine.getJobHistory(job.getId(), 1);

        assertEquals(1, history.size());
        assertThat(List.of(first.getId(), second.getId())).contains(history.get(0).getId());
        assertThrows(IllegalArgumentException.class, () -> engine.getJobHistory(job.getId(), 0));
    }

    private static JobRepository.StatusCount statusCount(JobStatus status, Long count) {
        return new JobRepository.StatusCount() {
            @Override
            public JobStatus getStatus() {
                return status;
            }

            @Override
            public Long getCount() {
                return count;
            }
        };
    }
}
