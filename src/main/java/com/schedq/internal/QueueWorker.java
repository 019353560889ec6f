package com.schedq.internal;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.schedq.ClaimedExecution;
import com.schedq.Job;
import com.schedq.JobContext;
import com.schedq.JobExecution;
import com.schedq.JobType;
import com.schedq.SchedulerEngine;
import com.schedq.config.SchedQProperties;
import com.schedq.queue.QueueItem;
import com.schedq.queue.QueueName;
import com.schedq.queue.QueueRouter;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Claims due queue items and runs them. Three kinds of items arrive:
 * <ul>
 * <li>schedule occurrences, handed to {@link SchedulerEngine#fireSchedule(UUID)}</li>
 * <li>job dispatches carrying a {@code jobId}, run through the engine's execution lifecycle</li>
 * <li>raw items added through the queue API, whose name selects the handler directly</li>
 * </ul>
 */
@Component
@ConditionalOnProperty(prefix = "schedq.worker", name = "enabled", havingValue = "true", matchIfMissing = true)
public class QueueWorker {

    private static final Logger log = LoggerFactory.getLogger(QueueWorker.class);

    static final List<QueueName> POLL_ORDER = List.of(QueueName.PRIORITY, QueueName.SCHEDULER, QueueName.DELAYED);

    private final SchedulerEngine engine;
    private final QueueRouter queueRouter;
    private final JobHandlerRegistry handlerRegistry;
    private final ObjectMapper objectMapper;
    private final int workerCount;
    private final long defaultTimeoutMs;
    private final String workerId;
    private final ThreadPoolExecutor processingExecutor;
    private final ThreadPoolExecutor handlerExecutor;
    private final AtomicBoolean pollInProgress = new AtomicBoolean(false);

    public QueueWorker(
            SchedulerEngine engine,
            QueueRouter queueRouter,
            JobHandlerRegistry handlerRegistry,
            @Qualifier("schedqObjectMapper") ObjectMapper objectMapper,
            SchedQProperties properties) {
        this.engine = engine;
        this.queueRouter = queueRouter;
        this.handlerRegistry = handlerRegistry;
        this.objectMapper = objectMapper;
        SchedQProperties.Worker settings = properties.getWorker();
        this.workerCount = Math.max(1, settings.getWorkerCount());
        this.defaultTimeoutMs = settings.getDefaultTimeout().toMillis();
        this.workerId = settings.getWorkerId() != null && !settings.getWorkerId().isBlank()
                ? settings.getWorkerId()
                : "worker-" + UUID.randomUUID();

        int processingQueueCapacity = Math.max(32, workerCount * 8);
        this.processingExecutor = new ThreadPoolExecutor(
                workerCount,
                workerCount,
                0L,
                TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(processingQueueCapacity),
                new ThreadPoolExecutor.CallerRunsPolicy());

        // Handlers run on their own pool so a processing thread can abandon one that overruns its timeout.
        this.handlerExecutor = new ThreadPoolExecutor(
                workerCount,
                workerCount,
                0L,
                TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>());
    }

    @PostConstruct
    public void init() {
        log.info("Queue worker {} started with {} thread(s) for job types {}", workerId, workerCount,
                handlerRegistry.registeredTypes());
    }

    public String getWorkerId() {
        return workerId;
    }

    @Scheduled(fixedDelayString = "${schedq.worker.poll-interval-ms:1000}")
    public void poll() {
        if (!pollInProgress.compareAndSet(false, true)) {
            return;
        }
        try {
            for (QueueName queue : POLL_ORDER) {
                int availableSlots = availableProcessingSlots();
                if (availableSlots <= 0) {
                    return;
                }
                List<QueueItem> items;
                try {
                    items = queueRouter.claim(queue, availableSlots, workerId);
                } catch (RuntimeException e) {
                    log.error("Failed to claim items from queue {}", queue.getValue(), e);
                    continue;
                }
                for (QueueItem item : items) {
                    processingExecutor.execute(() -> process(item));
                }
            }
        } finally {
            pollInProgress.set(false);
        }
    }

    // A handler that ignored its interrupt still holds a handler thread after its item was timed out.
    int availableProcessingSlots() {
        int processing = processingExecutor.getActiveCount() + processingExecutor.getQueue().size();
        int handling = handlerExecutor.getActiveCount() + handlerExecutor.getQueue().size();
        return workerCount - Math.max(processing, handling);
    }

    void process(QueueItem item) {
        log.debug("Processing item {} ({}) from queue {}", item.id(), item.name(), item.queue().getValue());
        try {
            if (SchedulerEngine.SCHEDULE_ITEM_NAME.equals(item.name())) {
                processScheduleOccurrence(item);
            } else if (item.data() != null && item.data().hasNonNull("jobId")) {
                processJobDispatch(item);
            } else {
                processRawItem(item);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failItemQuietly(item, "Worker interrupted");
        } catch (Exception e) {
            log.error("Failed to process item {} ({}) from queue {}", item.id(), item.name(),
                    item.queue().getValue(), e);
            failItemQuietly(item, messageOf(e));
        }
    }

    private void processScheduleOccurrence(QueueItem item) {
        UUID scheduleId = UUID.fromString(item.data().path("scheduleId").asText());
        Optional<JobExecution> execution = engine.fireSchedule(scheduleId);
        queueRouter.completeItem(item, execution.map(e -> e.getId().toString()).orElse(null));
    }

    private void processJobDispatch(QueueItem item) throws InterruptedException {
        UUID jobId = UUID.fromString(item.data().get("jobId").asText());
        UUID executionId = item.data().hasNonNull("executionId")
                ? UUID.fromString(item.data().get("executionId").asText())
                : null;
        Optional<ClaimedExecution> claimed = engine.startExecution(jobId, executionId, workerId,
                item.queue().getValue());
        if (claimed.isEmpty()) {
            queueRouter.completeItem(item, null);
            return;
        }

        Job job = claimed.get().job();
        JobExecution execution = claimed.get().execution();
        JobContext context = new JobContext(job.getId(), execution.getId(), execution.getRetryAttempt(), workerId,
                () -> engine.isCancellationRequested(jobId));
        long timeoutMs = job.getTimeoutMs() != null ? job.getTimeoutMs() : defaultTimeoutMs;
        try {
            Object result = runHandler(() -> handlerRegistry.invoke(job.getType(), context, job.getPayload()),
                    timeoutMs);
            engine.completeJobExecution(execution.getId(), toOutput(result));
            queueRouter.completeItem(item, execution.getId().toString());
        } catch (TimeoutException e) {
            engine.timeoutJobExecution(execution.getId());
            queueRouter.failItem(item, "Execution timed out after " + timeoutMs + " ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Job {} of type {} failed in execution {}", job.getId(), job.getType().getValue(),
                    execution.getId(), cause);
            ObjectNode details = objectMapper.createObjectNode();
            details.put("exception", cause.getClass().getName());
            engine.failJobExecution(execution.getId(), messageOf(cause), details);
            queueRouter.failItem(item, messageOf(cause));
        } catch (InterruptedException e) {
            engine.failJobExecution(execution.getId(), "Worker interrupted", null);
            throw e;
        }
    }

    private void processRawItem(QueueItem item) throws Exception {
        JobType type = JobType.fromValue(item.name());
        JobContext context = new JobContext(null, null, item.attemptsMade(), workerId, null);
        try {
            Object result = runHandler(() -> handlerRegistry.invoke(type, context, item.data()), defaultTimeoutMs);
            queueRouter.completeItem(item, toOutput(result));
        } catch (TimeoutException e) {
            queueRouter.failItem(item, "Execution timed out after " + defaultTimeoutMs + " ms");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Handler for item {} ({}) failed: {}", item.id(), item.name(), messageOf(cause));
            queueRouter.failItem(item, messageOf(cause));
        }
    }

    /**
     * Runs a handler on the handler pool and waits at most {@code timeoutMs} once it has started. Time spent
     * queued behind a busy handler thread does not count against the timeout.
     */
    private Object runHandler(Callable<Object> handler, long timeoutMs)
            throws InterruptedException, ExecutionException, TimeoutException {
        CountDownLatch started = new CountDownLatch(1);
        Future<Object> future = handlerExecutor.submit(() -> {
            started.countDown();
            return handler.call();
        });
        try {
            started.await();
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException | InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }

    private void failItemQuietly(QueueItem item, String reason) {
        try {
            queueRouter.failItem(item, reason);
        } catch (RuntimeException e) {
            log.error("Failed to record failure of item {} on queue {}", item.id(), item.queue().getValue(), e);
        }
    }

    private String toOutput(Object result) {
        if (result == null) {
            return null;
        }
        if (result instanceof String text) {
            return text;
        }
        if (result instanceof JsonNode node) {
            return node.toString();
        }
        try {
            return objectMapper.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            log.warn("Handler result of type {} is not serializable; storing toString()", result.getClass().getName());
            return String.valueOf(result);
        }
    }

    private static String messageOf(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getName();
    }

    @PreDestroy
    void shutdownExecutor() {
        processingExecutor.shutdown();
        handlerExecutor.shutdown();
    }
}
