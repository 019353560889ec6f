package com.schedq;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.schedq.queue.QueueItem;
import com.schedq.queue.QueueItemState;
import com.schedq.queue.QueueOptions;
import com.schedq.queue.QueueRouter;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;

import static org.awaitility.Awaitility.await;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest(classes = { TestApplication.class, SchedQIntegrationTest.TestConfig.class })
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
public class SchedQIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:17-alpine")
            .withDatabaseName("testdb")
            .withUsername("test")
            .withPassword("test");

    @DynamicPropertySource
    static void registerPgProperties(DynamicPropertyRegistry registry) {
        registry.add("testcontainers.postgresql.host", postgres::getHost);
        registry.add("testcontainers.postgresql.port", postgres::getFirstMappedPort);
        registry.add("testcontainers.postgresql.database", postgres::getDatabaseName);
        registry.add("testcontainers.postgresql.username", postgres::getUsername);
        registry.add("testcontainers.postgresql.password", postgres::getPassword);
    }

    @Autowired
    SchedulerEngine engine;

    @Autowired
    QueueRouter queueRouter;

    @Autowired
    JobRepository jobRepository;

    @Autowired
    JobExecutionRepository executionRepository;

    @Autowired
    JdbcTemplate jdbcTemplate;

    @Autowired
    ObjectMapper objectMapper;

    static final ConcurrentLinkedQueue<String> generatedReports = new ConcurrentLinkedQueue<>();

    record ReportRequest(String report) {
    }

    @Configuration
    static class TestConfig {
        @Bean
        JobHandler<ReportRequest> reportHandler() {
            return new JobHandler<ReportRequest>() {
                @Override
                public JobType getJobType() {
                    return JobType.REPORT;
                }

                @Override
                public Object handle(JobContext context, ReportRequest payload) {
                    generatedReports.add(payload.report());
                    return "report:" + payload.report();
                }
            };
        }

        @Bean
        JobHandler<Void> syncHandler() {
            return new JobHandler<Void>() {
                @Override
                public JobType getJobType() {
                    return JobType.SYNC;
                }

                @Override
                public Object handle(JobContext context, Void payload) {
                    throw new IllegalStateException("upstream unavailable");
                }
            };
        }
    }

    private Job createReportJob(String report) {
        return engine.createJob(JobSpec.of("Report " + report, JobType.REPORT,
                objectMapper.createObjectNode().put("report", report)));
    }

    @Test
    void shouldRecordAppliedMigration() {
        Integer applied = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM schedq_schema_migrations WHERE version = '1'", Integer.class);
        assertEquals(1, applied);
    }

    @Test
    void shouldExecuteJobThroughQueue() {
        Job job = createReportJob("revenue");

        JobExecution execution = engine.executeJob(job.getId());

        await().atMost(Duration.ofSeconds(20)).untilAsserted(() -> {
            JobExecution stored = executionRepository.findById(execution.getId()).orElseThrow();
            assertEquals(ExecutionStatus.COMPLETED, stored.getStatus());
            assertEquals("report:revenue", stored.getOutput());
            assertEquals("it-worker", stored.getWorkerId());
            assertEquals("scheduler", stored.getQueueName());
        });
        Job completed = jobRepository.findById(job.getId()).orElseThrow();
        assertEquals(JobStatus.COMPLETED, completed.getStatus());
        assertNotNull(completed.getCompletedAt());
        assertTrue(generatedReports.contains("revenue"));
    }

    @Test
    void shouldFailJobWithoutRetriesLeft() {
        Job job = engine.createJob(new JobSpec("Sync ledger", JobType.SYNC, null, null, 0, null, null));

        JobExecution execution = engine.executeJob(job.getId());

        await().atMost(Duration.ofSeconds(20)).untilAsserted(() -> {
            QueueItem item = queueRouter.getJob(execution.getId().toString()).orElseThrow();
            assertEquals(QueueItemState.FAILED, item.state());
        });
        Job failed = jobRepository.findById(job.getId()).orElseThrow();
        assertEquals(JobStatus.FAILED, failed.getStatus());
        assertEquals("upstream unavailable", failed.getErrorMessage());
        JobExecution stored = executionRepository.findById(execution.getId()).orElseThrow();
        assertEquals(ExecutionStatus.FAILED, stored.getStatus());
        assertEquals(IllegalStateException.class.getName(), stored.getErrorDetails().get("exception").asText());
    }

    @Test
    void shouldScheduleRetryWithBackoffAfterFailure() {
        Job job = engine.createJob(new JobSpec("Sync ledger", JobType.SYNC, null, null, 2, null, null));

        engine.executeJob(job.getId());

        await().atMost(Duration.ofSeconds(20)).untilAsserted(() -> {
            Job retrying = jobRepository.findById(job.getId()).orElseThrow();
            assertEquals(JobStatus.RETRY, retrying.getStatus());
            assertEquals(1, retrying.getRetryCount());
            assertTrue(retrying.getNextRetryAt().isAfter(OffsetDateTime.now().plusSeconds(60)));
            List<QueueItem> delayed = queueRouter.getJobsByState(QueueItemState.DELAYED, 50, 0);
            assertTrue(delayed.stream().anyMatch(item -> item.id().startsWith("retry_" + job.getId() + "_1_")));
        });
    }

    @Test
    void shouldFireDueScheduleOccurrence() {
        Job job = createReportJob("inventory");
        Schedule schedule = engine.scheduleJob(job.getId(), ScheduleSpec.cron("0 3 * * *"));
        assertEquals(ScheduleStatus.ACTIVE, schedule.getStatus());
        jdbcTemplate.update("UPDATE schedq_schedules SET next_execution = ? WHERE id = ?",
                OffsetDateTime.now().minusSeconds(5), schedule.getId());

        JobExecution execution = engine.fireSchedule(schedule.getId()).orElseThrow();

        await().atMost(Duration.ofSeconds(20)).untilAsserted(() -> assertEquals(ExecutionStatus.COMPLETED,
                executionRepository.findById(execution.getId()).orElseThrow().getStatus()));
        Schedule advanced = engine.getSchedule(job.getId());
        assertEquals(1, advanced.getExecutionCount());
        assertNotNull(advanced.getLastExecution());
        assertTrue(advanced.getNextExecution().isAfter(OffsetDateTime.now()));
        assertEquals(schedule.getId().toString(), execution.getExecutionContext().get("scheduleId").asText());
    }

    @Test
    void shouldRemoveScheduleOccurrenceWhenPaused() {
        Job job = createReportJob("audit");
        Schedule schedule = engine.scheduleJob(job.getId(), ScheduleSpec.cron("0 4 * * *"));
        String itemId = "schedule_" + schedule.getId() + "_" + schedule.getNextExecution().toInstant().toEpochMilli();
        assertTrue(queueRouter.getJob(itemId).isPresent());

        Schedule paused = engine.pauseSchedule(job.getId());

        assertEquals(ScheduleStatus.PAUSED, paused.getStatus());
        assertTrue(queueRouter.getJob(itemId).isEmpty());
    }

    @Test
    void shouldRunRawQueueItemsByName() {
        QueueItem added = queueRouter.addJob("report", objectMapper.createObjectNode().put("report", "adhoc"),
                QueueOptions.none().withPriority(12));

        await().atMost(Duration.ofSeconds(20)).untilAsserted(() -> {
            QueueItem processed = queueRouter.getJob(added.id()).orElseThrow();
            assertEquals(QueueItemState.COMPLETED, processed.state());
            assertEquals("report:adhoc", processed.returnValue());
        });
    }

    @Test
    void shouldDeleteJobWithItsHistory() {
        Job job = createReportJob("cleanup");
        JobExecution execution = engine.executeJob(job.getId());
        await().atMost(Duration.ofSeconds(20)).untilAsserted(() -> assertEquals(JobStatus.COMPLETED,
                jobRepository.findById(job.getId()).orElseThrow().getStatus()));

        engine.deleteJob(job.getId());

        assertTrue(jobRepository.findById(job.getId()).isEmpty());
        assertTrue(executionRepository.findById(execution.getId()).isEmpty());
        assertEquals(0, jdbcTemplate.queryForObject("SELECT COUNT(*) FROM schedq_job_executions WHERE job_id = ?",
                Integer.class, job.getId()));
    }
}
