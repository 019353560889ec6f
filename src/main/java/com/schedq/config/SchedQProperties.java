package com.schedq.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "schedq")
public class SchedQProperties {

    private final Database database = new Database();
    private final Jobs jobs = new Jobs();
    private final Queue queue = new Queue();
    private final Worker worker = new Worker();
    private final Cleaner cleaner = new Cleaner();

    public Database getDatabase() {
        return database;
    }

    public Jobs getJobs() {
        return jobs;
    }

    public Queue getQueue() {
        return queue;
    }

    public Worker getWorker() {
        return worker;
    }

    public Cleaner getCleaner() {
        return cleaner;
    }

    public static class Database {
        private boolean skipCreate = false;
        private boolean failOnMigrationError = true;

        public boolean isSkipCreate() {
            return skipCreate;
        }

        public void setSkipCreate(boolean skipCreate) {
            this.skipCreate = skipCreate;
        }

        public boolean isFailOnMigrationError() {
            return failOnMigrationError;
        }

        public void setFailOnMigrationError(boolean failOnMigrationError) {
            this.failOnMigrationError = failOnMigrationError;
        }
    }

    public static class Jobs {
        private int defaultMaxRetries = 3;
        private int defaultPriority = 1;

        public int getDefaultMaxRetries() {
            return defaultMaxRetries;
        }

        public void setDefaultMaxRetries(int defaultMaxRetries) {
            this.defaultMaxRetries = defaultMaxRetries;
        }

        public int getDefaultPriority() {
            return defaultPriority;
        }

        public void setDefaultPriority(int defaultPriority) {
            this.defaultPriority = defaultPriority;
        }
    }

    public static class Queue {

        public enum Backend {
            DATABASE,
            MEMORY
        }

        private Backend backend = Backend.DATABASE;
        private int highPriorityThreshold = 10;
        private int defaultAttempts = 3;
        private long defaultBackoffDelayMs = 2000;
        private long maxBackoffDelayMs = 30000;
        private int removeOnComplete = 10;
        private int removeOnFail = 5;

        public Backend getBackend() {
            return backend;
        }

        public void setBackend(Backend backend) {
            this.backend = backend;
        }

        public int getHighPriorityThreshold() {
            return highPriorityThreshold;
        }

        public void setHighPriorityThreshold(int highPriorityThreshold) {
            this.highPriorityThreshold = highPriorityThreshold;
        }

        public int getDefaultAttempts() {
            return defaultAttempts;
        }

        public void setDefaultAttempts(int defaultAttempts) {
            this.defaultAttempts = defaultAttempts;
        }

        public long getDefaultBackoffDelayMs() {
            return defaultBackoffDelayMs;
        }

        public void setDefaultBackoffDelayMs(long defaultBackoffDelayMs) {
            this.defaultBackoffDelayMs = defaultBackoffDelayMs;
        }

        public long getMaxBackoffDelayMs() {
            return maxBackoffDelayMs;
        }

        public void setMaxBackoffDelayMs(long maxBackoffDelayMs) {
            this.maxBackoffDelayMs = maxBackoffDelayMs;
        }

        public int getRemoveOnComplete() {
            return removeOnComplete;
        }

        public void setRemoveOnComplete(int removeOnComplete) {
            this.removeOnComplete = removeOnComplete;
        }

        public int getRemoveOnFail() {
            return removeOnFail;
        }

        public void setRemoveOnFail(int removeOnFail) {
            this.removeOnFail = removeOnFail;
        }
    }

    public static class Worker {
        private boolean enabled = true;
        private int workerCount = Math.max(2, Runtime.getRuntime().availableProcessors());
        private long pollIntervalMs = 1000;
        private Duration defaultTimeout = Duration.ofMinutes(5);
        private String workerId;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getWorkerCount() {
            return workerCount;
        }

        public void setWorkerCount(int workerCount) {
            this.workerCount = workerCount;
        }

        public long getPollIntervalMs() {
            return pollIntervalMs;
        }

        public void setPollIntervalMs(long pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
        }

        public Duration getDefaultTimeout() {
            return defaultTimeout;
        }

        public void setDefaultTimeout(Duration defaultTimeout) {
            this.defaultTimeout = defaultTimeout;
        }

        public String getWorkerId() {
            return workerId;
        }

        public void setWorkerId(String workerId) {
            this.workerId = workerId;
        }
    }

    public static class Cleaner {
        private boolean enabled = true;
        private String completedRetention = "24h";
        private String failedRetention = "7d";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getCompletedRetention() {
            return completedRetention;
        }

        public void setCompletedRetention(String completedRetention) {
            this.completedRetention = completedRetention;
        }

        public String getFailedRetention() {
            return failedRetention;
        }

        public void setFailedRetention(String failedRetention) {
            this.failedRetention = failedRetention;
        }
    }
}
