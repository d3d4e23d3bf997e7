package com.auditq.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.time.ZoneId;

@ConfigurationProperties(prefix = "auditq")
public class AuditQProperties {

    private final Database database = new Database();
    private final Jobs jobs = new Jobs();
    private final Retry retry = new Retry();
    private final Admission admission = new Admission();
    private final BackgroundJobServer backgroundJobServer = new BackgroundJobServer();
    private final Monitoring monitoring = new Monitoring();
    private final Api api = new Api();

    public Database getDatabase() {
        return database;
    }

    public Jobs getJobs() {
        return jobs;
    }

    public Retry getRetry() {
        return retry;
    }

    public Admission getAdmission() {
        return admission;
    }

    public BackgroundJobServer getBackgroundJobServer() {
        return backgroundJobServer;
    }

    public Monitoring getMonitoring() {
        return monitoring;
    }

    public Api getApi() {
        return api;
    }

    public static class Database {
        private String tablePrefix = "";
        private boolean skipCreate = false;
        private boolean failOnMigrationError = true;

        public String getTablePrefix() {
            return tablePrefix;
        }

        public void setTablePrefix(String tablePrefix) {
            this.tablePrefix = tablePrefix;
        }

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
        private int defaultPriority = 5;
        private int defaultMaxRetries = 3;

        public int getDefaultPriority() {
            return defaultPriority;
        }

        public void setDefaultPriority(int defaultPriority) {
            this.defaultPriority = defaultPriority;
        }

        public int getDefaultMaxRetries() {
            return defaultMaxRetries;
        }

        public void setDefaultMaxRetries(int defaultMaxRetries) {
            this.defaultMaxRetries = defaultMaxRetries;
        }
    }

    public static class Retry {
        private Duration baseDelay = Duration.ofMinutes(5);
        private Duration maxDelay = Duration.ofHours(24);
        // 0 keeps the delays exactly 5, 10, 20... minutes.
        private double jitterRatio = 0.0;

        public Duration getBaseDelay() {
            return baseDelay;
        }

        public void setBaseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }

        public double getJitterRatio() {
            return jitterRatio;
        }

        public void setJitterRatio(double jitterRatio) {
            this.jitterRatio = jitterRatio;
        }
    }

    public static class Admission {
        private int maxActiveJobsPerResource = 5;
        private int maxQueueDepth = 100;
        private Duration retryAfter = Duration.ofSeconds(60);

        public int getMaxActiveJobsPerResource() {
            return maxActiveJobsPerResource;
        }

        public void setMaxActiveJobsPerResource(int maxActiveJobsPerResource) {
            this.maxActiveJobsPerResource = maxActiveJobsPerResource;
        }

        public int getMaxQueueDepth() {
            return maxQueueDepth;
        }

        public void setMaxQueueDepth(int maxQueueDepth) {
            this.maxQueueDepth = maxQueueDepth;
        }

        public Duration getRetryAfter() {
            return retryAfter;
        }

        public void setRetryAfter(Duration retryAfter) {
            this.retryAfter = retryAfter;
        }
    }

    public static class BackgroundJobServer {
        private boolean enabled = true;
        private int workerCount = Math.max(2, Runtime.getRuntime().availableProcessors());
        private long pollIntervalInSeconds = 15;
        private Duration leaseDuration = Duration.ofMinutes(10);
        private long leaseRenewalIntervalInSeconds = 30;
        private long reaperIntervalInSeconds = 60;

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

        public long getPollIntervalInSeconds() {
            return pollIntervalInSeconds;
        }

        public void setPollIntervalInSeconds(long pollIntervalInSeconds) {
            this.pollIntervalInSeconds = pollIntervalInSeconds;
        }

        public Duration getLeaseDuration() {
            return leaseDuration;
        }

        public void setLeaseDuration(Duration leaseDuration) {
            this.leaseDuration = leaseDuration;
        }

        public long getLeaseRenewalIntervalInSeconds() {
            return leaseRenewalIntervalInSeconds;
        }

        public void setLeaseRenewalIntervalInSeconds(long leaseRenewalIntervalInSeconds) {
            this.leaseRenewalIntervalInSeconds = leaseRenewalIntervalInSeconds;
        }

        public long getReaperIntervalInSeconds() {
            return reaperIntervalInSeconds;
        }

        public void setReaperIntervalInSeconds(long reaperIntervalInSeconds) {
            this.reaperIntervalInSeconds = reaperIntervalInSeconds;
        }
    }

    public static class Monitoring {
        private boolean enabled = true;
        private long tickIntervalInSeconds = 60;
        private Duration interTargetDelay = Duration.ofSeconds(2);
        private ZoneId zone = ZoneId.of("UTC");
        private int runConcurrency = 2;
        private int defaultMaxRunsPerDay = 24;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public long getTickIntervalInSeconds() {
            return tickIntervalInSeconds;
        }

        public void setTickIntervalInSeconds(long tickIntervalInSeconds) {
            this.tickIntervalInSeconds = tickIntervalInSeconds;
        }

        public Duration getInterTargetDelay() {
            return interTargetDelay;
        }

        public void setInterTargetDelay(Duration interTargetDelay) {
            this.interTargetDelay = interTargetDelay;
        }

        public ZoneId getZone() {
            return zone;
        }

        public void setZone(ZoneId zone) {
            this.zone = zone;
        }

        public int getRunConcurrency() {
            return runConcurrency;
        }

        public void setRunConcurrency(int runConcurrency) {
            this.runConcurrency = runConcurrency;
        }

        public int getDefaultMaxRunsPerDay() {
            return defaultMaxRunsPerDay;
        }

        public void setDefaultMaxRunsPerDay(int defaultMaxRunsPerDay) {
            this.defaultMaxRunsPerDay = defaultMaxRunsPerDay;
        }
    }

    public static class Api {
        private String internalToken = "";
        private Duration eventStreamTimeout = Duration.ofMinutes(30);

        public String getInternalToken() {
            return internalToken;
        }

        public void setInternalToken(String internalToken) {
            this.internalToken = internalToken;
        }

        public Duration getEventStreamTimeout() {
            return eventStreamTimeout;
        }

        public void setEventStreamTimeout(Duration eventStreamTimeout) {
            this.eventStreamTimeout = eventStreamTimeout;
        }
    }
}
