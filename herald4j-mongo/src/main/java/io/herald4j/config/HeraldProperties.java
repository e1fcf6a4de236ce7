package io.herald4j.config;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Runtime configuration for the publication scheduler.
 */
@ConfigurationProperties(prefix = "herald")
public class HeraldProperties {
    private boolean enabled = true;
    private String workerId; // defaults to host-pid-uuid
    private Duration tickEvery = Duration.ofSeconds(60);
    private Duration workerPollEvery = Duration.ofSeconds(1);
    private Duration reaperEvery = Duration.ofSeconds(60);
    private int batchSize = 50; // schedules claimed per tick
    private int maxConcurrency = 8; // publish jobs in flight per instance
    private Duration scheduleLeaseLifetime = Duration.ofMinutes(2);
    private int maxAttempts = 5;
    private Duration retryBaseDelay = Duration.ofSeconds(10);
    private Duration retryMaxDelay = Duration.ofMinutes(10);
    private double retryJitterRatio = 0.2;
    private Duration publishTimeout = Duration.ofSeconds(30);
    private Duration staleRunningThreshold = Duration.ofMinutes(10);
    private int maxTextLength = 280;
    private double duplicateSimilarityThreshold = 0.9;
    private int duplicateCheckWindow = 10; // 0 disables the advisory check
    private int ruleCacheSize = 1000;
    private Duration dedupeLockTtl = Duration.ofDays(2);
    private Duration historyRetention = Duration.ofDays(90);
    private boolean skipMissedOccurrences = false; // resolve the next run from now instead of the fired occurrence
    private boolean ensureIndexesOnStartup = true;
    private boolean autoStartup = true;
    private int lifecyclePhase = Integer.MAX_VALUE;
    private Duration shutdownTimeout = Duration.ofSeconds(30); // loop join plus in-flight publishes

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getWorkerId() {
        return workerId;
    }

    public void setWorkerId(String workerId) {
        this.workerId = workerId;
    }

    public Duration getTickEvery() {
        return tickEvery;
    }

    public void setTickEvery(Duration tickEvery) {
        this.tickEvery = tickEvery;
    }

    public Duration getWorkerPollEvery() {
        return workerPollEvery;
    }

    public void setWorkerPollEvery(Duration workerPollEvery) {
        this.workerPollEvery = workerPollEvery;
    }

    public Duration getReaperEvery() {
        return reaperEvery;
    }

    public void setReaperEvery(Duration reaperEvery) {
        this.reaperEvery = reaperEvery;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    public void setMaxConcurrency(int maxConcurrency) {
        this.maxConcurrency = maxConcurrency;
    }

    public Duration getScheduleLeaseLifetime() {
        return scheduleLeaseLifetime;
    }

    public void setScheduleLeaseLifetime(Duration scheduleLeaseLifetime) {
        this.scheduleLeaseLifetime = scheduleLeaseLifetime;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public Duration getRetryBaseDelay() {
        return retryBaseDelay;
    }

    public void setRetryBaseDelay(Duration retryBaseDelay) {
        this.retryBaseDelay = retryBaseDelay;
    }

    public Duration getRetryMaxDelay() {
        return retryMaxDelay;
    }

    public void setRetryMaxDelay(Duration retryMaxDelay) {
        this.retryMaxDelay = retryMaxDelay;
    }

    public double getRetryJitterRatio() {
        return retryJitterRatio;
    }

    public void setRetryJitterRatio(double retryJitterRatio) {
        this.retryJitterRatio = retryJitterRatio;
    }

    public Duration getPublishTimeout() {
        return publishTimeout;
    }

    public void setPublishTimeout(Duration publishTimeout) {
        this.publishTimeout = publishTimeout;
    }

    public Duration getStaleRunningThreshold() {
        return staleRunningThreshold;
    }

    public void setStaleRunningThreshold(Duration staleRunningThreshold) {
        this.staleRunningThreshold = staleRunningThreshold;
    }

    public int getMaxTextLength() {
        return maxTextLength;
    }

    public void setMaxTextLength(int maxTextLength) {
        this.maxTextLength = maxTextLength;
    }

    public double getDuplicateSimilarityThreshold() {
        return duplicateSimilarityThreshold;
    }

    public void setDuplicateSimilarityThreshold(double duplicateSimilarityThreshold) {
        this.duplicateSimilarityThreshold = duplicateSimilarityThreshold;
    }

    public int getDuplicateCheckWindow() {
        return duplicateCheckWindow;
    }

    public void setDuplicateCheckWindow(int duplicateCheckWindow) {
        this.duplicateCheckWindow = duplicateCheckWindow;
    }

    public int getRuleCacheSize() {
        return ruleCacheSize;
    }

    public void setRuleCacheSize(int ruleCacheSize) {
        this.ruleCacheSize = ruleCacheSize;
    }

    public Duration getDedupeLockTtl() {
        return dedupeLockTtl;
    }

    public void setDedupeLockTtl(Duration dedupeLockTtl) {
        this.dedupeLockTtl = dedupeLockTtl;
    }

    public Duration getHistoryRetention() {
        return historyRetention;
    }

    public void setHistoryRetention(Duration historyRetention) {
        this.historyRetention = historyRetention;
    }

    public boolean isSkipMissedOccurrences() {
        return skipMissedOccurrences;
    }

    public void setSkipMissedOccurrences(boolean skipMissedOccurrences) {
        this.skipMissedOccurrences = skipMissedOccurrences;
    }

    public boolean isEnsureIndexesOnStartup() {
        return ensureIndexesOnStartup;
    }

    public void setEnsureIndexesOnStartup(boolean ensureIndexesOnStartup) {
        this.ensureIndexesOnStartup = ensureIndexesOnStartup;
    }

    public boolean isAutoStartup() {
        return autoStartup;
    }

    public void setAutoStartup(boolean autoStartup) {
        this.autoStartup = autoStartup;
    }

    public int getLifecyclePhase() {
        return lifecyclePhase;
    }

    public void setLifecyclePhase(int lifecyclePhase) {
        this.lifecyclePhase = lifecyclePhase;
    }

    public Duration getShutdownTimeout() {
        return shutdownTimeout;
    }

    public void setShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = shutdownTimeout;
    }
}
