package dev.aparikh.semanticmail.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Settings for sync runs: how far back a first run looks, batch sizes, worker count and the
 * timeout and retry policy applied to every external call.
 */
@Validated
@ConfigurationProperties(prefix = "sync")
public class SyncProperties {

    @NotNull
    private Duration lookback = Duration.ofDays(30);

    @NotEmpty
    private List<String> folders = new ArrayList<>(List.of("INBOX", "SENT"));

    @Positive
    private int pageSize = 100;

    @Positive
    private int workers = 4;

    @Positive
    private int embeddingBatchSize = 100;

    @Positive
    private int pendingBatchLimit = 100;

    @NotNull
    private Duration callTimeout = Duration.ofSeconds(30);

    @Min(1)
    private int maxAttempts = 3;

    @NotNull
    private Duration initialBackoff = Duration.ofMillis(500);

    @NotNull
    private Duration maxBackoff = Duration.ofSeconds(10);

    public Duration getLookback() {
        return lookback;
    }

    public void setLookback(Duration lookback) {
        this.lookback = lookback;
    }

    public List<String> getFolders() {
        return folders;
    }

    public void setFolders(List<String> folders) {
        this.folders = folders;
    }

    public int getPageSize() {
        return pageSize;
    }

    public void setPageSize(int pageSize) {
        this.pageSize = pageSize;
    }

    public int getWorkers() {
        return workers;
    }

    public void setWorkers(int workers) {
        this.workers = workers;
    }

    public int getEmbeddingBatchSize() {
        return embeddingBatchSize;
    }

    public void setEmbeddingBatchSize(int embeddingBatchSize) {
        this.embeddingBatchSize = embeddingBatchSize;
    }

    public int getPendingBatchLimit() {
        return pendingBatchLimit;
    }

    public void setPendingBatchLimit(int pendingBatchLimit) {
        this.pendingBatchLimit = pendingBatchLimit;
    }

    public Duration getCallTimeout() {
        return callTimeout;
    }

    public void setCallTimeout(Duration callTimeout) {
        this.callTimeout = callTimeout;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public Duration getInitialBackoff() {
        return initialBackoff;
    }

    public void setInitialBackoff(Duration initialBackoff) {
        this.initialBackoff = initialBackoff;
    }

    public Duration getMaxBackoff() {
        return maxBackoff;
    }

    public void setMaxBackoff(Duration maxBackoff) {
        this.maxBackoff = maxBackoff;
    }
}
