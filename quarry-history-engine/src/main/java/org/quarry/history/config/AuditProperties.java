package org.quarry.history.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.quarry.history.enums.AuditActionType;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.Set;

/**
 * Configuration properties for the audit log.
 * Maps to quarry.audit.* properties in application.yml
 */
@Slf4j
@Data
@Configuration
@ConfigurationProperties(prefix = "quarry.audit")
public class AuditProperties {

    /**
     * Window in milliseconds during which logged actions are coalesced into one flush.
     * 0 flushes as soon as the writer thread picks the entry up.
     */
    private long batchDelayMs = 100;

    /**
     * Maximum number of rows written by a single INSERT statement.
     */
    private int maxBatchSize = 100;

    /**
     * Delay before a failed flush is retried.
     */
    private long flushRetryDelayMs = 1000;

    /**
     * Upper bound on the number of audit entries kept. 0 means no cap.
     */
    private long maxLogEntries = 10000;

    /**
     * Entries older than this many days are pruned by the retention job.
     */
    private int retentionDays = 90;

    private boolean pruneEnabled = true;

    /**
     * Cron expression for the retention job.
     * Default: "0 0 4 * * ?" (daily at 4 AM)
     */
    private String pruneCron = "0 0 4 * * ?";

    /**
     * Record NAVIGATION actions (views, searches, jumps). These are high volume.
     */
    private boolean logNavigation = false;

    /**
     * Record LEARNING actions (flashcards, quizzes).
     */
    private boolean logLearning = true;

    /**
     * Action types that are never recorded.
     */
    private Set<AuditActionType> excludedActionTypes = Set.of();

    @PostConstruct
    public void validate() {
        if (batchDelayMs < 0) {
            throw new IllegalArgumentException("quarry.audit.batch-delay-ms must be >= 0. Current value: " + batchDelayMs);
        }
        if (maxBatchSize <= 0) {
            throw new IllegalArgumentException("quarry.audit.max-batch-size must be > 0. Current value: " + maxBatchSize);
        }
        if (flushRetryDelayMs <= 0) {
            throw new IllegalArgumentException("quarry.audit.flush-retry-delay-ms must be > 0. Current value: " + flushRetryDelayMs);
        }
        if (maxLogEntries < 0) {
            throw new IllegalArgumentException("quarry.audit.max-log-entries must be >= 0 (0 means no cap). Current value: " + maxLogEntries);
        }
        if (retentionDays <= 0) {
            throw new IllegalArgumentException("quarry.audit.retention-days must be > 0. Current value: " + retentionDays);
        }
        log.info("Audit log: batch window {} ms, retention {} days, cap {} entries", batchDelayMs, retentionDays,
                maxLogEntries == 0 ? "no" : maxLogEntries);
    }

    public boolean isAuditable(AuditActionType actionType) {
        if (actionType == null) {
            return false;
        }
        if (excludedActionTypes != null && excludedActionTypes.contains(actionType)) {
            return false;
        }
        return switch (actionType) {
            case NAVIGATION -> logNavigation;
            case LEARNING -> logLearning;
            default -> true;
        };
    }
}
