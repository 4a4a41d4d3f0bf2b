package org.quarry.history.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.quarry.history.config.AuditProperties;
import org.quarry.history.service.AuditLogService;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

/**
 * Scheduler enforcing audit log retention.
 * Runs on a configurable cron schedule (default: daily at 4 AM): entries older than the
 * retention period are pruned, then the log is trimmed to the configured maximum size.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "quarry.audit", name = "prune-enabled", havingValue = "true", matchIfMissing = true)
public class AuditRetentionScheduler {

    private final AuditLogService auditLogService;
    private final AuditProperties auditProperties;

    @Scheduled(cron = "${quarry.audit.prune-cron:0 0 4 * * ?}")
    public void enforceRetention() {
        int days = auditProperties.getRetentionDays();
        long maxEntries = auditProperties.getMaxLogEntries();
        log.info("Starting audit log retention: older than {} days, cap {}", days, maxEntries);

        auditLogService.pruneAuditLog(days)
                .flatMap(pruned -> (maxEntries > 0 ? auditLogService.trimToMaxEntries(maxEntries) : Mono.just(0L))
                        .map(trimmed -> pruned + trimmed))
                .doOnSuccess(removed -> log.info("Audit log retention completed, {} entries removed", removed))
                .doOnError(e -> log.error("Error during audit log retention", e))
                .subscribe();
    }
}
