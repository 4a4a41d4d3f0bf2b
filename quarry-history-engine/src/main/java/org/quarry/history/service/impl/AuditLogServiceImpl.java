package org.quarry.history.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.quarry.history.config.AuditProperties;
import org.quarry.history.dto.request.AuditLogInput;
import org.quarry.history.dto.request.AuditLogQuery;
import org.quarry.history.dto.response.AuditStats;
import org.quarry.history.dto.response.TargetPathCount;
import org.quarry.history.entity.AuditLogEntry;
import org.quarry.history.enums.AuditSource;
import org.quarry.history.repository.AuditLogDAO;
import org.quarry.history.service.AuditLogService;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

import static org.quarry.history.repository.HistorySchema.MAX_ACTION_NAME_LENGTH;
import static org.quarry.history.repository.HistorySchema.MAX_KEY_LENGTH;
import static org.quarry.history.repository.HistorySchema.MAX_TARGET_PATH_LENGTH;

@Slf4j
@Service
@RequiredArgsConstructor
public class AuditLogServiceImpl implements AuditLogService {

    private final AuditLogDAO auditLogDAO;
    private final AuditLogBatchWriter batchWriter;
    private final AuditProperties auditProperties;
    private final Clock clock;

    private final Object sequenceLock = new Object();
    private final AtomicBoolean pruning = new AtomicBoolean();
    // guarded by sequenceLock
    private long lastTimestamp;

    @Override
    public Mono<String> logAction(String sessionId, AuditLogInput input) {
        if (!isComplete(sessionId, input)) {
            log.warn("Ignoring audit action without session, action type, action name or target type: {}", input);
            return Mono.empty();
        }
        if (!fitsColumns(sessionId, input)) {
            log.warn("Ignoring audit action {} on {} with a value longer than its column allows", input.actionType(), input.targetType());
            return Mono.empty();
        }
        if (!auditProperties.isAuditable(input.actionType())) {
            log.debug("Action type {} is not audited, skipping {}", input.actionType(), input.actionName());
            return Mono.empty();
        }
        return Mono.fromSupplier(() -> {
                    AuditLogEntry entry;
                    // timestamps follow enqueue order
                    synchronized (sequenceLock) {
                        entry = toEntry(sessionId, input, nextTimestamp());
                        batchWriter.enqueue(entry);
                    }
                    log.debug("Logged {} {} on {} {} for session {}", input.actionType(), input.actionName(),
                            input.targetType(), input.targetId(), sessionId);
                    return entry.id();
                })
                .doOnError(e -> log.error("Failed to log audit action {}: {}", input.actionName(), e.getMessage()))
                .onErrorResume(e -> Mono.empty());
    }

    @Override
    public Mono<Integer> flush() {
        return batchWriter.flush();
    }

    @Override
    public Flux<AuditLogEntry> query(AuditLogQuery query) {
        AuditLogQuery criteria = query == null ? AuditLogQuery.builder().build() : query;
        return batchWriter.flush()
                .thenMany(Flux.defer(() -> auditLogDAO.query(criteria)))
                .doOnError(e -> log.error("Failed to query audit log with {}: {}", criteria, e.getMessage()))
                .onErrorResume(e -> Flux.empty());
    }

    @Override
    public Mono<AuditLogEntry> getEntry(String id) {
        if (id == null) {
            return Mono.empty();
        }
        return batchWriter.flush()
                .then(Mono.defer(() -> auditLogDAO.findById(id)))
                .doOnError(e -> log.error("Failed to read audit entry {}: {}", id, e.getMessage()))
                .onErrorResume(e -> Mono.empty());
    }

    @Override
    public Mono<AuditStats> getStats() {
        return batchWriter.flush()
                .then(Mono.defer(auditLogDAO::getStats))
                .doOnError(e -> log.error("Failed to compute audit stats: {}", e.getMessage()))
                .onErrorResume(e -> Mono.just(AuditStats.empty()));
    }

    @Override
    public Flux<TargetPathCount> getMostEditedPaths(int limit) {
        if (limit <= 0) {
            return Flux.empty();
        }
        return batchWriter.flush()
                .thenMany(Flux.defer(() -> auditLogDAO.getMostEditedPaths(limit)))
                .doOnError(e -> log.error("Failed to compute most edited paths: {}", e.getMessage()))
                .onErrorResume(e -> Flux.empty());
    }

    @Override
    public Mono<Long> pruneAuditLog(int retentionDays) {
        if (retentionDays <= 0) {
            log.warn("Refusing to prune audit log with a retention of {} days", retentionDays);
            return Mono.just(0L);
        }
        return guardedPrune(() -> {
            Instant cutoff = clock.instant().minus(Duration.ofDays(retentionDays));
            return auditLogDAO.deleteOlderThan(cutoff)
                    .doOnSuccess(count -> log.info("Pruned {} audit entries older than {}", count, cutoff));
        });
    }

    @Override
    public Mono<Long> trimToMaxEntries(long maxEntries) {
        if (maxEntries <= 0) {
            return Mono.just(0L);
        }
        return guardedPrune(() -> batchWriter.flush()
                .then(auditLogDAO.deleteBeyond(maxEntries))
                .doOnSuccess(count -> {
                    if (count > 0) {
                        log.info("Trimmed {} audit entries beyond the cap of {}", count, maxEntries);
                    }
                }));
    }

    @Override
    public Mono<Instant> getLastActivity(String sessionId) {
        return batchWriter.flush()
                .then(Mono.defer(() -> auditLogDAO.findLastActivity(sessionId)))
                .doOnError(e -> log.error("Failed to read last activity of session {}: {}", sessionId, e.getMessage()))
                .onErrorResume(e -> Mono.empty());
    }

    private Mono<Long> guardedPrune(Supplier<Mono<Long>> deletion) {
        return Mono.defer(() -> {
                    if (!pruning.compareAndSet(false, true)) {
                        log.warn("Audit log pruning already in progress, skipping");
                        return Mono.just(0L);
                    }
                    return deletion.get()
                            .defaultIfEmpty(0L)
                            .doFinally(signal -> pruning.set(false));
                })
                .doOnError(e -> log.error("Failed to prune audit log: {}", e.getMessage()))
                .onErrorResume(e -> Mono.just(0L));
    }

    private long nextTimestamp() {
        lastTimestamp = Math.max(lastTimestamp + 1, clock.millis());
        return lastTimestamp;
    }

    private static boolean isComplete(String sessionId, AuditLogInput input) {
        return sessionId != null && !sessionId.isBlank()
                && input != null
                && input.actionType() != null
                && input.actionName() != null && !input.actionName().isBlank()
                && input.targetType() != null;
    }

    private static boolean fitsColumns(String sessionId, AuditLogInput input) {
        return sessionId.length() <= MAX_KEY_LENGTH
                && input.actionName().length() <= MAX_ACTION_NAME_LENGTH
                && fits(input.targetId(), MAX_KEY_LENGTH)
                && fits(input.targetPath(), MAX_TARGET_PATH_LENGTH)
                && fits(input.undoGroupId(), MAX_KEY_LENGTH);
    }

    private static boolean fits(String value, int maxLength) {
        return value == null || value.length() <= maxLength;
    }

    private static AuditLogEntry toEntry(String sessionId, AuditLogInput input, long timestamp) {
        return AuditLogEntry.builder()
                .id(UUID.randomUUID().toString())
                .timestamp(Instant.ofEpochMilli(timestamp))
                .sessionId(sessionId)
                .actionType(input.actionType())
                .actionName(input.actionName())
                .targetType(input.targetType())
                .targetId(input.targetId())
                .targetPath(input.targetPath())
                .oldValue(input.oldValue())
                .newValue(input.newValue())
                .undoable(input.undoable())
                .undoGroupId(input.undoGroupId())
                .durationMs(input.durationMs())
                .source(input.source() == null ? AuditSource.USER : input.source())
                .build();
    }
}
