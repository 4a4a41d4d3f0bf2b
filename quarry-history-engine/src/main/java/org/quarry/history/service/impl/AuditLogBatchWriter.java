package org.quarry.history.service.impl;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.quarry.history.config.AuditProperties;
import org.quarry.history.entity.AuditLogEntry;
import org.quarry.history.repository.AuditLogDAO;
import org.quarry.history.utils.KeyedSerializer;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Coalesces audit entries logged within the batch window into a single flush.
 * <p>
 * Entries are written in the order they were enqueued, as multi-row inserts of at most
 * {@code max-batch-size} rows. Flushes never overlap; entries enqueued while a flush runs
 * go to the next one. When a multi-row insert fails its rows are retried one at a time:
 * rows the database rejects on their own are logged and set aside while the others are
 * written. When no row of the chunk can be written the database is considered unavailable,
 * and the unwritten rows return to the head of the queue to be retried after
 * {@code flush-retry-delay-ms}.
 */
@Slf4j
@Component
public class AuditLogBatchWriter {

    private static final String FLUSH_KEY = "audit-log-flush";

    private final AuditLogDAO auditLogDAO;
    private final AuditProperties auditProperties;
    private final Scheduler scheduler;
    private final KeyedSerializer flushes = new KeyedSerializer();

    // guarded by this
    private final Deque<AuditLogEntry> pending = new ArrayDeque<>();
    private boolean flushScheduled;
    private int consecutiveFailures;

    @Autowired
    public AuditLogBatchWriter(AuditLogDAO auditLogDAO, AuditProperties auditProperties) {
        this(auditLogDAO, auditProperties, Schedulers.parallel());
    }

    AuditLogBatchWriter(AuditLogDAO auditLogDAO, AuditProperties auditProperties, Scheduler scheduler) {
        this.auditLogDAO = auditLogDAO;
        this.auditProperties = auditProperties;
        this.scheduler = scheduler;
    }

    public void enqueue(AuditLogEntry entry) {
        boolean schedule;
        synchronized (this) {
            pending.addLast(entry);
            schedule = !flushScheduled;
            flushScheduled = true;
        }
        if (schedule) {
            scheduleFlush(auditProperties.getBatchDelayMs());
        }
    }

    /**
     * Writes everything pending at the time the flush starts and emits the number of rows written.
     * Never signals an error: failed rows stay queued for a retry.
     */
    public Mono<Integer> flush() {
        return flushes.serialize(FLUSH_KEY, this::drain);
    }

    public synchronized int pendingCount() {
        return pending.size();
    }

    @PreDestroy
    public void flushOnShutdown() {
        int remaining = pendingCount();
        if (remaining == 0) {
            return;
        }
        log.info("Flushing {} pending audit entries before shutdown", remaining);
        Integer written = flush().block(Duration.ofSeconds(10));
        if (pendingCount() > 0) {
            log.error("{} audit entries could not be written before shutdown ({} written)", pendingCount(), written);
        }
    }

    private void scheduleFlush(long delayMs) {
        scheduler.schedule(() -> flush().subscribe(), delayMs, TimeUnit.MILLISECONDS);
    }

    private Mono<Integer> drain() {
        List<AuditLogEntry> batch;
        synchronized (this) {
            flushScheduled = false;
            batch = new ArrayList<>(pending);
            pending.clear();
        }
        if (batch.isEmpty()) {
            return Mono.just(0);
        }
        AtomicInteger processed = new AtomicInteger();
        AtomicInteger written = new AtomicInteger();
        return Flux.fromIterable(partition(batch, auditProperties.getMaxBatchSize()))
                .concatMap(chunk -> writeChunk(chunk)
                        .doOnSuccess(rows -> {
                            processed.addAndGet(chunk.size());
                            written.addAndGet(rows);
                        }))
                .then(Mono.fromSupplier(() -> {
                    onFlushSucceeded(written.get());
                    return written.get();
                }))
                .onErrorResume(e -> {
                    List<AuditLogEntry> unwritten = batch.subList(processed.get(), batch.size());
                    onFlushFailed(unwritten, e);
                    return Mono.just(written.get());
                });
    }

    private Mono<Integer> writeChunk(List<AuditLogEntry> chunk) {
        return auditLogDAO.insertBatch(chunk)
                .thenReturn(chunk.size())
                .onErrorResume(e -> chunk.size() > 1, e -> writeRowByRow(chunk, e));
    }

    /**
     * Emits the number of rows written, or the chunk error when none of them could be written.
     */
    private Mono<Integer> writeRowByRow(List<AuditLogEntry> chunk, Throwable chunkError) {
        log.warn("Insert of {} audit entries failed, retrying row by row: {}", chunk.size(), chunkError.getMessage());
        List<AuditLogEntry> rejected = new ArrayList<>();
        return Flux.fromIterable(chunk)
                .concatMap(entry -> auditLogDAO.insertBatch(List.of(entry))
                        .thenReturn(true)
                        .onErrorResume(e -> {
                            rejected.add(entry);
                            log.debug("Audit entry {} rejected: {}", entry.id(), e.getMessage());
                            return Mono.just(false);
                        }))
                .filter(Boolean::booleanValue)
                .count()
                .flatMap(rows -> {
                    if (rows == 0) {
                        return Mono.error(chunkError);
                    }
                    rejected.forEach(entry -> log.error("Discarding audit entry the database rejects: {}", entry));
                    return Mono.just(rows.intValue());
                });
    }

    private synchronized void onFlushSucceeded(int written) {
        if (consecutiveFailures > 0) {
            log.info("Audit log flush recovered after {} failed attempts", consecutiveFailures);
            consecutiveFailures = 0;
        }
        log.debug("Flushed {} audit entries", written);
    }

    private void onFlushFailed(List<AuditLogEntry> unwritten, Throwable e) {
        boolean schedule;
        int attempt;
        synchronized (this) {
            for (int i = unwritten.size() - 1; i >= 0; i--) {
                pending.addFirst(unwritten.get(i));
            }
            attempt = ++consecutiveFailures;
            schedule = !flushScheduled;
            flushScheduled = true;
        }
        log.error("Failed to flush {} audit entries (attempt {}), retrying in {} ms: {}",
                unwritten.size(), attempt, auditProperties.getFlushRetryDelayMs(), e.getMessage());
        if (schedule) {
            scheduleFlush(auditProperties.getFlushRetryDelayMs());
        }
    }

    private static List<List<AuditLogEntry>> partition(List<AuditLogEntry> entries, int size) {
        List<List<AuditLogEntry>> chunks = new ArrayList<>();
        for (int from = 0; from < entries.size(); from += size) {
            chunks.add(entries.subList(from, Math.min(from + size, entries.size())));
        }
        return chunks;
    }
}
