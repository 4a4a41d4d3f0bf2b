package org.quarry.history.service.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.quarry.history.config.AuditProperties;
import org.quarry.history.dto.request.AuditLogQuery;
import org.quarry.history.dto.response.AuditStats;
import org.quarry.history.exception.StorageException;
import org.quarry.history.repository.AuditLogDAO;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AuditLogServiceImplErrorHandlingTest {

    @Mock private AuditLogDAO auditLogDAO;
    @Mock private AuditLogBatchWriter batchWriter;

    private AuditLogServiceImpl service;

    @BeforeEach
    void setUp() {
        Clock clock = Clock.fixed(Instant.parse("2026-01-01T00:00:00Z"), ZoneOffset.UTC);
        service = new AuditLogServiceImpl(auditLogDAO, batchWriter, new AuditProperties(), clock);
        lenient().when(batchWriter.flush()).thenReturn(Mono.just(0));
    }

    private static StorageException failure() {
        return new StorageException("connection refused");
    }

    @Test
    void query_whenStorageFails_returnsEmpty() {
        when(auditLogDAO.query(any(AuditLogQuery.class))).thenReturn(Flux.error(failure()));

        StepVerifier.create(service.query(AuditLogQuery.builder().build()))
                .verifyComplete();
    }

    @Test
    void getEntry_whenStorageFails_returnsEmpty() {
        when(auditLogDAO.findById(anyString())).thenReturn(Mono.error(failure()));

        StepVerifier.create(service.getEntry("id"))
                .verifyComplete();
    }

    @Test
    void getStats_whenStorageFails_returnsEmptyStats() {
        when(auditLogDAO.getStats()).thenReturn(Mono.error(failure()));

        StepVerifier.create(service.getStats())
                .expectNext(AuditStats.empty())
                .verifyComplete();
    }

    @Test
    void getMostEditedPaths_whenStorageFails_returnsEmpty() {
        when(auditLogDAO.getMostEditedPaths(anyInt())).thenReturn(Flux.error(failure()));

        StepVerifier.create(service.getMostEditedPaths(5))
                .verifyComplete();
    }

    @Test
    void pruneAuditLog_whenStorageFails_returnsZeroAndReleasesGuard() {
        when(auditLogDAO.deleteOlderThan(any(Instant.class)))
                .thenReturn(Mono.error(failure()))
                .thenReturn(Mono.just(4L));

        StepVerifier.create(service.pruneAuditLog(30))
                .expectNext(0L)
                .verifyComplete();
        StepVerifier.create(service.pruneAuditLog(30))
                .expectNext(4L)
                .verifyComplete();
    }

    @Test
    void pruneAuditLog_whileAnotherPruneRuns_returnsZero() {
        Sinks.One<Long> running = Sinks.one();
        when(auditLogDAO.deleteOlderThan(any(Instant.class))).thenReturn(running.asMono());

        StepVerifier.create(service.pruneAuditLog(30))
                .then(() -> {
                    StepVerifier.create(service.pruneAuditLog(30))
                            .expectNext(0L)
                            .verifyComplete();
                    StepVerifier.create(service.trimToMaxEntries(10))
                            .expectNext(0L)
                            .verifyComplete();
                    running.tryEmitValue(7L);
                })
                .expectNext(7L)
                .verifyComplete();

        verify(auditLogDAO, times(1)).deleteOlderThan(any(Instant.class));
        verify(auditLogDAO, never()).deleteBeyond(anyLong());
    }

    @Test
    void trimToMaxEntries_whenStorageFails_returnsZero() {
        when(auditLogDAO.deleteBeyond(anyLong())).thenReturn(Mono.error(failure()));

        StepVerifier.create(service.trimToMaxEntries(100))
                .expectNext(0L)
                .verifyComplete();
    }

    @Test
    void getLastActivity_whenStorageFails_returnsEmpty() {
        when(auditLogDAO.findLastActivity(anyString())).thenReturn(Mono.error(failure()));

        StepVerifier.create(service.getLastActivity("s1"))
                .verifyComplete();
    }
}
