package org.quarry.history.service.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.quarry.history.config.UndoProperties;
import org.quarry.history.repository.AuditLogDAO;
import org.quarry.history.repository.UndoStackDAO;
import org.quarry.history.service.AuditLogService;
import org.quarry.history.service.SessionLifecycleService;
import org.quarry.history.service.UndoRedoService;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

@Slf4j
@Service
@RequiredArgsConstructor
public class SessionLifecycleServiceImpl implements SessionLifecycleService {

    private final UndoStackDAO undoStackDAO;
    private final AuditLogDAO auditLogDAO;
    private final AuditLogService auditLogService;
    private final UndoRedoService undoRedoService;
    private final UndoProperties undoProperties;
    private final Clock clock;

    @Override
    public Mono<Long> clearExpiredSessions() {
        return clearExpiredSessions(undoProperties.getSessionMaxAgeHours());
    }

    @Override
    public Mono<Long> clearExpiredSessions(int maxAgeHours) {
        if (maxAgeHours <= 0) {
            log.warn("Refusing to expire sessions with a maximum age of {} hours", maxAgeHours);
            return Mono.just(0L);
        }
        Instant cutoff = clock.instant().minus(Duration.ofHours(maxAgeHours));
        return auditLogService.flush()
                .thenMany(undoStackDAO.findSessionIds())
                .filterWhen(sessionId -> isExpired(sessionId, cutoff))
                .concatMap(sessionId -> undoRedoService.clearStack(sessionId)
                        .doOnNext(cleared -> {
                            if (cleared) {
                                log.debug("Cleared undo stack of expired session {}", sessionId);
                            }
                        }))
                .filter(Boolean::booleanValue)
                .count()
                .doOnSuccess(count -> {
                    if (count > 0) {
                        log.info("Cleared undo stacks of {} sessions inactive since {}", count, cutoff);
                    }
                })
                .doOnError(e -> log.error("Failed to clear expired sessions: {}", e.getMessage()))
                .onErrorResume(e -> Mono.just(0L));
    }

    // a failed lookup aborts the sweep rather than clearing a live session
    private Mono<Boolean> isExpired(String sessionId, Instant cutoff) {
        return auditLogDAO.findLastActivity(sessionId)
                .map(lastActivity -> lastActivity.isBefore(cutoff))
                .defaultIfEmpty(Boolean.TRUE);
    }
}
