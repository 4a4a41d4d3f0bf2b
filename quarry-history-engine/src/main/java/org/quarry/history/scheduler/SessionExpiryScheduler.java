package org.quarry.history.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.quarry.history.service.SessionLifecycleService;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodically drops the undo stacks of idle sessions.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "quarry.undo", name = "expiry-enabled", havingValue = "true", matchIfMissing = true)
public class SessionExpiryScheduler {

    private final SessionLifecycleService sessionLifecycleService;

    @Scheduled(fixedDelayString = "${quarry.undo.expiry-interval-ms:3600000}",
            initialDelayString = "${quarry.undo.expiry-interval-ms:3600000}")
    public void expireSessions() {
        log.debug("Starting undo session expiry sweep");
        sessionLifecycleService.clearExpiredSessions()
                .doOnError(e -> log.error("Error during undo session expiry", e))
                .subscribe();
    }
}
