package org.quarry.history.service;

import reactor.core.publisher.Mono;

/**
 * Reclaims the undo stacks of sessions that went idle. Audit history is never touched.
 */
public interface SessionLifecycleService {

    /**
     * Clears the undo stack of every session whose latest audit activity is older than
     * {@code maxAgeHours}, or that has no audit activity left, and emits how many were cleared.
     */
    Mono<Long> clearExpiredSessions(int maxAgeHours);

    /**
     * Same as {@link #clearExpiredSessions(int)} with {@code quarry.undo.session-max-age-hours}.
     */
    Mono<Long> clearExpiredSessions();
}
