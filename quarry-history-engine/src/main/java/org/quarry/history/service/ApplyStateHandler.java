package org.quarry.history.service;

import com.fasterxml.jackson.databind.JsonNode;
import org.quarry.history.enums.AuditTargetType;
import reactor.core.publisher.Mono;

import java.util.Set;

/**
 * Writes a snapshot back to the document store when an action is undone or redone.
 * <p>
 * Implemented by the host application, one bean per group of target types. A target type
 * may be claimed by a single handler only. Implementations must be idempotent: the same
 * snapshot can be applied more than once.
 */
public interface ApplyStateHandler {

    /**
     * Target types this handler restores.
     */
    Set<AuditTargetType> targetTypes();

    /**
     * Applies {@code state} to the target.
     *
     * @param undo true when reverting to the before-state, false when replaying the after-state
     * @return true when the state was applied; false leaves the undo stack unchanged
     */
    Mono<Boolean> applyState(AuditTargetType targetType, String targetId, JsonNode state, boolean undo);
}
