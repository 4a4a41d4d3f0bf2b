package org.quarry.history.service.impl;

import lombok.extern.slf4j.Slf4j;
import org.quarry.history.enums.AuditTargetType;
import org.quarry.history.exception.ApplyStateException;
import org.quarry.history.service.ApplyStateHandler;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Index of the host's {@link ApplyStateHandler} beans by target type.
 */
@Slf4j
@Component
public class ApplyStateHandlerRegistry {

    private final Map<AuditTargetType, ApplyStateHandler> handlers = new EnumMap<>(AuditTargetType.class);

    public ApplyStateHandlerRegistry(List<ApplyStateHandler> applyStateHandlers) {
        for (ApplyStateHandler handler : applyStateHandlers) {
            for (AuditTargetType targetType : handler.targetTypes()) {
                ApplyStateHandler previous = handlers.putIfAbsent(targetType, handler);
                if (previous != null) {
                    throw new ApplyStateException("Target type " + targetType.wireName() + " is claimed by both "
                            + previous.getClass().getName() + " and " + handler.getClass().getName());
                }
            }
        }
        if (handlers.isEmpty()) {
            log.warn("No apply-state handler registered, undo and redo will fail");
        } else {
            log.info("Apply-state handlers registered for {}", handlers.keySet());
        }
    }

    public Optional<ApplyStateHandler> find(AuditTargetType targetType) {
        return Optional.ofNullable(targetType == null ? null : handlers.get(targetType));
    }
}
