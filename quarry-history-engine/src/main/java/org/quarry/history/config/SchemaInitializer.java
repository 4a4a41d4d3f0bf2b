package org.quarry.history.config;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.quarry.history.repository.HistorySchema;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Creates the history tables during startup, before any scheduled job runs.
 * Startup fails when the schema cannot be created.
 * Disable with quarry.schema.initialize=false when the schema is managed externally.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "quarry.schema.initialize", havingValue = "true", matchIfMissing = true)
public class SchemaInitializer {

    static final Duration INITIALIZE_TIMEOUT = Duration.ofSeconds(30);

    private final HistorySchema historySchema;

    @PostConstruct
    public void initializeSchema() {
        historySchema.initialize()
                .doOnError(e -> log.error("Failed to initialize history schema: {}", e.getMessage()))
                .block(INITIALIZE_TIMEOUT);
    }
}
