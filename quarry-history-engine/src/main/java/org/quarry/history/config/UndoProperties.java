package org.quarry.history.config;

import jakarta.annotation.PostConstruct;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration properties for the undo/redo stacks.
 * Maps to quarry.undo.* properties in application.yml
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "quarry.undo")
public class UndoProperties {

    /**
     * Maximum number of entries kept per session. Oldest entries are evicted first.
     */
    private int maxStackSize = 50;

    /**
     * Sessions without audit activity for this many hours lose their undo stack.
     */
    private int sessionMaxAgeHours = 24;

    private boolean expiryEnabled = true;

    /**
     * Interval between session expiry sweeps, in milliseconds.
     * Default: every hour (3600000 ms).
     */
    private long expiryIntervalMs = 3600000;

    @PostConstruct
    public void validate() {
        if (maxStackSize <= 0) {
            throw new IllegalArgumentException("quarry.undo.max-stack-size must be > 0. Current value: " + maxStackSize);
        }
        if (sessionMaxAgeHours <= 0) {
            throw new IllegalArgumentException("quarry.undo.session-max-age-hours must be > 0. Current value: " + sessionMaxAgeHours);
        }
    }
}
