package org.quarry.history.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Coarse category of a recorded action. Persisted by its lower-case wire name.
 */
public enum AuditActionType {
    FILE,
    CONTENT,
    METADATA,
    TREE,
    LEARNING,
    NAVIGATION,
    SETTINGS,
    BOOKMARK,
    API;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AuditActionType fromWireName(String value) {
        if (value == null) {
            return null;
        }
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
