package org.quarry.history.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Origin of a recorded action.
 */
public enum AuditSource {
    USER,
    AUTOSAVE,
    SYNC,
    IMPORT,
    UNDO, // entry written when an undo was applied
    REDO, // entry written when a redo was applied
    SYSTEM,
    API;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AuditSource fromWireName(String value) {
        if (value == null) {
            return null;
        }
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
