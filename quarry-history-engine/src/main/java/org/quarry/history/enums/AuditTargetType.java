package org.quarry.history.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AuditTargetType {
    STRAND,
    WEAVE,
    LOOM,
    FABRIC,
    FLASHCARD,
    FLASHCARD_DECK,
    QUIZ,
    QUIZ_QUESTION,
    GLOSSARY_TERM,
    BOOKMARK,
    DRAFT,
    SETTING,
    SEARCH_QUERY,
    API_TOKEN;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AuditTargetType fromWireName(String value) {
        if (value == null) {
            return null;
        }
        return valueOf(value.toUpperCase(Locale.ROOT));
    }
}
