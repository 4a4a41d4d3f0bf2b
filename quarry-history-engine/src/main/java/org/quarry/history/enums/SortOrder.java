package org.quarry.history.enums;

public enum SortOrder {
    ASC,
    DESC
}
