package org.quarry.history.entity;

public interface SqlTableMapping {
    String AUDIT_LOG = "audit_log";
    String UNDO_STACK = "undo_stack";
    String UNDO_METADATA = "undo_metadata";
}
