package org.quarry.history.entity;

public interface SqlColumnMapping {
    String ID = "id";
    String SESSION_ID = "session_id";
    String TARGET_TYPE = "target_type";
    String TARGET_ID = "target_id";

    // audit_log
    String TIMESTAMP = "timestamp";
    String ACTION_TYPE = "action_type";
    String ACTION_NAME = "action_name";
    String TARGET_PATH = "target_path";
    String OLD_VALUE = "old_value";
    String NEW_VALUE = "new_value";
    String IS_UNDOABLE = "is_undoable";
    String UNDO_GROUP_ID = "undo_group_id";
    String DURATION_MS = "duration_ms";
    String SOURCE = "source";

    // undo_stack
    String STACK_POSITION = "stack_position";
    String AUDIT_LOG_ID = "audit_log_id";
    String BEFORE_STATE = "before_state";
    String AFTER_STATE = "after_state";
    String IS_ACTIVE = "is_active";

    // undo_metadata, quoted because KEY and VALUE are reserved words in H2
    String UNDO_STACK_ID = "undo_stack_id";
    String META_KEY = "\"key\"";
    String META_VALUE = "\"value\"";
}
