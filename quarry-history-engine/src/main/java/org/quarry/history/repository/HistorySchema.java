package org.quarry.history.repository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

import static org.quarry.history.entity.SqlColumnMapping.*;
import static org.quarry.history.entity.SqlTableMapping.*;

/**
 * Tables and indexes of the history engine. The DDL only uses types shared by
 * PostgreSQL and H2, and every statement is idempotent.
 * <p>
 * There are no foreign keys: metadata rows are removed before their stack entry by the
 * undo stack itself, and audit entries are pruned independently of the stack entries that
 * may still reference them.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HistorySchema {

    public static final int MAX_KEY_LENGTH = 255;
    public static final int MAX_ACTION_NAME_LENGTH = 64;
    public static final int MAX_TARGET_PATH_LENGTH = 2048;

    static final List<String> STATEMENTS = List.of(
            "CREATE TABLE IF NOT EXISTS " + AUDIT_LOG + " ("
                    + ID + " VARCHAR(36) PRIMARY KEY, "
                    + TIMESTAMP + " BIGINT NOT NULL, "
                    + SESSION_ID + " VARCHAR(" + MAX_KEY_LENGTH + ") NOT NULL, "
                    + ACTION_TYPE + " VARCHAR(32) NOT NULL, "
                    + ACTION_NAME + " VARCHAR(" + MAX_ACTION_NAME_LENGTH + ") NOT NULL, "
                    + TARGET_TYPE + " VARCHAR(32) NOT NULL, "
                    + TARGET_ID + " VARCHAR(" + MAX_KEY_LENGTH + "), "
                    + TARGET_PATH + " VARCHAR(" + MAX_TARGET_PATH_LENGTH + "), "
                    + OLD_VALUE + " VARCHAR, "
                    + NEW_VALUE + " VARCHAR, "
                    + IS_UNDOABLE + " BOOLEAN DEFAULT FALSE NOT NULL, "
                    + UNDO_GROUP_ID + " VARCHAR(" + MAX_KEY_LENGTH + "), "
                    + DURATION_MS + " BIGINT, "
                    + SOURCE + " VARCHAR(32) NOT NULL)",
            "CREATE INDEX IF NOT EXISTS idx_audit_log_timestamp ON " + AUDIT_LOG + " (" + TIMESTAMP + ")",
            "CREATE INDEX IF NOT EXISTS idx_audit_log_session ON " + AUDIT_LOG + " (" + SESSION_ID + ")",
            "CREATE INDEX IF NOT EXISTS idx_audit_log_action_type ON " + AUDIT_LOG + " (" + ACTION_TYPE + ")",
            "CREATE INDEX IF NOT EXISTS idx_audit_log_target_path ON " + AUDIT_LOG + " (" + TARGET_PATH + ")",
            "CREATE INDEX IF NOT EXISTS idx_audit_log_undoable ON " + AUDIT_LOG + " (" + IS_UNDOABLE + ")",

            "CREATE TABLE IF NOT EXISTS " + UNDO_STACK + " ("
                    + ID + " VARCHAR(36) PRIMARY KEY, "
                    + SESSION_ID + " VARCHAR(" + MAX_KEY_LENGTH + ") NOT NULL, "
                    + STACK_POSITION + " INTEGER NOT NULL, "
                    + AUDIT_LOG_ID + " VARCHAR(36), "
                    + TARGET_TYPE + " VARCHAR(32) NOT NULL, "
                    + TARGET_ID + " VARCHAR(" + MAX_KEY_LENGTH + ") NOT NULL, "
                    + BEFORE_STATE + " VARCHAR, "
                    + AFTER_STATE + " VARCHAR, "
                    + IS_ACTIVE + " BOOLEAN NOT NULL)",
            "CREATE UNIQUE INDEX IF NOT EXISTS idx_undo_stack_position ON " + UNDO_STACK + " (" + SESSION_ID + ", " + STACK_POSITION + ")",
            "CREATE INDEX IF NOT EXISTS idx_undo_stack_active ON " + UNDO_STACK + " (" + SESSION_ID + ", " + IS_ACTIVE + ")",

            "CREATE TABLE IF NOT EXISTS " + UNDO_METADATA + " ("
                    + ID + " VARCHAR(36) PRIMARY KEY, "
                    + UNDO_STACK_ID + " VARCHAR(36) NOT NULL, "
                    + META_KEY + " VARCHAR(" + MAX_KEY_LENGTH + ") NOT NULL, "
                    + META_VALUE + " VARCHAR)",
            "CREATE INDEX IF NOT EXISTS idx_undo_metadata_stack ON " + UNDO_METADATA + " (" + UNDO_STACK_ID + ")"
    );

    private final StoragePort storagePort;

    public Mono<Void> initialize() {
        return Flux.fromIterable(STATEMENTS)
                .concatMap(storagePort::execute)
                .then()
                .doOnSuccess(v -> log.info("History schema is up to date ({} statements)", STATEMENTS.size()));
    }
}
