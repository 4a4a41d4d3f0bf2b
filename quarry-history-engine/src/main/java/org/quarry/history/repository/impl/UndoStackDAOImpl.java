package org.quarry.history.repository.impl;

import lombok.RequiredArgsConstructor;
import org.quarry.history.dto.response.UndoStackInfo;
import org.quarry.history.entity.UndoMetadata;
import org.quarry.history.entity.UndoStackEntry;
import org.quarry.history.enums.AuditTargetType;
import org.quarry.history.repository.StatementParams;
import org.quarry.history.repository.StoragePort;
import org.quarry.history.repository.StorageRow;
import org.quarry.history.repository.UndoStackDAO;
import org.quarry.history.utils.JsonUtils;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

import static org.quarry.history.entity.SqlColumnMapping.*;
import static org.quarry.history.entity.SqlTableMapping.UNDO_METADATA;
import static org.quarry.history.entity.SqlTableMapping.UNDO_STACK;
import static org.quarry.history.utils.SqlUtils.*;

@Service
@RequiredArgsConstructor
public class UndoStackDAOImpl implements UndoStackDAO {

    private static final String COLUMNS = String.join(COMMA, ID, SESSION_ID, STACK_POSITION, AUDIT_LOG_ID,
            TARGET_TYPE, TARGET_ID, BEFORE_STATE, AFTER_STATE, IS_ACTIVE);
    private static final String SELECT_ENTRIES = SELECT + COLUMNS + FROM + UNDO_STACK;
    private static final String BY_SESSION = WHERE + SESSION_ID + " = :sessionId ";

    private static final String STACK_INFO_SQL = SELECT
            + "COUNT(*) AS total_entries, "
            + "COUNT(CASE WHEN " + IS_ACTIVE + " = TRUE THEN 1 END) AS active_entries, "
            + "MAX(CASE WHEN " + IS_ACTIVE + " = TRUE THEN " + STACK_POSITION + " END) AS current_position"
            + FROM + UNDO_STACK + BY_SESSION;

    private static final String DELETE_METADATA_OF = "DELETE FROM " + UNDO_METADATA + WHERE + UNDO_STACK_ID
            + " IN (SELECT " + ID + FROM + UNDO_STACK + BY_SESSION;
    private static final String DELETE_ENTRIES = "DELETE FROM " + UNDO_STACK + BY_SESSION;

    private final StoragePort storagePort;
    private final JsonUtils jsonUtils;

    @Override
    public Mono<UndoStackInfo> getStackInfo(String sessionId) {
        return storagePort.queryOne(STACK_INFO_SQL, StatementParams.of("sessionId", sessionId))
                .map(row -> {
                    Integer position = row.getInt("current_position");
                    return new UndoStackInfo(
                            row.getLong("total_entries", 0L),
                            row.getLong("active_entries", 0L),
                            position == null ? UndoStackInfo.NO_POSITION : position);
                })
                .defaultIfEmpty(UndoStackInfo.empty());
    }

    @Override
    public Mono<UndoStackEntry> findHighestActive(String sessionId) {
        return storagePort.queryOne(SELECT_ENTRIES + BY_SESSION + AND + IS_ACTIVE + " = TRUE"
                                + ORDER_BY + STACK_POSITION + " DESC" + LIMIT + 1,
                        StatementParams.of("sessionId", sessionId))
                .map(this::toEntry);
    }

    @Override
    public Mono<UndoStackEntry> findLowestInactiveAbove(String sessionId, int position) {
        return storagePort.queryOne(SELECT_ENTRIES + BY_SESSION + AND + IS_ACTIVE + " = FALSE "
                                + AND + STACK_POSITION + " > :position"
                                + ORDER_BY + STACK_POSITION + " ASC" + LIMIT + 1,
                        StatementParams.of("sessionId", sessionId).bind("position", position))
                .map(this::toEntry);
    }

    @Override
    public Flux<UndoStackEntry> findBySession(String sessionId) {
        return storagePort.queryMany(SELECT_ENTRIES + BY_SESSION + ORDER_BY + STACK_POSITION + " ASC",
                        StatementParams.of("sessionId", sessionId))
                .map(this::toEntry);
    }

    @Override
    public Flux<String> findSessionIds() {
        return storagePort.queryMany(SELECT + "DISTINCT " + SESSION_ID + FROM + UNDO_STACK, StatementParams.empty())
                .map(row -> row.getString(SESSION_ID));
    }

    @Override
    public Mono<Long> insert(UndoStackEntry entry) {
        String sql = "INSERT INTO " + UNDO_STACK + " (" + COLUMNS + ") VALUES "
                + "(:id, :sessionId, :position, :auditLogId, :targetType, :targetId, :beforeState, :afterState, :active)";
        StatementParams params = StatementParams.of("id", entry.id())
                .bind("sessionId", entry.sessionId())
                .bind("position", entry.stackPosition())
                .bindNullable("auditLogId", entry.auditLogId(), String.class)
                .bind("targetType", entry.targetType().wireName())
                .bind("targetId", entry.targetId())
                .bindNullable("beforeState", jsonUtils.toJson(entry.beforeState()), String.class)
                .bindNullable("afterState", jsonUtils.toJson(entry.afterState()), String.class)
                .bind("active", entry.active());
        return storagePort.write(sql, params);
    }

    @Override
    public Mono<Long> insertMetadata(List<UndoMetadata> metadata) {
        if (metadata.isEmpty()) {
            return Mono.just(0L);
        }
        StringBuilder sql = new StringBuilder("INSERT INTO ").append(UNDO_METADATA).append(" (")
                .append(String.join(COMMA, ID, UNDO_STACK_ID, META_KEY, META_VALUE)).append(") VALUES ");
        StatementParams params = StatementParams.empty();
        for (int i = 0; i < metadata.size(); i++) {
            UndoMetadata row = metadata.get(i);
            if (i > 0) {
                sql.append(COMMA);
            }
            sql.append("(:id_").append(i).append(", :stack_").append(i)
                    .append(", :key_").append(i).append(", :value_").append(i).append(")");
            params.bind("id_" + i, row.id())
                    .bind("stack_" + i, row.undoStackId())
                    .bind("key_" + i, row.key())
                    .bindNullable("value_" + i, row.value(), String.class);
        }
        return storagePort.write(sql.toString(), params);
    }

    @Override
    public Flux<UndoMetadata> findMetadata(String undoStackId) {
        String sql = SELECT + String.join(COMMA, ID, UNDO_STACK_ID, META_KEY, META_VALUE) + FROM + UNDO_METADATA
                + WHERE + UNDO_STACK_ID + " = :undoStackId" + ORDER_BY + META_KEY;
        return storagePort.queryMany(sql, StatementParams.of("undoStackId", undoStackId))
                .map(row -> new UndoMetadata(row.getString(ID), row.getString(UNDO_STACK_ID),
                        row.getString("key"), row.getString("value")));
    }

    @Override
    public Mono<Long> setActive(String id, boolean active) {
        return storagePort.write("UPDATE " + UNDO_STACK + " SET " + IS_ACTIVE + " = :active" + WHERE + ID + " = :id",
                StatementParams.of("active", active).bind("id", id));
    }

    @Override
    public Mono<Long> deleteAbove(String sessionId, int position) {
        return deleteWhere(AND + STACK_POSITION + " > :position", sessionId, position);
    }

    @Override
    public Mono<Long> deleteAtOrBelow(String sessionId, int position) {
        return deleteWhere(AND + STACK_POSITION + " <= :position", sessionId, position);
    }

    @Override
    public Mono<Long> deleteSession(String sessionId) {
        StatementParams params = StatementParams.of("sessionId", sessionId);
        return storagePort.write(DELETE_METADATA_OF + ")", params)
                .then(Mono.defer(() -> storagePort.write(DELETE_ENTRIES, params)));
    }

    private Mono<Long> deleteWhere(String positionCriteria, String sessionId, int position) {
        StatementParams params = StatementParams.of("sessionId", sessionId).bind("position", position);
        return storagePort.write(DELETE_METADATA_OF + positionCriteria + ")", params)
                .then(Mono.defer(() -> storagePort.write(DELETE_ENTRIES + positionCriteria, params)));
    }

    private UndoStackEntry toEntry(StorageRow row) {
        return UndoStackEntry.builder()
                .id(row.getString(ID))
                .sessionId(row.getString(SESSION_ID))
                .stackPosition(row.getInt(STACK_POSITION))
                .auditLogId(row.getString(AUDIT_LOG_ID))
                .targetType(AuditTargetType.fromWireName(row.getString(TARGET_TYPE)))
                .targetId(row.getString(TARGET_ID))
                .beforeState(jsonUtils.toJsonNode(row.getString(BEFORE_STATE)))
                .afterState(jsonUtils.toJsonNode(row.getString(AFTER_STATE)))
                .active(row.getBoolean(IS_ACTIVE))
                .build();
    }
}
