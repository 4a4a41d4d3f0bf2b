package org.quarry.history.repository.impl;

import lombok.RequiredArgsConstructor;
import org.quarry.history.dto.request.AuditLogQuery;
import org.quarry.history.dto.response.AuditStats;
import org.quarry.history.dto.response.TargetPathCount;
import org.quarry.history.entity.AuditLogEntry;
import org.quarry.history.enums.AuditActionType;
import org.quarry.history.enums.AuditSource;
import org.quarry.history.enums.AuditTargetType;
import org.quarry.history.repository.AuditLogDAO;
import org.quarry.history.repository.StatementParams;
import org.quarry.history.repository.StoragePort;
import org.quarry.history.repository.StorageRow;
import org.quarry.history.utils.JsonUtils;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.quarry.history.entity.SqlColumnMapping.*;
import static org.quarry.history.entity.SqlTableMapping.AUDIT_LOG;
import static org.quarry.history.utils.SqlUtils.*;

@Service
@RequiredArgsConstructor
public class AuditLogDAOImpl implements AuditLogDAO {

    private static final String COLUMNS = String.join(COMMA, ID, TIMESTAMP, SESSION_ID, ACTION_TYPE, ACTION_NAME,
            TARGET_TYPE, TARGET_ID, TARGET_PATH, OLD_VALUE, NEW_VALUE, IS_UNDOABLE, UNDO_GROUP_ID, DURATION_MS, SOURCE);
    private static final String SELECT_ENTRIES = SELECT + COLUMNS + FROM + AUDIT_LOG;
    private static final String INSERT_SQL = "INSERT INTO " + AUDIT_LOG + " (" + COLUMNS + ") VALUES ";

    private static final String STATS_SQL = SELECT
            + "COUNT(*) AS total_entries, "
            + "COUNT(CASE WHEN " + IS_UNDOABLE + " = TRUE THEN 1 END) AS undoable_entries, "
            + "COUNT(DISTINCT " + SESSION_ID + ") AS unique_sessions, "
            + "MIN(" + TIMESTAMP + ") AS oldest_entry, "
            + "MAX(" + TIMESTAMP + ") AS newest_entry"
            + FROM + AUDIT_LOG;
    private static final String COUNT_BY_TYPE_SQL = SELECT + ACTION_TYPE + ", COUNT(*) AS entry_count"
            + FROM + AUDIT_LOG + " GROUP BY " + ACTION_TYPE;

    private final StoragePort storagePort;
    private final JsonUtils jsonUtils;

    @Override
    public Mono<Long> insertBatch(List<AuditLogEntry> entries) {
        if (entries.isEmpty()) {
            return Mono.just(0L);
        }
        StringBuilder sql = new StringBuilder(INSERT_SQL);
        StatementParams params = StatementParams.empty();
        for (int i = 0; i < entries.size(); i++) {
            if (i > 0) {
                sql.append(COMMA);
            }
            sql.append("(:id_").append(i)
                    .append(", :ts_").append(i)
                    .append(", :sid_").append(i)
                    .append(", :at_").append(i)
                    .append(", :an_").append(i)
                    .append(", :tt_").append(i)
                    .append(", :tid_").append(i)
                    .append(", :tp_").append(i)
                    .append(", :ov_").append(i)
                    .append(", :nv_").append(i)
                    .append(", :und_").append(i)
                    .append(", :ug_").append(i)
                    .append(", :dur_").append(i)
                    .append(", :src_").append(i)
                    .append(")");
            bindEntry(entries.get(i), i, params);
        }
        return storagePort.write(sql.toString(), params);
    }

    private void bindEntry(AuditLogEntry entry, int i, StatementParams params) {
        params.bind("id_" + i, entry.id())
                .bind("ts_" + i, entry.timestamp().toEpochMilli())
                .bind("sid_" + i, entry.sessionId())
                .bind("at_" + i, entry.actionType().wireName())
                .bind("an_" + i, entry.actionName())
                .bind("tt_" + i, entry.targetType().wireName())
                .bindNullable("tid_" + i, entry.targetId(), String.class)
                .bindNullable("tp_" + i, entry.targetPath(), String.class)
                .bindNullable("ov_" + i, jsonUtils.toJson(entry.oldValue()), String.class)
                .bindNullable("nv_" + i, jsonUtils.toJson(entry.newValue()), String.class)
                .bind("und_" + i, entry.undoable())
                .bindNullable("ug_" + i, entry.undoGroupId(), String.class)
                .bindNullable("dur_" + i, entry.durationMs(), Long.class)
                .bind("src_" + i, entry.source().wireName());
    }

    @Override
    public Flux<AuditLogEntry> query(AuditLogQuery query) {
        StringBuilder sql = new StringBuilder(SELECT_ENTRIES);
        StatementParams params = StatementParams.empty();
        boolean first = true;
        if (query.actionType() != null) {
            first = isFirst(first, sql);
            appendEqualsCriteria(ACTION_TYPE, "actionType", sql);
            params.bind("actionType", query.actionType().wireName());
        }
        if (query.actionName() != null && !query.actionName().isEmpty()) {
            first = isFirst(first, sql);
            appendEqualsCriteria(ACTION_NAME, "actionName", sql);
            params.bind("actionName", query.actionName());
        }
        if (query.targetType() != null) {
            first = isFirst(first, sql);
            appendEqualsCriteria(TARGET_TYPE, "targetType", sql);
            params.bind("targetType", query.targetType().wireName());
        }
        if (query.targetId() != null) {
            first = isFirst(first, sql);
            appendEqualsCriteria(TARGET_ID, "targetId", sql);
            params.bind("targetId", query.targetId());
        }
        if (query.targetPathPrefix() != null && !query.targetPathPrefix().isEmpty()) {
            first = isFirst(first, sql);
            appendStartsWithCriteria(TARGET_PATH, "targetPath", sql);
            params.bind("targetPath", startsWithPattern(query.targetPathPrefix()));
        }
        if (query.sessionId() != null) {
            first = isFirst(first, sql);
            appendEqualsCriteria(SESSION_ID, "sessionId", sql);
            params.bind("sessionId", query.sessionId());
        }
        if (query.source() != null) {
            first = isFirst(first, sql);
            appendEqualsCriteria(SOURCE, "source", sql);
            params.bind("source", query.source().wireName());
        }
        if (query.undoGroupId() != null) {
            first = isFirst(first, sql);
            appendEqualsCriteria(UNDO_GROUP_ID, "undoGroupId", sql);
            params.bind("undoGroupId", query.undoGroupId());
        }
        if (query.undoableOnly()) {
            first = isFirst(first, sql);
            sql.append(IS_UNDOABLE).append(" = TRUE ");
        }
        if (query.startTime() != null) {
            first = isFirst(first, sql);
            sql.append(TIMESTAMP).append(" >= :startTime ");
            params.bind("startTime", query.startTime().toEpochMilli());
        }
        if (query.endTime() != null) {
            isFirst(first, sql);
            sql.append(TIMESTAMP).append(" < :endTime ");
            params.bind("endTime", query.endTime().toEpochMilli());
        }
        String direction = query.effectiveOrder().name();
        sql.append(ORDER_BY).append(TIMESTAMP).append(SPACE).append(direction)
                .append(COMMA).append(ID).append(SPACE).append(direction)
                .append(LIMIT).append(query.effectiveLimit())
                .append(OFFSET).append(query.effectiveOffset());
        return storagePort.queryMany(sql.toString(), params).map(this::toEntry);
    }

    @Override
    public Mono<AuditLogEntry> findById(String id) {
        return storagePort.queryOne(SELECT_ENTRIES + WHERE + ID + " = :id", StatementParams.of("id", id))
                .map(this::toEntry);
    }

    @Override
    public Mono<AuditStats> getStats() {
        Mono<Map<AuditActionType, Long>> byType = storagePort.queryMany(COUNT_BY_TYPE_SQL, StatementParams.empty())
                .collectMap(row -> AuditActionType.fromWireName(row.getString(ACTION_TYPE)),
                        row -> row.getLong("entry_count", 0L),
                        LinkedHashMap::new);
        return storagePort.queryOne(STATS_SQL, StatementParams.empty())
                .zipWith(byType)
                .map(tuple -> {
                    StorageRow totals = tuple.getT1();
                    return new AuditStats(
                            totals.getLong("total_entries", 0L),
                            totals.getLong("undoable_entries", 0L),
                            totals.getLong("unique_sessions", 0L),
                            toInstant(totals.getLong("oldest_entry")),
                            toInstant(totals.getLong("newest_entry")),
                            Collections.unmodifiableMap(tuple.getT2()));
                })
                .defaultIfEmpty(AuditStats.empty());
    }

    @Override
    public Flux<TargetPathCount> getMostEditedPaths(int limit) {
        String sql = SELECT + TARGET_PATH + ", COUNT(*) AS edit_count" + FROM + AUDIT_LOG
                + WHERE + TARGET_PATH + " IS NOT NULL AND " + ACTION_TYPE + " <> :navigation"
                + " GROUP BY " + TARGET_PATH
                + ORDER_BY + "edit_count DESC, " + TARGET_PATH
                + LIMIT + limit;
        return storagePort.queryMany(sql, StatementParams.of("navigation", AuditActionType.NAVIGATION.wireName()))
                .map(row -> new TargetPathCount(row.getString(TARGET_PATH), row.getLong("edit_count", 0L)));
    }

    @Override
    public Mono<Long> deleteOlderThan(Instant cutoff) {
        return storagePort.write("DELETE FROM " + AUDIT_LOG + WHERE + TIMESTAMP + " < :cutoff",
                StatementParams.of("cutoff", cutoff.toEpochMilli()));
    }

    @Override
    public Mono<Long> deleteBeyond(long maxEntries) {
        String boundarySql = SELECT + TIMESTAMP + FROM + AUDIT_LOG
                + ORDER_BY + TIMESTAMP + " DESC" + LIMIT + 1 + OFFSET + maxEntries;
        return storagePort.queryOne(boundarySql, StatementParams.empty())
                .flatMap(row -> storagePort.write("DELETE FROM " + AUDIT_LOG + WHERE + TIMESTAMP + " <= :boundary",
                        StatementParams.of("boundary", row.getLong(TIMESTAMP))))
                .defaultIfEmpty(0L);
    }

    @Override
    public Mono<Instant> findLastActivity(String sessionId) {
        return storagePort.queryOne(SELECT + "MAX(" + TIMESTAMP + ") AS last_activity" + FROM + AUDIT_LOG
                                + WHERE + SESSION_ID + " = :sessionId",
                        StatementParams.of("sessionId", sessionId))
                .flatMap(row -> Mono.justOrEmpty(toInstant(row.getLong("last_activity"))));
    }

    private AuditLogEntry toEntry(StorageRow row) {
        return AuditLogEntry.builder()
                .id(row.getString(ID))
                .timestamp(toInstant(row.getLong(TIMESTAMP)))
                .sessionId(row.getString(SESSION_ID))
                .actionType(AuditActionType.fromWireName(row.getString(ACTION_TYPE)))
                .actionName(row.getString(ACTION_NAME))
                .targetType(AuditTargetType.fromWireName(row.getString(TARGET_TYPE)))
                .targetId(row.getString(TARGET_ID))
                .targetPath(row.getString(TARGET_PATH))
                .oldValue(jsonUtils.toJsonNode(row.getString(OLD_VALUE)))
                .newValue(jsonUtils.toJsonNode(row.getString(NEW_VALUE)))
                .undoable(row.getBoolean(IS_UNDOABLE))
                .undoGroupId(row.getString(UNDO_GROUP_ID))
                .durationMs(row.getLong(DURATION_MS))
                .source(AuditSource.fromWireName(row.getString(SOURCE)))
                .build();
    }

    private static Instant toInstant(Long epochMillis) {
        return epochMillis == null ? null : Instant.ofEpochMilli(epochMillis);
    }
}
