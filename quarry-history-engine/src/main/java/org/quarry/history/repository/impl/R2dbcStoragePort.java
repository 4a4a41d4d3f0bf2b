package org.quarry.history.repository.impl;

import io.r2dbc.spi.ColumnMetadata;
import io.r2dbc.spi.Row;
import io.r2dbc.spi.RowMetadata;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.quarry.history.exception.StorageException;
import org.quarry.history.repository.StatementParams;
import org.quarry.history.repository.StoragePort;
import org.quarry.history.repository.StorageRow;
import org.springframework.r2dbc.core.DatabaseClient;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.HashMap;
import java.util.Map;

/**
 * {@link StoragePort} over Spring's reactive {@link DatabaseClient}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class R2dbcStoragePort implements StoragePort {

    private final DatabaseClient databaseClient;

    @Override
    public Mono<Void> execute(String statement) {
        return databaseClient.sql(statement)
                .then()
                .onErrorMap(e -> toStorageException(statement, e));
    }

    @Override
    public Mono<Long> write(String statement, StatementParams params) {
        return bind(databaseClient.sql(statement), params)
                .fetch()
                .rowsUpdated()
                .onErrorMap(e -> toStorageException(statement, e));
    }

    @Override
    public Flux<StorageRow> queryMany(String statement, StatementParams params) {
        return bind(databaseClient.sql(statement), params)
                .map(R2dbcStoragePort::toStorageRow)
                .all()
                .onErrorMap(e -> toStorageException(statement, e));
    }

    @Override
    public Mono<StorageRow> queryOne(String statement, StatementParams params) {
        return queryMany(statement, params).next();
    }

    private DatabaseClient.GenericExecuteSpec bind(DatabaseClient.GenericExecuteSpec spec, StatementParams params) {
        if (params == null) {
            return spec;
        }
        for (Map.Entry<String, StatementParams.Param> entry : params.asMap().entrySet()) {
            StatementParams.Param param = entry.getValue();
            if (param.isNull()) {
                spec = spec.bindNull(entry.getKey(), param.type());
            } else {
                spec = spec.bind(entry.getKey(), param.value());
            }
        }
        return spec;
    }

    private static StorageRow toStorageRow(Row row, RowMetadata metadata) {
        Map<String, Object> columns = new HashMap<>();
        for (ColumnMetadata column : metadata.getColumnMetadatas()) {
            columns.put(column.getName(), row.get(column.getName()));
        }
        return StorageRow.of(columns);
    }

    private static Throwable toStorageException(String statement, Throwable e) {
        if (e instanceof StorageException) {
            return e;
        }
        log.debug("Statement failed: {}", statement, e);
        return new StorageException("Storage operation failed: " + e.getMessage(), e);
    }
}
