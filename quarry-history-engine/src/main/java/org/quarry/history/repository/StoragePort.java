package org.quarry.history.repository;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Minimal relational access used by the history engine. Implementations must give
 * read-your-writes consistency and signal failures as {@link org.quarry.history.exception.StorageException}.
 */
public interface StoragePort {

    /**
     * Runs a parameterless statement, typically DDL.
     */
    Mono<Void> execute(String statement);

    /**
     * Runs an INSERT, UPDATE or DELETE and emits the number of affected rows.
     */
    Mono<Long> write(String statement, StatementParams params);

    Flux<StorageRow> queryMany(String statement, StatementParams params);

    /**
     * Emits the first row, or completes empty when the statement returns none.
     */
    Mono<StorageRow> queryOne(String statement, StatementParams params);
}
