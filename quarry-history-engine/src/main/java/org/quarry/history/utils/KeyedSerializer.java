package org.quarry.history.utils;

import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;

/**
 * Runs asynchronous operations one at a time per key, in subscription order.
 * Operations on different keys do not wait for each other.
 * <p>
 * Each subscription queues behind the previous one for the same key and releases the key
 * when it terminates or is cancelled. A failed operation does not block its successors.
 */
public class KeyedSerializer {

    private final ConcurrentMap<String, Mono<Void>> tails = new ConcurrentHashMap<>();

    public <T> Mono<T> serialize(String key, Supplier<Mono<T>> operation) {
        return Mono.defer(() -> {
            Sinks.Empty<Void> done = Sinks.empty();
            Mono<Void> tail = done.asMono();
            Mono<Void> previous = tails.put(key, tail);
            Mono<Void> turn = previous == null ? Mono.empty() : previous;
            return turn.then(Mono.defer(operation))
                    .doFinally(signal -> {
                        tails.remove(key, tail);
                        done.tryEmitEmpty();
                    });
        });
    }

    /**
     * Number of keys with an operation running or queued.
     */
    public int activeKeys() {
        return tails.size();
    }
}
