package com.example.intake.util;

import com.example.intake.storage.KeyValueStore;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Delegates to another store, failing writes and removals of the keys a predicate selects.
 */
public class FaultyKeyValueStore implements KeyValueStore {

    private final KeyValueStore delegate;
    private final Predicate<String> failing;
    private final Function<String, RuntimeException> failure;

    public FaultyKeyValueStore(KeyValueStore delegate, Predicate<String> failing,
                               Function<String, RuntimeException> failure) {
        this.delegate = delegate;
        this.failing = failing;
        this.failure = failure;
    }

    @Override
    public Mono<String> get(String key) {
        return delegate.get(key);
    }

    @Override
    public Mono<Void> set(String key, String value) {
        return failing.test(key) ? Mono.error(failure.apply(key)) : delegate.set(key, value);
    }

    @Override
    public Mono<Boolean> remove(String key) {
        return failing.test(key) ? Mono.error(failure.apply(key)) : delegate.remove(key);
    }

    @Override
    public Flux<String> keys(String prefix) {
        return delegate.keys(prefix);
    }
}
