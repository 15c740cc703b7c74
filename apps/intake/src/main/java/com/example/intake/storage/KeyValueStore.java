package com.example.intake.storage;

import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Persistent string key-value medium the storage manager budgets against.
 * {@link #set} signals {@link com.example.intake.exception.StoreCapacityException} when the
 * medium itself is full.
 */
public interface KeyValueStore {

    Mono<String> get(String key);

    Mono<Void> set(String key, String value);

    Mono<Boolean> remove(String key);

    /**
     * Every key starting with {@code prefix}; an empty prefix lists all keys.
     */
    Flux<String> keys(String prefix);
}
