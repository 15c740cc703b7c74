package com.example.intake.storage;

import com.example.intake.exception.StoreCapacityException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.ReactiveStringRedisTemplate;
import org.springframework.data.redis.core.ScanOptions;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Redis-backed store. A Redis {@code OOM} reply (maxmemory reached with a noeviction policy)
 * surfaces as {@link StoreCapacityException}.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "intake.storage.store", havingValue = "redis")
public class RedisKeyValueStore implements KeyValueStore {

    private static final long SCAN_BATCH_SIZE = 500;

    private final ReactiveStringRedisTemplate redisTemplate;

    public RedisKeyValueStore(ReactiveStringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
        log.info("Initialized Redis key-value store");
    }

    @Override
    public Mono<String> get(String key) {
        return redisTemplate.opsForValue().get(key);
    }

    @Override
    public Mono<Void> set(String key, String value) {
        return redisTemplate.opsForValue()
                .set(key, value)
                .onErrorMap(RedisKeyValueStore::isOutOfMemory,
                        e -> new StoreCapacityException(key, "Redis rejected write: out of memory", e))
                .doOnSuccess(ok -> log.debug("Stored key in Redis: {}", key))
                .then();
    }

    @Override
    public Mono<Boolean> remove(String key) {
        return redisTemplate.delete(key)
                .map(count -> count > 0);
    }

    @Override
    public Flux<String> keys(String prefix) {
        return redisTemplate.scan(ScanOptions.scanOptions()
                .match(prefix + "*")
                .count(SCAN_BATCH_SIZE)
                .build());
    }

    static boolean isOutOfMemory(Throwable error) {
        for (Throwable current = error; current != null; current = current.getCause()) {
            String message = current.getMessage();
            if (message != null && message.contains("OOM")) {
                return true;
            }
            if (current.getCause() == current) {
                break;
            }
        }
        return false;
    }
}
