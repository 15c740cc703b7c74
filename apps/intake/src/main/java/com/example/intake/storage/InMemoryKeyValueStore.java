package com.example.intake.storage;

import com.example.intake.config.IntakeProperties;
import com.example.intake.exception.StoreCapacityException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local store. With a positive capacity it rejects writes that would push the total
 * size of keys and values past it, the way a browser-style storage quota does.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "intake.storage.store", havingValue = "in-memory", matchIfMissing = true)
public class InMemoryKeyValueStore implements KeyValueStore {

    private final ConcurrentHashMap<String, String> entries = new ConcurrentHashMap<>();
    private final long capacityBytes;

    @Autowired
    public InMemoryKeyValueStore(IntakeProperties properties) {
        this(properties.getStorage().getInMemoryCapacityBytes());
    }

    public InMemoryKeyValueStore(long capacityBytes) {
        this.capacityBytes = capacityBytes;
        log.info("Initialized in-memory key-value store with capacity: {}",
                capacityBytes > 0 ? capacityBytes + " bytes" : "unbounded");
    }

    @Override
    public Mono<String> get(String key) {
        return Mono.fromSupplier(() -> entries.get(key));
    }

    @Override
    public Mono<Void> set(String key, String value) {
        return Mono.fromRunnable(() -> {
            synchronized (entries) {
                if (capacityBytes > 0) {
                    long projected = usedBytes() - sizeOf(key, entries.get(key)) + sizeOf(key, value);
                    if (projected > capacityBytes) {
                        throw new StoreCapacityException(key,
                                "In-memory store full: " + projected + " > " + capacityBytes + " bytes");
                    }
                }
                entries.put(key, value);
            }
            log.debug("Stored key: {}", key);
        });
    }

    @Override
    public Mono<Boolean> remove(String key) {
        return Mono.fromSupplier(() -> {
            synchronized (entries) {
                return entries.remove(key) != null;
            }
        });
    }

    @Override
    public Flux<String> keys(String prefix) {
        return Flux.defer(() -> Flux.fromIterable(entries.keySet().stream()
                .filter(key -> key.startsWith(prefix))
                .sorted()
                .toList()));
    }

    private long usedBytes() {
        long total = 0;
        for (var entry : entries.entrySet()) {
            total += sizeOf(entry.getKey(), entry.getValue());
        }
        return total;
    }

    private static long sizeOf(String key, String value) {
        if (value == null) {
            return 0;
        }
        return key.getBytes(StandardCharsets.UTF_8).length + value.getBytes(StandardCharsets.UTF_8).length;
    }
}
