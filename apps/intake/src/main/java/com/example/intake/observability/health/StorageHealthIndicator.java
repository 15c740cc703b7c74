package com.example.intake.observability.health;

import com.example.intake.config.IntakeProperties;
import com.example.intake.storage.StorageManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.ReactiveHealthIndicator;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Reports document storage usage via /actuator/health/storage. Storage that no longer accepts
 * writes within the headroom ratio is reported as OUT_OF_SERVICE.
 */
@Slf4j
@Component("storageHealthIndicator")
public class StorageHealthIndicator implements ReactiveHealthIndicator {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private final StorageManager storageManager;
    private final String store;

    public StorageHealthIndicator(StorageManager storageManager, IntakeProperties properties) {
        this.storageManager = storageManager;
        this.store = properties.getStorage().getStore();
    }

    @Override
    public Mono<Health> health() {
        return storageManager.checkQuota()
                .timeout(TIMEOUT)
                .map(quota -> (quota.canWrite() ? Health.up() : Health.outOfService())
                        .withDetail("store", store)
                        .withDetail("usedBytes", quota.usedBytes())
                        .withDetail("limitBytes", quota.limitBytes())
                        .withDetail("percentage", quota.percentage())
                        .build())
                .onErrorResume(e -> {
                    log.warn("Storage health check failed: {}", e.getMessage());
                    return Mono.just(Health.down()
                            .withDetail("store", store)
                            .withDetail("error", e.getMessage())
                            .build());
                });
    }
}
