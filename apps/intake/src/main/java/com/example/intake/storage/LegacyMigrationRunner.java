package com.example.intake.storage;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Runs the legacy key migration once the application is ready.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "intake.storage.migrate-on-startup", havingValue = "true", matchIfMissing = true)
public class LegacyMigrationRunner {

    private final StorageManager storageManager;

    @EventListener(ApplicationReadyEvent.class)
    public void migrateOnStartup() {
        storageManager.migrateLegacyKeys()
                .subscribe(
                        migrated -> log.info("Startup legacy migration finished, {} records migrated", migrated),
                        e -> log.error("Startup legacy migration failed: {}", e.getMessage(), e));
    }
}
