package com.example.intake.controller;

import com.example.intake.storage.CleanupReport;
import com.example.intake.storage.StorageManager;
import com.example.intake.storage.StorageQuota;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/v1/intake/storage")
@RequiredArgsConstructor
public class StorageController {

    private final StorageManager storageManager;

    @GetMapping("/quota")
    public Mono<StorageQuota> quota() {
        log.debug("GET /storage/quota");
        return storageManager.checkQuota();
    }

    @PostMapping("/cleanup")
    public Mono<CleanupReport> cleanup() {
        log.debug("POST /storage/cleanup");
        return storageManager.cleanup();
    }

    @PostMapping("/migrations/legacy")
    public Mono<Map<String, Integer>> migrateLegacy() {
        log.debug("POST /storage/migrations/legacy");
        return storageManager.migrateLegacyKeys()
                .map(migrated -> Map.of("migrated", migrated));
    }
}
