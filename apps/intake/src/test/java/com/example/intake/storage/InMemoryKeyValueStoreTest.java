package com.example.intake.storage;

import com.example.intake.exception.StoreCapacityException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

@DisplayName("InMemoryKeyValueStore")
class InMemoryKeyValueStoreTest {

    @Nested
    @DisplayName("set and get")
    class SetAndGet {

        @Test
        @DisplayName("should return the stored value")
        void shouldReturnStoredValue() {
            InMemoryKeyValueStore store = new InMemoryKeyValueStore(0);

            StepVerifier.create(store.set("k", "v").then(store.get("k")))
                    .expectNext("v")
                    .verifyComplete();
        }

        @Test
        @DisplayName("should complete empty for a missing key")
        void shouldCompleteEmptyForMissingKey() {
            StepVerifier.create(new InMemoryKeyValueStore(0).get("missing"))
                    .verifyComplete();
        }

        @Test
        @DisplayName("should reject a write past capacity")
        void shouldRejectWritePastCapacity() {
            InMemoryKeyValueStore store = new InMemoryKeyValueStore(10);

            StepVerifier.create(store.set("key", "0123456789"))
                    .expectError(StoreCapacityException.class)
                    .verify();
        }

        @Test
        @DisplayName("should count an overwrite by its new size only")
        void shouldCountOverwriteByNewSize() {
            InMemoryKeyValueStore store = new InMemoryKeyValueStore(20);

            StepVerifier.create(store.set("k", "0123456789")
                            .then(store.set("k", "0123456789abcdefgh"))
                            .then(store.get("k")))
                    .expectNext("0123456789abcdefgh")
                    .verifyComplete();
        }
    }

    @Nested
    @DisplayName("keys and remove")
    class KeysAndRemove {

        @Test
        @DisplayName("should list keys under a prefix in sorted order")
        void shouldListKeysUnderPrefix() {
            InMemoryKeyValueStore store = new InMemoryKeyValueStore(0);

            StepVerifier.create(store.set("intake:b", "1")
                            .then(store.set("intake:a", "2"))
                            .then(store.set("other", "3"))
                            .thenMany(store.keys("intake:")))
                    .expectNext("intake:a", "intake:b")
                    .verifyComplete();
        }

        @Test
        @DisplayName("should report whether a key was removed")
        void shouldReportRemoval() {
            InMemoryKeyValueStore store = new InMemoryKeyValueStore(0);

            StepVerifier.create(store.set("k", "v").then(store.remove("k")))
                    .expectNext(true)
                    .verifyComplete();
            StepVerifier.create(store.remove("k"))
                    .expectNext(false)
                    .verifyComplete();
        }
    }
}
