/*
 * Copyright CybKMS Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.cybkms.kms.local.store;

import java.io.IOException;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import io.cybkms.kms.service.KeyArn;
import io.cybkms.kms.service.KeyMetadata;
import io.cybkms.kms.service.KeyState;
import io.cybkms.kms.service.KeyUnavailableException;
import io.cybkms.kms.service.KeyUsage;
import io.cybkms.kms.service.KmsException;
import io.cybkms.kms.service.NotFoundException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class KeyStoreTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);
    private static final Instant NOW = Instant.parse("2024-05-01T10:15:30.123Z");

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private KeyStore store;

    @Mock
    private KeyTablePersistence persistence;

    @BeforeEach
    void setUp() {
        store = KeyStore.open(KeyTablePersistence.inMemory(), clock, new SecureRandom());
    }

    @AfterEach
    void tearDown() {
        store.close();
    }

    @Test
    void createKey() {
        var stage = store.createKey("Test Key", KeyUsage.ENCRYPT_DECRYPT);

        assertThat(stage).succeedsWithin(TIMEOUT)
                .satisfies(metadata -> {
                    assertThat(KeyArn.isWellFormedKeyId(metadata.keyId())).isTrue();
                    assertThat(metadata.arn()).isEqualTo(KeyArn.PREFIX + metadata.keyId());
                    assertThat(metadata.description()).isEqualTo("Test Key");
                    assertThat(metadata.keyState()).isEqualTo(KeyState.ENABLED);
                    assertThat(metadata.enabled()).isTrue();
                    assertThat(metadata.creationDate()).isEqualTo(NOW);
                    assertThat(metadata.deletionDate()).isNull();
                });
    }

    @Test
    void createdKeysHaveDistinctMaterial() {
        var first = create();
        var second = create();

        var firstRecord = join(store.getKey(first.keyId()));
        var secondRecord = join(store.getKey(second.keyId()));

        assertThat(firstRecord.keyMaterial()).hasSize(32).isNotEqualTo(secondRecord.keyMaterial());
        assertThat(first.keyId()).isNotEqualTo(second.keyId());
    }

    @Test
    void returnedMaterialCannotAlterStoredKey() {
        var metadata = create();
        var material = join(store.getKey(metadata.keyId())).keyMaterial();
        byte[] original = material.clone();

        Arrays.fill(material, (byte) 0);
        join(store.getKey(metadata.keyId())).keyMaterial()[0] ^= 1;

        var reread = join(store.getKey(metadata.keyId()));
        assertThat(reread.keyMaterial()).isEqualTo(original);
        assertThat(reread.secretKey().getEncoded()).isEqualTo(original);
    }

    @Test
    void getKeyAcceptsArn() {
        var metadata = create();

        assertThat(store.getKey(metadata.arn())).succeedsWithin(TIMEOUT)
                .extracting(KeyRecord::keyId)
                .isEqualTo(metadata.keyId());
    }

    @Test
    void getUnknownKey() {
        assertThat(store.getKey("non-existent")).failsWithin(TIMEOUT)
                .withThrowableThat()
                .isInstanceOf(ExecutionException.class)
                .havingCause()
                .isInstanceOf(NotFoundException.class)
                .withMessage("Key 'non-existent' not found");
    }

    @Test
    void listKeysInCreationOrder() {
        var created = List.of(create(), create(), create());

        assertThat(store.listKeys()).succeedsWithin(TIMEOUT)
                .isEqualTo(created);
    }

    @Test
    void enabledKeysExcludesDisabled() {
        var a = create();
        var b = create();
        var c = create();
        join(store.updateKeyState(b.keyId(), KeyState.DISABLED));

        assertThat(store.enabledKeys()).succeedsWithin(TIMEOUT)
                .satisfies(records -> assertThat(records).extracting(KeyRecord::keyId).containsExactly(a.keyId(), c.keyId()));
    }

    @Test
    void disableThenEnable() {
        var metadata = create();

        var disabled = join(store.updateKeyState(metadata.keyId(), KeyState.DISABLED));
        assertThat(disabled.keyState()).isEqualTo(KeyState.DISABLED);
        assertThat(disabled.enabled()).isFalse();

        var enabled = join(store.updateKeyState(metadata.keyId(), KeyState.ENABLED));
        assertThat(enabled).isEqualTo(metadata);
    }

    @Test
    void scheduleDeletionRecordsDeletionDate() {
        var metadata = create();

        var pending = join(store.scheduleDeletion(metadata.keyId(), Duration.ofDays(7)));

        assertThat(pending.keyState()).isEqualTo(KeyState.PENDING_DELETION);
        assertThat(pending.enabled()).isFalse();
        assertThat(pending.deletionDate()).isEqualTo(NOW.plus(Duration.ofDays(7)));
    }

    @Test
    void reschedulingKeepsOriginalDeletionDate() {
        var metadata = create();
        var first = join(store.scheduleDeletion(metadata.keyId(), Duration.ofDays(7)));

        var second = join(store.scheduleDeletion(metadata.keyId(), Duration.ofDays(30)));

        assertThat(second).isEqualTo(first);
    }

    @Test
    void pendingDeletionCannotBeEnabled() {
        var metadata = create();
        join(store.scheduleDeletion(metadata.keyId(), Duration.ofDays(7)));

        assertThat(store.updateKeyState(metadata.keyId(), KeyState.ENABLED)).failsWithin(TIMEOUT)
                .withThrowableThat()
                .havingCause()
                .isInstanceOf(KeyUnavailableException.class)
                .withMessage("Key '" + metadata.keyId() + "' is pending deletion");
    }

    @Test
    void deleteKey() {
        var keep = create();
        var gone = create();

        assertThat(store.deleteKey(gone.keyId())).succeedsWithin(TIMEOUT);

        assertThat(store.listKeys()).succeedsWithin(TIMEOUT).isEqualTo(List.of(keep));
        assertThat(store.getKey(gone.keyId())).failsWithin(TIMEOUT)
                .withThrowableThat()
                .havingCause()
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void deleteUnknownKey() {
        assertThat(store.deleteKey("non-existent")).failsWithin(TIMEOUT)
                .withThrowableThat()
                .havingCause()
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void failedCreateIsRolledBack() throws IOException {
        try (var failing = openWithMock()) {
            doThrow(new IOException("disk full")).when(persistence).save(anyMap());

            assertThat(failing.createKey(null, KeyUsage.ENCRYPT_DECRYPT)).failsWithin(TIMEOUT)
                    .withThrowableThat()
                    .havingCause()
                    .isInstanceOf(KmsException.class)
                    .withMessage("Failed to persist key table");
            assertThat(failing.listKeys()).succeedsWithin(TIMEOUT).isEqualTo(List.of());
        }
    }

    @Test
    void failedStateChangeIsRolledBack() throws IOException {
        try (var failing = openWithMock()) {
            var metadata = join(failing.createKey(null, KeyUsage.ENCRYPT_DECRYPT));
            doThrow(new IOException("disk full")).when(persistence).save(anyMap());

            assertThat(failing.updateKeyState(metadata.keyId(), KeyState.DISABLED)).failsWithin(TIMEOUT);

            assertThat(failing.getKey(metadata.keyId())).succeedsWithin(TIMEOUT)
                    .extracting(KeyRecord::metadata)
                    .isEqualTo(metadata);
        }
    }

    @Test
    void failedDeleteIsRolledBack() throws IOException {
        try (var failing = openWithMock()) {
            var first = join(failing.createKey(null, KeyUsage.ENCRYPT_DECRYPT));
            var second = join(failing.createKey(null, KeyUsage.ENCRYPT_DECRYPT));
            doThrow(new IOException("disk full")).when(persistence).save(anyMap());

            assertThat(failing.deleteKey(first.keyId())).failsWithin(TIMEOUT);

            assertThat(failing.listKeys()).succeedsWithin(TIMEOUT).isEqualTo(List.of(first, second));
        }
    }

    @Test
    void persistenceRunsOnWorkerThreadOneAtATime() throws IOException {
        var concurrentSaves = new AtomicInteger();
        var maxConcurrentSaves = new AtomicInteger();
        var onWorker = new CopyOnWriteArrayList<Boolean>();
        try (var observed = openWithMock()) {
            doAnswerSave(() -> {
                int now = concurrentSaves.incrementAndGet();
                maxConcurrentSaves.accumulateAndGet(now, Math::max);
                onWorker.add(observed.isWorkerThread());
                concurrentSaves.decrementAndGet();
            });

            List<CompletableFuture<KeyMetadata>> creates = new ArrayList<>();
            for (int i = 0; i < 50; i++) {
                creates.add(CompletableFuture.supplyAsync(() -> observed.createKey(null, KeyUsage.ENCRYPT_DECRYPT))
                        .thenCompose(stage -> stage));
            }
            CompletableFuture.allOf(creates.toArray(CompletableFuture[]::new)).join();

            assertThat(maxConcurrentSaves).hasValue(1);
            assertThat(onWorker).hasSize(50).containsOnly(true);
        }
    }

    @Test
    void concurrentMutationsAreNeverPartiallyVisible() {
        var snapshots = new CopyOnWriteArrayList<Map<String, KeyRecord>>();
        try (var observed = KeyStore.open(recordingPersistence(snapshots), clock, new SecureRandom())) {
            List<CompletableFuture<?>> operations = new ArrayList<>();
            List<CompletableFuture<List<KeyMetadata>>> listings = new ArrayList<>();
            for (int i = 0; i < 40; i++) {
                operations.add(CompletableFuture.supplyAsync(() -> observed.createKey(null, KeyUsage.ENCRYPT_DECRYPT))
                        .thenCompose(stage -> stage)
                        .thenCompose(created -> observed.deleteKey(created.keyId()))
                        .toCompletableFuture());
                listings.add(observed.listKeys().toCompletableFuture());
            }
            CompletableFuture.allOf(operations.toArray(CompletableFuture[]::new)).join();

            // every persisted snapshot differs from its predecessor by exactly one key
            for (int i = 1; i < snapshots.size(); i++) {
                assertThat(Math.abs(snapshots.get(i).size() - snapshots.get(i - 1).size())).isEqualTo(1);
            }
            // every listing shows only fully created keys
            for (var listing : listings) {
                assertThat(listing.join()).allSatisfy(metadata -> assertThat(metadata.keyState()).isEqualTo(KeyState.ENABLED));
            }
            assertThat(observed.listKeys()).succeedsWithin(TIMEOUT).isEqualTo(List.of());
            assertThat(snapshots).hasSize(80);
        }
    }

    @Test
    void operationsAfterCloseFail() {
        store.close();

        assertThat(store.listKeys()).failsWithin(TIMEOUT)
                .withThrowableThat()
                .havingCause()
                .isInstanceOf(IllegalStateException.class);
    }

    private KeyStore openWithMock() {
        when(persistence.load()).thenReturn(new LinkedHashMap<>());
        return KeyStore.open(persistence, clock, new SecureRandom());
    }

    private void doAnswerSave(Runnable onSave) throws IOException {
        doAnswer(invocation -> {
            onSave.run();
            return null;
        }).when(persistence).save(anyMap());
    }

    private static KeyTablePersistence recordingPersistence(List<Map<String, KeyRecord>> snapshots) {
        return new KeyTablePersistence() {
            @Override
            public LinkedHashMap<String, KeyRecord> load() {
                return new LinkedHashMap<>();
            }

            @Override
            public void save(Map<String, KeyRecord> table) {
                snapshots.add(Map.copyOf(table));
            }
        };
    }

    private KeyMetadata create() {
        return join(store.createKey(null, KeyUsage.ENCRYPT_DECRYPT));
    }

    private static <T> T join(CompletionStage<T> stage) {
        return stage.toCompletableFuture().join();
    }
}
