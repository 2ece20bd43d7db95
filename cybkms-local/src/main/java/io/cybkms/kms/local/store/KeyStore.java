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
import java.time.temporal.ChronoUnit;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import javax.annotation.concurrent.ThreadSafe;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.cybkms.kms.service.DestroyableRawSecretKey;
import io.cybkms.kms.service.KeyArn;
import io.cybkms.kms.service.KeyMetadata;
import io.cybkms.kms.service.KeySpec;
import io.cybkms.kms.service.KeyState;
import io.cybkms.kms.service.KeyStoreLoadException;
import io.cybkms.kms.service.KeyUsage;
import io.cybkms.kms.service.KmsException;
import io.cybkms.kms.service.NotFoundException;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The table of keys known to the local KMS.
 * <p>
 * The table is owned by a single worker thread. Every operation is queued to that thread and
 * runs to completion, including writing the table to persistence, before the next one starts.
 * Callers never see a partially applied mutation. If persisting a mutation fails, the in-memory
 * change is reverted and the operation fails with a {@link KmsException}.
 * </p>
 * Operations accept either a bare key id or a key ARN.
 */
@ThreadSafe
public class KeyStore implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(KeyStore.class);

    private final ExecutorService worker;
    private final KeyTablePersistence persistence;
    private final Clock clock;
    private final SecureRandom random;
    // confined to the worker thread
    private final LinkedHashMap<String, KeyRecord> table;
    private volatile Thread workerThread;

    private KeyStore(KeyTablePersistence persistence, LinkedHashMap<String, KeyRecord> table, Clock clock, SecureRandom random) {
        this.persistence = persistence;
        this.table = table;
        this.clock = clock;
        this.random = random;
        this.worker = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "cybkms-keystore");
            thread.setDaemon(true);
            workerThread = thread;
            return thread;
        });
    }

    /**
     * Loads the table from persistence and starts the worker.
     *
     * @param persistence where the table lives
     * @param clock source of creation and deletion dates
     * @param random source of key material
     * @return the store
     * @throws KeyStoreLoadException if the persisted table cannot be read
     */
    @NonNull
    public static KeyStore open(@NonNull KeyTablePersistence persistence, @NonNull Clock clock, @NonNull SecureRandom random) {
        Objects.requireNonNull(persistence);
        Objects.requireNonNull(clock);
        Objects.requireNonNull(random);
        return new KeyStore(persistence, persistence.load(), clock, random);
    }

    @NonNull
    public static KeyStore open(@NonNull KeyTablePersistence persistence) {
        return open(persistence, Clock.systemUTC(), new SecureRandom());
    }

    /**
     * Creates an enabled key with fresh 256-bit material.
     *
     * @param description optional description
     * @param keyUsage key usage
     * @return the new key's metadata
     */
    @NonNull
    public CompletionStage<KeyMetadata> createKey(@Nullable String description, @NonNull KeyUsage keyUsage) {
        Objects.requireNonNull(keyUsage);
        return submit(() -> {
            String keyId = KeyArn.newKeyId();
            String arn = KeyArn.forKeyId(keyId);
            var metadata = new KeyMetadata(keyId, arn, description, keyUsage, KeyState.ENABLED, KeySpec.SYMMETRIC_DEFAULT,
                    now(), null);
            var material = DestroyableRawSecretKey.generateAes256(random);
            var keyRecord = new KeyRecord(keyId, arn, material.getEncoded(), metadata);
            material.destroy();
            table.put(keyId, keyRecord);
            persist(() -> table.remove(keyId));
            LOGGER.info("Created key {}", keyId);
            return metadata;
        });
    }

    /**
     * @param keyId key id or ARN
     * @return the key
     * @throws NotFoundException if there is no such key
     */
    @NonNull
    public CompletionStage<KeyRecord> getKey(@NonNull String keyId) {
        return submit(() -> lookup(KeyArn.toKeyId(keyId)));
    }

    /**
     * @return the metadata of every key, in creation order
     */
    @NonNull
    public CompletionStage<List<KeyMetadata>> listKeys() {
        return submit(() -> table.values().stream()
                .map(KeyRecord::metadata)
                .collect(Collectors.toUnmodifiableList()));
    }

    /**
     * @return the enabled keys, in creation order
     */
    @NonNull
    public CompletionStage<List<KeyRecord>> enabledKeys() {
        return submit(() -> table.values().stream()
                .filter(r -> r.metadata().enabled())
                .collect(Collectors.toUnmodifiableList()));
    }

    /**
     * Moves a key to a new state. Moving to {@link KeyState#PENDING_DELETION} this way records
     * the current instant as the deletion date; see {@link #scheduleDeletion(String, Duration)}.
     *
     * @param keyId key id or ARN
     * @param newState the requested state
     * @return the key's metadata after the change
     * @throws NotFoundException if there is no such key
     * @throws io.cybkms.kms.service.KeyUnavailableException if the key cannot leave its current state
     * @throws io.cybkms.kms.service.InvalidKeyUsageException if the requested state is reserved
     */
    @NonNull
    public CompletionStage<KeyMetadata> updateKeyState(@NonNull String keyId, @NonNull KeyState newState) {
        Objects.requireNonNull(newState);
        return submit(() -> transition(KeyArn.toKeyId(keyId), newState, Duration.ZERO));
    }

    /**
     * Moves a key to {@link KeyState#PENDING_DELETION} with a deletion date {@code pendingWindow} from now.
     * Scheduling a key that is already pending deletion keeps its original date.
     *
     * @param keyId key id or ARN
     * @param pendingWindow time until the key may be purged
     * @return the key's metadata after the change
     */
    @NonNull
    public CompletionStage<KeyMetadata> scheduleDeletion(@NonNull String keyId, @NonNull Duration pendingWindow) {
        Objects.requireNonNull(pendingWindow);
        if (pendingWindow.isNegative()) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("Pending window must not be negative"));
        }
        return submit(() -> transition(KeyArn.toKeyId(keyId), KeyState.PENDING_DELETION, pendingWindow));
    }

    /**
     * Removes a key outright.
     *
     * @param keyId key id or ARN
     * @return completion of the removal
     * @throws NotFoundException if there is no such key
     */
    @NonNull
    public CompletionStage<Void> deleteKey(@NonNull String keyId) {
        return submit(() -> {
            String id = KeyArn.toKeyId(keyId);
            var removed = lookup(id);
            var snapshot = new LinkedHashMap<>(table);
            table.remove(id);
            persist(() -> {
                table.clear();
                table.putAll(snapshot);
            });
            LOGGER.info("Deleted key {} (was {})", id, removed.metadata().keyState().value());
            return null;
        });
    }

    /**
     * Stops the worker after queued operations have run. Operations submitted afterwards fail.
     */
    @Override
    public void close() {
        worker.shutdown();
        try {
            if (!worker.awaitTermination(10, TimeUnit.SECONDS)) {
                LOGGER.warn("Key store worker did not stop within 10 seconds");
            }
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private KeyMetadata transition(String keyId, KeyState newState, Duration pendingWindow) {
        var current = lookup(keyId);
        var currentMetadata = current.metadata();
        if (!KeyLifecycle.checkTransition(keyId, currentMetadata.keyState(), newState)) {
            LOGGER.debug("Key {} is already {}", keyId, newState.value());
            return currentMetadata;
        }
        Instant deletionDate = newState == KeyState.PENDING_DELETION ? now().plus(pendingWindow) : null;
        var updated = current.withMetadata(currentMetadata.withState(newState, deletionDate));
        table.put(keyId, updated);
        persist(() -> table.put(keyId, current));
        LOGGER.info("Key {} moved from {} to {}", keyId, currentMetadata.keyState().value(), newState.value());
        return updated.metadata();
    }

    private KeyRecord lookup(String keyId) {
        var keyRecord = table.get(keyId);
        if (keyRecord == null) {
            throw NotFoundException.forKey(keyId);
        }
        return keyRecord;
    }

    private void persist(Runnable rollback) {
        try {
            persistence.save(Collections.unmodifiableMap(table));
        }
        catch (IOException | RuntimeException e) {
            rollback.run();
            LOGGER.error("Failed to persist key table, change reverted", e);
            throw new KmsException("Failed to persist key table", e);
        }
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    boolean isWorkerThread() {
        return Thread.currentThread() == workerThread;
    }

    private <T> CompletionStage<T> submit(Supplier<T> operation) {
        var future = new CompletableFuture<T>();
        try {
            worker.execute(() -> {
                try {
                    future.complete(operation.get());
                }
                catch (RuntimeException e) {
                    future.completeExceptionally(e);
                }
            });
        }
        catch (RejectedExecutionException e) {
            future.completeExceptionally(new IllegalStateException("Key store is closed", e));
        }
        return future;
    }
}
