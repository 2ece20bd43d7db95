/*
 * Copyright CybKMS Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.cybkms.kms.local;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

import javax.annotation.concurrent.ThreadSafe;

import io.cybkms.kms.local.crypto.CryptoEngine;
import io.cybkms.kms.local.store.KeyStore;
import io.cybkms.kms.service.DecryptResult;
import io.cybkms.kms.service.EncryptResult;
import io.cybkms.kms.service.EncryptionAlgorithm;
import io.cybkms.kms.service.KeyMetadata;
import io.cybkms.kms.service.KeyState;
import io.cybkms.kms.service.KeyUsage;
import io.cybkms.kms.service.Kms;
import io.cybkms.kms.service.ScheduleKeyDeletionResult;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * A KMS whose keys live in a local {@link KeyStore}.
 */
@ThreadSafe
public class LocalKms implements Kms {

    private final KeyStore keyStore;
    private final CryptoEngine cryptoEngine;
    private final int defaultPendingWindowInDays;

    LocalKms(@NonNull KeyStore keyStore, @NonNull CryptoEngine cryptoEngine, int defaultPendingWindowInDays) {
        this.keyStore = Objects.requireNonNull(keyStore);
        this.cryptoEngine = Objects.requireNonNull(cryptoEngine);
        this.defaultPendingWindowInDays = defaultPendingWindowInDays;
    }

    @NonNull
    @Override
    public CompletionStage<KeyMetadata> createKey(@Nullable String description, @NonNull KeyUsage keyUsage) {
        return keyStore.createKey(description, keyUsage);
    }

    @NonNull
    @Override
    public CompletionStage<KeyMetadata> describeKey(@NonNull String keyId) {
        return keyStore.getKey(keyId).thenApply(keyRecord -> keyRecord.metadata());
    }

    @NonNull
    @Override
    public CompletionStage<List<KeyMetadata>> listKeys() {
        return keyStore.listKeys();
    }

    @NonNull
    @Override
    public CompletionStage<KeyMetadata> enableKey(@NonNull String keyId) {
        return keyStore.updateKeyState(keyId, KeyState.ENABLED);
    }

    @NonNull
    @Override
    public CompletionStage<KeyMetadata> disableKey(@NonNull String keyId) {
        return keyStore.updateKeyState(keyId, KeyState.DISABLED);
    }

    @NonNull
    @Override
    public CompletionStage<ScheduleKeyDeletionResult> scheduleKeyDeletion(@NonNull String keyId,
                                                                          @Nullable Integer pendingWindowInDays) {
        int days = pendingWindowInDays == null ? defaultPendingWindowInDays : pendingWindowInDays;
        if (days < LocalKmsConfig.MIN_PENDING_WINDOW_IN_DAYS || days > LocalKmsConfig.MAX_PENDING_WINDOW_IN_DAYS) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("pendingWindowInDays must be between "
                    + LocalKmsConfig.MIN_PENDING_WINDOW_IN_DAYS + " and " + LocalKmsConfig.MAX_PENDING_WINDOW_IN_DAYS
                    + ", but was " + days));
        }
        return keyStore.scheduleDeletion(keyId, Duration.ofDays(days))
                .thenApply(metadata -> new ScheduleKeyDeletionResult(metadata.keyId(), metadata.deletionDate(), metadata.keyState()));
    }

    /**
     * Removes a key permanently, whatever its state. Intended for the process that purges
     * keys whose deletion date has passed.
     *
     * @param keyId key id or ARN
     * @return completion of the removal
     * @throws io.cybkms.kms.service.NotFoundException if there is no such key
     */
    @NonNull
    public CompletionStage<Void> deleteKey(@NonNull String keyId) {
        return keyStore.deleteKey(keyId);
    }

    @NonNull
    @Override
    public CompletionStage<EncryptResult> encrypt(@NonNull byte[] plaintext,
                                                  @NonNull String keyId,
                                                  @NonNull EncryptionAlgorithm encryptionAlgorithm,
                                                  @Nullable Map<String, String> encryptionContext) {
        return cryptoEngine.encrypt(plaintext, keyId, encryptionAlgorithm, encryptionContext);
    }

    @NonNull
    @Override
    public CompletionStage<DecryptResult> decrypt(@NonNull byte[] ciphertextBlob,
                                                  @NonNull EncryptionAlgorithm encryptionAlgorithm,
                                                  @Nullable Map<String, String> encryptionContext,
                                                  @Nullable String keyId) {
        return cryptoEngine.decrypt(ciphertextBlob, encryptionAlgorithm, encryptionContext, keyId);
    }
}
