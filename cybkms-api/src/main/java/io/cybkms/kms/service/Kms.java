/*
 * Copyright CybKMS Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.cybkms.kms.service;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionStage;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The KMS-compatible operation surface.
 * <p>Every operation is asynchronous. Failures complete the returned stage exceptionally with a
 * {@link KmsException}; the KMS itself never retries.</p>
 * <p>Wherever a {@code keyId} is accepted, the key's ARN may be given instead.</p>
 */
public interface Kms {

    /**
     * Asynchronously creates a new symmetric key in the {@link KeyState#ENABLED} state.
     * @param description optional free text.
     * @param keyUsage the usage of the key.
     * @return A completion stage for the new key's metadata.
     * @throws KmsException if the key could not be persisted.
     */
    @NonNull
    CompletionStage<KeyMetadata> createKey(@Nullable String description,
                                           @NonNull KeyUsage keyUsage);

    /**
     * Creates an {@link KeyUsage#ENCRYPT_DECRYPT} key.
     * @param description optional free text.
     * @return A completion stage for the new key's metadata.
     */
    @NonNull
    default CompletionStage<KeyMetadata> createKey(@Nullable String description) {
        return createKey(description, KeyUsage.ENCRYPT_DECRYPT);
    }

    /**
     * @param keyId the key
     * @return A completion stage for the key's metadata.
     * @throws NotFoundException If the key is not known to this KMS.
     */
    @NonNull
    CompletionStage<KeyMetadata> describeKey(@NonNull String keyId);

    /**
     * @return A completion stage for a snapshot of the metadata of every key.
     */
    @NonNull
    CompletionStage<List<KeyMetadata>> listKeys();

    /**
     * Enables a key. Enabling an enabled key succeeds without effect.
     * @param keyId the key
     * @return A completion stage for the key's updated metadata.
     * @throws NotFoundException If the key is not known to this KMS.
     * @throws KeyUnavailableException If the key is pending deletion.
     */
    @NonNull
    CompletionStage<KeyMetadata> enableKey(@NonNull String keyId);

    /**
     * Disables a key. Disabling a disabled key succeeds without effect.
     * @param keyId the key
     * @return A completion stage for the key's updated metadata.
     * @throws NotFoundException If the key is not known to this KMS.
     * @throws KeyUnavailableException If the key is pending deletion.
     */
    @NonNull
    CompletionStage<KeyMetadata> disableKey(@NonNull String keyId);

    /**
     * Moves a key to {@link KeyState#PENDING_DELETION}. The key is permanently unusable from then on;
     * the actual purge is left to an external process once the deletion date has passed.
     * @param keyId the key
     * @param pendingWindowInDays days until the key may be purged, or null for the default.
     * @return A completion stage for the scheduled deletion.
     * @throws NotFoundException If the key is not known to this KMS.
     */
    @NonNull
    CompletionStage<ScheduleKeyDeletionResult> scheduleKeyDeletion(@NonNull String keyId,
                                                                   @Nullable Integer pendingWindowInDays);

    /**
     * Asynchronously encrypts the plaintext under the given key.
     * @param plaintext the plaintext
     * @param keyId the key
     * @param encryptionAlgorithm the algorithm
     * @param encryptionContext optional context, accepted for API compatibility
     * @return A completion stage for the result.
     * @throws NotFoundException If the key is not known to this KMS.
     * @throws KeyUnavailableException If the key is not enabled.
     */
    @NonNull
    CompletionStage<EncryptResult> encrypt(@NonNull byte[] plaintext,
                                           @NonNull String keyId,
                                           @NonNull EncryptionAlgorithm encryptionAlgorithm,
                                           @Nullable Map<String, String> encryptionContext);

    @NonNull
    default CompletionStage<EncryptResult> encrypt(@NonNull byte[] plaintext,
                                                   @NonNull String keyId) {
        return encrypt(plaintext, keyId, EncryptionAlgorithm.SYMMETRIC_DEFAULT, null);
    }

    /**
     * Asynchronously decrypts a blob {@linkplain #encrypt(byte[], String, EncryptionAlgorithm, Map) previously encrypted}.
     * <p>When {@code keyId} is null every enabled key is tried in turn and the first that
     * authenticates the blob wins.</p>
     * @param ciphertextBlob the blob
     * @param encryptionAlgorithm the algorithm
     * @param encryptionContext optional context, accepted for API compatibility
     * @param keyId the key to use, or null to search the enabled keys
     * @return A completion stage for the result.
     * @throws NotFoundException If the given key is not known to this KMS.
     * @throws KeyUnavailableException If the given key is not enabled.
     * @throws InvalidCiphertextException If the blob cannot be authenticated.
     */
    @NonNull
    CompletionStage<DecryptResult> decrypt(@NonNull byte[] ciphertextBlob,
                                           @NonNull EncryptionAlgorithm encryptionAlgorithm,
                                           @Nullable Map<String, String> encryptionContext,
                                           @Nullable String keyId);

    @NonNull
    default CompletionStage<DecryptResult> decrypt(@NonNull byte[] ciphertextBlob,
                                                   @Nullable String keyId) {
        return decrypt(ciphertextBlob, EncryptionAlgorithm.SYMMETRIC_DEFAULT, null, keyId);
    }

    @NonNull
    default CompletionStage<DecryptResult> decrypt(@NonNull byte[] ciphertextBlob) {
        return decrypt(ciphertextBlob, null);
    }
}
