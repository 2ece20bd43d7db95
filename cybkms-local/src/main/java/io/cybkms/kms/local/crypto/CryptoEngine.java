/*
 * Copyright CybKMS Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.cybkms.kms.local.crypto;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;

import javax.annotation.concurrent.ThreadSafe;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.cybkms.kms.crypto.AesGcm;
import io.cybkms.kms.crypto.SealedBox;
import io.cybkms.kms.local.store.KeyRecord;
import io.cybkms.kms.local.store.KeyStore;
import io.cybkms.kms.service.DecryptResult;
import io.cybkms.kms.service.EncryptResult;
import io.cybkms.kms.service.EncryptionAlgorithm;
import io.cybkms.kms.service.InvalidCiphertextException;
import io.cybkms.kms.service.KeyUnavailableException;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Encrypts and decrypts under keys held in a {@link KeyStore}.
 * Keys are looked up on the store's worker; AES-GCM runs on the crypto executor.
 * <p>
 * The encryption context is accepted but is not bound into the ciphertext.
 * </p>
 */
@ThreadSafe
public class CryptoEngine {

    private static final Logger LOGGER = LoggerFactory.getLogger(CryptoEngine.class);

    static final String NO_KEY_DECRYPTS = "Unable to decrypt ciphertext with available keys";

    private final KeyStore keyStore;
    private final AesGcm aesGcm;
    private final Executor cryptoExecutor;

    public CryptoEngine(@NonNull KeyStore keyStore, @NonNull AesGcm aesGcm, @NonNull Executor cryptoExecutor) {
        this.keyStore = Objects.requireNonNull(keyStore);
        this.aesGcm = Objects.requireNonNull(aesGcm);
        this.cryptoExecutor = Objects.requireNonNull(cryptoExecutor);
    }

    @NonNull
    public CompletionStage<EncryptResult> encrypt(@NonNull byte[] plaintext,
                                                  @NonNull String keyId,
                                                  @NonNull EncryptionAlgorithm encryptionAlgorithm,
                                                  @Nullable Map<String, String> encryptionContext) {
        Objects.requireNonNull(plaintext);
        Objects.requireNonNull(encryptionAlgorithm);
        return keyStore.getKey(keyId).thenApplyAsync(keyRecord -> {
            requireEnabled(keyRecord);
            byte[] blob = aesGcm.seal(keyRecord.secretKey(), plaintext);
            LOGGER.debug("Encrypted {} byte(s) under key {}", plaintext.length, keyRecord.keyId());
            return new EncryptResult(blob, keyRecord.keyId(), keyRecord.arn(), encryptionAlgorithm);
        }, cryptoExecutor);
    }

    /**
     * Decrypts a blob. With a key id, only that key is tried. Without one, each enabled key is tried
     * in creation order and the first that authenticates the blob is reported in the result.
     */
    @NonNull
    public CompletionStage<DecryptResult> decrypt(@NonNull byte[] ciphertextBlob,
                                                  @NonNull EncryptionAlgorithm encryptionAlgorithm,
                                                  @Nullable Map<String, String> encryptionContext,
                                                  @Nullable String keyId) {
        Objects.requireNonNull(ciphertextBlob);
        Objects.requireNonNull(encryptionAlgorithm);
        if (keyId != null) {
            return keyStore.getKey(keyId).thenApplyAsync(keyRecord -> {
                requireEnabled(keyRecord);
                var box = SealedBox.fromCombined(ciphertextBlob);
                byte[] plaintext = aesGcm.open(keyRecord.secretKey(), box);
                return new DecryptResult(plaintext, keyRecord.keyId(), keyRecord.arn(), encryptionAlgorithm);
            }, cryptoExecutor);
        }
        return keyStore.enabledKeys().thenApplyAsync(candidates -> trialDecrypt(ciphertextBlob, encryptionAlgorithm, candidates), cryptoExecutor);
    }

    private DecryptResult trialDecrypt(byte[] ciphertextBlob, EncryptionAlgorithm encryptionAlgorithm, List<KeyRecord> candidates) {
        var box = SealedBox.fromCombined(ciphertextBlob);
        for (KeyRecord candidate : candidates) {
            try {
                byte[] plaintext = aesGcm.open(candidate.secretKey(), box);
                LOGGER.debug("Key {} decrypted a blob presented without a key id", candidate.keyId());
                return new DecryptResult(plaintext, candidate.keyId(), candidate.arn(), encryptionAlgorithm);
            }
            catch (InvalidCiphertextException e) {
                LOGGER.trace("Key {} did not authenticate the blob", candidate.keyId());
            }
        }
        throw new InvalidCiphertextException(NO_KEY_DECRYPTS);
    }

    private static void requireEnabled(KeyRecord keyRecord) {
        if (!keyRecord.metadata().enabled()) {
            throw KeyUnavailableException.notEnabled(keyRecord.keyId());
        }
    }
}
