/*
 * Copyright CybKMS Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.cybkms.kms.crypto;

import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Objects;

import javax.annotation.concurrent.ThreadSafe;
import javax.crypto.AEADBadTagException;
import javax.crypto.Cipher;
import javax.crypto.SecretKey;
import javax.crypto.spec.GCMParameterSpec;

import io.cybkms.kms.service.InvalidCiphertextException;
import io.cybkms.kms.service.KmsException;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * AES-256-GCM sealing and opening with a 96-bit nonce and a 128-bit tag.
 * Used both by the KMS for its own keys and by envelope encryption for wrapping and payload chunks.
 * <p>A new {@link Cipher} is obtained per call, so an instance may be shared between threads.</p>
 */
@ThreadSafe
public final class AesGcm {

    public static final int NONCE_LENGTH = 12;
    public static final int TAG_LENGTH = 16;
    public static final int OVERHEAD = NONCE_LENGTH + TAG_LENGTH;
    public static final int KEY_LENGTH = 32;

    private static final String TRANSFORMATION = "AES/GCM/NoPadding";
    private static final int TAG_BITS = TAG_LENGTH * Byte.SIZE;

    private final SecureRandom random;

    public AesGcm() {
        this(new SecureRandom());
    }

    public AesGcm(@NonNull SecureRandom random) {
        this.random = Objects.requireNonNull(random);
    }

    /**
     * @return a fresh random nonce
     */
    @NonNull
    public byte[] randomNonce() {
        byte[] nonce = new byte[NONCE_LENGTH];
        random.nextBytes(nonce);
        return nonce;
    }

    /**
     * Seals the plaintext under a fresh random nonce.
     * @param key a 256-bit AES key
     * @param plaintext the plaintext
     * @return {@code nonce || ciphertext || tag}
     */
    @NonNull
    public byte[] seal(@NonNull SecretKey key, @NonNull byte[] plaintext) {
        return seal(key, randomNonce(), plaintext).combined();
    }

    /**
     * Seals the plaintext under the given nonce. The caller is responsible for never
     * reusing a nonce with the same key.
     * @param key a 256-bit AES key
     * @param nonce the nonce
     * @param plaintext the plaintext
     * @return the sealed box
     */
    @NonNull
    public SealedBox seal(@NonNull SecretKey key, @NonNull byte[] nonce, @NonNull byte[] plaintext) {
        checkKey(key);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.ENCRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, nonce));
            return new SealedBox(nonce.clone(), cipher.doFinal(plaintext));
        }
        catch (GeneralSecurityException e) {
            throw new KmsException("AES-GCM encryption failed", e);
        }
    }

    /**
     * Authenticates and decrypts {@code nonce || ciphertext || tag}.
     * @param key a 256-bit AES key
     * @param combined the sealed bytes
     * @return the plaintext
     * @throws InvalidCiphertextException if the input is too short or fails authentication
     */
    @NonNull
    public byte[] open(@NonNull SecretKey key, @NonNull byte[] combined) {
        return open(key, SealedBox.fromCombined(combined));
    }

    /**
     * Authenticates and decrypts a sealed box.
     * @param key a 256-bit AES key
     * @param box the sealed box
     * @return the plaintext
     * @throws InvalidCiphertextException if the box fails authentication
     */
    @NonNull
    public byte[] open(@NonNull SecretKey key, @NonNull SealedBox box) {
        checkKey(key);
        try {
            Cipher cipher = Cipher.getInstance(TRANSFORMATION);
            cipher.init(Cipher.DECRYPT_MODE, key, new GCMParameterSpec(TAG_BITS, box.nonce()));
            return cipher.doFinal(box.ciphertextAndTag());
        }
        catch (AEADBadTagException e) {
            throw new InvalidCiphertextException("Ciphertext failed authentication", e);
        }
        catch (GeneralSecurityException e) {
            throw new KmsException("AES-GCM decryption failed", e);
        }
    }

    private static void checkKey(SecretKey key) {
        var encoded = Objects.requireNonNull(key).getEncoded();
        try {
            if (encoded == null || encoded.length != KEY_LENGTH) {
                throw new IllegalArgumentException("AES-256 key required");
            }
        }
        finally {
            if (encoded != null) {
                Arrays.fill(encoded, (byte) 0);
            }
        }
    }
}
