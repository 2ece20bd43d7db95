/*
 * Copyright CybKMS Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.cybkms.kms.service;

import java.security.MessageDigest;
import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Objects;

import javax.annotation.concurrent.NotThreadSafe;
import javax.crypto.SecretKey;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * A SecretKey that has RAW encoding and can be {@linkplain #destroy() destroyed}
 * (unlike {@link javax.crypto.spec.SecretKeySpec}).
 * Used for every piece of key material that must not outlive its use: derived master keys
 * and unwrapped data keys.
 */
@NotThreadSafe
public final class DestroyableRawSecretKey implements SecretKey {

    public static final String AES = "AES";
    public static final int AES_256_KEY_BYTES = 32;

    private final String algorithm;
    private boolean destroyed = false;
    private final byte[] key;

    private DestroyableRawSecretKey(byte[] bytes, String algorithm) {
        this.algorithm = Objects.requireNonNull(algorithm);
        this.key = Objects.requireNonNull(bytes);
    }

    /**
     * @return The number of bits in this key
     */
    public int numKeyBits() {
        return key.length * Byte.SIZE;
    }

    /**
     * Create a new key by becoming owner of the given key material.
     * The caller should not modify the given bytes after calling this method.
     *
     * @param bytes The key material
     * @param algorithm The key algorithm
     * @return The new key
     */
    public static @NonNull DestroyableRawSecretKey takeOwnershipOf(@NonNull byte[] bytes,
                                                                   @NonNull String algorithm) {
        return new DestroyableRawSecretKey(bytes, algorithm);
    }

    /**
     * Create a new key by creating a copy of the given key material.
     *
     * @param bytes The key material
     * @param algorithm The key algorithm
     * @return The new key
     */
    public static @NonNull DestroyableRawSecretKey takeCopyOf(@NonNull byte[] bytes,
                                                              @NonNull String algorithm) {
        return new DestroyableRawSecretKey(Objects.requireNonNull(bytes).clone(), algorithm);
    }

    /**
     * Generates a fresh random 256-bit AES key.
     * @param random source of randomness
     * @return The new key
     */
    public static @NonNull DestroyableRawSecretKey generateAes256(@NonNull SecureRandom random) {
        byte[] bytes = new byte[AES_256_KEY_BYTES];
        random.nextBytes(bytes);
        return takeOwnershipOf(bytes, AES);
    }

    @Override
    public @NonNull String getAlgorithm() {
        return algorithm;
    }

    @Override
    public @NonNull String getFormat() {
        return "RAW";
    }

    /**
     * Returns the RAW-encoded key.
     * This is a copy the key. It is the caller's responsibility to destroy this key material
     * when it's no longer needed.
     * @return The RAW-encoded key.
     * @throws IllegalStateException if the key has been destroyed
     */
    @Override
    public @NonNull byte[] getEncoded() {
        checkNotDestroyed(this);
        return key.clone();
    }

    /**
     * Tests, in constant time, whether the other key has the same algorithm and key material.
     * @param other The other key
     * @return true if the keys are the same
     * @throws IllegalStateException if either key has been destroyed
     */
    public boolean sameAs(@NonNull DestroyableRawSecretKey other) {
        if (this == other) {
            return true;
        }
        checkNotDestroyed(this);
        checkNotDestroyed(Objects.requireNonNull(other));
        return algorithm.equalsIgnoreCase(other.algorithm)
                && MessageDigest.isEqual(key, other.key);
    }

    static void checkNotDestroyed(SecretKey key) {
        if (key.isDestroyed()) {
            throw new IllegalStateException("Key has been destroyed");
        }
    }

    @Override
    public void destroy() {
        Arrays.fill(key, (byte) 0);
        destroyed = true;
    }

    @Override
    public boolean isDestroyed() {
        return destroyed;
    }

    @Override
    public String toString() {
        return "DestroyableRawSecretKey{" + algorithm + ", " + numKeyBits() + " bits" + (destroyed ? ", destroyed" : "") + "}";
    }
}
