/*
 * Copyright CybKMS Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.cybkms.envelope;

import java.util.Arrays;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import io.cybkms.envelope.kdf.MasterKeyDerivation;
import io.cybkms.kms.crypto.AesGcm;
import io.cybkms.kms.service.DestroyableRawSecretKey;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * A data key sealed under a master key, together with the parameters needed to derive that master key again.
 *
 * @param wrappedDataKey {@code nonce || encrypted data key || tag}
 * @param kdfSalt the PBKDF2 salt
 * @param kdfIterations the PBKDF2 iteration count
 */
@JsonPropertyOrder({ "wrappedDataKey", "kdfSalt", "kdfIterations" })
public record WrappedDataKey(@JsonProperty("wrappedDataKey") @NonNull byte[] wrappedDataKey,
                             @JsonProperty("kdfSalt") @NonNull byte[] kdfSalt,
                             @JsonProperty("kdfIterations") int kdfIterations) {

    public static final int WRAPPED_LENGTH = DestroyableRawSecretKey.AES_256_KEY_BYTES + AesGcm.OVERHEAD;

    public WrappedDataKey {
        Objects.requireNonNull(wrappedDataKey, "wrappedDataKey");
        Objects.requireNonNull(kdfSalt, "kdfSalt");
        if (wrappedDataKey.length != WRAPPED_LENGTH) {
            throw new IllegalArgumentException("wrappedDataKey must be " + WRAPPED_LENGTH + " bytes, but was " + wrappedDataKey.length);
        }
        if (kdfSalt.length == 0) {
            throw new IllegalArgumentException("kdfSalt must not be empty");
        }
        if (kdfIterations < MasterKeyDerivation.MIN_ITERATIONS) {
            throw new IllegalArgumentException("kdfIterations must be at least " + MasterKeyDerivation.MIN_ITERATIONS);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        WrappedDataKey that = (WrappedDataKey) o;
        return kdfIterations == that.kdfIterations
                && Arrays.equals(wrappedDataKey, that.wrappedDataKey)
                && Arrays.equals(kdfSalt, that.kdfSalt);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(kdfIterations);
        result = 31 * result + Arrays.hashCode(wrappedDataKey);
        result = 31 * result + Arrays.hashCode(kdfSalt);
        return result;
    }

    @Override
    public String toString() {
        return "WrappedDataKey{" +
                "kdfSalt=" + kdfSalt.length + " bytes" +
                ", kdfIterations=" + kdfIterations +
                '}';
    }
}
