/*
 * Copyright CybKMS Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.cybkms.kms.service;

import java.util.Arrays;
import java.util.Objects;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * The result of an encrypt operation.
 *
 * @param ciphertextBlob {@code nonce || ciphertext || tag}
 * @param keyId the id of the key that encrypted
 * @param arn the ARN of the key that encrypted
 * @param encryptionAlgorithm the algorithm tag
 */
public record EncryptResult(@NonNull byte[] ciphertextBlob,
                            @NonNull String keyId,
                            @NonNull String arn,
                            @NonNull EncryptionAlgorithm encryptionAlgorithm) {

    public EncryptResult {
        Objects.requireNonNull(ciphertextBlob);
        Objects.requireNonNull(keyId);
        Objects.requireNonNull(arn);
        Objects.requireNonNull(encryptionAlgorithm);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        EncryptResult that = (EncryptResult) o;
        return Arrays.equals(ciphertextBlob, that.ciphertextBlob)
                && keyId.equals(that.keyId)
                && arn.equals(that.arn)
                && encryptionAlgorithm == that.encryptionAlgorithm;
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.hashCode(ciphertextBlob), keyId, arn, encryptionAlgorithm);
    }

    @Override
    public String toString() {
        return "EncryptResult{"
                + "ciphertextBlob=" + ciphertextBlob.length + " bytes"
                + ", keyId='" + keyId + '\''
                + ", encryptionAlgorithm=" + encryptionAlgorithm
                + '}';
    }
}
