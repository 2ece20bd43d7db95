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
 * The result of a decrypt operation.
 * The {@code keyId} is that of the key which authenticated the ciphertext, which, when the caller
 * gave no key, is discovered by the KMS.
 *
 * @param plaintext the recovered plaintext
 * @param keyId the id of the key that decrypted
 * @param arn the ARN of the key that decrypted
 * @param encryptionAlgorithm the algorithm tag
 */
public record DecryptResult(@NonNull byte[] plaintext,
                            @NonNull String keyId,
                            @NonNull String arn,
                            @NonNull EncryptionAlgorithm encryptionAlgorithm) {

    public DecryptResult {
        Objects.requireNonNull(plaintext);
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
        DecryptResult that = (DecryptResult) o;
        return Arrays.equals(plaintext, that.plaintext)
                && keyId.equals(that.keyId)
                && arn.equals(that.arn)
                && encryptionAlgorithm == that.encryptionAlgorithm;
    }

    @Override
    public int hashCode() {
        return Objects.hash(Arrays.hashCode(plaintext), keyId, arn, encryptionAlgorithm);
    }

    // never render the plaintext
    @Override
    public String toString() {
        return "DecryptResult{"
                + "plaintext=" + plaintext.length + " bytes"
                + ", keyId='" + keyId + '\''
                + ", encryptionAlgorithm=" + encryptionAlgorithm
                + '}';
    }
}
