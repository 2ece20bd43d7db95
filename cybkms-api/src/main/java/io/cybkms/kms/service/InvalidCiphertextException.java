/*
 * Copyright CybKMS Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.cybkms.kms.service;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Thrown when a ciphertext cannot be authenticated, either because it was tampered with,
 * because it was produced under a different key, or because it is too short to be a ciphertext at all.
 * Never carries partial plaintext.
 */
public class InvalidCiphertextException extends KmsException {

    public InvalidCiphertextException(String message) {
        super(message);
    }

    public InvalidCiphertextException(String message, Throwable cause) {
        super(message, cause);
    }

    @NonNull
    @Override
    public KmsErrorType errorType() {
        return KmsErrorType.INVALID_CIPHERTEXT;
    }
}
