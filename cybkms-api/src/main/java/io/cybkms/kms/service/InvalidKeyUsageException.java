/*
 * Copyright CybKMS Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.cybkms.kms.service;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Thrown when a KMS-managed key is passed to an operation that is incompatible with its allowed key usage,
 * or when an operation asks for a lifecycle state that no operation may move a key into.
 */
public class InvalidKeyUsageException extends KmsException {

    public InvalidKeyUsageException(String message) {
        super(message);
    }

    @NonNull
    @Override
    public KmsErrorType errorType() {
        return KmsErrorType.INVALID_KEY_USAGE;
    }
}
