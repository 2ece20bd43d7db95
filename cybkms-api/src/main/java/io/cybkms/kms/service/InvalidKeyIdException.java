/*
 * Copyright CybKMS Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.cybkms.kms.service;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Thrown when a key identifier is syntactically invalid.
 */
public class InvalidKeyIdException extends KmsException {

    public InvalidKeyIdException(String message) {
        super(message);
    }

    @NonNull
    @Override
    public KmsErrorType errorType() {
        return KmsErrorType.INVALID_KEY_ID;
    }
}
