/*
 * Copyright CybKMS Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.cybkms.kms.service;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Thrown when a grant token presented with a request is not valid.
 */
public class InvalidGrantTokenException extends KmsException {

    public InvalidGrantTokenException(String message) {
        super(message);
    }

    @NonNull
    @Override
    public KmsErrorType errorType() {
        return KmsErrorType.INVALID_GRANT_TOKEN;
    }
}
