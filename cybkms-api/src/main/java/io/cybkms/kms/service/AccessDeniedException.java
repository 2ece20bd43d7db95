/*
 * Copyright CybKMS Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.cybkms.kms.service;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Thrown when the caller is not permitted to perform the requested operation.
 */
public class AccessDeniedException extends KmsException {

    public AccessDeniedException(String message) {
        super(message);
    }

    @NonNull
    @Override
    public KmsErrorType errorType() {
        return KmsErrorType.ACCESS_DENIED;
    }
}
