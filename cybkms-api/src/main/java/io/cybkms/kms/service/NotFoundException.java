/*
 * Copyright CybKMS Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.cybkms.kms.service;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Thrown when a KMS instance is passed reference to key that it does not manage.
 */
public class NotFoundException extends KmsException {

    public NotFoundException(String message) {
        super(message);
    }

    /**
     * @param keyId the id that could not be resolved
     * @return an exception describing the missing key
     */
    public static NotFoundException forKey(@NonNull String keyId) {
        return new NotFoundException("Key '" + keyId + "' not found");
    }

    @NonNull
    @Override
    public KmsErrorType errorType() {
        return KmsErrorType.NOT_FOUND;
    }
}
