/*
 * Copyright CybKMS Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.cybkms.kms.service;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Thrown when a cryptographic operation targets a key whose state is not {@link KeyState#ENABLED},
 * or when a state change is requested for a key that can no longer change state.
 */
public class KeyUnavailableException extends KmsException {

    public KeyUnavailableException(String message) {
        super(message);
    }

    public static KeyUnavailableException notEnabled(@NonNull String keyId) {
        return new KeyUnavailableException("Key '" + keyId + "' is not enabled");
    }

    public static KeyUnavailableException pendingDeletion(@NonNull String keyId) {
        return new KeyUnavailableException("Key '" + keyId + "' is pending deletion");
    }

    @NonNull
    @Override
    public KmsErrorType errorType() {
        return KmsErrorType.KEY_UNAVAILABLE;
    }
}
