/*
 * Copyright CybKMS Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.cybkms.kms.service;

/**
 * Thrown when persisted key material cannot be read back: the file is unreadable, is not valid JSON,
 * or holds records that violate the store's invariants.
 * Kept distinct from {@link InvalidCiphertextException} so that operators can tell
 * a corrupted store apart from bad input.
 */
public class KeyStoreLoadException extends KmsException {

    public KeyStoreLoadException(String message) {
        super(message);
    }

    public KeyStoreLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
