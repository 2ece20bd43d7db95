/*
 * Copyright CybKMS Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.cybkms.kms.service;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle state of a KMS key. Only {@link #ENABLED} keys may be used for cryptographic operations.
 * {@link #PENDING_IMPORT} and {@link #UNAVAILABLE} are reserved: no operation moves a key into them.
 */
public enum KeyState {
    ENABLED("Enabled"),
    DISABLED("Disabled"),
    PENDING_DELETION("PendingDeletion"),
    PENDING_IMPORT("PendingImport"),
    UNAVAILABLE("Unavailable");

    private final String value;

    KeyState(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * @return true if keys in this state can encrypt and decrypt.
     */
    public boolean isUsable() {
        return this == ENABLED;
    }
}
