/*
 * Copyright CybKMS Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.cybkms.kms.config;

/**
 * Signals that the configuration is syntactically correct but has values that
 * cannot be used, for example a KDF iteration count below the permitted floor.
 */
public class IllegalConfigurationException extends RuntimeException {
    public IllegalConfigurationException(String message) {
        super(message);
    }
}
