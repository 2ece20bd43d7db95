/*
 * Copyright CybKMS Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.cybkms.kms.service;

/**
 * The type of key material. {@code SYMMETRIC_DEFAULT} is a 256-bit AES key.
 */
public enum KeySpec {
    SYMMETRIC_DEFAULT
}
