/*
 * Copyright CybKMS Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.cybkms.kms.service;

/**
 * What a key may be used for.
 */
public enum KeyUsage {
    ENCRYPT_DECRYPT
}
