/*
 * Copyright CybKMS Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.cybkms.kms.service;

/**
 * Algorithm tag carried by encrypt and decrypt results. {@code SYMMETRIC_DEFAULT} is AES-256-GCM
 * with a 96-bit nonce and a 128-bit tag.
 */
public enum EncryptionAlgorithm {
    SYMMETRIC_DEFAULT
}
