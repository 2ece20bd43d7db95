/*
 * Copyright CybKMS Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.cybkms.envelope.mnemonic;

/**
 * Thrown when a phrase is not a usable mnemonic: wrong word count, a word outside the
 * word list, or a bad checksum. The message never contains the words themselves.
 */
public class InvalidMnemonicException extends IllegalArgumentException {
    public InvalidMnemonicException(String message) {
        super(message);
    }
}
