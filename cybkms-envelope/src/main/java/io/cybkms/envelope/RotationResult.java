/*
 * Copyright CybKMS Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.cybkms.envelope;

import java.util.Objects;

import io.cybkms.envelope.mnemonic.Mnemonic;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * The outcome of rotating to a generated mnemonic.
 *
 * @param newMnemonic the mnemonic now protecting the data key; the only copy, to be shown to its owner
 * @param wrapped the stored record
 */
public record RotationResult(@NonNull Mnemonic newMnemonic, @NonNull WrappedDataKey wrapped) {
    public RotationResult {
        Objects.requireNonNull(newMnemonic);
        Objects.requireNonNull(wrapped);
    }
}
