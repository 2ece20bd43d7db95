/*
 * Copyright CybKMS Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.cybkms.envelope;

import java.util.Objects;

import io.cybkms.kms.service.DestroyableRawSecretKey;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * A freshly generated data key and its wrapped form.
 *
 * @param dataKey the plaintext data key, which the caller must destroy
 * @param wrapped the data key wrapped under the master key
 */
public record ProvisionedDataKey(@NonNull DestroyableRawSecretKey dataKey,
                                 @NonNull WrappedDataKey wrapped) {
    public ProvisionedDataKey {
        Objects.requireNonNull(dataKey);
        Objects.requireNonNull(wrapped);
    }
}
