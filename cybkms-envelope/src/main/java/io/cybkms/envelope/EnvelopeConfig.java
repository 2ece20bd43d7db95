/*
 * Copyright CybKMS Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.cybkms.envelope;

import java.nio.file.Path;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.cybkms.envelope.chunk.ChunkedEncryption;
import io.cybkms.envelope.kdf.MasterKeyDerivation;
import io.cybkms.kms.config.IllegalConfigurationException;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Configuration for envelope encryption.
 *
 * @param wrappedKeyPath file holding the wrapped data key
 * @param kdfIterations PBKDF2 iterations used for new wraps
 * @param chunkSize plaintext bytes per chunk
 * @param wordlistPath word list for generating and validating mnemonics, or null to accept any well-formed mnemonic
 */
public record EnvelopeConfig(@JsonProperty(value = "wrappedKeyPath", required = true) @NonNull Path wrappedKeyPath,
                             @JsonProperty("kdfIterations") int kdfIterations,
                             @JsonProperty("chunkSize") int chunkSize,
                             @JsonProperty("wordlistPath") @Nullable Path wordlistPath) {

    public EnvelopeConfig {
        if (wrappedKeyPath == null) {
            throw new IllegalConfigurationException("wrappedKeyPath is required");
        }
        if (kdfIterations < MasterKeyDerivation.MIN_ITERATIONS) {
            throw new IllegalConfigurationException("kdfIterations must be at least " + MasterKeyDerivation.MIN_ITERATIONS
                    + ", but was " + kdfIterations);
        }
        if (chunkSize < ChunkedEncryption.MIN_CHUNK_SIZE || chunkSize > ChunkedEncryption.MAX_CHUNK_SIZE) {
            throw new IllegalConfigurationException("chunkSize must be between " + ChunkedEncryption.MIN_CHUNK_SIZE
                    + " and " + ChunkedEncryption.MAX_CHUNK_SIZE + ", but was " + chunkSize);
        }
    }

    @JsonCreator
    static EnvelopeConfig create(@JsonProperty(value = "wrappedKeyPath", required = true) Path wrappedKeyPath,
                                 @JsonProperty("kdfIterations") @Nullable Integer kdfIterations,
                                 @JsonProperty("chunkSize") @Nullable Integer chunkSize,
                                 @JsonProperty("wordlistPath") @Nullable Path wordlistPath) {
        return new EnvelopeConfig(wrappedKeyPath,
                kdfIterations == null ? MasterKeyDerivation.MIN_ITERATIONS : kdfIterations,
                chunkSize == null ? ChunkedEncryption.DEFAULT_CHUNK_SIZE : chunkSize,
                wordlistPath);
    }

    public static EnvelopeConfig forWrappedKeyAt(@NonNull Path wrappedKeyPath) {
        return create(wrappedKeyPath, null, null, null);
    }
}
