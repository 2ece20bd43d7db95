/*
 * Copyright CybKMS Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.cybkms.envelope;

import java.io.IOException;
import java.security.SecureRandom;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.cybkms.envelope.chunk.ChunkedEncryption;
import io.cybkms.envelope.mnemonic.MnemonicCodec;
import io.cybkms.envelope.mnemonic.Wordlist;
import io.cybkms.kms.config.IllegalConfigurationException;
import io.cybkms.kms.crypto.AesGcm;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * The envelope encryption components wired together from an {@link EnvelopeConfig}.
 */
public final class EnvelopeEncryption {

    private static final Logger LOGGER = LoggerFactory.getLogger(EnvelopeEncryption.class);

    private final @Nullable MnemonicCodec mnemonicCodec;
    private final DataKeyVault vault;
    private final RotationManager rotationManager;
    private final ChunkedEncryption chunkedEncryption;

    private EnvelopeEncryption(@Nullable MnemonicCodec mnemonicCodec, DataKeyVault vault, RotationManager rotationManager,
                               ChunkedEncryption chunkedEncryption) {
        this.mnemonicCodec = mnemonicCodec;
        this.vault = vault;
        this.rotationManager = rotationManager;
        this.chunkedEncryption = chunkedEncryption;
    }

    /**
     * @param config the configuration
     * @return the components
     * @throws IllegalConfigurationException if the configured word list cannot be loaded
     */
    @NonNull
    public static EnvelopeEncryption create(@NonNull EnvelopeConfig config) {
        Objects.requireNonNull(config);
        var random = new SecureRandom();
        var aesGcm = new AesGcm(random);
        MnemonicCodec codec = null;
        if (config.wordlistPath() != null) {
            try {
                codec = new MnemonicCodec(Wordlist.load(config.wordlistPath()), random);
            }
            catch (IOException | IllegalArgumentException e) {
                throw new IllegalConfigurationException("Unable to load word list " + config.wordlistPath() + ": " + e.getMessage());
            }
        }
        var keyWrapper = new KeyWrapper(aesGcm, random, config.kdfIterations());
        var store = new WrappedKeyStore(config.wrappedKeyPath());
        LOGGER.debug("Envelope encryption for {} with {} byte chunks", config.wrappedKeyPath(), config.chunkSize());
        return new EnvelopeEncryption(codec,
                new DataKeyVault(keyWrapper, store),
                new RotationManager(keyWrapper, store, codec),
                new ChunkedEncryption(aesGcm, random, config.chunkSize()));
    }

    public Optional<MnemonicCodec> mnemonicCodec() {
        return Optional.ofNullable(mnemonicCodec);
    }

    public DataKeyVault vault() {
        return vault;
    }

    public RotationManager rotationManager() {
        return rotationManager;
    }

    public ChunkedEncryption chunkedEncryption() {
        return chunkedEncryption;
    }
}
