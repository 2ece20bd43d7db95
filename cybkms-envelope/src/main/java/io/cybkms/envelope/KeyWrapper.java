/*
 * Copyright CybKMS Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.cybkms.envelope;

import java.security.SecureRandom;
import java.util.Arrays;
import java.util.Objects;

import javax.annotation.concurrent.ThreadSafe;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.cybkms.envelope.kdf.MasterKeyDerivation;
import io.cybkms.envelope.mnemonic.Mnemonic;
import io.cybkms.kms.crypto.AesGcm;
import io.cybkms.kms.service.DestroyableRawSecretKey;
import io.cybkms.kms.service.InvalidCiphertextException;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Seals data keys under master keys derived from mnemonics.
 * Each wrap uses a fresh random salt, so wrapping the same data key twice gives different records.
 */
@ThreadSafe
public class KeyWrapper {

    private static final Logger LOGGER = LoggerFactory.getLogger(KeyWrapper.class);

    public static final int SALT_LENGTH = 16;

    private final AesGcm aesGcm;
    private final SecureRandom random;
    private final int kdfIterations;

    public KeyWrapper(@NonNull AesGcm aesGcm, @NonNull SecureRandom random, int kdfIterations) {
        if (kdfIterations < MasterKeyDerivation.MIN_ITERATIONS) {
            throw new IllegalArgumentException("At least " + MasterKeyDerivation.MIN_ITERATIONS + " iterations are required");
        }
        this.aesGcm = Objects.requireNonNull(aesGcm);
        this.random = Objects.requireNonNull(random);
        this.kdfIterations = kdfIterations;
    }

    public KeyWrapper() {
        this(new AesGcm(), new SecureRandom(), MasterKeyDerivation.MIN_ITERATIONS);
    }

    /**
     * Generates a random 256-bit data key and wraps it.
     *
     * @param mnemonic the mnemonic protecting the data key
     * @return the data key and its wrapped form
     */
    @NonNull
    public ProvisionedDataKey provision(@NonNull Mnemonic mnemonic) {
        var dataKey = DestroyableRawSecretKey.generateAes256(random);
        return new ProvisionedDataKey(dataKey, wrap(dataKey, mnemonic));
    }

    /**
     * @param dataKey the data key, which is not destroyed
     * @param mnemonic the mnemonic to wrap under
     * @return the wrapped data key
     */
    @NonNull
    public WrappedDataKey wrap(@NonNull DestroyableRawSecretKey dataKey, @NonNull Mnemonic mnemonic) {
        byte[] salt = new byte[SALT_LENGTH];
        random.nextBytes(salt);
        var masterKey = MasterKeyDerivation.deriveMasterKey(mnemonic, salt, kdfIterations);
        byte[] plaintext = dataKey.getEncoded();
        try {
            return new WrappedDataKey(aesGcm.seal(masterKey, plaintext), salt, kdfIterations);
        }
        finally {
            Arrays.fill(plaintext, (byte) 0);
            masterKey.destroy();
        }
    }

    /**
     * @param wrapped the wrapped data key
     * @param mnemonic the mnemonic it was wrapped under
     * @return the data key, which the caller must destroy
     * @throws InvalidCiphertextException if the mnemonic is wrong or the record has been altered
     */
    @NonNull
    public DestroyableRawSecretKey unwrap(@NonNull WrappedDataKey wrapped, @NonNull Mnemonic mnemonic) {
        var masterKey = MasterKeyDerivation.deriveMasterKey(mnemonic, wrapped.kdfSalt(), wrapped.kdfIterations());
        byte[] plaintext;
        try {
            plaintext = aesGcm.open(masterKey, wrapped.wrappedDataKey());
        }
        catch (InvalidCiphertextException e) {
            LOGGER.debug("Data key failed to unwrap");
            throw new InvalidCiphertextException("Unable to unwrap data key: wrong mnemonic or corrupted record", e);
        }
        finally {
            masterKey.destroy();
        }
        return DestroyableRawSecretKey.takeOwnershipOf(plaintext, DestroyableRawSecretKey.AES);
    }
}
