/*
 * Copyright CybKMS Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.cybkms.envelope;

import java.io.IOException;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.cybkms.envelope.mnemonic.Mnemonic;
import io.cybkms.kms.service.DestroyableRawSecretKey;
import io.cybkms.kms.service.KmsException;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Gives access to the data key protected by a mnemonic, provisioning it on first use.
 */
public class DataKeyVault {

    private static final Logger LOGGER = LoggerFactory.getLogger(DataKeyVault.class);

    private final KeyWrapper keyWrapper;
    private final WrappedKeyStore store;

    public DataKeyVault(@NonNull KeyWrapper keyWrapper, @NonNull WrappedKeyStore store) {
        this.keyWrapper = Objects.requireNonNull(keyWrapper);
        this.store = Objects.requireNonNull(store);
    }

    /**
     * Unwraps the stored data key, or when nothing is stored yet, generates one, wraps it under
     * the mnemonic and stores it.
     *
     * @param mnemonic the mnemonic
     * @return the data key, which the caller must destroy
     * @throws io.cybkms.kms.service.InvalidCiphertextException if the mnemonic does not unwrap the stored key
     * @throws io.cybkms.kms.service.KeyStoreLoadException if the stored record is malformed
     * @throws KmsException if a new record cannot be stored
     */
    @NonNull
    public synchronized DestroyableRawSecretKey open(@NonNull Mnemonic mnemonic) {
        var stored = store.load();
        if (stored.isPresent()) {
            return keyWrapper.unwrap(stored.get(), mnemonic);
        }
        var provisioned = keyWrapper.provision(mnemonic);
        try {
            store.save(provisioned.wrapped());
        }
        catch (IOException e) {
            provisioned.dataKey().destroy();
            throw new KmsException("Failed to store wrapped data key", e);
        }
        LOGGER.info("Provisioned a new data key at {}", store.path());
        return provisioned.dataKey();
    }

    public boolean isProvisioned() {
        return store.load().isPresent();
    }
}
