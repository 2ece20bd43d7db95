/*
 * Copyright CybKMS Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.cybkms.envelope;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

import javax.annotation.concurrent.ThreadSafe;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.cybkms.envelope.mnemonic.Mnemonic;
import io.cybkms.envelope.mnemonic.MnemonicCodec;
import io.cybkms.kms.service.DestroyableRawSecretKey;
import io.cybkms.kms.service.KmsException;
import io.cybkms.kms.service.NotFoundException;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Moves the stored data key from one mnemonic to another. The data key itself is unchanged,
 * so everything it protects stays readable; only its wrapping changes.
 * <p>
 * A rotation either replaces the stored record completely or leaves it untouched.
 * Rotations through the same manager run one at a time.
 * </p>
 */
@ThreadSafe
public class RotationManager {

    private static final Logger LOGGER = LoggerFactory.getLogger(RotationManager.class);

    private final KeyWrapper keyWrapper;
    private final WrappedKeyStore store;
    private final @Nullable MnemonicCodec mnemonicCodec;
    private final List<RotationListener> listeners = new CopyOnWriteArrayList<>();

    /**
     * @param keyWrapper wraps and unwraps the data key
     * @param store holds the wrapped data key
     * @param mnemonicCodec generates and validates new mnemonics; null to accept any well-formed mnemonic
     *                      and disable {@link #rotate(Mnemonic)}
     */
    public RotationManager(@NonNull KeyWrapper keyWrapper, @NonNull WrappedKeyStore store, @Nullable MnemonicCodec mnemonicCodec) {
        this.keyWrapper = Objects.requireNonNull(keyWrapper);
        this.store = Objects.requireNonNull(store);
        this.mnemonicCodec = mnemonicCodec;
    }

    public void addListener(@NonNull RotationListener listener) {
        listeners.add(Objects.requireNonNull(listener));
    }

    public void removeListener(@NonNull RotationListener listener) {
        listeners.remove(listener);
    }

    /**
     * Re-wraps the stored data key under a new mnemonic.
     *
     * @param oldMnemonic the mnemonic currently protecting the data key
     * @param newMnemonic the mnemonic to protect it from now on
     * @return the new stored record
     * @throws NotFoundException if no data key has been provisioned
     * @throws io.cybkms.kms.service.InvalidCiphertextException if the old mnemonic does not unwrap the data key
     * @throws io.cybkms.envelope.mnemonic.InvalidMnemonicException if the new mnemonic fails validation
     * @throws KmsException if the new record cannot be stored
     */
    @NonNull
    public synchronized WrappedDataKey rotate(@NonNull Mnemonic oldMnemonic, @NonNull Mnemonic newMnemonic) {
        Objects.requireNonNull(oldMnemonic);
        Objects.requireNonNull(newMnemonic);
        notify(RotationState.STARTED);
        DestroyableRawSecretKey dataKey = null;
        try {
            if (mnemonicCodec != null) {
                mnemonicCodec.validate(newMnemonic);
            }
            var current = store.load()
                    .orElseThrow(() -> new NotFoundException("No wrapped data key at " + store.path()));
            dataKey = keyWrapper.unwrap(current, oldMnemonic);
            notify(RotationState.UNWRAPPED);

            var rewrapped = keyWrapper.wrap(dataKey, newMnemonic);
            notify(RotationState.REWRAPPED);

            store.save(rewrapped);
            LOGGER.info("Rotated data key at {} to a new mnemonic", store.path());
            notify(RotationState.COMPLETED);
            return rewrapped;
        }
        catch (IOException e) {
            notify(RotationState.FAILED);
            throw new KmsException("Failed to store rotated data key", e);
        }
        catch (RuntimeException e) {
            LOGGER.warn("Rotation of data key at {} failed: {}", store.path(), e.getMessage());
            notify(RotationState.FAILED);
            throw e;
        }
        finally {
            if (dataKey != null) {
                dataKey.destroy();
            }
        }
    }

    /**
     * Re-wraps the stored data key under a newly generated mnemonic.
     *
     * @param oldMnemonic the mnemonic currently protecting the data key
     * @return the generated mnemonic and the new stored record
     * @throws IllegalStateException if this manager has no mnemonic codec
     */
    @NonNull
    public RotationResult rotate(@NonNull Mnemonic oldMnemonic) {
        if (mnemonicCodec == null) {
            throw new IllegalStateException("A word list is required to generate mnemonics");
        }
        var newMnemonic = mnemonicCodec.generate();
        return new RotationResult(newMnemonic, rotate(oldMnemonic, newMnemonic));
    }

    private void notify(RotationState state) {
        for (RotationListener listener : listeners) {
            try {
                listener.onProgress(state);
            }
            catch (RuntimeException e) {
                LOGGER.warn("Rotation listener {} failed on {}", listener, state, e);
            }
        }
    }
}
