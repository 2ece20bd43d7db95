/*
 * Copyright CybKMS Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.cybkms.kms.crypto;

import java.nio.ByteBuffer;
import java.util.Arrays;
import java.util.Objects;

import io.cybkms.kms.service.InvalidCiphertextException;
import io.cybkms.kms.service.Serde;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * An AES-GCM output split into its nonce and its ciphertext-with-tag.
 * The combined form is {@code nonce (12 bytes) || ciphertext || tag (16 bytes)}.
 *
 * @param nonce the 96-bit nonce
 * @param ciphertextAndTag the ciphertext followed by the 128-bit tag
 */
public record SealedBox(@NonNull byte[] nonce,
                        @NonNull byte[] ciphertextAndTag) {

    /**
     * Serde for the combined form. Deserialization consumes every remaining byte of the buffer.
     */
    public static final Serde<SealedBox> COMBINED = new Serde<>() {
        @Override
        public int sizeOf(SealedBox box) {
            return box.nonce.length + box.ciphertextAndTag.length;
        }

        @Override
        public void serialize(SealedBox box, @NonNull ByteBuffer buffer) {
            buffer.put(box.nonce).put(box.ciphertextAndTag);
        }

        @Override
        public SealedBox deserialize(@NonNull ByteBuffer buffer) {
            if (buffer.remaining() < AesGcm.OVERHEAD) {
                throw new InvalidCiphertextException("Ciphertext is too short: "
                        + buffer.remaining() + " bytes, at least " + AesGcm.OVERHEAD + " required");
            }
            byte[] nonce = new byte[AesGcm.NONCE_LENGTH];
            buffer.get(nonce);
            byte[] rest = new byte[buffer.remaining()];
            buffer.get(rest);
            return new SealedBox(nonce, rest);
        }
    };

    public SealedBox {
        Objects.requireNonNull(nonce);
        Objects.requireNonNull(ciphertextAndTag);
        if (nonce.length != AesGcm.NONCE_LENGTH) {
            throw new IllegalArgumentException("nonce must be " + AesGcm.NONCE_LENGTH + " bytes");
        }
        nonce = nonce.clone();
        ciphertextAndTag = ciphertextAndTag.clone();
    }

    @Override
    public byte[] nonce() {
        return nonce.clone();
    }

    @Override
    public byte[] ciphertextAndTag() {
        return ciphertextAndTag.clone();
    }

    /**
     * @param combined {@code nonce || ciphertext || tag}
     * @return the parsed box
     * @throws InvalidCiphertextException if the input cannot hold a nonce and a tag
     */
    public static SealedBox fromCombined(@NonNull byte[] combined) {
        return COMBINED.deserialize(ByteBuffer.wrap(combined));
    }

    /**
     * @return {@code nonce || ciphertext || tag}
     */
    public byte[] combined() {
        return COMBINED.toBytes(this);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        SealedBox that = (SealedBox) o;
        return Arrays.equals(nonce, that.nonce) && Arrays.equals(ciphertextAndTag, that.ciphertextAndTag);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(nonce) + Arrays.hashCode(ciphertextAndTag);
    }

    @Override
    public String toString() {
        return "SealedBox{" + ciphertextAndTag.length + " bytes}";
    }
}
