/*
 * Copyright CybKMS Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.cybkms.envelope.chunk;

import java.nio.ByteBuffer;
import java.security.SecureRandom;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicLong;

import javax.annotation.concurrent.ThreadSafe;

import io.cybkms.kms.crypto.AesGcm;

/**
 * Issues the nonces for one encryption operation: a random 8-byte prefix followed by a
 * 4-byte big-endian counter. Nonces never repeat within a sequence, whichever threads draw them.
 * Once the counter is used up every further call fails.
 */
@ThreadSafe
public final class NonceSequence {

    public static final int PREFIX_LENGTH = 8;
    static final long MAX_COUNTER = 0xFFFF_FFFFL;

    private final byte[] prefix;
    private final AtomicLong counter;

    public NonceSequence(SecureRandom random) {
        this(randomPrefix(random), 0);
    }

    NonceSequence(byte[] prefix, long start) {
        if (prefix.length != PREFIX_LENGTH) {
            throw new IllegalArgumentException("prefix must be " + PREFIX_LENGTH + " bytes");
        }
        this.prefix = prefix.clone();
        this.counter = new AtomicLong(start);
    }

    /**
     * @return the next nonce
     * @throws IllegalStateException if 2<sup>32</sup> nonces have been issued
     */
    public byte[] next() {
        long value = counter.getAndIncrement();
        if (value > MAX_COUNTER || value < 0) {
            counter.set(MAX_COUNTER + 1);
            throw new IllegalStateException("Nonce sequence exhausted");
        }
        return ByteBuffer.allocate(AesGcm.NONCE_LENGTH)
                .put(prefix)
                .putInt((int) value)
                .array();
    }

    private static byte[] randomPrefix(SecureRandom random) {
        byte[] prefix = new byte[PREFIX_LENGTH];
        Objects.requireNonNull(random).nextBytes(prefix);
        return prefix;
    }
}
