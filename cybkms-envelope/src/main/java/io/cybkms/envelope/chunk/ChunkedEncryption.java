/*
 * Copyright CybKMS Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.cybkms.envelope.chunk;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;

import javax.annotation.concurrent.ThreadSafe;
import javax.crypto.SecretKey;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.cybkms.kms.crypto.AesGcm;
import io.cybkms.kms.crypto.SealedBox;
import io.cybkms.kms.service.InvalidCiphertextException;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Encrypts payloads as a sequence of independently sealed chunks:
 * <pre>
 * | nonce (12) | ciphertext (up to chunkSize) | tag (16) | nonce (12) | ...
 * </pre>
 * Every chunk but the last holds exactly {@code chunkSize} plaintext bytes, so a reader with the same
 * chunk size can find chunk boundaries without any framing. An empty payload encrypts to nothing.
 */
@ThreadSafe
public class ChunkedEncryption {

    private static final Logger LOGGER = LoggerFactory.getLogger(ChunkedEncryption.class);

    public static final int DEFAULT_CHUNK_SIZE = 1024 * 1024;
    public static final int MIN_CHUNK_SIZE = 256 * 1024;
    public static final int MAX_CHUNK_SIZE = 16 * 1024 * 1024;
    public static final int OVERHEAD = AesGcm.OVERHEAD;

    private static final long MIB = 1024L * 1024L;

    private final AesGcm aesGcm;
    private final SecureRandom random;
    private final int chunkSize;

    public ChunkedEncryption(@NonNull AesGcm aesGcm, @NonNull SecureRandom random, int chunkSize) {
        checkChunkSize(chunkSize);
        this.aesGcm = Objects.requireNonNull(aesGcm);
        this.random = Objects.requireNonNull(random);
        this.chunkSize = chunkSize;
    }

    public ChunkedEncryption(int chunkSize) {
        this(new AesGcm(), new SecureRandom(), chunkSize);
    }

    public ChunkedEncryption() {
        this(DEFAULT_CHUNK_SIZE);
    }

    public int chunkSize() {
        return chunkSize;
    }

    public static void checkChunkSize(int chunkSize) {
        if (chunkSize < MIN_CHUNK_SIZE || chunkSize > MAX_CHUNK_SIZE) {
            throw new IllegalArgumentException("Chunk size must be between " + MIN_CHUNK_SIZE + " and " + MAX_CHUNK_SIZE
                    + " bytes, but was " + chunkSize);
        }
    }

    /**
     * Picks a chunk size for a payload: 256 KiB below 10 MiB, 1 MiB below 100 MiB,
     * 5 MiB below 1 GiB and 16 MiB beyond.
     *
     * @param payloadSize payload size in bytes
     * @return the chunk size
     */
    public static int optimalChunkSize(long payloadSize) {
        if (payloadSize < 10 * MIB) {
            return MIN_CHUNK_SIZE;
        }
        else if (payloadSize < 100 * MIB) {
            return DEFAULT_CHUNK_SIZE;
        }
        else if (payloadSize < 1024 * MIB) {
            return 5 * 1024 * 1024;
        }
        return MAX_CHUNK_SIZE;
    }

    /**
     * @param plaintextSize payload size in bytes
     * @param chunkSize chunk size in bytes
     * @return the size of the encrypted payload
     */
    public static long encryptedSize(long plaintextSize, int chunkSize) {
        if (plaintextSize < 0 || chunkSize <= 0) {
            throw new IllegalArgumentException("sizes must be positive");
        }
        long fullChunks = plaintextSize / chunkSize;
        long remainder = plaintextSize % chunkSize;
        long total = fullChunks * (chunkSize + OVERHEAD);
        if (remainder > 0) {
            total += remainder + OVERHEAD;
        }
        return total;
    }

    /**
     * Encrypts the input until end of stream. Neither stream is closed.
     *
     * @return the number of bytes written
     * @throws IOException if a stream fails
     */
    public long encrypt(@NonNull SecretKey key, @NonNull InputStream in, @NonNull OutputStream out) throws IOException {
        var nonces = new NonceSequence(random);
        byte[] buffer = new byte[chunkSize];
        long written = 0;
        try {
            int read;
            while ((read = in.readNBytes(buffer, 0, chunkSize)) > 0) {
                byte[] chunk = read == chunkSize ? buffer : Arrays.copyOf(buffer, read);
                byte[] sealed = aesGcm.seal(key, nonces.next(), chunk).combined();
                out.write(sealed);
                written += sealed.length;
                if (chunk != buffer) {
                    Arrays.fill(chunk, (byte) 0);
                }
            }
        }
        finally {
            Arrays.fill(buffer, (byte) 0);
        }
        return written;
    }

    /**
     * Decrypts input produced by {@link #encrypt(SecretKey, InputStream, OutputStream)} with the same chunk size.
     * Neither stream is closed. Plaintext of chunks that authenticated is written before a later chunk fails.
     *
     * @return the number of bytes written
     * @throws InvalidCiphertextException if a chunk fails authentication or the input ends with a fragment too short to be a chunk
     * @throws IOException if a stream fails
     */
    public long decrypt(@NonNull SecretKey key, @NonNull InputStream in, @NonNull OutputStream out) throws IOException {
        int blockSize = chunkSize + OVERHEAD;
        byte[] block = new byte[blockSize];
        long written = 0;
        long index = 0;
        int read;
        while ((read = in.readNBytes(block, 0, blockSize)) > 0) {
            if (read < OVERHEAD) {
                throw new InvalidCiphertextException("Trailing fragment of " + read + " bytes is too short to be a chunk");
            }
            byte[] plaintext;
            try {
                plaintext = aesGcm.open(key, SealedBox.fromCombined(Arrays.copyOf(block, read)));
            }
            catch (InvalidCiphertextException e) {
                throw new InvalidCiphertextException("Chunk " + index + " failed authentication", e);
            }
            out.write(plaintext);
            written += plaintext.length;
            Arrays.fill(plaintext, (byte) 0);
            index++;
        }
        LOGGER.debug("Decrypted {} chunk(s)", index);
        return written;
    }

    @NonNull
    public byte[] encrypt(@NonNull SecretKey key, @NonNull byte[] plaintext) {
        var out = new ByteArrayOutputStream((int) Math.min(Integer.MAX_VALUE, encryptedSize(plaintext.length, chunkSize)));
        try {
            encrypt(key, new ByteArrayInputStream(plaintext), out);
        }
        catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toByteArray();
    }

    @NonNull
    public byte[] decrypt(@NonNull SecretKey key, @NonNull byte[] ciphertext) {
        var out = new ByteArrayOutputStream(ciphertext.length);
        try {
            decrypt(key, new ByteArrayInputStream(ciphertext), out);
        }
        catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        return out.toByteArray();
    }

    /**
     * Seals the chunks of the payload concurrently. All chunks draw nonces from one sequence.
     *
     * @param key the data key
     * @param plaintext the payload
     * @param executor runs the sealing of each chunk
     * @return the sealed chunks in payload order; concatenated they equal the output of
     *         {@link #encrypt(SecretKey, InputStream, OutputStream)} up to nonces
     */
    @NonNull
    public CompletionStage<List<byte[]>> encryptParallel(@NonNull SecretKey key, @NonNull byte[] plaintext, @NonNull Executor executor) {
        var nonces = new NonceSequence(random);
        List<CompletableFuture<byte[]>> chunks = new ArrayList<>();
        for (int offset = 0; offset < plaintext.length; offset += chunkSize) {
            int from = offset;
            int to = Math.min(plaintext.length, offset + chunkSize);
            chunks.add(CompletableFuture.supplyAsync(() -> {
                byte[] chunk = Arrays.copyOfRange(plaintext, from, to);
                try {
                    return aesGcm.seal(key, nonces.next(), chunk).combined();
                }
                finally {
                    Arrays.fill(chunk, (byte) 0);
                }
            }, executor));
        }
        return CompletableFuture.allOf(chunks.toArray(CompletableFuture[]::new))
                .thenApply(ignored -> chunks.stream()
                        .map(CompletableFuture::join)
                        .collect(Collectors.toList()));
    }
}
