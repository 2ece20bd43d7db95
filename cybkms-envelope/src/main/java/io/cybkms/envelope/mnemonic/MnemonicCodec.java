/*
 * Copyright CybKMS Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.cybkms.envelope.mnemonic;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import javax.annotation.concurrent.ThreadSafe;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Converts between entropy and mnemonics using the BIP-39 scheme: the entropy is followed by
 * the first {@code ENT / 32} bits of its SHA-256 digest, and the result is cut into 11-bit word indices.
 */
@ThreadSafe
public class MnemonicCodec {

    public static final int DEFAULT_WORD_COUNT = 12;

    private static final int BITS_PER_WORD = 11;

    private final Wordlist wordlist;
    private final SecureRandom random;

    public MnemonicCodec(@NonNull Wordlist wordlist) {
        this(wordlist, new SecureRandom());
    }

    public MnemonicCodec(@NonNull Wordlist wordlist, @NonNull SecureRandom random) {
        this.wordlist = Objects.requireNonNull(wordlist);
        this.random = Objects.requireNonNull(random);
    }

    /**
     * @return a new random 12-word mnemonic
     */
    @NonNull
    public Mnemonic generate() {
        return generate(DEFAULT_WORD_COUNT);
    }

    /**
     * @param wordCount 12, 15, 18, 21 or 24
     * @return a new random mnemonic of that length
     */
    @NonNull
    public Mnemonic generate(int wordCount) {
        if (!Mnemonic.VALID_LENGTHS.contains(wordCount)) {
            throw new IllegalArgumentException("Word count must be one of " + Mnemonic.VALID_LENGTHS + ", not " + wordCount);
        }
        byte[] entropy = new byte[wordCount * BITS_PER_WORD * 32 / 33 / Byte.SIZE];
        random.nextBytes(entropy);
        try {
            return toMnemonic(entropy);
        }
        finally {
            Arrays.fill(entropy, (byte) 0);
        }
    }

    /**
     * @param entropy 16, 20, 24, 28 or 32 bytes
     * @return the mnemonic encoding the entropy
     */
    @NonNull
    public Mnemonic toMnemonic(@NonNull byte[] entropy) {
        int entropyBits = entropy.length * Byte.SIZE;
        if (entropyBits < 128 || entropyBits > 256 || entropyBits % 32 != 0) {
            throw new IllegalArgumentException("Entropy must be 128 to 256 bits in multiples of 32, not " + entropyBits);
        }
        byte[] digest = sha256(entropy);
        byte[] bits = Arrays.copyOf(entropy, entropy.length + 1);
        bits[entropy.length] = digest[0];
        int wordCount = (entropyBits + entropyBits / 32) / BITS_PER_WORD;
        List<String> words = new ArrayList<>(wordCount);
        for (int i = 0; i < wordCount; i++) {
            int index = 0;
            for (int j = 0; j < BITS_PER_WORD; j++) {
                index = (index << 1) | bit(bits, i * BITS_PER_WORD + j);
            }
            words.add(wordlist.word(index));
        }
        Arrays.fill(bits, (byte) 0);
        return Mnemonic.of(words);
    }

    /**
     * Recovers the entropy, checking that every word is in the word list and the checksum matches.
     *
     * @param mnemonic the mnemonic
     * @return the entropy
     * @throws InvalidMnemonicException if the mnemonic is not valid
     */
    @NonNull
    public byte[] toEntropy(@NonNull Mnemonic mnemonic) {
        int totalBits = mnemonic.size() * BITS_PER_WORD;
        int checksumBits = totalBits / 33;
        int entropyBits = totalBits - checksumBits;
        byte[] bits = new byte[(totalBits + Byte.SIZE - 1) / Byte.SIZE];
        var words = mnemonic.words();
        for (int i = 0; i < words.size(); i++) {
            int position = i + 1;
            int index = wordlist.indexOf(words.get(i))
                    .orElseThrow(() -> new InvalidMnemonicException("Word " + position + " is not in the word list"));
            for (int j = 0; j < BITS_PER_WORD; j++) {
                if (((index >> (BITS_PER_WORD - 1 - j)) & 1) == 1) {
                    int n = i * BITS_PER_WORD + j;
                    bits[n / Byte.SIZE] |= (byte) (0x80 >>> (n % Byte.SIZE));
                }
            }
        }
        byte[] entropy = Arrays.copyOf(bits, entropyBits / Byte.SIZE);
        byte[] digest = sha256(entropy);
        for (int k = 0; k < checksumBits; k++) {
            if (bit(bits, entropyBits + k) != bit(digest, k)) {
                Arrays.fill(bits, (byte) 0);
                Arrays.fill(entropy, (byte) 0);
                throw new InvalidMnemonicException("Mnemonic checksum does not match");
            }
        }
        Arrays.fill(bits, (byte) 0);
        return entropy;
    }

    /**
     * @param mnemonic the mnemonic
     * @throws InvalidMnemonicException if a word is not in the word list or the checksum does not match
     */
    public void validate(@NonNull Mnemonic mnemonic) {
        Arrays.fill(toEntropy(mnemonic), (byte) 0);
    }

    public boolean isValid(@NonNull Mnemonic mnemonic) {
        try {
            validate(mnemonic);
            return true;
        }
        catch (InvalidMnemonicException e) {
            return false;
        }
    }

    private static int bit(byte[] bytes, int n) {
        return (bytes[n / Byte.SIZE] >> (Byte.SIZE - 1 - n % Byte.SIZE)) & 1;
    }

    private static byte[] sha256(byte[] input) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(input);
        }
        catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
