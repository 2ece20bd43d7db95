/*
 * Copyright CybKMS Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.cybkms.envelope.mnemonic;

import java.nio.charset.StandardCharsets;
import java.text.Normalizer;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * A sequence of 12, 15, 18, 21 or 24 lower-case words from which a master key is derived.
 * Whether the words belong to a word list and carry a valid checksum is checked by {@link MnemonicCodec}.
 */
public final class Mnemonic {

    public static final Set<Integer> VALID_LENGTHS = Set.of(12, 15, 18, 21, 24);

    private final List<String> words;

    private Mnemonic(List<String> words) {
        this.words = words;
    }

    /**
     * @param words the words, in order
     * @return the mnemonic
     * @throws InvalidMnemonicException if the word count is not a valid length or a word is blank
     */
    @NonNull
    public static Mnemonic of(@NonNull List<String> words) {
        Objects.requireNonNull(words);
        if (!VALID_LENGTHS.contains(words.size())) {
            throw new InvalidMnemonicException("A mnemonic has 12, 15, 18, 21 or 24 words, not " + words.size());
        }
        var normalized = words.stream()
                .map(word -> Objects.requireNonNull(word, "word").trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableList());
        if (normalized.stream().anyMatch(String::isEmpty)) {
            throw new InvalidMnemonicException("A mnemonic cannot contain empty words");
        }
        return new Mnemonic(normalized);
    }

    /**
     * @param phrase words separated by white space
     * @return the mnemonic
     * @throws InvalidMnemonicException if the phrase does not have a valid number of words
     */
    @NonNull
    public static Mnemonic parse(@NonNull String phrase) {
        var trimmed = Objects.requireNonNull(phrase).trim();
        return of(trimmed.isEmpty() ? List.of() : Arrays.asList(trimmed.split("\\s+")));
    }

    @NonNull
    public List<String> words() {
        return words;
    }

    public int size() {
        return words.size();
    }

    /**
     * @return the NFKD-normalized words joined by single spaces, UTF-8 encoded. Callers should zero the array after use.
     */
    @NonNull
    public byte[] canonicalBytes() {
        return Normalizer.normalize(String.join(" ", words), Normalizer.Form.NFKD).getBytes(StandardCharsets.UTF_8);
    }

    /**
     * @return the words joined by single spaces, for display to the owner of the mnemonic only
     */
    @NonNull
    public String phrase() {
        return String.join(" ", words);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        return words.equals(((Mnemonic) o).words);
    }

    @Override
    public int hashCode() {
        return words.hashCode();
    }

    @Override
    public String toString() {
        return "Mnemonic{" + words.size() + " words}";
    }
}
