/*
 * Copyright CybKMS Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.cybkms.envelope.mnemonic;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.stream.Collectors;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * The 2048 words a mnemonic is drawn from. Each word encodes 11 bits: its index in the list.
 */
public final class Wordlist {

    public static final int SIZE = 2048;

    private final List<String> words;
    private final Map<String, Integer> indices;

    private Wordlist(List<String> words) {
        this.words = words;
        this.indices = new HashMap<>(SIZE * 2);
        for (int i = 0; i < words.size(); i++) {
            if (indices.putIfAbsent(words.get(i), i) != null) {
                throw new IllegalArgumentException("Word list contains '" + words.get(i) + "' more than once");
            }
        }
    }

    /**
     * @param words exactly 2048 distinct words
     * @return the word list
     */
    @NonNull
    public static Wordlist of(@NonNull List<String> words) {
        var normalized = Objects.requireNonNull(words).stream()
                .map(word -> word.trim().toLowerCase(Locale.ROOT))
                .filter(word -> !word.isEmpty())
                .collect(Collectors.toUnmodifiableList());
        if (normalized.size() != SIZE) {
            throw new IllegalArgumentException("Word list must have " + SIZE + " words, but has " + normalized.size());
        }
        return new Wordlist(normalized);
    }

    /**
     * Reads one word per line, UTF-8. Blank lines are ignored.
     * @param stream the source, which is not closed
     * @return the word list
     * @throws IOException if the stream cannot be read
     */
    @NonNull
    public static Wordlist load(@NonNull InputStream stream) throws IOException {
        var reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8));
        try {
            return of(reader.lines().collect(Collectors.toList()));
        }
        catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    @NonNull
    public static Wordlist load(@NonNull Path file) throws IOException {
        return of(Files.readAllLines(file, StandardCharsets.UTF_8));
    }

    @NonNull
    public String word(int index) {
        return words.get(index);
    }

    /**
     * @param word a word
     * @return the word's index, or empty if the word is not in the list
     */
    public OptionalInt indexOf(@NonNull String word) {
        Integer index = indices.get(word);
        return index == null ? OptionalInt.empty() : OptionalInt.of(index);
    }

    public boolean contains(@NonNull String word) {
        return indices.containsKey(word);
    }
}
