/*
 * Copyright CybKMS Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.cybkms.envelope.mnemonic;

import java.util.ArrayList;
import java.util.List;

/**
 * A synthetic word list: the three-letter strings "aaa", "aab", ... in order, so word {@code i}
 * spells {@code i} in base 26.
 */
public final class TestWordlists {

    private TestWordlists() {
    }

    public static List<String> syntheticWords() {
        List<String> words = new ArrayList<>(Wordlist.SIZE);
        for (int i = 0; i < Wordlist.SIZE; i++) {
            words.add(word(i));
        }
        return words;
    }

    public static Wordlist synthetic() {
        return Wordlist.of(syntheticWords());
    }

    public static String word(int index) {
        return new String(new char[]{
                (char) ('a' + (index / 676) % 26),
                (char) ('a' + (index / 26) % 26),
                (char) ('a' + index % 26) });
    }
}
