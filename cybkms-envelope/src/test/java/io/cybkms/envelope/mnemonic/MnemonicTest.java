/*
 * Copyright CybKMS Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.cybkms.envelope.mnemonic;

import java.nio.charset.StandardCharsets;
import java.util.Collections;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MnemonicTest {

    private static final String PHRASE = "abandon ability able about above absent absorb abstract absurd abuse access accident";

    @Test
    void parseNormalizesCaseAndSpacing() {
        var mnemonic = Mnemonic.parse("  Abandon   ABILITY able\tabout above absent absorb abstract absurd abuse access accident\n");

        assertThat(mnemonic).isEqualTo(Mnemonic.parse(PHRASE));
        assertThat(mnemonic.words()).hasSize(12).startsWith("abandon", "ability");
        assertThat(mnemonic.phrase()).isEqualTo(PHRASE);
    }

    @Test
    void canonicalBytesAreSpaceJoinedUtf8() {
        assertThat(Mnemonic.parse(PHRASE).canonicalBytes()).isEqualTo(PHRASE.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void canonicalBytesAreNfkdNormalized() {
        var composed = Mnemonic.of(Collections.nCopies(12, "caf\u00e9"));
        var decomposed = Mnemonic.of(Collections.nCopies(12, "cafe\u0301"));

        assertThat(composed.canonicalBytes()).isEqualTo(decomposed.canonicalBytes());
    }

    @ParameterizedTest
    @ValueSource(ints = { 12, 15, 18, 21, 24 })
    void validLengths(int length) {
        assertThat(Mnemonic.of(Collections.nCopies(length, "word")).size()).isEqualTo(length);
    }

    @ParameterizedTest
    @ValueSource(ints = { 0, 1, 11, 13, 25 })
    void invalidLengths(int length) {
        var words = Collections.nCopies(length, "word");
        assertThatThrownBy(() -> Mnemonic.of(words))
                .isInstanceOf(InvalidMnemonicException.class);
    }

    @Test
    void emptyPhrase() {
        assertThatThrownBy(() -> Mnemonic.parse("   "))
                .isInstanceOf(InvalidMnemonicException.class);
    }

    @Test
    void toStringHidesWords() {
        assertThat(Mnemonic.parse(PHRASE).toString())
                .isEqualTo("Mnemonic{12 words}")
                .doesNotContain("abandon");
    }
}
