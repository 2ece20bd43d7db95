/*
 * Copyright CybKMS Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.cybkms.kms.crypto;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Arrays;

import javax.crypto.spec.SecretKeySpec;

import org.junit.jupiter.api.Test;

import io.cybkms.kms.service.DestroyableRawSecretKey;
import io.cybkms.kms.service.InvalidCiphertextException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AesGcmTest {

    private static final byte[] PLAINTEXT = "attack at dawn".getBytes(StandardCharsets.UTF_8);

    private final AesGcm aesGcm = new AesGcm();
    private final DestroyableRawSecretKey key = DestroyableRawSecretKey.generateAes256(new SecureRandom());

    @Test
    void sealThenOpen() {
        byte[] combined = aesGcm.seal(key, PLAINTEXT);

        assertThat(combined).hasSize(PLAINTEXT.length + AesGcm.OVERHEAD);
        assertThat(aesGcm.open(key, combined)).isEqualTo(PLAINTEXT);
    }

    @Test
    void emptyPlaintext() {
        byte[] combined = aesGcm.seal(key, new byte[0]);

        assertThat(combined).hasSize(AesGcm.OVERHEAD);
        assertThat(aesGcm.open(key, combined)).isEmpty();
    }

    @Test
    void explicitNonceIsCarried() {
        byte[] nonce = aesGcm.randomNonce();

        var box = aesGcm.seal(key, nonce, PLAINTEXT);

        assertThat(box.nonce()).isEqualTo(nonce);
        assertThat(box.combined()).startsWith(nonce);
        assertThat(SealedBox.fromCombined(box.combined())).isEqualTo(box);
        assertThat(aesGcm.open(key, box)).isEqualTo(PLAINTEXT);
    }

    @Test
    void sealedBoxCopiesItsArrays() {
        byte[] nonce = aesGcm.randomNonce();
        var box = aesGcm.seal(key, nonce, PLAINTEXT);
        byte[] expectedNonce = nonce.clone();

        Arrays.fill(nonce, (byte) 0);
        box.nonce()[0] ^= 1;
        box.ciphertextAndTag()[0] ^= 1;

        assertThat(box.nonce()).isEqualTo(expectedNonce);
        assertThat(aesGcm.open(key, box)).isEqualTo(PLAINTEXT);
    }

    @Test
    void wrongKeyFailsAuthentication() {
        byte[] combined = aesGcm.seal(key, PLAINTEXT);
        var other = DestroyableRawSecretKey.generateAes256(new SecureRandom());

        assertThatThrownBy(() -> aesGcm.open(other, combined))
                .isInstanceOf(InvalidCiphertextException.class);
    }

    @Test
    void tamperedTagFailsAuthentication() {
        byte[] combined = aesGcm.seal(key, PLAINTEXT);
        combined[combined.length - 1] ^= 0x01;

        assertThatThrownBy(() -> aesGcm.open(key, combined))
                .isInstanceOf(InvalidCiphertextException.class);
    }

    @Test
    void tooShortIsInvalidCiphertext() {
        assertThatThrownBy(() -> aesGcm.open(key, new byte[AesGcm.OVERHEAD - 1]))
                .isInstanceOf(InvalidCiphertextException.class)
                .hasMessageContaining("too short");
    }

    @Test
    void onlyAes256KeysAccepted() {
        var aes128 = new SecretKeySpec(new byte[16], "AES");

        assertThatThrownBy(() -> aesGcm.seal(aes128, PLAINTEXT))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void destroyedKeyIsRejected() {
        var destroyed = DestroyableRawSecretKey.generateAes256(new SecureRandom());
        destroyed.destroy();

        assertThatThrownBy(() -> aesGcm.seal(destroyed, PLAINTEXT))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void serdeSizesAndPosition() {
        var box = aesGcm.seal(key, aesGcm.randomNonce(), PLAINTEXT);
        var buffer = ByteBuffer.allocate(SealedBox.COMBINED.sizeOf(box) + 3);
        buffer.put(new byte[]{ 1, 2, 3 });

        SealedBox.COMBINED.serialize(box, buffer);
        buffer.flip().position(3);

        assertThat(SealedBox.COMBINED.deserialize(buffer)).isEqualTo(box);
        assertThat(buffer.hasRemaining()).isFalse();
    }
}
