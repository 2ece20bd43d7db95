/*
 * Copyright CybKMS Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.cybkms.envelope;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import io.cybkms.envelope.mnemonic.MnemonicCodec;
import io.cybkms.envelope.mnemonic.TestWordlists;
import io.cybkms.kms.service.InvalidCiphertextException;
import io.cybkms.kms.service.KmsException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DataKeyVaultTest {

    @TempDir
    Path dir;

    @Mock
    WrappedKeyStore failingStore;

    private final MnemonicCodec codec = new MnemonicCodec(TestWordlists.synthetic());
    private final KeyWrapper wrapper = new KeyWrapper();

    @Test
    void firstOpenProvisions() {
        var store = new WrappedKeyStore(dir.resolve("wrapped.json"));
        var vault = new DataKeyVault(wrapper, store);
        assertThat(vault.isProvisioned()).isFalse();

        var dataKey = vault.open(codec.generate());

        assertThat(vault.isProvisioned()).isTrue();
        assertThat(dataKey.isDestroyed()).isFalse();
        assertThat(dataKey.getEncoded()).hasSize(32);
    }

    @Test
    void laterOpensReturnTheSameKey() {
        var mnemonic = codec.generate();
        var store = new WrappedKeyStore(dir.resolve("wrapped.json"));
        var first = new DataKeyVault(wrapper, store).open(mnemonic);
        var storedBefore = store.load();

        var second = new DataKeyVault(wrapper, store).open(mnemonic);

        assertThat(second.sameAs(first)).isTrue();
        assertThat(store.load()).isEqualTo(storedBefore);
    }

    @Test
    void wrongMnemonic() {
        var store = new WrappedKeyStore(dir.resolve("wrapped.json"));
        var vault = new DataKeyVault(wrapper, store);
        vault.open(codec.generate());
        var other = codec.generate();

        assertThatThrownBy(() -> vault.open(other))
                .isInstanceOf(InvalidCiphertextException.class);
    }

    @Test
    void failedSaveIsReported() throws IOException {
        when(failingStore.load()).thenReturn(Optional.empty());
        doThrow(new IOException("disk full")).when(failingStore).save(any());
        var vault = new DataKeyVault(wrapper, failingStore);
        var mnemonic = codec.generate();

        assertThatThrownBy(() -> vault.open(mnemonic))
                .isInstanceOf(KmsException.class)
                .hasMessage("Failed to store wrapped data key")
                .hasCauseInstanceOf(IOException.class);
    }
}
