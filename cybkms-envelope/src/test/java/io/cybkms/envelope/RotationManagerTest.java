/*
 * Copyright CybKMS Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.cybkms.envelope;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CopyOnWriteArrayList;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import io.cybkms.envelope.chunk.ChunkedEncryption;
import io.cybkms.envelope.mnemonic.InvalidMnemonicException;
import io.cybkms.envelope.mnemonic.Mnemonic;
import io.cybkms.envelope.mnemonic.MnemonicCodec;
import io.cybkms.envelope.mnemonic.TestWordlists;
import io.cybkms.kms.service.InvalidCiphertextException;
import io.cybkms.kms.service.KmsException;
import io.cybkms.kms.service.NotFoundException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.spy;

class RotationManagerTest {

    @TempDir
    Path dir;

    private final MnemonicCodec codec = new MnemonicCodec(TestWordlists.synthetic());
    private final KeyWrapper wrapper = new KeyWrapper();
    private final List<RotationState> states = new CopyOnWriteArrayList<>();
    private WrappedKeyStore store;
    private RotationManager manager;
    private Mnemonic original;

    @BeforeEach
    void setUp() {
        store = new WrappedKeyStore(dir.resolve("wrapped.json"));
        manager = new RotationManager(wrapper, store, codec);
        manager.addListener(states::add);
        original = codec.generate();
    }

    @Test
    void rotationKeepsTheDataKey() {
        var dataKey = new DataKeyVault(wrapper, store).open(original);
        var replacement = codec.generate();

        var rewrapped = manager.rotate(original, replacement);

        assertThat(store.load()).contains(rewrapped);
        assertThat(wrapper.unwrap(rewrapped, replacement).sameAs(dataKey)).isTrue();
        assertThat(states).containsExactly(RotationState.STARTED, RotationState.UNWRAPPED, RotationState.REWRAPPED,
                RotationState.COMPLETED);
    }

    @Test
    void payloadEncryptedBeforeRotationStaysReadable() {
        var chunked = new ChunkedEncryption(ChunkedEncryption.MIN_CHUNK_SIZE);
        byte[] payload = new byte[ChunkedEncryption.MIN_CHUNK_SIZE * 2 + 17];
        new Random(42).nextBytes(payload);
        byte[] ciphertext = chunked.encrypt(new DataKeyVault(wrapper, store).open(original), payload);
        var replacement = codec.generate();

        manager.rotate(original, replacement);

        var vault = new DataKeyVault(wrapper, store);
        assertThat(chunked.decrypt(vault.open(replacement), ciphertext)).isEqualTo(payload);
        assertThatThrownBy(() -> vault.open(original))
                .isInstanceOf(InvalidCiphertextException.class);
    }

    @Test
    void wrongOldMnemonicLeavesStoreUntouched() throws IOException {
        new DataKeyVault(wrapper, store).open(original);
        byte[] before = Files.readAllBytes(store.path());
        var wrong = codec.generate();
        var replacement = codec.generate();

        assertThatThrownBy(() -> manager.rotate(wrong, replacement))
                .isInstanceOf(InvalidCiphertextException.class);

        assertThat(Files.readAllBytes(store.path())).isEqualTo(before);
        assertThat(states).containsExactly(RotationState.STARTED, RotationState.FAILED);
    }

    @Test
    void invalidNewMnemonicLeavesStoreUntouched() throws IOException {
        new DataKeyVault(wrapper, store).open(original);
        byte[] before = Files.readAllBytes(store.path());
        var invalid = Mnemonic.parse("aaa aaa aaa aaa aaa aaa aaa aaa aaa aaa aaa aaa");

        assertThatThrownBy(() -> manager.rotate(original, invalid))
                .isInstanceOf(InvalidMnemonicException.class);

        assertThat(Files.readAllBytes(store.path())).isEqualTo(before);
        assertThat(states).containsExactly(RotationState.STARTED, RotationState.FAILED);
    }

    @Test
    void nothingToRotate() {
        var replacement = codec.generate();

        assertThatThrownBy(() -> manager.rotate(original, replacement))
                .isInstanceOf(NotFoundException.class)
                .hasMessageContaining("No wrapped data key");
        assertThat(store.load()).isEmpty();
    }

    @Test
    void failedSaveIsReported() throws IOException {
        new DataKeyVault(wrapper, store).open(original);
        var failingStore = spy(store);
        doThrow(new IOException("disk full")).when(failingStore).save(any());
        var failingManager = new RotationManager(wrapper, failingStore, codec);
        failingManager.addListener(states::add);
        var before = store.load();
        var replacement = codec.generate();

        assertThatThrownBy(() -> failingManager.rotate(original, replacement))
                .isInstanceOf(KmsException.class)
                .hasMessage("Failed to store rotated data key");

        assertThat(store.load()).isEqualTo(before);
        assertThat(states).endsWith(RotationState.FAILED);
    }

    @Test
    void rotateToGeneratedMnemonic() {
        var dataKey = new DataKeyVault(wrapper, store).open(original);

        var result = manager.rotate(original);

        assertThat(codec.isValid(result.newMnemonic())).isTrue();
        assertThat(result.newMnemonic()).isNotEqualTo(original);
        assertThat(new DataKeyVault(wrapper, store).open(result.newMnemonic()).sameAs(dataKey)).isTrue();
    }

    @Test
    void generatingRequiresACodec() {
        var withoutCodec = new RotationManager(wrapper, store, null);

        assertThatThrownBy(() -> withoutCodec.rotate(original))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void failingListenerDoesNotAbortRotation() {
        new DataKeyVault(wrapper, store).open(original);
        manager.addListener(state -> {
            throw new IllegalStateException("listener failure");
        });
        var replacement = codec.generate();

        manager.rotate(original, replacement);

        assertThat(states).endsWith(RotationState.COMPLETED);
    }

    @Test
    void removedListenerIsNotNotified() {
        new DataKeyVault(wrapper, store).open(original);
        RotationListener listener = states::add;
        manager.addListener(listener);
        manager.removeListener(listener);
        var replacement = codec.generate();

        manager.rotate(original, replacement);

        assertThat(states).hasSize(4);
    }

    @Test
    void progressValues() {
        assertThat(RotationState.STARTED.progress()).isZero();
        assertThat(RotationState.UNWRAPPED.progress()).isEqualTo(0.4);
        assertThat(RotationState.REWRAPPED.progress()).isEqualTo(0.8);
        assertThat(RotationState.COMPLETED.progress()).isEqualTo(1.0);
        assertThat(RotationState.FAILED.progress()).isEqualTo(1.0);
    }
}
