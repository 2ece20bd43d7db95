/*
 * Copyright CybKMS Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.cybkms.envelope;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import io.cybkms.kms.io.AtomicFiles;
import io.cybkms.kms.service.KeyStoreLoadException;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Keeps the single {@link WrappedDataKey} in a JSON file, replaced atomically on every save.
 */
public class WrappedKeyStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(WrappedKeyStore.class);

    static final ObjectMapper MAPPER = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_NULL_CREATOR_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_MISSING_CREATOR_PROPERTIES)
            .enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION);

    private final Path path;

    public WrappedKeyStore(@NonNull Path path) {
        this.path = Objects.requireNonNull(path);
    }

    public Path path() {
        return path;
    }

    /**
     * @return the stored record, or empty if none has been saved
     * @throws KeyStoreLoadException if the file exists but cannot be read as a wrapped data key
     */
    @NonNull
    public Optional<WrappedDataKey> load() {
        byte[] content;
        try {
            content = Files.readAllBytes(path);
        }
        catch (NoSuchFileException e) {
            return Optional.empty();
        }
        catch (IOException e) {
            throw new KeyStoreLoadException("Unable to read wrapped data key " + path, e);
        }
        try {
            var wrapped = MAPPER.readValue(content, WrappedDataKey.class);
            if (wrapped == null) {
                throw new KeyStoreLoadException("Wrapped data key " + path + " is empty");
            }
            return Optional.of(wrapped);
        }
        catch (IOException | IllegalArgumentException e) {
            throw new KeyStoreLoadException("Wrapped data key " + path + " is malformed", e);
        }
    }

    /**
     * Replaces the stored record.
     * @param wrapped the new record
     * @throws IOException if the record could not be written; the previous record is then intact
     */
    public void save(@NonNull WrappedDataKey wrapped) throws IOException {
        AtomicFiles.write(path, MAPPER.writeValueAsBytes(Objects.requireNonNull(wrapped)));
        LOGGER.debug("Saved wrapped data key to {}", path);
    }
}
