/*
 * Copyright CybKMS Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.cybkms.kms.local.store;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import io.cybkms.kms.io.AtomicFiles;
import io.cybkms.kms.service.KeyArn;
import io.cybkms.kms.service.KeyStoreLoadException;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Stores the key table as a single JSON object mapping key id to {@link KeyRecord}.
 * Key material is written base64 encoded and in the clear; protect the file with file system permissions.
 * Every save rewrites the whole file through {@link AtomicFiles#write(Path, byte[])}.
 */
public class JsonFileKeyTablePersistence implements KeyTablePersistence {

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonFileKeyTablePersistence.class);

    private static final TypeReference<LinkedHashMap<String, KeyRecord>> TABLE_TYPE = new TypeReference<>() {
    };

    static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT)
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .enable(DeserializationFeature.FAIL_ON_NULL_CREATOR_PROPERTIES)
            .enable(JsonParser.Feature.STRICT_DUPLICATE_DETECTION);

    private final Path path;

    public JsonFileKeyTablePersistence(@NonNull Path path) {
        this.path = Objects.requireNonNull(path);
    }

    public Path path() {
        return path;
    }

    @NonNull
    @Override
    public LinkedHashMap<String, KeyRecord> load() {
        byte[] content;
        try {
            content = Files.readAllBytes(path);
        }
        catch (NoSuchFileException e) {
            LOGGER.info("No key table at {}, starting empty", path);
            return new LinkedHashMap<>();
        }
        catch (IOException e) {
            throw new KeyStoreLoadException("Unable to read key table " + path, e);
        }

        LinkedHashMap<String, KeyRecord> table;
        try {
            table = MAPPER.readValue(content, TABLE_TYPE);
        }
        catch (IOException | IllegalArgumentException e) {
            throw new KeyStoreLoadException("Key table " + path + " is malformed", e);
        }
        if (table == null) {
            throw new KeyStoreLoadException("Key table " + path + " is malformed: expected a JSON object");
        }
        for (var entry : table.entrySet()) {
            var keyRecord = entry.getValue();
            if (keyRecord == null) {
                throw new KeyStoreLoadException("Key table " + path + " has no record for key '" + entry.getKey() + "'");
            }
            if (!entry.getKey().equals(keyRecord.keyId())) {
                throw new KeyStoreLoadException("Key table " + path + " maps '" + entry.getKey() + "' to key '" + keyRecord.keyId() + "'");
            }
            if (!KeyArn.forKeyId(keyRecord.keyId()).equals(keyRecord.arn())) {
                throw new KeyStoreLoadException("Key table " + path + " has a foreign ARN for key '" + keyRecord.keyId() + "'");
            }
        }
        LOGGER.info("Loaded {} key(s) from {}", table.size(), path);
        return table;
    }

    @Override
    public void save(@NonNull Map<String, KeyRecord> table) throws IOException {
        AtomicFiles.write(path, MAPPER.writeValueAsBytes(table));
        LOGGER.debug("Saved {} key(s) to {}", table.size(), path);
    }
}
