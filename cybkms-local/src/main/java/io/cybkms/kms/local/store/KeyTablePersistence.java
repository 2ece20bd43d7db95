/*
 * Copyright CybKMS Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.cybkms.kms.local.store;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

import io.cybkms.kms.service.KeyStoreLoadException;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Durable storage for the whole key table. Implementations are only ever called
 * from the key store's worker thread.
 */
public interface KeyTablePersistence {

    /**
     * @return the stored table in insertion order, empty if nothing has been stored yet
     * @throws KeyStoreLoadException if stored data exists but cannot be read
     */
    @NonNull
    LinkedHashMap<String, KeyRecord> load();

    /**
     * Replaces the stored table with the given one. The replacement is all-or-nothing.
     *
     * @param table the table
     * @throws IOException if the table could not be stored
     */
    void save(@NonNull Map<String, KeyRecord> table) throws IOException;

    /**
     * @return persistence that keeps nothing
     */
    static KeyTablePersistence inMemory() {
        return new KeyTablePersistence() {
            @NonNull
            @Override
            public LinkedHashMap<String, KeyRecord> load() {
                return new LinkedHashMap<>();
            }

            @Override
            public void save(@NonNull Map<String, KeyRecord> table) {
                // nothing to keep
            }
        };
    }
}
