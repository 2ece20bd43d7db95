/*
 * Copyright CybKMS Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.cybkms.kms.local;

import java.nio.file.Path;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.cybkms.kms.config.IllegalConfigurationException;

import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Configuration for the local KMS.
 *
 * @param keyStorePath file holding the key table, or null to keep keys in memory only
 * @param defaultPendingWindowInDays pending window used when schedule-deletion names none
 * @param cryptoThreads number of threads performing AES-GCM
 */
public record LocalKmsConfig(@JsonProperty("keyStorePath") @Nullable Path keyStorePath,
                             @JsonProperty("defaultPendingWindowInDays") int defaultPendingWindowInDays,
                             @JsonProperty("cryptoThreads") int cryptoThreads) {

    public static final int MIN_PENDING_WINDOW_IN_DAYS = 7;
    public static final int MAX_PENDING_WINDOW_IN_DAYS = 30;

    public LocalKmsConfig {
        checkPendingWindow(defaultPendingWindowInDays);
        if (cryptoThreads < 1) {
            throw new IllegalConfigurationException("cryptoThreads must be at least 1, but was " + cryptoThreads);
        }
    }

    @JsonCreator
    static LocalKmsConfig create(@JsonProperty("keyStorePath") @Nullable Path keyStorePath,
                                 @JsonProperty("defaultPendingWindowInDays") @Nullable Integer defaultPendingWindowInDays,
                                 @JsonProperty("cryptoThreads") @Nullable Integer cryptoThreads) {
        return new LocalKmsConfig(keyStorePath,
                defaultPendingWindowInDays == null ? MIN_PENDING_WINDOW_IN_DAYS : defaultPendingWindowInDays,
                cryptoThreads == null ? Runtime.getRuntime().availableProcessors() : cryptoThreads);
    }

    /**
     * @return a configuration for an in-memory KMS with defaults
     */
    public static LocalKmsConfig inMemory() {
        return create(null, null, null);
    }

    public static LocalKmsConfig persistentAt(Path keyStorePath) {
        return create(keyStorePath, null, null);
    }

    static void checkPendingWindow(int pendingWindowInDays) {
        if (pendingWindowInDays < MIN_PENDING_WINDOW_IN_DAYS || pendingWindowInDays > MAX_PENDING_WINDOW_IN_DAYS) {
            throw new IllegalConfigurationException("pending window must be between " + MIN_PENDING_WINDOW_IN_DAYS
                    + " and " + MAX_PENDING_WINDOW_IN_DAYS + " days, but was " + pendingWindowInDays);
        }
    }
}
