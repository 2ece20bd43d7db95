/*
 * Copyright CybKMS Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.cybkms.kms.local;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import javax.annotation.concurrent.ThreadSafe;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.cybkms.kms.crypto.AesGcm;
import io.cybkms.kms.local.crypto.CryptoEngine;
import io.cybkms.kms.local.store.JsonFileKeyTablePersistence;
import io.cybkms.kms.local.store.KeyStore;
import io.cybkms.kms.local.store.KeyTablePersistence;
import io.cybkms.kms.service.KmsService;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Service providing a {@link LocalKms}. All KMS instances built by one service share its key store.
 */
@ThreadSafe
public class LocalKmsService implements KmsService<LocalKmsConfig> {

    private static final Logger LOGGER = LoggerFactory.getLogger(LocalKmsService.class);

    private final Clock clock;
    private final SecureRandom random;
    private LocalKmsConfig config;
    private KeyStore keyStore;
    private ExecutorService cryptoExecutor;
    private LocalKms kms;
    private boolean closed;

    public LocalKmsService() {
        this(Clock.systemUTC(), new SecureRandom());
    }

    LocalKmsService(@NonNull Clock clock, @NonNull SecureRandom random) {
        this.clock = Objects.requireNonNull(clock);
        this.random = Objects.requireNonNull(random);
    }

    @Override
    public synchronized void initialize(@NonNull LocalKmsConfig config) {
        Objects.requireNonNull(config);
        if (this.config != null) {
            throw new IllegalStateException("KMS service is already initialized");
        }
        if (closed) {
            throw new IllegalStateException("KMS service is closed");
        }
        KeyTablePersistence persistence = config.keyStorePath() == null
                ? KeyTablePersistence.inMemory()
                : new JsonFileKeyTablePersistence(config.keyStorePath());
        this.keyStore = KeyStore.open(persistence, clock, random);
        var threadCount = new AtomicInteger();
        this.cryptoExecutor = Executors.newFixedThreadPool(config.cryptoThreads(), runnable -> {
            Thread thread = new Thread(runnable, "cybkms-crypto-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        this.kms = new LocalKms(keyStore, new CryptoEngine(keyStore, new AesGcm(random), cryptoExecutor),
                config.defaultPendingWindowInDays());
        this.config = config;
        LOGGER.info("Local KMS initialized ({})", config.keyStorePath() == null ? "in memory" : config.keyStorePath());
    }

    @NonNull
    @Override
    public synchronized LocalKms buildKms() {
        if (closed) {
            throw new IllegalStateException("KMS service is closed");
        }
        if (config == null) {
            throw new IllegalStateException("KMS service not initialized");
        }
        return kms;
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        if (keyStore != null) {
            keyStore.close();
        }
        if (cryptoExecutor != null) {
            cryptoExecutor.shutdown();
            try {
                if (!cryptoExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
                    cryptoExecutor.shutdownNow();
                }
            }
            catch (InterruptedException e) {
                cryptoExecutor.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }
}
