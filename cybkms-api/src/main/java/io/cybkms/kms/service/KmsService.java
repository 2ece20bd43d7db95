/*
 * Copyright CybKMS Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.cybkms.kms.service;

import javax.annotation.concurrent.ThreadSafe;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Service interface for KMSs
 * @param <C> The config type
 */
@ThreadSafe
public interface KmsService<C> extends AutoCloseable {

    /**
     * Initialises the service.  This method must be invoked exactly once
     * before {@link #buildKms()} is called.
     *
     * @param config KMS service configuration
     * @throws KeyStoreLoadException if persisted keys exist but cannot be loaded
     */
    void initialize(@NonNull C config);

    /**
     * Builds a KMS.
     * {@link #initialize(Object)} must have been called before this method is invoked.
     *
     * @return the KMS.
     * @throws IllegalStateException if the KMS Service has not been initialised or the KMS service is closed.
     */
    @NonNull
    Kms buildKms() throws IllegalStateException;

    /**
     * Closes the service. Once the service is closed, the building of new {@link Kms} or the
     * continued use of previously built {@link Kms}s is not allowed.
     * <br/>
     * Implementations of this method must be idempotent and must tolerate closing a service
     * that was never initialized.
     */
    @Override
    default void close() {
    }
}
