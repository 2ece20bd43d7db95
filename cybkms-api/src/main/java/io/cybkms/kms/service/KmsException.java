/*
 * Copyright CybKMS Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.cybkms.kms.service;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Represents problems interacting with a Key Management System.
 * <p>Subclasses correspond to the kinds of the {@link KmsErrorType} taxonomy. A bare
 * {@code KmsException} (for example an I/O failure while persisting the key table) is reported
 * to remote callers as {@link KmsErrorType#INTERNAL}.</p>
 */
public class KmsException extends RuntimeException {
    public KmsException() {
    }

    public KmsException(Throwable cause) {
        super(cause);
    }

    public KmsException(String message) {
        super(message);
    }

    public KmsException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * @return the kind of this failure, as exposed on the wire.
     */
    @NonNull
    public KmsErrorType errorType() {
        return KmsErrorType.INTERNAL;
    }
}
