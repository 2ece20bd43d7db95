/*
 * Copyright CybKMS Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.cybkms.kms.service;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Thrown when a request was rejected because the caller exceeded its request rate.
 * The message is fixed.
 */
public class ThrottlingException extends KmsException {

    public static final String MESSAGE = "Request throttled";

    public ThrottlingException() {
        super(MESSAGE);
    }

    @NonNull
    @Override
    public KmsErrorType errorType() {
        return KmsErrorType.THROTTLING;
    }
}
