/*
 * Copyright CybKMS Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.cybkms.kms.service;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * The closed set of error kinds a KMS reports, each with the discriminator used in the
 * {@code {"type": ..., "message": ...}} wire format.
 */
public enum KmsErrorType {
    NOT_FOUND("NotFoundException", NotFoundException::new),
    ACCESS_DENIED("AccessDeniedException", AccessDeniedException::new),
    INVALID_KEY_USAGE("InvalidKeyUsageException", InvalidKeyUsageException::new),
    KEY_UNAVAILABLE("KeyUnavailableException", KeyUnavailableException::new),
    INVALID_CIPHERTEXT("InvalidCiphertextException", InvalidCiphertextException::new),
    THROTTLING("ThrottlingException", message -> new ThrottlingException()),
    INTERNAL("InternalException", InternalException::new),
    INVALID_GRANT_TOKEN("InvalidGrantTokenException", InvalidGrantTokenException::new),
    INVALID_KEY_ID("InvalidKeyIdException", InvalidKeyIdException::new);

    private static final Map<String, KmsErrorType> BY_DISCRIMINATOR = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(KmsErrorType::discriminator, Function.identity()));

    private final String discriminator;
    private final Function<String, KmsException> factory;

    KmsErrorType(String discriminator, Function<String, KmsException> factory) {
        this.discriminator = discriminator;
        this.factory = factory;
    }

    /**
     * @return the value of the {@code type} property on the wire.
     */
    @NonNull
    public String discriminator() {
        return discriminator;
    }

    /**
     * Creates the exception corresponding to this kind.
     * @param message the message
     * @return the exception
     */
    @NonNull
    public KmsException newException(String message) {
        return factory.apply(message);
    }

    /**
     * Looks up a kind by its wire discriminator.
     * @param discriminator the value of the {@code type} property.
     * @return the kind, or empty if the discriminator is not one we know.
     */
    @NonNull
    public static Optional<KmsErrorType> fromDiscriminator(String discriminator) {
        return Optional.ofNullable(discriminator).map(BY_DISCRIMINATOR::get);
    }
}
