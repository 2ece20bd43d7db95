/*
 * Copyright CybKMS Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.cybkms.kms.service;

import java.util.Locale;
import java.util.Objects;
import java.util.UUID;
import java.util.regex.Pattern;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Key identifiers and the ARNs that name them: {@code arn:cyb:kms:local:000000000000:key/<keyId>}.
 */
public final class KeyArn {

    public static final String PREFIX = "arn:cyb:kms:local:000000000000:key/";
    private static final String ARN_SCHEME = "arn:";
    private static final Pattern KEY_ID = Pattern.compile("[0-9a-f]{8}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{4}-[0-9a-f]{12}");

    private KeyArn() {
    }

    /**
     * @return a new random key id: a lower-case, hyphenated UUID.
     */
    @NonNull
    public static String newKeyId() {
        return UUID.randomUUID().toString().toLowerCase(Locale.ROOT);
    }

    /**
     * @param keyId the key id
     * @return the ARN naming the key
     */
    @NonNull
    public static String forKeyId(@NonNull String keyId) {
        return PREFIX + Objects.requireNonNull(keyId);
    }

    /**
     * @param keyId a candidate key id
     * @return true if it has the shape of an id generated by {@link #newKeyId()}
     */
    public static boolean isWellFormedKeyId(String keyId) {
        return keyId != null && KEY_ID.matcher(keyId).matches();
    }

    /**
     * Resolves a key reference that may be either a bare key id or a key ARN.
     * Bare ids are returned as given, so that unknown ids surface as {@link NotFoundException} later.
     *
     * @param keyIdOrArn key id or ARN
     * @return the key id
     * @throws InvalidKeyIdException if the reference is empty, or is an ARN outside this service's namespace
     */
    @NonNull
    public static String toKeyId(String keyIdOrArn) {
        if (keyIdOrArn == null || keyIdOrArn.isBlank()) {
            throw new InvalidKeyIdException("Key id must not be empty");
        }
        if (keyIdOrArn.startsWith(ARN_SCHEME)) {
            if (!keyIdOrArn.startsWith(PREFIX) || keyIdOrArn.length() == PREFIX.length()) {
                throw new InvalidKeyIdException("Invalid key ARN '" + keyIdOrArn + "'");
            }
            return keyIdOrArn.substring(PREFIX.length());
        }
        return keyIdOrArn;
    }
}
