/*
 * Copyright CybKMS Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.cybkms.kms.local.store;

import java.util.Arrays;
import java.util.Objects;

import javax.crypto.SecretKey;
import javax.crypto.spec.SecretKeySpec;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import io.cybkms.kms.service.DestroyableRawSecretKey;
import io.cybkms.kms.service.KeyMetadata;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * A key held by the local KMS: its identity, its 256-bit material and its metadata.
 * Instances are immutable; state changes produce a new record.
 *
 * @param keyId the key id
 * @param arn the key's ARN
 * @param keyMaterial the raw AES-256 key
 * @param metadata the key's metadata
 */
@JsonPropertyOrder({ "keyId", "arn", "keyMaterial", "metadata" })
public record KeyRecord(@JsonProperty("keyId") @NonNull String keyId,
                        @JsonProperty("arn") @NonNull String arn,
                        @JsonProperty("keyMaterial") @NonNull byte[] keyMaterial,
                        @JsonProperty("metadata") @NonNull KeyMetadata metadata) {

    public KeyRecord {
        Objects.requireNonNull(keyId, "keyId");
        Objects.requireNonNull(arn, "arn");
        Objects.requireNonNull(keyMaterial, "keyMaterial");
        Objects.requireNonNull(metadata, "metadata");
        keyMaterial = keyMaterial.clone();
        if (keyMaterial.length != DestroyableRawSecretKey.AES_256_KEY_BYTES) {
            throw new IllegalArgumentException("Key material for key '" + keyId + "' must be "
                    + DestroyableRawSecretKey.AES_256_KEY_BYTES + " bytes, but was " + keyMaterial.length);
        }
        if (!keyId.equals(metadata.keyId()) || !arn.equals(metadata.arn())) {
            throw new IllegalArgumentException("Metadata of key '" + keyId + "' names a different key");
        }
    }

    /**
     * @return a copy of the raw key
     */
    @Override
    @NonNull
    public byte[] keyMaterial() {
        return keyMaterial.clone();
    }

    @NonNull
    public KeyRecord withMetadata(@NonNull KeyMetadata newMetadata) {
        return new KeyRecord(keyId, arn, keyMaterial, newMetadata);
    }

    /**
     * @return the key material as a JCA key
     */
    @NonNull
    public SecretKey secretKey() {
        return new SecretKeySpec(keyMaterial, DestroyableRawSecretKey.AES);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        KeyRecord that = (KeyRecord) o;
        return keyId.equals(that.keyId)
                && arn.equals(that.arn)
                && Arrays.equals(keyMaterial, that.keyMaterial)
                && metadata.equals(that.metadata);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(keyId, arn, metadata);
        result = 31 * result + Arrays.hashCode(keyMaterial);
        return result;
    }

    @Override
    public String toString() {
        return "KeyRecord{" +
                "keyId='" + keyId + '\'' +
                ", metadata=" + metadata +
                '}';
    }
}
