/*
 * Copyright CybKMS Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.cybkms.kms.service;

import java.time.Instant;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import edu.umd.cs.findbugs.annotations.NonNull;
import edu.umd.cs.findbugs.annotations.Nullable;

/**
 * Describes a KMS key.
 * <p>{@link #enabled()} is derived from {@link #keyState()}. It is written out for the benefit of
 * readers of the persisted and wire forms, but any value read back is ignored.</p>
 *
 * @param keyId the key id
 * @param arn the key's ARN
 * @param description free text supplied at creation
 * @param keyUsage what the key may be used for
 * @param keyState the lifecycle state
 * @param keySpec the type of key material
 * @param creationDate when the key was created
 * @param deletionDate when the key becomes eligible for purging; set only while {@link KeyState#PENDING_DELETION}
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(value = "enabled", allowGetters = true)
@JsonPropertyOrder({ "keyId", "arn", "description", "keyUsage", "keyState", "keySpec", "creationDate", "deletionDate", "enabled" })
public record KeyMetadata(@JsonProperty("keyId") @NonNull String keyId,
                          @JsonProperty("arn") @NonNull String arn,
                          @JsonProperty("description") @Nullable String description,
                          @JsonProperty("keyUsage") @NonNull KeyUsage keyUsage,
                          @JsonProperty("keyState") @NonNull KeyState keyState,
                          @JsonProperty("keySpec") @NonNull KeySpec keySpec,
                          @JsonProperty("creationDate") @NonNull Instant creationDate,
                          @JsonProperty("deletionDate") @Nullable Instant deletionDate) {

    public KeyMetadata {
        Objects.requireNonNull(keyId);
        Objects.requireNonNull(arn);
        Objects.requireNonNull(keyUsage);
        Objects.requireNonNull(keyState);
        Objects.requireNonNull(keySpec);
        Objects.requireNonNull(creationDate);
    }

    /**
     * @return true iff the key is {@link KeyState#ENABLED}.
     */
    @JsonProperty("enabled")
    public boolean enabled() {
        return keyState.isUsable();
    }

    /**
     * @param newState the new state
     * @param newDeletionDate the deletion date to record, or null
     * @return a copy of this metadata with the given state
     */
    @NonNull
    public KeyMetadata withState(@NonNull KeyState newState, @Nullable Instant newDeletionDate) {
        return new KeyMetadata(keyId, arn, description, keyUsage, newState, keySpec, creationDate, newDeletionDate);
    }
}
