/*
 * Copyright CybKMS Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.cybkms.kms.service;

import java.time.Instant;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * The outcome of scheduling a key for deletion.
 * @param keyId the key
 * @param deletionDate the earliest time at which the key may be purged
 * @param keyState always {@link KeyState#PENDING_DELETION}
 */
public record ScheduleKeyDeletionResult(@NonNull String keyId,
                                        @NonNull Instant deletionDate,
                                        @NonNull KeyState keyState) {}
