/*
 * Copyright CybKMS Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.cybkms.envelope;

/**
 * Receives progress of rotations. Called on the rotating thread.
 */
@FunctionalInterface
public interface RotationListener {
    void onProgress(RotationState state);
}
