/*
 * Copyright CybKMS Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.cybkms.envelope;

/**
 * Progress of a rotation, in the order reached.
 */
public enum RotationState {
    STARTED(0.0),
    UNWRAPPED(0.4),
    REWRAPPED(0.8),
    COMPLETED(1.0),
    FAILED(1.0);

    private final double progress;

    RotationState(double progress) {
        this.progress = progress;
    }

    /**
     * @return fraction of the rotation done on reaching this state
     */
    public double progress() {
        return progress;
    }
}
