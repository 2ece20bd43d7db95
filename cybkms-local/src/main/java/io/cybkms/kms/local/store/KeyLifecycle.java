/*
 * Copyright CybKMS Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.cybkms.kms.local.store;

import io.cybkms.kms.service.InvalidKeyUsageException;
import io.cybkms.kms.service.KeyState;
import io.cybkms.kms.service.KeyUnavailableException;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * The key state machine.
 * <pre>
 *   Enabled &lt;--&gt; Disabled
 *      \           /
 *       PendingDeletion   (terminal)
 * </pre>
 * PendingImport and Unavailable are reserved and can be neither entered nor left.
 */
final class KeyLifecycle {

    private KeyLifecycle() {
    }

    /**
     * Checks whether a key in state {@code from} may move to {@code to}.
     *
     * @param keyId the key, for error messages
     * @param from current state
     * @param to requested state
     * @return true if the state must change, false if the request is a no-op
     * @throws InvalidKeyUsageException if {@code to} is a reserved state
     * @throws KeyUnavailableException if the key is in a state that cannot be left
     */
    static boolean checkTransition(@NonNull String keyId, @NonNull KeyState from, @NonNull KeyState to) {
        if (to == KeyState.PENDING_IMPORT || to == KeyState.UNAVAILABLE) {
            throw new InvalidKeyUsageException("Keys cannot be moved to state " + to.value());
        }
        if (from == to) {
            return false;
        }
        switch (from) {
            case PENDING_DELETION:
                throw KeyUnavailableException.pendingDeletion(keyId);
            case PENDING_IMPORT:
            case UNAVAILABLE:
                throw new KeyUnavailableException("Key '" + keyId + "' is " + from.value());
            default:
                return true;
        }
    }
}
