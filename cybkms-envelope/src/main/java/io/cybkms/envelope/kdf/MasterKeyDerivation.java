/*
 * Copyright CybKMS Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.cybkms.envelope.kdf;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.crypto.digests.SHA512Digest;
import org.bouncycastle.crypto.generators.HKDFBytesGenerator;
import org.bouncycastle.crypto.generators.PKCS5S2ParametersGenerator;
import org.bouncycastle.crypto.params.HKDFParameters;
import org.bouncycastle.crypto.params.KeyParameter;

import io.cybkms.envelope.mnemonic.Mnemonic;
import io.cybkms.kms.service.DestroyableRawSecretKey;

import edu.umd.cs.findbugs.annotations.NonNull;

/**
 * Derives a 256-bit master key from a mnemonic.
 * <ol>
 *     <li>PBKDF2-HMAC-SHA512 over the mnemonic's canonical bytes and the caller's salt gives a 64-byte seed.</li>
 *     <li>HKDF-SHA256 (salt {@value #HKDF_SALT}, info {@value #HKDF_INFO}) expands the seed to 32 bytes.</li>
 * </ol>
 * The result depends only on the mnemonic, the salt and the iteration count.
 */
public final class MasterKeyDerivation {

    public static final int MIN_ITERATIONS = 2048;
    public static final String HKDF_SALT = "cybkms-vault";
    public static final String HKDF_INFO = "cybkms-master-key";

    private static final int SEED_BITS = 512;

    private MasterKeyDerivation() {
    }

    /**
     * @param mnemonic the mnemonic
     * @param salt non-empty salt
     * @param iterations PBKDF2 iterations, at least {@value #MIN_ITERATIONS}
     * @return the master key, which the caller must destroy
     * @throws IllegalArgumentException if the salt is empty or there are too few iterations
     */
    @NonNull
    public static DestroyableRawSecretKey deriveMasterKey(@NonNull Mnemonic mnemonic, @NonNull byte[] salt, int iterations) {
        Objects.requireNonNull(mnemonic);
        Objects.requireNonNull(salt);
        if (salt.length == 0) {
            throw new IllegalArgumentException("Salt must not be empty");
        }
        if (iterations < MIN_ITERATIONS) {
            throw new IllegalArgumentException("At least " + MIN_ITERATIONS + " iterations are required, not " + iterations);
        }

        byte[] password = mnemonic.canonicalBytes();
        byte[] seed = null;
        try {
            var pbkdf2 = new PKCS5S2ParametersGenerator(new SHA512Digest());
            pbkdf2.init(password, salt, iterations);
            seed = ((KeyParameter) pbkdf2.generateDerivedMacParameters(SEED_BITS)).getKey();

            var hkdf = new HKDFBytesGenerator(new SHA256Digest());
            hkdf.init(new HKDFParameters(seed,
                    HKDF_SALT.getBytes(StandardCharsets.UTF_8),
                    HKDF_INFO.getBytes(StandardCharsets.UTF_8)));
            byte[] masterKey = new byte[DestroyableRawSecretKey.AES_256_KEY_BYTES];
            hkdf.generateBytes(masterKey, 0, masterKey.length);
            return DestroyableRawSecretKey.takeOwnershipOf(masterKey, DestroyableRawSecretKey.AES);
        }
        finally {
            Arrays.fill(password, (byte) 0);
            if (seed != null) {
                Arrays.fill(seed, (byte) 0);
            }
        }
    }
}
