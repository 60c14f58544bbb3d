package com.bastion.crypto;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.util.Arrays;
import java.util.HexFormat;
import javax.crypto.Mac;
import javax.crypto.SecretKeyFactory;
import javax.crypto.spec.PBEKeySpec;
import javax.crypto.spec.SecretKeySpec;

/**
 * A 256-bit symmetric key derived from a configured secret with PBKDF2-HMAC-SHA256.
 * <p>
 * The salt is fixed per deployment so that every process derives the same key from the
 * same secret; it is not secret. Changing either the secret or the salt on a populated
 * store makes existing ciphertext unreadable and unmatchable.
 */
public final class KeyMaterial {

    /** Salt used when the deployment does not configure one. */
    public static final String DEFAULT_SALT = "bastion-rbac-field-encryption-v1";

    /** PBKDF2 iteration count. */
    public static final int ITERATIONS = 100_000;

    /** Derived key length in bytes. */
    public static final int KEY_LENGTH_BYTES = 32;

    private static final String KDF_ALGORITHM = "PBKDF2WithHmacSHA256";
    private static final String FINGERPRINT_LABEL = "bastion-key-fingerprint";

    private final byte[] key;

    private KeyMaterial(byte[] key) {
        this.key = key;
    }

    /**
     * Derives a key from {@code secret} and {@code salt}.
     *
     * @param secret configured secret, must not be null or empty
     * @param salt   fixed deployment salt, must not be null or empty
     * @return the derived key material
     * @throws KeyDerivationException if the secret or salt is missing, or the KDF is unavailable
     */
    public static KeyMaterial derive(String secret, String salt) {
        if (secret == null || secret.isEmpty()) {
            throw new KeyDerivationException("Encryption secret must not be empty");
        }
        if (salt == null || salt.isEmpty()) {
            throw new KeyDerivationException("Key derivation salt must not be empty");
        }
        char[] password = secret.toCharArray();
        PBEKeySpec spec = new PBEKeySpec(
                password, salt.getBytes(StandardCharsets.UTF_8), ITERATIONS, KEY_LENGTH_BYTES * 8);
        try {
            SecretKeyFactory factory = SecretKeyFactory.getInstance(KDF_ALGORITHM);
            return new KeyMaterial(factory.generateSecret(spec).getEncoded());
        } catch (GeneralSecurityException e) {
            throw new KeyDerivationException("Key derivation failed", e);
        } finally {
            spec.clearPassword();
            Arrays.fill(password, '\0');
        }
    }

    /**
     * Derives a key from {@code secret} using {@link #DEFAULT_SALT}.
     */
    public static KeyMaterial derive(String secret) {
        return derive(secret, DEFAULT_SALT);
    }

    /** AES key spec over the derived bytes. */
    SecretKeySpec aesKey() {
        return new SecretKeySpec(key, "AES");
    }

    /** HMAC-SHA256 key spec over the derived bytes. */
    SecretKeySpec hmacKey() {
        return new SecretKeySpec(key, DeterministicCipher.HMAC_ALGORITHM);
    }

    /**
     * Short, non-reversible tag identifying this key (16 hex chars).
     * <p>
     * Stored next to the data so that a restart with a different secret is detected
     * instead of silently writing rows no query will ever match.
     */
    public String fingerprint() {
        try {
            Mac mac = Mac.getInstance(DeterministicCipher.HMAC_ALGORITHM);
            mac.init(hmacKey());
            byte[] tag = mac.doFinal(FINGERPRINT_LABEL.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(tag, 0, 8);
        } catch (GeneralSecurityException e) {
            throw new KeyDerivationException("Cannot compute key fingerprint", e);
        }
    }

    @Override
    public String toString() {
        return "KeyMaterial[fingerprint=" + fingerprint() + "]";
    }
}
