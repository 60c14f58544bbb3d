package com.bastion.crypto;

import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Transparently encrypts designated entity fields on write and decrypts them on read.
 * <p>
 * When encryption is disabled the codec is an identity function. The mode is fixed at
 * construction; there is no way to toggle it on a live instance. Flipping the flag on a
 * populated store does not re-encrypt existing rows: that is an offline migration, not a
 * runtime behavior.
 * <p>
 * Thread-safe.
 */
public final class EncryptedFieldCodec {

    private static final Logger log = LoggerFactory.getLogger(EncryptedFieldCodec.class);

    private final DeterministicCipher cipher;
    private final String keyFingerprint;

    private EncryptedFieldCodec(DeterministicCipher cipher, String keyFingerprint) {
        this.cipher = cipher;
        this.keyFingerprint = keyFingerprint;
    }

    /**
     * Builds a codec from a configuration snapshot.
     *
     * @param settings encryption settings
     * @return a passthrough codec when disabled, an encrypting codec otherwise
     * @throws KeyDerivationException if encryption is enabled without a usable secret
     */
    public static EncryptedFieldCodec fromSettings(EncryptionSettings settings) {
        if (settings == null) {
            throw new IllegalArgumentException("settings must not be null");
        }
        if (!settings.enabled()) {
            log.info("Field encryption disabled, identifiers are stored in plaintext");
            return passthrough();
        }
        if (settings.secret() == null || settings.secret().isBlank()) {
            throw new KeyDerivationException("Field encryption is enabled but no secret is configured");
        }
        KeyMaterial key = KeyMaterial.derive(settings.secret(), settings.salt());
        log.info("Field encryption enabled, keyFingerprint={}", key.fingerprint());
        return new EncryptedFieldCodec(new DeterministicCipher(key), key.fingerprint());
    }

    /** A codec that stores every field as given. */
    public static EncryptedFieldCodec passthrough() {
        return new EncryptedFieldCodec(null, null);
    }

    /** A codec that encrypts designated fields with {@code key}. */
    public static EncryptedFieldCodec encrypting(KeyMaterial key) {
        return new EncryptedFieldCodec(new DeterministicCipher(key), key.fingerprint());
    }

    /**
     * Converts a domain value into the form stored (and queried) in the database.
     *
     * @param field the field the value belongs to
     * @param value domain value; null passes through
     */
    public String encode(EncryptedField field, String value) {
        if (cipher == null || value == null || field == null) {
            return value;
        }
        return cipher.encrypt(value);
    }

    /**
     * Converts a stored value back into its domain form.
     *
     * @param field  the field the value belongs to
     * @param stored stored value; null passes through
     * @throws CipherException if encryption is on and the stored value is not well-formed ciphertext
     */
    public String decode(EncryptedField field, String stored) {
        if (cipher == null || stored == null || field == null) {
            return stored;
        }
        return cipher.decrypt(stored);
    }

    /** Whether designated fields are encrypted. */
    public boolean isEnabled() {
        return cipher != null;
    }

    /** Fingerprint of the active key, empty when encryption is disabled. */
    public Optional<String> keyFingerprint() {
        return Optional.ofNullable(keyFingerprint);
    }
}
