package com.bastion.crypto;

/**
 * Immutable snapshot of the encryption configuration, taken once at process start.
 *
 * @param enabled whether designated fields are encrypted at rest
 * @param secret  secret the key is derived from (required when enabled)
 * @param salt    fixed deployment salt; {@link KeyMaterial#DEFAULT_SALT} when blank
 */
public record EncryptionSettings(boolean enabled, String secret, String salt) {

    public EncryptionSettings {
        if (salt == null || salt.isBlank()) {
            salt = KeyMaterial.DEFAULT_SALT;
        }
    }

    /** Settings with encryption turned off. */
    public static EncryptionSettings disabled() {
        return new EncryptionSettings(false, null, null);
    }

    /** Settings with encryption on, using the default salt. */
    public static EncryptionSettings enabled(String secret) {
        return new EncryptionSettings(true, secret, null);
    }

    @Override
    public String toString() {
        return "EncryptionSettings[enabled=" + enabled + ", secret=" + (secret == null ? "<none>" : "<redacted>")
                + ", salt=" + salt + "]";
    }
}
