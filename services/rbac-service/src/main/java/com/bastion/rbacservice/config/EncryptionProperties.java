package com.bastion.rbacservice.config;

import com.bastion.crypto.EncryptionSettings;
import com.bastion.crypto.KeyMaterial;
import jakarta.validation.constraints.AssertTrue;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Field-encryption settings, bound once from {@code bastion.encryption.*}.
 *
 * <pre>
 * bastion:
 *   encryption:
 *     enabled: true
 *     secret: ${BASTION_ENCRYPTION_SECRET}
 *     salt: bastion-rbac-field-encryption-v1
 *     allow-mode-change: false
 * </pre>
 *
 * @param enabled whether user identifiers, permission names and descriptions are encrypted
 * @param secret key-derivation secret; required when enabled
 * @param salt key-derivation salt; fixed for the life of a deployment
 * @param allowModeChange start even if the store was written under another mode or key
 */
@ConfigurationProperties(prefix = "bastion.encryption")
@Validated
public record EncryptionProperties(
        boolean enabled, String secret, String salt, boolean allowModeChange) {

    public EncryptionProperties {
        if (salt == null || salt.isBlank()) {
            salt = KeyMaterial.DEFAULT_SALT;
        }
    }

    @AssertTrue(message = "bastion.encryption.secret is required when encryption is enabled")
    public boolean isSecretPresentWhenEnabled() {
        return !enabled || (secret != null && !secret.isBlank());
    }

    public EncryptionSettings toSettings() {
        return new EncryptionSettings(enabled, secret, salt);
    }

    @Override
    public String toString() {
        String shownSecret = secret == null || secret.isEmpty() ? "<unset>" : "<redacted>";
        return "EncryptionProperties[enabled=%s, secret=%s, allowModeChange=%s]"
                .formatted(enabled, shownSecret, allowModeChange);
    }
}
