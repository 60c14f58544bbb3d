package com.bastion.crypto;

/**
 * Entity fields eligible for field-level encryption.
 * <p>
 * Role names and tenant keys are deliberately absent: they stay in plaintext so that
 * role listings and tenant scoping work without the key.
 */
public enum EncryptedField {

    /** {@code membership.username}: the user a role is granted to. */
    USER_IDENTIFIER,

    /** {@code permission.name}: the action a role may perform. */
    PERMISSION_NAME,

    /** {@code role.description}: free text attached to a role. */
    ROLE_DESCRIPTION
}
