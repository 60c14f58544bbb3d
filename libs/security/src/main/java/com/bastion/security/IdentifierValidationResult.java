package com.bastion.security;

import java.util.List;

/**
 * Result of validating one or more RBAC identifiers.
 * <p>
 * Either valid (empty errors) or invalid (every violation listed, not just the first).
 *
 * @param valid  whether all checked identifiers are well-formed
 * @param errors violation messages (empty if valid)
 */
public record IdentifierValidationResult(boolean valid, List<String> errors) {

    /** Creates a passing result. */
    public static IdentifierValidationResult ok() {
        return new IdentifierValidationResult(true, List.of());
    }

    /** Creates a failing result with one or more error messages. */
    public static IdentifierValidationResult fail(List<String> errors) {
        return new IdentifierValidationResult(false, List.copyOf(errors));
    }

    /**
     * Throws if this result is invalid.
     *
     * @throws IllegalArgumentException listing every violation
     */
    public void orThrow() {
        if (!valid) {
            throw new IllegalArgumentException(String.join("; ", errors));
        }
    }
}
