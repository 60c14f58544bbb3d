package com.bastion.security;

import java.util.UUID;

/**
 * Opaque key scoping one client's entire role/permission/membership graph.
 * <p>
 * Travels with every call; every read and write is filtered by it. The key is an untrusted scoping value, not a credential:
 * holding a key grants nothing beyond isolation from other keys.
 * <p>
 * Recommended form is a random UUID ({@link #random()}), but any non-blank string of at
 * most {@value #MAX_LENGTH} characters without whitespace is accepted.
 *
 * @param value the key as supplied by the caller
 */
public record TenantKey(String value) {

    /** Maximum key length (matches the {@code tenant} column width). */
    public static final int MAX_LENGTH = 64;

    public TenantKey {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("tenant key must not be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException(
                    "tenant key must be at most %d characters".formatted(MAX_LENGTH));
        }
        for (int i = 0; i < value.length(); i++) {
            if (Character.isWhitespace(value.charAt(i))) {
                throw new IllegalArgumentException("tenant key must not contain whitespace");
            }
        }
    }

    /** Parses a caller-supplied key. */
    public static TenantKey of(String value) {
        return new TenantKey(value);
    }

    /** Generates a fresh 128-bit random key formatted as a UUID. */
    public static TenantKey random() {
        return new TenantKey(UUID.randomUUID().toString());
    }

    @Override
    public String toString() {
        return value;
    }
}
