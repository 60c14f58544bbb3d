package com.bastion.security;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.regex.Pattern;

/**
 * Shape rules for the identifiers stored in the role graph.
 * <p>
 * Role names and user identifiers: 1-64 characters from {@code [A-Za-z0-9_.@-]}.
 * Permission names: 1-128 characters from {@code [A-Za-z0-9_.:-]}.
 * Role descriptions: at most 256 characters, any content.
 * <p>
 * A violation is a caller error ({@link IllegalArgumentException}), never a boolean
 * "not found" result.
 */
public final class IdentifierRules {

    /** Maximum role name length. */
    public static final int MAX_ROLE_LENGTH = 64;

    /** Maximum user identifier length. */
    public static final int MAX_USER_LENGTH = 64;

    /** Maximum permission name length. */
    public static final int MAX_PERMISSION_LENGTH = 128;

    /** Maximum role description length. */
    public static final int MAX_DESCRIPTION_LENGTH = 256;

    private static final Pattern ROLE_OR_USER = Pattern.compile("^[A-Za-z0-9_.@-]{1,64}$");
    private static final Pattern PERMISSION = Pattern.compile("^[A-Za-z0-9_.:-]{1,128}$");

    private IdentifierRules() {
        // utility class
    }

    /** Validates a role name. */
    public static IdentifierValidationResult checkRole(String role) {
        return collect(errors -> checkInto(errors, "role", role, ROLE_OR_USER, MAX_ROLE_LENGTH));
    }

    /** Validates a user identifier. */
    public static IdentifierValidationResult checkUser(String user) {
        return collect(errors -> checkInto(errors, "user", user, ROLE_OR_USER, MAX_USER_LENGTH));
    }

    /** Validates a permission name. */
    public static IdentifierValidationResult checkPermission(String permission) {
        return collect(errors -> checkInto(errors, "permission", permission, PERMISSION, MAX_PERMISSION_LENGTH));
    }

    /** Validates a user/role pair, reporting both violations at once. */
    public static IdentifierValidationResult checkMembership(String user, String role) {
        return collect(errors -> {
            checkInto(errors, "user", user, ROLE_OR_USER, MAX_USER_LENGTH);
            checkInto(errors, "role", role, ROLE_OR_USER, MAX_ROLE_LENGTH);
        });
    }

    /** Validates a role/permission pair, reporting both violations at once. */
    public static IdentifierValidationResult checkGrant(String role, String permission) {
        return collect(errors -> {
            checkInto(errors, "role", role, ROLE_OR_USER, MAX_ROLE_LENGTH);
            checkInto(errors, "permission", permission, PERMISSION, MAX_PERMISSION_LENGTH);
        });
    }

    /** Validates an optional role description. */
    public static IdentifierValidationResult checkDescription(String description) {
        if (description != null && description.length() > MAX_DESCRIPTION_LENGTH) {
            return IdentifierValidationResult.fail(List.of(
                    "description must be at most %d characters".formatted(MAX_DESCRIPTION_LENGTH)));
        }
        return IdentifierValidationResult.ok();
    }

    /** Throws unless {@code role} is a valid role name. */
    public static String requireRole(String role) {
        checkRole(role).orThrow();
        return role;
    }

    /** Throws unless {@code user} is a valid user identifier. */
    public static String requireUser(String user) {
        checkUser(user).orThrow();
        return user;
    }

    /** Throws unless {@code permission} is a valid permission name. */
    public static String requirePermission(String permission) {
        checkPermission(permission).orThrow();
        return permission;
    }

    private static void checkInto(List<String> errors, String kind, String value, Pattern pattern, int max) {
        if (value == null || value.isEmpty()) {
            errors.add(kind + " must not be null or empty");
        } else if (value.length() > max) {
            errors.add("%s must be at most %d characters".formatted(kind, max));
        } else if (!pattern.matcher(value).matches()) {
            errors.add("%s contains characters outside %s".formatted(kind, pattern.pattern()));
        }
    }

    private static IdentifierValidationResult collect(Consumer<List<String>> checks) {
        List<String> errors = new ArrayList<>();
        checks.accept(errors);
        return errors.isEmpty() ? IdentifierValidationResult.ok() : IdentifierValidationResult.fail(errors);
    }
}
