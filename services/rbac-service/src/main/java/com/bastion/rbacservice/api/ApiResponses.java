package com.bastion.rbacservice.api;

import java.util.Collection;
import java.util.List;

/** Response bodies shared by the RBAC endpoints. */
public final class ApiResponses {

    private ApiResponses() {
        // holder
    }

    /** Answer of a boolean operation: {@code {"result": true}}. */
    public record BooleanResult(boolean result) {}

    /** Answer of a listing: {@code {"items": [...]}}. */
    public record Items<T>(List<T> items) {

        public static <T> Items<T> of(Collection<T> items) {
            return new Items<>(List.copyOf(items));
        }
    }
}
