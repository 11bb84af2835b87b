package dev.newsroom.entity;

import java.util.Arrays;
import java.util.Optional;

/**
 * Roles carried in the access token.
 * AUTHOR manages own articles only; EDITOR and ADMIN manage every article and its lifecycle.
 */
public enum UserRole {
    AUTHOR,
    EDITOR,
    ADMIN;

    /**
     * Check if the given role string matches this enum value.
     */
    public boolean matches(String role) {
        return this.name().equals(role);
    }

    public static Optional<UserRole> from(String role) {
        if (role == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(r -> r.matches(role))
                .findFirst();
    }
}
