package dev.newsroom.security;

import dev.newsroom.entity.UserRole;

/**
 * The caller identity resolved from the access token. Passed explicitly into every service call.
 */
public record AuthenticatedUser(String id, String email, UserRole role) {

    public boolean hasAnyRole(UserRole... roles) {
        for (UserRole candidate : roles) {
            if (candidate == role) {
                return true;
            }
        }
        return false;
    }

    public boolean isAuthor() {
        return role == UserRole.AUTHOR;
    }
}
