package dev.newsroom.entity;

import java.util.Arrays;
import java.util.Optional;

/**
 * Article lifecycle states. Stored and rendered as the lowercase {@link #getValue() value}.
 */
public enum ArticleStatus {
    DRAFT("draft"),
    PUBLISHED("published"),
    ARCHIVED("archived");

    private final String value;

    ArticleStatus(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    public boolean matches(String status) {
        return value.equalsIgnoreCase(status);
    }

    public static Optional<ArticleStatus> from(String status) {
        if (status == null || status.isBlank()) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(s -> s.matches(status.trim()))
                .findFirst();
    }
}
