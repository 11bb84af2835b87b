package dev.newsroom.service.media;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/**
 * Storage layout and size limit for article media, bound by {@code StorageConfig}.
 * Keys look like {@code articles/2024/05/{fileId}.png} for the default prefix.
 */
public record ArticleMediaSettings(String keyPrefix, long maxFileSize) {

    private static final DateTimeFormatter MONTH_PATH = DateTimeFormatter.ofPattern("yyyy/MM");

    public ArticleMediaSettings {
        if (keyPrefix == null || keyPrefix.isBlank()) {
            throw new IllegalArgumentException("Article media key prefix must not be blank");
        }
        keyPrefix = keyPrefix.trim().replaceAll("^/+|/+$", "");
        if (keyPrefix.isEmpty() || keyPrefix.contains("..")) {
            throw new IllegalArgumentException("Invalid article media key prefix: " + keyPrefix);
        }
        if (maxFileSize <= 0) {
            throw new IllegalArgumentException("Maximum article media size must be positive");
        }
    }

    public String storageKey(String fileId, String extension, LocalDate uploadDate) {
        return keyPrefix + "/" + uploadDate.format(MONTH_PATH) + "/" + fileId + "." + extension;
    }
}
