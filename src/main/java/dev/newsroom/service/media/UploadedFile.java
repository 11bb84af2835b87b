package dev.newsroom.service.media;

/**
 * Result of a single upload. {@code path} is the storage key and may be null.
 */
public record UploadedFile(String id, String url, String path) {
}
