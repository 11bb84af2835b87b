package dev.newsroom.service.storage;

import reactor.core.publisher.Mono;

/**
 * Abstraction for blob storage backends holding article images and videos.
 * Implementations: {@link LocalStorageProvider} (filesystem) and {@link S3StorageProvider}
 * (S3-compatible: MinIO, AWS S3, Cloudflare R2).
 */
public interface StorageProvider {

    /**
     * Store a file.
     *
     * @param key         the storage key (e.g., "articles/2026/01/uuid.jpg")
     * @param data        the file bytes
     * @param contentType the MIME type
     * @return the public URL of the stored file
     */
    Mono<String> store(String key, byte[] data, String contentType);

    /**
     * Delete a file by its storage key.
     */
    Mono<Void> delete(String key);

    /**
     * Get the public URL for a given storage key.
     */
    String getUrl(String key);

    /**
     * @return the storage type identifier (e.g., "LOCAL", "S3")
     */
    String getType();
}
