package dev.newsroom.service.storage;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Local filesystem storage provider.
 * Stores files under the configured upload directory, served at {siteUrl}/images/{key}.
 */
@Slf4j
public class LocalStorageProvider implements StorageProvider {

    private final Path uploadRoot;
    private final String siteUrl;

    public LocalStorageProvider(String uploadPath, String siteUrl) {
        this.uploadRoot = Paths.get(uploadPath).toAbsolutePath().normalize();
        this.siteUrl = siteUrl.endsWith("/") ? siteUrl.substring(0, siteUrl.length() - 1) : siteUrl;
        log.info("LocalStorageProvider initialized: uploadPath={}", uploadRoot);
    }

    @Override
    public Mono<String> store(String key, byte[] data, String contentType) {
        return Mono.fromCallable(() -> {
            Path filePath = resolveInsideRoot(key);
            Files.createDirectories(filePath.getParent());
            Files.write(filePath, data);
            log.info("File stored locally: {} ({} bytes, {})", filePath, data.length, contentType);
            return getUrl(key);
        }).subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<Void> delete(String key) {
        return Mono.fromCallable(() -> {
            Path filePath = resolveInsideRoot(key);
            if (Files.deleteIfExists(filePath)) {
                log.info("File deleted: {}", filePath);
            } else {
                log.warn("File not found for deletion: {}", filePath);
            }
            return filePath;
        }).subscribeOn(Schedulers.boundedElastic()).then();
    }

    @Override
    public String getUrl(String key) {
        return siteUrl + "/images/" + key;
    }

    @Override
    public String getType() {
        return "LOCAL";
    }

    private Path resolveInsideRoot(String key) {
        Path filePath = uploadRoot.resolve(key).normalize();
        // Prevent path traversal
        if (!filePath.startsWith(uploadRoot)) {
            throw new IllegalArgumentException("Storage key escapes the upload directory: " + key);
        }
        return filePath;
    }
}
