package dev.newsroom.service.media;

import reactor.core.publisher.Mono;

public interface FileDeleter {

    /**
     * Removes the stored bytes and the file record. Fails with NOT_FOUND for an unknown ID.
     */
    Mono<Void> deleteFile(String fileId);
}
