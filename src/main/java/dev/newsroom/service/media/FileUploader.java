package dev.newsroom.service.media;

import reactor.core.publisher.Mono;

public interface FileUploader {

    /**
     * Stores the bytes and records the file.
     *
     * @return the stored file's ID, public URL and storage path
     */
    Mono<UploadedFile> uploadFile(byte[] content, String filename, String mimetype);
}
