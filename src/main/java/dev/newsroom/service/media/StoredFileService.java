package dev.newsroom.service.media;

import dev.newsroom.entity.MediaFile;
import dev.newsroom.exception.ArticleWorkflowException;
import dev.newsroom.repository.MediaFileRepository;
import dev.newsroom.service.IdService;
import dev.newsroom.service.storage.StorageProvider;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Locale;
import java.util.Map;

/**
 * Article media uploads.
 * Validates files, stores them via the configured StorageProvider,
 * and tracks metadata in the media_files table.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StoredFileService implements FileUploader, FileDeleter {

    private final StorageProvider storageProvider;
    private final MediaFileRepository mediaFileRepository;
    private final IdService idService;
    private final ArticleMediaSettings settings;

    private static final Map<String, String> EXTENSIONS_BY_TYPE = Map.of(
            "image/jpeg", "jpg",
            "image/png", "png",
            "image/gif", "gif",
            "image/webp", "webp",
            "video/mp4", "mp4",
            "video/webm", "webm",
            "video/quicktime", "mov"
    );

    @Override
    public Mono<UploadedFile> uploadFile(byte[] content, String filename, String mimetype) {
        return Mono.defer(() -> {
            String contentType = mimetype == null ? "" : mimetype.toLowerCase(Locale.ROOT);
            validate(content, filename, contentType);

            String extension = EXTENSIONS_BY_TYPE.get(contentType);
            String fileId = idService.nextId();
            String storageKey = settings.storageKey(fileId, extension, LocalDate.now());

            return storageProvider.store(storageKey, content, contentType)
                    .flatMap(url -> {
                        LocalDateTime now = LocalDateTime.now();
                        MediaFile file = MediaFile.builder()
                                .id(fileId)
                                .url(url)
                                .filename(filename)
                                .mimetype(contentType)
                                .size((long) content.length)
                                .path(storageKey)
                                .createdAt(now)
                                .updatedAt(now)
                                .newRecord(true)
                                .build();
                        return mediaFileRepository.save(file);
                    })
                    .doOnSuccess(saved -> log.info("Media file stored: id={}, key={}, size={} bytes",
                            fileId, storageKey, content.length))
                    .map(saved -> new UploadedFile(saved.getId(), saved.getUrl(), saved.getPath()));
        });
    }

    @Override
    public Mono<Void> deleteFile(String fileId) {
        return mediaFileRepository.findById(fileId)
                .switchIfEmpty(Mono.error(ArticleWorkflowException.notFound("Media file with ID " + fileId + " not found")))
                .flatMap(file -> deleteBlob(file)
                        .then(mediaFileRepository.delete(file))
                        .doOnSuccess(done -> log.info("Media file deleted: id={}, key={}", fileId, file.getPath())));
    }

    private Mono<Void> deleteBlob(MediaFile file) {
        if (file.getPath() == null || file.getPath().isBlank()) {
            return Mono.empty();
        }
        return storageProvider.delete(file.getPath());
    }

    // ============================
    // Private helpers
    // ============================

    private void validate(byte[] content, String filename, String contentType) {
        // Validate filename for path traversal
        if (filename == null || filename.isBlank() ||
                filename.contains("..") || filename.contains("/") ||
                filename.contains("\\") || filename.contains("\0")) {
            throw ArticleWorkflowException.badRequest("Invalid filename");
        }
        if (!EXTENSIONS_BY_TYPE.containsKey(contentType)) {
            throw ArticleWorkflowException.badRequest("Unsupported file type: " + contentType);
        }
        if (content == null || content.length == 0) {
            throw ArticleWorkflowException.badRequest("File is empty: " + filename);
        }
        if (content.length > settings.maxFileSize()) {
            throw ArticleWorkflowException.badRequest(
                    "File size exceeds maximum allowed: " + settings.maxFileSize() + " bytes");
        }
        if (!isValidMagicBytes(content, contentType)) {
            throw ArticleWorkflowException.badRequest("File content does not match declared type");
        }
    }

    static boolean isValidMagicBytes(byte[] bytes, String contentType) {
        if (bytes.length < 12) return false;

        return switch (contentType) {
            case "image/jpeg" ->
                    bytes[0] == (byte) 0xFF && bytes[1] == (byte) 0xD8 && bytes[2] == (byte) 0xFF;
            case "image/png" ->
                    bytes[0] == (byte) 0x89 && bytes[1] == 0x50 && bytes[2] == 0x4E && bytes[3] == 0x47
                            && bytes[4] == 0x0D && bytes[5] == 0x0A && bytes[6] == 0x1A && bytes[7] == 0x0A;
            case "image/gif" ->
                    bytes[0] == 0x47 && bytes[1] == 0x49 && bytes[2] == 0x46 && bytes[3] == 0x38;
            case "image/webp" ->
                    bytes[0] == 0x52 && bytes[1] == 0x49 && bytes[2] == 0x46 && bytes[3] == 0x46
                            && bytes[8] == 0x57 && bytes[9] == 0x45 && bytes[10] == 0x42 && bytes[11] == 0x50;
            // ISO base media: "ftyp" box at offset 4
            case "video/mp4", "video/quicktime" ->
                    bytes[4] == 0x66 && bytes[5] == 0x74 && bytes[6] == 0x79 && bytes[7] == 0x70;
            // EBML header
            case "video/webm" ->
                    bytes[0] == 0x1A && bytes[1] == 0x45 && bytes[2] == (byte) 0xDF && bytes[3] == (byte) 0xA3;
            default -> false;
        };
    }
}
