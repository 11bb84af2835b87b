package dev.newsroom.service.media;

import dev.newsroom.config.RequestIdFilter;
import dev.newsroom.entity.MediaFile;
import dev.newsroom.metrics.ArticleWorkflowMetrics;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

/**
 * Uploads the files of one article and deletes files on a best-effort basis.
 *
 * <p>Groups run in sequence (featured, images, videos); files inside a group upload concurrently
 * and keep their input order. The first failure cancels the rest of the batch and is propagated
 * unchanged. Files already stored when a batch fails are not removed.</p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MediaUploadCoordinator {

    private final FileUploader fileUploader;
    private final FileDeleter fileDeleter;
    private final ArticleWorkflowMetrics metrics;

    public Mono<UploadedMedia> uploadAll(MediaBatch batch) {
        if (batch == null || batch.isEmpty()) {
            return Mono.just(UploadedMedia.none());
        }
        Mono<List<MediaFile>> featured = uploadGroup(
                batch.featured() == null ? List.of() : List.of(batch.featured()), "featured");

        return featured.flatMap(featuredFiles -> uploadGroup(batch.images(), "image")
                .flatMap(images -> uploadGroup(batch.videos(), "video")
                        .map(videos -> new UploadedMedia(
                                featuredFiles.isEmpty() ? null : featuredFiles.get(0),
                                images,
                                videos))));
    }

    private Mono<List<MediaFile>> uploadGroup(List<MediaUpload> uploads, String kind) {
        return Flux.fromIterable(uploads)
                .filter(MediaUpload::hasContent)
                .flatMapSequential(upload -> uploadOne(upload, kind))
                .collectList();
    }

    private Mono<MediaFile> uploadOne(MediaUpload upload, String kind) {
        return Mono.deferContextual(context -> {
            String requestId = RequestIdFilter.requestId(context);
            return fileUploader.uploadFile(upload.content(), upload.filename(), upload.mimetype())
                    .map(uploaded -> toMediaFile(uploaded, upload))
                    .doOnNext(file -> {
                        metrics.incrementMediaUploaded(kind);
                        log.debug("[{}] Uploaded {} file: id={}, filename={}",
                                requestId, kind, file.getId(), file.getFilename());
                    })
                    .doOnError(e -> log.warn("[{}] Upload of {} file '{}' failed: {}",
                            requestId, kind, upload.filename(), e.getMessage()));
        });
    }

    private MediaFile toMediaFile(UploadedFile uploaded, MediaUpload upload) {
        LocalDateTime now = LocalDateTime.now();
        return MediaFile.builder()
                .id(uploaded.id())
                .url(uploaded.url())
                .filename(upload.filename())
                .mimetype(upload.mimetype())
                .size(upload.size())
                .path(uploaded.path() != null ? uploaded.path() : "")
                .createdAt(now)
                .updatedAt(now)
                .newRecord(false)
                .build();
    }

    /**
     * Deletes each file, logging and counting failures. Never fails.
     *
     * @param label what the files are, for log lines (e.g. "removed image")
     */
    public Mono<Void> deleteBestEffort(Collection<String> fileIds, String label) {
        if (fileIds == null || fileIds.isEmpty()) {
            return Mono.empty();
        }
        return Mono.deferContextual(context -> {
            String requestId = RequestIdFilter.requestId(context);
            return Flux.fromIterable(fileIds)
                    .concatMap(fileId -> fileDeleter.deleteFile(fileId)
                            .doOnSuccess(done -> log.debug("[{}] Deleted {} file {}", requestId, label, fileId))
                            .onErrorResume(e -> {
                                log.warn("[{}] Failed to delete {} file {}: {}",
                                        requestId, label, fileId, e.getMessage());
                                metrics.incrementMediaDeleteFailed();
                                return Mono.empty();
                            }))
                    .then();
        });
    }
}
