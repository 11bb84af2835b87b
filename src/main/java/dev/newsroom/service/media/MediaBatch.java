package dev.newsroom.service.media;

import java.util.List;

/**
 * Files to upload for one article: at most one featured file, any number of images and videos.
 */
public record MediaBatch(MediaUpload featured, List<MediaUpload> images, List<MediaUpload> videos) {

    public MediaBatch {
        images = images == null ? List.of() : List.copyOf(images);
        videos = videos == null ? List.of() : List.copyOf(videos);
    }

    public static MediaBatch empty() {
        return new MediaBatch(null, List.of(), List.of());
    }

    public boolean isEmpty() {
        return (featured == null || !featured.hasContent())
                && images.stream().noneMatch(MediaUpload::hasContent)
                && videos.stream().noneMatch(MediaUpload::hasContent);
    }
}
