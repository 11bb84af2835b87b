package dev.newsroom.service.media;

import dev.newsroom.entity.MediaFile;

import java.util.List;

/**
 * Files uploaded for one article, in upload order. {@code featured} is null when none was uploaded.
 */
public record UploadedMedia(MediaFile featured, List<MediaFile> images, List<MediaFile> videos) {

    public UploadedMedia {
        images = images == null ? List.of() : List.copyOf(images);
        videos = videos == null ? List.of() : List.copyOf(videos);
    }

    public static UploadedMedia none() {
        return new UploadedMedia(null, List.of(), List.of());
    }

    public boolean hasFeatured() {
        return featured != null;
    }
}
