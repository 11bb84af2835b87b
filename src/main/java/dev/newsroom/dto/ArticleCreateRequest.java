package dev.newsroom.dto;

import dev.newsroom.service.media.MediaBatch;
import dev.newsroom.service.media.MediaUpload;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Multipart create form. {@code tags} holds the raw inline tag JSON values and {@code tagIds}
 * the raw existing tag ID values; both are parsed by the service before anything is persisted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ArticleCreateRequest {
    private String title;
    private String titleAr;
    private String content;
    private String contentAr;
    private String summary;
    private String summaryAr;
    private String categoryId;
    private String status;

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    @Builder.Default
    private List<String> tagIds = new ArrayList<>();

    private MediaUpload featuredMedia;

    @Builder.Default
    private List<MediaUpload> images = new ArrayList<>();

    @Builder.Default
    private List<MediaUpload> videos = new ArrayList<>();

    public MediaBatch toMediaBatch() {
        return new MediaBatch(featuredMedia, images, videos);
    }
}
