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
 * Multipart partial update. Null scalars are left untouched. The ID list fields keep their raw
 * form values (JSON array or comma-separated) for the array field parser.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ArticleUpdateRequest {
    private String title;
    private String titleAr;
    private String content;
    private String contentAr;
    private String summary;
    private String summaryAr;
    private String categoryId;

    @Builder.Default
    private List<String> tags = new ArrayList<>();

    @Builder.Default
    private List<String> removedImages = new ArrayList<>();

    @Builder.Default
    private List<String> removedVideos = new ArrayList<>();

    @Builder.Default
    private List<String> removedTags = new ArrayList<>();

    private MediaUpload featuredMedia;

    @Builder.Default
    private List<MediaUpload> images = new ArrayList<>();

    @Builder.Default
    private List<MediaUpload> videos = new ArrayList<>();

    public MediaBatch toMediaBatch() {
        return new MediaBatch(featuredMedia, images, videos);
    }
}
