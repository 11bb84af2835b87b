package dev.newsroom.service.persistence;

import dev.newsroom.entity.MediaFile;
import dev.newsroom.entity.Tag;
import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Changes to apply to an existing article. A null field leaves the stored value untouched;
 * non-null {@code tags}, {@code images} and {@code videos} replace the whole collection.
 */
@Value
@Builder(toBuilder = true)
public class UpdateArticleCommand {
    String id;
    String title;
    String titleAr;
    String content;
    String contentAr;
    String summary;
    String summaryAr;
    String categoryId;
    String status;
    LocalDateTime publishedAt;
    List<Tag> tags;
    List<String> tagsToRemove;
    List<MediaFile> images;
    List<MediaFile> videos;
    MediaFile featuredMedia;
}
