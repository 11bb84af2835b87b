package dev.newsroom.service.persistence;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * Core fields of a new article. Tags and media are attached afterwards with an update.
 */
@Value
@Builder
public class CreateArticleCommand {
    String title;
    String titleAr;
    String content;
    String contentAr;
    String summary;
    String summaryAr;
    String categoryId;
    String status;
    LocalDateTime publishedAt;
    String authorId;
    String authorEmail;
}
