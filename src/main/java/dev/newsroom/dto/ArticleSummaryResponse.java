package dev.newsroom.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.newsroom.entity.Article;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

/**
 * List item: an article without its content bodies, images or videos.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ArticleSummaryResponse {
    private String id;
    private String title;
    private String titleAr;
    private String summary;
    private String summaryAr;
    private String slug;
    private String slugAr;
    private String status;
    private String categoryId;
    private String authorId;
    private String authorEmail;
    private Integer views;
    private List<TagResponse> tags;
    private String featuredMediaId;
    private LocalDateTime publishedAt;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static ArticleSummaryResponse from(Article article) {
        return ArticleSummaryResponse.builder()
                .id(article.getId())
                .title(article.getTitle())
                .titleAr(article.getTitleAr())
                .summary(article.getSummary())
                .summaryAr(article.getSummaryAr())
                .slug(article.getSlug())
                .slugAr(article.getSlugAr())
                .status(article.getStatus())
                .categoryId(article.getCategoryId())
                .authorId(article.getAuthorId())
                .authorEmail(article.getAuthorEmail())
                .views(article.getViews())
                .tags(article.getTags() == null ? List.of()
                        : article.getTags().stream().map(TagResponse::from).toList())
                .featuredMediaId(article.getFeaturedMediaId())
                .publishedAt(article.getPublishedAt())
                .createdAt(article.getCreatedAt())
                .updatedAt(article.getUpdatedAt())
                .build();
    }
}
