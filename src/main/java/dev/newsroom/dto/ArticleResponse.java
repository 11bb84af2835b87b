package dev.newsroom.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.newsroom.entity.Article;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ArticleResponse {
    private String id;
    private String title;
    private String titleAr;
    private String content;
    private String contentAr;
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
    private List<MediaFileResponse> images;
    private List<MediaFileResponse> videos;
    private MediaFileResponse featuredMedia;
    private LocalDateTime publishedAt;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static ArticleResponse from(Article article) {
        return ArticleResponse.builder()
                .id(article.getId())
                .title(article.getTitle())
                .titleAr(article.getTitleAr())
                .content(article.getContent())
                .contentAr(article.getContentAr())
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
                .images(article.getImages() == null ? List.of()
                        : article.getImages().stream().map(MediaFileResponse::from).toList())
                .videos(article.getVideos() == null ? List.of()
                        : article.getVideos().stream().map(MediaFileResponse::from).toList())
                .featuredMedia(MediaFileResponse.from(article.getFeaturedMedia()))
                .publishedAt(article.getPublishedAt())
                .createdAt(article.getCreatedAt())
                .updatedAt(article.getUpdatedAt())
                .build();
    }
}
