package dev.newsroom.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Transient;
import org.springframework.data.domain.Persistable;
import org.springframework.data.relational.core.mapping.Column;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

@Table("articles")
@Getter
@Setter
@ToString(exclude = {"content", "contentAr", "tags", "images", "videos"})
@EqualsAndHashCode(of = "id")
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Article implements Persistable<String>, NewRecordAware {

    @Id
    private String id;

    @Transient
    @Builder.Default
    private boolean newRecord = true;

    @Override
    public boolean isNew() {
        return newRecord;
    }

    private String title;

    @Column("title_ar")
    private String titleAr;

    private String content;

    @Column("content_ar")
    private String contentAr;

    private String summary;

    @Column("summary_ar")
    private String summaryAr;

    private String slug;

    @Column("slug_ar")
    private String slugAr;

    @Builder.Default
    private String status = ArticleStatus.DRAFT.getValue();

    @Column("category_id")
    private String categoryId;

    @Column("author_id")
    private String authorId;

    @Column("author_email")
    private String authorEmail;

    @Column("featured_media_id")
    private String featuredMediaId;

    @Builder.Default
    private Integer views = 0;

    @Column("published_at")
    private LocalDateTime publishedAt;

    @Column("created_at")
    private LocalDateTime createdAt;

    @Column("updated_at")
    private LocalDateTime updatedAt;

    @Transient
    @Builder.Default
    private Set<Tag> tags = new LinkedHashSet<>();

    @Transient
    @Builder.Default
    private List<MediaFile> images = new ArrayList<>();

    @Transient
    @Builder.Default
    private List<MediaFile> videos = new ArrayList<>();

    @Transient
    private MediaFile featuredMedia;

    public boolean hasStatus(ArticleStatus candidate) {
        return candidate.matches(this.status);
    }

    public boolean isOwnedBy(String userId) {
        return authorId != null && authorId.equals(userId);
    }
}
