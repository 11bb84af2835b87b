package dev.newsroom.service.persistence;

import lombok.Builder;
import lombok.Value;
import lombok.With;

@Value
@Builder
@With
public class ArticleFilters {
    String status;
    String categoryId;
    String tagId;
    String authorId;

    public static ArticleFilters none() {
        return ArticleFilters.builder().build();
    }
}
