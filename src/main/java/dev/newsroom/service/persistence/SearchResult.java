package dev.newsroom.service.persistence;

import dev.newsroom.entity.Article;

import java.util.List;

public record SearchResult(List<Article> data, int page, int pageSize, long totalResults, int totalPages) {

    public static SearchResult of(List<Article> data, int page, int pageSize, long totalResults) {
        int totalPages = pageSize > 0 ? (int) Math.ceil((double) totalResults / pageSize) : 0;
        return new SearchResult(data, page, pageSize, totalResults, totalPages);
    }
}
