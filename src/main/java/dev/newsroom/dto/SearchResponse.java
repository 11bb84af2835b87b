package dev.newsroom.dto;

import dev.newsroom.service.persistence.SearchResult;

import java.util.List;

public record SearchResponse(List<ArticleSummaryResponse> data, int page, int pageSize,
                             long totalResults, int totalPages) {

    public static SearchResponse from(SearchResult result) {
        return new SearchResponse(
                result.data().stream().map(ArticleSummaryResponse::from).toList(),
                result.page(),
                result.pageSize(),
                result.totalResults(),
                result.totalPages());
    }
}
