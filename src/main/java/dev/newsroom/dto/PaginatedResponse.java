package dev.newsroom.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.function.Function;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaginatedResponse<T> {
    private List<T> data;
    private PageMetadata metadata;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PageMetadata {
        private long total;
        private int page;
        private int limit;
        private int totalPages;
    }

    /**
     * Builds a page from its items and a 1-based page number.
     */
    public static <T> PaginatedResponse<T> of(List<T> data, int page, int limit, long total) {
        int totalPages = limit > 0 ? (int) Math.ceil((double) total / limit) : 0;
        return PaginatedResponse.<T>builder()
                .data(data)
                .metadata(PageMetadata.builder()
                        .total(total)
                        .page(page)
                        .limit(limit)
                        .totalPages(totalPages)
                        .build())
                .build();
    }

    public <R> PaginatedResponse<R> map(Function<? super T, ? extends R> mapper) {
        List<R> mapped = data.stream().<R>map(mapper).toList();
        return PaginatedResponse.<R>builder()
                .data(mapped)
                .metadata(metadata)
                .build();
    }
}
