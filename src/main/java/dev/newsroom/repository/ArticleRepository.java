package dev.newsroom.repository;

import dev.newsroom.entity.Article;
import org.springframework.data.r2dbc.repository.Modifying;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.r2dbc.repository.R2dbcRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface ArticleRepository extends R2dbcRepository<Article, String> {

    String MATCHES_QUERY = "(LOWER(title) LIKE LOWER(CONCAT('%', :query, '%')) OR " +
            "LOWER(title_ar) LIKE LOWER(CONCAT('%', :query, '%')) OR " +
            "LOWER(summary) LIKE LOWER(CONCAT('%', :query, '%')) OR " +
            "LOWER(summary_ar) LIKE LOWER(CONCAT('%', :query, '%')) OR " +
            "LOWER(content) LIKE LOWER(CONCAT('%', :query, '%')) OR " +
            "LOWER(content_ar) LIKE LOWER(CONCAT('%', :query, '%')))";

    @Query("SELECT * FROM articles WHERE " + MATCHES_QUERY +
           " ORDER BY created_at DESC LIMIT :limit OFFSET :offset")
    Flux<Article> search(String query, int limit, long offset);

    @Query("SELECT COUNT(*) FROM articles WHERE " + MATCHES_QUERY)
    Mono<Long> countSearch(String query);

    @Query("SELECT * FROM articles WHERE status = :status AND " + MATCHES_QUERY +
           " ORDER BY created_at DESC LIMIT :limit OFFSET :offset")
    Flux<Article> searchByStatus(String query, String status, int limit, long offset);

    @Query("SELECT COUNT(*) FROM articles WHERE status = :status AND " + MATCHES_QUERY)
    Mono<Long> countSearchByStatus(String query, String status);

    /**
     * Archives the article unless it is already archived.
     *
     * @return rows updated, 0 when the article is missing or already archived
     */
    @Modifying
    @Query("UPDATE articles SET status = 'archived', updated_at = :now WHERE id = :id AND status <> 'archived'")
    Mono<Integer> archiveIfEligible(String id, LocalDateTime now);

    @Modifying
    @Query("UPDATE articles SET status = 'draft', updated_at = :now WHERE id = :id")
    Mono<Integer> restoreToDraft(String id, LocalDateTime now);
}
