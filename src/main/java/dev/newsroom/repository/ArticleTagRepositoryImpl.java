package dev.newsroom.repository;

import lombok.RequiredArgsConstructor;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
@RequiredArgsConstructor
public class ArticleTagRepositoryImpl implements ArticleTagRepository {

    private final R2dbcEntityTemplate r2dbcTemplate;

    private static final String FIND_ARTICLE_IDS =
            "SELECT article_id FROM article_tags WHERE tag_id = :tagId";

    private static final String EXISTS =
            "SELECT COUNT(*) AS cnt FROM article_tags WHERE article_id = :articleId AND tag_id = :tagId";

    private static final String INSERT_ARTICLE_TAG =
            "INSERT INTO article_tags (article_id, tag_id, created_at) VALUES (:articleId, :tagId, :createdAt) " +
            "ON CONFLICT (article_id, tag_id) DO NOTHING";

    private static final String DELETE_ARTICLE_TAG =
            "DELETE FROM article_tags WHERE article_id = :articleId AND tag_id = :tagId";

    private static final String DELETE_BY_ARTICLE_ID =
            "DELETE FROM article_tags WHERE article_id = :articleId";

    @Override
    public Flux<String> findArticleIdsByTagId(String tagId) {
        return r2dbcTemplate.getDatabaseClient()
                .sql(FIND_ARTICLE_IDS)
                .bind("tagId", tagId)
                .map((row, meta) -> row.get("article_id", String.class))
                .all();
    }

    @Override
    public Mono<Boolean> exists(String articleId, String tagId) {
        return r2dbcTemplate.getDatabaseClient()
                .sql(EXISTS)
                .bind("articleId", articleId)
                .bind("tagId", tagId)
                .map((row, meta) -> row.get("cnt", Long.class))
                .one()
                .map(count -> count != null && count > 0)
                .defaultIfEmpty(false);
    }

    @Override
    public Mono<Void> insertArticleTag(String articleId, String tagId) {
        return r2dbcTemplate.getDatabaseClient()
                .sql(INSERT_ARTICLE_TAG)
                .bind("articleId", articleId)
                .bind("tagId", tagId)
                .bind("createdAt", LocalDateTime.now())
                .fetch()
                .rowsUpdated()
                .then();
    }

    @Override
    public Mono<Long> deleteArticleTag(String articleId, String tagId) {
        return r2dbcTemplate.getDatabaseClient()
                .sql(DELETE_ARTICLE_TAG)
                .bind("articleId", articleId)
                .bind("tagId", tagId)
                .fetch()
                .rowsUpdated();
    }

    @Override
    public Mono<Void> deleteByArticleId(String articleId) {
        return r2dbcTemplate.getDatabaseClient()
                .sql(DELETE_BY_ARTICLE_ID)
                .bind("articleId", articleId)
                .fetch()
                .rowsUpdated()
                .then();
    }
}
