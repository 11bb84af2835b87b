package dev.newsroom.repository;

import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Article-tag many-to-many links. R2DBC has no join entities, so the SQL lives in
 * {@link ArticleTagRepositoryImpl} on top of DatabaseClient.
 */
@Repository
public interface ArticleTagRepository {

    Flux<String> findArticleIdsByTagId(String tagId);

    Mono<Boolean> exists(String articleId, String tagId);

    Mono<Void> insertArticleTag(String articleId, String tagId);

    /**
     * @return rows deleted
     */
    Mono<Long> deleteArticleTag(String articleId, String tagId);

    Mono<Void> deleteByArticleId(String articleId);
}
