package dev.newsroom.repository;

import lombok.RequiredArgsConstructor;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.stream.IntStream;

@Repository
@RequiredArgsConstructor
public class ArticleMediaRepositoryImpl implements ArticleMediaRepository {

    private final R2dbcEntityTemplate r2dbcTemplate;

    private static final String DELETE_BY_KIND =
            "DELETE FROM article_media WHERE article_id = :articleId AND kind = :kind";

    private static final String INSERT_LINK =
            "INSERT INTO article_media (article_id, file_id, kind, position) " +
            "VALUES (:articleId, :fileId, :kind, :position)";

    private static final String DELETE_BY_ARTICLE_ID =
            "DELETE FROM article_media WHERE article_id = :articleId";

    @Override
    public Mono<Void> replaceLinks(String articleId, String kind, List<String> fileIds) {
        Mono<Long> clear = r2dbcTemplate.getDatabaseClient()
                .sql(DELETE_BY_KIND)
                .bind("articleId", articleId)
                .bind("kind", kind)
                .fetch()
                .rowsUpdated();

        return clear.thenMany(Flux.fromStream(IntStream.range(0, fileIds.size()).boxed()))
                .concatMap(position -> r2dbcTemplate.getDatabaseClient()
                        .sql(INSERT_LINK)
                        .bind("articleId", articleId)
                        .bind("fileId", fileIds.get(position))
                        .bind("kind", kind)
                        .bind("position", position)
                        .fetch()
                        .rowsUpdated())
                .then();
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
