package dev.newsroom.repository;

import dev.newsroom.entity.Tag;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.r2dbc.repository.R2dbcRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface TagRepository extends R2dbcRepository<Tag, String> {

    @Query("SELECT t.* FROM tags t " +
           "JOIN article_tags at ON t.id = at.tag_id " +
           "WHERE at.article_id = :articleId " +
           "ORDER BY at.created_at, t.name")
    Flux<Tag> findByArticleId(String articleId);
}
