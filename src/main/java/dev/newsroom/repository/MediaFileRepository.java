package dev.newsroom.repository;

import dev.newsroom.entity.MediaFile;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.r2dbc.repository.R2dbcRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface MediaFileRepository extends R2dbcRepository<MediaFile, String> {

    /**
     * Media attached to an article under the given kind ("image" or "video"), in attachment order.
     */
    @Query("SELECT mf.* FROM media_files mf " +
           "JOIN article_media am ON am.file_id = mf.id " +
           "WHERE am.article_id = :articleId AND am.kind = :kind " +
           "ORDER BY am.position")
    Flux<MediaFile> findByArticleIdAndKind(String articleId, String kind);
}
