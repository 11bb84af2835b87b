package dev.newsroom.repository;

import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Ordered article-media links (table article_media). Kind is "image" or "video".
 */
@Repository
public interface ArticleMediaRepository {

    String KIND_IMAGE = "image";
    String KIND_VIDEO = "video";

    /**
     * Replaces every link of the given kind with {@code fileIds}, positions following list order.
     */
    Mono<Void> replaceLinks(String articleId, String kind, List<String> fileIds);

    Mono<Void> deleteByArticleId(String articleId);
}
