package dev.newsroom.service.persistence;

import dev.newsroom.dto.PaginatedResponse;
import dev.newsroom.entity.Article;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Storage of articles with their tag and media links. Lookups of unknown articles fail with a
 * NOT_FOUND {@link dev.newsroom.exception.ArticleWorkflowException}.
 */
public interface ArticlePersistence {

    Mono<Article> create(CreateArticleCommand command);

    Mono<Article> update(UpdateArticleCommand command);

    Mono<Void> delete(String id);

    /**
     * @return the article with tags, images, videos and featured media populated
     */
    Mono<Article> getById(String id);

    /**
     * @param page 1-based page number
     */
    Mono<PaginatedResponse<Article>> list(ArticleFilters filters, int page, int limit, String sortBy, String sortOrder);

    Mono<SearchResult> search(SearchQuery query);

    /**
     * Archives every existing article that is not archived yet; other IDs are skipped.
     */
    Mono<ArchiveResult> archiveBatch(List<String> ids);

    /**
     * Moves an article back to draft.
     */
    Mono<Article> restore(String id);

    /**
     * Links existing tags to an article, skipping links that already exist.
     */
    Mono<Void> assignTags(String articleId, List<String> tagIds);

    Mono<Void> removeTag(String articleId, String tagId);
}
