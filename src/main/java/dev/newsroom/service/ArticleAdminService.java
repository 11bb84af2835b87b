package dev.newsroom.service;

import dev.newsroom.config.RequestIdFilter;
import dev.newsroom.dto.ArticleCreateRequest;
import dev.newsroom.dto.ArticleUpdateRequest;
import dev.newsroom.dto.InlineTagSpec;
import dev.newsroom.dto.PaginatedResponse;
import dev.newsroom.entity.Article;
import dev.newsroom.entity.ArticleStatus;
import dev.newsroom.entity.MediaFile;
import dev.newsroom.entity.UserRole;
import dev.newsroom.exception.ArticleWorkflowException;
import dev.newsroom.exception.ErrorKind;
import dev.newsroom.metrics.ArticleWorkflowMetrics;
import dev.newsroom.security.AuthenticatedUser;
import dev.newsroom.service.media.MediaBatch;
import dev.newsroom.service.media.MediaUploadCoordinator;
import dev.newsroom.service.media.UploadedMedia;
import dev.newsroom.service.persistence.ArchiveResult;
import dev.newsroom.service.persistence.ArticleFilters;
import dev.newsroom.service.persistence.ArticlePersistence;
import dev.newsroom.service.persistence.CreateArticleCommand;
import dev.newsroom.service.persistence.SearchQuery;
import dev.newsroom.service.persistence.SearchResult;
import dev.newsroom.service.persistence.UpdateArticleCommand;
import dev.newsroom.util.ArrayFieldParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.util.context.Context;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Admin article workflows: create/update with tag resolution and media upload, the lifecycle
 * transitions, listing, search and tag assignment. Every entry point takes the caller explicitly.
 *
 * <p>Create persists a skeleton article first to get an ID, then resolves tags, uploads media and
 * writes both in a single update. If anything after the skeleton fails (or the request is
 * cancelled before the enriched update lands) the skeleton is deleted. That deletion is the only
 * compensation: uploaded files and inline-created tags are left in place.</p>
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ArticleAdminService {

    static final Set<String> SORTABLE_FIELDS = Set.of("createdAt", "updatedAt", "publishedAt", "title", "views");
    static final int MAX_PAGE_SIZE = 100;

    private final ArticlePersistence persistence;
    private final TagResolver tagResolver;
    private final MediaUploadCoordinator mediaUploadCoordinator;
    private final ArticleMutationMerger mutationMerger;
    private final ArticleAccessPolicy accessPolicy;
    private final ArrayFieldParser arrayFieldParser;
    private final ArticleWorkflowMetrics metrics;

    // ==================== CREATE / UPDATE ====================

    public Mono<Article> createArticle(ArticleCreateRequest request, AuthenticatedUser user) {
        return Mono.defer(() -> {
                    accessPolicy.requireAnyRole(user);
                    List<InlineTagSpec> inlineSpecs = arrayFieldParser.parseInlineTags(request.getTags());
                    List<String> tagIds = arrayFieldParser.parseDistinctIds(request.getTagIds());
                    TagResolver.requireNames(inlineSpecs);
                    requireTitles(request.getTitle(), request.getTitleAr());
                    ArticleStatus status = initialStatus(request.getStatus(), user);

                    CreateArticleCommand command = CreateArticleCommand.builder()
                            .title(request.getTitle().trim())
                            .titleAr(request.getTitleAr().trim())
                            .content(request.getContent())
                            .contentAr(request.getContentAr())
                            .summary(request.getSummary())
                            .summaryAr(request.getSummaryAr())
                            .categoryId(blankToNull(request.getCategoryId()))
                            .status(status.getValue())
                            .publishedAt(status == ArticleStatus.PUBLISHED ? LocalDateTime.now() : null)
                            .authorId(user.id())
                            .authorEmail(user.email())
                            .build();

                    return persistence.create(command)
                            .flatMap(skeleton -> enrichSkeleton(skeleton.getId(), tagIds, inlineSpecs,
                                    request.toMediaBatch()));
                })
                .doOnSuccess(article -> {
                    metrics.incrementArticleCreated();
                    log.info("Article created: id={}, author={}", article.getId(), user.id());
                })
                .onErrorMap(e -> ArticleWorkflowException.wrap(e, "Failed to create article", Set.of()));
    }

    private Mono<Article> enrichSkeleton(String articleId, List<String> tagIds,
                                         List<InlineTagSpec> inlineSpecs, MediaBatch media) {
        return Mono.deferContextual(context -> {
            String requestId = RequestIdFilter.requestId(context);
            AtomicBoolean settled = new AtomicBoolean(false);

            return tagResolver.resolve(tagIds, inlineSpecs)
                    .flatMap(tags -> mediaUploadCoordinator.uploadAll(media)
                            .flatMap(uploaded -> persistence.update(UpdateArticleCommand.builder()
                                    .id(articleId)
                                    .tags(tags)
                                    .images(uploaded.images())
                                    .videos(uploaded.videos())
                                    .featuredMedia(uploaded.featured())
                                    .build())))
                    .doOnNext(enriched -> settled.set(true))
                    .onErrorResume(error -> settled.compareAndSet(false, true)
                            ? compensate(articleId, error, requestId)
                            : Mono.error(error))
                    .doOnCancel(() -> {
                        if (settled.compareAndSet(false, true)) {
                            compensateCancelled(articleId, requestId, RequestIdFilter.propagate(context));
                        }
                    })
                    .then(Mono.defer(() -> persistence.getById(articleId)));
        });
    }

    private Mono<Article> compensate(String articleId, Throwable error, String requestId) {
        log.warn("[{}] Create of article {} failed after skeleton was persisted, deleting skeleton: {}",
                requestId, articleId, error.getMessage());

        return persistence.delete(articleId)
                .doOnSuccess(done -> metrics.incrementCompensated())
                .onErrorResume(deleteError -> {
                    log.error("[{}] Compensation failed: skeleton article {} could not be deleted",
                            requestId, articleId, deleteError);
                    metrics.incrementCompensationFailed();
                    error.addSuppressed(deleteError);
                    return Mono.empty();
                })
                .then(Mono.<Article>error(error));
    }

    /**
     * The caller is gone, so the delete runs detached; it keeps the request context for its own logs.
     */
    private void compensateCancelled(String articleId, String requestId, Context requestContext) {
        log.warn("[{}] Create of article {} cancelled before completion, deleting skeleton", requestId, articleId);
        persistence.delete(articleId)
                .contextWrite(requestContext)
                .subscribe(
                        done -> { },
                        error -> {
                            log.error("[{}] Failed to delete skeleton article {} after cancellation",
                                    requestId, articleId, error);
                            metrics.incrementCompensationFailed();
                        },
                        metrics::incrementCompensated);
    }

    public Mono<Article> updateArticle(String id, ArticleUpdateRequest request, AuthenticatedUser user) {
        return Mono.defer(() -> {
                    accessPolicy.requireAnyRole(user);
                    requireNotBlank(request.getTitle(), "Title cannot be blank");
                    requireNotBlank(request.getTitleAr(), "Arabic title cannot be blank");
                    return persistence.getById(id);
                })
                .flatMap(existing -> {
                    accessPolicy.requireCanAccess(user, existing);
                    List<String> removedImages = ownedIds(existing.getImages(),
                            arrayFieldParser.parseIds(request.getRemovedImages()));
                    List<String> removedVideos = ownedIds(existing.getVideos(),
                            arrayFieldParser.parseIds(request.getRemovedVideos()));

                    return mediaUploadCoordinator.deleteBestEffort(removedImages, "removed image")
                            .then(mediaUploadCoordinator.deleteBestEffort(removedVideos, "removed video"))
                            .then(Mono.defer(() -> mediaUploadCoordinator.uploadAll(request.toMediaBatch())))
                            .flatMap(uploaded -> replaceFeatured(existing, uploaded).thenReturn(uploaded))
                            .map(uploaded -> mutationMerger.merge(existing, request, uploaded))
                            .flatMap(command -> persistence.update(command))
                            .then(Mono.defer(() -> persistence.getById(id)));
                })
                .doOnSuccess(article -> log.info("Article updated: id={}, by={}", id, user.id()))
                .onErrorMap(e -> ArticleWorkflowException.wrap(e, "Failed to update article", Set.of()));
    }

    private Mono<Void> replaceFeatured(Article existing, UploadedMedia uploaded) {
        if (!uploaded.hasFeatured() || existing.getFeaturedMediaId() == null) {
            return Mono.empty();
        }
        return mediaUploadCoordinator.deleteBestEffort(List.of(existing.getFeaturedMediaId()), "replaced featured");
    }

    // ==================== READ ====================

    public Mono<Article> getArticle(String id, AuthenticatedUser user) {
        return Mono.defer(() -> {
                    accessPolicy.requireAnyRole(user);
                    log.debug("Fetching article id={} for user={}", id, user.id());
                    return persistence.getById(id);
                })
                .doOnNext(article -> accessPolicy.requireCanAccess(user, article))
                .onErrorMap(e -> ArticleWorkflowException.wrap(e, ErrorKind.INTERNAL,
                        "An unexpected error occurred while fetching the article", Set.of(ErrorKind.NOT_FOUND)));
    }

    /**
     * @param page 1-based
     */
    public Mono<PaginatedResponse<Article>> listArticles(ArticleFilters filters, int page, int limit,
                                                        String sortBy, String sortOrder, AuthenticatedUser user) {
        return Mono.defer(() -> {
                    accessPolicy.requireAnyRole(user);
                    requirePaging(page, limit);
                    String sortField = sortBy == null || sortBy.isBlank() ? "createdAt" : sortBy;
                    if (!SORTABLE_FIELDS.contains(sortField)) {
                        throw ArticleWorkflowException.badRequest("Invalid sort field: " + sortBy);
                    }
                    String order = sortOrder == null || sortOrder.isBlank() ? "desc" : sortOrder.toLowerCase(Locale.ROOT);
                    if (!order.equals("asc") && !order.equals("desc")) {
                        throw ArticleWorkflowException.badRequest("Invalid sort order: " + sortOrder);
                    }
                    ArticleFilters effective = accessPolicy.scope(user, normalizeFilters(filters));
                    log.debug("Listing articles: filters={}, page={}, limit={}, sort={} {}", effective, page, limit, sortField, order);
                    return persistence.list(effective, page, limit, sortField, order);
                })
                .map(result -> user.isAuthor() ? ownPageOnly(result, user, page, limit) : result)
                .onErrorMap(e -> ArticleWorkflowException.wrap(e, ErrorKind.INTERNAL,
                        "Failed to fetch articles", Set.of(ErrorKind.BAD_REQUEST)));
    }

    private PaginatedResponse<Article> ownPageOnly(PaginatedResponse<Article> result, AuthenticatedUser user,
                                                   int page, int limit) {
        List<Article> own = result.getData().stream()
                .filter(article -> article.isOwnedBy(user.id()))
                .toList();
        return PaginatedResponse.of(own, page, limit, own.size());
    }

    private ArticleFilters normalizeFilters(ArticleFilters filters) {
        ArticleFilters source = filters != null ? filters : ArticleFilters.none();
        String status = blankToNull(source.getStatus());
        if (status != null && ArticleStatus.from(status).isEmpty()) {
            throw ArticleWorkflowException.badRequest("Invalid status: " + status);
        }
        return ArticleFilters.builder()
                .status(status)
                .categoryId(blankToNull(source.getCategoryId()))
                .tagId(blankToNull(source.getTagId()))
                .authorId(blankToNull(source.getAuthorId()))
                .build();
    }

    public Mono<SearchResult> searchArticles(String query, String status, int page, int pageSize,
                                             AuthenticatedUser user) {
        return Mono.defer(() -> {
                    accessPolicy.requireAnyRole(user);
                    int safePage = Math.max(page, 1);
                    int safeSize = Math.min(Math.max(pageSize, 1), MAX_PAGE_SIZE);
                    return persistence.search(new SearchQuery(query, blankToNull(status), safePage, safeSize));
                })
                .map(result -> user.isAuthor() ? ownResultsOnly(result, user) : result)
                .onErrorMap(e -> ArticleWorkflowException.wrap(e, ErrorKind.INTERNAL,
                        "An unexpected error occurred while searching articles", Set.of()));
    }

    private SearchResult ownResultsOnly(SearchResult result, AuthenticatedUser user) {
        List<Article> own = result.data().stream()
                .filter(article -> article.isOwnedBy(user.id()))
                .toList();
        if (own.size() == result.data().size()) {
            return result;
        }
        return SearchResult.of(own, result.page(), result.pageSize(), own.size());
    }

    // ==================== LIFECYCLE ====================

    public Mono<Article> publishArticle(String id, AuthenticatedUser user) {
        return Mono.defer(() -> {
                    accessPolicy.requireEditor(user);
                    return persistence.getById(id);
                })
                .flatMap(article -> {
                    if (article.hasStatus(ArticleStatus.ARCHIVED)) {
                        return Mono.error(ArticleWorkflowException.badRequest(
                                "Archived articles must be unarchived before publishing"));
                    }
                    return persistence.update(UpdateArticleCommand.builder()
                            .id(id)
                            .status(ArticleStatus.PUBLISHED.getValue())
                            .publishedAt(article.getPublishedAt() == null ? LocalDateTime.now() : null)
                            .build());
                })
                .doOnSuccess(article -> log.info("Article published: id={}, by={}", id, user.id()));
    }

    public Mono<Article> unpublishArticle(String id, AuthenticatedUser user) {
        return Mono.defer(() -> {
                    accessPolicy.requireEditor(user);
                    return persistence.getById(id);
                })
                .flatMap(article -> {
                    if (!article.hasStatus(ArticleStatus.PUBLISHED)) {
                        return Mono.error(ArticleWorkflowException.badRequest(
                                "Only published articles can be unpublished"));
                    }
                    return persistence.update(UpdateArticleCommand.builder()
                            .id(id)
                            .status(ArticleStatus.DRAFT.getValue())
                            .build());
                })
                .doOnSuccess(article -> log.info("Article unpublished: id={}, by={}", id, user.id()));
    }

    public Mono<ArchiveResult> archiveArticles(List<String> articleIds, AuthenticatedUser user) {
        return Mono.defer(() -> {
                    accessPolicy.requireEditor(user);
                    List<String> ids = articleIds == null ? List.of() : articleIds.stream()
                            .filter(articleId -> articleId != null && !articleId.isBlank())
                            .map(String::trim)
                            .distinct()
                            .toList();
                    if (ids.isEmpty()) {
                        throw ArticleWorkflowException.badRequest("No article IDs provided");
                    }
                    return persistence.archiveBatch(ids);
                })
                .flatMap(result -> {
                    if (result.archived() == 0) {
                        return Mono.error(ArticleWorkflowException.badRequest("no eligible articles"));
                    }
                    log.info("Articles archived: {}/{} by {}", result.archived(), result.totalProcessed(), user.id());
                    return Mono.just(result);
                })
                .onErrorMap(e -> ArticleWorkflowException.wrap(e, "Failed to archive articles", Set.of()));
    }

    public Mono<Article> unarchiveArticle(String id, AuthenticatedUser user) {
        return Mono.defer(() -> {
                    accessPolicy.requireEditor(user);
                    return persistence.getById(id);
                })
                .flatMap(article -> {
                    if (!article.hasStatus(ArticleStatus.ARCHIVED)) {
                        return Mono.error(ArticleWorkflowException.badRequest(
                                "Only archived articles can be unarchived"));
                    }
                    return persistence.restore(id);
                })
                .doOnSuccess(article -> log.info("Article unarchived: id={}, by={}", id, user.id()));
    }

    /**
     * Deletes the article. Media files go with it only while it is a draft; published and archived
     * articles keep their files.
     */
    public Mono<Void> deleteArticle(String id, AuthenticatedUser user) {
        return Mono.defer(() -> {
                    accessPolicy.requireEditor(user);
                    return persistence.getById(id);
                })
                .flatMap(article -> {
                    Mono<Void> files = article.hasStatus(ArticleStatus.DRAFT)
                            ? mediaUploadCoordinator.deleteBestEffort(mediaIdsOf(article), "article")
                            : Mono.empty();
                    return files.then(Mono.defer(() -> persistence.delete(id)));
                })
                .doOnSuccess(done -> log.info("Article deleted: id={}, by={}", id, user.id()))
                .onErrorMap(e -> ArticleWorkflowException.wrap(e, ErrorKind.INTERNAL,
                        "Failed to delete article and associated files", Set.of(ErrorKind.NOT_FOUND)));
    }

    // ==================== TAGS ====================

    public Mono<Void> assignTags(String articleId, List<String> tagIds, AuthenticatedUser user) {
        return Mono.defer(() -> {
                    accessPolicy.requireAnyRole(user);
                    List<String> ids = arrayFieldParser.parseDistinctIds(tagIds);
                    if (ids.isEmpty()) {
                        throw ArticleWorkflowException.badRequest("At least one tag ID is required");
                    }
                    return persistence.getById(articleId)
                            .doOnNext(article -> accessPolicy.requireCanAccess(user, article))
                            .then(persistence.assignTags(articleId, ids));
                })
                .doOnSuccess(done -> log.info("Tags assigned to article {}: {}", articleId, tagIds))
                .onErrorMap(e -> ArticleWorkflowException.wrap(e, "Failed to assign tags", Set.of(ErrorKind.BAD_REQUEST)));
    }

    public Mono<Void> removeTag(String articleId, String tagId, AuthenticatedUser user) {
        return Mono.defer(() -> {
                    accessPolicy.requireAnyRole(user);
                    return persistence.getById(articleId);
                })
                .doOnNext(article -> accessPolicy.requireCanAccess(user, article))
                .then(Mono.defer(() -> persistence.removeTag(articleId, tagId)))
                .doOnSuccess(done -> log.info("Tag {} removed from article {}", tagId, articleId))
                .onErrorMap(e -> ArticleWorkflowException.wrap(e, ErrorKind.INTERNAL,
                        "Failed to remove tag from article", Set.of(ErrorKind.NOT_FOUND)));
    }

    // ==================== HELPERS ====================

    private ArticleStatus initialStatus(String requested, AuthenticatedUser user) {
        if (requested == null || requested.isBlank()) {
            return ArticleStatus.DRAFT;
        }
        ArticleStatus status = ArticleStatus.from(requested)
                .orElseThrow(() -> ArticleWorkflowException.badRequest("Invalid status: " + requested));
        if (status == ArticleStatus.ARCHIVED) {
            throw ArticleWorkflowException.badRequest("Articles cannot be created as archived");
        }
        if (status == ArticleStatus.PUBLISHED && !user.hasAnyRole(UserRole.EDITOR, UserRole.ADMIN)) {
            throw ArticleWorkflowException.forbidden("Only editors and admins can publish articles");
        }
        return status;
    }

    private static void requireTitles(String title, String titleAr) {
        if (title == null || title.isBlank() || titleAr == null || titleAr.isBlank()) {
            throw ArticleWorkflowException.badRequest("Both title and titleAr are required");
        }
    }

    private static void requireNotBlank(String value, String message) {
        if (value != null && value.isBlank()) {
            throw ArticleWorkflowException.badRequest(message);
        }
    }

    private static void requirePaging(int page, int limit) {
        if (page < 1) {
            throw ArticleWorkflowException.badRequest("Page must be at least 1");
        }
        if (limit < 1 || limit > MAX_PAGE_SIZE) {
            throw ArticleWorkflowException.badRequest("Limit must be between 1 and " + MAX_PAGE_SIZE);
        }
    }

    private static List<String> ownedIds(List<MediaFile> files, List<String> requested) {
        Set<String> owned = new LinkedHashSet<>();
        if (files != null) {
            files.forEach(file -> owned.add(file.getId()));
        }
        return requested.stream().distinct().filter(owned::contains).toList();
    }

    private static List<String> mediaIdsOf(Article article) {
        List<String> ids = new ArrayList<>();
        if (article.getFeaturedMediaId() != null) {
            ids.add(article.getFeaturedMediaId());
        }
        if (article.getImages() != null) {
            article.getImages().forEach(file -> ids.add(file.getId()));
        }
        if (article.getVideos() != null) {
            article.getVideos().forEach(file -> ids.add(file.getId()));
        }
        return ids;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
