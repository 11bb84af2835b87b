package dev.newsroom.controller;

import dev.newsroom.dto.ArchiveArticlesRequest;
import dev.newsroom.dto.ArticleResponse;
import dev.newsroom.dto.ArticleSummaryResponse;
import dev.newsroom.dto.AssignTagsRequest;
import dev.newsroom.dto.PaginatedResponse;
import dev.newsroom.dto.SearchResponse;
import dev.newsroom.security.AuthenticatedUser;
import dev.newsroom.service.ArticleAdminService;
import dev.newsroom.service.persistence.ArchiveResult;
import dev.newsroom.service.persistence.ArticleFilters;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.codec.multipart.Part;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.util.MultiValueMap;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/admin/articles")
@RequiredArgsConstructor
@PreAuthorize("hasAnyRole('AUTHOR', 'EDITOR', 'ADMIN')")
@Validated
@Slf4j
public class AdminArticleController {

    private final ArticleAdminService articleAdminService;
    private final ArticleFormReader articleFormReader;

    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    @ResponseStatus(HttpStatus.CREATED)
    public Mono<ArticleResponse> createArticle(
            @RequestBody Mono<MultiValueMap<String, Part>> form,
            @AuthenticationPrincipal AuthenticatedUser user) {
        return form.flatMap(articleFormReader::readCreate)
                .doOnNext(request -> log.info("Creating article: title='{}', author={}", request.getTitle(), user.id()))
                .flatMap(request -> articleAdminService.createArticle(request, user))
                .map(ArticleResponse::from);
    }

    @GetMapping
    public Mono<PaginatedResponse<ArticleSummaryResponse>> getAllArticles(
            @RequestParam(defaultValue = "1") @Min(1) int page,
            @RequestParam(defaultValue = "10") @Min(1) @Max(100) int limit,
            @RequestParam(defaultValue = "createdAt") String sortBy,
            @RequestParam(defaultValue = "desc") String sortOrder,
            @RequestParam(required = false) String status,
            @RequestParam(required = false) String categoryId,
            @RequestParam(required = false) String tagId,
            @RequestParam(required = false) String authorId,
            @AuthenticationPrincipal AuthenticatedUser user) {
        log.debug("Listing articles: page={}, limit={}, status={}", page, limit, status);
        ArticleFilters filters = ArticleFilters.builder()
                .status(status)
                .categoryId(categoryId)
                .tagId(tagId)
                .authorId(authorId)
                .build();
        return articleAdminService.listArticles(filters, page, limit, sortBy, sortOrder, user)
                .map(result -> result.map(ArticleSummaryResponse::from));
    }

    @GetMapping("/search")
    public Mono<SearchResponse> searchArticles(
            @RequestParam String query,
            @RequestParam(required = false) String status,
            @RequestParam(defaultValue = "1") @Min(1) int page,
            @RequestParam(defaultValue = "10") @Min(1) @Max(100) int pageSize,
            @AuthenticationPrincipal AuthenticatedUser user) {
        log.debug("Searching articles: query='{}', status={}", query, status);
        return articleAdminService.searchArticles(query, status, page, pageSize, user)
                .map(SearchResponse::from);
    }

    @GetMapping("/{id}")
    public Mono<ArticleResponse> getArticleById(
            @PathVariable String id,
            @AuthenticationPrincipal AuthenticatedUser user) {
        return articleAdminService.getArticle(id, user)
                .map(ArticleResponse::from);
    }

    @PatchMapping(value = "/{id}", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public Mono<ArticleResponse> updateArticle(
            @PathVariable String id,
            @RequestBody Mono<MultiValueMap<String, Part>> form,
            @AuthenticationPrincipal AuthenticatedUser user) {
        log.info("Updating article id={}", id);
        return form.flatMap(articleFormReader::readUpdate)
                .flatMap(request -> articleAdminService.updateArticle(id, request, user))
                .map(ArticleResponse::from);
    }

    @PatchMapping("/{id}/publish")
    @PreAuthorize("hasAnyRole('EDITOR', 'ADMIN')")
    public Mono<ArticleResponse> publishArticle(
            @PathVariable String id,
            @AuthenticationPrincipal AuthenticatedUser user) {
        log.info("Publishing article id={}", id);
        return articleAdminService.publishArticle(id, user)
                .map(ArticleResponse::from);
    }

    @PatchMapping("/{id}/unpublish")
    @PreAuthorize("hasAnyRole('EDITOR', 'ADMIN')")
    public Mono<ArticleResponse> unpublishArticle(
            @PathVariable String id,
            @AuthenticationPrincipal AuthenticatedUser user) {
        return articleAdminService.unpublishArticle(id, user)
                .map(ArticleResponse::from);
    }

    @PatchMapping("/{id}/unarchive")
    @PreAuthorize("hasAnyRole('EDITOR', 'ADMIN')")
    public Mono<Void> unarchiveArticle(
            @PathVariable String id,
            @AuthenticationPrincipal AuthenticatedUser user) {
        return articleAdminService.unarchiveArticle(id, user).then();
    }

    @PatchMapping("/archive")
    @PreAuthorize("hasAnyRole('EDITOR', 'ADMIN')")
    public Mono<ArchiveResult> archiveArticles(
            @Valid @RequestBody ArchiveArticlesRequest request,
            @AuthenticationPrincipal AuthenticatedUser user) {
        log.info("Archiving {} article(s)", request.getArticleIds().size());
        return articleAdminService.archiveArticles(request.getArticleIds(), user);
    }

    @DeleteMapping("/{id}")
    @PreAuthorize("hasAnyRole('EDITOR', 'ADMIN')")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> deleteArticle(
            @PathVariable String id,
            @AuthenticationPrincipal AuthenticatedUser user) {
        log.info("Deleting article id={}", id);
        return articleAdminService.deleteArticle(id, user);
    }

    // ==================== TAGS ====================

    @PostMapping("/{id}/tags")
    public Mono<Void> assignTags(
            @PathVariable String id,
            @Valid @RequestBody AssignTagsRequest request,
            @AuthenticationPrincipal AuthenticatedUser user) {
        return articleAdminService.assignTags(id, request.getTagIds(), user);
    }

    @DeleteMapping("/{articleId}/tags/{tagId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public Mono<Void> removeTag(
            @PathVariable String articleId,
            @PathVariable String tagId,
            @AuthenticationPrincipal AuthenticatedUser user) {
        return articleAdminService.removeTag(articleId, tagId, user);
    }
}
