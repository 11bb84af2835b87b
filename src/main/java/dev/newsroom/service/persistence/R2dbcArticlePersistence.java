package dev.newsroom.service.persistence;

import dev.newsroom.dto.PaginatedResponse;
import dev.newsroom.entity.Article;
import dev.newsroom.entity.ArticleStatus;
import dev.newsroom.entity.MediaFile;
import dev.newsroom.entity.Tag;
import dev.newsroom.exception.ArticleWorkflowException;
import dev.newsroom.repository.ArticleMediaRepository;
import dev.newsroom.repository.ArticleRepository;
import dev.newsroom.repository.ArticleTagRepository;
import dev.newsroom.repository.MediaFileRepository;
import dev.newsroom.repository.TagRepository;
import dev.newsroom.service.IdService;
import dev.newsroom.util.SlugUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Sort;
import org.springframework.data.r2dbc.core.R2dbcEntityTemplate;
import org.springframework.data.relational.core.query.Criteria;
import org.springframework.data.relational.core.query.Query;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * {@link ArticlePersistence} on Spring Data R2DBC. Tags live in article_tags, images and videos in
 * article_media (ordered by position), the featured file in articles.featured_media_id.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class R2dbcArticlePersistence implements ArticlePersistence {

    private final ArticleRepository articleRepository;
    private final TagRepository tagRepository;
    private final MediaFileRepository mediaFileRepository;
    private final ArticleTagRepository articleTagRepository;
    private final ArticleMediaRepository articleMediaRepository;
    private final R2dbcEntityTemplate r2dbcTemplate;
    private final IdService idService;

    @Override
    public Mono<Article> create(CreateArticleCommand command) {
        String id = idService.nextId();
        LocalDateTime now = LocalDateTime.now();
        Article article = Article.builder()
                .id(id)
                .title(command.getTitle())
                .titleAr(command.getTitleAr())
                .content(command.getContent())
                .contentAr(command.getContentAr())
                .summary(command.getSummary())
                .summaryAr(command.getSummaryAr())
                .slug(SlugUtils.slugify(command.getTitle(), id))
                .slugAr(SlugUtils.slugify(command.getTitleAr(), id))
                .status(command.getStatus() != null ? command.getStatus() : ArticleStatus.DRAFT.getValue())
                .publishedAt(command.getPublishedAt())
                .categoryId(command.getCategoryId())
                .authorId(command.getAuthorId())
                .authorEmail(command.getAuthorEmail())
                .views(0)
                .createdAt(now)
                .updatedAt(now)
                .newRecord(true)
                .build();

        return articleRepository.save(article)
                .doOnSuccess(saved -> log.debug("Article row inserted: id={}, slug={}", id, saved.getSlug()));
    }

    @Override
    @Transactional
    public Mono<Article> update(UpdateArticleCommand command) {
        String id = command.getId();
        return articleRepository.findById(id)
                .switchIfEmpty(Mono.error(articleNotFound(id)))
                .flatMap(article -> requireTags(command.getTags()).thenReturn(article))
                .flatMap(article -> {
                    applyScalars(article, command);
                    return articleRepository.save(article);
                })
                .flatMap(saved -> applyTags(id, command)
                        .then(applyMedia(id, ArticleMediaRepository.KIND_IMAGE, command.getImages()))
                        .then(applyMedia(id, ArticleMediaRepository.KIND_VIDEO, command.getVideos())))
                .then(Mono.defer(() -> getById(id)));
    }

    private void applyScalars(Article article, UpdateArticleCommand command) {
        if (command.getTitle() != null) article.setTitle(command.getTitle());
        if (command.getTitleAr() != null) article.setTitleAr(command.getTitleAr());
        if (command.getContent() != null) article.setContent(command.getContent());
        if (command.getContentAr() != null) article.setContentAr(command.getContentAr());
        if (command.getSummary() != null) article.setSummary(command.getSummary());
        if (command.getSummaryAr() != null) article.setSummaryAr(command.getSummaryAr());
        if (command.getCategoryId() != null) article.setCategoryId(command.getCategoryId());
        if (command.getStatus() != null) article.setStatus(command.getStatus());
        if (command.getPublishedAt() != null) article.setPublishedAt(command.getPublishedAt());
        if (command.getFeaturedMedia() != null) article.setFeaturedMediaId(command.getFeaturedMedia().getId());
        article.setUpdatedAt(LocalDateTime.now());
    }

    private Mono<Void> applyTags(String articleId, UpdateArticleCommand command) {
        if (command.getTags() != null) {
            List<String> tagIds = command.getTags().stream()
                    .map(Tag::getId)
                    .distinct()
                    .toList();
            return articleTagRepository.deleteByArticleId(articleId)
                    .thenMany(Flux.fromIterable(tagIds))
                    .concatMap(tagId -> articleTagRepository.insertArticleTag(articleId, tagId))
                    .then();
        }
        if (command.getTagsToRemove() != null && !command.getTagsToRemove().isEmpty()) {
            return Flux.fromIterable(command.getTagsToRemove())
                    .concatMap(tagId -> articleTagRepository.deleteArticleTag(articleId, tagId))
                    .then();
        }
        return Mono.empty();
    }

    private Mono<Void> applyMedia(String articleId, String kind, List<MediaFile> files) {
        if (files == null) {
            return Mono.empty();
        }
        List<String> fileIds = files.stream().map(MediaFile::getId).toList();
        return articleMediaRepository.replaceLinks(articleId, kind, fileIds);
    }

    private Mono<Void> requireTags(List<Tag> tags) {
        if (tags == null || tags.isEmpty()) {
            return Mono.empty();
        }
        return Flux.fromIterable(tags)
                .map(Tag::getId)
                .distinct()
                .concatMap(this::requireTag)
                .then();
    }

    private Mono<String> requireTag(String tagId) {
        return tagRepository.existsById(tagId)
                .flatMap(exists -> exists
                        ? Mono.just(tagId)
                        : Mono.error(ArticleWorkflowException.notFound("Tag with ID " + tagId + " not found")));
    }

    @Override
    @Transactional
    public Mono<Void> delete(String id) {
        return requireArticle(id)
                .then(articleTagRepository.deleteByArticleId(id))
                .then(articleMediaRepository.deleteByArticleId(id))
                .then(articleRepository.deleteById(id))
                .doOnSuccess(done -> log.debug("Article row deleted: id={}", id));
    }

    @Override
    public Mono<Article> getById(String id) {
        return articleRepository.findById(id)
                .switchIfEmpty(Mono.error(articleNotFound(id)))
                .flatMap(this::enrich);
    }

    private Mono<Article> enrich(Article article) {
        String id = article.getId();
        Mono<Optional<MediaFile>> featured = article.getFeaturedMediaId() == null
                ? Mono.just(Optional.empty())
                : mediaFileRepository.findById(article.getFeaturedMediaId())
                        .map(Optional::of)
                        .defaultIfEmpty(Optional.empty());

        return Mono.zip(
                tagRepository.findByArticleId(id).collectList(),
                mediaFileRepository.findByArticleIdAndKind(id, ArticleMediaRepository.KIND_IMAGE).collectList(),
                mediaFileRepository.findByArticleIdAndKind(id, ArticleMediaRepository.KIND_VIDEO).collectList(),
                featured
        ).map(tuple -> {
            article.setTags(new LinkedHashSet<>(tuple.getT1()));
            article.setImages(tuple.getT2());
            article.setVideos(tuple.getT3());
            article.setFeaturedMedia(tuple.getT4().orElse(null));
            return article;
        });
    }

    private Mono<Article> attachTags(Article article) {
        return tagRepository.findByArticleId(article.getId())
                .collectList()
                .map(tags -> {
                    article.setTags(new LinkedHashSet<>(tags));
                    return article;
                });
    }

    @Override
    public Mono<PaginatedResponse<Article>> list(ArticleFilters filters, int page, int limit, String sortBy, String sortOrder) {
        Mono<Optional<List<String>>> tagScope = filters.getTagId() == null
                ? Mono.just(Optional.empty())
                : articleTagRepository.findArticleIdsByTagId(filters.getTagId()).collectList().map(Optional::of);

        return tagScope.flatMap(scope -> {
            if (scope.isPresent() && scope.get().isEmpty()) {
                return Mono.just(PaginatedResponse.<Article>of(List.of(), page, limit, 0));
            }
            Criteria criteria = toCriteria(filters, scope.orElse(null));
            Query pageQuery = Query.query(criteria)
                    .sort(toSort(sortBy, sortOrder))
                    .limit(limit)
                    .offset((long) (page - 1) * limit);

            Mono<List<Article>> rows = r2dbcTemplate.select(pageQuery, Article.class)
                    .concatMap(this::attachTags)
                    .collectList();
            Mono<Long> total = r2dbcTemplate.count(Query.query(criteria), Article.class);

            return Mono.zip(rows, total)
                    .map(tuple -> PaginatedResponse.of(tuple.getT1(), page, limit, tuple.getT2()));
        });
    }

    private Criteria toCriteria(ArticleFilters filters, List<String> articleIds) {
        Criteria criteria = Criteria.empty();
        if (filters.getStatus() != null) {
            criteria = criteria.and("status").is(filters.getStatus().toLowerCase(Locale.ROOT));
        }
        if (filters.getCategoryId() != null) {
            criteria = criteria.and("categoryId").is(filters.getCategoryId());
        }
        if (filters.getAuthorId() != null) {
            criteria = criteria.and("authorId").is(filters.getAuthorId());
        }
        if (articleIds != null) {
            criteria = criteria.and("id").in(articleIds);
        }
        return criteria;
    }

    private Sort toSort(String sortBy, String sortOrder) {
        Sort.Direction direction = "asc".equalsIgnoreCase(sortOrder) ? Sort.Direction.ASC : Sort.Direction.DESC;
        return Sort.by(direction, sortBy != null ? sortBy : "createdAt");
    }

    @Override
    public Mono<SearchResult> search(SearchQuery query) {
        int limit = query.pageSize();
        long offset = (long) (query.page() - 1) * limit;
        String text = query.query() == null ? "" : query.query().trim();

        Flux<Article> rows;
        Mono<Long> total;
        if (query.status() != null && !query.status().isBlank()) {
            String status = query.status().toLowerCase(Locale.ROOT);
            rows = articleRepository.searchByStatus(text, status, limit, offset);
            total = articleRepository.countSearchByStatus(text, status);
        } else {
            rows = articleRepository.search(text, limit, offset);
            total = articleRepository.countSearch(text);
        }

        return Mono.zip(rows.concatMap(this::attachTags).collectList(), total)
                .map(tuple -> SearchResult.of(tuple.getT1(), query.page(), limit, tuple.getT2()));
    }

    @Override
    @Transactional
    public Mono<ArchiveResult> archiveBatch(List<String> ids) {
        LocalDateTime now = LocalDateTime.now();
        return Flux.fromIterable(ids)
                .concatMap(id -> articleRepository.archiveIfEligible(id, now))
                .reduce(0, Integer::sum)
                .map(archived -> new ArchiveResult(ids.size(), archived));
    }

    @Override
    public Mono<Article> restore(String id) {
        return articleRepository.restoreToDraft(id, LocalDateTime.now())
                .flatMap(rows -> rows == 0
                        ? Mono.<Article>error(articleNotFound(id))
                        : getById(id));
    }

    @Override
    @Transactional
    public Mono<Void> assignTags(String articleId, List<String> tagIds) {
        return requireArticle(articleId)
                .thenMany(Flux.fromIterable(tagIds).distinct())
                .concatMap(this::requireTag)
                .collectList()
                .flatMapMany(Flux::fromIterable)
                .concatMap(tagId -> articleTagRepository.exists(articleId, tagId)
                        .flatMap(linked -> linked
                                ? Mono.<Void>empty()
                                : articleTagRepository.insertArticleTag(articleId, tagId)))
                .then();
    }

    @Override
    public Mono<Void> removeTag(String articleId, String tagId) {
        return requireArticle(articleId)
                .then(articleTagRepository.deleteArticleTag(articleId, tagId))
                .flatMap(rows -> rows == 0
                        ? Mono.<Void>error(ArticleWorkflowException.notFound(
                                "Tag " + tagId + " is not assigned to article " + articleId))
                        : Mono.<Void>empty());
    }

    private Mono<Void> requireArticle(String id) {
        return articleRepository.existsById(id)
                .flatMap(exists -> exists ? Mono.<Void>empty() : Mono.<Void>error(articleNotFound(id)));
    }

    private static ArticleWorkflowException articleNotFound(String id) {
        return ArticleWorkflowException.notFound("Article with ID " + id + " not found");
    }
}
