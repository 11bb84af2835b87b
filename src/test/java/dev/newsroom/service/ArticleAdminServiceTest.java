package dev.newsroom.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.newsroom.config.RequestIdFilter;
import dev.newsroom.dto.ArticleCreateRequest;
import dev.newsroom.dto.ArticleUpdateRequest;
import dev.newsroom.dto.PaginatedResponse;
import dev.newsroom.entity.Article;
import dev.newsroom.entity.ArticleStatus;
import dev.newsroom.entity.MediaFile;
import dev.newsroom.entity.Tag;
import dev.newsroom.entity.UserRole;
import dev.newsroom.exception.ArticleWorkflowException;
import dev.newsroom.exception.ErrorKind;
import dev.newsroom.metrics.ArticleWorkflowMetrics;
import dev.newsroom.security.AuthenticatedUser;
import dev.newsroom.service.media.MediaBatch;
import dev.newsroom.service.media.MediaUpload;
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
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import reactor.util.context.Context;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ArticleAdminServiceTest {

    private static final AuthenticatedUser AUTHOR = new AuthenticatedUser("author-1", "author@newsroom.dev", UserRole.AUTHOR);
    private static final AuthenticatedUser OTHER_AUTHOR = new AuthenticatedUser("author-2", "other@newsroom.dev", UserRole.AUTHOR);
    private static final AuthenticatedUser EDITOR = new AuthenticatedUser("editor-1", "editor@newsroom.dev", UserRole.EDITOR);

    @Mock
    private ArticlePersistence persistence;

    @Mock
    private TagResolver tagResolver;

    @Mock
    private MediaUploadCoordinator mediaUploadCoordinator;

    @Mock
    private ArticleWorkflowMetrics metrics;

    private ArticleAdminService service;

    @BeforeEach
    void setUp() {
        ArrayFieldParser parser = new ArrayFieldParser(new ObjectMapper());
        service = new ArticleAdminService(persistence, tagResolver, mediaUploadCoordinator,
                new ArticleMutationMerger(parser), new ArticleAccessPolicy(), parser, metrics);
    }

    private static Article article(String id, String authorId, ArticleStatus status) {
        return Article.builder()
                .id(id)
                .title("Title")
                .titleAr("عنوان")
                .authorId(authorId)
                .status(status.getValue())
                .newRecord(false)
                .build();
    }

    private static MediaFile media(String id) {
        return MediaFile.builder().id(id).url("https://cdn/" + id).newRecord(false).build();
    }

    private static ArticleCreateRequest.ArticleCreateRequestBuilder validCreate() {
        return ArticleCreateRequest.builder()
                .title("Markets rally")
                .titleAr("الأسواق ترتفع")
                .content("Body")
                .contentAr("نص");
    }

    private static Consumer<Throwable> workflowError(ErrorKind kind, String message) {
        return error -> {
            assertThat(error).isInstanceOf(ArticleWorkflowException.class).hasMessage(message);
            assertThat(((ArticleWorkflowException) error).getKind()).isEqualTo(kind);
        };
    }

    @Nested
    @DisplayName("createArticle")
    class CreateArticle {

        private final Article skeleton = article("a1", AUTHOR.id(), ArticleStatus.DRAFT);

        @Test
        @DisplayName("Should persist skeleton, resolve tags, upload media and write a single enriched update")
        void shouldCreateEnrichedArticle() {
            Tag tag = Tag.builder().id("t1").name("Economy").newRecord(false).build();
            MediaFile image = media("img-1");
            Article enriched = article("a1", AUTHOR.id(), ArticleStatus.DRAFT);

            when(persistence.create(any())).thenReturn(Mono.just(skeleton));
            when(tagResolver.resolve(anyList(), anyList())).thenReturn(Mono.just(List.of(tag)));
            when(mediaUploadCoordinator.uploadAll(any())).thenReturn(
                    Mono.just(new UploadedMedia(null, List.of(image), List.of())));
            when(persistence.update(any())).thenReturn(Mono.just(enriched));
            when(persistence.getById("a1")).thenReturn(Mono.just(enriched));

            ArticleCreateRequest request = validCreate()
                    .tagIds(List.of("[\"t1\"]"))
                    .images(List.of(new MediaUpload(new byte[]{1}, "a.png", "image/png")))
                    .build();

            StepVerifier.create(service.createArticle(request, AUTHOR))
                    .expectNext(enriched)
                    .verifyComplete();

            ArgumentCaptor<CreateArticleCommand> created = ArgumentCaptor.forClass(CreateArticleCommand.class);
            verify(persistence).create(created.capture());
            assertThat(created.getValue().getAuthorId()).isEqualTo("author-1");
            assertThat(created.getValue().getStatus()).isEqualTo("draft");
            assertThat(created.getValue().getPublishedAt()).isNull();

            ArgumentCaptor<UpdateArticleCommand> update = ArgumentCaptor.forClass(UpdateArticleCommand.class);
            verify(persistence, times(1)).update(update.capture());
            assertThat(update.getValue().getId()).isEqualTo("a1");
            assertThat(update.getValue().getTags()).containsExactly(tag);
            assertThat(update.getValue().getImages()).containsExactly(image);
            verify(tagResolver).resolve(List.of("t1"), List.of());
            verify(persistence, never()).delete(anyString());
            verify(metrics).incrementArticleCreated();
        }

        @Test
        @DisplayName("Should delete the skeleton when an upload fails and report the failure")
        void shouldCompensateOnUploadFailure() {
            when(persistence.create(any())).thenReturn(Mono.just(skeleton));
            when(tagResolver.resolve(anyList(), anyList())).thenReturn(Mono.just(List.of()));
            when(mediaUploadCoordinator.uploadAll(any())).thenReturn(Mono.error(new RuntimeException("disk full")));
            when(persistence.delete("a1")).thenReturn(Mono.empty());

            StepVerifier.create(service.createArticle(validCreate().build(), AUTHOR))
                    .expectErrorSatisfies(workflowError(ErrorKind.BAD_REQUEST, "Failed to create article: disk full"))
                    .verify();

            verify(persistence, times(1)).delete("a1");
            verify(persistence, never()).update(any());
            verify(metrics).incrementCompensated();
            verify(metrics, never()).incrementArticleCreated();
        }

        @Test
        @DisplayName("Should delete the skeleton when a referenced tag is missing")
        void shouldCompensateOnMissingTag() {
            when(persistence.create(any())).thenReturn(Mono.just(skeleton));
            when(tagResolver.resolve(anyList(), anyList()))
                    .thenReturn(Mono.error(ArticleWorkflowException.notFound("Tag with ID t9 not found")));
            when(persistence.delete("a1")).thenReturn(Mono.empty());

            StepVerifier.create(service.createArticle(validCreate().tagIds(List.of("t9")).build(), AUTHOR))
                    .expectErrorSatisfies(workflowError(ErrorKind.BAD_REQUEST,
                            "Failed to create article: Tag with ID t9 not found"))
                    .verify();

            verify(persistence).delete("a1");
            verifyNoInteractions(mediaUploadCoordinator);
        }

        @Test
        @DisplayName("Should surface the original failure with the compensation failure suppressed")
        void shouldKeepOriginalErrorWhenCompensationFails() {
            RuntimeException uploadFailure = new RuntimeException("upload failed");
            RuntimeException deleteFailure = new RuntimeException("database down");
            when(persistence.create(any())).thenReturn(Mono.just(skeleton));
            when(tagResolver.resolve(anyList(), anyList())).thenReturn(Mono.just(List.of()));
            when(mediaUploadCoordinator.uploadAll(any())).thenReturn(Mono.error(uploadFailure));
            when(persistence.delete("a1")).thenReturn(Mono.error(deleteFailure));

            StepVerifier.create(service.createArticle(validCreate().build(), AUTHOR))
                    .expectErrorSatisfies(error -> {
                        assertThat(error).hasMessage("Failed to create article: upload failed");
                        assertThat(error.getCause()).isSameAs(uploadFailure);
                        assertThat(uploadFailure.getSuppressed()).containsExactly(deleteFailure);
                    })
                    .verify();

            verify(metrics).incrementCompensationFailed();
            verify(metrics, never()).incrementCompensated();
        }

        @Test
        @DisplayName("Should delete the skeleton when the request is cancelled mid-upload")
        void shouldCompensateOnCancel() {
            when(persistence.create(any())).thenReturn(Mono.just(skeleton));
            when(tagResolver.resolve(anyList(), anyList())).thenReturn(Mono.just(List.of()));
            when(mediaUploadCoordinator.uploadAll(any())).thenReturn(Mono.never());
            when(persistence.delete("a1")).thenReturn(Mono.empty());

            StepVerifier.create(service.createArticle(validCreate().build(), AUTHOR))
                    .expectSubscription()
                    .thenCancel()
                    .verify();

            verify(persistence).delete("a1");
            verify(metrics).incrementCompensated();
        }

        @Test
        @DisplayName("Should run the cancellation cleanup with the request context of the create")
        void shouldKeepRequestContextOnCancel() {
            AtomicReference<String> deleteRequestId = new AtomicReference<>();
            when(persistence.create(any())).thenReturn(Mono.just(skeleton));
            when(tagResolver.resolve(anyList(), anyList())).thenReturn(Mono.just(List.of()));
            when(mediaUploadCoordinator.uploadAll(any())).thenReturn(Mono.never());
            when(persistence.delete("a1")).thenReturn(Mono.deferContextual(context -> {
                deleteRequestId.set(RequestIdFilter.requestId(context));
                return Mono.<Void>empty();
            }));

            StepVerifier.create(service.createArticle(validCreate().build(), AUTHOR)
                            .contextWrite(Context.of(RequestIdFilter.REQUEST_ID_CONTEXT_KEY, "req-7")))
                    .expectSubscription()
                    .thenCancel()
                    .verify();

            assertThat(deleteRequestId.get()).isEqualTo("req-7");
            verify(metrics).incrementCompensated();
        }

        @Test
        @DisplayName("Should reject a nameless inline tag before persisting anything")
        void shouldRejectNamelessInlineTag() {
            ArticleCreateRequest request = validCreate().tags(List.of("[{\"nameAr\":\"بلا اسم\"}]")).build();

            StepVerifier.create(service.createArticle(request, AUTHOR))
                    .expectErrorSatisfies(workflowError(ErrorKind.BAD_REQUEST,
                            "Failed to create article: Each tag must have a name"))
                    .verify();

            verifyNoInteractions(persistence, tagResolver, mediaUploadCoordinator);
        }

        @Test
        @DisplayName("Should reject malformed inline tag JSON before persisting anything")
        void shouldRejectMalformedTags() {
            ArticleCreateRequest request = validCreate().tags(List.of("{oops")).build();

            StepVerifier.create(service.createArticle(request, AUTHOR))
                    .expectErrorSatisfies(workflowError(ErrorKind.BAD_REQUEST,
                            "Failed to create article: Invalid JSON format for tags"))
                    .verify();

            verifyNoInteractions(persistence);
        }

        @Test
        @DisplayName("Should require both titles")
        void shouldRequireBothTitles() {
            ArticleCreateRequest request = validCreate().titleAr(" ").build();

            StepVerifier.create(service.createArticle(request, AUTHOR))
                    .expectErrorSatisfies(workflowError(ErrorKind.BAD_REQUEST,
                            "Failed to create article: Both title and titleAr are required"))
                    .verify();

            verifyNoInteractions(persistence);
        }

        @Test
        @DisplayName("Should forbid an author from creating a published article")
        void shouldForbidAuthorPublishing() {
            StepVerifier.create(service.createArticle(validCreate().status("published").build(), AUTHOR))
                    .expectErrorSatisfies(error -> assertThat(ArticleWorkflowException.kindOf(error))
                            .isEqualTo(ErrorKind.FORBIDDEN))
                    .verify();

            verifyNoInteractions(persistence);
        }

        @Test
        @DisplayName("Should stamp publishedAt when an editor creates a published article")
        void shouldStampPublishedAtForEditor() {
            Article created = article("a1", EDITOR.id(), ArticleStatus.PUBLISHED);
            when(persistence.create(any())).thenReturn(Mono.just(created));
            when(tagResolver.resolve(anyList(), anyList())).thenReturn(Mono.just(List.of()));
            when(mediaUploadCoordinator.uploadAll(any())).thenReturn(Mono.just(UploadedMedia.none()));
            when(persistence.update(any())).thenReturn(Mono.just(created));
            when(persistence.getById("a1")).thenReturn(Mono.just(created));

            StepVerifier.create(service.createArticle(validCreate().status("published").build(), EDITOR))
                    .expectNext(created)
                    .verifyComplete();

            ArgumentCaptor<CreateArticleCommand> command = ArgumentCaptor.forClass(CreateArticleCommand.class);
            verify(persistence).create(command.capture());
            assertThat(command.getValue().getStatus()).isEqualTo("published");
            assertThat(command.getValue().getPublishedAt()).isNotNull();
        }

        @Test
        @DisplayName("Should reject archived as an initial status")
        void shouldRejectArchivedStatus() {
            StepVerifier.create(service.createArticle(validCreate().status("archived").build(), EDITOR))
                    .expectErrorSatisfies(error -> assertThat(ArticleWorkflowException.kindOf(error))
                            .isEqualTo(ErrorKind.BAD_REQUEST))
                    .verify();
        }

        @Test
        @DisplayName("Should require authentication")
        void shouldRequireAuthentication() {
            StepVerifier.create(service.createArticle(validCreate().build(), null))
                    .expectErrorSatisfies(workflowError(ErrorKind.UNAUTHORIZED, "Authentication required"))
                    .verify();
        }
    }

    @Nested
    @DisplayName("updateArticle")
    class UpdateArticle {

        private Article existingWithMedia() {
            Article existing = article("a1", AUTHOR.id(), ArticleStatus.DRAFT);
            existing.setImages(new ArrayList<>(List.of(media("A"), media("B"), media("C"))));
            existing.setFeaturedMediaId("old-cover");
            return existing;
        }

        @Test
        @DisplayName("Should delete removed files, upload new ones and persist the merged result")
        void shouldMergeAndPersist() {
            Article existing = existingWithMedia();
            Article updated = article("a1", AUTHOR.id(), ArticleStatus.DRAFT);
            MediaFile cover = media("new-cover");

            when(persistence.getById("a1")).thenReturn(Mono.just(existing), Mono.just(updated));
            when(mediaUploadCoordinator.deleteBestEffort(anyCollection(), anyString())).thenReturn(Mono.empty());
            when(mediaUploadCoordinator.uploadAll(any(MediaBatch.class)))
                    .thenReturn(Mono.just(new UploadedMedia(cover, List.of(media("D")), List.of())));
            when(persistence.update(any())).thenReturn(Mono.just(updated));

            ArticleUpdateRequest request = ArticleUpdateRequest.builder()
                    .title("New title")
                    .removedImages(List.of("A,B,unknown"))
                    .build();

            StepVerifier.create(service.updateArticle("a1", request, AUTHOR))
                    .expectNext(updated)
                    .verifyComplete();

            verify(mediaUploadCoordinator).deleteBestEffort(List.of("A", "B"), "removed image");
            verify(mediaUploadCoordinator).deleteBestEffort(List.of("old-cover"), "replaced featured");

            ArgumentCaptor<UpdateArticleCommand> command = ArgumentCaptor.forClass(UpdateArticleCommand.class);
            verify(persistence).update(command.capture());
            assertThat(command.getValue().getTitle()).isEqualTo("New title");
            assertThat(command.getValue().getImages()).extracting(MediaFile::getId).containsExactly("C", "D");
            assertThat(command.getValue().getFeaturedMedia()).isSameAs(cover);
        }

        @Test
        @DisplayName("Should forbid an author updating another author's article")
        void shouldForbidOtherAuthor() {
            when(persistence.getById("a1")).thenReturn(Mono.just(existingWithMedia()));

            StepVerifier.create(service.updateArticle("a1", new ArticleUpdateRequest(), OTHER_AUTHOR))
                    .expectErrorSatisfies(workflowError(ErrorKind.FORBIDDEN, "You can only access your own articles"))
                    .verify();

            verifyNoInteractions(mediaUploadCoordinator);
            verify(persistence, never()).update(any());
        }

        @Test
        @DisplayName("Should reject a blank title")
        void shouldRejectBlankTitle() {
            ArticleUpdateRequest request = ArticleUpdateRequest.builder().title("   ").build();

            StepVerifier.create(service.updateArticle("a1", request, EDITOR))
                    .expectErrorSatisfies(workflowError(ErrorKind.BAD_REQUEST,
                            "Failed to update article: Title cannot be blank"))
                    .verify();

            verifyNoInteractions(persistence);
        }

        @Test
        @DisplayName("Should report a missing article as a failed update")
        void shouldWrapMissingArticle() {
            when(persistence.getById("missing"))
                    .thenReturn(Mono.error(ArticleWorkflowException.notFound("Article with ID missing not found")));

            StepVerifier.create(service.updateArticle("missing", new ArticleUpdateRequest(), EDITOR))
                    .expectErrorSatisfies(workflowError(ErrorKind.BAD_REQUEST,
                            "Failed to update article: Article with ID missing not found"))
                    .verify();
        }
    }

    @Nested
    @DisplayName("getArticle")
    class GetArticle {

        @Test
        @DisplayName("Should let an editor read any article")
        void shouldReturnArticleForEditor() {
            Article stored = article("a1", AUTHOR.id(), ArticleStatus.PUBLISHED);
            when(persistence.getById("a1")).thenReturn(Mono.just(stored));

            StepVerifier.create(service.getArticle("a1", EDITOR))
                    .expectNext(stored)
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should forbid an author reading another author's article")
        void shouldForbidOtherAuthor() {
            when(persistence.getById("a1")).thenReturn(Mono.just(article("a1", AUTHOR.id(), ArticleStatus.DRAFT)));

            StepVerifier.create(service.getArticle("a1", OTHER_AUTHOR))
                    .expectErrorSatisfies(workflowError(ErrorKind.FORBIDDEN, "You can only access your own articles"))
                    .verify();
        }

        @Test
        @DisplayName("Should pass NOT_FOUND through and hide other failures")
        void shouldMapErrors() {
            when(persistence.getById("missing"))
                    .thenReturn(Mono.error(ArticleWorkflowException.notFound("Article with ID missing not found")));
            when(persistence.getById("broken")).thenReturn(Mono.error(new IllegalStateException("pool closed")));

            StepVerifier.create(service.getArticle("missing", EDITOR))
                    .expectErrorSatisfies(workflowError(ErrorKind.NOT_FOUND, "Article with ID missing not found"))
                    .verify();
            StepVerifier.create(service.getArticle("broken", EDITOR))
                    .expectErrorSatisfies(workflowError(ErrorKind.INTERNAL,
                            "An unexpected error occurred while fetching the article"))
                    .verify();
        }
    }

    @Nested
    @DisplayName("listArticles and searchArticles")
    class Listing {

        @Test
        @DisplayName("Should scope an author's listing to their own articles")
        void shouldScopeAuthorListing() {
            Article own = article("a1", AUTHOR.id(), ArticleStatus.DRAFT);
            Article foreign = article("a2", OTHER_AUTHOR.id(), ArticleStatus.DRAFT);
            when(persistence.list(any(), eq(1), eq(10), eq("createdAt"), eq("desc")))
                    .thenReturn(Mono.just(PaginatedResponse.of(List.of(own, foreign), 1, 10, 2)));

            StepVerifier.create(service.listArticles(ArticleFilters.none(), 1, 10, null, null, AUTHOR))
                    .assertNext(page -> {
                        assertThat(page.getData()).containsExactly(own);
                        assertThat(page.getMetadata().getTotal()).isEqualTo(1);
                    })
                    .verifyComplete();

            ArgumentCaptor<ArticleFilters> filters = ArgumentCaptor.forClass(ArticleFilters.class);
            verify(persistence).list(filters.capture(), eq(1), eq(10), eq("createdAt"), eq("desc"));
            assertThat(filters.getValue().getAuthorId()).isEqualTo("author-1");
        }

        @Test
        @DisplayName("Should forbid an author filtering by another author")
        void shouldForbidForeignAuthorFilter() {
            ArticleFilters filters = ArticleFilters.none().withAuthorId("author-2");

            StepVerifier.create(service.listArticles(filters, 1, 10, null, null, AUTHOR))
                    .expectErrorSatisfies(workflowError(ErrorKind.FORBIDDEN, "You can only view your own articles"))
                    .verify();

            verifyNoInteractions(persistence);
        }

        @Test
        @DisplayName("Should pass editor filters through with normalized values")
        void shouldPassEditorFilters() {
            when(persistence.list(any(), anyInt(), anyInt(), anyString(), anyString()))
                    .thenReturn(Mono.just(PaginatedResponse.of(List.of(), 2, 5, 0)));

            ArticleFilters filters = ArticleFilters.builder().status("PUBLISHED").tagId(" t1 ").categoryId("").build();

            StepVerifier.create(service.listArticles(filters, 2, 5, "title", "ASC", EDITOR))
                    .assertNext(page -> assertThat(page.getData()).isEmpty())
                    .verifyComplete();

            ArgumentCaptor<ArticleFilters> captured = ArgumentCaptor.forClass(ArticleFilters.class);
            verify(persistence).list(captured.capture(), eq(2), eq(5), eq("title"), eq("asc"));
            assertThat(captured.getValue().getTagId()).isEqualTo("t1");
            assertThat(captured.getValue().getCategoryId()).isNull();
            assertThat(captured.getValue().getAuthorId()).isNull();
        }

        @Test
        @DisplayName("Should reject invalid paging, sort and status")
        void shouldRejectInvalidParameters() {
            StepVerifier.create(service.listArticles(null, 0, 10, null, null, EDITOR))
                    .expectErrorSatisfies(workflowError(ErrorKind.BAD_REQUEST, "Page must be at least 1"))
                    .verify();
            StepVerifier.create(service.listArticles(null, 1, 101, null, null, EDITOR))
                    .expectErrorSatisfies(workflowError(ErrorKind.BAD_REQUEST, "Limit must be between 1 and 100"))
                    .verify();
            StepVerifier.create(service.listArticles(null, 1, 10, "password", null, EDITOR))
                    .expectErrorSatisfies(workflowError(ErrorKind.BAD_REQUEST, "Invalid sort field: password"))
                    .verify();
            StepVerifier.create(service.listArticles(null, 1, 10, null, "sideways", EDITOR))
                    .expectErrorSatisfies(workflowError(ErrorKind.BAD_REQUEST, "Invalid sort order: sideways"))
                    .verify();
            StepVerifier.create(service.listArticles(ArticleFilters.builder().status("deleted").build(), 1, 10, null, null, EDITOR))
                    .expectErrorSatisfies(workflowError(ErrorKind.BAD_REQUEST, "Invalid status: deleted"))
                    .verify();

            verifyNoInteractions(persistence);
        }

        @Test
        @DisplayName("Should hide storage failures behind a generic message")
        void shouldWrapListFailure() {
            when(persistence.list(any(), anyInt(), anyInt(), anyString(), anyString()))
                    .thenReturn(Mono.error(new IllegalStateException("connection reset")));

            StepVerifier.create(service.listArticles(null, 1, 10, null, null, EDITOR))
                    .expectErrorSatisfies(workflowError(ErrorKind.INTERNAL, "Failed to fetch articles"))
                    .verify();
        }

        @Test
        @DisplayName("Should clamp search paging and keep only the author's own results")
        void shouldClampAndScopeSearch() {
            Article own = article("a1", AUTHOR.id(), ArticleStatus.DRAFT);
            Article foreign = article("a2", OTHER_AUTHOR.id(), ArticleStatus.DRAFT);
            when(persistence.search(any())).thenReturn(Mono.just(SearchResult.of(List.of(own, foreign), 1, 100, 2)));

            StepVerifier.create(service.searchArticles("rally", "", 0, 500, AUTHOR))
                    .assertNext(result -> {
                        assertThat(result.data()).containsExactly(own);
                        assertThat(result.totalResults()).isEqualTo(1);
                    })
                    .verifyComplete();

            verify(persistence).search(new SearchQuery("rally", null, 1, 100));
        }
    }

    @Nested
    @DisplayName("Lifecycle")
    class Lifecycle {

        @Test
        @DisplayName("Should stamp publishedAt on first publish only")
        void shouldStampPublishedAtOnce() {
            LocalDateTime firstPublished = LocalDateTime.of(2024, 1, 10, 9, 0);
            Article draft = article("a1", AUTHOR.id(), ArticleStatus.DRAFT);
            draft.setPublishedAt(firstPublished);
            when(persistence.getById("a1")).thenReturn(Mono.just(draft));
            when(persistence.update(any())).thenReturn(Mono.just(draft));

            StepVerifier.create(service.publishArticle("a1", EDITOR))
                    .expectNextCount(1)
                    .verifyComplete();

            ArgumentCaptor<UpdateArticleCommand> command = ArgumentCaptor.forClass(UpdateArticleCommand.class);
            verify(persistence).update(command.capture());
            assertThat(command.getValue().getStatus()).isEqualTo("published");
            assertThat(command.getValue().getPublishedAt()).isNull();
        }

        @Test
        @DisplayName("Should set publishedAt when publishing a never-published draft")
        void shouldSetPublishedAtForFreshDraft() {
            Article draft = article("a1", AUTHOR.id(), ArticleStatus.DRAFT);
            when(persistence.getById("a1")).thenReturn(Mono.just(draft));
            when(persistence.update(any())).thenReturn(Mono.just(draft));

            StepVerifier.create(service.publishArticle("a1", EDITOR))
                    .expectNextCount(1)
                    .verifyComplete();

            ArgumentCaptor<UpdateArticleCommand> command = ArgumentCaptor.forClass(UpdateArticleCommand.class);
            verify(persistence).update(command.capture());
            assertThat(command.getValue().getPublishedAt()).isNotNull();
        }

        @Test
        @DisplayName("Should refuse to publish an archived article")
        void shouldRefusePublishingArchived() {
            when(persistence.getById("a1")).thenReturn(Mono.just(article("a1", AUTHOR.id(), ArticleStatus.ARCHIVED)));

            StepVerifier.create(service.publishArticle("a1", EDITOR))
                    .expectErrorSatisfies(workflowError(ErrorKind.BAD_REQUEST,
                            "Archived articles must be unarchived before publishing"))
                    .verify();

            verify(persistence, never()).update(any());
        }

        @Test
        @DisplayName("Should forbid authors from lifecycle transitions")
        void shouldForbidAuthorTransitions() {
            StepVerifier.create(service.publishArticle("a1", AUTHOR))
                    .expectErrorSatisfies(workflowError(ErrorKind.FORBIDDEN, "You are not authorized to perform this action."))
                    .verify();
            StepVerifier.create(service.archiveArticles(List.of("a1"), AUTHOR))
                    .expectErrorSatisfies(error -> assertThat(ArticleWorkflowException.kindOf(error)).isEqualTo(ErrorKind.FORBIDDEN))
                    .verify();

            verifyNoInteractions(persistence);
        }

        @Test
        @DisplayName("Should only unpublish published articles")
        void shouldUnpublishOnlyPublished() {
            Article published = article("a1", AUTHOR.id(), ArticleStatus.PUBLISHED);
            when(persistence.getById("a1")).thenReturn(Mono.just(published));
            when(persistence.getById("a2")).thenReturn(Mono.just(article("a2", AUTHOR.id(), ArticleStatus.DRAFT)));
            when(persistence.update(any())).thenReturn(Mono.just(published));

            StepVerifier.create(service.unpublishArticle("a1", EDITOR))
                    .expectNextCount(1)
                    .verifyComplete();
            StepVerifier.create(service.unpublishArticle("a2", EDITOR))
                    .expectErrorSatisfies(workflowError(ErrorKind.BAD_REQUEST, "Only published articles can be unpublished"))
                    .verify();

            ArgumentCaptor<UpdateArticleCommand> command = ArgumentCaptor.forClass(UpdateArticleCommand.class);
            verify(persistence).update(command.capture());
            assertThat(command.getValue().getStatus()).isEqualTo("draft");
        }

        @Test
        @DisplayName("Should archive eligible articles and report counts")
        void shouldArchiveBatch() {
            when(persistence.archiveBatch(List.of("a1", "a2"))).thenReturn(Mono.just(new ArchiveResult(2, 1)));

            StepVerifier.create(service.archiveArticles(List.of("a1", " a2 ", "a1", ""), EDITOR))
                    .expectNext(new ArchiveResult(2, 1))
                    .verifyComplete();
        }

        @Test
        @DisplayName("Should fail when no article in the batch is eligible")
        void shouldFailWhenNothingArchived() {
            when(persistence.archiveBatch(anyList())).thenReturn(Mono.just(new ArchiveResult(1, 0)));

            StepVerifier.create(service.archiveArticles(List.of("a1"), EDITOR))
                    .expectErrorSatisfies(workflowError(ErrorKind.BAD_REQUEST,
                            "Failed to archive articles: no eligible articles"))
                    .verify();
        }

        @Test
        @DisplayName("Should reject an empty archive batch")
        void shouldRejectEmptyArchiveBatch() {
            StepVerifier.create(service.archiveArticles(List.of(" "), EDITOR))
                    .expectErrorSatisfies(workflowError(ErrorKind.BAD_REQUEST,
                            "Failed to archive articles: No article IDs provided"))
                    .verify();
        }

        @Test
        @DisplayName("Should restore an archived article to draft keeping publishedAt")
        void shouldUnarchive() {
            LocalDateTime publishedAt = LocalDateTime.of(2024, 3, 1, 12, 0);
            Article archived = article("a1", AUTHOR.id(), ArticleStatus.ARCHIVED);
            archived.setPublishedAt(publishedAt);
            Article restored = article("a1", AUTHOR.id(), ArticleStatus.DRAFT);
            restored.setPublishedAt(publishedAt);
            when(persistence.getById("a1")).thenReturn(Mono.just(archived));
            when(persistence.restore("a1")).thenReturn(Mono.just(restored));

            StepVerifier.create(service.unarchiveArticle("a1", EDITOR))
                    .assertNext(article -> {
                        assertThat(article.getStatus()).isEqualTo("draft");
                        assertThat(article.getPublishedAt()).isEqualTo(publishedAt);
                    })
                    .verifyComplete();

            verify(persistence, never()).update(any());
        }

        @Test
        @DisplayName("Should refuse to unarchive an article that is not archived")
        void shouldRefuseUnarchivingDraft() {
            when(persistence.getById("a1")).thenReturn(Mono.just(article("a1", AUTHOR.id(), ArticleStatus.DRAFT)));

            StepVerifier.create(service.unarchiveArticle("a1", EDITOR))
                    .expectErrorSatisfies(workflowError(ErrorKind.BAD_REQUEST, "Only archived articles can be unarchived"))
                    .verify();

            verify(persistence, never()).restore(anyString());
        }
    }

    @Nested
    @DisplayName("deleteArticle")
    class DeleteArticle {

        private Article withMedia(ArticleStatus status) {
            Article article = article("a1", AUTHOR.id(), status);
            article.setFeaturedMediaId("cover");
            article.setImages(new ArrayList<>(List.of(media("img"))));
            article.setVideos(new ArrayList<>(List.of(media("vid"))));
            return article;
        }

        @Test
        @DisplayName("Should delete files of a draft article")
        void shouldDeleteDraftFiles() {
            when(persistence.getById("a1")).thenReturn(Mono.just(withMedia(ArticleStatus.DRAFT)));
            when(mediaUploadCoordinator.deleteBestEffort(anyCollection(), anyString())).thenReturn(Mono.empty());
            when(persistence.delete("a1")).thenReturn(Mono.empty());

            StepVerifier.create(service.deleteArticle("a1", EDITOR)).verifyComplete();

            verify(mediaUploadCoordinator).deleteBestEffort(List.of("cover", "img", "vid"), "article");
            verify(persistence).delete("a1");
        }

        @Test
        @DisplayName("Should keep files of a published article")
        void shouldKeepPublishedFiles() {
            when(persistence.getById("a1")).thenReturn(Mono.just(withMedia(ArticleStatus.PUBLISHED)));
            when(persistence.delete("a1")).thenReturn(Mono.empty());

            StepVerifier.create(service.deleteArticle("a1", EDITOR)).verifyComplete();

            verifyNoInteractions(mediaUploadCoordinator);
            verify(persistence).delete("a1");
        }

        @Test
        @DisplayName("Should pass NOT_FOUND through")
        void shouldPassNotFound() {
            when(persistence.getById("missing"))
                    .thenReturn(Mono.error(ArticleWorkflowException.notFound("Article with ID missing not found")));

            StepVerifier.create(service.deleteArticle("missing", EDITOR))
                    .expectErrorSatisfies(workflowError(ErrorKind.NOT_FOUND, "Article with ID missing not found"))
                    .verify();
        }
    }

    @Nested
    @DisplayName("Tag assignment")
    class TagAssignment {

        @Test
        @DisplayName("Should assign parsed tag IDs to an own article")
        void shouldAssignTags() {
            when(persistence.getById("a1")).thenReturn(Mono.just(article("a1", AUTHOR.id(), ArticleStatus.DRAFT)));
            when(persistence.assignTags("a1", List.of("t1", "t2"))).thenReturn(Mono.empty());

            StepVerifier.create(service.assignTags("a1", List.of("t1", "t2", "t1"), AUTHOR)).verifyComplete();

            verify(persistence).assignTags("a1", List.of("t1", "t2"));
        }

        @Test
        @DisplayName("Should require at least one tag ID")
        void shouldRequireTagIds() {
            StepVerifier.create(service.assignTags("a1", List.of(), EDITOR))
                    .expectErrorSatisfies(workflowError(ErrorKind.BAD_REQUEST, "At least one tag ID is required"))
                    .verify();
        }

        @Test
        @DisplayName("Should forbid assigning tags to another author's article")
        void shouldForbidForeignArticle() {
            when(persistence.getById("a1")).thenReturn(Mono.just(article("a1", AUTHOR.id(), ArticleStatus.DRAFT)));
            lenient().when(persistence.assignTags(anyString(), anyList())).thenReturn(Mono.empty());

            StepVerifier.create(service.assignTags("a1", List.of("t1"), OTHER_AUTHOR))
                    .expectErrorSatisfies(error -> assertThat(ArticleWorkflowException.kindOf(error)).isEqualTo(ErrorKind.FORBIDDEN))
                    .verify();
        }

        @Test
        @DisplayName("Should pass NOT_FOUND through when removing an unassigned tag")
        void shouldPassNotFoundOnRemove() {
            when(persistence.getById("a1")).thenReturn(Mono.just(article("a1", AUTHOR.id(), ArticleStatus.DRAFT)));
            when(persistence.removeTag("a1", "t1"))
                    .thenReturn(Mono.error(ArticleWorkflowException.notFound("Tag t1 is not assigned to article a1")));

            StepVerifier.create(service.removeTag("a1", "t1", EDITOR))
                    .expectErrorSatisfies(workflowError(ErrorKind.NOT_FOUND, "Tag t1 is not assigned to article a1"))
                    .verify();
        }
    }
}
