package dev.newsroom.service;

import dev.newsroom.dto.InlineTagSpec;
import dev.newsroom.entity.Tag;
import dev.newsroom.exception.ArticleWorkflowException;
import dev.newsroom.repository.TagRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns existing tag IDs plus inline tag specs into the tag list of an article.
 * Existing tags come first in request order, then the newly created ones. Inline specs are not
 * matched against existing tag names, so two specs with the same name create two tags.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TagResolver {

    private final TagRepository tagRepository;
    private final IdService idService;

    public Mono<List<Tag>> resolve(List<String> existingTagIds, List<InlineTagSpec> inlineSpecs) {
        List<String> ids = existingTagIds == null ? List.of() : existingTagIds;
        List<InlineTagSpec> specs = inlineSpecs == null ? List.of() : inlineSpecs;

        return Mono.fromRunnable(() -> requireNames(specs))
                .then(Flux.fromIterable(ids)
                        .flatMapSequential(this::findExisting)
                        .collectList())
                .flatMap(existing -> Flux.fromIterable(specs)
                        .concatMap(this::createTag)
                        .collectList()
                        .map(created -> {
                            List<Tag> all = new ArrayList<>(existing.size() + created.size());
                            all.addAll(existing);
                            all.addAll(created);
                            return all;
                        }));
    }

    /**
     * @throws ArticleWorkflowException BAD_REQUEST when a spec has no name
     */
    public static void requireNames(List<InlineTagSpec> specs) {
        for (InlineTagSpec spec : specs) {
            if (spec == null || !spec.hasName()) {
                throw ArticleWorkflowException.badRequest("Each tag must have a name");
            }
        }
    }

    private Mono<Tag> findExisting(String tagId) {
        return tagRepository.findById(tagId)
                .switchIfEmpty(Mono.error(ArticleWorkflowException.notFound("Tag with ID " + tagId + " not found")));
    }

    private Mono<Tag> createTag(InlineTagSpec spec) {
        LocalDateTime now = LocalDateTime.now();
        Tag tag = Tag.builder()
                .id(idService.nextId())
                .name(spec.name().trim())
                .nameAr(spec.nameAr() != null && !spec.nameAr().isBlank() ? spec.nameAr().trim() : null)
                .createdAt(now)
                .updatedAt(now)
                .newRecord(true)
                .build();
        return tagRepository.save(tag)
                .doOnSuccess(saved -> log.info("Tag created inline: id={}, name='{}'", saved.getId(), saved.getName()));
    }
}
