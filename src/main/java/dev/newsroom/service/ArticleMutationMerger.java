package dev.newsroom.service;

import dev.newsroom.dto.ArticleUpdateRequest;
import dev.newsroom.entity.Article;
import dev.newsroom.entity.MediaFile;
import dev.newsroom.entity.Tag;
import dev.newsroom.service.media.UploadedMedia;
import dev.newsroom.service.persistence.UpdateArticleCommand;
import dev.newsroom.util.ArrayFieldParser;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Computes the update command for a partial article update: what stays, what goes and what is
 * appended. Pure function of its inputs; incoming tag IDs are not checked for existence here.
 */
@Component
@RequiredArgsConstructor
public class ArticleMutationMerger {

    private final ArrayFieldParser arrayFieldParser;

    public UpdateArticleCommand merge(Article existing, ArticleUpdateRequest request, UploadedMedia uploaded) {
        UploadedMedia media = uploaded != null ? uploaded : UploadedMedia.none();

        Set<String> removedImages = new HashSet<>(arrayFieldParser.parseIds(request.getRemovedImages()));
        Set<String> removedVideos = new HashSet<>(arrayFieldParser.parseIds(request.getRemovedVideos()));
        List<String> removedTags = arrayFieldParser.parseDistinctIds(request.getRemovedTags());
        List<String> incomingTags = arrayFieldParser.parseDistinctIds(request.getTags());

        return UpdateArticleCommand.builder()
                .id(existing.getId())
                .title(request.getTitle())
                .titleAr(request.getTitleAr())
                .content(request.getContent())
                .contentAr(request.getContentAr())
                .summary(request.getSummary())
                .summaryAr(request.getSummaryAr())
                .categoryId(request.getCategoryId())
                .images(keepThenAppend(existing.getImages(), removedImages, media.images()))
                .videos(keepThenAppend(existing.getVideos(), removedVideos, media.videos()))
                .tags(mergeTags(existing.getTags(), removedTags, incomingTags))
                .tagsToRemove(removedTags)
                .featuredMedia(media.featured())
                .build();
    }

    private List<MediaFile> keepThenAppend(List<MediaFile> current, Set<String> removedIds, List<MediaFile> added) {
        List<MediaFile> result = new ArrayList<>();
        if (current != null) {
            for (MediaFile file : current) {
                if (!removedIds.contains(file.getId())) {
                    result.add(file);
                }
            }
        }
        result.addAll(added);
        return result;
    }

    private List<Tag> mergeTags(Collection<Tag> current, List<String> removedIds, List<String> incomingIds) {
        Set<String> removed = new HashSet<>(removedIds);
        Set<String> existingIds = new HashSet<>();
        List<Tag> result = new ArrayList<>();
        if (current != null) {
            for (Tag tag : current) {
                existingIds.add(tag.getId());
                if (!removed.contains(tag.getId())) {
                    result.add(tag);
                }
            }
        }
        for (String tagId : incomingIds) {
            if (!existingIds.contains(tagId)) {
                result.add(Tag.reference(tagId));
            }
        }
        return result;
    }
}
