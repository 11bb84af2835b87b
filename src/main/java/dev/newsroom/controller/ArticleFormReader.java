package dev.newsroom.controller;

import dev.newsroom.dto.ArticleCreateRequest;
import dev.newsroom.dto.ArticleUpdateRequest;
import dev.newsroom.exception.ArticleWorkflowException;
import dev.newsroom.service.media.MediaUpload;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.MediaType;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.http.codec.multipart.FormFieldPart;
import org.springframework.http.codec.multipart.Part;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads multipart article forms into request objects. File fields must carry file parts; a text
 * value under a file field is rejected, as is more files than the field allows.
 */
@Component
@Slf4j
public class ArticleFormReader {

    static final String FEATURED_MEDIA = "featuredMedia";
    static final String IMAGES = "images";
    static final String VIDEOS = "videos";

    private final int maxImages;
    private final int maxVideos;

    public ArticleFormReader(@Value("${app.articles.max-images:8}") int maxImages,
                             @Value("${app.articles.max-videos:4}") int maxVideos) {
        this.maxImages = maxImages;
        this.maxVideos = maxVideos;
    }

    public Mono<ArticleCreateRequest> readCreate(MultiValueMap<String, Part> parts) {
        return Mono.defer(() -> {
            MediaFields media = mediaFields(parts);
            return media.read().map(files -> ArticleCreateRequest.builder()
                    .title(text(parts, "title"))
                    .titleAr(text(parts, "titleAr"))
                    .content(text(parts, "content"))
                    .contentAr(text(parts, "contentAr"))
                    .summary(text(parts, "summary"))
                    .summaryAr(text(parts, "summaryAr"))
                    .categoryId(text(parts, "categoryId"))
                    .status(text(parts, "status"))
                    .tags(texts(parts, "tags"))
                    .tagIds(texts(parts, "tagIds"))
                    .featuredMedia(files.featured())
                    .images(files.images())
                    .videos(files.videos())
                    .build());
        });
    }

    public Mono<ArticleUpdateRequest> readUpdate(MultiValueMap<String, Part> parts) {
        return Mono.defer(() -> {
            MediaFields media = mediaFields(parts);
            return media.read().map(files -> ArticleUpdateRequest.builder()
                    .title(text(parts, "title"))
                    .titleAr(text(parts, "titleAr"))
                    .content(text(parts, "content"))
                    .contentAr(text(parts, "contentAr"))
                    .summary(text(parts, "summary"))
                    .summaryAr(text(parts, "summaryAr"))
                    .categoryId(text(parts, "categoryId"))
                    .tags(texts(parts, "tags"))
                    .removedImages(texts(parts, "removedImages"))
                    .removedVideos(texts(parts, "removedVideos"))
                    .removedTags(texts(parts, "removedTags"))
                    .featuredMedia(files.featured())
                    .images(files.images())
                    .videos(files.videos())
                    .build());
        });
    }

    private MediaFields mediaFields(MultiValueMap<String, Part> parts) {
        List<FilePart> featured = fileParts(parts, FEATURED_MEDIA, 1,
                "Featured media must be a file upload, not a string",
                "Only one featured media file is allowed");
        List<FilePart> images = fileParts(parts, IMAGES, maxImages,
                "Images must be file uploads, not strings",
                "Too many images: at most " + maxImages + " allowed");
        List<FilePart> videos = fileParts(parts, VIDEOS, maxVideos,
                "Videos must be file uploads, not strings",
                "Too many videos: at most " + maxVideos + " allowed");
        return new MediaFields(featured, images, videos);
    }

    private List<FilePart> fileParts(MultiValueMap<String, Part> parts, String field, int max,
                                     String notAFileMessage, String tooManyMessage) {
        List<Part> values = parts.get(field);
        if (values == null || values.isEmpty()) {
            return List.of();
        }
        List<FilePart> files = new ArrayList<>(values.size());
        for (Part part : values) {
            if (!(part instanceof FilePart filePart)) {
                throw ArticleWorkflowException.badRequest(notAFileMessage);
            }
            files.add(filePart);
        }
        if (files.size() > max) {
            throw ArticleWorkflowException.badRequest(tooManyMessage);
        }
        return files;
    }

    private String text(MultiValueMap<String, Part> parts, String field) {
        Part part = parts.getFirst(field);
        if (part instanceof FormFieldPart formField) {
            return formField.value();
        }
        if (part != null) {
            throw ArticleWorkflowException.badRequest("Field '" + field + "' must be a text value");
        }
        return null;
    }

    private List<String> texts(MultiValueMap<String, Part> parts, String field) {
        List<Part> values = parts.get(field);
        if (values == null) {
            return new ArrayList<>();
        }
        List<String> texts = new ArrayList<>(values.size());
        for (Part part : values) {
            if (part instanceof FormFieldPart formField) {
                texts.add(formField.value());
            }
        }
        return texts;
    }

    private static Mono<MediaUpload> readFile(FilePart filePart) {
        MediaType contentType = filePart.headers().getContentType();
        String mimetype = contentType != null
                ? contentType.getType() + "/" + contentType.getSubtype()
                : MediaType.APPLICATION_OCTET_STREAM_VALUE;
        return DataBufferUtils.join(filePart.content())
                .map(dataBuffer -> {
                    byte[] bytes = new byte[dataBuffer.readableByteCount()];
                    dataBuffer.read(bytes);
                    DataBufferUtils.release(dataBuffer);
                    return bytes;
                })
                .defaultIfEmpty(new byte[0])
                .map(bytes -> new MediaUpload(bytes, filePart.filename(), mimetype));
    }

    private static Mono<List<MediaUpload>> readAll(List<FilePart> files) {
        return Flux.fromIterable(files)
                .concatMap(ArticleFormReader::readFile)
                .collectList();
    }

    private record MediaFields(List<FilePart> featured, List<FilePart> images, List<FilePart> videos) {

        Mono<ReadMedia> read() {
            return Mono.zip(readAll(featured), readAll(images), readAll(videos))
                    .map(tuple -> new ReadMedia(
                            tuple.getT1().isEmpty() ? null : tuple.getT1().get(0),
                            tuple.getT2(),
                            tuple.getT3()));
        }
    }

    private record ReadMedia(MediaUpload featured, List<MediaUpload> images, List<MediaUpload> videos) {
    }
}
