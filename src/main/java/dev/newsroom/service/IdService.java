package dev.newsroom.service;

import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Generates identifiers for articles, tags and media files.
 *
 * <pre>
 * Article article = Article.builder()
 *     .id(idService.nextId())
 *     .title("My Article")
 *     .build();
 * </pre>
 */
@Service
public class IdService {

    /**
     * @return a new random UUID string
     */
    public String nextId() {
        return UUID.randomUUID().toString();
    }
}
