package dev.newsroom.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A caller-supplied request to create a new tag inline with an article.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record InlineTagSpec(String name, String nameAr) {

    public boolean hasName() {
        return name != null && !name.isBlank();
    }
}
