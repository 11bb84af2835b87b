package dev.newsroom.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SlugUtilsTest {

    @Test
    @DisplayName("Should lowercase and collapse separators")
    void shouldLowercaseAndCollapse() {
        assertThat(SlugUtils.slugify("  Breaking News: Markets Rally!  ")).isEqualTo("breaking-news-markets-rally");
    }

    @Test
    @DisplayName("Should keep Arabic letters")
    void shouldKeepArabicLetters() {
        assertThat(SlugUtils.slugify("أخبار عاجلة")).isEqualTo("أخبار-عاجلة");
    }

    @Test
    @DisplayName("Should append the first 8 characters of the ID")
    void shouldAppendIdSuffix() {
        assertThat(SlugUtils.slugify("Hello World", "3f2a9c1e-1111-2222-3333-444455556666"))
                .isEqualTo("hello-world-3f2a9c1e");
    }

    @Test
    @DisplayName("Should fall back when the title has no letters or digits")
    void shouldFallBackForEmptySlug() {
        assertThat(SlugUtils.slugify("!!!")).isEqualTo("article");
        assertThat(SlugUtils.slugify(null)).isEqualTo("article");
    }
}
