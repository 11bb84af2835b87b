package dev.newsroom.util;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Slug generation for article titles. Unicode letters are kept so Arabic titles get Arabic slugs.
 */
public final class SlugUtils {

    private static final Pattern SEPARATORS = Pattern.compile("[^\\p{L}\\p{N}]+");
    private static final Pattern EDGE_DASHES = Pattern.compile("(^-+)|(-+$)");
    private static final int SUFFIX_LENGTH = 8;
    private static final String FALLBACK = "article";

    private SlugUtils() {
    }

    /**
     * @param text the title to slugify
     * @param id   the article ID; its first 8 characters are appended for uniqueness
     */
    public static String slugify(String text, String id) {
        String base = slugify(text);
        if (id == null || id.isBlank()) {
            return base;
        }
        String suffix = id.replace("-", "");
        suffix = suffix.substring(0, Math.min(SUFFIX_LENGTH, suffix.length())).toLowerCase(Locale.ROOT);
        return base + "-" + suffix;
    }

    public static String slugify(String text) {
        if (text == null || text.isBlank()) {
            return FALLBACK;
        }
        String normalized = Normalizer.normalize(text.trim(), Normalizer.Form.NFC).toLowerCase(Locale.ROOT);
        String slug = SEPARATORS.matcher(normalized).replaceAll("-");
        slug = EDGE_DASHES.matcher(slug).replaceAll("");
        return slug.isEmpty() ? FALLBACK : slug;
    }
}
