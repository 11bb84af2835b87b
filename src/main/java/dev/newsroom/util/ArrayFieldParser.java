package dev.newsroom.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import dev.newsroom.dto.InlineTagSpec;
import dev.newsroom.exception.ArticleWorkflowException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Tolerant parser for the array-like fields of multipart article forms.
 *
 * <p>ID lists ({@code tagIds}, {@code tags} on update, {@code removedImages}, {@code removedVideos},
 * {@code removedTags}) are accepted in any of these shapes, tried in this order:</p>
 * <ol>
 *   <li>a collection of values (repeated form fields), each value parsed recursively;</li>
 *   <li>a JSON document: an array (nested arrays are flattened, nulls dropped) or a scalar such as
 *   {@code "a"} or {@code 42}, which yields one value;</li>
 *   <li>a comma-separated string, e.g. {@code a,b}, used only when the text is not valid JSON.</li>
 * </ol>
 * Values are trimmed and blanks dropped, so {@code ["a","b"]} and {@code "a,b"} parse the same.
 * JSON objects carry no IDs and yield nothing.
 *
 * <p>Inline tag specs are parsed as a whole JSON document first (an array is used as is, a single
 * object is wrapped); on a syntax error the raw text is retried once wrapped in brackets, which
 * accepts {@code {"name":"a"},{"name":"b"}}. Anything else is rejected.</p>
 */
@Component
@Slf4j
public class ArrayFieldParser {

    static final String INVALID_TAGS_JSON = "Invalid JSON format for tags";

    private final ObjectMapper objectMapper;
    private final ObjectReader strictReader;

    public ArrayFieldParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.strictReader = objectMapper.readerFor(JsonNode.class)
                .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    /**
     * Parse an ID list field. {@code null} yields an empty list.
     */
    public List<String> parseIds(Object raw) {
        List<String> ids = new ArrayList<>();
        collectIds(raw, ids);
        return ids;
    }

    /**
     * Same as {@link #parseIds(Object)} without duplicates, first occurrence wins.
     */
    public List<String> parseDistinctIds(Object raw) {
        Set<String> distinct = new LinkedHashSet<>(parseIds(raw));
        return new ArrayList<>(distinct);
    }

    private void collectIds(Object raw, List<String> into) {
        if (raw == null) {
            return;
        }
        if (raw instanceof Collection<?> values) {
            for (Object value : values) {
                collectIds(value, into);
            }
            return;
        }
        String text = raw.toString().trim();
        if (text.isEmpty()) {
            return;
        }
        JsonNode node = tryJson(text);
        if (node != null) {
            collectJsonIds(node, into);
            return;
        }
        for (String part : text.split(",")) {
            addTrimmed(part, into);
        }
    }

    private void collectJsonIds(JsonNode node, List<String> into) {
        if (node.isArray()) {
            for (JsonNode element : node) {
                collectJsonIds(element, into);
            }
        } else if (node.isValueNode() && !node.isNull()) {
            addTrimmed(node.asText(), into);
        }
    }

    private static void addTrimmed(String value, List<String> into) {
        String trimmed = value.trim();
        if (!trimmed.isEmpty()) {
            into.add(trimmed);
        }
    }

    private JsonNode tryJson(String text) {
        try {
            return strictReader.readValue(text);
        } catch (JsonProcessingException e) {
            log.debug("ID list is not JSON, falling back to comma split: {}", e.getOriginalMessage());
            return null;
        }
    }

    /**
     * Parse inline tag specs. Blank input yields an empty list.
     *
     * @throws ArticleWorkflowException BAD_REQUEST when the text is not a JSON object or array of objects
     */
    public List<InlineTagSpec> parseInlineTags(String raw) {
        if (raw == null || raw.isBlank()) {
            return List.of();
        }
        JsonNode node = readTagsDocument(raw.trim());
        List<InlineTagSpec> specs = new ArrayList<>();
        if (node.isObject()) {
            specs.add(toSpec(node));
        } else if (node.isArray()) {
            for (JsonNode element : node) {
                specs.add(toSpec(element));
            }
        } else {
            throw ArticleWorkflowException.badRequest(INVALID_TAGS_JSON);
        }
        return specs;
    }

    /**
     * Inline specs sent as repeated form values are joined with commas before parsing.
     */
    public List<InlineTagSpec> parseInlineTags(Collection<String> rawValues) {
        if (rawValues == null || rawValues.isEmpty()) {
            return List.of();
        }
        if (rawValues.size() == 1) {
            return parseInlineTags(rawValues.iterator().next());
        }
        return parseInlineTags(String.join(",", rawValues));
    }

    private JsonNode readTagsDocument(String text) {
        try {
            return strictReader.readValue(text);
        } catch (JsonProcessingException first) {
            try {
                return strictReader.readValue("[" + text + "]");
            } catch (JsonProcessingException second) {
                log.warn("Rejected inline tags payload: {}", second.getOriginalMessage());
                throw ArticleWorkflowException.badRequest(INVALID_TAGS_JSON);
            }
        }
    }

    private InlineTagSpec toSpec(JsonNode element) {
        if (!element.isObject()) {
            throw ArticleWorkflowException.badRequest(INVALID_TAGS_JSON);
        }
        try {
            return objectMapper.treeToValue(element, InlineTagSpec.class);
        } catch (JsonProcessingException e) {
            throw ArticleWorkflowException.badRequest(INVALID_TAGS_JSON);
        }
    }
}
