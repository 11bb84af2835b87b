package dev.newsroom.service.persistence;

/**
 * @param page 1-based
 */
public record SearchQuery(String query, String status, int page, int pageSize) {
}
