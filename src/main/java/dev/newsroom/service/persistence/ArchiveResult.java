package dev.newsroom.service.persistence;

public record ArchiveResult(int totalProcessed, int archived) {
}
