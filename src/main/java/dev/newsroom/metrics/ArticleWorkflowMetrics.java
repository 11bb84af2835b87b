package dev.newsroom.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Counters for the article create/update workflows, exposed through actuator.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ArticleWorkflowMetrics {

    public static final String ARTICLES_CREATED = "newsroom.articles.created";
    public static final String ARTICLES_COMPENSATED = "newsroom.articles.compensated";
    public static final String COMPENSATION_FAILED = "newsroom.articles.compensation.failed";
    public static final String MEDIA_UPLOADED = "newsroom.media.uploaded";
    public static final String MEDIA_DELETE_FAILED = "newsroom.media.delete.failed";

    private final MeterRegistry meterRegistry;

    // Cached counter references to avoid registry lookup on every call
    private Counter articlesCreated;
    private Counter articlesCompensated;
    private Counter compensationFailed;
    private Counter mediaDeleteFailed;

    @PostConstruct
    public void init() {
        articlesCreated = Counter.builder(ARTICLES_CREATED)
                .description("Articles created through the admin API")
                .register(meterRegistry);
        articlesCompensated = Counter.builder(ARTICLES_COMPENSATED)
                .description("Skeleton articles deleted after a failed create")
                .register(meterRegistry);
        compensationFailed = Counter.builder(COMPENSATION_FAILED)
                .description("Skeleton articles that could not be deleted after a failed create")
                .register(meterRegistry);
        mediaDeleteFailed = Counter.builder(MEDIA_DELETE_FAILED)
                .description("Best-effort media deletions that failed")
                .register(meterRegistry);
        log.debug("Article workflow metrics registered");
    }

    public void incrementArticleCreated() {
        articlesCreated.increment();
    }

    public void incrementCompensated() {
        articlesCompensated.increment();
    }

    public void incrementCompensationFailed() {
        compensationFailed.increment();
    }

    public void incrementMediaDeleteFailed() {
        mediaDeleteFailed.increment();
    }

    /**
     * @param kind featured, image or video
     */
    public void incrementMediaUploaded(String kind) {
        meterRegistry.counter(MEDIA_UPLOADED, "kind", kind).increment();
    }
}
