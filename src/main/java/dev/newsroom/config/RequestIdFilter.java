package dev.newsroom.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.util.context.Context;
import reactor.util.context.ContextView;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Tags every admin request with an ID that the article workflow logs carry, so a create, its
 * uploads and a later skeleton compensation can be tied together in the logs.
 *
 * <p>A well-formed {@code X-Request-ID} from the gateway is reused, anything else is replaced by
 * a generated one. {@code X-Correlation-ID} defaults to the request ID. Both are echoed on the
 * response and stored in the Reactor context; services read them with {@link #requestId(ContextView)}
 * and hand them to detached pipelines with {@link #propagate(ContextView)}.</p>
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@Slf4j
public class RequestIdFilter implements WebFilter {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";
    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String REQUEST_ID_CONTEXT_KEY = "requestId";
    public static final String CORRELATION_ID_CONTEXT_KEY = "correlationId";

    static final String NO_REQUEST_ID = "-";

    private static final int GENERATED_ID_LENGTH = 16;
    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9_-]{1,64}");

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        HttpHeaders incoming = exchange.getRequest().getHeaders();
        String requestId = acceptOrGenerate(incoming.getFirst(REQUEST_ID_HEADER));
        String correlationId = safeOrNull(incoming.getFirst(CORRELATION_ID_HEADER));
        if (correlationId == null) {
            correlationId = requestId;
        }
        String finalCorrelationId = correlationId;

        ServerWebExchange tagged = exchange.mutate()
                .request(request -> request.headers(headers -> {
                    headers.set(REQUEST_ID_HEADER, requestId);
                    headers.set(CORRELATION_ID_HEADER, finalCorrelationId);
                }))
                .build();
        tagged.getResponse().getHeaders().set(REQUEST_ID_HEADER, requestId);
        tagged.getResponse().getHeaders().set(CORRELATION_ID_HEADER, finalCorrelationId);

        long start = System.nanoTime();
        String method = exchange.getRequest().getMethod().name();
        String path = exchange.getRequest().getPath().value();

        return chain.filter(tagged)
                .doOnSuccess(done -> logCompleted(requestId, method, path,
                        tagged.getResponse().getStatusCode(), start))
                .doOnError(error -> log.error("[{}] {} {} failed after {}ms: {}",
                        requestId, method, path, elapsedMillis(start), error.getMessage()))
                .contextWrite(context -> context
                        .put(REQUEST_ID_CONTEXT_KEY, requestId)
                        .put(CORRELATION_ID_CONTEXT_KEY, finalCorrelationId));
    }

    /**
     * Request ID of the current pipeline, or {@code "-"} outside a web request.
     */
    public static String requestId(ContextView context) {
        return context.getOrDefault(REQUEST_ID_CONTEXT_KEY, NO_REQUEST_ID);
    }

    /**
     * The request and correlation IDs of {@code source}, for pipelines subscribed outside the
     * request chain (e.g. cleanup after a cancelled create).
     */
    public static Context propagate(ContextView source) {
        Context context = Context.empty();
        if (source.hasKey(REQUEST_ID_CONTEXT_KEY)) {
            context = context.put(REQUEST_ID_CONTEXT_KEY, source.get(REQUEST_ID_CONTEXT_KEY));
        }
        if (source.hasKey(CORRELATION_ID_CONTEXT_KEY)) {
            context = context.put(CORRELATION_ID_CONTEXT_KEY, source.get(CORRELATION_ID_CONTEXT_KEY));
        }
        return context;
    }

    private static String acceptOrGenerate(String external) {
        String accepted = safeOrNull(external);
        if (accepted != null) {
            return accepted;
        }
        if (external != null && !external.isBlank()) {
            log.warn("Rejected external request ID");
        }
        return UUID.randomUUID().toString().replace("-", "").substring(0, GENERATED_ID_LENGTH);
    }

    private static String safeOrNull(String value) {
        return value != null && SAFE_ID.matcher(value).matches() ? value : null;
    }

    private static void logCompleted(String requestId, String method, String path,
                                     HttpStatusCode status, long start) {
        int code = status != null ? status.value() : 200;
        if (code >= 400) {
            log.warn("[{}] {} {} -> {} in {}ms", requestId, method, path, code, elapsedMillis(start));
        } else {
            log.info("[{}] {} {} -> {} in {}ms", requestId, method, path, code, elapsedMillis(start));
        }
    }

    private static long elapsedMillis(long start) {
        return (System.nanoTime() - start) / 1_000_000;
    }
}
