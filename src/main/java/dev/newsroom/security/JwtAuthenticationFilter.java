package dev.newsroom.security;

import dev.newsroom.entity.UserRole;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpCookie;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.ReactiveSecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.Optional;

/**
 * Resolves the caller from a Bearer token (or the {@code access_token} cookie) and installs an
 * {@link AuthenticatedUser} principal. Requests without a token pass through unauthenticated and
 * are rejected by the security rules; requests with a bad token get a 401 straight away.
 */
@Component
@Slf4j
public class JwtAuthenticationFilter implements WebFilter {

    private static final String ACCESS_TOKEN_COOKIE = "access_token";

    private final JwtTokenProvider tokenProvider;

    public JwtAuthenticationFilter(JwtTokenProvider tokenProvider) {
        this.tokenProvider = tokenProvider;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String jwt = getJwtFromRequest(exchange);
        if (!StringUtils.hasText(jwt)) {
            return chain.filter(exchange);
        }

        String path = exchange.getRequest().getPath().value();
        var validation = tokenProvider.validateAndParseClaims(jwt);
        if (!validation.valid()) {
            log.warn("Access denied - {} for path: {}", validation.error(), path);
            return unauthorizedResponse(exchange, validation.error());
        }

        var claims = validation.claims();
        String userId = claims.getSubject();
        String email = claims.get(JwtTokenProvider.EMAIL_CLAIM, String.class);
        Optional<UserRole> role = UserRole.from(claims.get(JwtTokenProvider.ROLE_CLAIM, String.class));

        if (!StringUtils.hasText(userId) || role.isEmpty()) {
            log.warn("Access denied - token without subject or with unknown role for path: {}", path);
            return unauthorizedResponse(exchange, "Invalid role");
        }

        AuthenticatedUser user = new AuthenticatedUser(userId, email, role.get());
        log.debug("Authentication successful for user: {} ({})", userId, user.role());
        var auth = new UsernamePasswordAuthenticationToken(
                user, null,
                Collections.singleton(new SimpleGrantedAuthority("ROLE_" + user.role().name())));
        return chain.filter(exchange)
                .contextWrite(ReactiveSecurityContextHolder.withAuthentication(auth));
    }

    private String getJwtFromRequest(ServerWebExchange exchange) {
        String bearerToken = exchange.getRequest().getHeaders().getFirst(HttpHeaders.AUTHORIZATION);
        if (StringUtils.hasText(bearerToken) && bearerToken.startsWith("Bearer ")) {
            return bearerToken.substring(7);
        }
        HttpCookie cookie = exchange.getRequest().getCookies().getFirst(ACCESS_TOKEN_COOKIE);
        if (cookie != null && StringUtils.hasText(cookie.getValue())) {
            return cookie.getValue();
        }
        return null;
    }

    /** Build a 401 Unauthorized JSON response with the message JSON-escaped */
    private Mono<Void> unauthorizedResponse(ServerWebExchange exchange, String message) {
        exchange.getResponse().setStatusCode(HttpStatus.UNAUTHORIZED);
        exchange.getResponse().getHeaders().setContentType(MediaType.APPLICATION_JSON);
        String safeMessage = message.replace("\\", "\\\\")
                .replace("\"", "\\\"")
                .replace("\n", "\\n")
                .replace("\r", "\\r")
                .replace("\t", "\\t");
        String body = "{\"error\":\"Unauthorized\",\"message\":\"" + safeMessage + "\"}";
        DataBuffer buffer = exchange.getResponse().bufferFactory()
                .wrap(body.getBytes(StandardCharsets.UTF_8));
        return exchange.getResponse().writeWith(Mono.just(buffer));
    }
}
