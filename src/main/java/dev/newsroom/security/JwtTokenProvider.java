package dev.newsroom.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.MalformedJwtException;
import io.jsonwebtoken.UnsupportedJwtException;
import io.jsonwebtoken.security.Keys;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;

/**
 * Verifies admin API access tokens. Tokens are minted by the identity service with the shared
 * HS512 secret; this service only reads them.
 */
@Component
@Slf4j
public class JwtTokenProvider {

    static final String ISSUER = "newsroom";
    static final String AUDIENCE = "newsroom-admin-api";
    static final String EMAIL_CLAIM = "email";
    static final String ROLE_CLAIM = "role";

    @Value("${jwt.secret}")
    private String secret;

    private JwtParser jwtParser;

    /**
     * Minimum required secret length for HS512 algorithm (64 bytes = 512 bits)
     */
    private static final int MIN_SECRET_LENGTH = 64;

    @PostConstruct
    public void init() {
        if (secret == null || secret.length() < MIN_SECRET_LENGTH) {
            throw new IllegalStateException(
                    String.format("JWT secret must be at least %d characters for HS512 algorithm. " +
                            "Current length: %d. Please configure a secure jwt.secret property.",
                            MIN_SECRET_LENGTH,
                            secret == null ? 0 : secret.length()));
        }
        SecretKey key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.jwtParser = Jwts.parser()
                .verifyWith(key)
                .requireIssuer(ISSUER)
                .requireAudience(AUDIENCE)
                .build();
        log.info("JWT token provider initialized with HS512 algorithm");
    }

    /**
     * Result of JWT token validation with granular error reporting.
     * Distinguishes between expired tokens (expected lifecycle) and invalid tokens (potential attack).
     */
    public record TokenValidationResult(boolean valid, boolean expired, Claims claims, String error) {
        public static TokenValidationResult success(Claims claims) {
            return new TokenValidationResult(true, false, claims, null);
        }
        public static TokenValidationResult expired(String message) {
            return new TokenValidationResult(false, true, null, message);
        }
        public static TokenValidationResult invalid(String message) {
            return new TokenValidationResult(false, false, null, message);
        }
    }

    /**
     * Checks signature (HS512), structure, issuer, audience and expiration in a single pass.
     */
    public TokenValidationResult validateAndParseClaims(String token) {
        try {
            Claims claims = jwtParser.parseSignedClaims(token).getPayload();
            return TokenValidationResult.success(claims);
        } catch (ExpiredJwtException e) {
            log.warn("JWT token expired: {}", e.getMessage());
            return TokenValidationResult.expired("Token expired");
        } catch (MalformedJwtException e) {
            log.warn("JWT token malformed: {}", e.getMessage());
            return TokenValidationResult.invalid("Malformed token");
        } catch (UnsupportedJwtException e) {
            log.warn("JWT token uses unsupported features: {}", e.getMessage());
            return TokenValidationResult.invalid("Unsupported token format");
        } catch (JwtException e) {
            log.warn("JWT validation failed: {}", e.getMessage());
            return TokenValidationResult.invalid("Invalid token");
        } catch (IllegalArgumentException e) {
            log.warn("JWT token is null or empty: {}", e.getMessage());
            return TokenValidationResult.invalid("Empty or null token");
        }
    }
}
