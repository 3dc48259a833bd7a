package ru.tigran.chatanalytics.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.JwtParserBuilder;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Verifies bearer tokens issued by the identity provider.
 * Uses an HMAC-SHA key; issuer and audience are checked only when configured.
 * Tokens are never issued by this service.
 */
@Slf4j
@Service
public class JwtTokenProvider {

    private static final String BEARER_PREFIX = "Bearer ";

    private final JwtParser parser;

    public JwtTokenProvider(
            @Value("${app.jwt.secret-key}") String secretKey,
            @Value("${app.jwt.issuer:}") String issuer,
            @Value("${app.jwt.audience:}") String audience
    ) {
        SecretKey key = Keys.hmacShaKeyFor(secretKey.getBytes(StandardCharsets.UTF_8));
        JwtParserBuilder builder = Jwts.parser().verifyWith(key);
        if (issuer != null && !issuer.isBlank()) {
            builder.requireIssuer(issuer);
        }
        if (audience != null && !audience.isBlank()) {
            builder.requireAudience(audience);
        }
        this.parser = builder.build();
    }

    /**
     * Verifies signature, expiry and the configured issuer / audience.
     *
     * @param token compact JWT
     * @return subject of a valid token, empty otherwise
     */
    public Optional<String> verifiedSubject(String token) {
        try {
            Claims claims = parser.parseSignedClaims(token).getPayload();
            String subject = claims.getSubject();
            if (subject == null || subject.isBlank()) {
                log.warn("JWT token has no subject");
                return Optional.empty();
            }
            log.debug("Validated JWT token for subject: {}", subject);
            return Optional.of(subject);
        } catch (JwtException | IllegalArgumentException e) {
            log.warn("JWT token validation failed: {}", e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Extracts the Bearer token from Authorization header.
     *
     * @param authHeader Authorization header value (e.g., "Bearer <token>")
     * @return Token string without "Bearer " prefix, or null if header is invalid
     */
    public String extractTokenFromHeader(String authHeader) {
        if (authHeader != null && authHeader.startsWith(BEARER_PREFIX)) {
            String token = authHeader.substring(BEARER_PREFIX.length()).trim();
            return token.isEmpty() ? null : token;
        }
        return null;
    }
}
