package com.eduhub.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParserBuilder;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Verifies HS256-signed JWTs with a shared secret.
 * 
 * With no secret configured every token is rejected, so tenant resolution
 * never trusts unverified claims.
 */
@Component
public class JwtTokenVerifier implements TokenVerifier {
    
    private static final Logger log = LoggerFactory.getLogger(JwtTokenVerifier.class);
    
    private static final int MIN_SECRET_LENGTH = 32;
    private static final long ALLOWED_CLOCK_SKEW_SECONDS = 30;
    
    private final Key signingKey;
    private final String expectedIssuer;
    
    public JwtTokenVerifier(
        @Value("${eduhub.security.jwt.secret:}") String secret,
        @Value("${eduhub.security.jwt.issuer:}") String expectedIssuer
    ) {
        if (StringUtils.hasText(secret)) {
            if (secret.length() < MIN_SECRET_LENGTH) {
                throw new IllegalArgumentException(
                    "eduhub.security.jwt.secret must be at least " + MIN_SECRET_LENGTH + " characters long");
            }
            this.signingKey = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        } else {
            log.warn("No JWT secret configured; bearer tokens will not be used for tenant resolution");
            this.signingKey = null;
        }
        this.expectedIssuer = StringUtils.hasText(expectedIssuer) ? expectedIssuer : null;
    }
    
    @Override
    public Optional<Map<String, Object>> verify(String token) {
        if (signingKey == null || !StringUtils.hasText(token)) {
            return Optional.empty();
        }
        
        JwtParserBuilder parser = Jwts.parserBuilder()
            .setSigningKey(signingKey)
            .setAllowedClockSkewSeconds(ALLOWED_CLOCK_SKEW_SECONDS);
        if (expectedIssuer != null) {
            parser.requireIssuer(expectedIssuer);
        }
        
        try {
            Claims claims = parser.build().parseClaimsJws(token).getBody();
            return Optional.of(new HashMap<>(claims));
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected bearer token: {}", e.getMessage());
            return Optional.empty();
        }
    }
}
