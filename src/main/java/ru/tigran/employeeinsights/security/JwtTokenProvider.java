package ru.tigran.employeeinsights.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.MalformedJwtException;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import ru.tigran.employeeinsights.model.User;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.util.Date;

/**
 * Service for JWT token generation and validation.
 * Uses HMAC-SHA256 for token signing; the subject is the user ID, role and username are claims.
 */
@Slf4j
@Service
public class JwtTokenProvider {

    private static final String CLAIM_USERNAME = "username";
    private static final String CLAIM_ROLE = "role";

    private final SecretKey key;
    private final long tokenValidityInMilliseconds;

    public JwtTokenProvider(
            @Value("${app.jwt.secret-key}") String secretKey,
            @Value("${app.jwt.expiration-hours:24}") int expirationHours
    ) {
        this.key = Keys.hmacShaKeyFor(secretKey.getBytes(StandardCharsets.UTF_8));
        this.tokenValidityInMilliseconds = expirationHours * 60L * 60 * 1000;
    }

    /**
     * Generates a signed token for the given user.
     *
     * @param user persisted user with ID, username and role
     * @return compact JWT string
     */
    public String generateToken(User user) {
        Date now = new Date();
        Date expiryDate = new Date(now.getTime() + tokenValidityInMilliseconds);

        String token = Jwts.builder()
                .subject(user.getId().toString())
                .claim(CLAIM_USERNAME, user.getUsername())
                .claim(CLAIM_ROLE, user.getRole().name())
                .issuedAt(now)
                .expiration(expiryDate)
                .signWith(key, Jwts.SIG.HS256)
                .compact();

        log.debug("Generated JWT token for user: {}", user.getId());
        return token;
    }

    /**
     * Verifies the token and reads the principal out of it.
     *
     * @throws JwtException if the token is invalid, expired or carries an unknown role
     */
    public AuthenticatedUser parseToken(String token) {
        Claims claims = Jwts.parser()
                .verifyWith(key)
                .build()
                .parseSignedClaims(token)
                .getPayload();

        String subject = claims.getSubject();
        String role = claims.get(CLAIM_ROLE, String.class);
        if (subject == null || role == null) {
            throw new MalformedJwtException("JWT is missing subject or role claim");
        }
        try {
            return new AuthenticatedUser(
                    Long.parseLong(subject),
                    claims.get(CLAIM_USERNAME, String.class),
                    User.Role.valueOf(role)
            );
        } catch (IllegalArgumentException e) {
            throw new MalformedJwtException("Malformed JWT claims: " + e.getMessage(), e);
        }
    }

    /**
     * Extracts the Bearer token from Authorization header.
     *
     * @param authHeader Authorization header value (e.g., "Bearer <token>")
     * @return Token string without "Bearer " prefix, or null if header is invalid
     */
    public String extractTokenFromHeader(String authHeader) {
        if (authHeader != null && authHeader.startsWith("Bearer ")) {
            return authHeader.substring(7);
        }
        return null;
    }
}
