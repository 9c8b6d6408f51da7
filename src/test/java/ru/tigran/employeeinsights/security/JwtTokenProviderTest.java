package ru.tigran.employeeinsights.security;

import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import ru.tigran.employeeinsights.model.User;

import java.nio.charset.StandardCharsets;
import java.util.Date;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JwtTokenProvider unit тесты")
class JwtTokenProviderTest {

    private static final String SECRET = "unit-test-secret-key-long-enough-for-hs256-signing";

    private final JwtTokenProvider provider = new JwtTokenProvider(SECRET, 1);

    @Test
    @DisplayName("Токен содержит id, имя и роль пользователя")
    void roundTripsPrincipal() {
        User user = new User(42L, "admin", "hash", User.Role.ADMIN, true);

        AuthenticatedUser parsed = provider.parseToken(provider.generateToken(user));

        assertEquals(new AuthenticatedUser(42L, "admin", User.Role.ADMIN), parsed);
    }

    @Test
    @DisplayName("Токен, подписанный другим ключом, отклоняется")
    void rejectsForeignSignature() {
        JwtTokenProvider other = new JwtTokenProvider("another-secret-key-that-is-also-long-enough", 1);
        String token = other.generateToken(new User(1L, "viewer", "hash", User.Role.VIEWER, true));

        assertThrows(JwtException.class, () -> provider.parseToken(token));
    }

    @Test
    @DisplayName("Истекший токен отклоняется")
    void rejectsExpiredToken() {
        String token = Jwts.builder()
                .subject("1")
                .claim("role", "ADMIN")
                .expiration(new Date(System.currentTimeMillis() - 60_000))
                .signWith(Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8)), Jwts.SIG.HS256)
                .compact();

        assertThrows(JwtException.class, () -> provider.parseToken(token));
    }

    @Test
    @DisplayName("Токен без роли или с неизвестной ролью отклоняется")
    void rejectsMissingOrUnknownRole() {
        var key = Keys.hmacShaKeyFor(SECRET.getBytes(StandardCharsets.UTF_8));
        String withoutRole = Jwts.builder().subject("1").signWith(key, Jwts.SIG.HS256).compact();
        String unknownRole = Jwts.builder().subject("1").claim("role", "ROOT").signWith(key, Jwts.SIG.HS256).compact();

        assertThrows(JwtException.class, () -> provider.parseToken(withoutRole));
        assertThrows(JwtException.class, () -> provider.parseToken(unknownRole));
    }

    @Test
    void extractsBearerToken() {
        assertEquals("abc", provider.extractTokenFromHeader("Bearer abc"));
        assertNull(provider.extractTokenFromHeader("Basic abc"));
        assertNull(provider.extractTokenFromHeader(null));
    }
}
