package ru.tigran.employeeinsights.config;

import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import ru.tigran.employeeinsights.model.User;
import ru.tigran.employeeinsights.security.JwtTokenProvider;

/**
 * Тестовая конфигурация безопасности для @WebMvcTest
 * Поднимает настоящий JwtTokenProvider с тестовым ключом, чтобы запросы проходили
 * через JwtAuthenticationFilter и правила SecurityConfig
 */
@TestConfiguration
public class TestSecurityConfig {

    public static final String SECRET = "test-secret-key-for-web-mvc-tests-q7x92k3f8a";

    @Bean
    public JwtTokenProvider jwtTokenProvider() {
        return new JwtTokenProvider(SECRET, 1);
    }

    /**
     * Заголовок Authorization для пользователя с указанной ролью
     */
    public static String bearer(JwtTokenProvider provider, User.Role role) {
        User user = new User(role == User.Role.ADMIN ? 1L : 2L, role.name().toLowerCase(), "hash", role, true);
        return "Bearer " + provider.generateToken(user);
    }
}
