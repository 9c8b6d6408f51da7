package ru.tigran.employeeinsights.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Валидатор JWT secret key при старте приложения.
 * Не даёт запустить приложение с коротким или шаблонным ключом,
 * дефолтный dev-ключ разрешён везде кроме prod профиля.
 */
@Slf4j
@Component
public class JwtSecretValidator implements ApplicationRunner {

    static final String DEV_DEFAULT_KEY = "dev-secret-key-only-for-local-development-change-in-production";

    private static final int MINIMUM_KEY_LENGTH = 32;
    private static final int RECOMMENDED_KEY_LENGTH = 64;

    private static final List<String> FORBIDDEN_KEYS = List.of(
            "your-secret-key",
            "your_jwt_secret_key_here",
            "changeme",
            "password",
            "123456"
    );

    private final String jwtSecretKey;
    private final Environment environment;

    public JwtSecretValidator(@Value("${app.jwt.secret-key}") String jwtSecretKey, Environment environment) {
        this.jwtSecretKey = jwtSecretKey;
        this.environment = environment;
    }

    @Override
    public void run(ApplicationArguments args) {
        validate();
    }

    void validate() {
        if (jwtSecretKey == null || jwtSecretKey.isBlank()) {
            throw new IllegalStateException(
                    "JWT secret key is not configured! Set JWT_SECRET_KEY or app.jwt.secret-key. "
                            + "Generate with: openssl rand -base64 48");
        }

        if (jwtSecretKey.length() < MINIMUM_KEY_LENGTH) {
            throw new IllegalStateException(String.format(
                    "JWT secret key is too short! Minimum required: %d characters, got: %d",
                    MINIMUM_KEY_LENGTH, jwtSecretKey.length()));
        }

        if (DEV_DEFAULT_KEY.equals(jwtSecretKey)) {
            if (isProductionProfile()) {
                throw new IllegalStateException(
                        "Cannot use the default JWT secret in the prod profile, set JWT_SECRET_KEY");
            }
            log.warn("Using the default JWT secret key, acceptable for local development only");
            return;
        }

        String lowered = jwtSecretKey.toLowerCase(Locale.ROOT);
        for (String forbiddenKey : FORBIDDEN_KEYS) {
            if (lowered.contains(forbiddenKey)) {
                throw new IllegalStateException(
                        "JWT secret key contains placeholder value '" + forbiddenKey + "', use a random key");
            }
        }

        if (jwtSecretKey.length() < RECOMMENDED_KEY_LENGTH) {
            log.warn("JWT secret key length is {}, recommended at least {} characters",
                    jwtSecretKey.length(), RECOMMENDED_KEY_LENGTH);
        }

        log.info("JWT secret key validation passed (length: {} characters)", jwtSecretKey.length());
    }

    private boolean isProductionProfile() {
        return Arrays.stream(environment.getActiveProfiles())
                .anyMatch(profile -> "prod".equalsIgnoreCase(profile) || "production".equalsIgnoreCase(profile));
    }
}
