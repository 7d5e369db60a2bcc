package ru.tigran.nationalityengine.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * Валидатор JWT secret key при старте приложения.
 * Не дает запустить приложение с коротким или шаблонным ключом.
 */
@Slf4j
@Component
public class JwtSecretValidator implements ApplicationRunner {

    static final int MINIMUM_KEY_LENGTH = 32;
    static final String DEV_DEFAULT_KEY = "dev-secret-key-only-for-local-development-change-in-production";

    private static final String[] FORBIDDEN_KEYS = {
            "your-secret-key-please-change-this",
            "your_jwt_secret_key_here",
            "changeme",
            "password",
            "123456"
    };

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
                    "JWT secret key is not configured! Set environment variable JWT_SECRET_KEY. " +
                    "Generate with: openssl rand -base64 32"
            );
        }

        // HMAC-SHA256 требует минимум 256 бит
        if (jwtSecretKey.length() < MINIMUM_KEY_LENGTH) {
            throw new IllegalStateException(String.format(
                    "JWT secret key is too short! Minimum required: %d characters, got: %d",
                    MINIMUM_KEY_LENGTH, jwtSecretKey.length()
            ));
        }

        if (DEV_DEFAULT_KEY.equals(jwtSecretKey)) {
            if (isProductionProfile()) {
                throw new IllegalStateException(
                        "Cannot use the default JWT secret in production profile. Set JWT_SECRET_KEY."
                );
            }
            log.warn("Using DEFAULT JWT secret key for local development. Set JWT_SECRET_KEY for production.");
            return;
        }

        for (String forbiddenKey : FORBIDDEN_KEYS) {
            if (jwtSecretKey.toLowerCase().contains(forbiddenKey)) {
                throw new IllegalStateException(
                        "JWT secret key contains placeholder value: '" + forbiddenKey + "'"
                );
            }
        }

        log.info("JWT secret key validation passed (length: {} characters)", jwtSecretKey.length());
    }

    private boolean isProductionProfile() {
        return Arrays.stream(environment.getActiveProfiles())
                .anyMatch(profile -> "prod".equalsIgnoreCase(profile) || "production".equalsIgnoreCase(profile));
    }
}
