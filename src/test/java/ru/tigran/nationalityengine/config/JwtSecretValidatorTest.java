package ru.tigran.nationalityengine.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("JwtSecretValidator модульные тесты")
class JwtSecretValidatorTest {

    private static JwtSecretValidator validator(String key, String... profiles) {
        MockEnvironment environment = new MockEnvironment();
        environment.setActiveProfiles(profiles);
        return new JwtSecretValidator(key, environment);
    }

    @Test
    @DisplayName("Достаточно длинный случайный ключ принимается")
    void acceptsStrongKey() {
        assertDoesNotThrow(() -> validator("k3J9x0QpLm2Vr8TzYw4NbHc6Ds1Fg5Ua").validate());
    }

    @Test
    @DisplayName("Пустой и короткий ключ отклоняются")
    void rejectsMissingOrShortKey() {
        assertThrows(IllegalStateException.class, () -> validator("").validate());
        assertThrows(IllegalStateException.class, () -> validator("short-key").validate());
    }

    @Test
    @DisplayName("Шаблонный ключ отклоняется")
    void rejectsPlaceholderKey() {
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> validator("your-secret-key-please-change-this-now").validate());
        assertTrue(e.getMessage().contains("placeholder"));
    }

    @Test
    @DisplayName("Ключ для разработки разрешен везде, кроме prod")
    void devKeyOnlyOutsideProduction() {
        assertDoesNotThrow(() -> validator(JwtSecretValidator.DEV_DEFAULT_KEY, "dev").validate());
        assertThrows(IllegalStateException.class,
                () -> validator(JwtSecretValidator.DEV_DEFAULT_KEY, "prod").validate());
    }
}
