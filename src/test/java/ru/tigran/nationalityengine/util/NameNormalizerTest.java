package ru.tigran.nationalityengine.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("NameNormalizer unit тесты")
class NameNormalizerTest {

    @ParameterizedTest
    @ValueSource(strings = {"John", "john", "JOHN", "  john", "john  ", "\tJoHn\n", "\u3000John\u2003"})
    @DisplayName("normalize - регистр и пробелы по краям не влияют на результат")
    void normalizeIgnoresCaseAndSurroundingWhitespace(String input) {
        assertEquals("john", NameNormalizer.normalize(input));
    }

    @ParameterizedTest
    @ValueSource(strings = {"  Anna Maria ", "ÉLODIE", "o'Brien", "", "   "})
    @DisplayName("normalize - идемпотентна")
    void normalizeIsIdempotent(String input) {
        String once = NameNormalizer.normalize(input);
        assertEquals(once, NameNormalizer.normalize(once));
    }

    @Test
    @DisplayName("normalize - внутренние пробелы сохраняются")
    void normalizeKeepsInnerWhitespace() {
        assertEquals("anna  maria", NameNormalizer.normalize(" Anna  Maria "));
    }

    @Test
    @DisplayName("normalize - null и пустая строка дают пустое имя")
    void normalizeNullAndBlank() {
        assertEquals("", NameNormalizer.normalize(null));
        assertEquals("", NameNormalizer.normalize("   "));
        assertEquals("", NameNormalizer.normalize("\u3000\u2003"));
    }

    @Test
    @DisplayName("normalize - не зависит от локали (турецкая I)")
    void normalizeUsesRootLocale() {
        assertEquals("ivan", NameNormalizer.normalize("IVAN"));
    }

    @Test
    @DisplayName("normalizeCountryCode - приводит к верхнему регистру")
    void normalizeCountryCode() {
        assertEquals("US", NameNormalizer.normalizeCountryCode(" us "));
        assertNull(NameNormalizer.normalizeCountryCode(null));
    }
}
