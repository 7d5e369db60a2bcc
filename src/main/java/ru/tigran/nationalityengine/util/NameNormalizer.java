package ru.tigran.nationalityengine.util;

import java.util.Locale;

/**
 * Utility class for name normalization.
 * The normalized form is the key of the prediction cache and of the popularity counters,
 * so two inputs differing only in surrounding whitespace or letter case share one entry.
 */
public class NameNormalizer {

    private NameNormalizer() {
        // Private constructor to prevent instantiation
    }

    /**
     * Strips leading/trailing whitespace and lower-cases the name.
     * Whitespace is the Unicode definition of {@link String#strip()} (U+3000, U+2003 included),
     * the same one used for the name sent to Nationalize.io.
     * Idempotent: normalize(normalize(x)) equals normalize(x).
     *
     * Example:
     * Input:  "  John "
     * Output: "john"
     *
     * @param name The raw name, may be null
     * @return Normalized name, empty string for null or blank input
     */
    public static String normalize(String name) {
        if (name == null) {
            return "";
        }
        return name
                .strip()
                .toLowerCase(Locale.ROOT);
    }

    /**
     * Upper-cases a country code using the root locale.
     */
    public static String normalizeCountryCode(String countryCode) {
        return countryCode == null ? null : countryCode.strip().toUpperCase(Locale.ROOT);
    }
}
