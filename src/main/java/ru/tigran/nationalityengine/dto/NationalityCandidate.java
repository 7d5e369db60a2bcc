package ru.tigran.nationalityengine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Comparator;

/**
 * One (country, probability) pair returned by the nationality prediction service.
 *
 * @param countryCode ISO 3166-1 alpha-2, upper case
 * @param probability value in 0.0..1.0
 */
public record NationalityCandidate(
        @JsonProperty("country_code") String countryCode,
        double probability
) {

    /**
     * Descending probability, ties broken by country code ascending.
     */
    public static final Comparator<NationalityCandidate> RANKING =
            Comparator.comparingDouble(NationalityCandidate::probability).reversed()
                    .thenComparing(NationalityCandidate::countryCode);
}
