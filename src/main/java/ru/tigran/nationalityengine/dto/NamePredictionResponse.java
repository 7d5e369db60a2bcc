package ru.tigran.nationalityengine.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.List;

/**
 * Prediction answer for GET /api/v1/names.
 * An empty {@code countries} list means the prediction service knows no nationality for the name.
 */
@Schema(description = "Nationality candidates for a name, enriched with country metadata")
public record NamePredictionResponse(
        @Schema(description = "Name as requested", example = "John")
        String name,

        @JsonProperty("normalized_name")
        String normalizedName,

        @JsonProperty("fetched_at")
        Instant fetchedAt,

        List<CountryItem> countries
) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record CountryItem(
            @JsonProperty("country_code") String countryCode,
            double probability,
            @JsonProperty("detail_available") boolean detailAvailable,
            @JsonProperty("common_name") String commonName,
            CountryDetail country
    ) {
    }

    public static NamePredictionResponse from(String requestedName, PredictionRecord record) {
        List<CountryItem> items = record.entries().stream()
                .map(entry -> new CountryItem(
                        entry.candidate().countryCode(),
                        entry.candidate().probability(),
                        entry.isDetailAvailable(),
                        entry.isDetailAvailable() ? entry.detail().commonName() : null,
                        entry.detail()
                ))
                .toList();
        return new NamePredictionResponse(requestedName, record.normalizedName(), record.fetchedAt(), items);
    }
}
