package ru.tigran.nationalityengine.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Answer for GET /api/v1/popular-names.
 */
public record PopularNamesResponse(
        @JsonProperty("country_code") String countryCode,
        @JsonProperty("popular_names") List<Item> popularNames
) {

    public record Item(String name, long frequency) {
    }

    public static PopularNamesResponse from(String countryCode, List<PopularName> names) {
        return new PopularNamesResponse(
                countryCode,
                names.stream().map(n -> new Item(n.name(), n.count())).toList()
        );
    }
}
