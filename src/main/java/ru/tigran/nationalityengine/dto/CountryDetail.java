package ru.tigran.nationalityengine.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.util.List;

/**
 * Country metadata from REST Countries, attached to a candidate country.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CountryDetail(
        @JsonProperty("country_code") String countryCode,
        @JsonProperty("common_name") String commonName,
        @JsonProperty("official_name") String officialName,
        String region,
        String subregion,
        Long population,
        @JsonProperty("is_independent") Boolean independent,
        @JsonProperty("capital_name") String capitalName,
        @JsonProperty("capital_latitude") Double capitalLatitude,
        @JsonProperty("capital_longitude") Double capitalLongitude,
        @JsonProperty("flag_png_url") String flagPngUrl,
        @JsonProperty("flag_svg_url") String flagSvgUrl,
        @JsonProperty("flag_alt_text") String flagAltText,
        @JsonProperty("google_maps_url") String googleMapsUrl,
        @JsonProperty("open_street_map_url") String openStreetMapUrl,
        @JsonProperty("coat_of_arms_png_url") String coatOfArmsPngUrl,
        @JsonProperty("coat_of_arms_svg_url") String coatOfArmsSvgUrl,
        List<String> borders
) {
}
