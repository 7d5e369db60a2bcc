package ru.tigran.nationalityengine.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import ru.tigran.nationalityengine.dto.CountryDetail;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Country metadata fetched from REST Countries, kept so that a country is looked up
 * upstream only once.
 */
@Entity
@Table(name = "countries")
@Getter
@Setter
@NoArgsConstructor
public class Country {

    /**
     * ISO 3166-1 alpha-2 country code
     */
    @Id
    @Column(name = "country_code", length = 2)
    private String countryCode;

    @Column(name = "common_name", nullable = false)
    private String commonName;

    @Column(name = "official_name")
    private String officialName;

    private String region;

    private String subregion;

    private Long population;

    @Column(name = "is_independent")
    private Boolean independent;

    @Column(name = "capital_name")
    private String capitalName;

    @Column(name = "capital_latitude")
    private Double capitalLatitude;

    @Column(name = "capital_longitude")
    private Double capitalLongitude;

    @Column(name = "flag_png_url", length = 512)
    private String flagPngUrl;

    @Column(name = "flag_svg_url", length = 512)
    private String flagSvgUrl;

    @Column(name = "flag_alt_text", length = 1024)
    private String flagAltText;

    @Column(name = "google_maps_url", length = 512)
    private String googleMapsUrl;

    @Column(name = "open_street_map_url", length = 512)
    private String openStreetMapUrl;

    @Column(name = "coat_of_arms_png_url", length = 512)
    private String coatOfArmsPngUrl;

    @Column(name = "coat_of_arms_svg_url", length = 512)
    private String coatOfArmsSvgUrl;

    @Convert(converter = StringListJsonConverter.class)
    @Column(name = "borders", length = 1024)
    private List<String> borders = new ArrayList<>();

    @Column(name = "fetched_at", nullable = false)
    private Instant fetchedAt;

    public static Country from(CountryDetail detail, Instant fetchedAt) {
        Country country = new Country();
        country.setCountryCode(detail.countryCode());
        country.setCommonName(detail.commonName());
        country.setOfficialName(detail.officialName());
        country.setRegion(detail.region());
        country.setSubregion(detail.subregion());
        country.setPopulation(detail.population());
        country.setIndependent(detail.independent());
        country.setCapitalName(detail.capitalName());
        country.setCapitalLatitude(detail.capitalLatitude());
        country.setCapitalLongitude(detail.capitalLongitude());
        country.setFlagPngUrl(detail.flagPngUrl());
        country.setFlagSvgUrl(detail.flagSvgUrl());
        country.setFlagAltText(detail.flagAltText());
        country.setGoogleMapsUrl(detail.googleMapsUrl());
        country.setOpenStreetMapUrl(detail.openStreetMapUrl());
        country.setCoatOfArmsPngUrl(detail.coatOfArmsPngUrl());
        country.setCoatOfArmsSvgUrl(detail.coatOfArmsSvgUrl());
        country.setBorders(detail.borders() == null ? new ArrayList<>() : new ArrayList<>(detail.borders()));
        country.setFetchedAt(fetchedAt);
        return country;
    }

    public CountryDetail toDetail() {
        return CountryDetail.builder()
                .countryCode(countryCode)
                .commonName(commonName)
                .officialName(officialName)
                .region(region)
                .subregion(subregion)
                .population(population)
                .independent(independent)
                .capitalName(capitalName)
                .capitalLatitude(capitalLatitude)
                .capitalLongitude(capitalLongitude)
                .flagPngUrl(flagPngUrl)
                .flagSvgUrl(flagSvgUrl)
                .flagAltText(flagAltText)
                .googleMapsUrl(googleMapsUrl)
                .openStreetMapUrl(openStreetMapUrl)
                .coatOfArmsPngUrl(coatOfArmsPngUrl)
                .coatOfArmsSvgUrl(coatOfArmsSvgUrl)
                .borders(borders == null ? List.of() : List.copyOf(borders))
                .build();
    }
}
