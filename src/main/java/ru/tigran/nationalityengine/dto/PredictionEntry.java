package ru.tigran.nationalityengine.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * A candidate merged with its country metadata.
 * {@code detail} is null when the metadata lookup failed for this candidate.
 */
public record PredictionEntry(
        NationalityCandidate candidate,
        CountryDetail detail
) {

    public static PredictionEntry withoutDetail(NationalityCandidate candidate) {
        return new PredictionEntry(candidate, null);
    }

    @JsonIgnore
    public boolean isDetailAvailable() {
        return detail != null;
    }
}
