package ru.tigran.nationalityengine.dto;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Aggregated answer for one normalized name. Unit of storage in the prediction cache.
 * Entries keep the candidate ranking order.
 */
public record PredictionRecord(
        String normalizedName,
        List<PredictionEntry> entries,
        Instant fetchedAt
) {

    public PredictionRecord {
        entries = List.copyOf(entries);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public Optional<PredictionEntry> topEntry() {
        return entries.stream().findFirst();
    }
}
