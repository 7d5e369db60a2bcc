package ru.tigran.nationalityengine.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import ru.tigran.nationalityengine.dto.PredictionEntry;
import ru.tigran.nationalityengine.dto.PredictionRecord;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Cached aggregated prediction for one normalized name.
 *
 * Columns:
 * - normalized_name: cache key, unique
 * - entries: candidates with country metadata as JSON, in ranking order
 * - fetched_at: moment the upstream answer was obtained, drives freshness
 */
@Entity
@Table(name = "name_predictions", uniqueConstraints = {
        @UniqueConstraint(name = "uk_name_prediction_name", columnNames = "normalized_name")
})
@Getter
@Setter
@NoArgsConstructor
public class NamePrediction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "normalized_name", nullable = false, length = 255)
    private String normalizedName;

    @Convert(converter = PredictionEntriesConverter.class)
    @Column(name = "entries", nullable = false, columnDefinition = "TEXT")
    private List<PredictionEntry> entries = new ArrayList<>();

    @Column(name = "fetched_at", nullable = false)
    private Instant fetchedAt;

    public NamePrediction(String normalizedName) {
        this.normalizedName = normalizedName;
    }

    /**
     * Replaces the whole stored record.
     */
    public void overwrite(PredictionRecord record) {
        this.entries = new ArrayList<>(record.entries());
        this.fetchedAt = record.fetchedAt();
    }

    public PredictionRecord toRecord() {
        return new PredictionRecord(normalizedName, entries, fetchedAt);
    }
}
