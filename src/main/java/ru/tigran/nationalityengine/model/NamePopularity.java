package ru.tigran.nationalityengine.model;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.time.Instant;

/**
 * How many times a normalized name was counted for a country.
 * Created lazily on first increment, never decremented.
 */
@Entity
@Table(name = "name_popularity",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_popularity_country_name", columnNames = {"country_code", "normalized_name"})
        },
        indexes = {
                @Index(name = "idx_popularity_country_count", columnList = "country_code, access_count")
        })
@Getter
@Setter
@NoArgsConstructor
public class NamePopularity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    /**
     * ISO 3166-1 alpha-2, upper case
     */
    @Column(name = "country_code", nullable = false, length = 2)
    private String countryCode;

    @Column(name = "normalized_name", nullable = false, length = 255)
    private String normalizedName;

    @Column(name = "access_count", nullable = false)
    private long accessCount;

    @Column(name = "last_accessed_at", nullable = false)
    private Instant lastAccessedAt;

    public NamePopularity(String countryCode, String normalizedName, Instant accessedAt) {
        this.countryCode = countryCode;
        this.normalizedName = normalizedName;
        this.accessCount = 1;
        this.lastAccessedAt = accessedAt;
    }

    public void increment(Instant accessedAt) {
        this.accessCount++;
        this.lastAccessedAt = accessedAt;
    }

    @Override
    public String toString() {
        return normalizedName + " (" + countryCode + ", " + accessCount + ")";
    }
}
