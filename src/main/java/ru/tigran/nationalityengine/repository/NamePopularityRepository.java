package ru.tigran.nationalityengine.repository;

import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import ru.tigran.nationalityengine.dto.PopularName;
import ru.tigran.nationalityengine.model.NamePopularity;

import java.util.List;
import java.util.Optional;

/**
 * Repository for per-country name counters.
 */
@Repository
public interface NamePopularityRepository extends JpaRepository<NamePopularity, Long> {

    /**
     * Locks the counter row (SELECT ... FOR UPDATE) until the surrounding transaction ends.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM NamePopularity p " +
           "WHERE p.countryCode = :countryCode AND p.normalizedName = :normalizedName")
    Optional<NamePopularity> findForUpdate(@Param("countryCode") String countryCode,
                                           @Param("normalizedName") String normalizedName);

    Optional<NamePopularity> findByCountryCodeAndNormalizedName(String countryCode, String normalizedName);

    /**
     * Most counted names of a country, count descending, ties by name ascending.
     */
    @Query("SELECT NEW ru.tigran.nationalityengine.dto.PopularName(p.normalizedName, p.accessCount) " +
           "FROM NamePopularity p WHERE p.countryCode = :countryCode " +
           "ORDER BY p.accessCount DESC, p.normalizedName ASC")
    List<PopularName> findTopByCountry(@Param("countryCode") String countryCode, Pageable pageable);
}
