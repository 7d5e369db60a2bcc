package ru.tigran.nationalityengine.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import ru.tigran.nationalityengine.model.Country;

/**
 * Repository for country metadata, keyed by ISO 3166-1 alpha-2 code.
 */
@Repository
public interface CountryRepository extends JpaRepository<Country, String> {
}
