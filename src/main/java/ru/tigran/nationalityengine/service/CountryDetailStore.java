package ru.tigran.nationalityengine.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import ru.tigran.nationalityengine.dto.CountryDetail;
import ru.tigran.nationalityengine.model.Country;
import ru.tigran.nationalityengine.repository.CountryRepository;

import java.time.Clock;
import java.util.Optional;

/**
 * Country metadata with a database-backed cache in front of REST Countries.
 * Country metadata changes rarely, so stored rows do not expire.
 */
@Slf4j
@Service
public class CountryDetailStore {

    private final CountryRepository countryRepository;
    private final ExternalApiGateway externalApiGateway;
    private final Clock clock;

    public CountryDetailStore(CountryRepository countryRepository, ExternalApiGateway externalApiGateway, Clock clock) {
        this.countryRepository = countryRepository;
        this.externalApiGateway = externalApiGateway;
        this.clock = clock;
    }

    /**
     * Returns stored metadata for the code, fetching and storing it on first use.
     *
     * @throws ru.tigran.nationalityengine.exception.UpstreamException if the code is unknown locally
     *         and REST Countries cannot provide it
     */
    public CountryDetail resolve(String countryCode) {
        Optional<CountryDetail> stored = findStored(countryCode);
        if (stored.isPresent()) {
            return stored.get();
        }

        CountryDetail detail = externalApiGateway.fetchCountryDetail(countryCode);
        save(detail);
        return detail;
    }

    private Optional<CountryDetail> findStored(String countryCode) {
        try {
            return countryRepository.findById(countryCode).map(Country::toDetail);
        } catch (DataAccessException e) {
            // Таблица стран - вспомогательный кэш, при ее недоступности идем в REST Countries
            log.warn("Failed to read stored country {}: {}", countryCode, e.getMessage());
            return Optional.empty();
        }
    }

    private void save(CountryDetail detail) {
        try {
            countryRepository.save(Country.from(detail, clock.instant()));
            log.debug("Stored country detail for {}", detail.countryCode());
        } catch (DataIntegrityViolationException e) {
            log.debug("Country {} was stored concurrently", detail.countryCode());
        } catch (DataAccessException e) {
            log.warn("Failed to store country {}: {}", detail.countryCode(), e.getMessage());
        }
    }
}
