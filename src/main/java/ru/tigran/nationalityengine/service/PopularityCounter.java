package ru.tigran.nationalityengine.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;
import ru.tigran.nationalityengine.dto.PopularName;
import ru.tigran.nationalityengine.exception.StoreFailureException;
import ru.tigran.nationalityengine.model.NamePopularity;
import ru.tigran.nationalityengine.repository.NamePopularityRepository;

import java.time.Clock;
import java.util.List;

/**
 * Per-country name counters.
 *
 * Increment protocol:
 * 1. SELECT ... FOR UPDATE the (country, name) row and increment it in the same transaction
 * 2. If the row does not exist, insert it with count 1 in a separate transaction
 * 3. If a concurrent insert won the unique constraint, go back to step 1
 *
 * N concurrent increments of the same pair yield exactly +N.
 */
@Slf4j
@Service
public class PopularityCounter {

    private static final int MAX_INSERT_CONFLICTS = 3;

    private final NamePopularityRepository repository;
    private final TransactionTemplate transactionTemplate;
    private final TransactionTemplate readOnlyTemplate;
    private final Clock clock;

    public PopularityCounter(NamePopularityRepository repository, PlatformTransactionManager transactionManager, Clock clock) {
        this.repository = repository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.readOnlyTemplate = new TransactionTemplate(transactionManager);
        this.readOnlyTemplate.setReadOnly(true);
        this.clock = clock;
    }

    /**
     * Adds one to the counter of the name for the country, creating it on first use.
     *
     * @param countryCode ISO 3166-1 alpha-2, upper case
     * @param normalizedName normalized name
     * @return counter value after the increment
     */
    public long increment(String countryCode, String normalizedName) {
        try {
            for (int conflicts = 0; ; conflicts++) {
                Long updated = incrementExisting(countryCode, normalizedName);
                if (updated != null) {
                    return updated;
                }
                try {
                    insertFirst(countryCode, normalizedName);
                    log.debug("Created popularity counter {}/{}", countryCode, normalizedName);
                    return 1L;
                } catch (DataIntegrityViolationException e) {
                    if (conflicts + 1 >= MAX_INSERT_CONFLICTS) {
                        throw e;
                    }
                    log.debug("Popularity counter {}/{} created concurrently, retrying as update",
                            countryCode, normalizedName);
                }
            }
        } catch (DataAccessException e) {
            log.error("Failed to increment popularity {}/{}", countryCode, normalizedName, e);
            throw new StoreFailureException(
                    "Failed to increment popularity of '" + normalizedName + "' for " + countryCode, e);
        }
    }

    /**
     * Most counted names for the country, count descending, ties by name ascending.
     * Unknown country yields an empty list.
     */
    public List<PopularName> topN(String countryCode, int limit) {
        try {
            return readOnlyTemplate.execute(status ->
                    repository.findTopByCountry(countryCode, PageRequest.of(0, limit)));
        } catch (DataAccessException e) {
            log.error("Failed to read popular names for {}", countryCode, e);
            throw new StoreFailureException("Failed to read popular names for " + countryCode, e);
        }
    }

    private Long incrementExisting(String countryCode, String normalizedName) {
        return transactionTemplate.execute(status -> repository.findForUpdate(countryCode, normalizedName)
                .map(popularity -> {
                    popularity.increment(clock.instant());
                    return popularity.getAccessCount();
                })
                .orElse(null));
    }

    private void insertFirst(String countryCode, String normalizedName) {
        transactionTemplate.executeWithoutResult(status ->
                repository.saveAndFlush(new NamePopularity(countryCode, normalizedName, clock.instant())));
    }
}
