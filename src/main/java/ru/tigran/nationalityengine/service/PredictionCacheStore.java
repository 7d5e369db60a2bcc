package ru.tigran.nationalityengine.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;
import ru.tigran.nationalityengine.config.NationalityEngineProperties;
import ru.tigran.nationalityengine.dto.PredictionRecord;
import ru.tigran.nationalityengine.exception.StoreFailureException;
import ru.tigran.nationalityengine.model.NamePrediction;
import ru.tigran.nationalityengine.repository.NamePredictionRepository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Persistent cache of aggregated predictions, keyed by normalized name.
 *
 * A record is fresh while {@code now - fetchedAt < ttl}; a zero TTL means records never expire.
 * Writes replace the whole record. Concurrent first writes for the same name resolve as
 * last-write-wins: the losing insert is retried as an update.
 */
@Slf4j
@Service
public class PredictionCacheStore {

    private final NamePredictionRepository repository;
    private final TransactionTemplate transactionTemplate;
    private final TransactionTemplate readOnlyTemplate;
    private final Clock clock;
    private final Duration ttl;

    public PredictionCacheStore(
            NamePredictionRepository repository,
            PlatformTransactionManager transactionManager,
            Clock clock,
            NationalityEngineProperties properties
    ) {
        this.repository = repository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.readOnlyTemplate = new TransactionTemplate(transactionManager);
        this.readOnlyTemplate.setReadOnly(true);
        this.clock = clock;
        this.ttl = properties.getCache().getTtl();
        if (ttl.isNegative()) {
            throw new IllegalArgumentException("app.cache.ttl must not be negative: " + ttl);
        }
    }

    /**
     * Stored record for the name, fresh or stale.
     */
    public Optional<PredictionRecord> get(String normalizedName) {
        try {
            return readOnlyTemplate.execute(status ->
                    repository.findByNormalizedName(normalizedName).map(NamePrediction::toRecord));
        } catch (DataAccessException e) {
            log.error("Failed to read cached prediction for '{}'", normalizedName, e);
            throw new StoreFailureException("Failed to read cached prediction for '" + normalizedName + "'", e);
        }
    }

    /**
     * Stored record for the name only if it is still fresh.
     */
    public Optional<PredictionRecord> getFresh(String normalizedName) {
        return get(normalizedName).filter(this::isFresh);
    }

    public boolean isFresh(PredictionRecord record) {
        if (ttl.isZero()) {
            return true;
        }
        Instant now = clock.instant();
        return Duration.between(record.fetchedAt(), now).compareTo(ttl) < 0;
    }

    /**
     * Inserts or fully replaces the record stored for the name.
     */
    public void put(String normalizedName, PredictionRecord record) {
        try {
            upsert(normalizedName, record);
        } catch (DataIntegrityViolationException e) {
            // Параллельный первый insert того же имени: перезаписываем победителя
            log.debug("Concurrent insert for '{}', retrying as update", normalizedName);
            try {
                upsert(normalizedName, record);
            } catch (DataAccessException retryFailure) {
                log.error("Failed to store prediction for '{}'", normalizedName, retryFailure);
                throw new StoreFailureException("Failed to store prediction for '" + normalizedName + "'", retryFailure);
            }
        } catch (DataAccessException e) {
            log.error("Failed to store prediction for '{}'", normalizedName, e);
            throw new StoreFailureException("Failed to store prediction for '" + normalizedName + "'", e);
        }
        log.debug("Stored prediction for '{}' with {} entries", normalizedName, record.entries().size());
    }

    /**
     * Removes the record for the name, if any.
     *
     * @return true if a record was removed
     */
    public boolean evict(String normalizedName) {
        try {
            Integer removed = transactionTemplate.execute(status -> repository.deleteByNormalizedName(normalizedName));
            return removed != null && removed > 0;
        } catch (DataAccessException e) {
            log.error("Failed to evict cached prediction for '{}'", normalizedName, e);
            throw new StoreFailureException("Failed to evict cached prediction for '" + normalizedName + "'", e);
        }
    }

    private void upsert(String normalizedName, PredictionRecord record) {
        transactionTemplate.executeWithoutResult(status -> {
            NamePrediction entity = repository.findByNormalizedName(normalizedName)
                    .orElseGet(() -> new NamePrediction(normalizedName));
            entity.overwrite(record);
            repository.saveAndFlush(entity);
        });
    }
}
