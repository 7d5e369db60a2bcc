package ru.tigran.nationalityengine.service;

import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import ru.tigran.nationalityengine.config.NationalityEngineProperties;
import ru.tigran.nationalityengine.dto.CountryDetail;
import ru.tigran.nationalityengine.dto.NationalityCandidate;
import ru.tigran.nationalityengine.dto.PredictionEntry;
import ru.tigran.nationalityengine.dto.PredictionRecord;
import ru.tigran.nationalityengine.exception.ErrorCode;
import ru.tigran.nationalityengine.exception.PredictionUnavailableException;
import ru.tigran.nationalityengine.exception.UpstreamException;
import ru.tigran.nationalityengine.exception.ValidationException;
import ru.tigran.nationalityengine.util.NameNormalizer;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Cache-aside aggregation of a nationality prediction.
 *
 * Flow for {@link #predict(String)}:
 * 1. Normalize the name (trim + lower case), blank names are rejected
 * 2. Fresh cached record: return it, no external calls
 * 3. Otherwise fetch candidates from Nationalize.io; any failure here aborts the request
 *    and nothing is cached
 * 4. Resolve country metadata for every candidate in parallel; a failed lookup only
 *    marks that entry as "metadata unavailable"
 * 5. Write the record through to the cache
 * 6. Increment popularity counters according to the configured scope
 *
 * External calls never run inside a database transaction: every store call commits on its own.
 */
@Slf4j
@Service
public class NationalityPredictionService {

    private final ExternalApiGateway externalApiGateway;
    private final CountryDetailStore countryDetailStore;
    private final PredictionCacheStore cacheStore;
    private final PopularityCounter popularityCounter;
    private final Executor countryLookupExecutor;
    private final Retry candidateFetchRetry;
    private final Clock clock;
    private final NationalityEngineProperties.Popularity popularityPolicy;

    private final Counter cacheHitCounter;
    private final Counter cacheMissCounter;
    private final Counter upstreamFailureCounter;
    private final Timer aggregationTimer;

    public NationalityPredictionService(
            ExternalApiGateway externalApiGateway,
            CountryDetailStore countryDetailStore,
            PredictionCacheStore cacheStore,
            PopularityCounter popularityCounter,
            @Qualifier("countryLookupExecutor") Executor countryLookupExecutor,
            @Qualifier("candidateFetchRetry") Retry candidateFetchRetry,
            Clock clock,
            NationalityEngineProperties properties,
            MeterRegistry meterRegistry
    ) {
        this.externalApiGateway = externalApiGateway;
        this.countryDetailStore = countryDetailStore;
        this.cacheStore = cacheStore;
        this.popularityCounter = popularityCounter;
        this.countryLookupExecutor = countryLookupExecutor;
        this.candidateFetchRetry = candidateFetchRetry;
        this.clock = clock;
        this.popularityPolicy = properties.getPopularity();

        this.cacheHitCounter = Counter.builder("prediction.cache.hit")
                .description("Predictions served from the cache")
                .register(meterRegistry);
        this.cacheMissCounter = Counter.builder("prediction.cache.miss")
                .description("Predictions that required upstream calls")
                .register(meterRegistry);
        this.upstreamFailureCounter = Counter.builder("prediction.upstream.failure")
                .description("Predictions aborted because Nationalize.io failed")
                .register(meterRegistry);
        this.aggregationTimer = Timer.builder("prediction.aggregation.time")
                .description("Time to fetch, merge and store a prediction on cache miss")
                .register(meterRegistry);
    }

    /**
     * Returns the prediction for a name, from the cache when fresh.
     *
     * @param rawName Name as entered by the user
     * @return Aggregated record; an empty entry list means no nationality is known for the name
     * @throws ValidationException if the name is blank
     * @throws PredictionUnavailableException if the prediction service could not be used
     */
    public PredictionRecord predict(String rawName) {
        String normalizedName = normalize(rawName);

        Optional<PredictionRecord> cached = cacheStore.getFresh(normalizedName);
        if (cached.isPresent()) {
            cacheHitCounter.increment();
            log.info("Cache hit for '{}'", normalizedName);
            if (popularityPolicy.isCountCacheHits()) {
                incrementPopularity(cached.get());
            }
            return cached.get();
        }

        cacheMissCounter.increment();
        log.info("Cache miss for '{}', fetching from upstream", normalizedName);
        return aggregationTimer.record(() -> fetchAndStore(rawName, normalizedName));
    }

    /**
     * Fetches the prediction from upstream even if a fresh record is cached, and replaces it.
     */
    public PredictionRecord refresh(String rawName) {
        String normalizedName = normalize(rawName);
        log.info("Forced refresh for '{}'", normalizedName);
        cacheMissCounter.increment();
        return aggregationTimer.record(() -> fetchAndStore(rawName, normalizedName));
    }

    private PredictionRecord fetchAndStore(String rawName, String normalizedName) {
        List<NationalityCandidate> candidates = fetchCandidates(rawName.strip(), normalizedName);
        List<PredictionEntry> entries = resolveDetails(candidates);

        PredictionRecord record = new PredictionRecord(normalizedName, entries, clock.instant());
        cacheStore.put(normalizedName, record);

        incrementPopularity(record);

        log.info("Prediction for '{}' stored: {} candidates, {} without metadata",
                normalizedName, entries.size(),
                entries.stream().filter(entry -> !entry.isDetailAvailable()).count());
        return record;
    }

    private List<NationalityCandidate> fetchCandidates(String name, String normalizedName) {
        try {
            return Retry.decorateSupplier(candidateFetchRetry, () -> externalApiGateway.fetchCandidates(name)).get();
        } catch (UpstreamException e) {
            upstreamFailureCounter.increment();
            log.warn("Nationality candidates for '{}' unavailable from {}: {}",
                    normalizedName, e.getService(), e.getMessage());
            throw new PredictionUnavailableException(normalizedName, e);
        }
    }

    /**
     * Resolves country metadata for every candidate concurrently. Output keeps candidate order.
     */
    private List<PredictionEntry> resolveDetails(List<NationalityCandidate> candidates) {
        List<CompletableFuture<PredictionEntry>> lookups = candidates.stream()
                .map(candidate -> CompletableFuture
                        .supplyAsync(() -> new PredictionEntry(candidate, lookupDetail(candidate)), countryLookupExecutor)
                        .exceptionally(e -> {
                            log.warn("Country lookup for {} failed: {}", candidate.countryCode(), e.getMessage());
                            return PredictionEntry.withoutDetail(candidate);
                        }))
                .toList();

        return lookups.stream()
                .map(CompletableFuture::join)
                .toList();
    }

    private CountryDetail lookupDetail(NationalityCandidate candidate) {
        try {
            return countryDetailStore.resolve(candidate.countryCode());
        } catch (UpstreamException e) {
            log.warn("Country metadata for {} unavailable from {}: {}",
                    candidate.countryCode(), e.getService(), e.getMessage());
            return null;
        }
    }

    private void incrementPopularity(PredictionRecord record) {
        if (record.isEmpty()) {
            return;
        }
        switch (popularityPolicy.getScope()) {
            case TOP_CANDIDATE -> record.topEntry().ifPresent(entry ->
                    popularityCounter.increment(entry.candidate().countryCode(), record.normalizedName()));
            case ALL_CANDIDATES -> record.entries().forEach(entry ->
                    popularityCounter.increment(entry.candidate().countryCode(), record.normalizedName()));
        }
    }

    private static String normalize(String rawName) {
        String normalizedName = NameNormalizer.normalize(rawName);
        if (normalizedName.isEmpty()) {
            throw new ValidationException(ErrorCode.INVALID_INPUT);
        }
        return normalizedName;
    }
}
