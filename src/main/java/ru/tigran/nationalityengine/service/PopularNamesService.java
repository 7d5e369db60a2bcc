package ru.tigran.nationalityengine.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import ru.tigran.nationalityengine.config.NationalityEngineProperties;
import ru.tigran.nationalityengine.dto.PopularName;
import ru.tigran.nationalityengine.exception.ErrorCode;
import ru.tigran.nationalityengine.exception.ValidationException;
import ru.tigran.nationalityengine.util.NameNormalizer;

import java.util.List;
import java.util.regex.Pattern;

/**
 * "Most popular names for a country" query.
 * Input is validated before the counters are touched.
 */
@Slf4j
@Service
public class PopularNamesService {

    private static final Pattern COUNTRY_CODE = Pattern.compile("^[A-Za-z]{2}$");

    private final PopularityCounter popularityCounter;
    private final int maxLimit;

    public PopularNamesService(PopularityCounter popularityCounter, NationalityEngineProperties properties) {
        this.popularityCounter = popularityCounter;
        this.maxLimit = properties.getPopularity().getMaxLimit();
    }

    /**
     * @param countryCode two ASCII letters, any case
     * @param limit 1..max-limit
     * @return names ordered by count descending, ties by name ascending; empty for an unknown country
     */
    public List<PopularName> mostPopular(String countryCode, int limit) {
        if (countryCode == null || !COUNTRY_CODE.matcher(countryCode).matches()) {
            log.warn("Rejected popular names query: invalid country code '{}'", countryCode);
            throw new ValidationException(ErrorCode.INVALID_COUNTRY_CODE);
        }
        if (limit < 1 || limit > maxLimit) {
            throw new ValidationException(
                    "Limit must be between 1 and " + maxLimit + ", got " + limit,
                    ErrorCode.INVALID_LIMIT.getCode()
            );
        }

        String code = NameNormalizer.normalizeCountryCode(countryCode);
        List<PopularName> names = popularityCounter.topN(code, limit);
        log.info("Popular names for {}: {} results (limit {})", code, names.size(), limit);
        return names;
    }
}
