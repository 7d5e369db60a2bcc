package ru.tigran.nationalityengine.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Настройки движка предсказаний (prefix "app").
 * Значения по умолчанию совпадают с application.yml.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "app")
public class NationalityEngineProperties {

    private External external = new External();
    private Cache cache = new Cache();
    private Prediction prediction = new Prediction();
    private Popularity popularity = new Popularity();

    @Data
    public static class External {
        private String nationalizeBaseUrl = "https://api.nationalize.io";
        private String countryBaseUrl = "https://restcountries.com/v3.1";
        private Duration requestTimeout = Duration.ofSeconds(5);
    }

    @Data
    public static class Cache {
        /**
         * Возраст записи, после которого она считается устаревшей. Zero = никогда не устаревает.
         */
        private Duration ttl = Duration.ofDays(1);
    }

    @Data
    public static class Prediction {
        private int candidateFetchAttempts = 1;
        private Duration candidateFetchBackoff = Duration.ofMillis(200);
        private int lookupCorePoolSize = 4;
        private int lookupMaxPoolSize = 16;
        private int lookupQueueCapacity = 100;
    }

    @Data
    public static class Popularity {
        private Scope scope = Scope.TOP_CANDIDATE;
        private boolean countCacheHits = false;
        private int maxLimit = 100;
        private int defaultLimit = 5;
    }

    /**
     * Какие страны из ответа получают +1 к популярности имени.
     */
    public enum Scope {
        TOP_CANDIDATE,
        ALL_CANDIDATES
    }
}
