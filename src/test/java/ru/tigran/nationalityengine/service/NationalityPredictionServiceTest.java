package ru.tigran.nationalityengine.service;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import ru.tigran.nationalityengine.config.NationalityEngineProperties;
import ru.tigran.nationalityengine.dto.CountryDetail;
import ru.tigran.nationalityengine.dto.NationalityCandidate;
import ru.tigran.nationalityengine.dto.PredictionEntry;
import ru.tigran.nationalityengine.dto.PredictionRecord;
import ru.tigran.nationalityengine.exception.ErrorCode;
import ru.tigran.nationalityengine.exception.PredictionUnavailableException;
import ru.tigran.nationalityengine.exception.StoreFailureException;
import ru.tigran.nationalityengine.exception.UpstreamMalformedException;
import ru.tigran.nationalityengine.exception.UpstreamUnavailableException;
import ru.tigran.nationalityengine.exception.ValidationException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit-тесты для NationalityPredictionService.
 * Внешние сервисы и хранилища замоканы, поиск стран выполняется в вызывающем потоке.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("NationalityPredictionService unit тесты")
class NationalityPredictionServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock
    private ExternalApiGateway externalApiGateway;

    @Mock
    private CountryDetailStore countryDetailStore;

    @Mock
    private PredictionCacheStore cacheStore;

    @Mock
    private PopularityCounter popularityCounter;

    private NationalityEngineProperties properties;
    private SimpleMeterRegistry meterRegistry;

    private static final NationalityCandidate US = new NationalityCandidate("US", 0.08);
    private static final NationalityCandidate GB = new NationalityCandidate("GB", 0.05);
    private static final NationalityCandidate AU = new NationalityCandidate("AU", 0.04);

    @BeforeEach
    void setUp() {
        properties = new NationalityEngineProperties();
        meterRegistry = new SimpleMeterRegistry();
    }

    private NationalityPredictionService service(int fetchAttempts) {
        Retry retry = Retry.of("candidateFetch", RetryConfig.custom()
                .maxAttempts(fetchAttempts)
                .waitDuration(Duration.ofMillis(10))
                .retryExceptions(UpstreamUnavailableException.class)
                .build());
        return new NationalityPredictionService(
                externalApiGateway,
                countryDetailStore,
                cacheStore,
                popularityCounter,
                Runnable::run,
                retry,
                Clock.fixed(NOW, ZoneOffset.UTC),
                properties,
                meterRegistry
        );
    }

    private NationalityPredictionService service() {
        return service(1);
    }

    private static CountryDetail detail(String code, String name) {
        return CountryDetail.builder().countryCode(code).commonName(name).borders(List.of()).build();
    }

    // ===== КЭШ =====

    @Test
    @DisplayName("predict - свежая запись в кэше отдается без внешних вызовов")
    void predictCacheHitMakesNoExternalCalls() {
        PredictionRecord cached = new PredictionRecord("john",
                List.of(new PredictionEntry(US, detail("US", "United States"))), NOW.minusSeconds(60));
        when(cacheStore.getFresh("john")).thenReturn(Optional.of(cached));

        PredictionRecord result = service().predict("  JoHn ");

        assertSame(cached, result);
        verifyNoInteractions(externalApiGateway, countryDetailStore, popularityCounter);
        verify(cacheStore, never()).put(anyString(), any());
        assertEquals(1.0, meterRegistry.counter("prediction.cache.hit").count());
    }

    @Test
    @DisplayName("predict - при count-cache-hits=true попадание в кэш увеличивает популярность")
    void predictCacheHitCountsWhenConfigured() {
        properties.getPopularity().setCountCacheHits(true);
        PredictionRecord cached = new PredictionRecord("john",
                List.of(new PredictionEntry(US, null), new PredictionEntry(GB, null)), NOW);
        when(cacheStore.getFresh("john")).thenReturn(Optional.of(cached));

        service().predict("John");

        verify(popularityCounter).increment("US", "john");
        verifyNoMoreInteractions(popularityCounter);
        verifyNoInteractions(externalApiGateway);
    }

    @Test
    @DisplayName("predict - промах: данные собираются, записываются в кэш и возвращаются")
    void predictMissWritesThrough() {
        when(cacheStore.getFresh("john")).thenReturn(Optional.empty());
        when(externalApiGateway.fetchCandidates("John")).thenReturn(List.of(US, GB));
        when(countryDetailStore.resolve("US")).thenReturn(detail("US", "United States"));
        when(countryDetailStore.resolve("GB")).thenReturn(detail("GB", "United Kingdom"));

        PredictionRecord result = service().predict("  John ");

        ArgumentCaptor<PredictionRecord> stored = ArgumentCaptor.forClass(PredictionRecord.class);
        verify(cacheStore).put(eq("john"), stored.capture());
        assertEquals(result, stored.getValue());

        assertEquals("john", result.normalizedName());
        assertEquals(NOW, result.fetchedAt());
        assertEquals(List.of("US", "GB"),
                result.entries().stream().map(e -> e.candidate().countryCode()).toList());
        assertTrue(result.entries().stream().allMatch(PredictionEntry::isDetailAvailable));
        assertEquals(1.0, meterRegistry.counter("prediction.cache.miss").count());
    }

    @Test
    @DisplayName("predict - по умолчанию популярность увеличивается только для первой страны")
    void predictIncrementsTopCandidateByDefault() {
        when(cacheStore.getFresh("john")).thenReturn(Optional.empty());
        when(externalApiGateway.fetchCandidates("john")).thenReturn(List.of(US, GB));
        when(countryDetailStore.resolve(anyString())).thenReturn(detail("XX", "Somewhere"));

        service().predict("john");

        verify(popularityCounter).increment("US", "john");
        verifyNoMoreInteractions(popularityCounter);
    }

    @Test
    @DisplayName("predict - scope ALL_CANDIDATES увеличивает популярность для всех стран")
    void predictIncrementsAllCandidatesWhenConfigured() {
        properties.getPopularity().setScope(NationalityEngineProperties.Scope.ALL_CANDIDATES);
        when(cacheStore.getFresh("john")).thenReturn(Optional.empty());
        when(externalApiGateway.fetchCandidates("john")).thenReturn(List.of(US, GB, AU));
        when(countryDetailStore.resolve(anyString())).thenReturn(detail("XX", "Somewhere"));

        service().predict("john");

        verify(popularityCounter).increment("US", "john");
        verify(popularityCounter).increment("GB", "john");
        verify(popularityCounter).increment("AU", "john");
    }

    // ===== ЧАСТИЧНЫЕ ОТКАЗЫ =====

    @Test
    @DisplayName("predict - сбой метаданных одной страны не прерывает запрос")
    void predictSurvivesSingleCountryFailure() {
        when(cacheStore.getFresh("john")).thenReturn(Optional.empty());
        when(externalApiGateway.fetchCandidates("john")).thenReturn(List.of(US, GB, AU));
        when(countryDetailStore.resolve("US")).thenReturn(detail("US", "United States"));
        when(countryDetailStore.resolve("GB"))
                .thenThrow(new UpstreamUnavailableException("restcountries", "timeout"));
        when(countryDetailStore.resolve("AU")).thenReturn(detail("AU", "Australia"));

        PredictionRecord result = service().predict("john");

        assertEquals(3, result.entries().size());
        assertTrue(result.entries().get(0).isDetailAvailable());
        assertFalse(result.entries().get(1).isDetailAvailable());
        assertEquals(GB, result.entries().get(1).candidate());
        assertTrue(result.entries().get(2).isDetailAvailable());
        verify(cacheStore).put("john", result);
    }

    @Test
    @DisplayName("predict - непредвиденная ошибка поиска страны тоже дает запись без метаданных")
    void predictSurvivesUnexpectedLookupFailure() {
        when(cacheStore.getFresh("john")).thenReturn(Optional.empty());
        when(externalApiGateway.fetchCandidates("john")).thenReturn(List.of(US));
        when(countryDetailStore.resolve("US")).thenThrow(new StoreFailureException("db down", null));

        PredictionRecord result = service().predict("john");

        assertEquals(1, result.entries().size());
        assertFalse(result.entries().get(0).isDetailAvailable());
    }

    @Test
    @DisplayName("predict - пустой ответ сервиса кэшируется и не трогает популярность")
    void predictCachesEmptyResult() {
        when(cacheStore.getFresh("xqzv")).thenReturn(Optional.empty());
        when(externalApiGateway.fetchCandidates("xqzv")).thenReturn(List.of());

        PredictionRecord result = service().predict("xqzv");

        assertTrue(result.isEmpty());
        verify(cacheStore).put("xqzv", result);
        verifyNoInteractions(countryDetailStore, popularityCounter);
    }

    // ===== ОТКАЗ ПРЕДСКАЗАНИЯ =====

    @Test
    @DisplayName("predict - недоступность Nationalize.io дает PredictionUnavailable, кэш не меняется")
    void predictUpstreamUnavailable() {
        when(cacheStore.getFresh("john")).thenReturn(Optional.empty());
        when(externalApiGateway.fetchCandidates("john"))
                .thenThrow(new UpstreamUnavailableException("nationalize", "HTTP 503"));

        PredictionUnavailableException exception = assertThrows(
                PredictionUnavailableException.class, () -> service().predict("john"));

        assertEquals(ErrorCode.PREDICTION_UNAVAILABLE.getCode(), exception.getErrorCode());
        assertTrue(exception.isRetriable());
        verify(cacheStore, never()).put(anyString(), any());
        verifyNoInteractions(countryDetailStore, popularityCounter);
        assertEquals(1.0, meterRegistry.counter("prediction.upstream.failure").count());
    }

    @Test
    @DisplayName("predict - некорректный ответ Nationalize.io не повторяется")
    void predictMalformedIsNotRetried() {
        when(cacheStore.getFresh("john")).thenReturn(Optional.empty());
        when(externalApiGateway.fetchCandidates("john"))
                .thenThrow(new UpstreamMalformedException("nationalize", "no country array"));

        assertThrows(PredictionUnavailableException.class, () -> service(3).predict("john"));

        verify(externalApiGateway, times(1)).fetchCandidates("john");
        verify(cacheStore, never()).put(anyString(), any());
    }

    @Test
    @DisplayName("predict - временная недоступность повторяется, если разрешено несколько попыток")
    void predictRetriesUnavailableWhenConfigured() {
        when(cacheStore.getFresh("john")).thenReturn(Optional.empty());
        when(externalApiGateway.fetchCandidates("john"))
                .thenThrow(new UpstreamUnavailableException("nationalize", "reset"))
                .thenReturn(List.of(US));
        when(countryDetailStore.resolve("US")).thenReturn(detail("US", "United States"));

        PredictionRecord result = service(2).predict("john");

        assertEquals(1, result.entries().size());
        verify(externalApiGateway, times(2)).fetchCandidates("john");
    }

    // ===== ВАЛИДАЦИЯ И REFRESH =====

    @Test
    @DisplayName("predict - пустое имя отклоняется до обращения к кэшу")
    void predictRejectsBlankName() {
        ValidationException exception = assertThrows(ValidationException.class, () -> service().predict("   "));

        assertEquals(ErrorCode.INVALID_INPUT.getCode(), exception.getErrorCode());
        verifyNoInteractions(cacheStore, externalApiGateway);
    }

    @Test
    @DisplayName("predict - имя только из Unicode-пробелов отклоняется без вызова Nationalize.io")
    void predictRejectsUnicodeWhitespaceName() {
        ValidationException exception = assertThrows(ValidationException.class,
                () -> service(3).predict("\u3000\u2003"));

        assertEquals(ErrorCode.INVALID_INPUT.getCode(), exception.getErrorCode());
        verifyNoInteractions(cacheStore, externalApiGateway);
    }

    @Test
    @DisplayName("predict - Unicode-пробелы по краям не меняют ключ кэша и имя для Nationalize.io")
    void predictStripsUnicodeWhitespace() {
        when(cacheStore.getFresh("anna")).thenReturn(Optional.empty());
        when(externalApiGateway.fetchCandidates("Anna")).thenReturn(List.of());

        PredictionRecord result = service().predict("\u3000Anna\u2003");

        assertEquals("anna", result.normalizedName());
        verify(externalApiGateway).fetchCandidates("Anna");
        verify(cacheStore).put(eq("anna"), any(PredictionRecord.class));
    }

    @Test
    @DisplayName("refresh - игнорирует свежую запись и перезаписывает кэш")
    void refreshBypassesCache() {
        when(externalApiGateway.fetchCandidates("John")).thenReturn(List.of(US));
        when(countryDetailStore.resolve("US")).thenReturn(detail("US", "United States"));

        PredictionRecord result = service().refresh("John");

        verify(cacheStore, never()).getFresh(anyString());
        verify(cacheStore).put("john", result);
        assertEquals(NOW, result.fetchedAt());
    }

    @Test
    @DisplayName("refresh - при сбое Nationalize.io прежняя запись остается в кэше")
    void refreshKeepsCachedRecordOnUpstreamFailure() {
        when(externalApiGateway.fetchCandidates("John"))
                .thenThrow(new UpstreamUnavailableException("nationalize", "nationalize returned HTTP 503"));

        assertThrows(PredictionUnavailableException.class, () -> service().refresh("John"));

        verify(cacheStore, never()).evict(anyString());
        verify(cacheStore, never()).put(anyString(), any());
    }
}
