package ru.tigran.nationalityengine.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.util.UriComponentsBuilder;
import ru.tigran.nationalityengine.config.NationalityEngineProperties;
import ru.tigran.nationalityengine.dto.CountryDetail;
import ru.tigran.nationalityengine.dto.NationalityCandidate;
import ru.tigran.nationalityengine.exception.UpstreamException;
import ru.tigran.nationalityengine.exception.UpstreamMalformedException;
import ru.tigran.nationalityengine.exception.UpstreamUnavailableException;
import ru.tigran.nationalityengine.util.NameNormalizer;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * HTTP client for the two external data sources: Nationalize.io (name to country probabilities)
 * and REST Countries (country metadata).
 *
 * Every call either returns a parsed value or throws an {@link UpstreamException}:
 * - {@link UpstreamUnavailableException}: network error, timeout, 5xx/429, open circuit breaker
 * - {@link UpstreamMalformedException}: the service answered, but the body cannot be used
 *
 * No retries here, the caller decides.
 */
@Slf4j
@Service
public class ExternalApiGateway {

    public static final String NATIONALIZE_SERVICE = "nationalize";
    public static final String REST_COUNTRIES_SERVICE = "restcountries";

    private static final Pattern SCHEME = Pattern.compile("^(http|https)://", Pattern.CASE_INSENSITIVE);
    private static final Pattern COUNTRY_CODE = Pattern.compile("^[A-Za-z]{2}$");

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final CircuitBreaker nationalizeCircuitBreaker;
    private final CircuitBreaker restCountriesCircuitBreaker;
    private final String nationalizeBaseUrl;
    private final String countryBaseUrl;

    public ExternalApiGateway(
            RestClient restClient,
            ObjectMapper objectMapper,
            @Qualifier("nationalizeCircuitBreaker") CircuitBreaker nationalizeCircuitBreaker,
            @Qualifier("restCountriesCircuitBreaker") CircuitBreaker restCountriesCircuitBreaker,
            NationalityEngineProperties properties
    ) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
        this.nationalizeCircuitBreaker = nationalizeCircuitBreaker;
        this.restCountriesCircuitBreaker = restCountriesCircuitBreaker;
        this.nationalizeBaseUrl = properties.getExternal().getNationalizeBaseUrl();
        this.countryBaseUrl = properties.getExternal().getCountryBaseUrl();
    }

    /**
     * Fetches nationality candidates for a name.
     *
     * Expected response structure:
     * {
     *   "count": 23,
     *   "name": "john",
     *   "country": [{"country_id": "US", "probability": 0.08}, ...]
     * }
     *
     * An empty "country" array is a valid answer and yields an empty list.
     * Entries without a usable country_id or probability are skipped.
     *
     * @param name Name as entered by the user (trimmed)
     * @return Candidates, probability descending, ties by country code ascending
     */
    public List<NationalityCandidate> fetchCandidates(String name) {
        URI uri = UriComponentsBuilder.fromHttpUrl(nationalizeBaseUrl)
                .queryParam("name", name)
                .encode()
                .build()
                .toUri();

        log.debug("Fetching nationality candidates for '{}'", name);
        String body = get(NATIONALIZE_SERVICE, nationalizeCircuitBreaker, uri, false);
        List<NationalityCandidate> candidates = parseCandidates(body);
        log.info("Nationalize.io returned {} candidates for '{}'", candidates.size(), name);
        return candidates;
    }

    /**
     * Fetches metadata for one country by its ISO 3166-1 alpha-2 code.
     * REST Countries answers GET /alpha/{code} with a JSON array, the first element is used.
     * 404 means the service does not know the code and is reported as malformed.
     */
    public CountryDetail fetchCountryDetail(String countryCode) {
        if (countryCode == null || !COUNTRY_CODE.matcher(countryCode).matches()) {
            throw new UpstreamMalformedException(REST_COUNTRIES_SERVICE,
                    "Country code '" + countryCode + "' is not an ISO 3166-1 alpha-2 code");
        }
        URI uri = UriComponentsBuilder.fromHttpUrl(countryBaseUrl)
                .pathSegment("alpha", NameNormalizer.normalizeCountryCode(countryCode))
                .build()
                .toUri();

        log.debug("Fetching country detail for {}", countryCode);
        String body = get(REST_COUNTRIES_SERVICE, restCountriesCircuitBreaker, uri, true);
        return parseCountryDetail(body);
    }

    private String get(String service, CircuitBreaker circuitBreaker, URI uri, boolean clientErrorIsMalformed) {
        try {
            return circuitBreaker.executeSupplier(() -> doGet(service, uri, clientErrorIsMalformed));
        } catch (CallNotPermittedException e) {
            log.warn("{} call rejected: circuit breaker is open", service);
            throw new UpstreamUnavailableException(service, service + " circuit breaker is open", e);
        }
    }

    private String doGet(String service, URI uri, boolean clientErrorIsMalformed) {
        try {
            String body = restClient.get()
                    .uri(uri)
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (request, response) -> {
                        HttpStatusCode status = response.getStatusCode();
                        // 429 и 5xx - временная недоступность, остальные 4xx - ответ, с которым нечего делать
                        if (clientErrorIsMalformed && status.is4xxClientError()
                                && status.value() != HttpStatus.TOO_MANY_REQUESTS.value()) {
                            throw new UpstreamMalformedException(service,
                                    service + " rejected request " + uri.getPath() + " with status " + status.value());
                        }
                        log.warn("{} returned HTTP {}", service, status.value());
                        throw new UpstreamUnavailableException(service,
                                service + " returned HTTP " + status.value());
                    })
                    .body(String.class);

            if (body == null || body.isBlank()) {
                throw new UpstreamMalformedException(service, service + " returned an empty body");
            }
            return body;
        } catch (UpstreamException e) {
            throw e;
        } catch (RestClientException e) {
            // Timeout, connection refused, DNS: ResourceAccessException
            log.warn("{} call failed: {}", service, e.getMessage());
            throw new UpstreamUnavailableException(service, service + " is unreachable: " + e.getMessage(), e);
        }
    }

    List<NationalityCandidate> parseCandidates(String body) {
        JsonNode root = readTree(NATIONALIZE_SERVICE, body);
        JsonNode countries = root.get("country");
        if (countries == null || !countries.isArray()) {
            throw new UpstreamMalformedException(NATIONALIZE_SERVICE, "Response has no 'country' array");
        }

        List<NationalityCandidate> candidates = new ArrayList<>();
        for (JsonNode entry : countries) {
            JsonNode countryId = entry.get("country_id");
            JsonNode probability = entry.get("probability");
            if (countryId == null || !countryId.isTextual() || countryId.asText().isBlank()
                    || probability == null || !probability.isNumber()) {
                log.warn("Skipping malformed nationality entry: {}", entry);
                continue;
            }
            double value = probability.asDouble();
            if (value < 0.0 || value > 1.0) {
                log.warn("Skipping nationality entry with probability out of range: {}", entry);
                continue;
            }
            candidates.add(new NationalityCandidate(NameNormalizer.normalizeCountryCode(countryId.asText()), value));
        }

        candidates.sort(NationalityCandidate.RANKING);
        return candidates;
    }

    CountryDetail parseCountryDetail(String body) {
        JsonNode root = readTree(REST_COUNTRIES_SERVICE, body);
        JsonNode country = root.isArray() ? root.path(0) : root;
        if (!country.isObject()) {
            throw new UpstreamMalformedException(REST_COUNTRIES_SERVICE, "Response contains no country object");
        }

        String code = text(country.get("cca2"));
        String commonName = text(country.path("name").get("common"));
        if (code == null || commonName == null) {
            throw new UpstreamMalformedException(REST_COUNTRIES_SERVICE, "Country object lacks cca2 or name.common");
        }

        JsonNode latlng = country.path("capitalInfo").path("latlng");
        boolean hasLatLng = latlng.isArray() && latlng.size() == 2
                && latlng.get(0).isNumber() && latlng.get(1).isNumber();

        JsonNode capital = country.get("capital");
        String capitalName = capital != null && capital.isArray() ? text(capital.path(0)) : text(capital);

        List<String> borders = new ArrayList<>();
        JsonNode bordersNode = country.get("borders");
        if (bordersNode != null && bordersNode.isArray()) {
            bordersNode.forEach(border -> {
                if (border.isTextual()) {
                    borders.add(border.asText());
                }
            });
        }

        JsonNode independent = country.get("independent");
        JsonNode population = country.get("population");

        return CountryDetail.builder()
                .countryCode(NameNormalizer.normalizeCountryCode(code))
                .commonName(commonName)
                .officialName(text(country.path("name").get("official")))
                .region(text(country.get("region")))
                .subregion(text(country.get("subregion")))
                .population(population != null && population.canConvertToLong() ? population.asLong() : null)
                .independent(independent != null && independent.isBoolean() ? independent.asBoolean() : null)
                .capitalName(capitalName)
                .capitalLatitude(hasLatLng ? latlng.get(0).asDouble() : null)
                .capitalLongitude(hasLatLng ? latlng.get(1).asDouble() : null)
                .flagPngUrl(ensureHttpsUrl(text(country.path("flags").get("png"))))
                .flagSvgUrl(ensureHttpsUrl(text(country.path("flags").get("svg"))))
                .flagAltText(text(country.path("flags").get("alt")))
                .googleMapsUrl(ensureHttpsUrl(text(country.path("maps").get("googleMaps"))))
                .openStreetMapUrl(ensureHttpsUrl(text(country.path("maps").get("openStreetMaps"))))
                .coatOfArmsPngUrl(ensureHttpsUrl(text(country.path("coatOfArms").get("png"))))
                .coatOfArmsSvgUrl(ensureHttpsUrl(text(country.path("coatOfArms").get("svg"))))
                .borders(List.copyOf(borders))
                .build();
    }

    /**
     * Prepends https:// to a URL without a scheme. Leading slashes are dropped first.
     */
    static String ensureHttpsUrl(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        if (SCHEME.matcher(url).find()) {
            return url;
        }
        return "https://" + url.replaceFirst("^/+", "");
    }

    private JsonNode readTree(String service, String body) {
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new UpstreamMalformedException(service, service + " returned a body that is not JSON", e);
        }
    }

    private static String text(JsonNode node) {
        if (node == null || !node.isTextual() || node.asText().isBlank()) {
            return null;
        }
        return node.asText();
    }
}
