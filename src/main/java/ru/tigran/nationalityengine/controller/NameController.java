package ru.tigran.nationalityengine.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import ru.tigran.nationalityengine.dto.NamePredictionResponse;
import ru.tigran.nationalityengine.dto.PopularName;
import ru.tigran.nationalityengine.dto.PopularNamesResponse;
import ru.tigran.nationalityengine.dto.PredictionRecord;
import ru.tigran.nationalityengine.service.NationalityPredictionService;
import ru.tigran.nationalityengine.service.PopularNamesService;
import ru.tigran.nationalityengine.util.NameNormalizer;

import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/v1")
@Tag(name = "Names", description = "Национальность по имени и популярные имена по странам")
@SecurityRequirement(name = "bearer-jwt")
public class NameController {

    private final NationalityPredictionService predictionService;
    private final PopularNamesService popularNamesService;

    public NameController(NationalityPredictionService predictionService, PopularNamesService popularNamesService) {
        this.predictionService = predictionService;
        this.popularNamesService = popularNamesService;
    }

    @GetMapping("/names")
    @Operation(
            summary = "Национальности для имени",
            description = "Возвращает вероятные страны для имени с метаданными стран. " +
                    "Ответ кэшируется; пустой список countries означает, что сервис не знает имя."
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Предсказание",
                    content = @Content(schema = @Schema(implementation = NamePredictionResponse.class))
            ),
            @ApiResponse(responseCode = "400", description = "Пустое имя"),
            @ApiResponse(responseCode = "503", description = "Nationalize.io недоступен, повторите позже (Retry-After)")
    })
    public ResponseEntity<NamePredictionResponse> getName(
            @Parameter(description = "Имя", example = "John") @RequestParam String name
    ) {
        log.info("GET /api/v1/names - user: {}, name: '{}'", AuthenticatedUser.id(), name);

        PredictionRecord record = predictionService.predict(name);

        return ResponseEntity.ok(NamePredictionResponse.from(name.strip(), record));
    }

    @PostMapping("/names/refresh")
    @Operation(
            summary = "Обновить предсказание",
            description = "Запрашивает Nationalize.io повторно, даже если в кэше есть свежая запись, и перезаписывает ее."
    )
    public ResponseEntity<NamePredictionResponse> refreshName(@RequestParam String name) {
        log.info("POST /api/v1/names/refresh - user: {}, name: '{}'", AuthenticatedUser.id(), name);

        PredictionRecord record = predictionService.refresh(name);

        return ResponseEntity.ok(NamePredictionResponse.from(name.strip(), record));
    }

    @GetMapping("/popular-names")
    @Operation(
            summary = "Популярные имена страны",
            description = "Самые запрашиваемые имена для страны (ISO 3166-1 alpha-2), по убыванию частоты."
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Список имен, пустой для неизвестной страны",
                    content = @Content(schema = @Schema(implementation = PopularNamesResponse.class))
            ),
            @ApiResponse(responseCode = "400", description = "Неверный код страны или limit")
    })
    public ResponseEntity<PopularNamesResponse> getPopularNames(
            @Parameter(description = "Код страны", example = "US") @RequestParam String country,
            @RequestParam(defaultValue = "${app.popularity.default-limit:5}") int limit
    ) {
        log.info("GET /api/v1/popular-names - user: {}, country: {}, limit: {}", AuthenticatedUser.id(), country, limit);

        List<PopularName> names = popularNamesService.mostPopular(country, limit);

        return ResponseEntity.ok(PopularNamesResponse.from(NameNormalizer.normalizeCountryCode(country), names));
    }
}
