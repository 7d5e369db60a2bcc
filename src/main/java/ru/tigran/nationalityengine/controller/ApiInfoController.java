package ru.tigran.nationalityengine.controller;

import io.swagger.v3.oas.annotations.security.SecurityRequirements;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Контроллер для информации об API и эндпоинтах
 */
@RestController
@RequestMapping("/api")
@Tag(name = "API Info", description = "Информация об API и доступных эндпоинтах")
public class ApiInfoController {

    @GetMapping("/endpoints")
    @SecurityRequirements()
    public ResponseEntity<ApiEndpointsResponse> getEndpoints() {
        return ResponseEntity.ok(new ApiEndpointsResponse(
                "Name Nationality Engine API",
                "Национальность по имени с метаданными стран и статистикой популярных имен",
                "1.0.0",
                List.of(
                    new EndpointGroup(
                            "Аутентификация",
                            "Регистрация и вход пользователей",
                            List.of(
                                    new ApiEndpoint("POST", "/api/v1/auth/register", "Регистрация нового пользователя", false),
                                    new ApiEndpoint("POST", "/api/v1/auth/login", "Вход в систему и получение JWT токена", false),
                                    new ApiEndpoint("GET", "/api/v1/auth/me", "Профиль текущего пользователя", true)
                            )
                    ),
                    new EndpointGroup(
                            "Имена",
                            "Предсказание национальности и популярные имена",
                            List.of(
                                    new ApiEndpoint("GET", "/api/v1/names?name={name}", "Страны для имени с метаданными (кэшируется)", true),
                                    new ApiEndpoint("POST", "/api/v1/names/refresh?name={name}", "Принудительно обновить предсказание", true),
                                    new ApiEndpoint("GET", "/api/v1/popular-names?country={code}&limit={n}", "Популярные имена страны", true)
                            )
                    ),
                    new EndpointGroup(
                            "Документация",
                            "Доступ к документации API",
                            List.of(
                                    new ApiEndpoint("GET", "/swagger-ui.html", "Интерактивная документация Swagger UI", false),
                                    new ApiEndpoint("GET", "/v3/api-docs", "OpenAPI документация в JSON формате", false),
                                    new ApiEndpoint("GET", "/api/endpoints", "Получить список всех эндпоинтов", false)
                            )
                    )
                )
        ));
    }

    public record ApiEndpointsResponse(String title, String description, String version, List<EndpointGroup> groups) {
    }

    public record EndpointGroup(String name, String description, List<ApiEndpoint> endpoints) {
    }

    public record ApiEndpoint(String method, String path, String description, boolean requiresAuth) {
    }
}
