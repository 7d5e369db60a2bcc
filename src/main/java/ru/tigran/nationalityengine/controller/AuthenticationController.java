package ru.tigran.nationalityengine.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.security.SecurityRequirements;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import ru.tigran.nationalityengine.dto.AuthenticationResponse;
import ru.tigran.nationalityengine.dto.LoginRequest;
import ru.tigran.nationalityengine.dto.RegisterRequest;
import ru.tigran.nationalityengine.dto.UserResponse;
import ru.tigran.nationalityengine.service.AuthenticationService;

/**
 * REST API for user authentication (registration, login, current user).
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/auth")
@Tag(name = "Authentication", description = "Регистрация и логин пользователей")
public class AuthenticationController {

    private final AuthenticationService authenticationService;

    public AuthenticationController(AuthenticationService authenticationService) {
        this.authenticationService = authenticationService;
    }

    @PostMapping("/register")
    @SecurityRequirements()
    @Operation(
            summary = "Регистрация нового пользователя",
            description = "Создает аккаунт с уникальным username. Пароль минимум 8 символов. " +
                    "Email и full_name необязательны."
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "201",
                    description = "Пользователь успешно зарегистрирован",
                    content = @Content(schema = @Schema(implementation = AuthenticationResponse.class))
            ),
            @ApiResponse(
                    responseCode = "400",
                    description = "Неверные данные регистрации или username уже занят"
            )
    })
    public ResponseEntity<AuthenticationResponse> register(
            @Valid @RequestBody RegisterRequest request
    ) {
        log.info("POST /api/v1/auth/register - username: {}", request.username());

        AuthenticationResponse response = authenticationService.register(request);

        return ResponseEntity
                .status(HttpStatus.CREATED)
                .body(response);
    }

    @PostMapping("/login")
    @SecurityRequirements()
    @Operation(
            summary = "Логин пользователя",
            description = "Проверяет username и пароль, возвращает JWT токен. " +
                    "Токен передается в заголовке Authorization: Bearer <token>"
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Успешная аутентификация",
                    content = @Content(schema = @Schema(implementation = AuthenticationResponse.class))
            ),
            @ApiResponse(
                    responseCode = "400",
                    description = "Неверный username или пароль, либо пользователь отключен"
            )
    })
    public ResponseEntity<AuthenticationResponse> login(
            @Valid @RequestBody LoginRequest request
    ) {
        log.info("POST /api/v1/auth/login - username: {}", request.username());

        AuthenticationResponse response = authenticationService.login(request);

        return ResponseEntity.ok(response);
    }

    @GetMapping("/me")
    @Operation(summary = "Текущий пользователь", description = "Профиль пользователя из JWT токена")
    public ResponseEntity<UserResponse> me() {
        Long userId = AuthenticatedUser.id();
        log.info("GET /api/v1/auth/me - user: {}", userId);
        return ResponseEntity.ok(authenticationService.getCurrentUser(userId));
    }
}
