package ru.tigran.nationalityengine.controller;

import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import ru.tigran.nationalityengine.exception.ErrorCode;
import ru.tigran.nationalityengine.exception.UnauthorizedException;

import java.util.Optional;

/**
 * Извлекает userId из SecurityContext (principal выставляет JwtAuthenticationFilter).
 */
final class AuthenticatedUser {

    private AuthenticatedUser() {
    }

    /**
     * @return User ID из JWT токена
     * @throws UnauthorizedException если аутентификация отсутствует
     */
    static Long id() {
        return Optional
                .ofNullable(SecurityContextHolder.getContext().getAuthentication())
                .map(Authentication::getPrincipal)
                .filter(Long.class::isInstance)
                .map(Long.class::cast)
                .orElseThrow(() -> new UnauthorizedException(
                        ErrorCode.MISSING_AUTHENTICATION.getDefaultMessage(),
                        ErrorCode.MISSING_AUTHENTICATION.getCode()
                ));
    }
}
