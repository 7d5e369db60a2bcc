package ru.tigran.nationalityengine.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.domain.AuditorAware;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

import java.util.Optional;

/**
 * Конфигурация для поддержки аудита сущностей
 * Автоматически заполняет createdBy, updatedBy, createdAt, updatedAt
 */
@Configuration
@EnableJpaAuditing
public class AuditingConfig {

    /**
     * Текущий пользователь из SecurityContext (userId из JWT), иначе 'system'
     */
    @Bean
    public AuditorAware<String> auditorAware() {
        return () -> {
            Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
            if (authentication == null
                    || authentication instanceof AnonymousAuthenticationToken
                    || authentication.getPrincipal() == null) {
                return Optional.of("system");
            }
            return Optional.of(String.valueOf(authentication.getPrincipal()));
        };
    }
}
