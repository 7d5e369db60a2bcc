package ru.tigran.nationalityengine.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import ru.tigran.nationalityengine.dto.AuthenticationResponse;
import ru.tigran.nationalityengine.dto.LoginRequest;
import ru.tigran.nationalityengine.dto.RegisterRequest;
import ru.tigran.nationalityengine.dto.UserResponse;
import ru.tigran.nationalityengine.exception.ErrorCode;
import ru.tigran.nationalityengine.exception.ResourceNotFoundException;
import ru.tigran.nationalityengine.exception.ValidationException;
import ru.tigran.nationalityengine.model.User;
import ru.tigran.nationalityengine.repository.UserRepository;
import ru.tigran.nationalityengine.security.JwtTokenProvider;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit-тесты для AuthenticationService.
 * Тестирует бизнес-логику регистрации и логина с использованием Mockito.
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("AuthenticationService unit тесты")
class AuthenticationServiceTest {

    @Mock
    private UserRepository userRepository;

    @Mock
    private PasswordEncoder passwordEncoder;

    @Mock
    private JwtTokenProvider jwtTokenProvider;

    private AuthenticationService authenticationService;

    private static final String USERNAME = "testuser";
    private static final String VALID_PASSWORD = "password123";
    private static final String HASHED_PASSWORD = "$2a$10$hashedpassword";
    private static final String JWT_TOKEN = "eyJhbGciOiJIUzI1NiIsInR5cCI6IkpXVCJ9...";
    private static final Long USER_ID = 1L;

    @BeforeEach
    void setUp() {
        authenticationService = new AuthenticationService(
                userRepository,
                passwordEncoder,
                jwtTokenProvider
        );
    }

    private User storedUser(boolean active) {
        User user = new User();
        user.setId(USER_ID);
        user.setUsername(USERNAME);
        user.setPasswordHash(HASHED_PASSWORD);
        user.setIsActive(active);
        return user;
    }

    // ===== РЕГИСТРАЦИЯ (register) =====

    @Test
    @DisplayName("register - успешная регистрация нового пользователя")
    void registerSuccess() {
        RegisterRequest request = new RegisterRequest(USERNAME, VALID_PASSWORD, "test@example.com", "Test User");

        when(userRepository.existsByUsername(USERNAME)).thenReturn(false);
        when(passwordEncoder.encode(VALID_PASSWORD)).thenReturn(HASHED_PASSWORD);
        when(userRepository.saveAndFlush(any(User.class))).thenReturn(storedUser(true));
        when(jwtTokenProvider.generateToken(USER_ID, USERNAME)).thenReturn(JWT_TOKEN);
        when(jwtTokenProvider.getTokenValiditySeconds()).thenReturn(86400L);

        AuthenticationResponse response = authenticationService.register(request);

        assertNotNull(response);
        assertEquals(USER_ID, response.userId());
        assertEquals(JWT_TOKEN, response.accessToken());
        assertEquals("Bearer", response.tokenType());
        assertEquals(86400L, response.expiresIn());

        ArgumentCaptor<User> saved = ArgumentCaptor.forClass(User.class);
        verify(userRepository).saveAndFlush(saved.capture());
        assertEquals(USERNAME, saved.getValue().getUsername());
        assertEquals("test@example.com", saved.getValue().getEmail());
        assertEquals("Test User", saved.getValue().getFullName());
        assertEquals(HASHED_PASSWORD, saved.getValue().getPasswordHash());
        assertTrue(saved.getValue().getIsActive());
    }

    @Test
    @DisplayName("register - ошибка при существующем username")
    void registerUsernameAlreadyExists() {
        RegisterRequest request = new RegisterRequest(USERNAME, VALID_PASSWORD);
        when(userRepository.existsByUsername(USERNAME)).thenReturn(true);

        ValidationException exception = assertThrows(ValidationException.class,
                () -> authenticationService.register(request));

        assertEquals(ErrorCode.USERNAME_ALREADY_EXISTS.getCode(), exception.getErrorCode());
        verify(userRepository, never()).saveAndFlush(any());
        verifyNoInteractions(jwtTokenProvider);
    }

    @Test
    @DisplayName("register - параллельная регистрация того же username")
    void registerConcurrentDuplicate() {
        RegisterRequest request = new RegisterRequest(USERNAME, VALID_PASSWORD);
        when(userRepository.existsByUsername(USERNAME)).thenReturn(false);
        when(passwordEncoder.encode(VALID_PASSWORD)).thenReturn(HASHED_PASSWORD);
        when(userRepository.saveAndFlush(any(User.class)))
                .thenThrow(new DataIntegrityViolationException("uk_username"));

        ValidationException exception = assertThrows(ValidationException.class,
                () -> authenticationService.register(request));

        assertEquals(ErrorCode.USERNAME_ALREADY_EXISTS.getCode(), exception.getErrorCode());
    }

    // ===== ЛОГИН (login) =====

    @Test
    @DisplayName("login - успешный вход")
    void loginSuccess() {
        when(userRepository.findByUsername(USERNAME)).thenReturn(Optional.of(storedUser(true)));
        when(passwordEncoder.matches(VALID_PASSWORD, HASHED_PASSWORD)).thenReturn(true);
        when(jwtTokenProvider.generateToken(USER_ID, USERNAME)).thenReturn(JWT_TOKEN);

        AuthenticationResponse response = authenticationService.login(new LoginRequest(USERNAME, VALID_PASSWORD));

        assertEquals(USER_ID, response.userId());
        assertEquals(JWT_TOKEN, response.accessToken());
    }

    @Test
    @DisplayName("login - пользователь не найден")
    void loginUserNotFound() {
        when(userRepository.findByUsername(USERNAME)).thenReturn(Optional.empty());

        ValidationException exception = assertThrows(ValidationException.class,
                () -> authenticationService.login(new LoginRequest(USERNAME, VALID_PASSWORD)));

        assertEquals(ErrorCode.INVALID_CREDENTIALS.getCode(), exception.getErrorCode());
        verifyNoInteractions(jwtTokenProvider);
    }

    @Test
    @DisplayName("login - неверный пароль")
    void loginWrongPassword() {
        when(userRepository.findByUsername(USERNAME)).thenReturn(Optional.of(storedUser(true)));
        when(passwordEncoder.matches("wrong-password", HASHED_PASSWORD)).thenReturn(false);

        ValidationException exception = assertThrows(ValidationException.class,
                () -> authenticationService.login(new LoginRequest(USERNAME, "wrong-password")));

        assertEquals(ErrorCode.INVALID_CREDENTIALS.getCode(), exception.getErrorCode());
    }

    @Test
    @DisplayName("login - отключенный пользователь")
    void loginInactiveUser() {
        when(userRepository.findByUsername(USERNAME)).thenReturn(Optional.of(storedUser(false)));
        when(passwordEncoder.matches(VALID_PASSWORD, HASHED_PASSWORD)).thenReturn(true);

        ValidationException exception = assertThrows(ValidationException.class,
                () -> authenticationService.login(new LoginRequest(USERNAME, VALID_PASSWORD)));

        assertEquals(ErrorCode.USER_INACTIVE.getCode(), exception.getErrorCode());
        verifyNoInteractions(jwtTokenProvider);
    }

    // ===== ТЕКУЩИЙ ПОЛЬЗОВАТЕЛЬ (getCurrentUser) =====

    @Test
    @DisplayName("getCurrentUser - профиль по userId")
    void getCurrentUser() {
        User user = storedUser(true);
        user.setEmail("test@example.com");
        when(userRepository.findById(USER_ID)).thenReturn(Optional.of(user));

        UserResponse response = authenticationService.getCurrentUser(USER_ID);

        assertEquals(USERNAME, response.username());
        assertEquals("test@example.com", response.email());
        assertTrue(response.active());
    }

    @Test
    @DisplayName("getCurrentUser - удаленный пользователь")
    void getCurrentUserNotFound() {
        when(userRepository.findById(USER_ID)).thenReturn(Optional.empty());

        assertThrows(ResourceNotFoundException.class, () -> authenticationService.getCurrentUser(USER_ID));
    }
}
