package ru.tigran.nationalityengine.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
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

/**
 * Service for user authentication (registration and login).
 * Handles password hashing, token generation, and user creation.
 */
@Slf4j
@Service
public class AuthenticationService {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenProvider jwtTokenProvider;

    public AuthenticationService(
            UserRepository userRepository,
            PasswordEncoder passwordEncoder,
            JwtTokenProvider jwtTokenProvider
    ) {
        this.userRepository = userRepository;
        this.passwordEncoder = passwordEncoder;
        this.jwtTokenProvider = jwtTokenProvider;
    }

    /**
     * Registers a new user. Password is hashed using BCrypt before storing.
     *
     * @param request Registration request with username, password and optional profile fields
     * @return Authentication response with access token
     * @throws ValidationException if username already exists
     */
    @Transactional
    public AuthenticationResponse register(RegisterRequest request) {
        log.info("Registering new user: {}", request.username());

        if (userRepository.existsByUsername(request.username())) {
            log.warn("Registration failed: username already exists: {}", request.username());
            throw new ValidationException(ErrorCode.USERNAME_ALREADY_EXISTS);
        }

        User user = new User();
        user.setUsername(request.username());
        user.setEmail(request.email());
        user.setFullName(request.fullName());
        user.setPasswordHash(passwordEncoder.encode(request.password()));
        user.setIsActive(true);

        User savedUser;
        try {
            savedUser = userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException e) {
            log.warn("Registration failed: username taken concurrently: {}", request.username());
            throw new ValidationException(ErrorCode.USERNAME_ALREADY_EXISTS);
        }
        log.info("User registered successfully: {}", savedUser.getId());

        String token = jwtTokenProvider.generateToken(savedUser.getId(), savedUser.getUsername());
        return AuthenticationResponse.bearer(savedUser.getId(), token, jwtTokenProvider.getTokenValiditySeconds());
    }

    /**
     * Authenticates user with username and password.
     *
     * @throws ValidationException if credentials are invalid or the user is disabled
     */
    @Transactional(readOnly = true)
    public AuthenticationResponse login(LoginRequest request) {
        log.info("User login attempt: {}", request.username());

        User user = userRepository.findByUsername(request.username())
                .orElseThrow(() -> {
                    log.warn("Login failed: user not found: {}", request.username());
                    return new ValidationException(ErrorCode.INVALID_CREDENTIALS);
                });

        // Статус аккаунта проверяется только после верного пароля
        if (!passwordEncoder.matches(request.password(), user.getPasswordHash())) {
            log.warn("Login failed: invalid password for user: {}", user.getId());
            throw new ValidationException(ErrorCode.INVALID_CREDENTIALS);
        }

        if (!Boolean.TRUE.equals(user.getIsActive())) {
            log.warn("Login failed: user is inactive: {}", user.getId());
            throw new ValidationException(ErrorCode.USER_INACTIVE);
        }

        log.info("User logged in successfully: {}", user.getId());

        String token = jwtTokenProvider.generateToken(user.getId(), user.getUsername());
        return AuthenticationResponse.bearer(user.getId(), token, jwtTokenProvider.getTokenValiditySeconds());
    }

    /**
     * Profile of the user identified by the JWT subject.
     */
    @Transactional(readOnly = true)
    public UserResponse getCurrentUser(Long userId) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new ResourceNotFoundException(
                        "User " + userId + " not found", ErrorCode.USER_NOT_FOUND.getCode()));
        return new UserResponse(user.getId(), user.getUsername(), user.getEmail(), user.getFullName(),
                Boolean.TRUE.equals(user.getIsActive()));
    }
}
