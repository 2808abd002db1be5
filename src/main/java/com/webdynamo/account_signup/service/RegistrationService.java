package com.webdynamo.account_signup.service;

import com.webdynamo.account_signup.dto.auth.SignUpRequest;
import com.webdynamo.account_signup.exception.RegistrationException;
import com.webdynamo.account_signup.exception.UserAlreadyExistsException;
import com.webdynamo.account_signup.model.RegistrationOutcome;
import com.webdynamo.account_signup.model.User;
import com.webdynamo.account_signup.repo.UserRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class RegistrationService {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final MetricsService metricsService;

    /**
     * Register a new user from a normalized, validated request.
     * <p>
     * The lookup and the insert share one transaction whose timeout is the
     * request deadline. The pre-check only exists to answer the common case
     * with a clean conflict; the unique key on {@code users.username} decides
     * concurrent registrations, and losing that race is reported the same way.
     *
     * @param request Normalized signup request
     * @throws UserAlreadyExistsException if the username is taken
     * @throws RegistrationException if lookup, hashing or insert fails
     */
    @Transactional(timeoutString = "${signup.request-timeout-seconds:5}")
    public void registerUser(SignUpRequest request) {
        String username = request.getUsername();
        log.info("Registering new user: {}", username);

        // Fail fast when the username is already taken
        Optional<User> existing;
        try {
            existing = userRepository.findByUsername(username);
        } catch (DataAccessException e) {
            metricsService.recordRegistration(RegistrationOutcome.FAILED);
            throw new RegistrationException("lookup existing user", e);
        }
        if (existing.isPresent()) {
            log.warn("Registration failed: username already exists - {}", username);
            metricsService.recordRegistration(RegistrationOutcome.DUPLICATE);
            throw new UserAlreadyExistsException(username);
        }

        String passwordHash;
        try {
            passwordHash = passwordEncoder.encode(request.getPassword().reveal());
        } catch (RuntimeException e) {
            metricsService.recordRegistration(RegistrationOutcome.FAILED);
            throw new RegistrationException("hash password", e);
        }

        User user = new User();
        user.setUsername(username);
        user.setPasswordHash(passwordHash);

        // Absent optional fields stay null instead of being stored as ""
        if (!request.getEmail().isEmpty()) {
            user.setEmail(request.getEmail());
        }
        if (!request.getFirstName().isEmpty()) {
            user.setFirstName(request.getFirstName());
        }
        if (!request.getLastName().isEmpty()) {
            user.setLastName(request.getLastName());
        }

        User savedUser;
        try {
            savedUser = userRepository.saveAndFlush(user);
        } catch (DataIntegrityViolationException e) {
            log.warn("Registration failed: unique constraint rejected username - {}", username);
            metricsService.recordRegistration(RegistrationOutcome.DUPLICATE);
            throw new UserAlreadyExistsException(username, e);
        } catch (DataAccessException e) {
            metricsService.recordRegistration(RegistrationOutcome.FAILED);
            throw new RegistrationException("create user", e);
        }

        metricsService.recordRegistration(RegistrationOutcome.CREATED);
        log.info("User registered successfully with ID: {}", savedUser.getId());
    }
}
