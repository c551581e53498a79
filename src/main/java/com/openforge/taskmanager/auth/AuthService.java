package com.openforge.taskmanager.auth;

import com.openforge.taskmanager.auth.dto.RegisterRequest;
import com.openforge.taskmanager.auth.dto.TokenResponse;
import com.openforge.taskmanager.domain.User;
import com.openforge.taskmanager.error.ConflictException;
import com.openforge.taskmanager.error.ForbiddenException;
import com.openforge.taskmanager.error.UnauthenticatedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Registration, login and token refresh.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AuthService {

    private final CredentialStore credentialStore;
    private final TokenService    tokenService;

    /**
     * The existence checks only give a friendlier message for the common
     * case; two concurrent registrations can both pass them, and then the
     * unique index in {@link CredentialStore#create} decides.
     */
    public User register(RegisterRequest req) {
        PasswordPolicy.validateUsername(req.username());
        PasswordPolicy.validatePassword(req.password());

        String email = normalize(req.email());
        if (credentialStore.findByEmail(email).isPresent()) {
            throw new ConflictException("Email already registered");
        }
        if (credentialStore.findByUsername(req.username()).isPresent()) {
            throw new ConflictException("Username already taken");
        }
        return credentialStore.create(email, req.username(), blankToNull(req.fullName()), req.password());
    }

    /** A password longer than any stored one could be fails like a wrong password. */
    public TokenResponse login(String email, String password) {
        if (PasswordPolicy.exceedsMaxBytes(password)) {
            log.info("[Auth] Failed login for {}: password over {} bytes", email, PasswordPolicy.MAX_BYTES);
            throw invalidCredentials();
        }
        User user = credentialStore.verifyCredentials(normalize(email), password)
                .orElseThrow(() -> {
                    log.info("[Auth] Failed login for {}", email);
                    return invalidCredentials();
                });

        if (!user.isActive()) {
            throw new ForbiddenException("User account is disabled");
        }

        log.info("[Auth] User logged in: id={}", user.getId());
        return tokenService.issue(user);
    }

    /** A fresh token for an already-authenticated user. */
    public TokenResponse refresh(User user) {
        return tokenService.issue(user);
    }

    private static UnauthenticatedException invalidCredentials() {
        return new UnauthenticatedException("Invalid email or password");
    }

    private static String normalize(String value) {
        return value == null ? null : value.trim();
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
