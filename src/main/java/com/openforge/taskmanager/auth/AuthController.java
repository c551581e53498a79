package com.openforge.taskmanager.auth;

import com.openforge.taskmanager.auth.dto.LoginRequest;
import com.openforge.taskmanager.auth.dto.RegisterRequest;
import com.openforge.taskmanager.auth.dto.TokenResponse;
import com.openforge.taskmanager.auth.dto.UserResponse;
import com.openforge.taskmanager.domain.User;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

/**
 * Endpoints:
 *   POST /api/auth/register  - create an account (201, user without password)
 *   POST /api/auth/login     - JSON email + password → token
 *   POST /api/auth/token     - OAuth2 password form (username = email) → token
 *   GET  /api/auth/me        - the authenticated user
 *   POST /api/auth/refresh   - new token for a still-valid one
 */
@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
public class AuthController {

    private final AuthService authService;

    @PostMapping("/register")
    public ResponseEntity<UserResponse> register(@Valid @RequestBody RegisterRequest request) {
        User user = authService.register(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(UserResponse.from(user));
    }

    @PostMapping("/login")
    public TokenResponse login(@Valid @RequestBody LoginRequest request) {
        return authService.login(request.email(), request.password());
    }

    @PostMapping(value = "/token", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    public TokenResponse token(@RequestParam String username, @RequestParam String password) {
        return authService.login(username, password);
    }

    @GetMapping("/me")
    public UserResponse me(@AuthenticationPrincipal User currentUser) {
        return UserResponse.from(currentUser);
    }

    @PostMapping("/refresh")
    public TokenResponse refresh(@AuthenticationPrincipal User currentUser) {
        return authService.refresh(currentUser);
    }
}
