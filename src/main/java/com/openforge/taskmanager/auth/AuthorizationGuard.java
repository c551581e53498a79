package com.openforge.taskmanager.auth;

import com.openforge.taskmanager.domain.Task;
import com.openforge.taskmanager.domain.User;
import com.openforge.taskmanager.error.ForbiddenException;
import com.openforge.taskmanager.error.NotFoundException;
import com.openforge.taskmanager.error.UnauthenticatedException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * The single gate in front of protected operations.
 *
 * authenticate() runs in {@link JwtAuthFilter} for every request carrying a
 * bearer token. The task checks are applied by the controllers before any
 * read or mutation of a task.
 *
 * Disabled accounts are turned away at login only; a token issued before the
 * account was disabled keeps working until it expires.
 */
@Component
@RequiredArgsConstructor
public class AuthorizationGuard {

    private final TokenService    tokenService;
    private final CredentialStore credentialStore;

    /**
     * @throws UnauthenticatedException if the token is invalid/expired or
     *         its user no longer exists
     */
    public User authenticate(String rawToken) {
        long userId = tokenService.validate(rawToken);
        return credentialStore.findById(userId)
                .orElseThrow(() -> new UnauthenticatedException("Could not validate credentials"));
    }

    public boolean canAccess(User user, Task task) {
        return user.isAdmin() || user.getId().equals(task.getUserId());
    }

    /** Owner or admin; applies to read, update, delete, completion and assignment. */
    public void authorizeTaskAccess(User user, Task task) {
        if (!canAccess(user, task)) {
            throw new ForbiddenException("Access denied");
        }
    }

    public User resolveAssignee(long userId) {
        return credentialStore.findById(userId)
                .orElseThrow(() -> new NotFoundException("Target user not found"));
    }
}
