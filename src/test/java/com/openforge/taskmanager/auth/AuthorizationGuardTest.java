package com.openforge.taskmanager.auth;

import com.openforge.taskmanager.domain.Task;
import com.openforge.taskmanager.domain.User;
import com.openforge.taskmanager.error.ForbiddenException;
import com.openforge.taskmanager.error.NotFoundException;
import com.openforge.taskmanager.error.UnauthenticatedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class AuthorizationGuardTest {

    private TokenService       tokenService;
    private CredentialStore    credentialStore;
    private AuthorizationGuard guard;

    @BeforeEach
    void setUp() {
        tokenService    = mock(TokenService.class);
        credentialStore = mock(CredentialStore.class);
        guard           = new AuthorizationGuard(tokenService, credentialStore);
    }

    private static User user(long id, boolean admin) {
        User user = new User();
        user.setId(id);
        user.setAdmin(admin);
        return user;
    }

    private static Task ownedBy(long ownerId) {
        Task task = new Task();
        task.setId(100L);
        task.setUserId(ownerId);
        return task;
    }

    @Test
    void ownerAndAdminMayAccessOthersMayNot() {
        Task task = ownedBy(1);

        assertTrue(guard.canAccess(user(1, false), task));
        assertTrue(guard.canAccess(user(2, true), task));
        assertFalse(guard.canAccess(user(2, false), task));

        assertDoesNotThrow(() -> guard.authorizeTaskAccess(user(1, false), task));
        ForbiddenException ex = assertThrows(ForbiddenException.class,
                () -> guard.authorizeTaskAccess(user(2, false), task));
        assertEquals("Access denied", ex.getMessage());
    }

    @Test
    void authenticateResolvesTheTokenSubject() {
        User alice = user(5, false);
        when(tokenService.validate("tok")).thenReturn(5L);
        when(credentialStore.findById(5L)).thenReturn(Optional.of(alice));

        assertSame(alice, guard.authenticate("tok"));
    }

    @Test
    void authenticateFailsWhenTheUserIsGone() {
        when(tokenService.validate("tok")).thenReturn(5L);
        when(credentialStore.findById(5L)).thenReturn(Optional.empty());

        assertThrows(UnauthenticatedException.class, () -> guard.authenticate("tok"));
    }

    @Test
    void authenticatePropagatesInvalidToken() {
        when(tokenService.validate("bad")).thenThrow(new UnauthenticatedException("Could not validate credentials"));

        assertThrows(UnauthenticatedException.class, () -> guard.authenticate("bad"));
        verifyNoInteractions(credentialStore);
    }

    @Test
    void unknownAssigneeIsNotFound() {
        when(credentialStore.findById(99L)).thenReturn(Optional.empty());

        NotFoundException ex = assertThrows(NotFoundException.class, () -> guard.resolveAssignee(99));
        assertEquals("Target user not found", ex.getMessage());
    }
}
