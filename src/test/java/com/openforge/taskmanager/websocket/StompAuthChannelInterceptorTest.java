package com.openforge.taskmanager.websocket;

import com.openforge.taskmanager.auth.AuthorizationGuard;
import com.openforge.taskmanager.domain.User;
import com.openforge.taskmanager.error.UnauthenticatedException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.MessageDeliveryException;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;

import java.security.Principal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class StompAuthChannelInterceptorTest {

    private AuthorizationGuard          guard;
    private MessageChannel              channel;
    private StompAuthChannelInterceptor interceptor;

    @BeforeEach
    void setUp() {
        guard       = mock(AuthorizationGuard.class);
        channel     = mock(MessageChannel.class);
        interceptor = new StompAuthChannelInterceptor(guard);
    }

    private static Message<byte[]> frame(StompCommand command, String authorization,
                                         String destination, Principal user) {
        StompHeaderAccessor accessor = StompHeaderAccessor.create(command);
        if (authorization != null) {
            accessor.addNativeHeader("Authorization", authorization);
        }
        if (destination != null) {
            accessor.setDestination(destination);
        }
        if (user != null) {
            accessor.setUser(user);
        }
        accessor.setSessionId("s1");
        accessor.setLeaveMutable(true);
        return MessageBuilder.createMessage(new byte[0], accessor.getMessageHeaders());
    }

    private static Principal userPrincipal(long id) {
        return new UsernamePasswordAuthenticationToken(String.valueOf(id), null, List.of());
    }

    @Test
    void connectWithValidTokenBindsSessionToUserId() {
        User user = new User();
        user.setId(42L);
        when(guard.authenticate("good")).thenReturn(user);

        Message<?> result = interceptor.preSend(frame(StompCommand.CONNECT, "Bearer good", null, null), channel);

        Principal principal = StompHeaderAccessor.wrap(result).getUser();
        assertNotNull(principal);
        assertEquals("42", principal.getName());
    }

    @Test
    void connectWithoutTokenIsRefused() {
        assertThrows(MessageDeliveryException.class,
                () -> interceptor.preSend(frame(StompCommand.CONNECT, null, null, null), channel));
        verifyNoInteractions(guard);
    }

    @Test
    void connectWithInvalidTokenIsRefused() {
        when(guard.authenticate("bad")).thenThrow(new UnauthenticatedException("Could not validate credentials"));

        assertThrows(MessageDeliveryException.class,
                () -> interceptor.preSend(frame(StompCommand.CONNECT, "Bearer bad", null, null), channel));
    }

    @Test
    void subscribeToOwnUserQueueIsAllowed() {
        Message<byte[]> subscribe = frame(StompCommand.SUBSCRIBE, null, "/user/queue/notifications", userPrincipal(7));
        assertSame(subscribe, interceptor.preSend(subscribe, channel));
    }

    @Test
    void subscribeToAnotherUsersDestinationIsRefused() {
        assertThrows(MessageDeliveryException.class, () -> interceptor.preSend(
                frame(StompCommand.SUBSCRIBE, null, "/topic/notifications/8", userPrincipal(7)), channel));
        assertThrows(MessageDeliveryException.class, () -> interceptor.preSend(
                frame(StompCommand.SUBSCRIBE, null, "/queue/notifications-usersomeone", userPrincipal(7)), channel));
    }

    @Test
    void anonymousSubscribeIsRefused() {
        assertThrows(MessageDeliveryException.class, () -> interceptor.preSend(
                frame(StompCommand.SUBSCRIBE, null, "/user/queue/notifications", null), channel));
    }

    @Test
    void clientSendIsRefused() {
        assertThrows(MessageDeliveryException.class, () -> interceptor.preSend(
                frame(StompCommand.SEND, null, "/app/anything", userPrincipal(7)), channel));
    }
}
