package com.openforge.taskmanager.websocket;

import com.openforge.taskmanager.auth.AuthorizationGuard;
import com.openforge.taskmanager.domain.User;
import com.openforge.taskmanager.error.UnauthenticatedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.messaging.Message;
import org.springframework.messaging.MessageChannel;
import org.springframework.messaging.MessageDeliveryException;
import org.springframework.messaging.simp.stomp.StompCommand;
import org.springframework.messaging.simp.stomp.StompHeaderAccessor;
import org.springframework.messaging.support.ChannelInterceptor;
import org.springframework.messaging.support.MessageBuilder;
import org.springframework.messaging.support.MessageHeaderAccessor;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Authenticates STOMP sessions and limits what they may subscribe to.
 *
 * The HTTP handshake on /ws is public (SockJS clients cannot set headers),
 * so the bearer token travels in the CONNECT frame's Authorization header
 * and goes through the same {@link AuthorizationGuard} as REST requests.
 * The session principal's name is the user id, which is what
 * {@code convertAndSendToUser} routes on.
 *
 * SUBSCRIBE is only allowed to the session's own /user/queue/** destinations.
 * Nothing in the app handles client SEND frames, so those are refused.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StompAuthChannelInterceptor implements ChannelInterceptor {

    static final String USER_QUEUE_PREFIX = "/user/queue/";

    private static final String BEARER_PREFIX = "Bearer ";

    private final AuthorizationGuard guard;

    @Override
    public Message<?> preSend(@NonNull Message<?> message, @NonNull MessageChannel channel) {
        StompHeaderAccessor accessor = MessageHeaderAccessor.getAccessor(message, StompHeaderAccessor.class);
        if (accessor == null) {
            accessor = StompHeaderAccessor.wrap(message);
        }
        StompCommand command = accessor.getCommand();
        if (command == null) {
            return message;
        }

        switch (command) {
            case CONNECT, STOMP -> {
                accessor.setUser(authenticate(accessor, message));
                return MessageBuilder.createMessage(message.getPayload(), accessor.getMessageHeaders());
            }
            case SUBSCRIBE -> checkSubscription(accessor, message);
            case SEND -> throw new MessageDeliveryException(message, "Sending is not supported");
            default -> {
            }
        }
        return message;
    }

    private UsernamePasswordAuthenticationToken authenticate(StompHeaderAccessor accessor, Message<?> message) {
        String header = accessor.getFirstNativeHeader("Authorization");
        if (header == null || !header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            log.debug("[Notify] STOMP CONNECT without bearer token rejected");
            throw new MessageDeliveryException(message, "Could not validate credentials");
        }
        try {
            User user = guard.authenticate(header.substring(BEARER_PREFIX.length()).trim());
            log.debug("[Notify] STOMP session {} authenticated as user {}", accessor.getSessionId(), user.getId());
            return new UsernamePasswordAuthenticationToken(String.valueOf(user.getId()), null, List.of());
        } catch (UnauthenticatedException e) {
            log.debug("[Notify] STOMP CONNECT rejected: {}", e.getMessage());
            throw new MessageDeliveryException(message, e.getMessage());
        }
    }

    private static void checkSubscription(StompHeaderAccessor accessor, Message<?> message) {
        String destination = accessor.getDestination();
        if (accessor.getUser() == null) {
            throw new MessageDeliveryException(message, "Not authenticated");
        }
        if (destination == null || !destination.startsWith(USER_QUEUE_PREFIX)) {
            log.debug("[Notify] User {} denied SUBSCRIBE to {}", accessor.getUser().getName(), destination);
            throw new MessageDeliveryException(message, "Access denied");
        }
    }
}
