package com.openforge.taskmanager.websocket;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Thin facade over SimpMessagingTemplate that routes in-app notifications to
 * their recipient's sessions only.
 *
 * Destination, as subscribed by the client:
 *   /user/queue/notifications
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NotificationPublisher {

    static final String DESTINATION = "/queue/notifications";

    private final SimpMessagingTemplate messagingTemplate;

    /**
     * Fire-and-forget: a failed push is logged and the notification stays
     * readable through the REST API.
     */
    public void publish(long userId, Object payload) {
        try {
            messagingTemplate.convertAndSendToUser(String.valueOf(userId), DESTINATION, payload);
        } catch (Exception e) {
            log.warn("[Notify] Failed to push notification to user {}: {}", userId, e.getMessage());
        }
    }
}
