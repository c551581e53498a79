package com.openforge.taskmanager.notification;

import com.openforge.taskmanager.domain.Task;
import com.openforge.taskmanager.error.NotFoundException;
import com.openforge.taskmanager.websocket.NotificationPublisher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;

/**
 * Stores notifications and hands them to their delivery channel.
 *
 * In-app notifications are pushed over STOMP to the recipient's own
 * sessions (/user/queue/notifications).
 * Email, push and SMS have no gateway wired in; those channels log the
 * delivery and count it as sent.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationService {

    private final NotificationRepository notificationRepository;
    private final NotificationPublisher  publisher;
    private final Clock                  clock;

    public Notification send(long userId, String title, String message,
                             NotificationType type, NotificationPriority priority) {
        Notification notification = Notification.builder()
                .userId(userId)
                .title(title)
                .message(message)
                .type(type)
                .priority(priority)
                .createdAt(LocalDateTime.now(clock))
                .build();
        Notification stored = notificationRepository.save(notification);

        if (!deliver(stored)) {
            return stored;
        }
        LocalDateTime sentAt = LocalDateTime.now(clock);
        return notificationRepository.update(stored.getId(), n -> n.toBuilder().sentAt(sentAt).build())
                .orElse(stored);
    }

    public Notification send(long userId, String title, String message) {
        return send(userId, title, message, NotificationType.IN_APP, NotificationPriority.NORMAL);
    }

    public void notifyAssignment(long assigneeId, Task task) {
        send(assigneeId, "Task assigned", "You have been assigned task #" + task.getId() + ": " + task.getTitle());
    }

    /** Newest first. */
    public List<Notification> forUser(long userId, boolean unreadOnly) {
        return notificationRepository.findByUserId(userId).stream()
                .filter(n -> !unreadOnly || !n.isRead())
                .sorted(Comparator.comparing(Notification::getCreatedAt)
                        .thenComparing(Notification::getId)
                        .reversed())
                .toList();
    }

    /** @throws NotFoundException unless the notification exists and belongs to the user */
    public Notification markAsRead(long userId, long notificationId) {
        LocalDateTime now = LocalDateTime.now(clock);
        return notificationRepository.update(notificationId,
                        n -> n.getUserId() != userId || n.isRead() ? n : n.toBuilder().readAt(now).build())
                .filter(n -> n.getUserId() == userId)
                .orElseThrow(() -> new NotFoundException("Notification not found"));
    }

    public long unreadCount(long userId) {
        return notificationRepository.findByUserId(userId).stream().filter(n -> !n.isRead()).count();
    }

    public NotificationPreferences preferences(long userId) {
        return notificationRepository.findPreferences(userId)
                .orElseGet(() -> NotificationPreferences.defaults(userId));
    }

    public NotificationPreferences setPreferences(long userId, boolean email, boolean push, boolean sms) {
        return notificationRepository.savePreferences(new NotificationPreferences(userId, email, push, sms));
    }

    // ── Delivery ─────────────────────────────────────────────────────────────

    private boolean deliver(Notification notification) {
        if (!preferences(notification.getUserId()).allows(notification.getType())) {
            log.debug("[Notify] {} channel disabled for user {}, notification {} kept undelivered",
                    notification.getType(), notification.getUserId(), notification.getId());
            return false;
        }

        switch (notification.getType()) {
            case IN_APP -> publisher.publish(notification.getUserId(), NotificationResponse.from(notification));
            case EMAIL, PUSH, SMS -> log.info("[Notify] [{}] To user {} - {}",
                    notification.getType(), notification.getUserId(), notification.getTitle());
        }
        return true;
    }
}
