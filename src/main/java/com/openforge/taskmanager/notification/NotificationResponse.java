package com.openforge.taskmanager.notification;

import java.time.LocalDateTime;

public record NotificationResponse(
        Long                 id,
        long                 userId,
        String               title,
        String               message,
        NotificationType     type,
        NotificationPriority priority,
        LocalDateTime        createdAt,
        LocalDateTime        sentAt,
        LocalDateTime        readAt
) {

    public static NotificationResponse from(Notification n) {
        return new NotificationResponse(
                n.getId(),
                n.getUserId(),
                n.getTitle(),
                n.getMessage(),
                n.getType(),
                n.getPriority(),
                n.getCreatedAt(),
                n.getSentAt(),
                n.getReadAt()
        );
    }
}
