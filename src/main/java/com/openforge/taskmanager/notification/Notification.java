package com.openforge.taskmanager.notification;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.time.LocalDateTime;

/**
 * A message addressed to one user. Immutable; changes are made by building a
 * modified copy and handing it back to the repository.
 *
 * sentAt: set once the channel accepted it; stays null if the user disabled the channel
 * readAt: set when the user marks it read
 */
@Getter
@Builder(toBuilder = true)
@AllArgsConstructor
public class Notification {

    private final Long                 id;
    private final long                 userId;
    private final String               title;
    private final String               message;
    private final NotificationType     type;
    @Builder.Default
    private final NotificationPriority priority = NotificationPriority.NORMAL;
    private final LocalDateTime        createdAt;
    private final LocalDateTime        sentAt;
    private final LocalDateTime        readAt;

    public boolean isRead() {
        return readAt != null;
    }
}
