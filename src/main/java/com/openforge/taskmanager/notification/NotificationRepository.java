package com.openforge.taskmanager.notification;

import java.util.List;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Keyed notification and preference storage behind an interface, so a
 * persistent backend can replace the in-memory one without touching callers.
 */
public interface NotificationRepository {

    /** Stores a new notification under a freshly assigned id and returns the stored copy. */
    Notification save(Notification notification);

    /**
     * Replaces the stored notification with {@code change} applied to it, as
     * one atomic step per id. Empty when no notification has that id.
     */
    Optional<Notification> update(long id, UnaryOperator<Notification> change);

    Optional<Notification> findById(long id);

    List<Notification> findByUserId(long userId);

    NotificationPreferences savePreferences(NotificationPreferences preferences);

    Optional<NotificationPreferences> findPreferences(long userId);
}
