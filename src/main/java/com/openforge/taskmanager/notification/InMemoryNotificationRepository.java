package com.openforge.taskmanager.notification;

import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.UnaryOperator;

@Repository
public class InMemoryNotificationRepository implements NotificationRepository {

    private final Map<Long, Notification>            notifications = new ConcurrentHashMap<>();
    private final Map<Long, NotificationPreferences> preferences   = new ConcurrentHashMap<>();
    private final AtomicLong                         sequence      = new AtomicLong();

    @Override
    public Notification save(Notification notification) {
        Notification stored = notification.toBuilder().id(sequence.incrementAndGet()).build();
        notifications.put(stored.getId(), stored);
        return stored;
    }

    @Override
    public Optional<Notification> update(long id, UnaryOperator<Notification> change) {
        return Optional.ofNullable(notifications.computeIfPresent(id, (key, current) -> change.apply(current)));
    }

    @Override
    public Optional<Notification> findById(long id) {
        return Optional.ofNullable(notifications.get(id));
    }

    @Override
    public List<Notification> findByUserId(long userId) {
        return notifications.values().stream()
                .filter(n -> n.getUserId() == userId)
                .toList();
    }

    @Override
    public NotificationPreferences savePreferences(NotificationPreferences prefs) {
        preferences.put(prefs.userId(), prefs);
        return prefs;
    }

    @Override
    public Optional<NotificationPreferences> findPreferences(long userId) {
        return Optional.ofNullable(preferences.get(userId));
    }
}
