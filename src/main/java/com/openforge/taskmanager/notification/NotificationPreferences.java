package com.openforge.taskmanager.notification;

/**
 * Per-user channel switches. In-app delivery cannot be turned off.
 */
public record NotificationPreferences(
        long    userId,
        boolean emailEnabled,
        boolean pushEnabled,
        boolean smsEnabled
) {

    /** Applied to users who never saved preferences: every channel on. */
    public static NotificationPreferences defaults(long userId) {
        return new NotificationPreferences(userId, true, true, true);
    }

    public boolean inAppEnabled() {
        return true;
    }

    public boolean allows(NotificationType type) {
        return switch (type) {
            case EMAIL  -> emailEnabled;
            case PUSH   -> pushEnabled;
            case SMS    -> smsEnabled;
            case IN_APP -> true;
        };
    }
}
