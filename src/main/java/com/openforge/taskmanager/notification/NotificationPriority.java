package com.openforge.taskmanager.notification;

import com.fasterxml.jackson.annotation.JsonValue;

public enum NotificationPriority {

    LOW("low"),
    NORMAL("normal"),
    HIGH("high"),
    URGENT("urgent");

    private final String value;

    NotificationPriority(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
