package com.openforge.taskmanager.notification;

import com.fasterxml.jackson.annotation.JsonValue;

/** Delivery channel. */
public enum NotificationType {

    EMAIL("email"),
    PUSH("push"),
    IN_APP("in_app"),
    SMS("sms");

    private final String value;

    NotificationType(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }
}
