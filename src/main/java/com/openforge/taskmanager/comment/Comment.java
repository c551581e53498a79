package com.openforge.taskmanager.comment;

import java.time.LocalDateTime;

/**
 * A remark left on a task. Immutable; a null id means "not stored yet".
 */
public record Comment(
        Long          id,
        long          taskId,
        long          userId,
        String        text,
        LocalDateTime createdAt
) {

    public Comment withId(long newId) {
        return new Comment(newId, taskId, userId, text, createdAt);
    }
}
