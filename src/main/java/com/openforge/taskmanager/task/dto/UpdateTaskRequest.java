package com.openforge.taskmanager.task.dto;

import com.openforge.taskmanager.domain.TaskPriority;
import com.openforge.taskmanager.domain.TaskStatus;
import com.openforge.taskmanager.task.TaskPatch;
import jakarta.validation.constraints.Size;

import java.time.LocalDateTime;

/**
 * PUT body. Every field is optional; absent (or null) fields are not part of
 * the resulting patch and keep their stored value.
 */
public record UpdateTaskRequest(
        @Size(min = 1, max = 200)
        String title,

        @Size(max = 2000)
        String description,

        TaskPriority priority,

        TaskStatus status,

        LocalDateTime dueDate
) {

    public TaskPatch toPatch() {
        TaskPatch patch = TaskPatch.empty();
        if (title != null)       patch.title(title);
        if (description != null) patch.description(description);
        if (priority != null)    patch.priority(priority);
        if (status != null)      patch.status(status);
        if (dueDate != null)     patch.dueDate(dueDate);
        return patch;
    }
}
