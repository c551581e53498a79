package com.openforge.taskmanager.task.dto;

import com.openforge.taskmanager.domain.TaskPriority;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.time.LocalDateTime;

public record CreateTaskRequest(
        @NotNull
        @Size(min = 1, max = 200)
        String title,

        @Size(max = 2000)
        String description,

        TaskPriority priority,

        LocalDateTime dueDate
) {
}
