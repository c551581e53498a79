package com.openforge.taskmanager.task.dto;

import jakarta.validation.constraints.NotNull;

public record AssignTaskRequest(
        @NotNull Long assignedTo
) {
}
