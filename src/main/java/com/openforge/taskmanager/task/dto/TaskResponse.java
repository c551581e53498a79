package com.openforge.taskmanager.task.dto;

import com.openforge.taskmanager.domain.Task;
import com.openforge.taskmanager.domain.TaskPriority;
import com.openforge.taskmanager.domain.TaskStatus;

import java.time.LocalDateTime;

public record TaskResponse(
        Long          id,
        String        title,
        String        description,
        TaskPriority  priority,
        TaskStatus    status,
        LocalDateTime dueDate,
        Long          userId,
        Long          assignedTo,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {

    public static TaskResponse from(Task task) {
        return new TaskResponse(
                task.getId(),
                task.getTitle(),
                task.getDescription(),
                task.getPriority(),
                task.getStatus(),
                task.getDueDate(),
                task.getUserId(),
                task.getAssignedTo(),
                task.getCreatedAt(),
                task.getUpdatedAt()
        );
    }
}
