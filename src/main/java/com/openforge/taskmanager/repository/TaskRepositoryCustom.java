package com.openforge.taskmanager.repository;

import com.openforge.taskmanager.domain.Task;
import com.openforge.taskmanager.domain.TaskPriority;
import com.openforge.taskmanager.domain.TaskStatus;
import com.openforge.taskmanager.task.TaskPatch;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Queries that derived-method names cannot express: offset pagination with
 * optional filters, and a field-selective UPDATE built from a {@link TaskPatch}.
 */
public interface TaskRepositoryCustom {

    List<Task> findForOwner(Long userId, TaskStatus status, TaskPriority priority, int skip, int limit);

    /**
     * Writes only the patched columns plus updated_at in one UPDATE statement.
     *
     * @return number of rows changed, 0 when no task has that id
     */
    int applyPatch(Long taskId, TaskPatch patch, LocalDateTime updatedAt);
}
