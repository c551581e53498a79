package com.openforge.taskmanager.task;

import com.openforge.taskmanager.domain.Task;
import com.openforge.taskmanager.domain.TaskPriority;
import com.openforge.taskmanager.domain.TaskStatus;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Aggregate view of one owner's tasks. Every status and priority key is
 * present, with 0 where no task matches.
 */
public record TaskStatistics(
        long              total,
        Map<String, Long> byStatus,
        Map<String, Long> byPriority,
        long              overdueCount
) {

    /** Single pass over an already-loaded snapshot. */
    public static TaskStatistics of(Collection<Task> tasks, LocalDateTime now) {
        Map<String, Long> byStatus = new LinkedHashMap<>();
        for (TaskStatus status : TaskStatus.values()) {
            byStatus.put(status.value(), 0L);
        }
        Map<String, Long> byPriority = new LinkedHashMap<>();
        for (TaskPriority priority : TaskPriority.values()) {
            byPriority.put(priority.value(), 0L);
        }

        long overdue = 0;
        for (Task task : tasks) {
            byStatus.merge(task.getStatus().value(), 1L, Long::sum);
            byPriority.merge(task.getPriority().value(), 1L, Long::sum);
            if (task.isOverdueAt(now)) {
                overdue++;
            }
        }
        return new TaskStatistics(tasks.size(), byStatus, byPriority, overdue);
    }
}
