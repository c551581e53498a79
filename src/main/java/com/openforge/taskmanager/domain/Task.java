package com.openforge.taskmanager.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * A unit of work owned by one user.
 *
 * The owner and the optional assignee are plain user ids, not associations:
 * tasks reference users, they are never loaded through them.
 */
@Getter
@Setter
@Entity
@Table(name = "tasks", indexes = {
        @Index(name = "idx_tasks_user", columnList = "user_id"),
        @Index(name = "idx_tasks_user_status", columnList = "user_id, status"),
        @Index(name = "idx_tasks_user_due", columnList = "user_id, due_date")
})
public class Task extends BaseEntity {

    @Column(nullable = false, length = 200)
    private String title;

    @Column(length = 2000)
    private String description;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private TaskPriority priority = TaskPriority.MEDIUM;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private TaskStatus status = TaskStatus.PENDING;

    @Column(name = "due_date")
    private LocalDateTime dueDate;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "assigned_to")
    private Long assignedTo;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    /** Overdue = has a due date in the past and is not completed. */
    public boolean isOverdueAt(LocalDateTime now) {
        return dueDate != null && dueDate.isBefore(now) && status != TaskStatus.COMPLETED;
    }
}
