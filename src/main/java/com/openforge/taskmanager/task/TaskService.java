package com.openforge.taskmanager.task;

import com.openforge.taskmanager.counter.CounterAllocator;
import com.openforge.taskmanager.domain.Task;
import com.openforge.taskmanager.domain.TaskPriority;
import com.openforge.taskmanager.domain.TaskStatus;
import com.openforge.taskmanager.error.NotFoundException;
import com.openforge.taskmanager.notification.NotificationService;
import com.openforge.taskmanager.repository.TaskRepository;
import com.openforge.taskmanager.task.dto.CreateTaskRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Task storage rules. Ownership checks are not done here; callers run the
 * {@link com.openforge.taskmanager.auth.AuthorizationGuard} first.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TaskService {

    public static final int DEFAULT_LIMIT = 20;
    public static final int MAX_LIMIT     = 100;

    private final TaskRepository      taskRepository;
    private final CounterAllocator    counterAllocator;
    private final NotificationService notificationService;
    private final Clock               clock;

    /**
     * Not transactional: the id is allocated first, then the single INSERT
     * runs in the repository's own transaction.
     */
    public Task create(CreateTaskRequest data, long ownerId) {
        long id = counterAllocator.nextId(CounterAllocator.TASKS);
        LocalDateTime now = LocalDateTime.now(clock);

        Task task = new Task();
        task.setId(id);
        task.setTitle(data.title());
        task.setDescription(data.description());
        task.setPriority(data.priority() != null ? data.priority() : TaskPriority.MEDIUM);
        task.setDueDate(data.dueDate());
        task.setStatus(TaskStatus.PENDING);
        task.setUserId(ownerId);
        task.setCreatedAt(now);
        task.setUpdatedAt(now);

        Task saved = taskRepository.save(task);
        log.info("[Task] Created task {} for user {}", saved.getId(), ownerId);
        return saved;
    }

    @Transactional(readOnly = true)
    public Optional<Task> find(long taskId) {
        return taskRepository.findById(taskId);
    }

    /** @throws NotFoundException when no task has that id */
    @Transactional(readOnly = true)
    public Task get(long taskId) {
        return taskRepository.findById(taskId)
                .orElseThrow(() -> new NotFoundException("Task not found"));
    }

    @Transactional(readOnly = true)
    public List<Task> list(long ownerId, TaskStatus status, TaskPriority priority, int skip, int limit) {
        int boundedLimit = Math.max(1, Math.min(limit, MAX_LIMIT));
        return taskRepository.findForOwner(ownerId, status, priority, Math.max(0, skip), boundedLimit);
    }

    /**
     * Applies the patch in one UPDATE and returns the stored row.
     * Empty when the task does not exist (or was deleted concurrently).
     */
    @Transactional
    public Optional<Task> update(long taskId, TaskPatch patch) {
        int rows = taskRepository.applyPatch(taskId, patch, LocalDateTime.now(clock));
        if (rows == 0) {
            return Optional.empty();
        }
        log.info("[Task] Updated task {} {}", taskId, patch);
        return taskRepository.findById(taskId);
    }

    @Transactional
    public Optional<Task> complete(long taskId) {
        return update(taskId, TaskPatch.empty().status(TaskStatus.COMPLETED));
    }

    /**
     * Sets assigned_to and tells the assignee. The assignee must already have
     * been resolved by the caller.
     */
    @Transactional
    public Optional<Task> assign(long taskId, long assigneeId) {
        Optional<Task> updated = update(taskId, TaskPatch.empty().assignedTo(assigneeId));
        updated.ifPresent(task -> notificationService.notifyAssignment(assigneeId, task));
        return updated;
    }

    @Transactional
    public boolean delete(long taskId) {
        if (!taskRepository.existsById(taskId)) {
            return false;
        }
        taskRepository.deleteById(taskId);
        log.info("[Task] Deleted task {}", taskId);
        return true;
    }

    /** Due in the past and not completed, earliest due first (at most 100). */
    @Transactional(readOnly = true)
    public List<Task> overdue(long ownerId) {
        return taskRepository.findTop100ByUserIdAndStatusNotAndDueDateBeforeOrderByDueDateAsc(
                ownerId, TaskStatus.COMPLETED, LocalDateTime.now(clock));
    }

    /**
     * All of the owner's tasks are read with one query and counted from that
     * result, so a concurrent mutation cannot be counted twice within one call.
     */
    @Transactional(readOnly = true)
    public TaskStatistics statistics(long ownerId) {
        List<Task> snapshot = taskRepository.findByUserId(ownerId);
        return TaskStatistics.of(snapshot, LocalDateTime.now(clock));
    }
}
