package com.openforge.taskmanager.task;

import com.openforge.taskmanager.auth.AuthorizationGuard;
import com.openforge.taskmanager.domain.Task;
import com.openforge.taskmanager.domain.TaskPriority;
import com.openforge.taskmanager.domain.TaskStatus;
import com.openforge.taskmanager.domain.User;
import com.openforge.taskmanager.error.NotFoundException;
import com.openforge.taskmanager.task.dto.AssignTaskRequest;
import com.openforge.taskmanager.task.dto.CreateTaskRequest;
import com.openforge.taskmanager.task.dto.TaskResponse;
import com.openforge.taskmanager.task.dto.UpdateTaskRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Optional;

/**
 * REST API for tasks. Every endpoint requires a bearer token.
 *
 * ┌──────────────────────────────────────────────────────────────────────┐
 * │  GET    /api/tasks/?status&priority&skip&limit   own tasks, filtered  │
 * │  POST   /api/tasks/                              create (201)         │
 * │  GET    /api/tasks/statistics                    counts for own tasks │
 * │  GET    /api/tasks/overdue                       own overdue tasks    │
 * │  GET    /api/tasks/{id}                          owner or admin       │
 * │  PUT    /api/tasks/{id}                          partial update       │
 * │  DELETE /api/tasks/{id}                          204                  │
 * │  POST   /api/tasks/{id}/complete                 status → completed   │
 * │  POST   /api/tasks/{id}/assign                   set assigned_to      │
 * └──────────────────────────────────────────────────────────────────────┘
 */
@RestController
@RequestMapping("/api/tasks")
@RequiredArgsConstructor
public class TaskController {

    private final TaskService        taskService;
    private final AuthorizationGuard guard;

    // ── List / create ────────────────────────────────────────────────────────

    @GetMapping({"", "/"})
    public List<TaskResponse> list(
            @AuthenticationPrincipal User currentUser,
            @RequestParam(required = false) TaskStatus status,
            @RequestParam(required = false) TaskPriority priority,
            @RequestParam(defaultValue = "0") @Min(0) int skip,
            @RequestParam(defaultValue = "20") @Min(1) @Max(100) int limit) {

        return taskService.list(currentUser.getId(), status, priority, skip, limit)
                .stream()
                .map(TaskResponse::from)
                .toList();
    }

    @PostMapping({"", "/"})
    public ResponseEntity<TaskResponse> create(
            @AuthenticationPrincipal User currentUser,
            @Valid @RequestBody CreateTaskRequest request) {

        Task task = taskService.create(request, currentUser.getId());
        return ResponseEntity.status(HttpStatus.CREATED).body(TaskResponse.from(task));
    }

    // ── Aggregates ───────────────────────────────────────────────────────────

    @GetMapping("/statistics")
    public TaskStatistics statistics(@AuthenticationPrincipal User currentUser) {
        return taskService.statistics(currentUser.getId());
    }

    @GetMapping("/overdue")
    public List<TaskResponse> overdue(@AuthenticationPrincipal User currentUser) {
        return taskService.overdue(currentUser.getId()).stream().map(TaskResponse::from).toList();
    }

    // ── Single task ──────────────────────────────────────────────────────────

    @GetMapping("/{taskId}")
    public TaskResponse get(@AuthenticationPrincipal User currentUser, @PathVariable long taskId) {
        return TaskResponse.from(accessibleTask(currentUser, taskId));
    }

    @PutMapping("/{taskId}")
    public TaskResponse update(
            @AuthenticationPrincipal User currentUser,
            @PathVariable long taskId,
            @Valid @RequestBody UpdateTaskRequest request) {

        accessibleTask(currentUser, taskId);
        return respond(taskService.update(taskId, request.toPatch()));
    }

    @DeleteMapping("/{taskId}")
    public ResponseEntity<Void> delete(@AuthenticationPrincipal User currentUser, @PathVariable long taskId) {
        accessibleTask(currentUser, taskId);
        if (!taskService.delete(taskId)) {
            throw new NotFoundException("Task not found");
        }
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{taskId}/complete")
    public TaskResponse complete(@AuthenticationPrincipal User currentUser, @PathVariable long taskId) {
        accessibleTask(currentUser, taskId);
        return respond(taskService.complete(taskId));
    }

    @PostMapping("/{taskId}/assign")
    public TaskResponse assign(
            @AuthenticationPrincipal User currentUser,
            @PathVariable long taskId,
            @Valid @RequestBody AssignTaskRequest request) {

        accessibleTask(currentUser, taskId);
        User assignee = guard.resolveAssignee(request.assignedTo());
        return respond(taskService.assign(taskId, assignee.getId()));
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private Task accessibleTask(User currentUser, long taskId) {
        Task task = taskService.get(taskId);
        guard.authorizeTaskAccess(currentUser, task);
        return task;
    }

    private static TaskResponse respond(Optional<Task> task) {
        return task.map(TaskResponse::from)
                .orElseThrow(() -> new NotFoundException("Task not found"));
    }
}
