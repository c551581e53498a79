package com.openforge.taskmanager.task;

import com.openforge.taskmanager.domain.Task;
import com.openforge.taskmanager.domain.TaskPriority;
import com.openforge.taskmanager.domain.TaskStatus;
import com.openforge.taskmanager.error.NotFoundException;
import com.openforge.taskmanager.task.dto.CreateTaskRequest;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.concurrent.ThreadLocalRandom;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles("test")
class TaskServiceTest {

    @Autowired private TaskService taskService;

    /** Owner ids far above anything the user counter hands out, unique per test. */
    private static long owner() {
        return 1_000_000L + ThreadLocalRandom.current().nextLong(1_000_000_000L);
    }

    private Task create(long owner, String title, TaskPriority priority, LocalDateTime due) {
        return taskService.create(new CreateTaskRequest(title, "desc", priority, due), owner);
    }

    @Test
    void createDefaultsToPendingAndMedium() {
        long owner = owner();
        Task task = create(owner, "Write report", null, null);

        assertTrue(task.getId() > 0);
        assertEquals(TaskStatus.PENDING, task.getStatus());
        assertEquals(TaskPriority.MEDIUM, task.getPriority());
        assertEquals(owner, task.getUserId());
        assertNull(task.getAssignedTo());
        assertEquals(task.getCreatedAt(), task.getUpdatedAt());
    }

    @Test
    void partialUpdateTouchesOnlyGivenFields() {
        Task original = create(owner(), "Original", TaskPriority.LOW, null);

        Task updated = taskService.update(original.getId(), TaskPatch.empty().title("Renamed")).orElseThrow();

        assertEquals("Renamed", updated.getTitle());
        assertEquals("desc", updated.getDescription());
        assertEquals(TaskPriority.LOW, updated.getPriority());
        assertEquals(TaskStatus.PENDING, updated.getStatus());
        assertEquals(original.getCreatedAt().truncatedTo(ChronoUnit.MILLIS),
                updated.getCreatedAt().truncatedTo(ChronoUnit.MILLIS));
        assertFalse(updated.getUpdatedAt().isBefore(original.getUpdatedAt().truncatedTo(ChronoUnit.MILLIS)));
    }

    @Test
    void emptyPatchOnlyRefreshesUpdatedAt() throws InterruptedException {
        long owner = owner();
        LocalDateTime due = LocalDateTime.of(2030, 5, 17, 9, 30);
        Task created = create(owner, "Unchanged", TaskPriority.HIGH, due);
        long assignee = owner();
        Task before = taskService.update(created.getId(),
                TaskPatch.empty().status(TaskStatus.IN_PROGRESS).assignedTo(assignee)).orElseThrow();

        Thread.sleep(20);
        Task after = taskService.update(before.getId(), TaskPatch.empty()).orElseThrow();

        assertEquals(before.getId(), after.getId());
        assertEquals("Unchanged", after.getTitle());
        assertEquals("desc", after.getDescription());
        assertEquals(TaskPriority.HIGH, after.getPriority());
        assertEquals(TaskStatus.IN_PROGRESS, after.getStatus());
        assertEquals(due, after.getDueDate());
        assertEquals(owner, after.getUserId());
        assertEquals(assignee, after.getAssignedTo());
        assertEquals(before.getCreatedAt(), after.getCreatedAt());
        assertTrue(after.getUpdatedAt().isAfter(before.getUpdatedAt()),
                before.getUpdatedAt() + " -> " + after.getUpdatedAt());
    }

    @Test
    void updatingMissingTaskReturnsEmpty() {
        assertTrue(taskService.update(Long.MAX_VALUE, TaskPatch.empty().title("x")).isEmpty());
        assertThrows(NotFoundException.class, () -> taskService.get(Long.MAX_VALUE));
    }

    @Test
    void completeAndDelete() {
        Task task = create(owner(), "Finish", null, null);

        assertEquals(TaskStatus.COMPLETED, taskService.complete(task.getId()).orElseThrow().getStatus());
        assertTrue(taskService.delete(task.getId()));
        assertFalse(taskService.delete(task.getId()));
        assertTrue(taskService.find(task.getId()).isEmpty());
    }

    @Test
    void listFiltersAndPagesInIdOrder() {
        long owner = owner();
        Task a = create(owner, "a", TaskPriority.HIGH, null);
        Task b = create(owner, "b", TaskPriority.LOW, null);
        Task c = create(owner, "c", TaskPriority.HIGH, null);
        taskService.complete(b.getId());
        create(owner(), "someone else's", TaskPriority.HIGH, null);

        assertEquals(List.of(a.getId(), b.getId(), c.getId()), ids(taskService.list(owner, null, null, 0, 20)));
        assertEquals(List.of(a.getId(), c.getId()),
                ids(taskService.list(owner, null, TaskPriority.HIGH, 0, 20)));
        assertEquals(List.of(b.getId()),
                ids(taskService.list(owner, TaskStatus.COMPLETED, null, 0, 20)));
        assertEquals(List.of(b.getId()), ids(taskService.list(owner, null, null, 1, 1)));
    }

    @Test
    void overdueAndStatisticsAreScopedToOwner() {
        long owner = owner();
        LocalDateTime now = LocalDateTime.now();
        Task late = create(owner, "late", TaskPriority.URGENT, now.minusDays(2));
        Task done = create(owner, "done", TaskPriority.LOW, now.minusDays(1));
        taskService.complete(done.getId());
        create(owner, "future", TaskPriority.LOW, now.plusDays(5));
        create(owner(), "not mine", TaskPriority.LOW, now.minusDays(3));

        assertEquals(List.of(late.getId()), ids(taskService.overdue(owner)));

        TaskStatistics stats = taskService.statistics(owner);
        assertEquals(3, stats.total());
        assertEquals(2L, stats.byStatus().get("pending"));
        assertEquals(1L, stats.byStatus().get("completed"));
        assertEquals(1L, stats.byPriority().get("urgent"));
        assertEquals(2L, stats.byPriority().get("low"));
        assertEquals(1, stats.overdueCount());
    }

    private static List<Long> ids(List<Task> tasks) {
        return tasks.stream().map(Task::getId).toList();
    }
}
