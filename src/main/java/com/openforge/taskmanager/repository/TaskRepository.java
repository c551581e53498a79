package com.openforge.taskmanager.repository;

import com.openforge.taskmanager.domain.Task;
import com.openforge.taskmanager.domain.TaskStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface TaskRepository extends JpaRepository<Task, Long>, TaskRepositoryCustom {

    List<Task> findByUserId(Long userId);

    /** Overdue helper: due before {@code now} and not in the given (completed) status. */
    List<Task> findTop100ByUserIdAndStatusNotAndDueDateBeforeOrderByDueDateAsc(
            Long userId, TaskStatus status, LocalDateTime now);
}
