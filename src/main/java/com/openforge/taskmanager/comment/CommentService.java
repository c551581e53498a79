package com.openforge.taskmanager.comment;

import com.openforge.taskmanager.auth.AuthorizationGuard;
import com.openforge.taskmanager.domain.Task;
import com.openforge.taskmanager.domain.User;
import com.openforge.taskmanager.error.ForbiddenException;
import com.openforge.taskmanager.error.NotFoundException;
import com.openforge.taskmanager.task.TaskService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Comments are visible to whoever may access the task; only the author or an
 * admin may delete one.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CommentService {

    private final CommentRepository  commentRepository;
    private final TaskService        taskService;
    private final AuthorizationGuard guard;
    private final Clock              clock;

    public Comment add(User author, long taskId, String text) {
        accessibleTask(author, taskId);
        Comment saved = commentRepository.save(
                new Comment(null, taskId, author.getId(), text, LocalDateTime.now(clock)));
        log.debug("[Comment] User {} commented on task {} (comment {})", author.getId(), taskId, saved.id());
        return saved;
    }

    public List<Comment> forTask(User viewer, long taskId) {
        accessibleTask(viewer, taskId);
        return commentRepository.findByTaskId(taskId);
    }

    public void delete(User user, long commentId) {
        Comment comment = commentRepository.findById(commentId)
                .orElseThrow(() -> new NotFoundException("Comment not found"));
        if (!user.isAdmin() && comment.userId() != user.getId()) {
            throw new ForbiddenException("Access denied");
        }
        commentRepository.deleteById(commentId);
        log.debug("[Comment] Comment {} deleted by user {}", commentId, user.getId());
    }

    private Task accessibleTask(User user, long taskId) {
        Task task = taskService.get(taskId);
        guard.authorizeTaskAccess(user, task);
        return task;
    }
}
