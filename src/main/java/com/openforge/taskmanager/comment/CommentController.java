package com.openforge.taskmanager.comment;

import com.openforge.taskmanager.domain.User;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Comments on tasks.
 * Base path: /api/comments
 */
@RestController
@RequestMapping("/api/comments")
@RequiredArgsConstructor
public class CommentController {

    private final CommentService commentService;

    // ── DTOs ─────────────────────────────────────────────────────────────────

    public record CommentRequest(
            @NotNull                        Long   taskId,
            @NotBlank @Size(max = 2000)     String text
    ) {}

    // ── Endpoints ────────────────────────────────────────────────────────────

    @PostMapping({"", "/"})
    public ResponseEntity<Comment> create(
            @AuthenticationPrincipal User currentUser,
            @Valid @RequestBody CommentRequest req) {

        Comment comment = commentService.add(currentUser, req.taskId(), req.text());
        return ResponseEntity.status(HttpStatus.CREATED).body(comment);
    }

    @GetMapping("/task/{taskId}")
    public List<Comment> forTask(@AuthenticationPrincipal User currentUser, @PathVariable long taskId) {
        return commentService.forTask(currentUser, taskId);
    }

    @DeleteMapping("/{commentId}")
    public Map<String, Boolean> delete(@AuthenticationPrincipal User currentUser, @PathVariable long commentId) {
        commentService.delete(currentUser, commentId);
        return Map.of("deleted", true);
    }
}
