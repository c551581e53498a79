package com.openforge.taskmanager.comment;

import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local comment store. Contents are lost on restart.
 */
@Repository
public class InMemoryCommentRepository implements CommentRepository {

    private final Map<Long, Comment> comments = new ConcurrentHashMap<>();
    private final AtomicLong         sequence = new AtomicLong();

    @Override
    public Comment save(Comment comment) {
        Comment stored = comment.id() == null ? comment.withId(sequence.incrementAndGet()) : comment;
        comments.put(stored.id(), stored);
        return stored;
    }

    @Override
    public Optional<Comment> findById(long id) {
        return Optional.ofNullable(comments.get(id));
    }

    @Override
    public List<Comment> findByTaskId(long taskId) {
        return comments.values().stream()
                .filter(c -> c.taskId() == taskId)
                .sorted(Comparator.comparing(Comment::createdAt).thenComparing(Comment::id))
                .toList();
    }

    @Override
    public boolean deleteById(long id) {
        return comments.remove(id) != null;
    }
}
