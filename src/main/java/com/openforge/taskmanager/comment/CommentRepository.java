package com.openforge.taskmanager.comment;

import java.util.List;
import java.util.Optional;

/**
 * Keyed comment storage. Call sites depend only on this interface, so the
 * in-memory implementation can be replaced by a persistent one.
 */
public interface CommentRepository {

    /** Stores the comment, assigning a new unique id when it has none. */
    Comment save(Comment comment);

    Optional<Comment> findById(long id);

    /** Comments on one task, oldest first. */
    List<Comment> findByTaskId(long taskId);

    /** @return true when a comment was removed */
    boolean deleteById(long id);
}
