package com.openforge.taskmanager.task;

import com.openforge.taskmanager.domain.TaskPriority;
import com.openforge.taskmanager.domain.TaskStatus;

import java.time.LocalDateTime;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * The set of task fields a caller wants to change, and nothing else.
 *
 * Built explicitly from the fields the caller intends to set; a field that
 * was never put is left untouched by the UPDATE. An empty patch only
 * refreshes updated_at.
 */
public final class TaskPatch {

    /** Patchable fields, mapped to their JPA attribute names. */
    public enum Field {
        TITLE("title"),
        DESCRIPTION("description"),
        PRIORITY("priority"),
        STATUS("status"),
        DUE_DATE("dueDate"),
        ASSIGNED_TO("assignedTo");

        private final String attribute;

        Field(String attribute) {
            this.attribute = attribute;
        }

        public String attribute() {
            return attribute;
        }
    }

    private final Map<Field, Object> changes = new EnumMap<>(Field.class);

    public static TaskPatch empty() {
        return new TaskPatch();
    }

    public TaskPatch title(String title) {
        return put(Field.TITLE, title);
    }

    public TaskPatch description(String description) {
        return put(Field.DESCRIPTION, description);
    }

    public TaskPatch priority(TaskPriority priority) {
        return put(Field.PRIORITY, priority);
    }

    public TaskPatch status(TaskStatus status) {
        return put(Field.STATUS, status);
    }

    public TaskPatch dueDate(LocalDateTime dueDate) {
        return put(Field.DUE_DATE, dueDate);
    }

    public TaskPatch assignedTo(Long userId) {
        return put(Field.ASSIGNED_TO, userId);
    }

    public boolean isEmpty() {
        return changes.isEmpty();
    }

    public Map<Field, Object> changes() {
        return Collections.unmodifiableMap(changes);
    }

    private TaskPatch put(Field field, Object value) {
        changes.put(field, Objects.requireNonNull(value, () -> field + " must not be null in a patch"));
        return this;
    }

    @Override
    public String toString() {
        return "TaskPatch" + changes;
    }
}
