package com.openforge.taskmanager.repository;

import com.openforge.taskmanager.domain.Task;
import com.openforge.taskmanager.domain.TaskPriority;
import com.openforge.taskmanager.domain.TaskStatus;
import com.openforge.taskmanager.task.TaskPatch;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.CriteriaUpdate;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;
import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Slf4j
class TaskRepositoryCustomImpl implements TaskRepositoryCustom {

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public List<Task> findForOwner(Long userId, TaskStatus status, TaskPriority priority, int skip, int limit) {
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaQuery<Task> query = cb.createQuery(Task.class);
        Root<Task> root = query.from(Task.class);

        List<Predicate> predicates = new ArrayList<>();
        predicates.add(cb.equal(root.get("userId"), userId));
        if (status != null) {
            predicates.add(cb.equal(root.get("status"), status));
        }
        if (priority != null) {
            predicates.add(cb.equal(root.get("priority"), priority));
        }

        query.select(root)
             .where(predicates.toArray(new Predicate[0]))
             .orderBy(cb.asc(root.get("id")));

        return entityManager.createQuery(query)
                .setFirstResult(skip)
                .setMaxResults(limit)
                .getResultList();
    }

    @Override
    @Transactional
    public int applyPatch(Long taskId, TaskPatch patch, LocalDateTime updatedAt) {
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaUpdate<Task> update = cb.createCriteriaUpdate(Task.class);
        Root<Task> root = update.from(Task.class);

        patch.changes().forEach((field, value) -> update.set(field.attribute(), value));
        update.set("updatedAt", updatedAt);
        update.where(cb.equal(root.get("id"), taskId));

        // Bulk updates bypass the persistence context: push pending writes first,
        // then drop managed copies so the next read sees the new row.
        entityManager.flush();
        int rows = entityManager.createQuery(update).executeUpdate();
        entityManager.clear();

        log.debug("[Task] Patched task {} fields={} rows={}", taskId, patch.changes().keySet(), rows);
        return rows;
    }
}
