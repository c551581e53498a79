package com.openforge.taskmanager.counter;

import com.openforge.taskmanager.domain.Counter;
import com.openforge.taskmanager.repository.CounterRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionSynchronizationManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Hands out monotonically increasing ids per entity type.
 *
 * Each call runs in its own short transaction (REQUIRES_NEW) made of one
 * {@code UPDATE … SET sequence = sequence + 1} and one read of the same row.
 * The row lock taken by the UPDATE serialises concurrent callers, so two
 * calls for the same name never see the same value. The lock is released as
 * soon as the id is issued, not when the caller's own transaction commits;
 * an id handed to a caller that later rolls back is simply skipped.
 *
 * First use of a name inserts the row at 0. Two callers racing to create it
 * are arbitrated by the primary key: the loser's insert fails and it goes on
 * to increment the row the winner created.
 *
 * Callers must not hold a transaction of their own. The allocation takes a
 * pooled connection; one taken while the caller already holds another lets
 * a burst of concurrent creators exhaust the pool, each waiting for a second
 * connection. Allocate the id first, then open the transaction that saves.
 */
@Slf4j
@Component
public class CounterAllocator {

    public static final String USERS = "users";
    public static final String TASKS = "tasks";

    private final CounterRepository   counterRepository;
    private final TransactionTemplate requiresNew;

    public CounterAllocator(CounterRepository counterRepository,
                            PlatformTransactionManager transactionManager) {
        this.counterRepository = counterRepository;
        this.requiresNew       = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * Atomically increments the counter for {@code entityName} and returns
     * the post-increment value, creating the counter at 0 if absent.
     *
     * @throws IllegalStateException when called inside an active transaction
     */
    public long nextId(String entityName) {
        if (TransactionSynchronizationManager.isActualTransactionActive()) {
            throw new IllegalStateException("Counter '" + entityName + "' allocated inside an open transaction");
        }
        Long next = requiresNew.execute(status -> incrementAndGet(entityName));
        if (next == null) {
            createIfAbsent(entityName);
            next = requiresNew.execute(status -> incrementAndGet(entityName));
            if (next == null) {
                throw new IllegalStateException("Counter row missing after creation: " + entityName);
            }
        }
        log.debug("[Counter] {} -> {}", entityName, next);
        return next;
    }

    // ── Private ───────────────────────────────────────────────────────────────

    /** Returns null when the counter row does not exist yet. */
    private Long incrementAndGet(String entityName) {
        if (counterRepository.increment(entityName) == 0) {
            return null;
        }
        return counterRepository.findSequence(entityName).orElse(null);
    }

    private void createIfAbsent(String entityName) {
        try {
            requiresNew.executeWithoutResult(status -> counterRepository.saveAndFlush(new Counter(entityName)));
            log.info("[Counter] Created counter '{}'", entityName);
        } catch (DataIntegrityViolationException e) {
            log.debug("[Counter] Counter '{}' created concurrently by another writer", entityName);
        }
    }
}
