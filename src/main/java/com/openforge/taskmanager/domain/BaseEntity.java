package com.openforge.taskmanager.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Id;
import jakarta.persistence.MappedSuperclass;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.Transient;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import org.springframework.data.domain.Persistable;

import java.time.LocalDateTime;

/**
 * Columns shared by every business table.
 *
 * - id          : assigned by CounterAllocator before the first save, never generated by the store
 * - created_at  : set once on INSERT, never touched again
 *
 * Because the id is always present, Spring Data cannot tell a new row from a
 * detached one by looking at it. The transient "fresh" flag answers isNew()
 * so save() issues a plain INSERT and a duplicate id fails on the primary key.
 */
@Getter
@Setter
@MappedSuperclass
public abstract class BaseEntity implements Persistable<Long> {

    @Id
    private Long id;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Transient
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private boolean fresh = true;

    @Override
    public boolean isNew() {
        return fresh;
    }

    @PostLoad
    @PostPersist
    void markPersisted() {
        this.fresh = false;
    }
}
