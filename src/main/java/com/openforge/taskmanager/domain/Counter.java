package com.openforge.taskmanager.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PostLoad;
import jakarta.persistence.PostPersist;
import jakarta.persistence.Table;
import jakarta.persistence.Transient;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.domain.Persistable;

/**
 * One row per entity type ("users", "tasks" …) holding the last id handed out.
 * Rows are created lazily at 0 and never deleted.
 *
 * Persistable so that creating a counter is always an INSERT: a merge would
 * silently reset a counter another writer created in the meantime.
 */
@Getter
@Setter
@NoArgsConstructor
@Entity
@Table(name = "counters")
public class Counter implements Persistable<String> {

    @Id
    @Column(length = 64)
    private String name;

    @Column(nullable = false)
    private long sequence;

    @Transient
    @Getter(AccessLevel.NONE)
    @Setter(AccessLevel.NONE)
    private boolean fresh = true;

    public Counter(String name) {
        this.name = name;
        this.sequence = 0L;
    }

    @Override
    public String getId() {
        return name;
    }

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
