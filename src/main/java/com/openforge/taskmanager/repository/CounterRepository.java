package com.openforge.taskmanager.repository;

import com.openforge.taskmanager.domain.Counter;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface CounterRepository extends JpaRepository<Counter, String> {

    /**
     * Single-statement increment; the store holds the row lock until the
     * surrounding transaction ends. Returns the number of rows touched
     * (0 when the counter does not exist yet).
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Counter c SET c.sequence = c.sequence + 1 WHERE c.name = :name")
    int increment(@Param("name") String name);

    @Query("SELECT c.sequence FROM Counter c WHERE c.name = :name")
    Optional<Long> findSequence(@Param("name") String name);
}
