package com.openforge.taskmanager.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * Registered account, the root of the ownership graph.
 *
 * email and username carry unique indexes; those constraints, not the
 * existence checks done at registration, are what keep them unique.
 */
@Getter
@Setter
@Entity
@Table(name = "users")
public class User extends BaseEntity {

    @Column(nullable = false, length = 254, unique = true)
    private String email;

    @Column(nullable = false, length = 50, unique = true)
    private String username;

    @Column(name = "full_name", length = 100)
    private String fullName;

    @Column(name = "password_digest", nullable = false, length = 255)
    private String passwordDigest;

    @Column(name = "is_active", nullable = false)
    private boolean isActive = true;

    @Column(name = "is_admin", nullable = false)
    private boolean isAdmin = false;

    @Column(name = "last_login")
    private LocalDateTime lastLogin;
}
