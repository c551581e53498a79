package com.openforge.taskmanager.auth.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.openforge.taskmanager.domain.User;

import java.time.LocalDateTime;

/**
 * Outward view of a user. Deliberately has no password or digest field.
 */
public record UserResponse(
        Long          id,
        String        email,
        String        username,
        String        fullName,
        @JsonProperty("is_active") boolean active,
        @JsonProperty("is_admin")  boolean admin,
        LocalDateTime createdAt,
        LocalDateTime lastLogin
) {

    public static UserResponse from(User user) {
        return new UserResponse(
                user.getId(),
                user.getEmail(),
                user.getUsername(),
                user.getFullName(),
                user.isActive(),
                user.isAdmin(),
                user.getCreatedAt(),
                user.getLastLogin()
        );
    }
}
