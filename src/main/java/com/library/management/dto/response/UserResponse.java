package com.library.management.dto.response;

import com.library.management.entity.UserRole;

import java.time.Instant;

public record UserResponse(
    Long id,
    String username,
    String email,
    String fullName,
    UserRole role,
    boolean active,
    Instant createdAt,
    Instant updatedAt
) {}
