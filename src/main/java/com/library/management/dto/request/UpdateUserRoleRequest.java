package com.library.management.dto.request;

import com.library.management.entity.UserRole;
import jakarta.validation.constraints.NotNull;

public record UpdateUserRoleRequest(

    @NotNull(message = "Role is required")
    UserRole role
) {}
