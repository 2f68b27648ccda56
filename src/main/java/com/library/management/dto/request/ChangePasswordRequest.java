package com.library.management.dto.request;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ChangePasswordRequest(

    /** Required for regular users; ignored when an admin resets another account. */
    String currentPassword,

    @NotBlank(message = "New password must not be blank")
    @Size(min = 8, max = 100, message = "New password must be between 8 and 100 characters")
    String newPassword
) {}
