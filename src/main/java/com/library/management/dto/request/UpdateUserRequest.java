package com.library.management.dto.request;

import com.library.management.entity.UserRole;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/**
 * Partial update of a user profile. A {@code null} component means "not provided".
 *
 * <p>{@code role} and {@code active} are privileged: for a non-admin actor they are
 * stripped by {@link #withoutPrivilegedFields()} before the update is applied, so a
 * regular user sending them gets the rest of the update applied and no error.
 */
public record UpdateUserRequest(

    @Email(message = "Email must be a valid address")
    @Pattern(regexp = ".*\\S.*", message = "Email must not be blank")
    @Size(max = 254, message = "Email must not exceed 254 characters")
    String email,

    @Size(max = 200, message = "Full name must not exceed 200 characters")
    String fullName,

    UserRole role,

    Boolean active
) {

    public UpdateUserRequest withoutPrivilegedFields() {
        return new UpdateUserRequest(email, fullName, null, null);
    }
}
