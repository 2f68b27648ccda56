package com.library.management.security;

import com.library.management.dto.request.UpdateUserRequest;
import org.springframework.security.access.AccessDeniedException;
import org.springframework.stereotype.Component;

/**
 * Ownership checks that URL rules in {@link SecurityConfig} cannot express, because the
 * owner is only known once the target row has been read.
 */
@Component
public class AccessGuard {

    /**
     * @throws AccessDeniedException unless the actor is an admin or {@code ownerId} is the
     *                               actor's own id
     */
    public void requireSelfOrAdmin(LibraryUserDetails actor, Long ownerId) {
        if (actor.isAdmin() || actor.getId().equals(ownerId)) {
            return;
        }
        throw new AccessDeniedException("You do not have permission to access this resource");
    }

    /** Drops {@code role} and {@code active} from the update when the actor is not an admin. */
    public UpdateUserRequest filterUpdate(LibraryUserDetails actor, UpdateUserRequest request) {
        return actor.isAdmin() ? request : request.withoutPrivilegedFields();
    }
}
