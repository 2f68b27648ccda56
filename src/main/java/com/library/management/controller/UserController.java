package com.library.management.controller;

import com.library.management.dto.request.ChangePasswordRequest;
import com.library.management.dto.request.RegisterUserRequest;
import com.library.management.dto.request.UpdateUserRequest;
import com.library.management.dto.request.UpdateUserRoleRequest;
import com.library.management.dto.response.PagedResponse;
import com.library.management.dto.response.UserResponse;
import com.library.management.entity.UserRole;
import com.library.management.security.AccessGuard;
import com.library.management.security.LibraryUserDetails;
import com.library.management.service.UserService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.Pageable;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/users")
@RequiredArgsConstructor
@Tag(name = "Users", description = "Accounts and roles")
public class UserController {

    private final UserService userService;
    private final AccessGuard accessGuard;

    @PostMapping("/register")
    @Operation(summary = "Register a regular account")
    @ApiResponse(responseCode = "201", description = "User created")
    @ApiResponse(responseCode = "409", description = "Username or email already taken")
    public ResponseEntity<UserResponse> register(@Valid @RequestBody RegisterUserRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(userService.register(request));
    }

    @GetMapping("/me")
    @Operation(summary = "The authenticated account")
    public ResponseEntity<UserResponse> me(@AuthenticationPrincipal LibraryUserDetails actor) {
        return ResponseEntity.ok(userService.findById(actor.getId()));
    }

    @GetMapping
    @Operation(summary = "List users", description = "Admin only.")
    public ResponseEntity<PagedResponse<UserResponse>> findAll(
            @RequestParam(required = false) UserRole role,
            @RequestParam(required = false) Boolean isActive,
            Pageable pageable) {
        return ResponseEntity.ok(PagedResponse.from(userService.findAll(role, isActive, pageable)));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get user by ID")
    @ApiResponse(responseCode = "200", description = "User found")
    @ApiResponse(responseCode = "403", description = "Not the account owner")
    @ApiResponse(responseCode = "404", description = "User not found")
    public ResponseEntity<UserResponse> findById(@AuthenticationPrincipal LibraryUserDetails actor,
                                                 @PathVariable Long id) {
        accessGuard.requireSelfOrAdmin(actor, id);
        return ResponseEntity.ok(userService.findById(id));
    }

    @PatchMapping("/{id}")
    @Operation(summary = "Update a user",
               description = "Partial update. role and active are ignored unless the caller is an admin.")
    @ApiResponse(responseCode = "200", description = "User updated")
    @ApiResponse(responseCode = "409", description = "Email already taken")
    public ResponseEntity<UserResponse> update(@AuthenticationPrincipal LibraryUserDetails actor,
                                               @PathVariable Long id,
                                               @Valid @RequestBody UpdateUserRequest request) {
        accessGuard.requireSelfOrAdmin(actor, id);
        return ResponseEntity.ok(userService.update(id, accessGuard.filterUpdate(actor, request)));
    }

    @PostMapping("/{id}/change-password")
    @Operation(summary = "Change password", description = "Admins may reset without the current password.")
    @ApiResponse(responseCode = "204", description = "Password changed")
    @ApiResponse(responseCode = "400", description = "Current password is wrong")
    public ResponseEntity<Void> changePassword(@AuthenticationPrincipal LibraryUserDetails actor,
                                               @PathVariable Long id,
                                               @Valid @RequestBody ChangePasswordRequest request) {
        accessGuard.requireSelfOrAdmin(actor, id);
        userService.changePassword(id, request, !actor.isAdmin());
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/role")
    @Operation(summary = "Change a user's role", description = "Admin only.")
    public ResponseEntity<UserResponse> changeRole(@PathVariable Long id,
                                                   @Valid @RequestBody UpdateUserRoleRequest request) {
        return ResponseEntity.ok(userService.changeRole(id, request.role()));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete a user", description = "Admin only. Returns 409 if the user has borrowing history.")
    @ApiResponse(responseCode = "204", description = "User deleted")
    @ApiResponse(responseCode = "409", description = "User has borrowing history")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        userService.delete(id);
        return ResponseEntity.noContent().build();
    }
}
