package com.library.management.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * JPA entity representing a library account.
 *
 * <p>Mapped to the {@code users} table ({@code user} is reserved in PostgreSQL).
 * {@code username} and {@code email} are unique, enforced by {@code uk_users_username}
 * and {@code uk_users_email}; {@code GlobalExceptionHandler} turns a violation of either
 * into a 409 when two registrations race past the service-level pre-check.
 *
 * <p>{@code passwordHash} holds a BCrypt hash and is never exposed through a response DTO.
 * An account with {@code active = false} cannot authenticate.
 */
@Entity
@Table(name = "users")
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id", callSuper = false)
public class User extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "username", nullable = false, unique = true, length = 50)
    private String username;

    @Column(name = "email", nullable = false, unique = true, length = 254)
    private String email;

    @Column(name = "full_name", length = 200)
    private String fullName;

    @Column(name = "password_hash", nullable = false, length = 100)
    private String passwordHash;

    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 20)
    private UserRole role = UserRole.REGULAR;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;
}
