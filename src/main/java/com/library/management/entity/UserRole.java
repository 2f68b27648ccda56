package com.library.management.entity;

/**
 * Role of a {@link User}. Stored by name ({@code EnumType.STRING}).
 *
 * <ul>
 *   <li>{@link #ADMIN}: manages the catalog, other users and the full transaction ledger</li>
 *   <li>{@link #REGULAR}: borrows and returns books, sees only its own records</li>
 * </ul>
 */
public enum UserRole {
    ADMIN,
    REGULAR
}
