package com.library.management.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Credentials of the administrator account created on startup. Bootstrap is skipped unless
 * username, email and password are all non-blank.
 */
@ConfigurationProperties(prefix = "library.admin")
public record AdminBootstrapProperties(
    String username,
    String email,
    String password,
    String fullName
) {

    public boolean isComplete() {
        return hasText(username) && hasText(email) && hasText(password);
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
