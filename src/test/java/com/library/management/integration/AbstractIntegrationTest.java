package com.library.management.integration;

import com.library.management.dto.request.RegisterUserRequest;
import com.library.management.dto.response.UserResponse;
import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Boots the whole application against a PostgreSQL container shared by every subclass.
 * The schema comes from the Flyway migrations; rows are wiped before each test, except
 * the bootstrapped admin account.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
@Testcontainers(disabledWithoutDocker = true)
public abstract class AbstractIntegrationTest {

    protected static final String ADMIN_USERNAME = "admin";
    protected static final String ADMIN_PASSWORD = "admin-password";
    protected static final String USER_PASSWORD = "reader-password";

    static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16-alpine");

    @DynamicPropertySource
    static void configureProperties(DynamicPropertyRegistry registry) {
        POSTGRES.start();
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
        registry.add("library.admin.username", () -> ADMIN_USERNAME);
        registry.add("library.admin.email", () -> "admin@library.test");
        registry.add("library.admin.password", () -> ADMIN_PASSWORD);
        registry.add("library.admin.full-name", () -> "Library Admin");
    }

    @Autowired
    private TestRestTemplate anonymousRestTemplate;

    @Autowired
    protected JdbcTemplate jdbcTemplate;

    /** Authenticated as the bootstrapped admin. */
    protected TestRestTemplate restTemplate;

    @BeforeEach
    protected void resetState() {
        jdbcTemplate.execute("DELETE FROM transactions");
        jdbcTemplate.execute("DELETE FROM books");
        jdbcTemplate.execute("DELETE FROM authors");
        jdbcTemplate.update("DELETE FROM users WHERE username <> ?", ADMIN_USERNAME);
        restTemplate = anonymousRestTemplate.withBasicAuth(ADMIN_USERNAME, ADMIN_PASSWORD);
    }

    protected TestRestTemplate anonymous() {
        return anonymousRestTemplate;
    }

    protected TestRestTemplate as(String username) {
        return anonymousRestTemplate.withBasicAuth(username, USER_PASSWORD);
    }

    protected Long registerUser(String username) {
        var request = new RegisterUserRequest(username, username + "@library.test", USER_PASSWORD,
            "Reader " + username);
        ResponseEntity<UserResponse> response =
            anonymousRestTemplate.postForEntity("/api/v1/users/register", request, UserResponse.class);
        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CREATED);
        return response.getBody().id();
    }

    protected Long adminId() {
        return jdbcTemplate.queryForObject(
            "SELECT id FROM users WHERE username = ?", Long.class, ADMIN_USERNAME);
    }
}
