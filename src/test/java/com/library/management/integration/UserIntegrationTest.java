package com.library.management.integration;

import com.library.management.dto.request.BorrowRequest;
import com.library.management.dto.request.ChangePasswordRequest;
import com.library.management.dto.request.CreateBookRequest;
import com.library.management.dto.request.RegisterUserRequest;
import com.library.management.dto.request.UpdateUserRequest;
import com.library.management.dto.request.UpdateUserRoleRequest;
import com.library.management.dto.response.BookResponse;
import com.library.management.dto.response.ErrorResponse;
import com.library.management.dto.response.PagedResponse;
import com.library.management.dto.response.TransactionResponse;
import com.library.management.dto.response.UserResponse;
import com.library.management.entity.UserRole;
import org.junit.jupiter.api.Test;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import static org.assertj.core.api.Assertions.assertThat;

class UserIntegrationTest extends AbstractIntegrationTest {

    private static final String USERS_URL = "/api/v1/users";

    private static final ParameterizedTypeReference<PagedResponse<UserResponse>> USER_PAGE =
        new ParameterizedTypeReference<>() {};

    @Test
    void register_createsRegularUserWhoCanAuthenticate() {
        Long id = registerUser("alice");

        ResponseEntity<UserResponse> me = as("alice").getForEntity(USERS_URL + "/me", UserResponse.class);

        assertThat(me.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(me.getBody().id()).isEqualTo(id);
        assertThat(me.getBody().role()).isEqualTo(UserRole.REGULAR);
        assertThat(me.getBody().active()).isTrue();
    }

    @Test
    void register_withTakenUsername_returns409() {
        registerUser("alice");

        ResponseEntity<ErrorResponse> response = anonymous().postForEntity(USERS_URL + "/register",
            new RegisterUserRequest("alice", "other@library.test", "long-enough-pw", null), ErrorResponse.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
    }

    @Test
    void update_byRegularUser_silentlyIgnoresRoleAndActive() {
        Long id = registerUser("alice");

        var request = new UpdateUserRequest(null, "Alice Liddell", UserRole.ADMIN, false);
        ResponseEntity<UserResponse> response = as("alice").exchange(
            USERS_URL + "/" + id, HttpMethod.PATCH, new HttpEntity<>(request), UserResponse.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(response.getBody().fullName()).isEqualTo("Alice Liddell");
        assertThat(response.getBody().role()).isEqualTo(UserRole.REGULAR);
        assertThat(response.getBody().active()).isTrue();
    }

    @Test
    void update_byAdmin_canDeactivateAccount() {
        Long id = registerUser("alice");

        restTemplate.exchange(USERS_URL + "/" + id, HttpMethod.PATCH,
            new HttpEntity<>(new UpdateUserRequest(null, null, null, false)), UserResponse.class);

        ResponseEntity<String> me = as("alice").getForEntity(USERS_URL + "/me", String.class);
        assertThat(me.getStatusCode()).isEqualTo(HttpStatus.UNAUTHORIZED);
    }

    @Test
    void getUser_ofSomeoneElse_returns403() {
        registerUser("alice");
        Long bobId = registerUser("bob");

        ResponseEntity<String> response = as("alice").getForEntity(USERS_URL + "/" + bobId, String.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);
    }

    @Test
    void changePassword_requiresCurrentPasswordForOwner() {
        Long id = registerUser("alice");

        ResponseEntity<ErrorResponse> wrong = as("alice").postForEntity(USERS_URL + "/" + id + "/change-password",
            new ChangePasswordRequest("not-my-password", "brand-new-password"), ErrorResponse.class);
        assertThat(wrong.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);

        ResponseEntity<Void> ok = as("alice").postForEntity(USERS_URL + "/" + id + "/change-password",
            new ChangePasswordRequest(USER_PASSWORD, "brand-new-password"), Void.class);
        assertThat(ok.getStatusCode()).isEqualTo(HttpStatus.NO_CONTENT);

        ResponseEntity<UserResponse> withNewPassword = anonymous().withBasicAuth("alice", "brand-new-password")
            .getForEntity(USERS_URL + "/me", UserResponse.class);
        assertThat(withNewPassword.getStatusCode()).isEqualTo(HttpStatus.OK);
    }

    @Test
    void changeRole_promotesUserToAdmin() {
        Long id = registerUser("alice");

        ResponseEntity<String> beforePromotion = as("alice").getForEntity(USERS_URL, String.class);
        assertThat(beforePromotion.getStatusCode()).isEqualTo(HttpStatus.FORBIDDEN);

        ResponseEntity<UserResponse> promoted = restTemplate.postForEntity(USERS_URL + "/" + id + "/role",
            new UpdateUserRoleRequest(UserRole.ADMIN), UserResponse.class);
        assertThat(promoted.getBody().role()).isEqualTo(UserRole.ADMIN);

        ResponseEntity<PagedResponse<UserResponse>> admins = as("alice").exchange(
            USERS_URL + "?role=ADMIN", HttpMethod.GET, null, USER_PAGE);
        assertThat(admins.getStatusCode()).isEqualTo(HttpStatus.OK);
        assertThat(admins.getBody().content()).extracting(UserResponse::username)
            .containsExactlyInAnyOrder(ADMIN_USERNAME, "alice");
    }

    @Test
    void delete_userWithBorrowingHistory_returns409() {
        Long id = registerUser("alice");
        Long bookId = restTemplate.postForEntity("/api/v1/books",
            new CreateBookRequest("Refactoring", "9780134757599", null, 2018, null), BookResponse.class)
            .getBody().id();
        restTemplate.postForEntity("/api/v1/transactions", new BorrowRequest(id, bookId, null),
            TransactionResponse.class);

        ResponseEntity<ErrorResponse> response = restTemplate.exchange(
            USERS_URL + "/" + id, HttpMethod.DELETE, null, ErrorResponse.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
    }

    @Test
    void delete_userWithoutHistory_returns204() {
        Long id = registerUser("alice");

        ResponseEntity<Void> response = restTemplate.exchange(USERS_URL + "/" + id, HttpMethod.DELETE, null, Void.class);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.NO_CONTENT);
    }
}
