package com.library.management.unit.dto;

import com.library.management.dto.request.CreateAuthorRequest;
import com.library.management.dto.request.UpdateAuthorRequest;
import com.library.management.dto.request.UpdateUserRequest;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validation;
import jakarta.validation.Validator;
import jakarta.validation.ValidatorFactory;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class RequestValidationTest {

    private static ValidatorFactory factory;
    private static Validator validator;

    @BeforeAll
    static void setUp() {
        factory = Validation.buildDefaultValidatorFactory();
        validator = factory.getValidator();
    }

    @AfterAll
    static void tearDown() {
        factory.close();
    }

    @Test
    void updateUser_withBlankEmail_isRejected() {
        assertThat(emailViolations(new UpdateUserRequest("", null, null, null))).isNotEmpty();
        assertThat(emailViolations(new UpdateUserRequest("   ", null, null, null))).isNotEmpty();
    }

    @Test
    void updateUser_withoutEmail_isAccepted() {
        assertThat(validator.validate(new UpdateUserRequest(null, "Alice", null, null))).isEmpty();
    }

    @Test
    void updateUser_withValidEmail_isAccepted() {
        assertThat(validator.validate(new UpdateUserRequest("alice@library.test", null, null, null))).isEmpty();
    }

    @Test
    void author_withBlankEmail_isRejected() {
        Set<ConstraintViolation<CreateAuthorRequest>> create =
            validator.validate(new CreateAuthorRequest("Brian Goetz", "", null, null, null, null));
        Set<ConstraintViolation<UpdateAuthorRequest>> update =
            validator.validate(new UpdateAuthorRequest(null, "", null, null, null, null));

        assertThat(create).extracting(v -> v.getPropertyPath().toString()).contains("email");
        assertThat(update).extracting(v -> v.getPropertyPath().toString()).contains("email");
    }

    private List<String> emailViolations(UpdateUserRequest request) {
        return validator.validate(request).stream()
            .filter(v -> v.getPropertyPath().toString().equals("email"))
            .map(ConstraintViolation::getMessage)
            .toList();
    }
}
