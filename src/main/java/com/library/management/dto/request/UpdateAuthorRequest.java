package com.library.management.dto.request;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Past;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;

public record UpdateAuthorRequest(

    @Size(min = 1, max = 200, message = "Name must be between 1 and 200 characters")
    @Pattern(regexp = ".*\\S.*", message = "Name must not be blank")
    String name,

    @Email(message = "Email must be a valid address")
    @Pattern(regexp = ".*\\S.*", message = "Email must not be blank")
    @Size(max = 254, message = "Email must not exceed 254 characters")
    String email,

    @Size(max = 2000, message = "Bio must not exceed 2000 characters")
    String bio,

    @Past(message = "Birth date must be in the past")
    LocalDate birthDate,

    @Size(max = 100, message = "Nationality must not exceed 100 characters")
    String nationality,

    @Size(max = 500, message = "Website must not exceed 500 characters")
    String website
) {}
