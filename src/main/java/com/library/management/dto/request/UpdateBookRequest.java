package com.library.management.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record UpdateBookRequest(

    @Size(min = 1, max = 200, message = "Title must be between 1 and 200 characters")
    @Pattern(regexp = ".*\\S.*", message = "Title must not be blank")
    String title,

    @Size(min = 1, max = 13, message = "ISBN must be between 1 and 13 characters")
    @Pattern(regexp = ".*\\S.*", message = "ISBN must not be blank")
    String isbn,

    @Size(max = 1000, message = "Description must not exceed 1000 characters")
    String description,

    @Min(value = 1000, message = "Published year must be 1000 or later")
    @Max(value = 2100, message = "Published year must be 2100 or earlier")
    Integer publishedYear,

    Long authorId
) {}
