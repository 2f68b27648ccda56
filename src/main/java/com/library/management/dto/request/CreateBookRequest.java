package com.library.management.dto.request;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Registers one physical copy. Adding a second copy of a title means posting the same
 * ISBN again; the copies then form one availability group.
 */
public record CreateBookRequest(

    @NotBlank(message = "Title must not be blank")
    @Size(max = 200, message = "Title must not exceed 200 characters")
    String title,

    @NotBlank(message = "ISBN must not be blank")
    @Size(max = 13, message = "ISBN must not exceed 13 characters")
    String isbn,

    @Size(max = 1000, message = "Description must not exceed 1000 characters")
    String description,

    @Min(value = 1000, message = "Published year must be 1000 or later")
    @Max(value = 2100, message = "Published year must be 2100 or earlier")
    Integer publishedYear,

    Long authorId
) {}
