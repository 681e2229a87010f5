package io.b2mash.workhub.tag.dto;

import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/** Partial update; a {@code null} field keeps its current value. */
public record UpdateTagRequest(
    @Pattern(regexp = "(?s).*\\S.*", message = "name must not be blank") @Size(max = 100)
        String name,
    @Pattern(regexp = "^#[0-9A-Fa-f]{6}$", message = "color must be a #RRGGBB hex value")
        String color) {}
