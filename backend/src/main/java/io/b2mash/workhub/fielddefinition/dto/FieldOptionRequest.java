package io.b2mash.workhub.fielddefinition.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

/** An option of a single-select field. {@code id} identifies an existing option on update. */
public record FieldOptionRequest(
    Long id,
    @NotBlank(message = "option name must not be blank") @Size(max = 100) String name,
    @Pattern(regexp = "^#[0-9A-Fa-f]{6}$", message = "color must be a #RRGGBB hex value")
        String color) {}
