package io.b2mash.workhub.tag.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

public record CreateTagRequest(
    @NotNull(message = "workspaceId is required") Long workspaceId,
    @NotBlank @Size(max = 100) String name,
    @Pattern(regexp = "^#[0-9A-Fa-f]{6}$", message = "color must be a #RRGGBB hex value")
        String color) {}
