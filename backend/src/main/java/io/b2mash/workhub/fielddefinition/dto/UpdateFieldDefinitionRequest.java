package io.b2mash.workhub.fielddefinition.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.util.List;

/**
 * Partial update. A {@code null} options list keeps the current options; a non-null list replaces
 * them, matching existing options by id.
 */
public record UpdateFieldDefinitionRequest(
    @Pattern(regexp = "(?s).*\\S.*", message = "name must not be blank") @Size(max = 100)
        String name,
    String valueType,
    @Valid List<FieldOptionRequest> options) {}
