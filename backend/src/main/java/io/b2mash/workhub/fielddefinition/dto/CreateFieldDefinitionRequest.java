package io.b2mash.workhub.fielddefinition.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.List;

public record CreateFieldDefinitionRequest(
    @NotBlank @Size(max = 100) String name,
    @NotBlank(message = "valueType is required") String valueType,
    @Valid List<FieldOptionRequest> options) {}
