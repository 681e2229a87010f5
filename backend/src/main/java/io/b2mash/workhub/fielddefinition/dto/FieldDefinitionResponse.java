package io.b2mash.workhub.fielddefinition.dto;

import io.b2mash.workhub.fielddefinition.CustomFieldDefinition;
import io.b2mash.workhub.fielddefinition.CustomFieldOption;
import java.time.Instant;
import java.util.List;

public record FieldDefinitionResponse(
    Long id,
    Long projectId,
    String name,
    String valueType,
    List<FieldOptionResponse> options,
    Instant createdAt,
    Instant updatedAt) {

  public static FieldDefinitionResponse from(
      CustomFieldDefinition definition, List<CustomFieldOption> options) {
    return new FieldDefinitionResponse(
        definition.getId(),
        definition.getProjectId(),
        definition.getName(),
        definition.getValueType().wireName(),
        options.stream().map(FieldOptionResponse::from).toList(),
        definition.getCreatedAt(),
        definition.getUpdatedAt());
  }
}
