package io.b2mash.workhub.fielddefinition.dto;

import java.time.Instant;

/**
 * A set custom field value. For single-select fields {@code value} is the option name and {@code
 * optionId} the stored option; for other types {@code optionId} is {@code null}.
 */
public record FieldValueResponse(
    Long fieldId,
    String fieldName,
    String valueType,
    Object value,
    Long optionId,
    Instant updatedAt) {}
