package io.b2mash.workhub.fielddefinition.dto;

/**
 * The raw JSON payload; its accepted shape depends on the field's declared type. A
 * {@code null} value is rejected, use the DELETE endpoint to clear a field.
 */
public record SetFieldValueRequest(Object value) {}
