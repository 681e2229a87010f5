package io.b2mash.workhub.fielddefinition;

import io.b2mash.workhub.exception.ValidationException;
import java.util.Arrays;
import java.util.Locale;

/** Declared type of a custom field. The wire form is lower-case, e.g. {@code single-select}. */
public enum FieldValueType {
  TEXT("text"),
  NUMBER("number"),
  DATE("date"),
  BOOLEAN("boolean"),
  SINGLE_SELECT("single-select");

  private final String wireName;

  FieldValueType(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() {
    return wireName;
  }

  public boolean hasOptions() {
    return this == SINGLE_SELECT;
  }

  /** Accepts the wire form or the constant name, case-insensitively. */
  public static FieldValueType fromValue(String value) {
    if (value == null || value.isBlank()) {
      throw new ValidationException("Invalid value type", "valueType is required");
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT).replace('_', '-');
    return Arrays.stream(values())
        .filter(type -> type.wireName.equals(normalized))
        .findFirst()
        .orElseThrow(
            () ->
                new ValidationException(
                    "Invalid value type",
                    "valueType must be one of text, number, date, boolean, single-select"));
  }
}
