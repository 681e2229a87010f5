package io.b2mash.workhub.fielddefinition;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * A type-checked custom field value. There is one variant per {@link FieldValueType}, and each
 * variant maps to exactly one storage column of {@link TaskFieldValue}.
 */
public sealed interface FieldPayload {

  FieldValueType type();

  record Text(String value) implements FieldPayload {
    @Override
    public FieldValueType type() {
      return FieldValueType.TEXT;
    }
  }

  record Number(BigDecimal value) implements FieldPayload {
    @Override
    public FieldValueType type() {
      return FieldValueType.NUMBER;
    }
  }

  record Date(LocalDate value) implements FieldPayload {
    @Override
    public FieldValueType type() {
      return FieldValueType.DATE;
    }
  }

  record Bool(boolean value) implements FieldPayload {
    @Override
    public FieldValueType type() {
      return FieldValueType.BOOLEAN;
    }
  }

  record Option(Long optionId) implements FieldPayload {
    @Override
    public FieldValueType type() {
      return FieldValueType.SINGLE_SELECT;
    }
  }
}
