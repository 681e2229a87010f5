package io.b2mash.workhub.fielddefinition;

import io.b2mash.workhub.exception.ValidationException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Turns a raw JSON payload into a {@link FieldPayload} for a given field definition. The parser is
 * picked from the definition's declared type, never from the shape of the payload, so a boolean
 * sent to a date field is rejected rather than coerced.
 */
@Component
public class CustomFieldValidator {

  /** Matches the {@code NUMERIC(38, 10)} storage column. */
  static final int MAX_NUMBER_SCALE = 10;

  static final int MAX_NUMBER_INTEGER_DIGITS = 28;

  @FunctionalInterface
  interface ValueParser {
    FieldPayload parse(Object raw, List<CustomFieldOption> options);
  }

  private final Map<FieldValueType, ValueParser> parsers = new EnumMap<>(FieldValueType.class);

  public CustomFieldValidator() {
    parsers.put(FieldValueType.TEXT, (raw, options) -> parseText(raw));
    parsers.put(FieldValueType.NUMBER, (raw, options) -> parseNumber(raw));
    parsers.put(FieldValueType.DATE, (raw, options) -> parseDate(raw));
    parsers.put(FieldValueType.BOOLEAN, (raw, options) -> parseBoolean(raw));
    parsers.put(FieldValueType.SINGLE_SELECT, CustomFieldValidator::parseOption);
  }

  /**
   * Parses {@code raw} against the field's declared type.
   *
   * @param options the field's options; ignored unless the field is single-select
   * @throws ValidationException when the payload is missing or does not match the type
   */
  public FieldPayload parse(
      CustomFieldDefinition definition, List<CustomFieldOption> options, Object raw) {
    if (raw == null) {
      throw new ValidationException(
          "Invalid field value",
          "value is required for field '" + definition.getName() + "'; clear the field instead");
    }
    return parsers.get(definition.getValueType()).parse(raw, options);
  }

  private static FieldPayload parseText(Object raw) {
    if (!(raw instanceof String text)) {
      throw typeMismatch("a text value");
    }
    return new FieldPayload.Text(text);
  }

  private static FieldPayload parseNumber(Object raw) {
    if (!(raw instanceof Number number)) {
      throw typeMismatch("a numeric value");
    }
    BigDecimal decimal;
    try {
      decimal = toBigDecimal(number);
    } catch (NumberFormatException e) {
      throw typeMismatch("a finite numeric value");
    }
    var significant = decimal.stripTrailingZeros();
    if (significant.scale() > MAX_NUMBER_SCALE) {
      throw new ValidationException(
          "Invalid field value",
          "Numbers may have at most " + MAX_NUMBER_SCALE + " decimal places");
    }
    if (significant.precision() - significant.scale() > MAX_NUMBER_INTEGER_DIGITS) {
      throw new ValidationException(
          "Invalid field value",
          "Numbers may have at most " + MAX_NUMBER_INTEGER_DIGITS + " integer digits");
    }
    return new FieldPayload.Number(decimal);
  }

  private static FieldPayload parseDate(Object raw) {
    if (!(raw instanceof String text)) {
      throw typeMismatch("a date string in yyyy-MM-dd format");
    }
    try {
      return new FieldPayload.Date(LocalDate.parse(text));
    } catch (DateTimeParseException e) {
      throw typeMismatch("a date string in yyyy-MM-dd format");
    }
  }

  private static FieldPayload parseBoolean(Object raw) {
    if (!(raw instanceof Boolean bool)) {
      throw typeMismatch("a boolean value");
    }
    return new FieldPayload.Bool(bool);
  }

  /** An option id (number) or an option name (string); either way the option id is stored. */
  private static FieldPayload parseOption(Object raw, List<CustomFieldOption> options) {
    if (raw instanceof Number number) {
      BigDecimal candidate;
      try {
        candidate = toBigDecimal(number);
      } catch (NumberFormatException e) {
        throw typeMismatch("an option id or option name");
      }
      return options.stream()
          .filter(option -> candidate.compareTo(BigDecimal.valueOf(option.getId())) == 0)
          .findFirst()
          .map(option -> new FieldPayload.Option(option.getId()))
          .orElseThrow(
              () ->
                  new ValidationException(
                      "Invalid field value", "Unknown option id " + number + " for this field"));
    }
    if (raw instanceof String name) {
      return options.stream()
          .filter(option -> option.getName().equals(name))
          .findFirst()
          .map(option -> new FieldPayload.Option(option.getId()))
          .orElseThrow(
              () ->
                  new ValidationException(
                      "Invalid field value", "Unknown option '" + name + "' for this field"));
    }
    throw typeMismatch("an option id or option name");
  }

  private static BigDecimal toBigDecimal(Number number) {
    if (number instanceof BigDecimal decimal) {
      return decimal;
    }
    if (number instanceof BigInteger integer) {
      return new BigDecimal(integer);
    }
    return new BigDecimal(number.toString());
  }

  private static ValidationException typeMismatch(String expected) {
    return new ValidationException("Invalid field value", "Expected " + expected);
  }
}
