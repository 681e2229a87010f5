package io.b2mash.workhub.fielddefinition;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;

/**
 * The stored value of one custom field on one task. Exactly one of the typed columns is populated
 * and it always matches {@code valueType}; the database enforces the same rule with a CHECK
 * constraint. An unset field has no row at all.
 */
@Entity
@Table(name = "task_field_values")
public class TaskFieldValue {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "task_id", nullable = false, updatable = false)
  private Long taskId;

  @Column(name = "field_id", nullable = false, updatable = false)
  private Long fieldId;

  @Enumerated(EnumType.STRING)
  @Column(name = "value_type", nullable = false, length = 20)
  private FieldValueType valueType;

  @Column(name = "value_text", columnDefinition = "TEXT")
  private String valueText;

  @Column(name = "value_number", precision = 38, scale = 10)
  private BigDecimal valueNumber;

  @Column(name = "value_date")
  private LocalDate valueDate;

  @Column(name = "value_boolean")
  private Boolean valueBoolean;

  @Column(name = "value_option_id")
  private Long valueOptionId;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected TaskFieldValue() {}

  public TaskFieldValue(Long taskId, Long fieldId, FieldPayload payload) {
    this.taskId = taskId;
    this.fieldId = fieldId;
    this.createdAt = Instant.now();
    replace(payload);
  }

  /** Overwrites the stored payload, clearing every column the new variant does not use. */
  public void replace(FieldPayload payload) {
    this.valueType = payload.type();
    this.valueText = null;
    this.valueNumber = null;
    this.valueDate = null;
    this.valueBoolean = null;
    this.valueOptionId = null;
    if (payload instanceof FieldPayload.Text text) {
      this.valueText = text.value();
    } else if (payload instanceof FieldPayload.Number number) {
      this.valueNumber = number.value();
    } else if (payload instanceof FieldPayload.Date date) {
      this.valueDate = date.value();
    } else if (payload instanceof FieldPayload.Bool bool) {
      this.valueBoolean = bool.value();
    } else if (payload instanceof FieldPayload.Option option) {
      this.valueOptionId = option.optionId();
    }
    this.updatedAt = Instant.now();
  }

  /** Reads the populated column back as its payload variant. */
  public FieldPayload payload() {
    return switch (valueType) {
      case TEXT -> new FieldPayload.Text(valueText);
      case NUMBER -> new FieldPayload.Number(valueNumber);
      case DATE -> new FieldPayload.Date(valueDate);
      case BOOLEAN -> new FieldPayload.Bool(valueBoolean);
      case SINGLE_SELECT -> new FieldPayload.Option(valueOptionId);
    };
  }

  public Long getId() {
    return id;
  }

  public Long getTaskId() {
    return taskId;
  }

  public Long getFieldId() {
    return fieldId;
  }

  public FieldValueType getValueType() {
    return valueType;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
