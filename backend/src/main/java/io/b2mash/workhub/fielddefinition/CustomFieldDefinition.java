package io.b2mash.workhub.fielddefinition;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

@Entity
@Table(name = "custom_field_definitions")
public class CustomFieldDefinition {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "project_id", nullable = false, updatable = false)
  private Long projectId;

  @Column(name = "name", nullable = false, length = 100)
  private String name;

  @Enumerated(EnumType.STRING)
  @Column(name = "value_type", nullable = false, length = 20)
  private FieldValueType valueType;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected CustomFieldDefinition() {}

  public CustomFieldDefinition(Long projectId, String name, FieldValueType valueType) {
    this.projectId = projectId;
    this.name = name;
    this.valueType = valueType;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public Long getId() {
    return id;
  }

  public Long getProjectId() {
    return projectId;
  }

  public String getName() {
    return name;
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

  public void rename(String name) {
    this.name = name;
    this.updatedAt = Instant.now();
  }

  /** Callers must make sure no stored value still uses the old type. */
  public void changeType(FieldValueType valueType) {
    this.valueType = valueType;
    this.updatedAt = Instant.now();
  }
}
