package io.b2mash.workhub.fielddefinition;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

/** One choice of a single-select field. */
@Entity
@Table(name = "custom_field_options")
public class CustomFieldOption {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "field_id", nullable = false, updatable = false)
  private Long fieldId;

  @Column(name = "name", nullable = false, length = 100)
  private String name;

  @Column(name = "color", length = 7)
  private String color;

  @Column(name = "position", nullable = false)
  private int position;

  protected CustomFieldOption() {}

  public CustomFieldOption(Long fieldId, String name, String color, int position) {
    this.fieldId = fieldId;
    this.name = name;
    this.color = color;
    this.position = position;
  }

  public Long getId() {
    return id;
  }

  public Long getFieldId() {
    return fieldId;
  }

  public String getName() {
    return name;
  }

  public String getColor() {
    return color;
  }

  public int getPosition() {
    return position;
  }

  public void update(String name, String color, int position) {
    this.name = name;
    this.color = color;
    this.position = position;
  }
}
