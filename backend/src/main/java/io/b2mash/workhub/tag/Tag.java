package io.b2mash.workhub.tag;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

@Entity
@Table(name = "tags")
public class Tag {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "workspace_id", nullable = false, updatable = false)
  private Long workspaceId;

  @Column(name = "name", nullable = false, length = 100)
  private String name;

  @Column(name = "color", length = 7)
  private String color;

  @Column(name = "creator_id", nullable = false, updatable = false)
  private Long creatorId;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Tag() {}

  public Tag(Long workspaceId, String name, String color, Long creatorId) {
    this.workspaceId = workspaceId;
    this.name = name;
    this.color = color;
    this.creatorId = creatorId;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public void updateMetadata(String name, String color) {
    this.name = name;
    this.color = color;
    this.updatedAt = Instant.now();
  }

  public Long getId() {
    return id;
  }

  public Long getWorkspaceId() {
    return workspaceId;
  }

  public String getName() {
    return name;
  }

  public String getColor() {
    return color;
  }

  public Long getCreatorId() {
    return creatorId;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }
}
