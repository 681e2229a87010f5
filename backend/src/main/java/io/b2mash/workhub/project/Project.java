package io.b2mash.workhub.project;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

@Entity
@Table(name = "projects")
public class Project {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "workspace_id", nullable = false, updatable = false)
  private Long workspaceId;

  @Column(name = "team_id")
  private Long teamId;

  @Column(name = "name", nullable = false, length = 255)
  private String name;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @Column(name = "owner_id", nullable = false, updatable = false)
  private Long ownerId;

  @Column(name = "is_public", nullable = false)
  private boolean isPublic;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Project() {}

  public Project(
      Long workspaceId,
      String name,
      String description,
      Long teamId,
      boolean isPublic,
      Long ownerId) {
    this.workspaceId = workspaceId;
    this.name = name;
    this.description = description;
    this.teamId = teamId;
    this.isPublic = isPublic;
    this.ownerId = ownerId;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public Long getId() {
    return id;
  }

  public Long getWorkspaceId() {
    return workspaceId;
  }

  public Long getTeamId() {
    return teamId;
  }

  public String getName() {
    return name;
  }

  public String getDescription() {
    return description;
  }

  public Long getOwnerId() {
    return ownerId;
  }

  public boolean isPublic() {
    return isPublic;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public void updateDetails(String name, String description, boolean isPublic) {
    this.name = name;
    this.description = description;
    this.isPublic = isPublic;
    this.updatedAt = Instant.now();
  }

  public void assignTeam(Long teamId) {
    this.teamId = teamId;
    this.updatedAt = Instant.now();
  }
}
