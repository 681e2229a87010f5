package io.b2mash.workhub.task;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;
import java.time.LocalDate;

@Entity
@Table(name = "tasks")
public class Task {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "project_id", nullable = false, updatable = false)
  private Long projectId;

  @Column(name = "section_id")
  private Long sectionId;

  @Column(name = "parent_task_id")
  private Long parentTaskId;

  @Column(name = "name", nullable = false, length = 500)
  private String name;

  @Column(name = "description", columnDefinition = "TEXT")
  private String description;

  @Column(name = "assignee_id")
  private Long assigneeId;

  @Column(name = "creator_id", nullable = false, updatable = false)
  private Long creatorId;

  @Column(name = "due_date")
  private LocalDate dueDate;

  @Column(name = "completed_at")
  private Instant completedAt;

  @Column(name = "position", nullable = false)
  private int position;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at", nullable = false)
  private Instant updatedAt;

  protected Task() {}

  public Task(
      Long projectId,
      Long sectionId,
      Long parentTaskId,
      String name,
      String description,
      Long assigneeId,
      LocalDate dueDate,
      int position,
      Long creatorId) {
    this.projectId = projectId;
    this.sectionId = sectionId;
    this.parentTaskId = parentTaskId;
    this.name = name;
    this.description = description;
    this.assigneeId = assigneeId;
    this.dueDate = dueDate;
    this.position = position;
    this.creatorId = creatorId;
    this.createdAt = Instant.now();
    this.updatedAt = Instant.now();
  }

  public Long getId() {
    return id;
  }

  public Long getProjectId() {
    return projectId;
  }

  public Long getSectionId() {
    return sectionId;
  }

  public Long getParentTaskId() {
    return parentTaskId;
  }

  public String getName() {
    return name;
  }

  public String getDescription() {
    return description;
  }

  public Long getAssigneeId() {
    return assigneeId;
  }

  public Long getCreatorId() {
    return creatorId;
  }

  public LocalDate getDueDate() {
    return dueDate;
  }

  public Instant getCompletedAt() {
    return completedAt;
  }

  public boolean isCompleted() {
    return completedAt != null;
  }

  public int getPosition() {
    return position;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getUpdatedAt() {
    return updatedAt;
  }

  public void updateDetails(String name, String description, LocalDate dueDate, int position) {
    this.name = name;
    this.description = description;
    this.dueDate = dueDate;
    this.position = position;
    this.updatedAt = Instant.now();
  }

  public void moveToSection(Long sectionId) {
    this.sectionId = sectionId;
    this.updatedAt = Instant.now();
  }

  public void reparent(Long parentTaskId) {
    this.parentTaskId = parentTaskId;
    this.updatedAt = Instant.now();
  }

  public void assign(Long assigneeId) {
    this.assigneeId = assigneeId;
    this.updatedAt = Instant.now();
  }

  /** Stamps the completion instant. A task that is already complete keeps its original stamp. */
  public void complete() {
    if (this.completedAt == null) {
      this.completedAt = Instant.now();
      this.updatedAt = this.completedAt;
    }
  }

  public void reopen() {
    this.completedAt = null;
    this.updatedAt = Instant.now();
  }
}
