package io.b2mash.workhub.tag;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.IdClass;
import jakarta.persistence.Table;
import java.time.Instant;

/** Link between a task and a tag. The pair is the key; there is no other payload. */
@Entity
@Table(name = "task_tags")
@IdClass(TaskTagId.class)
public class TaskTag {

  @Id
  @Column(name = "task_id", nullable = false, updatable = false)
  private Long taskId;

  @Id
  @Column(name = "tag_id", nullable = false, updatable = false)
  private Long tagId;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected TaskTag() {}

  public TaskTag(Long taskId, Long tagId) {
    this.taskId = taskId;
    this.tagId = tagId;
    this.createdAt = Instant.now();
  }

  public Long getTaskId() {
    return taskId;
  }

  public Long getTagId() {
    return tagId;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
