package io.b2mash.workhub.tag;

import java.io.Serializable;
import java.util.Objects;

public class TaskTagId implements Serializable {

  private Long taskId;
  private Long tagId;

  protected TaskTagId() {}

  public TaskTagId(Long taskId, Long tagId) {
    this.taskId = taskId;
    this.tagId = tagId;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TaskTagId other)) {
      return false;
    }
    return Objects.equals(taskId, other.taskId) && Objects.equals(tagId, other.tagId);
  }

  @Override
  public int hashCode() {
    return Objects.hash(taskId, tagId);
  }
}
