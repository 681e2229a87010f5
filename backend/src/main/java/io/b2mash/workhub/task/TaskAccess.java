package io.b2mash.workhub.task;

import io.b2mash.workhub.project.ProjectAccess;

/** A task the caller may work on, with the project access that grants it. */
public record TaskAccess(Task task, ProjectAccess projectAccess) {

  public Long taskId() {
    return task.getId();
  }

  public Long projectId() {
    return task.getProjectId();
  }

  public Long workspaceId() {
    return projectAccess.workspaceId();
  }
}
