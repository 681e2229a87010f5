package io.b2mash.workhub.project;

import io.b2mash.workhub.workspace.WorkspaceAccess;

/** A project the caller may work in, together with the membership that grants it. */
public record ProjectAccess(Project project, WorkspaceAccess workspaceAccess) {

  public Long projectId() {
    return project.getId();
  }

  public Long workspaceId() {
    return project.getWorkspaceId();
  }
}
