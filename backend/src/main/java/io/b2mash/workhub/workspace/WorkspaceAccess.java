package io.b2mash.workhub.workspace;

/** Outcome of a successful membership check: the workspace and whether the caller owns it. */
public record WorkspaceAccess(Workspace workspace, boolean owner) {

  public Long workspaceId() {
    return workspace.getId();
  }
}
