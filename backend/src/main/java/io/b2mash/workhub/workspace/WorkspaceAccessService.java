package io.b2mash.workhub.workspace;

import io.b2mash.workhub.exception.ForbiddenException;
import io.b2mash.workhub.exception.ResourceNotFoundException;
import io.b2mash.workhub.exception.ValidationException;
import io.b2mash.workhub.identity.Principal;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Membership checks shared by every service below the workspace level. A missing workspace is
 * {@link ResourceNotFoundException}; an existing workspace the caller does not belong to is {@link
 * ForbiddenException}.
 */
@Service
public class WorkspaceAccessService {

  private final WorkspaceRepository workspaceRepository;
  private final WorkspaceMemberRepository workspaceMemberRepository;

  public WorkspaceAccessService(
      WorkspaceRepository workspaceRepository,
      WorkspaceMemberRepository workspaceMemberRepository) {
    this.workspaceRepository = workspaceRepository;
    this.workspaceMemberRepository = workspaceMemberRepository;
  }

  @Transactional(readOnly = true)
  public WorkspaceAccess requireMember(Long workspaceId, Principal principal) {
    var workspace =
        workspaceRepository
            .findById(workspaceId)
            .orElseThrow(() -> new ResourceNotFoundException("Workspace", workspaceId));
    if (!workspaceMemberRepository.existsByWorkspaceIdAndAccountId(
        workspaceId, principal.accountId())) {
      throw new ForbiddenException(
          "Not a workspace member", "You are not a member of workspace " + workspaceId);
    }
    return new WorkspaceAccess(workspace, principal.isAccount(workspace.getOwnerId()));
  }

  @Transactional(readOnly = true)
  public WorkspaceAccess requireOwner(Long workspaceId, Principal principal) {
    var access = requireMember(workspaceId, principal);
    if (!access.owner()) {
      throw new ForbiddenException(
          "Not the workspace owner",
          "Only the owner of workspace " + workspaceId + " can perform this operation");
    }
    return access;
  }

  /** Rejects an account reference (assignee, team member) that is not part of the workspace. */
  @Transactional(readOnly = true)
  public void requireAccountInWorkspace(Long workspaceId, Long accountId, String role) {
    if (!workspaceMemberRepository.existsByWorkspaceIdAndAccountId(workspaceId, accountId)) {
      throw new ValidationException(
          "Invalid " + role,
          "Account " + accountId + " is not a member of workspace " + workspaceId);
    }
  }
}
