package io.b2mash.workhub.workspace;

import io.b2mash.workhub.account.AccountRepository;
import io.b2mash.workhub.exception.ForbiddenException;
import io.b2mash.workhub.exception.ResourceNotFoundException;
import io.b2mash.workhub.exception.ValidationException;
import io.b2mash.workhub.identity.Principal;
import io.b2mash.workhub.team.TeamMemberRepository;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class WorkspaceService {

  private static final Logger log = LoggerFactory.getLogger(WorkspaceService.class);

  private final WorkspaceRepository workspaceRepository;
  private final WorkspaceMemberRepository workspaceMemberRepository;
  private final WorkspaceAccessService workspaceAccessService;
  private final AccountRepository accountRepository;
  private final TeamMemberRepository teamMemberRepository;

  public WorkspaceService(
      WorkspaceRepository workspaceRepository,
      WorkspaceMemberRepository workspaceMemberRepository,
      WorkspaceAccessService workspaceAccessService,
      AccountRepository accountRepository,
      TeamMemberRepository teamMemberRepository) {
    this.workspaceRepository = workspaceRepository;
    this.workspaceMemberRepository = workspaceMemberRepository;
    this.workspaceAccessService = workspaceAccessService;
    this.accountRepository = accountRepository;
    this.teamMemberRepository = teamMemberRepository;
  }

  /** Creates a workspace owned by the caller and enrols the caller as its first member. */
  @Transactional
  public Workspace createWorkspace(String name, Principal principal) {
    var workspace = workspaceRepository.save(new Workspace(name, principal.accountId()));
    workspaceMemberRepository.save(new WorkspaceMember(workspace.getId(), principal.accountId()));
    log.info("Created workspace {} owned by account {}", workspace.getId(), principal.accountId());
    return workspace;
  }

  @Transactional(readOnly = true)
  public List<Workspace> listWorkspaces(Principal principal) {
    return workspaceRepository.findAllForMember(principal.accountId());
  }

  /** Unscoped listing, reserved for administrators. */
  @Transactional(readOnly = true)
  public List<Workspace> listAllWorkspaces(Principal principal) {
    if (!principal.administrator()) {
      throw new ForbiddenException(
          "Administrator required", "Listing all workspaces requires administrator capability");
    }
    return workspaceRepository.findAllByOrderByIdAsc();
  }

  @Transactional(readOnly = true)
  public Workspace getWorkspace(Long workspaceId, Principal principal) {
    return workspaceAccessService.requireMember(workspaceId, principal).workspace();
  }

  @Transactional
  public Workspace updateWorkspace(Long workspaceId, String name, Principal principal) {
    var workspace = workspaceAccessService.requireOwner(workspaceId, principal).workspace();
    if (name != null) {
      workspace.rename(name);
    }
    log.info("Updated workspace {}", workspaceId);
    return workspace;
  }

  /** Deletes the workspace; teams, projects, tags and everything below them go with it. */
  @Transactional
  public void deleteWorkspace(Long workspaceId, Principal principal) {
    var workspace = workspaceAccessService.requireOwner(workspaceId, principal).workspace();
    workspaceRepository.delete(workspace);
    log.info("Deleted workspace {} and its contents", workspaceId);
  }

  @Transactional(readOnly = true)
  public List<WorkspaceMember> listMembers(Long workspaceId, Principal principal) {
    workspaceAccessService.requireMember(workspaceId, principal);
    return workspaceMemberRepository.findByWorkspaceIdOrderByIdAsc(workspaceId);
  }

  /** Enrols an existing account. Adding a current member returns the existing membership. */
  @Transactional
  public WorkspaceMember addMember(Long workspaceId, Long accountId, Principal principal) {
    workspaceAccessService.requireOwner(workspaceId, principal);
    if (!accountRepository.existsById(accountId)) {
      throw new ResourceNotFoundException("Account", accountId);
    }
    var existing = workspaceMemberRepository.findByWorkspaceIdAndAccountId(workspaceId, accountId);
    if (existing.isPresent()) {
      return existing.get();
    }
    var member = workspaceMemberRepository.save(new WorkspaceMember(workspaceId, accountId));
    log.info("Added account {} to workspace {}", accountId, workspaceId);
    return member;
  }

  /** Removes a member and their team memberships inside this workspace. The owner stays. */
  @Transactional
  public void removeMember(Long workspaceId, Long accountId, Principal principal) {
    var access = workspaceAccessService.requireOwner(workspaceId, principal);
    if (accountId.equals(access.workspace().getOwnerId())) {
      throw new ValidationException(
          "Cannot remove owner", "The owner of workspace " + workspaceId + " cannot be removed");
    }
    var member =
        workspaceMemberRepository
            .findByWorkspaceIdAndAccountId(workspaceId, accountId)
            .orElseThrow(() -> new ResourceNotFoundException("WorkspaceMember", accountId));
    teamMemberRepository.deleteMembershipsInWorkspace(workspaceId, accountId);
    workspaceMemberRepository.delete(member);
    log.info("Removed account {} from workspace {}", accountId, workspaceId);
  }
}
