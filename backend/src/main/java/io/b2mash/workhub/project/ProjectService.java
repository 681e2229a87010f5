package io.b2mash.workhub.project;

import io.b2mash.workhub.exception.ForbiddenException;
import io.b2mash.workhub.exception.ResourceNotFoundException;
import io.b2mash.workhub.identity.Principal;
import io.b2mash.workhub.team.TeamService;
import io.b2mash.workhub.workspace.WorkspaceAccessService;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class ProjectService {

  private static final Logger log = LoggerFactory.getLogger(ProjectService.class);

  private final ProjectRepository projectRepository;
  private final WorkspaceAccessService workspaceAccessService;
  private final TeamService teamService;

  public ProjectService(
      ProjectRepository projectRepository,
      WorkspaceAccessService workspaceAccessService,
      TeamService teamService) {
    this.projectRepository = projectRepository;
    this.workspaceAccessService = workspaceAccessService;
    this.teamService = teamService;
  }

  @Transactional
  public Project createProject(
      Long workspaceId,
      String name,
      String description,
      Long teamId,
      boolean isPublic,
      Principal principal) {
    var access = workspaceAccessService.requireMember(workspaceId, principal);
    if (teamId != null) {
      teamService.requireTeamInWorkspace(teamId, access);
    }
    var project =
        projectRepository.save(
            new Project(workspaceId, name, description, teamId, isPublic, principal.accountId()));
    log.info("Created project {} in workspace {}", project.getId(), workspaceId);
    return project;
  }

  @Transactional(readOnly = true)
  public List<Project> listProjects(Long workspaceId, Principal principal) {
    workspaceAccessService.requireMember(workspaceId, principal);
    return projectRepository.findByWorkspaceIdOrderByIdAsc(workspaceId);
  }

  @Transactional(readOnly = true)
  public Project getProject(Long projectId, Principal principal) {
    return requireAccess(projectId, principal).project();
  }

  /**
   * Partial update: {@code null} arguments leave the current value. {@code clearTeam} detaches the
   * project from its team.
   */
  @Transactional
  public Project updateProject(
      Long projectId,
      String name,
      String description,
      Long teamId,
      boolean clearTeam,
      Boolean isPublic,
      Principal principal) {
    var access = requireAccess(projectId, principal);
    var project = access.project();
    project.updateDetails(
        name != null ? name : project.getName(),
        description != null ? description : project.getDescription(),
        isPublic != null ? isPublic : project.isPublic());
    if (clearTeam) {
      project.assignTeam(null);
    } else if (teamId != null) {
      teamService.requireTeamInWorkspace(teamId, access.workspaceAccess());
      project.assignTeam(teamId);
    }
    log.info("Updated project {}", projectId);
    return project;
  }

  /**
   * Deletes the project together with its sections, tasks, field definitions and everything that
   * hangs off those tasks. Allowed for the project owner and the workspace owner.
   */
  @Transactional
  public void deleteProject(Long projectId, Principal principal) {
    var access = requireAccess(projectId, principal);
    var project = access.project();
    if (!principal.isAccount(project.getOwnerId()) && !access.workspaceAccess().owner()) {
      throw new ForbiddenException(
          "Cannot delete project",
          "Only the project owner or the workspace owner can delete project " + projectId);
    }
    projectRepository.delete(project);
    log.info("Deleted project {} from workspace {}", projectId, project.getWorkspaceId());
  }

  /**
   * Loads a project and checks that the caller belongs to its workspace. Missing projects are
   * {@link ResourceNotFoundException}, non-members get {@link ForbiddenException}.
   */
  @Transactional(readOnly = true)
  public ProjectAccess requireAccess(Long projectId, Principal principal) {
    var project =
        projectRepository
            .findById(projectId)
            .orElseThrow(() -> new ResourceNotFoundException("Project", projectId));
    var workspaceAccess =
        workspaceAccessService.requireMember(project.getWorkspaceId(), principal);
    return new ProjectAccess(project, workspaceAccess);
  }
}
