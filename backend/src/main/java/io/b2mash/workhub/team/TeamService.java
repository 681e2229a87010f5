package io.b2mash.workhub.team;

import io.b2mash.workhub.exception.ResourceNotFoundException;
import io.b2mash.workhub.exception.ValidationException;
import io.b2mash.workhub.identity.Principal;
import io.b2mash.workhub.workspace.WorkspaceAccess;
import io.b2mash.workhub.workspace.WorkspaceAccessService;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class TeamService {

  private static final Logger log = LoggerFactory.getLogger(TeamService.class);

  private final TeamRepository teamRepository;
  private final TeamMemberRepository teamMemberRepository;
  private final WorkspaceAccessService workspaceAccessService;

  public TeamService(
      TeamRepository teamRepository,
      TeamMemberRepository teamMemberRepository,
      WorkspaceAccessService workspaceAccessService) {
    this.teamRepository = teamRepository;
    this.teamMemberRepository = teamMemberRepository;
    this.workspaceAccessService = workspaceAccessService;
  }

  @Transactional
  public Team createTeam(Long workspaceId, String name, String description, Principal principal) {
    workspaceAccessService.requireMember(workspaceId, principal);
    var team = teamRepository.save(new Team(workspaceId, name, description));
    log.info("Created team {} in workspace {}", team.getId(), workspaceId);
    return team;
  }

  @Transactional(readOnly = true)
  public List<Team> listTeams(Long workspaceId, Principal principal) {
    workspaceAccessService.requireMember(workspaceId, principal);
    return teamRepository.findByWorkspaceIdOrderByIdAsc(workspaceId);
  }

  @Transactional(readOnly = true)
  public Team getTeam(Long teamId, Principal principal) {
    return requireTeam(teamId, principal);
  }

  /** Deleting a team detaches its projects; the projects themselves stay. */
  @Transactional
  public void deleteTeam(Long teamId, Principal principal) {
    var team = findTeam(teamId);
    workspaceAccessService.requireOwner(team.getWorkspaceId(), principal);
    teamRepository.delete(team);
    log.info("Deleted team {} from workspace {}", teamId, team.getWorkspaceId());
  }

  @Transactional(readOnly = true)
  public List<Long> listMemberIds(Long teamId) {
    return teamMemberRepository.findByTeamIdOrderByIdAsc(teamId).stream()
        .map(TeamMember::getAccountId)
        .toList();
  }

  /** Batch-loads member ids for several teams (one query instead of N). */
  @Transactional(readOnly = true)
  public Map<Long, List<Long>> listMemberIdsBatch(List<Long> teamIds) {
    if (teamIds.isEmpty()) {
      return Map.of();
    }
    return teamMemberRepository.findByTeamIdInOrderByIdAsc(teamIds).stream()
        .collect(
            Collectors.groupingBy(
                TeamMember::getTeamId,
                Collectors.mapping(TeamMember::getAccountId, Collectors.toList())));
  }

  /**
   * Adds a workspace member to the team. Accounts outside the workspace are rejected; adding a
   * current team member is a no-op.
   */
  @Transactional
  public Team addMember(Long teamId, Long accountId, Principal principal) {
    var team = requireTeam(teamId, principal);
    workspaceAccessService.requireAccountInWorkspace(team.getWorkspaceId(), accountId, "member");
    if (!teamMemberRepository.existsByTeamIdAndAccountId(teamId, accountId)) {
      teamMemberRepository.save(new TeamMember(teamId, accountId));
      log.info("Added account {} to team {}", accountId, teamId);
    }
    return team;
  }

  @Transactional
  public void removeMember(Long teamId, Long accountId, Principal principal) {
    requireTeam(teamId, principal);
    var member =
        teamMemberRepository
            .findByTeamIdAndAccountId(teamId, accountId)
            .orElseThrow(() -> new ResourceNotFoundException("TeamMember", accountId));
    teamMemberRepository.delete(member);
    log.info("Removed account {} from team {}", accountId, teamId);
  }

  /** A project may only reference a team of its own workspace. */
  @Transactional(readOnly = true)
  public void requireTeamInWorkspace(Long teamId, WorkspaceAccess access) {
    boolean sameWorkspace =
        teamRepository
            .findById(teamId)
            .map(team -> team.getWorkspaceId().equals(access.workspaceId()))
            .orElse(false);
    if (!sameWorkspace) {
      throw new ValidationException(
          "Invalid team",
          "Team " + teamId + " does not belong to workspace " + access.workspaceId());
    }
  }

  private Team requireTeam(Long teamId, Principal principal) {
    var team = findTeam(teamId);
    workspaceAccessService.requireMember(team.getWorkspaceId(), principal);
    return team;
  }

  private Team findTeam(Long teamId) {
    return teamRepository
        .findById(teamId)
        .orElseThrow(() -> new ResourceNotFoundException("Team", teamId));
  }
}
