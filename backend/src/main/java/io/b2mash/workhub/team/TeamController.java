package io.b2mash.workhub.team;

import io.b2mash.workhub.identity.RequestScopes;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping({"/api/teams", "/mcp/teams"})
public class TeamController {

  private final TeamService teamService;

  public TeamController(TeamService teamService) {
    this.teamService = teamService;
  }

  @GetMapping
  public ResponseEntity<List<TeamResponse>> listTeams(@RequestParam Long workspaceId) {
    var teams = teamService.listTeams(workspaceId, RequestScopes.requirePrincipal());
    var membersByTeam = teamService.listMemberIdsBatch(teams.stream().map(Team::getId).toList());
    return ResponseEntity.ok(
        teams.stream()
            .map(t -> TeamResponse.from(t, membersByTeam.getOrDefault(t.getId(), List.of())))
            .toList());
  }

  @PostMapping
  public ResponseEntity<TeamResponse> createTeam(@Valid @RequestBody CreateTeamRequest request) {
    var team =
        teamService.createTeam(
            request.workspaceId(),
            request.name(),
            request.description(),
            RequestScopes.requirePrincipal());
    return ResponseEntity.status(HttpStatus.CREATED).body(TeamResponse.from(team, List.of()));
  }

  @GetMapping("/{id}")
  public ResponseEntity<TeamResponse> getTeam(@PathVariable Long id) {
    var team = teamService.getTeam(id, RequestScopes.requirePrincipal());
    return ResponseEntity.ok(TeamResponse.from(team, teamService.listMemberIds(id)));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> deleteTeam(@PathVariable Long id) {
    teamService.deleteTeam(id, RequestScopes.requirePrincipal());
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/{id}/members")
  public ResponseEntity<TeamResponse> addMember(
      @PathVariable Long id, @Valid @RequestBody AddTeamMemberRequest request) {
    var team = teamService.addMember(id, request.accountId(), RequestScopes.requirePrincipal());
    return ResponseEntity.ok(TeamResponse.from(team, teamService.listMemberIds(id)));
  }

  @DeleteMapping("/{id}/members/{accountId}")
  public ResponseEntity<Void> removeMember(@PathVariable Long id, @PathVariable Long accountId) {
    teamService.removeMember(id, accountId, RequestScopes.requirePrincipal());
    return ResponseEntity.noContent().build();
  }

  public record CreateTeamRequest(
      @NotNull(message = "workspaceId is required") Long workspaceId,
      @NotBlank(message = "name is required")
          @Size(max = 255, message = "name must be at most 255 characters")
          String name,
      @Size(max = 2000, message = "description must be at most 2000 characters")
          String description) {}

  public record AddTeamMemberRequest(@NotNull(message = "accountId is required") Long accountId) {}

  public record TeamResponse(
      Long id,
      Long workspaceId,
      String name,
      String description,
      List<Long> memberIds,
      Instant createdAt) {

    public static TeamResponse from(Team team, List<Long> memberIds) {
      return new TeamResponse(
          team.getId(),
          team.getWorkspaceId(),
          team.getName(),
          team.getDescription(),
          memberIds,
          team.getCreatedAt());
    }
  }
}
