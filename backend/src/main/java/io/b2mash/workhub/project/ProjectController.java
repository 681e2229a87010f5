package io.b2mash.workhub.project;

import io.b2mash.workhub.identity.RequestScopes;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping({"/api/projects", "/mcp/projects"})
public class ProjectController {

  private final ProjectService projectService;

  public ProjectController(ProjectService projectService) {
    this.projectService = projectService;
  }

  @GetMapping
  public ResponseEntity<List<ProjectResponse>> listProjects(@RequestParam Long workspaceId) {
    var projects = projectService.listProjects(workspaceId, RequestScopes.requirePrincipal());
    return ResponseEntity.ok(projects.stream().map(ProjectResponse::from).toList());
  }

  @GetMapping("/{id}")
  public ResponseEntity<ProjectResponse> getProject(@PathVariable Long id) {
    var project = projectService.getProject(id, RequestScopes.requirePrincipal());
    return ResponseEntity.ok(ProjectResponse.from(project));
  }

  @PostMapping
  public ResponseEntity<ProjectResponse> createProject(
      @Valid @RequestBody CreateProjectRequest request) {
    var project =
        projectService.createProject(
            request.workspaceId(),
            request.name(),
            request.description(),
            request.teamId(),
            Boolean.TRUE.equals(request.isPublic()),
            RequestScopes.requirePrincipal());
    return ResponseEntity.status(HttpStatus.CREATED).body(ProjectResponse.from(project));
  }

  @PatchMapping("/{id}")
  public ResponseEntity<ProjectResponse> updateProject(
      @PathVariable Long id, @Valid @RequestBody UpdateProjectRequest request) {
    var project =
        projectService.updateProject(
            id,
            request.name(),
            request.description(),
            request.teamId(),
            Boolean.TRUE.equals(request.clearTeam()),
            request.isPublic(),
            RequestScopes.requirePrincipal());
    return ResponseEntity.ok(ProjectResponse.from(project));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> deleteProject(@PathVariable Long id) {
    projectService.deleteProject(id, RequestScopes.requirePrincipal());
    return ResponseEntity.noContent().build();
  }

  public record CreateProjectRequest(
      @NotNull(message = "workspaceId is required") Long workspaceId,
      @NotBlank(message = "name is required")
          @Size(max = 255, message = "name must be at most 255 characters")
          String name,
      @Size(max = 2000, message = "description must be at most 2000 characters") String description,
      Long teamId,
      Boolean isPublic) {}

  public record UpdateProjectRequest(
      @Pattern(regexp = "(?s).*\\S.*", message = "name must not be blank")
          @Size(max = 255, message = "name must be at most 255 characters")
          String name,
      @Size(max = 2000, message = "description must be at most 2000 characters") String description,
      Long teamId,
      Boolean clearTeam,
      Boolean isPublic) {}

  public record ProjectResponse(
      Long id,
      Long workspaceId,
      Long teamId,
      String name,
      String description,
      Long ownerId,
      boolean isPublic,
      Instant createdAt,
      Instant updatedAt) {

    public static ProjectResponse from(Project project) {
      return new ProjectResponse(
          project.getId(),
          project.getWorkspaceId(),
          project.getTeamId(),
          project.getName(),
          project.getDescription(),
          project.getOwnerId(),
          project.isPublic(),
          project.getCreatedAt(),
          project.getUpdatedAt());
    }
  }
}
