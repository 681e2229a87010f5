package io.b2mash.workhub.workspace;

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
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping({"/api/workspaces", "/mcp/workspaces"})
public class WorkspaceController {

  private final WorkspaceService workspaceService;

  public WorkspaceController(WorkspaceService workspaceService) {
    this.workspaceService = workspaceService;
  }

  @GetMapping
  public ResponseEntity<List<WorkspaceResponse>> listWorkspaces() {
    var workspaces = workspaceService.listWorkspaces(RequestScopes.requirePrincipal());
    return ResponseEntity.ok(workspaces.stream().map(WorkspaceResponse::from).toList());
  }

  @GetMapping("/all")
  public ResponseEntity<List<WorkspaceResponse>> listAllWorkspaces() {
    var workspaces = workspaceService.listAllWorkspaces(RequestScopes.requirePrincipal());
    return ResponseEntity.ok(workspaces.stream().map(WorkspaceResponse::from).toList());
  }

  @PostMapping
  public ResponseEntity<WorkspaceResponse> createWorkspace(
      @Valid @RequestBody CreateWorkspaceRequest request) {
    var workspace =
        workspaceService.createWorkspace(request.name(), RequestScopes.requirePrincipal());
    return ResponseEntity.status(HttpStatus.CREATED).body(WorkspaceResponse.from(workspace));
  }

  @GetMapping("/{id}")
  public ResponseEntity<WorkspaceResponse> getWorkspace(@PathVariable Long id) {
    var workspace = workspaceService.getWorkspace(id, RequestScopes.requirePrincipal());
    return ResponseEntity.ok(WorkspaceResponse.from(workspace));
  }

  @PatchMapping("/{id}")
  public ResponseEntity<WorkspaceResponse> updateWorkspace(
      @PathVariable Long id, @Valid @RequestBody UpdateWorkspaceRequest request) {
    var workspace =
        workspaceService.updateWorkspace(id, request.name(), RequestScopes.requirePrincipal());
    return ResponseEntity.ok(WorkspaceResponse.from(workspace));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> deleteWorkspace(@PathVariable Long id) {
    workspaceService.deleteWorkspace(id, RequestScopes.requirePrincipal());
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/{id}/members")
  public ResponseEntity<List<MemberResponse>> listMembers(@PathVariable Long id) {
    var members = workspaceService.listMembers(id, RequestScopes.requirePrincipal());
    return ResponseEntity.ok(members.stream().map(MemberResponse::from).toList());
  }

  @PostMapping("/{id}/members")
  public ResponseEntity<MemberResponse> addMember(
      @PathVariable Long id, @Valid @RequestBody AddMemberRequest request) {
    var member =
        workspaceService.addMember(id, request.accountId(), RequestScopes.requirePrincipal());
    return ResponseEntity.status(HttpStatus.CREATED).body(MemberResponse.from(member));
  }

  @DeleteMapping("/{id}/members/{accountId}")
  public ResponseEntity<Void> removeMember(@PathVariable Long id, @PathVariable Long accountId) {
    workspaceService.removeMember(id, accountId, RequestScopes.requirePrincipal());
    return ResponseEntity.noContent().build();
  }

  public record CreateWorkspaceRequest(
      @NotBlank(message = "name is required")
          @Size(max = 255, message = "name must be at most 255 characters")
          String name) {}

  public record UpdateWorkspaceRequest(
      @Pattern(regexp = "(?s).*\\S.*", message = "name must not be blank")
          @Size(max = 255, message = "name must be at most 255 characters")
          String name) {}

  public record AddMemberRequest(@NotNull(message = "accountId is required") Long accountId) {}

  public record WorkspaceResponse(
      Long id, String name, Long ownerId, Instant createdAt, Instant updatedAt) {

    public static WorkspaceResponse from(Workspace workspace) {
      return new WorkspaceResponse(
          workspace.getId(),
          workspace.getName(),
          workspace.getOwnerId(),
          workspace.getCreatedAt(),
          workspace.getUpdatedAt());
    }
  }

  public record MemberResponse(Long workspaceId, Long accountId, Instant joinedAt) {

    public static MemberResponse from(WorkspaceMember member) {
      return new MemberResponse(
          member.getWorkspaceId(), member.getAccountId(), member.getJoinedAt());
    }
  }
}
