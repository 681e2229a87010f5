package io.b2mash.workhub.section;

import io.b2mash.workhub.identity.RequestScopes;
import io.b2mash.workhub.task.TaskController.TaskResponse;
import io.b2mash.workhub.task.TaskService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
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
@RequestMapping({"/api/sections", "/mcp/sections"})
public class SectionController {

  private final SectionService sectionService;
  private final TaskService taskService;

  public SectionController(SectionService sectionService, TaskService taskService) {
    this.sectionService = sectionService;
    this.taskService = taskService;
  }

  @GetMapping
  public ResponseEntity<List<SectionResponse>> listSections(@RequestParam Long projectId) {
    var sections = sectionService.listSections(projectId, RequestScopes.requirePrincipal());
    return ResponseEntity.ok(sections.stream().map(SectionResponse::from).toList());
  }

  @PostMapping
  public ResponseEntity<SectionResponse> createSection(
      @Valid @RequestBody CreateSectionRequest request) {
    var section =
        sectionService.createSection(
            request.projectId(),
            request.name(),
            request.position(),
            RequestScopes.requirePrincipal());
    return ResponseEntity.status(HttpStatus.CREATED).body(SectionResponse.from(section));
  }

  @PatchMapping("/{id}")
  public ResponseEntity<SectionResponse> updateSection(
      @PathVariable Long id, @Valid @RequestBody UpdateSectionRequest request) {
    var section =
        sectionService.updateSection(
            id, request.name(), request.position(), RequestScopes.requirePrincipal());
    return ResponseEntity.ok(SectionResponse.from(section));
  }

  @GetMapping("/{id}/tasks")
  public ResponseEntity<List<TaskResponse>> listSectionTasks(@PathVariable Long id) {
    var tasks = taskService.listSectionTasks(id, RequestScopes.requirePrincipal());
    return ResponseEntity.ok(tasks.stream().map(TaskResponse::from).toList());
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> deleteSection(@PathVariable Long id) {
    sectionService.deleteSection(id, RequestScopes.requirePrincipal());
    return ResponseEntity.noContent().build();
  }

  public record CreateSectionRequest(
      @NotNull(message = "projectId is required") Long projectId,
      @NotBlank(message = "name is required")
          @Size(max = 255, message = "name must be at most 255 characters")
          String name,
      @Min(value = 0, message = "position must be non-negative") Integer position) {}

  public record UpdateSectionRequest(
      @Pattern(regexp = "(?s).*\\S.*", message = "name must not be blank")
          @Size(max = 255, message = "name must be at most 255 characters")
          String name,
      @Min(value = 0, message = "position must be non-negative") Integer position) {}

  public record SectionResponse(
      Long id, Long projectId, String name, int position, Instant createdAt) {

    public static SectionResponse from(Section section) {
      return new SectionResponse(
          section.getId(),
          section.getProjectId(),
          section.getName(),
          section.getPosition(),
          section.getCreatedAt());
    }
  }
}
