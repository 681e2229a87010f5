package io.b2mash.workhub.task;

import io.b2mash.workhub.identity.RequestScopes;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import java.time.Instant;
import java.time.LocalDate;
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
@RequestMapping({"/api/tasks", "/mcp/tasks"})
public class TaskController {

  private final TaskService taskService;
  private final TaskQueryService taskQueryService;

  public TaskController(TaskService taskService, TaskQueryService taskQueryService) {
    this.taskService = taskService;
    this.taskQueryService = taskQueryService;
  }

  @GetMapping
  public ResponseEntity<TaskPageResponse> queryTasks(
      @RequestParam(required = false) Long workspaceId,
      @RequestParam(required = false) Long projectId,
      @RequestParam(required = false) String assignee,
      @RequestParam(required = false) Boolean completed,
      @RequestParam(required = false) Instant completedSince,
      @RequestParam(required = false) Integer limit,
      @RequestParam(required = false) Integer offset) {
    var query =
        new TaskQuery(workspaceId, projectId, assignee, completed, completedSince, limit, offset);
    var page = taskQueryService.query(query, RequestScopes.requirePrincipal());
    return ResponseEntity.ok(TaskPageResponse.from(page));
  }

  @PostMapping
  public ResponseEntity<TaskResponse> createTask(@Valid @RequestBody CreateTaskRequest request) {
    var task =
        taskService.createTask(
            request.projectId(),
            request.name(),
            request.description(),
            request.sectionId(),
            request.parentTaskId(),
            request.assigneeId(),
            request.dueDate(),
            request.position(),
            RequestScopes.requirePrincipal());
    return ResponseEntity.status(HttpStatus.CREATED).body(TaskResponse.from(task));
  }

  @GetMapping("/{id}")
  public ResponseEntity<TaskResponse> getTask(@PathVariable Long id) {
    var task = taskService.getTask(id, RequestScopes.requirePrincipal());
    return ResponseEntity.ok(TaskResponse.from(task));
  }

  @GetMapping("/{id}/subtasks")
  public ResponseEntity<List<TaskResponse>> listSubtasks(@PathVariable Long id) {
    var subtasks = taskService.listSubtasks(id, RequestScopes.requirePrincipal());
    return ResponseEntity.ok(subtasks.stream().map(TaskResponse::from).toList());
  }

  @PatchMapping("/{id}")
  public ResponseEntity<TaskResponse> updateTask(
      @PathVariable Long id, @Valid @RequestBody UpdateTaskRequest request) {
    var task = taskService.updateTask(id, request.toChanges(), RequestScopes.requirePrincipal());
    return ResponseEntity.ok(TaskResponse.from(task));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> deleteTask(@PathVariable Long id) {
    taskService.deleteTask(id, RequestScopes.requirePrincipal());
    return ResponseEntity.noContent().build();
  }

  public record CreateTaskRequest(
      @NotNull(message = "projectId is required") Long projectId,
      @NotBlank(message = "name is required")
          @Size(max = 500, message = "name must be at most 500 characters")
          String name,
      @Size(max = 10000, message = "description must be at most 10000 characters")
          String description,
      Long sectionId,
      Long parentTaskId,
      Long assigneeId,
      LocalDate dueDate,
      @Min(value = 0, message = "position must be non-negative") Integer position) {}

  public record UpdateTaskRequest(
      @Pattern(regexp = "(?s).*\\S.*", message = "name must not be blank")
          @Size(max = 500, message = "name must be at most 500 characters")
          String name,
      @Size(max = 10000, message = "description must be at most 10000 characters")
          String description,
      Long projectId,
      Long sectionId,
      Boolean clearSection,
      Long parentTaskId,
      Boolean clearParent,
      Long assigneeId,
      Boolean clearAssignee,
      LocalDate dueDate,
      Boolean clearDueDate,
      Boolean completed,
      @Min(value = 0, message = "position must be non-negative") Integer position) {

    TaskChanges toChanges() {
      return new TaskChanges(
          name,
          description,
          projectId,
          sectionId,
          Boolean.TRUE.equals(clearSection),
          parentTaskId,
          Boolean.TRUE.equals(clearParent),
          assigneeId,
          Boolean.TRUE.equals(clearAssignee),
          dueDate,
          Boolean.TRUE.equals(clearDueDate),
          completed,
          position);
    }
  }

  public record TaskResponse(
      Long id,
      Long projectId,
      Long sectionId,
      Long parentTaskId,
      String name,
      String description,
      Long assigneeId,
      Long creatorId,
      LocalDate dueDate,
      boolean completed,
      Instant completedAt,
      int position,
      Instant createdAt,
      Instant updatedAt) {

    public static TaskResponse from(Task task) {
      return new TaskResponse(
          task.getId(),
          task.getProjectId(),
          task.getSectionId(),
          task.getParentTaskId(),
          task.getName(),
          task.getDescription(),
          task.getAssigneeId(),
          task.getCreatorId(),
          task.getDueDate(),
          task.isCompleted(),
          task.getCompletedAt(),
          task.getPosition(),
          task.getCreatedAt(),
          task.getUpdatedAt());
    }
  }

  public record TaskPageResponse(List<TaskResponse> items, long total, int limit, int offset) {

    public static TaskPageResponse from(TaskPage page) {
      return new TaskPageResponse(
          page.items().stream().map(TaskResponse::from).toList(),
          page.total(),
          page.limit(),
          page.offset());
    }
  }
}
