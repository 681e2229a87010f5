package io.b2mash.workhub.tag;

import io.b2mash.workhub.identity.RequestScopes;
import io.b2mash.workhub.tag.dto.CreateTagRequest;
import io.b2mash.workhub.tag.dto.TagResponse;
import io.b2mash.workhub.tag.dto.UpdateTagRequest;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping({"/api", "/mcp"})
public class TagController {

  private final TagService tagService;
  private final TaskTagService taskTagService;

  public TagController(TagService tagService, TaskTagService taskTagService) {
    this.tagService = tagService;
    this.taskTagService = taskTagService;
  }

  @GetMapping("/tags")
  public ResponseEntity<List<TagResponse>> list(@RequestParam Long workspaceId) {
    return ResponseEntity.ok(tagService.listTags(workspaceId, RequestScopes.requirePrincipal()));
  }

  @PostMapping("/tags")
  public ResponseEntity<TagResponse> create(@Valid @RequestBody CreateTagRequest request) {
    var response = tagService.create(request, RequestScopes.requirePrincipal());
    return ResponseEntity.status(HttpStatus.CREATED).body(response);
  }

  @PatchMapping("/tags/{id}")
  public ResponseEntity<TagResponse> update(
      @PathVariable Long id, @Valid @RequestBody UpdateTagRequest request) {
    return ResponseEntity.ok(tagService.update(id, request, RequestScopes.requirePrincipal()));
  }

  @DeleteMapping("/tags/{id}")
  public ResponseEntity<Void> delete(@PathVariable Long id) {
    tagService.delete(id, RequestScopes.requirePrincipal());
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/tasks/{taskId}/tags")
  public ResponseEntity<List<TagResponse>> listTaskTags(@PathVariable Long taskId) {
    return ResponseEntity.ok(
        taskTagService.listForTask(taskId, RequestScopes.requirePrincipal()));
  }

  @PutMapping("/tasks/{taskId}/tags/{tagId}")
  public ResponseEntity<List<TagResponse>> attach(
      @PathVariable Long taskId, @PathVariable Long tagId) {
    return ResponseEntity.ok(
        taskTagService.attach(taskId, tagId, RequestScopes.requirePrincipal()));
  }

  @DeleteMapping("/tasks/{taskId}/tags/{tagId}")
  public ResponseEntity<List<TagResponse>> detach(
      @PathVariable Long taskId, @PathVariable Long tagId) {
    return ResponseEntity.ok(
        taskTagService.detach(taskId, tagId, RequestScopes.requirePrincipal()));
  }
}
