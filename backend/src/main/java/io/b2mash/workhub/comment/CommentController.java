package io.b2mash.workhub.comment;

import io.b2mash.workhub.identity.RequestScopes;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
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
@RequestMapping({"/api", "/mcp"})
public class CommentController {

  private final CommentService commentService;

  public CommentController(CommentService commentService) {
    this.commentService = commentService;
  }

  @GetMapping("/tasks/{taskId}/comments")
  public ResponseEntity<List<CommentResponse>> listComments(@PathVariable Long taskId) {
    var comments = commentService.listComments(taskId, RequestScopes.requirePrincipal());
    return ResponseEntity.ok(comments.stream().map(CommentResponse::from).toList());
  }

  @PostMapping("/tasks/{taskId}/comments")
  public ResponseEntity<CommentResponse> createComment(
      @PathVariable Long taskId, @Valid @RequestBody CommentRequest request) {
    var comment =
        commentService.createComment(taskId, request.text(), RequestScopes.requirePrincipal());
    return ResponseEntity.status(HttpStatus.CREATED).body(CommentResponse.from(comment));
  }

  @PatchMapping("/comments/{id}")
  public ResponseEntity<CommentResponse> updateComment(
      @PathVariable Long id, @Valid @RequestBody CommentRequest request) {
    var comment =
        commentService.updateComment(id, request.text(), RequestScopes.requirePrincipal());
    return ResponseEntity.ok(CommentResponse.from(comment));
  }

  @DeleteMapping("/comments/{id}")
  public ResponseEntity<Void> deleteComment(@PathVariable Long id) {
    commentService.deleteComment(id, RequestScopes.requirePrincipal());
    return ResponseEntity.noContent().build();
  }

  public record CommentRequest(
      @NotBlank(message = "text is required")
          @Size(max = 10000, message = "text must be at most 10000 characters")
          String text) {}

  public record CommentResponse(
      Long id, Long taskId, Long authorId, String text, Instant createdAt, Instant updatedAt) {

    public static CommentResponse from(Comment comment) {
      return new CommentResponse(
          comment.getId(),
          comment.getTaskId(),
          comment.getAuthorId(),
          comment.getText(),
          comment.getCreatedAt(),
          comment.getUpdatedAt());
    }
  }
}
