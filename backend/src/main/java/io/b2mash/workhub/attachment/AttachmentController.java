package io.b2mash.workhub.attachment;

import io.b2mash.workhub.identity.RequestScopes;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
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
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping({"/api", "/mcp"})
public class AttachmentController {

  private final AttachmentService attachmentService;

  public AttachmentController(AttachmentService attachmentService) {
    this.attachmentService = attachmentService;
  }

  @GetMapping("/tasks/{taskId}/attachments")
  public ResponseEntity<List<AttachmentResponse>> listTaskAttachments(@PathVariable Long taskId) {
    var attachments = attachmentService.listForTask(taskId, RequestScopes.requirePrincipal());
    return ResponseEntity.ok(attachments.stream().map(AttachmentResponse::from).toList());
  }

  @PostMapping("/tasks/{taskId}/attachments")
  public ResponseEntity<AttachmentResponse> attachToTask(
      @PathVariable Long taskId, @Valid @RequestBody AttachmentRequest request) {
    var attachment =
        attachmentService.attachToTask(
            taskId,
            request.filename(),
            request.reference(),
            request.sizeBytes(),
            RequestScopes.requirePrincipal());
    return ResponseEntity.status(HttpStatus.CREATED).body(AttachmentResponse.from(attachment));
  }

  @GetMapping("/comments/{commentId}/attachments")
  public ResponseEntity<List<AttachmentResponse>> listCommentAttachments(
      @PathVariable Long commentId) {
    var attachments =
        attachmentService.listForComment(commentId, RequestScopes.requirePrincipal());
    return ResponseEntity.ok(attachments.stream().map(AttachmentResponse::from).toList());
  }

  @PostMapping("/comments/{commentId}/attachments")
  public ResponseEntity<AttachmentResponse> attachToComment(
      @PathVariable Long commentId, @Valid @RequestBody AttachmentRequest request) {
    var attachment =
        attachmentService.attachToComment(
            commentId,
            request.filename(),
            request.reference(),
            request.sizeBytes(),
            RequestScopes.requirePrincipal());
    return ResponseEntity.status(HttpStatus.CREATED).body(AttachmentResponse.from(attachment));
  }

  @DeleteMapping("/attachments/{id}")
  public ResponseEntity<Void> deleteAttachment(@PathVariable Long id) {
    attachmentService.deleteAttachment(id, RequestScopes.requirePrincipal());
    return ResponseEntity.noContent().build();
  }

  public record AttachmentRequest(
      @NotBlank(message = "filename is required")
          @Size(max = 500, message = "filename must be at most 500 characters")
          String filename,
      @NotBlank(message = "reference is required")
          @Size(max = 2000, message = "reference must be at most 2000 characters")
          String reference,
      @PositiveOrZero(message = "sizeBytes must not be negative") Long sizeBytes) {}

  public record AttachmentResponse(
      Long id,
      Long taskId,
      Long commentId,
      String filename,
      String reference,
      Long sizeBytes,
      Long uploaderId,
      Instant createdAt) {

    public static AttachmentResponse from(Attachment attachment) {
      return new AttachmentResponse(
          attachment.getId(),
          attachment.getTaskId(),
          attachment.getCommentId(),
          attachment.getFilename(),
          attachment.getReference(),
          attachment.getSizeBytes(),
          attachment.getUploaderId(),
          attachment.getCreatedAt());
    }
  }
}
