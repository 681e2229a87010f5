package io.b2mash.workhub.attachment;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

/**
 * A file reference on exactly one target: a task or a comment, never both. The bytes live in
 * external storage; {@code reference} is the opaque locator.
 */
@Entity
@Table(name = "attachments")
public class Attachment {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "task_id", updatable = false)
  private Long taskId;

  @Column(name = "comment_id", updatable = false)
  private Long commentId;

  @Column(name = "filename", nullable = false, length = 500)
  private String filename;

  @Column(name = "reference", nullable = false, length = 2000)
  private String reference;

  @Column(name = "size_bytes")
  private Long sizeBytes;

  @Column(name = "uploader_id", nullable = false, updatable = false)
  private Long uploaderId;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected Attachment() {}

  private Attachment(
      Long taskId,
      Long commentId,
      String filename,
      String reference,
      Long sizeBytes,
      Long uploaderId) {
    this.taskId = taskId;
    this.commentId = commentId;
    this.filename = filename;
    this.reference = reference;
    this.sizeBytes = sizeBytes;
    this.uploaderId = uploaderId;
    this.createdAt = Instant.now();
  }

  public static Attachment onTask(
      Long taskId, String filename, String reference, Long sizeBytes, Long uploaderId) {
    return new Attachment(taskId, null, filename, reference, sizeBytes, uploaderId);
  }

  public static Attachment onComment(
      Long commentId, String filename, String reference, Long sizeBytes, Long uploaderId) {
    return new Attachment(null, commentId, filename, reference, sizeBytes, uploaderId);
  }

  public Long getId() {
    return id;
  }

  public Long getTaskId() {
    return taskId;
  }

  public Long getCommentId() {
    return commentId;
  }

  public String getFilename() {
    return filename;
  }

  public String getReference() {
    return reference;
  }

  public Long getSizeBytes() {
    return sizeBytes;
  }

  public Long getUploaderId() {
    return uploaderId;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
