package io.b2mash.workhub.attachment;

import io.b2mash.workhub.comment.CommentService;
import io.b2mash.workhub.exception.ForbiddenException;
import io.b2mash.workhub.exception.ResourceNotFoundException;
import io.b2mash.workhub.identity.Principal;
import io.b2mash.workhub.task.TaskService;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class AttachmentService {

  private static final Logger log = LoggerFactory.getLogger(AttachmentService.class);

  private final AttachmentRepository attachmentRepository;
  private final TaskService taskService;
  private final CommentService commentService;

  public AttachmentService(
      AttachmentRepository attachmentRepository,
      TaskService taskService,
      CommentService commentService) {
    this.attachmentRepository = attachmentRepository;
    this.taskService = taskService;
    this.commentService = commentService;
  }

  @Transactional
  public Attachment attachToTask(
      Long taskId, String filename, String reference, Long sizeBytes, Principal principal) {
    taskService.requireTask(taskId, principal);
    var attachment =
        attachmentRepository.save(
            Attachment.onTask(taskId, filename, reference, sizeBytes, principal.accountId()));
    log.info("Created attachment {} on task {}", attachment.getId(), taskId);
    return attachment;
  }

  @Transactional
  public Attachment attachToComment(
      Long commentId, String filename, String reference, Long sizeBytes, Principal principal) {
    commentService.requireComment(commentId, principal);
    var attachment =
        attachmentRepository.save(
            Attachment.onComment(commentId, filename, reference, sizeBytes, principal.accountId()));
    log.info("Created attachment {} on comment {}", attachment.getId(), commentId);
    return attachment;
  }

  @Transactional(readOnly = true)
  public List<Attachment> listForTask(Long taskId, Principal principal) {
    taskService.requireTask(taskId, principal);
    return attachmentRepository.findByTaskIdOrderByIdAsc(taskId);
  }

  @Transactional(readOnly = true)
  public List<Attachment> listForComment(Long commentId, Principal principal) {
    commentService.requireComment(commentId, principal);
    return attachmentRepository.findByCommentIdOrderByIdAsc(commentId);
  }

  /** Only the uploader may delete. Removes the reference only; stored bytes are not touched. */
  @Transactional
  public void deleteAttachment(Long attachmentId, Principal principal) {
    var attachment =
        attachmentRepository
            .findById(attachmentId)
            .orElseThrow(() -> new ResourceNotFoundException("Attachment", attachmentId));
    if (attachment.getTaskId() != null) {
      taskService.requireTask(attachment.getTaskId(), principal);
    } else {
      commentService.requireComment(attachment.getCommentId(), principal);
    }
    if (!principal.isAccount(attachment.getUploaderId())) {
      throw new ForbiddenException(
          "Cannot delete attachment", "Only the uploader can delete attachment " + attachmentId);
    }
    attachmentRepository.delete(attachment);
    log.info("Deleted attachment {}", attachmentId);
  }
}
