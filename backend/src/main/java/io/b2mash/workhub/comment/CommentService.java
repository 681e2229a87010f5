package io.b2mash.workhub.comment;

import io.b2mash.workhub.exception.ForbiddenException;
import io.b2mash.workhub.exception.ResourceNotFoundException;
import io.b2mash.workhub.identity.Principal;
import io.b2mash.workhub.task.TaskAccess;
import io.b2mash.workhub.task.TaskService;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class CommentService {

  private static final Logger log = LoggerFactory.getLogger(CommentService.class);

  private final CommentRepository commentRepository;
  private final TaskService taskService;

  public CommentService(CommentRepository commentRepository, TaskService taskService) {
    this.commentRepository = commentRepository;
    this.taskService = taskService;
  }

  @Transactional
  public Comment createComment(Long taskId, String text, Principal principal) {
    taskService.requireTask(taskId, principal);
    var comment = commentRepository.save(new Comment(taskId, principal.accountId(), text));
    log.info("Created comment {} on task {}", comment.getId(), taskId);
    return comment;
  }

  @Transactional(readOnly = true)
  public List<Comment> listComments(Long taskId, Principal principal) {
    taskService.requireTask(taskId, principal);
    return commentRepository.findByTaskIdOrderByCreatedAtAscIdAsc(taskId);
  }

  /** Only the author may edit. Id, author and creation time never change. */
  @Transactional
  public Comment updateComment(Long commentId, String text, Principal principal) {
    var comment = requireComment(commentId, principal).comment();
    if (!principal.isAccount(comment.getAuthorId())) {
      throw new ForbiddenException(
          "Cannot update comment", "Only the author can update comment " + commentId);
    }
    comment.updateText(text);
    log.info("Updated comment {}", commentId);
    return comment;
  }

  /** Only the author may delete. Attachments on the comment go with it. */
  @Transactional
  public void deleteComment(Long commentId, Principal principal) {
    var comment = requireComment(commentId, principal).comment();
    if (!principal.isAccount(comment.getAuthorId())) {
      throw new ForbiddenException(
          "Cannot delete comment", "Only the author can delete comment " + commentId);
    }
    commentRepository.delete(comment);
    log.info("Deleted comment {} from task {}", commentId, comment.getTaskId());
  }

  /** Loads a comment and checks the caller may see its task. */
  @Transactional(readOnly = true)
  public CommentAccess requireComment(Long commentId, Principal principal) {
    var comment =
        commentRepository
            .findById(commentId)
            .orElseThrow(() -> new ResourceNotFoundException("Comment", commentId));
    TaskAccess taskAccess = taskService.requireTask(comment.getTaskId(), principal);
    return new CommentAccess(comment, taskAccess);
  }

  public record CommentAccess(Comment comment, TaskAccess taskAccess) {}
}
