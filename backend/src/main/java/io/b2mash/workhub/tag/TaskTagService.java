package io.b2mash.workhub.tag;

import io.b2mash.workhub.exception.ResourceNotFoundException;
import io.b2mash.workhub.exception.ValidationException;
import io.b2mash.workhub.identity.Principal;
import io.b2mash.workhub.tag.dto.TagResponse;
import io.b2mash.workhub.task.TaskService;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Task-to-tag links. Attach and detach are idempotent: both run under the task row lock, check the
 * current link, and only then insert or delete, so repeated and concurrent calls converge on one
 * link or none.
 */
@Service
public class TaskTagService {

  private static final Logger log = LoggerFactory.getLogger(TaskTagService.class);

  private final TaskTagRepository taskTagRepository;
  private final TagRepository tagRepository;
  private final TaskService taskService;

  public TaskTagService(
      TaskTagRepository taskTagRepository, TagRepository tagRepository, TaskService taskService) {
    this.taskTagRepository = taskTagRepository;
    this.tagRepository = tagRepository;
    this.taskService = taskService;
  }

  @Transactional(readOnly = true)
  public List<TagResponse> listForTask(Long taskId, Principal principal) {
    taskService.requireTask(taskId, principal);
    return tagRepository.findByTaskId(taskId).stream().map(TagResponse::from).toList();
  }

  @Transactional
  public List<TagResponse> attach(Long taskId, Long tagId, Principal principal) {
    var taskAccess = taskService.requireTaskForUpdate(taskId, principal);
    var tag =
        tagRepository
            .findById(tagId)
            .orElseThrow(() -> new ResourceNotFoundException("Tag", tagId));
    if (!tag.getWorkspaceId().equals(taskAccess.workspaceId())) {
      throw new ValidationException(
          "Invalid tag",
          "Tag " + tagId + " does not belong to workspace " + taskAccess.workspaceId());
    }
    if (!taskTagRepository.existsByTaskIdAndTagId(taskId, tagId)) {
      taskTagRepository.save(new TaskTag(taskId, tagId));
      log.info("Attached tag {} to task {}", tagId, taskId);
    }
    return tagRepository.findByTaskId(taskId).stream().map(TagResponse::from).toList();
  }

  /** Detaching a tag that is not attached, or no longer exists, is a no-op. */
  @Transactional
  public List<TagResponse> detach(Long taskId, Long tagId, Principal principal) {
    taskService.requireTaskForUpdate(taskId, principal);
    if (taskTagRepository.deleteLink(taskId, tagId) > 0) {
      log.info("Detached tag {} from task {}", tagId, taskId);
    }
    return tagRepository.findByTaskId(taskId).stream().map(TagResponse::from).toList();
  }
}
