package io.b2mash.workhub.task;

import io.b2mash.workhub.config.HierarchyProperties;
import io.b2mash.workhub.exception.CycleDetectedException;
import io.b2mash.workhub.exception.ResourceNotFoundException;
import io.b2mash.workhub.exception.ValidationException;
import io.b2mash.workhub.identity.Principal;
import io.b2mash.workhub.project.ProjectAccess;
import io.b2mash.workhub.project.ProjectService;
import io.b2mash.workhub.section.SectionService;
import io.b2mash.workhub.workspace.WorkspaceAccessService;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@EnableConfigurationProperties(HierarchyProperties.class)
public class TaskService {

  private static final Logger log = LoggerFactory.getLogger(TaskService.class);

  private final TaskRepository taskRepository;
  private final ProjectService projectService;
  private final SectionService sectionService;
  private final WorkspaceAccessService workspaceAccessService;
  private final HierarchyProperties hierarchyProperties;

  public TaskService(
      TaskRepository taskRepository,
      ProjectService projectService,
      SectionService sectionService,
      WorkspaceAccessService workspaceAccessService,
      HierarchyProperties hierarchyProperties) {
    this.taskRepository = taskRepository;
    this.projectService = projectService;
    this.sectionService = sectionService;
    this.workspaceAccessService = workspaceAccessService;
    this.hierarchyProperties = hierarchyProperties;
  }

  @Transactional
  public Task createTask(
      Long projectId,
      String name,
      String description,
      Long sectionId,
      Long parentTaskId,
      Long assigneeId,
      LocalDate dueDate,
      Integer position,
      Principal principal) {
    var access = projectService.requireAccess(projectId, principal);
    if (sectionId != null) {
      sectionService.requireSectionInProject(sectionId, access);
    }
    if (parentTaskId != null) {
      requireParentInProject(parentTaskId, access);
    }
    if (assigneeId != null) {
      workspaceAccessService.requireAccountInWorkspace(
          access.workspaceId(), assigneeId, "assignee");
    }
    int resolvedPosition =
        position != null ? position : taskRepository.nextPosition(projectId, sectionId);
    var task =
        taskRepository.save(
            new Task(
                projectId,
                sectionId,
                parentTaskId,
                name,
                description,
                assigneeId,
                dueDate,
                resolvedPosition,
                principal.accountId()));
    log.info("Created task {} in project {}", task.getId(), projectId);
    return task;
  }

  @Transactional(readOnly = true)
  public Task getTask(Long taskId, Principal principal) {
    return requireTask(taskId, principal).task();
  }

  @Transactional(readOnly = true)
  public List<Task> listSubtasks(Long taskId, Principal principal) {
    getTask(taskId, principal);
    return taskRepository.findByParentTaskIdOrderByPositionAscIdAsc(taskId);
  }

  @Transactional(readOnly = true)
  public List<Task> listSectionTasks(Long sectionId, Principal principal) {
    sectionService.getSection(sectionId, principal);
    return taskRepository.findBySectionIdOrderByPositionAscIdAsc(sectionId);
  }

  /**
   * Applies a partial update. The task row stays locked until commit, so a reparent and a
   * concurrent delete of the same task or of its new parent are serialized.
   */
  @Transactional
  public Task updateTask(Long taskId, TaskChanges changes, Principal principal) {
    var task = lockTask(taskId);
    var access = projectService.requireAccess(task.getProjectId(), principal);

    if (changes.projectId() != null && !changes.projectId().equals(task.getProjectId())) {
      throw new ValidationException(
          "Cannot move task", "Task " + taskId + " cannot be moved to another project");
    }

    if (changes.clearSection()) {
      task.moveToSection(null);
    } else if (changes.sectionId() != null
        && !changes.sectionId().equals(task.getSectionId())) {
      sectionService.requireSectionInProject(changes.sectionId(), access);
      task.moveToSection(changes.sectionId());
    }

    if (changes.clearParent()) {
      task.reparent(null);
    } else if (changes.parentTaskId() != null
        && !changes.parentTaskId().equals(task.getParentTaskId())) {
      reparent(task, changes.parentTaskId(), access);
    }

    if (changes.clearAssignee()) {
      task.assign(null);
    } else if (changes.assigneeId() != null
        && !changes.assigneeId().equals(task.getAssigneeId())) {
      workspaceAccessService.requireAccountInWorkspace(
          access.workspaceId(), changes.assigneeId(), "assignee");
      task.assign(changes.assigneeId());
    }

    task.updateDetails(
        changes.name() != null ? changes.name() : task.getName(),
        changes.description() != null ? changes.description() : task.getDescription(),
        changes.clearDueDate()
            ? null
            : Objects.requireNonNullElse(changes.dueDate(), task.getDueDate()),
        changes.position() != null ? changes.position() : task.getPosition());

    if (Boolean.TRUE.equals(changes.completed())) {
      task.complete();
    } else if (Boolean.FALSE.equals(changes.completed())) {
      task.reopen();
    }

    log.info("Updated task {} in project {}", taskId, task.getProjectId());
    return task;
  }

  /** Deletes the task with its subtasks, comments, attachments, tag links and field values. */
  @Transactional
  public void deleteTask(Long taskId, Principal principal) {
    var task = lockTask(taskId);
    projectService.requireAccess(task.getProjectId(), principal);
    taskRepository.delete(task);
    log.info("Deleted task {} from project {}", taskId, task.getProjectId());
  }

  /**
   * Loads a task for a write and checks the caller's access. Used by the tag, comment and custom
   * value services, which all serialize on the task row.
   */
  @Transactional
  public TaskAccess requireTaskForUpdate(Long taskId, Principal principal) {
    var task = lockTask(taskId);
    var access = projectService.requireAccess(task.getProjectId(), principal);
    return new TaskAccess(task, access);
  }

  @Transactional(readOnly = true)
  public TaskAccess requireTask(Long taskId, Principal principal) {
    var task =
        taskRepository
            .findById(taskId)
            .orElseThrow(() -> new ResourceNotFoundException("Task", taskId));
    return new TaskAccess(task, projectService.requireAccess(task.getProjectId(), principal));
  }

  private void reparent(Task task, Long newParentId, ProjectAccess access) {
    if (newParentId.equals(task.getId())) {
      throw new CycleDetectedException(task.getId(), newParentId);
    }
    requireParentInProject(newParentId, access);
    assertNoCycle(task.getId(), newParentId);
    task.reparent(newParentId);
  }

  /**
   * Walks up from the proposed parent. Reaching the task being moved means the parent is one of
   * its descendants; running out of depth budget is treated the same way.
   */
  void assertNoCycle(Long taskId, Long newParentId) {
    Long current = newParentId;
    for (int depth = 0; depth < hierarchyProperties.maxAncestorDepth(); depth++) {
      if (current == null) {
        return;
      }
      if (current.equals(taskId)) {
        throw new CycleDetectedException(taskId, newParentId);
      }
      current = taskRepository.findParentTaskId(current).orElse(null);
    }
    if (current != null) {
      log.warn(
          "Ancestor walk for task {} exceeded {} levels",
          taskId,
          hierarchyProperties.maxAncestorDepth());
      throw new CycleDetectedException(taskId, newParentId);
    }
  }

  /** Checks the parent belongs to the project and holds its row lock until commit. */
  private void requireParentInProject(Long parentTaskId, ProjectAccess access) {
    boolean sameProject =
        taskRepository
            .findByIdForUpdate(parentTaskId)
            .map(parent -> parent.getProjectId().equals(access.projectId()))
            .orElse(false);
    if (!sameProject) {
      throw new ValidationException(
          "Invalid parent task",
          "Task " + parentTaskId + " does not belong to project " + access.projectId());
    }
  }

  private Task lockTask(Long taskId) {
    return taskRepository
        .findByIdForUpdate(taskId)
        .orElseThrow(() -> new ResourceNotFoundException("Task", taskId));
  }
}
