package io.b2mash.workhub.task;

import io.b2mash.workhub.config.QueryProperties;
import io.b2mash.workhub.exception.ValidationException;
import io.b2mash.workhub.identity.Principal;
import io.b2mash.workhub.project.ProjectRepository;
import io.b2mash.workhub.project.ProjectService;
import io.b2mash.workhub.workspace.WorkspaceAccessService;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Runs filtered, paginated task queries. Each filter contributes one JPQL predicate and its named
 * parameter; the predicates are AND-joined and shared by the page query and the count query.
 * Results are ordered by id so pages stay stable while positions change.
 */
@Service
@EnableConfigurationProperties(QueryProperties.class)
public class TaskQueryService {

  static final String ASSIGNEE_ME = "me";

  private final WorkspaceAccessService workspaceAccessService;
  private final ProjectRepository projectRepository;
  private final ProjectService projectService;
  private final QueryProperties queryProperties;

  @PersistenceContext private EntityManager entityManager;

  public TaskQueryService(
      WorkspaceAccessService workspaceAccessService,
      ProjectRepository projectRepository,
      ProjectService projectService,
      QueryProperties queryProperties) {
    this.workspaceAccessService = workspaceAccessService;
    this.projectRepository = projectRepository;
    this.projectService = projectService;
    this.queryProperties = queryProperties;
  }

  /**
   * Runs the query in a workspace, or in a single project when only {@code projectId} is given. In
   * the latter case the workspace is taken from the project.
   */
  @Transactional(readOnly = true)
  public TaskPage query(TaskQuery query, Principal principal) {
    int limit = resolveLimit(query.limit());
    int offset = resolveOffset(query.offset());
    if (query.workspaceId() != null) {
      workspaceAccessService.requireMember(query.workspaceId(), principal);
    } else if (query.projectId() != null) {
      var access = projectService.requireAccess(query.projectId(), principal);
      query = query.withWorkspaceId(access.workspaceId());
    } else {
      throw new ValidationException("Invalid query", "workspaceId or projectId is required");
    }

    Map<String, Object> params = new HashMap<>();
    String whereClause = buildWhereClause(query, principal, params);

    var countQuery =
        entityManager.createQuery("SELECT COUNT(t) FROM Task t WHERE " + whereClause, Long.class);
    params.forEach(countQuery::setParameter);
    long total = countQuery.getSingleResult();

    List<Task> items = List.of();
    if (offset < total) {
      var pageQuery =
          entityManager.createQuery(
              "SELECT t FROM Task t WHERE " + whereClause + " ORDER BY t.id ASC", Task.class);
      params.forEach(pageQuery::setParameter);
      items = pageQuery.setFirstResult(offset).setMaxResults(limit).getResultList();
    }
    return new TaskPage(items, total, limit, offset);
  }

  /**
   * Builds the JPQL WHERE clause for the query.
   *
   * @param params output map populated with the named parameter bindings
   * @return predicates joined with AND, never empty since the workspace scope always applies
   */
  String buildWhereClause(TaskQuery query, Principal principal, Map<String, Object> params) {
    List<String> clauses = new ArrayList<>();

    clauses.add(
        "t.projectId IN (SELECT p.id FROM Project p WHERE p.workspaceId = :workspaceId)");
    params.put("workspaceId", query.workspaceId());

    if (query.projectId() != null) {
      requireProjectInWorkspace(query.projectId(), query.workspaceId());
      clauses.add("t.projectId = :projectId");
      params.put("projectId", query.projectId());
    }

    if (query.assignee() != null) {
      clauses.add("t.assigneeId = :assigneeId");
      params.put("assigneeId", resolveAssignee(query.assignee(), principal));
    }

    if (query.completed() != null) {
      clauses.add(query.completed() ? "t.completedAt IS NOT NULL" : "t.completedAt IS NULL");
    }

    if (query.completedSince() != null) {
      clauses.add("t.completedAt >= :completedSince");
      params.put("completedSince", query.completedSince());
    }

    return String.join(" AND ", clauses);
  }

  static Long resolveAssignee(String assignee, Principal principal) {
    String value = assignee.trim();
    if (ASSIGNEE_ME.equalsIgnoreCase(value)) {
      return principal.accountId();
    }
    try {
      return Long.valueOf(value);
    } catch (NumberFormatException e) {
      throw new ValidationException(
          "Invalid assignee", "assignee must be 'me' or an account id, got '" + assignee + "'");
    }
  }

  private int resolveLimit(Integer limit) {
    if (limit == null) {
      return queryProperties.defaultLimit();
    }
    if (limit < 1 || limit > queryProperties.maxLimit()) {
      throw new ValidationException(
          "Invalid limit", "limit must be between 1 and " + queryProperties.maxLimit());
    }
    return limit;
  }

  private static int resolveOffset(Integer offset) {
    if (offset == null) {
      return 0;
    }
    if (offset < 0) {
      throw new ValidationException("Invalid offset", "offset must not be negative");
    }
    return offset;
  }

  private void requireProjectInWorkspace(Long projectId, Long workspaceId) {
    boolean sameWorkspace =
        projectRepository
            .findById(projectId)
            .map(project -> project.getWorkspaceId().equals(workspaceId))
            .orElse(false);
    if (!sameWorkspace) {
      throw new ValidationException(
          "Invalid project",
          "Project " + projectId + " does not belong to workspace " + workspaceId);
    }
  }
}
