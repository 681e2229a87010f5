package io.b2mash.workhub.task;

import static io.b2mash.workhub.TestEntities.withId;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.workhub.config.QueryProperties;
import io.b2mash.workhub.exception.ForbiddenException;
import io.b2mash.workhub.exception.ValidationException;
import io.b2mash.workhub.identity.Principal;
import io.b2mash.workhub.project.Project;
import io.b2mash.workhub.project.ProjectRepository;
import io.b2mash.workhub.project.ProjectService;
import io.b2mash.workhub.workspace.WorkspaceAccessService;
import java.time.Instant;
import java.util.HashMap;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TaskQueryServiceTest {

  private static final Principal CALLER = Principal.of(7L);

  @Mock private WorkspaceAccessService workspaceAccessService;
  @Mock private ProjectRepository projectRepository;
  @Mock private ProjectService projectService;

  private TaskQueryService service;

  @BeforeEach
  void setUp() {
    service =
        new TaskQueryService(
            workspaceAccessService, projectRepository, projectService, new QueryProperties(20, 200));
  }

  @Test
  void query_rejectsOutOfRangeLimitsBeforeTouchingStorage() {
    for (Integer limit : new Integer[] {0, 201, -5}) {
      var query = new TaskQuery(1L, null, null, null, null, limit, null);
      assertThatThrownBy(() -> service.query(query, CALLER))
          .isInstanceOf(ValidationException.class);
    }
    verify(workspaceAccessService, never()).requireMember(any(), any());
  }

  @Test
  void query_rejectsNegativeOffset() {
    var query = new TaskQuery(1L, null, null, null, null, null, -1);

    assertThatThrownBy(() -> service.query(query, CALLER)).isInstanceOf(ValidationException.class);
  }

  @Test
  void query_requiresWorkspaceOrProject() {
    var query = new TaskQuery(null, null, null, null, null, 10, 0);

    assertThatThrownBy(() -> service.query(query, CALLER)).isInstanceOf(ValidationException.class);
  }

  @Test
  void query_scopedByProjectOnlyChecksProjectAccess() {
    when(projectService.requireAccess(4L, CALLER))
        .thenThrow(new ForbiddenException("Not a workspace member", "denied"));
    var query = new TaskQuery(null, 4L, null, null, null, 10, 0);

    assertThatThrownBy(() -> service.query(query, CALLER)).isInstanceOf(ForbiddenException.class);
    verify(workspaceAccessService, never()).requireMember(any(), any());
  }

  @Test
  void resolveAssignee_mapsMeToCaller() {
    assertThat(TaskQueryService.resolveAssignee("me", CALLER)).isEqualTo(7L);
    assertThat(TaskQueryService.resolveAssignee(" ME ", CALLER)).isEqualTo(7L);
    assertThat(TaskQueryService.resolveAssignee("12", CALLER)).isEqualTo(12L);
  }

  @Test
  void resolveAssignee_rejectsGarbage() {
    assertThatThrownBy(() -> TaskQueryService.resolveAssignee("someone", CALLER))
        .isInstanceOf(ValidationException.class);
  }

  @Test
  void buildWhereClause_combinesAllFiltersWithAnd() {
    when(projectRepository.findById(4L))
        .thenReturn(Optional.of(withId(new Project(1L, "P", null, null, false, 7L), 4L)));
    var since = Instant.parse("2024-01-01T00:00:00Z");
    var query = new TaskQuery(1L, 4L, "me", true, since, null, null);
    var params = new HashMap<String, Object>();

    String where = service.buildWhereClause(query, CALLER, params);

    assertThat(where)
        .contains("p.workspaceId = :workspaceId")
        .contains(" AND t.projectId = :projectId")
        .contains(" AND t.assigneeId = :assigneeId")
        .contains(" AND t.completedAt IS NOT NULL")
        .contains(" AND t.completedAt >= :completedSince");
    assertThat(params)
        .containsEntry("workspaceId", 1L)
        .containsEntry("projectId", 4L)
        .containsEntry("assigneeId", 7L)
        .containsEntry("completedSince", since);
  }

  @Test
  void buildWhereClause_rejectsProjectFromAnotherWorkspace() {
    when(projectRepository.findById(4L))
        .thenReturn(Optional.of(withId(new Project(2L, "P", null, null, false, 7L), 4L)));
    var query = new TaskQuery(1L, 4L, null, null, null, null, null);

    assertThatThrownBy(() -> service.buildWhereClause(query, CALLER, new HashMap<>()))
        .isInstanceOf(ValidationException.class);
  }
}
