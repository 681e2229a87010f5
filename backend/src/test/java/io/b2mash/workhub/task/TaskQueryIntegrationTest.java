package io.b2mash.workhub.task;

import static io.b2mash.workhub.TestFixtures.accountId;
import static io.b2mash.workhub.TestFixtures.addMember;
import static io.b2mash.workhub.TestFixtures.createProject;
import static io.b2mash.workhub.TestFixtures.createTask;
import static io.b2mash.workhub.TestFixtures.createWorkspace;
import static io.b2mash.workhub.TestFixtures.userJwt;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Instant;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInstance;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.webmvc.test.autoconfigure.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.JwtRequestPostProcessor;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class TaskQueryIntegrationTest {

  @Autowired private MockMvc mockMvc;

  private final JwtRequestPostProcessor owner = userJwt("user_tq_owner");
  private final JwtRequestPostProcessor member = userJwt("user_tq_member");

  private long memberId;
  private long workspaceId;
  private long projectA;
  private long projectB;
  private long earlyDone;
  private long lateDone;
  private long assigned;
  private Instant cutoff;

  @BeforeAll
  void setUp() throws Exception {
    memberId = accountId(mockMvc, member);
    workspaceId = createWorkspace(mockMvc, owner, "Query Workspace");
    addMember(mockMvc, owner, workspaceId, memberId);
    projectA = createProject(mockMvc, owner, workspaceId, "Query A");
    projectB = createProject(mockMvc, owner, workspaceId, "Query B");

    earlyDone = createTask(mockMvc, owner, projectA, "Early", null);
    lateDone = createTask(mockMvc, owner, projectA, "Late", null);
    assigned = createTask(mockMvc, owner, projectB, "Assigned", null);
    createTask(mockMvc, owner, projectB, "Open", null);

    complete(earlyDone);
    Thread.sleep(20);
    cutoff = Instant.now();
    Thread.sleep(20);
    complete(lateDone);

    mockMvc
        .perform(
            patch("/api/tasks/" + assigned)
                .with(owner)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"assigneeId\": %d}".formatted(memberId)))
        .andExpect(status().isOk());
  }

  @Test
  void completedSinceExcludesTasksCompletedBeforeCutoff() throws Exception {
    mockMvc
        .perform(
            get("/api/tasks")
                .with(owner)
                .param("workspaceId", String.valueOf(workspaceId))
                .param("completedSince", cutoff.toString()))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.total").value(1))
        .andExpect(jsonPath("$.items[*].id", contains((int) lateDone)));
  }

  @Test
  void completedFilterAndProjectFilterCombine() throws Exception {
    mockMvc
        .perform(
            get("/api/tasks")
                .with(owner)
                .param("workspaceId", String.valueOf(workspaceId))
                .param("projectId", String.valueOf(projectA))
                .param("completed", "true"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.total").value(2))
        .andExpect(jsonPath("$.items[*].id", contains((int) earlyDone, (int) lateDone)));

    mockMvc
        .perform(
            get("/api/tasks")
                .with(owner)
                .param("workspaceId", String.valueOf(workspaceId))
                .param("completed", "false"))
        .andExpect(jsonPath("$.total").value(2));
  }

  @Test
  void projectAloneScopesTheQuery() throws Exception {
    mockMvc
        .perform(get("/api/tasks").with(member).param("projectId", String.valueOf(projectB)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.total").value(2))
        .andExpect(jsonPath("$.items[0].id").value(assigned));

    mockMvc
        .perform(
            get("/api/tasks")
                .with(userJwt("user_tq_outsider"))
                .param("projectId", String.valueOf(projectB)))
        .andExpect(status().isForbidden());

    mockMvc.perform(get("/api/tasks").with(owner)).andExpect(status().isBadRequest());
  }

  @Test
  void assigneeMeResolvesToCaller() throws Exception {
    mockMvc
        .perform(
            get("/api/tasks")
                .with(member)
                .param("workspaceId", String.valueOf(workspaceId))
                .param("assignee", "me"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.total").value(1))
        .andExpect(jsonPath("$.items[0].id").value(assigned));
  }

  @Test
  void paginationReportsTotalAndOrdersById() throws Exception {
    mockMvc
        .perform(
            get("/api/tasks")
                .with(owner)
                .param("workspaceId", String.valueOf(workspaceId))
                .param("limit", "3")
                .param("offset", "0"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.total").value(4))
        .andExpect(jsonPath("$.limit").value(3))
        .andExpect(jsonPath("$.items", hasSize(3)))
        .andExpect(jsonPath("$.items[0].id").value(earlyDone));

    mockMvc
        .perform(
            get("/api/tasks")
                .with(owner)
                .param("workspaceId", String.valueOf(workspaceId))
                .param("limit", "3")
                .param("offset", "3"))
        .andExpect(jsonPath("$.total").value(4))
        .andExpect(jsonPath("$.items", hasSize(1)));
  }

  @Test
  void outOfRangePaginationIsValidationError() throws Exception {
    for (String[] params : new String[][] {{"limit", "0"}, {"limit", "201"}, {"offset", "-1"}}) {
      mockMvc
          .perform(
              get("/api/tasks")
                  .with(owner)
                  .param("workspaceId", String.valueOf(workspaceId))
                  .param(params[0], params[1]))
          .andExpect(status().isBadRequest());
    }
  }

  @Test
  void projectFromAnotherWorkspaceIsValidationError() throws Exception {
    long otherWorkspace = createWorkspace(mockMvc, owner, "Unrelated Workspace");
    long otherProject = createProject(mockMvc, owner, otherWorkspace, "Unrelated");

    mockMvc
        .perform(
            get("/api/tasks")
                .with(owner)
                .param("workspaceId", String.valueOf(workspaceId))
                .param("projectId", String.valueOf(otherProject)))
        .andExpect(status().isBadRequest());
  }

  private void complete(long taskId) throws Exception {
    mockMvc
        .perform(
            patch("/api/tasks/" + taskId)
                .with(owner)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"completed\": true}"))
        .andExpect(status().isOk());
  }
}
