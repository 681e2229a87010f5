package io.b2mash.workhub.tag;

import static io.b2mash.workhub.TestFixtures.createProject;
import static io.b2mash.workhub.TestFixtures.createTask;
import static io.b2mash.workhub.TestFixtures.createWorkspace;
import static io.b2mash.workhub.TestFixtures.idOf;
import static io.b2mash.workhub.TestFixtures.userJwt;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

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
import org.springframework.test.web.servlet.ResultActions;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class TagIntegrationTest {

  @Autowired private MockMvc mockMvc;

  private final JwtRequestPostProcessor owner = userJwt("user_tag_owner");

  private long workspaceId;
  private long otherWorkspaceId;
  private long taskId;

  @BeforeAll
  void setUp() throws Exception {
    workspaceId = createWorkspace(mockMvc, owner, "Tag Workspace");
    otherWorkspaceId = createWorkspace(mockMvc, owner, "Other Tag Workspace");
    long projectId = createProject(mockMvc, owner, workspaceId, "Tag Project");
    taskId = createTask(mockMvc, owner, projectId, "Tagged task", null);
  }

  @Test
  void duplicateNameInSameWorkspaceIsConflictButOtherWorkspaceSucceeds() throws Exception {
    createTag(workspaceId, "urgent").andExpect(status().isCreated());
    createTag(workspaceId, "urgent").andExpect(status().isConflict());
    createTag(otherWorkspaceId, "urgent").andExpect(status().isCreated());
  }

  @Test
  void attachAndDetachAreIdempotent() throws Exception {
    long tagId = idOf(createTag(workspaceId, "backend").andReturn());

    for (int i = 0; i < 2; i++) {
      mockMvc
          .perform(put("/api/tasks/" + taskId + "/tags/" + tagId).with(owner))
          .andExpect(status().isOk());
    }
    mockMvc
        .perform(get("/api/tasks/" + taskId + "/tags").with(owner))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[?(@.id == %d)]".formatted(tagId), hasSize(1)));

    for (int i = 0; i < 2; i++) {
      mockMvc
          .perform(delete("/api/tasks/" + taskId + "/tags/" + tagId).with(owner))
          .andExpect(status().isOk());
    }
    mockMvc
        .perform(get("/api/tasks/" + taskId + "/tags").with(owner))
        .andExpect(jsonPath("$[?(@.id == %d)]".formatted(tagId)).isEmpty());
  }

  @Test
  void tagFromAnotherWorkspaceCannotBeAttached() throws Exception {
    long foreignTag = idOf(createTag(otherWorkspaceId, "foreign").andReturn());

    mockMvc
        .perform(put("/api/tasks/" + taskId + "/tags/" + foreignTag).with(owner))
        .andExpect(status().isBadRequest());
  }

  @Test
  void invalidColorIsRejected() throws Exception {
    mockMvc
        .perform(
            post("/api/tags")
                .with(owner)
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"workspaceId\": %d, \"name\": \"red\", \"color\": \"red\"}"
                        .formatted(workspaceId)))
        .andExpect(status().isBadRequest());
  }

  @Test
  void deletingTagRemovesItsLinks() throws Exception {
    long tagId = idOf(createTag(workspaceId, "temporary").andReturn());
    mockMvc
        .perform(put("/api/tasks/" + taskId + "/tags/" + tagId).with(owner))
        .andExpect(status().isOk());

    mockMvc.perform(delete("/api/tags/" + tagId).with(owner)).andExpect(status().isNoContent());

    mockMvc
        .perform(get("/api/tasks/" + taskId + "/tags").with(owner))
        .andExpect(jsonPath("$[?(@.id == %d)]".formatted(tagId)).isEmpty());
  }

  private ResultActions createTag(long workspace, String name) throws Exception {
    return mockMvc.perform(
        post("/api/tags")
            .with(owner)
            .contentType(MediaType.APPLICATION_JSON)
            .content("{\"workspaceId\": %d, \"name\": \"%s\"}".formatted(workspace, name)));
  }
}
