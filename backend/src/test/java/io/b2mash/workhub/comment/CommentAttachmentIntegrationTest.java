package io.b2mash.workhub.comment;

import static io.b2mash.workhub.TestFixtures.accountId;
import static io.b2mash.workhub.TestFixtures.addMember;
import static io.b2mash.workhub.TestFixtures.createProject;
import static io.b2mash.workhub.TestFixtures.createTask;
import static io.b2mash.workhub.TestFixtures.createWorkspace;
import static io.b2mash.workhub.TestFixtures.idOf;
import static io.b2mash.workhub.TestFixtures.userJwt;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
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

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
class CommentAttachmentIntegrationTest {

  @Autowired private MockMvc mockMvc;

  private final JwtRequestPostProcessor author = userJwt("user_ca_author");
  private final JwtRequestPostProcessor colleague = userJwt("user_ca_colleague");

  private long taskId;

  @BeforeAll
  void setUp() throws Exception {
    long colleagueId = accountId(mockMvc, colleague);
    long workspaceId = createWorkspace(mockMvc, author, "Comment Workspace");
    addMember(mockMvc, author, workspaceId, colleagueId);
    long projectId = createProject(mockMvc, author, workspaceId, "Comment Project");
    taskId = createTask(mockMvc, author, projectId, "Discussed task", null);
  }

  @Test
  void commentsListInCreationOrderAndOnlyAuthorMayEdit() throws Exception {
    long first = postComment(author, "first");
    long second = postComment(colleague, "second");

    mockMvc
        .perform(get("/api/tasks/" + taskId + "/comments").with(colleague))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[?(@.id == %d)].text".formatted(first)).value("first"))
        .andExpect(jsonPath("$[?(@.id == %d)].text".formatted(second)).value("second"));

    mockMvc
        .perform(
            patch("/api/comments/" + first)
                .with(colleague)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"text\": \"hijacked\"}"))
        .andExpect(status().isForbidden());

    mockMvc
        .perform(
            patch("/api/comments/" + first)
                .with(author)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"text\": \"edited\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.text").value("edited"));

    mockMvc
        .perform(delete("/api/comments/" + second).with(author))
        .andExpect(status().isForbidden());
  }

  @Test
  void deletingCommentRemovesItsAttachments() throws Exception {
    long commentId = postComment(author, "see attached");
    long attachmentId =
        idOf(
            mockMvc
                .perform(
                    post("/api/comments/" + commentId + "/attachments")
                        .with(author)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(
                            """
                            {"filename": "brief.pdf", "reference": "s3://bucket/brief.pdf", "sizeBytes": 1024}
                            """))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.commentId").value(commentId))
                .andReturn());

    mockMvc
        .perform(get("/api/comments/" + commentId + "/attachments").with(author))
        .andExpect(jsonPath("$", hasSize(1)));

    mockMvc
        .perform(delete("/api/comments/" + commentId).with(author))
        .andExpect(status().isNoContent());

    mockMvc
        .perform(delete("/api/attachments/" + attachmentId).with(author))
        .andExpect(status().isNotFound());
  }

  @Test
  void taskAttachmentsAreDeletableOnlyByUploader() throws Exception {
    long attachmentId =
        idOf(
            mockMvc
                .perform(
                    post("/api/tasks/" + taskId + "/attachments")
                        .with(colleague)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"filename\": \"a.png\", \"reference\": \"blob:a\"}"))
                .andExpect(status().isCreated())
                .andReturn());

    mockMvc
        .perform(delete("/api/attachments/" + attachmentId).with(author))
        .andExpect(status().isForbidden());
    mockMvc
        .perform(delete("/api/attachments/" + attachmentId).with(colleague))
        .andExpect(status().isNoContent());
  }

  private long postComment(JwtRequestPostProcessor jwt, String text) throws Exception {
    return idOf(
        mockMvc
            .perform(
                post("/api/tasks/" + taskId + "/comments")
                    .with(jwt)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"text\": \"%s\"}".formatted(text)))
            .andExpect(status().isCreated())
            .andReturn());
  }
}
