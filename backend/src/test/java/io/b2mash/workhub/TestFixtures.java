package io.b2mash.workhub;

import static org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.jwt;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
import org.springframework.http.MediaType;
import org.springframework.security.test.web.servlet.request.SecurityMockMvcRequestPostProcessors.JwtRequestPostProcessor;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

/** Request helpers shared by the MockMvc integration tests. */
public final class TestFixtures {

  public static final String API_KEY = "test-api-key";

  private TestFixtures() {}

  /** A verified bearer token for {@code subject}, with email {@code subject@test.com}. */
  public static JwtRequestPostProcessor userJwt(String subject) {
    return jwt()
        .jwt(j -> j.subject(subject).claim("email", subject + "@test.com").claim("name", subject));
  }

  public static long idOf(MvcResult result) throws Exception {
    return ((Number) JsonPath.read(result.getResponse().getContentAsString(), "$.id"))
        .longValue();
  }

  /** Provisions the account behind the token and returns its id. */
  public static long accountId(MockMvc mockMvc, JwtRequestPostProcessor jwt) throws Exception {
    var result =
        mockMvc.perform(get("/api/users/me").with(jwt)).andExpect(status().isOk()).andReturn();
    return idOf(result);
  }

  public static long createWorkspace(MockMvc mockMvc, JwtRequestPostProcessor jwt, String name)
      throws Exception {
    return idOf(
        mockMvc
            .perform(
                post("/api/workspaces")
                    .with(jwt)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"name\": \"%s\"}".formatted(name)))
            .andExpect(status().isCreated())
            .andReturn());
  }

  public static void addMember(
      MockMvc mockMvc, JwtRequestPostProcessor ownerJwt, long workspaceId, long accountId)
      throws Exception {
    mockMvc
        .perform(
            post("/api/workspaces/" + workspaceId + "/members")
                .with(ownerJwt)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"accountId\": %d}".formatted(accountId)))
        .andExpect(status().isCreated());
  }

  public static long createProject(
      MockMvc mockMvc, JwtRequestPostProcessor jwt, long workspaceId, String name)
      throws Exception {
    return idOf(
        mockMvc
            .perform(
                post("/api/projects")
                    .with(jwt)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        "{\"workspaceId\": %d, \"name\": \"%s\"}".formatted(workspaceId, name)))
            .andExpect(status().isCreated())
            .andReturn());
  }

  public static long createTask(
      MockMvc mockMvc, JwtRequestPostProcessor jwt, long projectId, String name, Long parentId)
      throws Exception {
    String parent = parentId == null ? "null" : parentId.toString();
    return idOf(
        mockMvc
            .perform(
                post("/api/tasks")
                    .with(jwt)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {"projectId": %d, "name": "%s", "parentTaskId": %s}
                        """
                            .formatted(projectId, name, parent)))
            .andExpect(status().isCreated())
            .andReturn());
  }
}
