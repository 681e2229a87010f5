package io.b2mash.workhub.fielddefinition;

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
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
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
class CustomFieldIntegrationTest {

  @Autowired private MockMvc mockMvc;

  private final JwtRequestPostProcessor owner = userJwt("user_cf_owner");

  private long projectId;
  private long taskId;

  @BeforeAll
  void setUp() throws Exception {
    long workspaceId = createWorkspace(mockMvc, owner, "Custom Field Workspace");
    projectId = createProject(mockMvc, owner, workspaceId, "Custom Field Project");
    taskId = createTask(mockMvc, owner, projectId, "Fielded task", null);
  }

  @Test
  void singleSelectAcceptsDeclaredOptionsOnlyAndClearRemovesValue() throws Exception {
    var created =
        mockMvc
            .perform(
                post("/api/projects/" + projectId + "/custom-fields")
                    .with(owner)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        """
                        {
                          "name": "Priority",
                          "valueType": "single-select",
                          "options": [{"name": "low"}, {"name": "high", "color": "#FF0000"}]
                        }
                        """))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.valueType").value("single-select"))
            .andExpect(jsonPath("$.options", hasSize(2)))
            .andReturn();
    long fieldId = idOf(created);
    Number highId = JsonPath.read(created.getResponse().getContentAsString(), "$.options[1].id");

    mockMvc
        .perform(
            put("/api/tasks/" + taskId + "/custom-fields/" + fieldId)
                .with(owner)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"value\": \"high\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.value").value("high"))
        .andExpect(jsonPath("$.optionId").value(highId.longValue()));

    mockMvc
        .perform(
            put("/api/tasks/" + taskId + "/custom-fields/" + fieldId)
                .with(owner)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"value\": \"medium\"}"))
        .andExpect(status().isBadRequest());

    mockMvc
        .perform(get("/api/tasks/" + taskId + "/custom-fields").with(owner))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[?(@.fieldId == %d)].value".formatted(fieldId)).value("high"));

    mockMvc
        .perform(delete("/api/tasks/" + taskId + "/custom-fields/" + fieldId).with(owner))
        .andExpect(status().isNoContent());
    mockMvc
        .perform(delete("/api/tasks/" + taskId + "/custom-fields/" + fieldId).with(owner))
        .andExpect(status().isNoContent());

    mockMvc
        .perform(get("/api/tasks/" + taskId + "/custom-fields").with(owner))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[?(@.fieldId == %d)]".formatted(fieldId)).isEmpty());
  }

  @Test
  void numberFieldRejectsNonNumericPayloadWithoutWritingRow() throws Exception {
    long task = createTask(mockMvc, owner, projectId, "Numbers", null);
    long fieldId = defineField("Points", "number");

    mockMvc
        .perform(
            put("/api/tasks/" + task + "/custom-fields/" + fieldId)
                .with(owner)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"value\": \"five\"}"))
        .andExpect(status().isBadRequest());

    mockMvc
        .perform(get("/api/tasks/" + task + "/custom-fields").with(owner))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$", hasSize(0)));

    mockMvc
        .perform(
            put("/api/tasks/" + task + "/custom-fields/" + fieldId)
                .with(owner)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"value\": 5}"))
        .andExpect(status().isOk());
    mockMvc
        .perform(
            put("/api/tasks/" + task + "/custom-fields/" + fieldId)
                .with(owner)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"value\": 8}"))
        .andExpect(status().isOk());

    mockMvc
        .perform(get("/api/tasks/" + task + "/custom-fields").with(owner))
        .andExpect(jsonPath("$", hasSize(1)))
        .andExpect(jsonPath("$[0].valueType").value("number"))
        .andExpect(jsonPath("$[0].value").value(8));
  }

  @Test
  void numberFieldRejectsValuesTheColumnCannotHold() throws Exception {
    long task = createTask(mockMvc, owner, projectId, "Precision", null);
    long fieldId = defineField("Estimate", "number");

    mockMvc
        .perform(
            put("/api/tasks/" + task + "/custom-fields/" + fieldId)
                .with(owner)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"value\": 1000000000000000000000000000000}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.title").value("Invalid field value"));
    mockMvc
        .perform(
            put("/api/tasks/" + task + "/custom-fields/" + fieldId)
                .with(owner)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"value\": 0.123456789012345}"))
        .andExpect(status().isBadRequest());

    mockMvc
        .perform(
            put("/api/tasks/" + task + "/custom-fields/" + fieldId)
                .with(owner)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"value\": 0.1234567891}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.value").value(0.1234567891));
    mockMvc
        .perform(get("/api/tasks/" + task + "/custom-fields").with(owner))
        .andExpect(jsonPath("$", hasSize(1)))
        .andExpect(jsonPath("$[0].value").value(0.1234567891));
  }

  @Test
  void dateFieldRejectsBoolean() throws Exception {
    long task = createTask(mockMvc, owner, projectId, "Dates", null);
    long fieldId = defineField("Launch", "date");

    mockMvc
        .perform(
            put("/api/tasks/" + task + "/custom-fields/" + fieldId)
                .with(owner)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"value\": true}"))
        .andExpect(status().isBadRequest());
    mockMvc
        .perform(
            put("/api/tasks/" + task + "/custom-fields/" + fieldId)
                .with(owner)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"value\": \"2025-03-01\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.value").value("2025-03-01"));
  }

  @Test
  void changingTypeWhileValuesExistIsConflict() throws Exception {
    long task = createTask(mockMvc, owner, projectId, "Typed", null);
    long fieldId = defineField("Notes", "text");
    mockMvc
        .perform(
            put("/api/tasks/" + task + "/custom-fields/" + fieldId)
                .with(owner)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"value\": \"hello\"}"))
        .andExpect(status().isOk());

    mockMvc
        .perform(
            patch("/api/custom-fields/" + fieldId)
                .with(owner)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"valueType\": \"number\"}"))
        .andExpect(status().isConflict());

    mockMvc
        .perform(delete("/api/tasks/" + task + "/custom-fields/" + fieldId).with(owner))
        .andExpect(status().isNoContent());
    mockMvc
        .perform(
            patch("/api/custom-fields/" + fieldId)
                .with(owner)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"valueType\": \"number\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.valueType").value("number"));
  }

  @Test
  void fieldFromAnotherProjectIsValidationError() throws Exception {
    long workspaceId = createWorkspace(mockMvc, owner, "Second Field Workspace");
    long otherProject = createProject(mockMvc, owner, workspaceId, "Other");
    long foreignField =
        idOf(
            mockMvc
                .perform(
                    post("/api/projects/" + otherProject + "/custom-fields")
                        .with(owner)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\": \"Foreign\", \"valueType\": \"boolean\"}"))
                .andExpect(status().isCreated())
                .andReturn());

    mockMvc
        .perform(
            put("/api/tasks/" + taskId + "/custom-fields/" + foreignField)
                .with(owner)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"value\": true}"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void singleSelectWithoutOptionsIsRejected() throws Exception {
    mockMvc
        .perform(
            post("/api/projects/" + projectId + "/custom-fields")
                .with(owner)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"name\": \"Empty\", \"valueType\": \"single-select\"}"))
        .andExpect(status().isBadRequest());
  }

  @Test
  void deletingFieldRemovesItsValues() throws Exception {
    long task = createTask(mockMvc, owner, projectId, "Flagged", null);
    long fieldId = defineField("Blocked", "boolean");
    mockMvc
        .perform(
            put("/api/tasks/" + task + "/custom-fields/" + fieldId)
                .with(owner)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"value\": true}"))
        .andExpect(status().isOk());

    mockMvc
        .perform(delete("/api/custom-fields/" + fieldId).with(owner))
        .andExpect(status().isNoContent());

    mockMvc
        .perform(get("/api/tasks/" + task + "/custom-fields").with(owner))
        .andExpect(jsonPath("$", hasSize(0)));
  }

  private long defineField(String name, String valueType) throws Exception {
    return idOf(
        mockMvc
            .perform(
                post("/api/projects/" + projectId + "/custom-fields")
                    .with(owner)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(
                        "{\"name\": \"%s\", \"valueType\": \"%s\"}".formatted(name, valueType)))
            .andExpect(status().isCreated())
            .andReturn());
  }
}
