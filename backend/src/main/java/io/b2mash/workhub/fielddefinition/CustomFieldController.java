package io.b2mash.workhub.fielddefinition;

import io.b2mash.workhub.fielddefinition.dto.CreateFieldDefinitionRequest;
import io.b2mash.workhub.fielddefinition.dto.FieldDefinitionResponse;
import io.b2mash.workhub.fielddefinition.dto.FieldValueResponse;
import io.b2mash.workhub.fielddefinition.dto.SetFieldValueRequest;
import io.b2mash.workhub.fielddefinition.dto.UpdateFieldDefinitionRequest;
import io.b2mash.workhub.identity.RequestScopes;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping({"/api", "/mcp"})
public class CustomFieldController {

  private final CustomFieldService customFieldService;
  private final CustomFieldValueService customFieldValueService;

  public CustomFieldController(
      CustomFieldService customFieldService, CustomFieldValueService customFieldValueService) {
    this.customFieldService = customFieldService;
    this.customFieldValueService = customFieldValueService;
  }

  @GetMapping("/projects/{projectId}/custom-fields")
  public ResponseEntity<List<FieldDefinitionResponse>> listFields(@PathVariable Long projectId) {
    return ResponseEntity.ok(
        customFieldService.listFields(projectId, RequestScopes.requirePrincipal()));
  }

  @PostMapping("/projects/{projectId}/custom-fields")
  public ResponseEntity<FieldDefinitionResponse> defineField(
      @PathVariable Long projectId, @Valid @RequestBody CreateFieldDefinitionRequest request) {
    var response =
        customFieldService.defineField(projectId, request, RequestScopes.requirePrincipal());
    return ResponseEntity.status(HttpStatus.CREATED).body(response);
  }

  @GetMapping("/custom-fields/{id}")
  public ResponseEntity<FieldDefinitionResponse> getField(@PathVariable Long id) {
    return ResponseEntity.ok(customFieldService.getField(id, RequestScopes.requirePrincipal()));
  }

  @PatchMapping("/custom-fields/{id}")
  public ResponseEntity<FieldDefinitionResponse> updateField(
      @PathVariable Long id, @Valid @RequestBody UpdateFieldDefinitionRequest request) {
    return ResponseEntity.ok(
        customFieldService.updateField(id, request, RequestScopes.requirePrincipal()));
  }

  @DeleteMapping("/custom-fields/{id}")
  public ResponseEntity<Void> deleteField(@PathVariable Long id) {
    customFieldService.deleteField(id, RequestScopes.requirePrincipal());
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/tasks/{taskId}/custom-fields")
  public ResponseEntity<List<FieldValueResponse>> listValues(@PathVariable Long taskId) {
    return ResponseEntity.ok(
        customFieldValueService.listValues(taskId, RequestScopes.requirePrincipal()));
  }

  @PutMapping("/tasks/{taskId}/custom-fields/{fieldId}")
  public ResponseEntity<FieldValueResponse> setValue(
      @PathVariable Long taskId,
      @PathVariable Long fieldId,
      @RequestBody SetFieldValueRequest request) {
    return ResponseEntity.ok(
        customFieldValueService.setValue(
            taskId, fieldId, request.value(), RequestScopes.requirePrincipal()));
  }

  @DeleteMapping("/tasks/{taskId}/custom-fields/{fieldId}")
  public ResponseEntity<Void> clearValue(@PathVariable Long taskId, @PathVariable Long fieldId) {
    customFieldValueService.clearValue(taskId, fieldId, RequestScopes.requirePrincipal());
    return ResponseEntity.noContent().build();
  }
}
