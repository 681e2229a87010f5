package io.b2mash.workhub.fielddefinition;

import io.b2mash.workhub.exception.ResourceNotFoundException;
import io.b2mash.workhub.exception.ValidationException;
import io.b2mash.workhub.fielddefinition.dto.FieldValueResponse;
import io.b2mash.workhub.identity.Principal;
import io.b2mash.workhub.task.TaskService;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Custom field values of a task. Set and clear run under the task row lock, so writers of the same
 * task and field are serialized and the last committed write wins.
 */
@Service
public class CustomFieldValueService {

  private static final Logger log = LoggerFactory.getLogger(CustomFieldValueService.class);

  private final TaskFieldValueRepository valueRepository;
  private final CustomFieldDefinitionRepository definitionRepository;
  private final CustomFieldOptionRepository optionRepository;
  private final CustomFieldValidator validator;
  private final TaskService taskService;

  public CustomFieldValueService(
      TaskFieldValueRepository valueRepository,
      CustomFieldDefinitionRepository definitionRepository,
      CustomFieldOptionRepository optionRepository,
      CustomFieldValidator validator,
      TaskService taskService) {
    this.valueRepository = valueRepository;
    this.definitionRepository = definitionRepository;
    this.optionRepository = optionRepository;
    this.validator = validator;
    this.taskService = taskService;
  }

  /** Only fields that hold a value are returned. */
  @Transactional(readOnly = true)
  public List<FieldValueResponse> listValues(Long taskId, Principal principal) {
    taskService.requireTask(taskId, principal);
    var values = valueRepository.findByTaskIdOrderByFieldIdAsc(taskId);
    if (values.isEmpty()) {
      return List.of();
    }
    var fieldIds = values.stream().map(TaskFieldValue::getFieldId).toList();
    Map<Long, CustomFieldDefinition> definitions =
        definitionRepository.findAllById(fieldIds).stream()
            .collect(Collectors.toMap(CustomFieldDefinition::getId, Function.identity()));
    Map<Long, CustomFieldOption> options =
        optionRepository.findByFieldIdInOrderByPositionAscIdAsc(fieldIds).stream()
            .collect(Collectors.toMap(CustomFieldOption::getId, Function.identity()));
    return values.stream()
        .map(value -> toResponse(value, definitions.get(value.getFieldId()), options))
        .toList();
  }

  @Transactional
  public FieldValueResponse setValue(Long taskId, Long fieldId, Object raw, Principal principal) {
    var taskAccess = taskService.requireTaskForUpdate(taskId, principal);
    var definition =
        definitionRepository
            .findByIdForShare(fieldId)
            .orElseThrow(() -> new ResourceNotFoundException("CustomField", fieldId));
    if (!definition.getProjectId().equals(taskAccess.projectId())) {
      throw new ValidationException(
          "Invalid custom field",
          "Custom field " + fieldId + " does not belong to project " + taskAccess.projectId());
    }

    var fieldOptions = optionRepository.findByFieldIdOrderByPositionAscIdAsc(fieldId);
    var payload = validator.parse(definition, fieldOptions, raw);

    var value =
        valueRepository
            .findByTaskIdAndFieldId(taskId, fieldId)
            .map(
                existing -> {
                  existing.replace(payload);
                  return existing;
                })
            .orElseGet(() -> new TaskFieldValue(taskId, fieldId, payload));
    value = valueRepository.save(value);

    log.info(
        "Set custom field {} on task {} (type={})",
        fieldId,
        taskId,
        definition.getValueType().wireName());
    Map<Long, CustomFieldOption> optionsById =
        fieldOptions.stream()
            .collect(Collectors.toMap(CustomFieldOption::getId, Function.identity()));
    return toResponse(value, definition, optionsById);
  }

  /** Clearing a field that holds no value is a no-op. */
  @Transactional
  public void clearValue(Long taskId, Long fieldId, Principal principal) {
    taskService.requireTaskForUpdate(taskId, principal);
    if (valueRepository.deleteValue(taskId, fieldId) > 0) {
      log.info("Cleared custom field {} on task {}", fieldId, taskId);
    }
  }

  private static FieldValueResponse toResponse(
      TaskFieldValue value,
      CustomFieldDefinition definition,
      Map<Long, CustomFieldOption> optionsById) {
    var payload = value.payload();
    Object rendered;
    Long optionId = null;
    if (payload instanceof FieldPayload.Text text) {
      rendered = text.value();
    } else if (payload instanceof FieldPayload.Number number) {
      // NUMERIC(38, 10) pads the scale; render 8.0000000000 as 8
      BigDecimal stripped = number.value().stripTrailingZeros();
      rendered = stripped.scale() <= 0 ? stripped.toBigIntegerExact() : stripped;
    } else if (payload instanceof FieldPayload.Date date) {
      rendered = date.value().toString();
    } else if (payload instanceof FieldPayload.Bool bool) {
      rendered = bool.value();
    } else {
      optionId = ((FieldPayload.Option) payload).optionId();
      var option = optionsById.get(optionId);
      rendered = option != null ? option.getName() : null;
    }
    return new FieldValueResponse(
        value.getFieldId(),
        definition != null ? definition.getName() : null,
        value.getValueType().wireName(),
        rendered,
        optionId,
        value.getUpdatedAt());
  }
}
