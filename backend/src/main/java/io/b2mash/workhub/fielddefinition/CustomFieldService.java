package io.b2mash.workhub.fielddefinition;

import io.b2mash.workhub.exception.ResourceConflictException;
import io.b2mash.workhub.exception.ResourceNotFoundException;
import io.b2mash.workhub.exception.ValidationException;
import io.b2mash.workhub.fielddefinition.dto.CreateFieldDefinitionRequest;
import io.b2mash.workhub.fielddefinition.dto.FieldDefinitionResponse;
import io.b2mash.workhub.fielddefinition.dto.FieldOptionRequest;
import io.b2mash.workhub.fielddefinition.dto.UpdateFieldDefinitionRequest;
import io.b2mash.workhub.identity.Principal;
import io.b2mash.workhub.project.ProjectService;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Custom field definitions of a project and the options of single-select fields. */
@Service
public class CustomFieldService {

  private static final Logger log = LoggerFactory.getLogger(CustomFieldService.class);

  private final CustomFieldDefinitionRepository definitionRepository;
  private final CustomFieldOptionRepository optionRepository;
  private final TaskFieldValueRepository valueRepository;
  private final ProjectService projectService;

  public CustomFieldService(
      CustomFieldDefinitionRepository definitionRepository,
      CustomFieldOptionRepository optionRepository,
      TaskFieldValueRepository valueRepository,
      ProjectService projectService) {
    this.definitionRepository = definitionRepository;
    this.optionRepository = optionRepository;
    this.valueRepository = valueRepository;
    this.projectService = projectService;
  }

  @Transactional
  public FieldDefinitionResponse defineField(
      Long projectId, CreateFieldDefinitionRequest request, Principal principal) {
    projectService.requireAccess(projectId, principal);
    var valueType = FieldValueType.fromValue(request.valueType());
    var options = normalizeOptions(request.options());
    checkOptionsRule(valueType, options.isEmpty());

    var definition =
        definitionRepository.save(
            new CustomFieldDefinition(projectId, request.name().trim(), valueType));
    var saved = new ArrayList<CustomFieldOption>();
    for (int i = 0; i < options.size(); i++) {
      var option = options.get(i);
      saved.add(
          optionRepository.save(
              new CustomFieldOption(definition.getId(), option.name(), option.color(), i)));
    }

    log.info(
        "Defined custom field: id={}, project={}, type={}, options={}",
        definition.getId(),
        projectId,
        valueType.wireName(),
        saved.size());
    return FieldDefinitionResponse.from(definition, saved);
  }

  @Transactional(readOnly = true)
  public List<FieldDefinitionResponse> listFields(Long projectId, Principal principal) {
    projectService.requireAccess(projectId, principal);
    var definitions = definitionRepository.findByProjectIdOrderByIdAsc(projectId);
    if (definitions.isEmpty()) {
      return List.of();
    }
    var optionsByField =
        optionRepository
            .findByFieldIdInOrderByPositionAscIdAsc(
                definitions.stream().map(CustomFieldDefinition::getId).toList())
            .stream()
            .collect(Collectors.groupingBy(CustomFieldOption::getFieldId));
    return definitions.stream()
        .map(d -> FieldDefinitionResponse.from(d, optionsByField.getOrDefault(d.getId(), List.of())))
        .toList();
  }

  @Transactional(readOnly = true)
  public FieldDefinitionResponse getField(Long fieldId, Principal principal) {
    var definition = requireField(fieldId, principal);
    return FieldDefinitionResponse.from(definition, loadOptions(fieldId));
  }

  /**
   * Renames, retypes and replaces options. Changing the type of a field that still has stored
   * values is a conflict; the options rule is checked against the resulting type. The definition
   * row stays locked until commit, so no value write interleaves with the type check.
   */
  @Transactional
  public FieldDefinitionResponse updateField(
      Long fieldId, UpdateFieldDefinitionRequest request, Principal principal) {
    var definition =
        definitionRepository
            .findByIdForUpdate(fieldId)
            .orElseThrow(() -> new ResourceNotFoundException("CustomField", fieldId));
    projectService.requireAccess(definition.getProjectId(), principal);

    var targetType =
        request.valueType() != null
            ? FieldValueType.fromValue(request.valueType())
            : definition.getValueType();
    if (targetType != definition.getValueType() && valueRepository.existsByFieldId(fieldId)) {
      throw new ResourceConflictException(
          "Field type change rejected",
          "Custom field "
              + fieldId
              + " still has stored values; clear them before changing its type");
    }

    var existing = loadOptions(fieldId);
    List<FieldOptionRequest> requested =
        request.options() != null ? normalizeOptions(request.options()) : null;
    boolean optionsEmpty;
    if (requested != null) {
      optionsEmpty = requested.isEmpty();
    } else {
      optionsEmpty = !targetType.hasOptions() || existing.isEmpty();
    }
    checkOptionsRule(targetType, optionsEmpty);

    if (request.name() != null) {
      definition.rename(request.name().trim());
    }
    if (targetType != definition.getValueType()) {
      definition.changeType(targetType);
    }

    List<CustomFieldOption> options;
    if (!targetType.hasOptions()) {
      optionRepository.deleteAll(existing);
      options = List.of();
    } else if (requested != null) {
      options = syncOptions(fieldId, existing, requested);
    } else {
      options = existing;
    }

    definition = definitionRepository.save(definition);
    log.info("Updated custom field: id={}, type={}", fieldId, targetType.wireName());
    return FieldDefinitionResponse.from(definition, options);
  }

  /** Stored values and options go with the definition. */
  @Transactional
  public void deleteField(Long fieldId, Principal principal) {
    var definition = requireField(fieldId, principal);
    definitionRepository.delete(definition);
    log.info("Deleted custom field {} from project {}", fieldId, definition.getProjectId());
  }

  CustomFieldDefinition requireField(Long fieldId, Principal principal) {
    var definition =
        definitionRepository
            .findById(fieldId)
            .orElseThrow(() -> new ResourceNotFoundException("CustomField", fieldId));
    projectService.requireAccess(definition.getProjectId(), principal);
    return definition;
  }

  List<CustomFieldOption> loadOptions(Long fieldId) {
    return optionRepository.findByFieldIdOrderByPositionAscIdAsc(fieldId);
  }

  private static void checkOptionsRule(FieldValueType valueType, boolean optionsEmpty) {
    if (valueType.hasOptions() && optionsEmpty) {
      throw new ValidationException(
          "Invalid options", "A single-select field needs at least one option");
    }
    if (!valueType.hasOptions() && !optionsEmpty) {
      throw new ValidationException(
          "Invalid options", "Only single-select fields can have options, not " + valueType.wireName());
    }
  }

  /** Trims names and rejects blank or duplicate names and repeated ids. */
  private static List<FieldOptionRequest> normalizeOptions(List<FieldOptionRequest> options) {
    if (options == null) {
      return List.of();
    }
    var names = new HashSet<String>();
    var ids = new HashSet<Long>();
    var normalized = new ArrayList<FieldOptionRequest>();
    for (var option : options) {
      if (option == null || option.name() == null || option.name().isBlank()) {
        throw new ValidationException("Invalid options", "Option names must not be blank");
      }
      String name = option.name().trim();
      if (!names.add(name)) {
        throw new ValidationException("Invalid options", "Duplicate option name '" + name + "'");
      }
      if (option.id() != null && !ids.add(option.id())) {
        throw new ValidationException("Invalid options", "Duplicate option id " + option.id());
      }
      normalized.add(new FieldOptionRequest(option.id(), name, option.color()));
    }
    return normalized;
  }

  /**
   * Makes the stored options match {@code requested}. Existing options are matched by id, or by
   * name when no id is given; unmatched existing options are removed together with the values that
   * select them.
   */
  private List<CustomFieldOption> syncOptions(
      Long fieldId, List<CustomFieldOption> existing, List<FieldOptionRequest> requested) {
    Map<Long, CustomFieldOption> unclaimed =
        existing.stream()
            .collect(
                Collectors.toMap(
                    CustomFieldOption::getId,
                    Function.identity(),
                    (a, b) -> a,
                    LinkedHashMap::new));
    var result = new ArrayList<CustomFieldOption>();

    for (var option : requested) {
      if (option.id() != null && !unclaimed.containsKey(option.id())) {
        throw new ValidationException(
            "Invalid options", "Option " + option.id() + " does not belong to field " + fieldId);
      }
    }
    for (int i = 0; i < requested.size(); i++) {
      var option = requested.get(i);
      CustomFieldOption match = option.id() != null ? unclaimed.remove(option.id()) : null;
      if (match == null && option.id() == null) {
        match =
            unclaimed.values().stream()
                .filter(o -> o.getName().equals(option.name()))
                .filter(o -> requested.stream().noneMatch(r -> o.getId().equals(r.id())))
                .findFirst()
                .orElse(null);
        if (match != null) {
          unclaimed.remove(match.getId());
        }
      }
      if (match != null) {
        match.update(option.name(), option.color(), i);
        result.add(optionRepository.save(match));
      } else {
        result.add(
            optionRepository.save(new CustomFieldOption(fieldId, option.name(), option.color(), i)));
      }
    }

    if (!unclaimed.isEmpty()) {
      optionRepository.deleteAll(unclaimed.values());
      log.info("Removed {} options from custom field {}", unclaimed.size(), fieldId);
    }
    return result;
  }
}
