package io.b2mash.workhub.task;

import java.time.LocalDate;

/**
 * A partial task update. {@code null} leaves a field as it is; the {@code clear*} flags reset an
 * optional reference to empty and win over a value given for the same field.
 */
public record TaskChanges(
    String name,
    String description,
    Long projectId,
    Long sectionId,
    boolean clearSection,
    Long parentTaskId,
    boolean clearParent,
    Long assigneeId,
    boolean clearAssignee,
    LocalDate dueDate,
    boolean clearDueDate,
    Boolean completed,
    Integer position) {}
