package io.b2mash.workhub.task;

import java.time.Instant;

/**
 * Task collection filters, AND-combined. At least one of {@code workspaceId} and {@code projectId}
 * scopes the query; the rest are optional.
 *
 * @param assignee an account id, or {@code "me"} for the calling principal
 * @param completedSince only tasks completed at or after this instant
 */
public record TaskQuery(
    Long workspaceId,
    Long projectId,
    String assignee,
    Boolean completed,
    Instant completedSince,
    Integer limit,
    Integer offset) {

  TaskQuery withWorkspaceId(Long resolvedWorkspaceId) {
    return new TaskQuery(
        resolvedWorkspaceId, projectId, assignee, completed, completedSince, limit, offset);
  }
}
