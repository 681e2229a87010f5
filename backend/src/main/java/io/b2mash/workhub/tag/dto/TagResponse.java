package io.b2mash.workhub.tag.dto;

import io.b2mash.workhub.tag.Tag;
import java.time.Instant;

public record TagResponse(
    Long id, Long workspaceId, String name, String color, Instant createdAt, Instant updatedAt) {

  public static TagResponse from(Tag tag) {
    return new TagResponse(
        tag.getId(),
        tag.getWorkspaceId(),
        tag.getName(),
        tag.getColor(),
        tag.getCreatedAt(),
        tag.getUpdatedAt());
  }
}
