package io.b2mash.workhub.fielddefinition.dto;

import io.b2mash.workhub.fielddefinition.CustomFieldOption;

public record FieldOptionResponse(Long id, String name, String color, int position) {

  public static FieldOptionResponse from(CustomFieldOption option) {
    return new FieldOptionResponse(
        option.getId(), option.getName(), option.getColor(), option.getPosition());
  }
}
