package io.b2mash.workhub;

/** Assigns database ids to entities built in unit tests. */
public final class TestEntities {

  private TestEntities() {}

  public static <T> T withId(T entity, Long id) {
    try {
      var idField = entity.getClass().getDeclaredField("id");
      idField.setAccessible(true);
      idField.set(entity, id);
    } catch (ReflectiveOperationException e) {
      throw new RuntimeException("Failed to set id on " + entity.getClass().getSimpleName(), e);
    }
    return entity;
  }
}
