package io.b2mash.workhub.exception;

/** Thrown when a task reparent would make the task its own ancestor. */
public class CycleDetectedException extends ValidationException {

  public CycleDetectedException(long taskId, long newParentId) {
    super(
        "Cycle detected",
        "Task " + newParentId + " cannot become the parent of task " + taskId
            + ": it is the task itself or one of its descendants");
    getBody().setProperty("taskId", taskId);
    getBody().setProperty("parentTaskId", newParentId);
  }
}
