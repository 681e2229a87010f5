package io.b2mash.workhub.task;

import jakarta.persistence.LockModeType;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TaskRepository extends JpaRepository<Task, Long> {

  /**
   * Locks the task row for the rest of the transaction. Reparenting, deleting, tag attachment and
   * custom value writes all serialize on this lock.
   */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT t FROM Task t WHERE t.id = :id")
  Optional<Task> findByIdForUpdate(@Param("id") Long id);

  /** Empty when the task does not exist or has no parent. */
  @Query("SELECT t.parentTaskId FROM Task t WHERE t.id = :id")
  Optional<Long> findParentTaskId(@Param("id") Long id);

  @Query("SELECT t.projectId FROM Task t WHERE t.id = :id")
  Optional<Long> findProjectId(@Param("id") Long id);

  List<Task> findByParentTaskIdOrderByPositionAscIdAsc(Long parentTaskId);

  List<Task> findBySectionIdOrderByPositionAscIdAsc(Long sectionId);

  @Query(
      """
      SELECT COALESCE(MAX(t.position) + 1, 0) FROM Task t
      WHERE t.projectId = :projectId
        AND ((:sectionId IS NULL AND t.sectionId IS NULL) OR t.sectionId = :sectionId)
      """)
  int nextPosition(@Param("projectId") Long projectId, @Param("sectionId") Long sectionId);
}
