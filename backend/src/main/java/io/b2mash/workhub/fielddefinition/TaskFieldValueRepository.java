package io.b2mash.workhub.fielddefinition;

import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TaskFieldValueRepository extends JpaRepository<TaskFieldValue, Long> {

  Optional<TaskFieldValue> findByTaskIdAndFieldId(Long taskId, Long fieldId);

  List<TaskFieldValue> findByTaskIdOrderByFieldIdAsc(Long taskId);

  boolean existsByFieldId(Long fieldId);

  @Modifying
  @Query("DELETE FROM TaskFieldValue v WHERE v.taskId = :taskId AND v.fieldId = :fieldId")
  int deleteValue(@Param("taskId") Long taskId, @Param("fieldId") Long fieldId);
}
