package io.b2mash.workhub.fielddefinition;

import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface CustomFieldOptionRepository extends JpaRepository<CustomFieldOption, Long> {

  List<CustomFieldOption> findByFieldIdOrderByPositionAscIdAsc(Long fieldId);

  List<CustomFieldOption> findByFieldIdInOrderByPositionAscIdAsc(Collection<Long> fieldIds);

  @Modifying
  @Query("DELETE FROM CustomFieldOption o WHERE o.fieldId = :fieldId")
  int deleteByFieldId(@Param("fieldId") Long fieldId);
}
