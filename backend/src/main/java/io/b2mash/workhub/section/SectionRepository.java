package io.b2mash.workhub.section;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface SectionRepository extends JpaRepository<Section, Long> {

  List<Section> findByProjectIdOrderByPositionAscIdAsc(Long projectId);

  @Query("SELECT COALESCE(MAX(s.position) + 1, 0) FROM Section s WHERE s.projectId = :projectId")
  int nextPosition(@Param("projectId") Long projectId);
}
