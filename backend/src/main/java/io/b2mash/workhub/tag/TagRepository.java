package io.b2mash.workhub.tag;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TagRepository extends JpaRepository<Tag, Long> {

  @Query("SELECT t FROM Tag t WHERE t.workspaceId = :workspaceId ORDER BY t.name ASC, t.id ASC")
  List<Tag> findByWorkspaceIdOrderByName(@Param("workspaceId") Long workspaceId);

  boolean existsByWorkspaceIdAndName(Long workspaceId, String name);

  boolean existsByWorkspaceIdAndNameAndIdNot(Long workspaceId, String name, Long id);

  @Query(
      """
      SELECT t FROM Tag t JOIN TaskTag tt ON tt.tagId = t.id
      WHERE tt.taskId = :taskId
      ORDER BY tt.createdAt ASC, t.id ASC
      """)
  List<Tag> findByTaskId(@Param("taskId") Long taskId);
}
