package io.b2mash.workhub.tag;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TaskTagRepository extends JpaRepository<TaskTag, TaskTagId> {

  boolean existsByTaskIdAndTagId(Long taskId, Long tagId);

  @Modifying
  @Query("DELETE FROM TaskTag tt WHERE tt.taskId = :taskId AND tt.tagId = :tagId")
  int deleteLink(@Param("taskId") Long taskId, @Param("tagId") Long tagId);
}
