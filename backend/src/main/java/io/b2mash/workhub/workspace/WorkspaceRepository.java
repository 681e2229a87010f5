package io.b2mash.workhub.workspace;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface WorkspaceRepository extends JpaRepository<Workspace, Long> {

  @Query(
      """
      SELECT w FROM Workspace w
      WHERE w.id IN (
          SELECT m.workspaceId FROM WorkspaceMember m WHERE m.accountId = :accountId)
      ORDER BY w.id
      """)
  List<Workspace> findAllForMember(@Param("accountId") Long accountId);

  List<Workspace> findAllByOrderByIdAsc();
}
