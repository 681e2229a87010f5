package io.b2mash.workhub.team;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface TeamMemberRepository extends JpaRepository<TeamMember, Long> {

  List<TeamMember> findByTeamIdOrderByIdAsc(Long teamId);

  List<TeamMember> findByTeamIdInOrderByIdAsc(Collection<Long> teamIds);

  Optional<TeamMember> findByTeamIdAndAccountId(Long teamId, Long accountId);

  boolean existsByTeamIdAndAccountId(Long teamId, Long accountId);

  @Modifying
  @Query(
      """
      DELETE FROM TeamMember tm
      WHERE tm.accountId = :accountId
        AND tm.teamId IN (SELECT t.id FROM Team t WHERE t.workspaceId = :workspaceId)
      """)
  int deleteMembershipsInWorkspace(
      @Param("workspaceId") Long workspaceId, @Param("accountId") Long accountId);
}
