package io.b2mash.workhub.workspace;

import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface WorkspaceMemberRepository extends JpaRepository<WorkspaceMember, Long> {

  boolean existsByWorkspaceIdAndAccountId(Long workspaceId, Long accountId);

  Optional<WorkspaceMember> findByWorkspaceIdAndAccountId(Long workspaceId, Long accountId);

  List<WorkspaceMember> findByWorkspaceIdOrderByIdAsc(Long workspaceId);
}
