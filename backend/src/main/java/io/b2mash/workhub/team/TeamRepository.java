package io.b2mash.workhub.team;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface TeamRepository extends JpaRepository<Team, Long> {

  List<Team> findByWorkspaceIdOrderByIdAsc(Long workspaceId);
}
