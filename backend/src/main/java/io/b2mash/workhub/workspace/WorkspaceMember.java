package io.b2mash.workhub.workspace;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

@Entity
@Table(name = "workspace_members")
public class WorkspaceMember {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "workspace_id", nullable = false, updatable = false)
  private Long workspaceId;

  @Column(name = "account_id", nullable = false, updatable = false)
  private Long accountId;

  @Column(name = "joined_at", nullable = false, updatable = false)
  private Instant joinedAt;

  protected WorkspaceMember() {}

  public WorkspaceMember(Long workspaceId, Long accountId) {
    this.workspaceId = workspaceId;
    this.accountId = accountId;
    this.joinedAt = Instant.now();
  }

  public Long getId() {
    return id;
  }

  public Long getWorkspaceId() {
    return workspaceId;
  }

  public Long getAccountId() {
    return accountId;
  }

  public Instant getJoinedAt() {
    return joinedAt;
  }
}
