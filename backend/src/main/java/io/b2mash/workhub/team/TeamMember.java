package io.b2mash.workhub.team;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

@Entity
@Table(name = "team_members")
public class TeamMember {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "team_id", nullable = false, updatable = false)
  private Long teamId;

  @Column(name = "account_id", nullable = false, updatable = false)
  private Long accountId;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  protected TeamMember() {}

  public TeamMember(Long teamId, Long accountId) {
    this.teamId = teamId;
    this.accountId = accountId;
    this.createdAt = Instant.now();
  }

  public Long getId() {
    return id;
  }

  public Long getTeamId() {
    return teamId;
  }

  public Long getAccountId() {
    return accountId;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }
}
