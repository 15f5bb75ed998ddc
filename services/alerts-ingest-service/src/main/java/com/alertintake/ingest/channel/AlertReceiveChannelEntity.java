package com.alertintake.ingest.channel;

import jakarta.persistence.*;
import java.time.Instant;
import java.util.Objects;

@Entity
@Table(name = "alert_receive_channel")
public class AlertReceiveChannelEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "token", nullable = false, unique = true, length = 64, updatable = false)
  private String token;

  @Column(name = "integration", nullable = false, length = 64)
  private String integration;

  @Column(name = "organization_id", nullable = false)
  private Long organizationId;

  @Column(name = "author_user_id")
  private Long authorUserId;

  @Column(name = "created_at", nullable = false, updatable = false)
  private Instant createdAt;

  // set when the owner deactivates the channel
  @Column(name = "deleted_at")
  private Instant deletedAt;

  protected AlertReceiveChannelEntity() {
    // for JPA
  }

  public AlertReceiveChannelEntity(
      String token, String integration, Long organizationId, Long authorUserId) {
    this.token = token;
    this.integration = integration;
    this.organizationId = organizationId;
    this.authorUserId = authorUserId;
    this.createdAt = Instant.now();
  }

  public Long getId() {
    return id;
  }

  public String getToken() {
    return token;
  }

  public String getIntegration() {
    return integration;
  }

  public Long getOrganizationId() {
    return organizationId;
  }

  public Long getAuthorUserId() {
    return authorUserId;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public Instant getDeletedAt() {
    return deletedAt;
  }

  public void deactivate(Instant at) {
    this.deletedAt = at;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (o == null || getClass() != o.getClass()) {
      return false;
    }
    AlertReceiveChannelEntity that = (AlertReceiveChannelEntity) o;
    return Objects.equals(token, that.token);
  }

  @Override
  public int hashCode() {
    return Objects.hash(token);
  }
}
