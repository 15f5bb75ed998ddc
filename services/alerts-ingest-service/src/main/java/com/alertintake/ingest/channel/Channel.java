package com.alertintake.ingest.channel;

/** A configured alert destination as stored in the durable channel table. */
public record Channel(
    long id,
    String token,
    IntegrationType integrationType,
    long organizationId,
    Long authorUserId) {

  public ChannelRef toRef() {
    return new ChannelRef(id, integrationType, organizationId);
  }
}
