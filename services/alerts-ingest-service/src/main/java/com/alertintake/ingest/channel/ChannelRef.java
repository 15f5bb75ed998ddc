package com.alertintake.ingest.channel;

/** Routing projection of a {@link Channel} kept in memory by the routing cache. */
public record ChannelRef(long channelId, IntegrationType integrationType, long organizationId) {}
