package com.alertintake.ingest.channel;

import java.util.List;

/**
 * Durable source of channels.
 *
 * <p>Only the routing cache refresh reads from it; request handling never does.
 */
public interface ChannelStore {

  /** Returns every active channel; throws when the store cannot be reached. */
  List<Channel> listAllChannels();
}
