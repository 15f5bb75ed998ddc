package com.alertintake.ingest.channel;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
@RequiredArgsConstructor
@Slf4j
public class JpaChannelStore implements ChannelStore {

  private final AlertReceiveChannelRepository repository;

  @Override
  @Transactional(readOnly = true)
  public List<Channel> listAllChannels() {
    List<AlertReceiveChannelEntity> rows = repository.findAllByDeletedAtIsNullOrderByIdAsc();
    List<Channel> out = new ArrayList<>(rows.size());
    for (AlertReceiveChannelEntity row : rows) {
      Optional<IntegrationType> type = IntegrationType.fromSlug(row.getIntegration());
      if (type.isEmpty()) {
        log.warn(
            "Skipping channel id={} with unsupported integration '{}'",
            row.getId(),
            row.getIntegration());
        continue;
      }
      out.add(
          new Channel(
              row.getId(),
              row.getToken(),
              type.get(),
              row.getOrganizationId(),
              row.getAuthorUserId()));
    }
    return out;
  }
}
