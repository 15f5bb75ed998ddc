package com.alertintake.ingest.channel;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface AlertReceiveChannelRepository
    extends JpaRepository<AlertReceiveChannelEntity, Long> {

  List<AlertReceiveChannelEntity> findAllByDeletedAtIsNullOrderByIdAsc();
}
