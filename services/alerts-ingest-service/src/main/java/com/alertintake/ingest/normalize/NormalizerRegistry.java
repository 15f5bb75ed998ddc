package com.alertintake.ingest.normalize;

import com.alertintake.ingest.channel.IntegrationType;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Maps each integration type to its normalizer; fails at startup on gaps or overlaps. */
@Component
public class NormalizerRegistry {

  private final Map<IntegrationType, IntegrationNormalizer> byType =
      new EnumMap<>(IntegrationType.class);

  public NormalizerRegistry(List<IntegrationNormalizer> normalizers) {
    for (IntegrationNormalizer n : normalizers) {
      for (IntegrationType type : n.supportedTypes()) {
        IntegrationNormalizer previous = byType.put(type, n);
        if (previous != null) {
          throw new IllegalStateException(
              "Integration "
                  + type.slug()
                  + " is claimed by both "
                  + previous.getClass().getSimpleName()
                  + " and "
                  + n.getClass().getSimpleName());
        }
      }
    }
    for (IntegrationType type : IntegrationType.values()) {
      if (!byType.containsKey(type)) {
        throw new IllegalStateException("No normalizer for integration " + type.slug());
      }
    }
  }

  public IntegrationNormalizer forType(IntegrationType type) {
    return byType.get(type);
  }
}
