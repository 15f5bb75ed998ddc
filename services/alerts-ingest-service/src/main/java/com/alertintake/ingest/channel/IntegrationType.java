package com.alertintake.ingest.channel;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/** Integration kinds a channel can be created with, keyed by the slug used in URLs and storage. */
public enum IntegrationType {
  ALERTMANAGER("alertmanager", EndpointFamily.ALERTMANAGER),
  GRAFANA_ALERTING("grafana_alerting", EndpointFamily.ALERTMANAGER),
  GRAFANA("grafana", EndpointFamily.GRAFANA),
  AMAZON_SNS("amazon_sns", EndpointFamily.AMAZON_SNS),
  MAINTENANCE("maintenance", EndpointFamily.MAINTENANCE),

  WEBHOOK("webhook", EndpointFamily.UNIVERSAL),
  FORMATTED_WEBHOOK("formatted_webhook", EndpointFamily.UNIVERSAL),
  KAPACITOR("kapacitor", EndpointFamily.UNIVERSAL),
  ELASTALERT("elastalert", EndpointFamily.UNIVERSAL),
  DATADOG("datadog", EndpointFamily.UNIVERSAL),
  PAGERDUTY("pagerduty", EndpointFamily.UNIVERSAL),
  PINGDOM("pingdom", EndpointFamily.UNIVERSAL),
  PRTG("prtg", EndpointFamily.UNIVERSAL),
  SENTRY("sentry", EndpointFamily.UNIVERSAL),
  STACKDRIVER("stackdriver", EndpointFamily.UNIVERSAL),
  UPTIMEROBOT("uptimerobot", EndpointFamily.UNIVERSAL),
  NEWRELIC("newrelic", EndpointFamily.UNIVERSAL),
  ZABBIX("zabbix", EndpointFamily.UNIVERSAL),
  JIRA("jira", EndpointFamily.UNIVERSAL),
  ZENDESK("zendesk", EndpointFamily.UNIVERSAL);

  /** Groups integration types that share an HTTP endpoint contract. */
  public enum EndpointFamily {
    ALERTMANAGER,
    GRAFANA,
    AMAZON_SNS,
    MAINTENANCE,
    UNIVERSAL
  }

  private static final Map<String, IntegrationType> BY_SLUG =
      Arrays.stream(values()).collect(Collectors.toMap(IntegrationType::slug, Function.identity()));

  private final String slug;
  private final EndpointFamily family;

  IntegrationType(String slug, EndpointFamily family) {
    this.slug = slug;
    this.family = family;
  }

  public String slug() {
    return slug;
  }

  public EndpointFamily family() {
    return family;
  }

  public boolean isUniversal() {
    return family == EndpointFamily.UNIVERSAL;
  }

  public static Optional<IntegrationType> fromSlug(String slug) {
    if (slug == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(BY_SLUG.get(slug.trim().toLowerCase(Locale.ROOT)));
  }

  public static List<IntegrationType> universalTypes() {
    return Arrays.stream(values())
        .filter(IntegrationType::isUniversal)
        .collect(Collectors.toList());
  }
}
