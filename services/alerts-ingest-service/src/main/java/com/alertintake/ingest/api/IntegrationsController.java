package com.alertintake.ingest.api;

import com.alertintake.ingest.channel.IntegrationType;
import com.alertintake.ingest.dispatch.DispatchOutcome;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Public webhook endpoints for monitoring tools. The body is read raw by the gateway, never bound
 * by Spring, so size and encoding are checked before parsing. Literal paths take precedence over
 * the universal {@code /{integrationType}/{token}} route.
 */
@RestController
@RequestMapping("/integrations/v1")
@RequiredArgsConstructor
public class IntegrationsController {

  private final IngestionGateway gateway;

  @PostMapping({"/alertmanager/{token}", "/alertmanager/{token}/"})
  public ResponseEntity<Map<String, Object>> alertmanager(
      @PathVariable String token, HttpServletRequest request) {
    return ack(gateway.ingest(IntegrationType.ALERTMANAGER, token, request));
  }

  @PostMapping({"/grafana_alerting/{token}", "/grafana_alerting/{token}/"})
  public ResponseEntity<Map<String, Object>> grafanaAlerting(
      @PathVariable String token, HttpServletRequest request) {
    return ack(gateway.ingest(IntegrationType.GRAFANA_ALERTING, token, request));
  }

  @PostMapping({"/grafana/{token}", "/grafana/{token}/"})
  public ResponseEntity<Map<String, Object>> grafana(
      @PathVariable String token, HttpServletRequest request) {
    return ack(gateway.ingest(IntegrationType.GRAFANA, token, request));
  }

  @PostMapping({"/amazon_sns/{token}", "/amazon_sns/{token}/"})
  public ResponseEntity<Map<String, Object>> amazonSns(
      @PathVariable String token, HttpServletRequest request) {
    return ack(gateway.ingest(IntegrationType.AMAZON_SNS, token, request));
  }

  @PostMapping({"/maintenance/{token}", "/maintenance/{token}/"})
  public ResponseEntity<Map<String, Object>> maintenance(
      @PathVariable String token, HttpServletRequest request) {
    return ack(gateway.ingest(IntegrationType.MAINTENANCE, token, request));
  }

  @PostMapping({"/{integrationType}/{token}", "/{integrationType}/{token}/"})
  public ResponseEntity<Map<String, Object>> universal(
      @PathVariable String integrationType,
      @PathVariable String token,
      HttpServletRequest request) {
    return ack(gateway.ingest(gateway.universalType(integrationType), token, request));
  }

  // content type is preset: tasks are already enqueued, Accept must not turn this into a 406
  private static ResponseEntity<Map<String, Object>> ack(DispatchOutcome outcome) {
    return ResponseEntity.ok()
        .contentType(MediaType.APPLICATION_JSON)
        .body(Map.of("ok", true, "enqueued", outcome.enqueued()));
  }
}
