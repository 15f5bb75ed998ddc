package com.alertintake.ingest.normalize;

import com.alertintake.ingest.channel.ChannelRef;
import com.alertintake.ingest.channel.IntegrationType;
import com.alertintake.ingest.common.web.MalformedPayloadException;
import com.alertintake.ingest.dispatch.AlertTask;
import com.alertintake.ingest.guard.InboundPayload;
import com.alertintake.ingest.guard.PayloadFormat;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Amazon SNS HTTP(S) subscription messages. SNS posts a JSON envelope as {@code text/plain}; only
 * {@code Notification} messages become alerts.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AmazonSnsNormalizer implements IntegrationNormalizer {

  private final ObjectMapper objectMapper;

  @Override
  public Set<IntegrationType> supportedTypes() {
    return Set.of(IntegrationType.AMAZON_SNS);
  }

  @Override
  public Set<PayloadFormat> acceptedFormats() {
    return Set.of(PayloadFormat.JSON, PayloadFormat.TEXT);
  }

  @Override
  public List<AlertTask> normalize(ChannelRef channel, InboundPayload payload) {
    JsonNode body = Payloads.requireObject(payload.body(), "Amazon SNS");
    String type = Payloads.text(body, "Type");
    if (type == null) {
      throw new MalformedPayloadException("'Type' is required");
    }

    switch (type) {
      case "SubscriptionConfirmation", "UnsubscribeConfirmation" -> {
        // confirming is done by the channel owner through SubscribeURL
        log.info(
            "SNS {} for channel {} topic={} subscribeUrl={}",
            type,
            channel.channelId(),
            Payloads.text(body, "TopicArn"),
            Payloads.text(body, "SubscribeURL"));
        return List.of();
      }
      case "Notification" -> {
        String message = Payloads.text(body, "Message");
        NormalizedAlert alert =
            new NormalizedAlert(
                Payloads.text(body, "Subject"),
                message,
                null,
                null,
                channel.channelId(),
                Payloads.text(body, "MessageId"),
                innerMessageOr(body, message));
        return List.of(AlertTask.createAlert(alert));
      }
      default -> throw new MalformedPayloadException("Unsupported SNS message type '" + type + "'");
    }
  }

  /** The notification's own JSON document when Message carries one, else the whole envelope. */
  private JsonNode innerMessageOr(JsonNode envelope, String message) {
    if (message == null || message.isBlank()) {
      return envelope;
    }
    try {
      JsonNode inner = objectMapper.readTree(message);
      return inner != null && inner.isObject() ? inner : envelope;
    } catch (JsonProcessingException e) {
      return envelope;
    }
  }
}
