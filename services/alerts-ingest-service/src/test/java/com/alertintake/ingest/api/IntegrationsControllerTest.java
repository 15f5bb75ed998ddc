package com.alertintake.ingest.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.verifyNoMoreInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.alertintake.ingest.cache.ChannelRoutingCache;
import com.alertintake.ingest.channel.Channel;
import com.alertintake.ingest.channel.ChannelStore;
import com.alertintake.ingest.channel.IntegrationType;
import com.alertintake.ingest.common.web.EnqueueFailureException;
import com.alertintake.ingest.common.web.RateLimitExceededException;
import com.alertintake.ingest.dispatch.AlertTasks;
import com.alertintake.ingest.dispatch.TaskQueue;
import com.alertintake.ingest.ratelimit.IntegrationRateLimitService;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;
import org.mockito.InOrder;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.ResultActions;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class IntegrationsControllerTest {

  private static final long ORG_ID = 7L;

  @Autowired MockMvc mvc;

  @Autowired ObjectMapper objectMapper;

  @Autowired ChannelRoutingCache cache;

  @MockBean ChannelStore store;

  @MockBean TaskQueue taskQueue;

  @MockBean IntegrationRateLimitService rateLimit;

  private static long pk(IntegrationType type) {
    return 100L + type.ordinal();
  }

  private static String token(IntegrationType type) {
    return "token-" + type.slug();
  }

  @BeforeEach
  void populateCache() {
    List<Channel> channels = new ArrayList<>();
    for (IntegrationType type : IntegrationType.values()) {
      channels.add(new Channel(pk(type), token(type), type, ORG_ID, 1L));
    }
    when(store.listAllChannels()).thenReturn(channels);
    assertThat(cache.refresh().success()).isTrue();
    clearInvocations(store);
  }

  private void takeDatabaseDown() {
    when(store.listAllChannels())
        .thenThrow(new DataAccessResourceFailureException("Database access disabled"));
    assertThat(cache.refresh().success()).isFalse();
    clearInvocations(store);
  }

  private ResultActions postJson(String url, String body) throws Exception {
    return mvc.perform(post(url).contentType(MediaType.APPLICATION_JSON).content(body));
  }

  private Map<String, Object> createAlertKwargs(long channelPk, String rawJson) throws Exception {
    Map<String, Object> kwargs = new LinkedHashMap<>();
    kwargs.put("title", null);
    kwargs.put("message", null);
    kwargs.put("image_url", null);
    kwargs.put("link_to_upstream_details", null);
    kwargs.put("alert_receive_channel_pk", channelPk);
    kwargs.put("integration_unique_data", null);
    kwargs.put("raw_request_data", objectMapper.readTree(rawJson));
    return kwargs;
  }

  private void assertUniversalEnqueue(IntegrationType type) throws Exception {
    postJson("/integrations/v1/" + type.slug() + "/" + token(type), "{\"foo\":\"bar\"}")
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.ok").value(true))
        .andExpect(jsonPath("$.enqueued").value(1));

    verify(taskQueue)
        .enqueue(
            AlertTasks.CREATE_ALERT, List.of(), createAlertKwargs(pk(type), "{\"foo\":\"bar\"}"));
    verifyNoMoreInteractions(taskQueue);
  }

  private void assertGrafanaFanOut() throws Exception {
    String body = "{\"alerts\":[{\"foo\":123},{\"foo\":456}]}";
    JsonNode alerts = objectMapper.readTree(body).get("alerts");

    postJson("/integrations/v1/grafana/" + token(IntegrationType.GRAFANA), body)
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.enqueued").value(2));

    long channelPk = pk(IntegrationType.GRAFANA);
    InOrder order = inOrder(taskQueue);
    order
        .verify(taskQueue)
        .enqueue(
            AlertTasks.CREATE_ALERTMANAGER_ALERTS, List.of(channelPk, alerts.get(0)), Map.of());
    order
        .verify(taskQueue)
        .enqueue(
            AlertTasks.CREATE_ALERTMANAGER_ALERTS, List.of(channelPk, alerts.get(1)), Map.of());
    verifyNoMoreInteractions(taskQueue);
  }

  @ParameterizedTest
  @EnumSource(
      value = IntegrationType.class,
      mode = EnumSource.Mode.EXCLUDE,
      names = {"AMAZON_SNS", "GRAFANA", "ALERTMANAGER", "GRAFANA_ALERTING", "MAINTENANCE"})
  void universalEndpointEnqueuesOneFixedShapeAlert(IntegrationType type) throws Exception {
    assertUniversalEnqueue(type);
    verifyNoInteractions(store);
  }

  @ParameterizedTest
  @EnumSource(
      value = IntegrationType.class,
      mode = EnumSource.Mode.EXCLUDE,
      names = {"AMAZON_SNS", "GRAFANA", "ALERTMANAGER", "GRAFANA_ALERTING", "MAINTENANCE"})
  void universalEndpointWorksWithoutDatabase(IntegrationType type) throws Exception {
    takeDatabaseDown();

    assertUniversalEnqueue(type);
    verifyNoInteractions(store);
  }

  @ParameterizedTest
  @EnumSource(
      value = IntegrationType.class,
      mode = EnumSource.Mode.EXCLUDE,
      names = {"AMAZON_SNS", "GRAFANA", "ALERTMANAGER", "GRAFANA_ALERTING", "MAINTENANCE"})
  void universalEndpointDoesNotAllowFiles(IntegrationType type) throws Exception {
    MockMultipartFile file =
        new MockMultipartFile(
            "f", "testing", "application/octet-stream", "file_content".getBytes());

    mvc.perform(
            multipart("/integrations/v1/" + type.slug() + "/" + token(type))
                .file(file)
                .param("foo", "bar"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("UNSUPPORTED_CONTENT_TYPE"));

    verifyNoInteractions(taskQueue);
  }

  @Test
  void acknowledgesWithJsonWhateverTheSenderAccepts() throws Exception {
    mvc.perform(
            post("/integrations/v1/webhook/" + token(IntegrationType.WEBHOOK))
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.TEXT_PLAIN)
                .content("{\"foo\":\"bar\"}"))
        .andExpect(status().isOk())
        .andExpect(content().contentTypeCompatibleWith(MediaType.APPLICATION_JSON))
        .andExpect(jsonPath("$.enqueued").value(1));

    verify(taskQueue).enqueue(anyString(), anyList(), anyMap());
  }

  @Test
  void rejectionIsJsonWhateverTheSenderAccepts() throws Exception {
    mvc.perform(
            post("/integrations/v1/webhook/no-such-token")
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.TEXT_PLAIN)
                .content("{}"))
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("UNKNOWN_CHANNEL"));
  }

  @Test
  void universalEndpointAcceptsFormEncodedBody() throws Exception {
    IntegrationType type = IntegrationType.WEBHOOK;

    mvc.perform(
            post("/integrations/v1/webhook/" + token(type))
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .content("foo=bar"))
        .andExpect(status().isOk());

    verify(taskQueue)
        .enqueue(
            AlertTasks.CREATE_ALERT, List.of(), createAlertKwargs(pk(type), "{\"foo\":\"bar\"}"));
  }

  @Test
  void universalEndpointRejectsTokenOfAnotherIntegration() throws Exception {
    postJson("/integrations/v1/webhook/" + token(IntegrationType.SENTRY), "{\"foo\":\"bar\"}")
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("WRONG_ENDPOINT"));

    verifyNoInteractions(taskQueue);
  }

  @Test
  void universalEndpointRejectsUnknownIntegrationType() throws Exception {
    postJson("/integrations/v1/carrier_pigeon/" + token(IntegrationType.WEBHOOK), "{}")
        .andExpect(status().isBadRequest());

    verifyNoInteractions(taskQueue);
  }

  @Test
  void grafanaEndpointRejectsGrafanaAlertingChannel() throws Exception {
    postJson("/integrations/v1/grafana/" + token(IntegrationType.GRAFANA_ALERTING), "{}")
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("WRONG_ENDPOINT"));

    verifyNoInteractions(taskQueue);
  }

  @Test
  void alertmanagerEndpointRejectsGrafanaAlertingChannel() throws Exception {
    postJson(
            "/integrations/v1/alertmanager/" + token(IntegrationType.GRAFANA_ALERTING),
            "{\"alerts\":[{\"status\":\"firing\"}]}")
        .andExpect(status().isBadRequest());

    verifyNoInteractions(taskQueue);
  }

  @Test
  void alertmanagerEndpointRejectsGrafanaAlertingPayload() throws Exception {
    postJson(
            "/integrations/v1/alertmanager/" + token(IntegrationType.ALERTMANAGER),
            "{\"orgId\":1,\"alerts\":[{\"status\":\"firing\"}]}")
        .andExpect(status().isBadRequest());

    verifyNoInteractions(taskQueue);
  }

  @Test
  void alertmanagerEndpointFansOutAlerts() throws Exception {
    String body = "{\"status\":\"firing\",\"alerts\":[{\"a\":1},{\"a\":2},{\"a\":3}]}";

    postJson("/integrations/v1/alertmanager/" + token(IntegrationType.ALERTMANAGER) + "/", body)
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.enqueued").value(3));
  }

  @Test
  void alertmanagerEndpointWithoutAlertsKeyIsMalformed() throws Exception {
    postJson("/integrations/v1/alertmanager/" + token(IntegrationType.ALERTMANAGER), "{}")
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("MALFORMED_PAYLOAD"));

    verifyNoInteractions(taskQueue);
  }

  @Test
  void grafanaAlertingEndpointAcceptsItsPayload() throws Exception {
    postJson(
            "/integrations/v1/grafana_alerting/" + token(IntegrationType.GRAFANA_ALERTING),
            "{\"orgId\":1,\"alerts\":[{\"status\":\"firing\"}]}")
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.enqueued").value(1));
  }

  @Test
  void grafanaEndpointHasAlerts() throws Exception {
    assertGrafanaFanOut();
  }

  @Test
  void grafanaEndpointWithoutDatabaseHasAlerts() throws Exception {
    takeDatabaseDown();

    assertGrafanaFanOut();
    verifyNoInteractions(store);
  }

  @Test
  void grafanaEndpointWithEmptyAlertsSucceedsWithoutTasks() throws Exception {
    postJson("/integrations/v1/grafana/" + token(IntegrationType.GRAFANA), "{\"alerts\":[]}")
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.enqueued").value(0));

    verifyNoInteractions(taskQueue);
  }

  @Test
  void grafanaEndpointWithoutAlertsKeyIsLegacyNotification() throws Exception {
    postJson(
            "/integrations/v1/grafana/" + token(IntegrationType.GRAFANA),
            "{\"title\":\"[Alerting] CPU\",\"ruleUrl\":\"http://grafana/rule/1\"}")
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.enqueued").value(1));

    verify(taskQueue).enqueue(anyString(), anyList(), anyMap());
  }

  @Test
  void amazonSnsNotificationSentAsTextPlain() throws Exception {
    mvc.perform(
            post("/integrations/v1/amazon_sns/" + token(IntegrationType.AMAZON_SNS))
                .contentType("text/plain; charset=UTF-8")
                .content("{\"Type\":\"Notification\",\"Subject\":\"ALARM\",\"Message\":\"cpu\"}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.enqueued").value(1));
  }

  @Test
  void maintenanceEndpointEnqueuesOneAlert() throws Exception {
    postJson(
            "/integrations/v1/maintenance/" + token(IntegrationType.MAINTENANCE),
            "{\"title\":\"db upgrade\"}")
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.enqueued").value(1));
  }

  @Test
  void unknownTokenIsNotFound() throws Exception {
    postJson("/integrations/v1/webhook/no-such-token", "{\"foo\":\"bar\"}")
        .andExpect(status().isNotFound())
        .andExpect(jsonPath("$.code").value("UNKNOWN_CHANNEL"));

    verifyNoInteractions(taskQueue);
  }

  @Test
  void invalidJsonIsBadRequestWithDetailInDebugMode() throws Exception {
    postJson("/integrations/v1/webhook/" + token(IntegrationType.WEBHOOK), "{\"foo\":")
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("MALFORMED_PAYLOAD"))
        .andExpect(jsonPath("$.detail").isNotEmpty());

    verifyNoInteractions(taskQueue);
  }

  @Test
  void unsupportedContentTypeIsBadRequest() throws Exception {
    mvc.perform(
            post("/integrations/v1/grafana/" + token(IntegrationType.GRAFANA))
                .contentType(MediaType.APPLICATION_XML)
                .content("<alerts/>"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("UNSUPPORTED_CONTENT_TYPE"));
  }

  @Test
  void rateLimitedRequestIsRejectedBeforeEnqueue() throws Exception {
    doThrow(new RateLimitExceededException("Rate-limit has been reached"))
        .when(rateLimit)
        .check(any());

    postJson("/integrations/v1/webhook/" + token(IntegrationType.WEBHOOK), "{\"foo\":\"bar\"}")
        .andExpect(status().isTooManyRequests());

    verifyNoInteractions(taskQueue);
  }

  @Test
  void enqueueFailureIsLoggedAndStillAcknowledged() throws Exception {
    doThrow(new EnqueueFailureException("queue down", null))
        .when(taskQueue)
        .enqueue(anyString(), anyList(), anyMap());

    postJson("/integrations/v1/webhook/" + token(IntegrationType.WEBHOOK), "{\"foo\":\"bar\"}")
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.enqueued").value(0));
  }
}
