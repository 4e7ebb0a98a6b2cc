package com.example.orchestrator.notification.channel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.http.HttpMethod.POST;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;

import com.example.orchestrator.notification.model.DeliveryError;
import com.example.orchestrator.notification.model.DeliveryResult;
import com.example.orchestrator.notification.model.EndpointConfig;
import com.example.orchestrator.notification.model.NotificationEventType;
import com.example.orchestrator.notification.model.NotificationPayload;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;

class DiscordChannelAdapterTest {

  private static final Clock CLOCK =
      Clock.fixed(Instant.parse("2026-03-01T00:00:00Z"), ZoneOffset.UTC);
  private static final NotificationPayload AVAILABLE =
      NotificationPayload.of(
              NotificationEventType.REQUEST_AVAILABLE, "Dune (2021)", "Ready to watch")
          .withField("Requested By", "alice");

  @Test
  void sendPostsEmbedToWebhook() {
    final HttpFixture fixture = HttpFixture.create();
    fixture
        .server()
        .expect(requestTo("https://discord.test/api/webhooks/1/abc"))
        .andExpect(method(POST))
        .andExpect(jsonPath("$.embeds[0].title").value("Dune (2021)"))
        .andExpect(
            jsonPath("$.embeds[0].color").value(NotificationEventType.REQUEST_AVAILABLE.color()))
        .andExpect(jsonPath("$.embeds[0].footer.text").value("Media Portal"))
        .andExpect(jsonPath("$.embeds[0].fields[0].name").value("Requested By"))
        .andExpect(jsonPath("$.username").value("Portal Bot"))
        .andRespond(withStatus(HttpStatus.NO_CONTENT));
    final DiscordChannelAdapter adapter =
        new DiscordChannelAdapter(fixture.client(), HttpFixture.PROPERTIES, CLOCK);

    final DeliveryResult result =
        adapter.send(
            new EndpointConfig(
                Map.of(
                    "webhookUrl", "https://discord.test/api/webhooks/1/abc",
                    "botUsername", "Portal Bot")),
            AVAILABLE);

    assertThat(result.ok()).isTrue();
    fixture.server().verify();
  }

  @Test
  void mentionsRoleOnlyWhenEnabled() {
    final DiscordChannelAdapter adapter =
        new DiscordChannelAdapter(HttpFixture.create().client(), HttpFixture.PROPERTIES, CLOCK);

    final Map<String, Object> withMention =
        adapter.buildBody(
            new EndpointConfig(Map.of("enableMentions", true, "roleId", "42")), AVAILABLE);
    final Map<String, Object> withoutMention =
        adapter.buildBody(new EndpointConfig(Map.of("roleId", "42")), AVAILABLE);

    assertThat(withMention.get("content")).isEqualTo("<@&42>");
    assertThat(withMention.get("allowed_mentions")).isEqualTo(Map.of("roles", List.of("42")));
    assertThat(withoutMention).doesNotContainKey("content");
  }

  @Test
  void rateLimitedResponseIsHttpStatusFailure() {
    final HttpFixture fixture = HttpFixture.create();
    fixture
        .server()
        .expect(requestTo("https://discord.test/api/webhooks/1/abc"))
        .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));
    final DiscordChannelAdapter adapter =
        new DiscordChannelAdapter(fixture.client(), HttpFixture.PROPERTIES, CLOCK);

    final DeliveryResult result =
        adapter.send(
            new EndpointConfig(Map.of("webhookUrl", "https://discord.test/api/webhooks/1/abc")),
            AVAILABLE);

    assertThat(result.error().kind()).isEqualTo(DeliveryError.Kind.HTTP_STATUS);
    assertThat(result.error().httpStatus()).isEqualTo(429);
  }
}
