/*
 * どこで: Notification サービス層
 * 何を: チャネル種別ごとの必須キー/秘密キー/値域を定義し、設定を検証する
 * なぜ: 不正な設定を送信時ではなく保存時に弾き、API 応答で秘密値を伏せるため
 */
package com.example.orchestrator.notification.service;

import com.example.orchestrator.notification.model.EndpointConfig;
import com.example.orchestrator.notification.model.EndpointType;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * チャネル種別ごとの設定スキーマ。
 *
 * <p>キー名は管理画面から保存される config JSON のキー (camelCase) に揃える。
 */
public final class EndpointConfigSchema {

  public static final Set<String> NTFY_AUTH_METHODS = Set.of("none", "basic", "token");
  public static final Set<String> EMAIL_ENCRYPTIONS = Set.of("none", "starttls", "tls");

  private static final ObjectMapper TEMPLATE_MAPPER = new ObjectMapper();

  private static final Map<EndpointType, Definition> DEFINITIONS =
      new EnumMap<>(EndpointType.class);

  static {
    DEFINITIONS.put(
        EndpointType.DISCORD,
        new Definition(
            List.of("webhookUrl"), Set.of("webhookUrl"), Set.of("webhookUrl", "botAvatarUrl")));
    DEFINITIONS.put(
        EndpointType.SLACK,
        new Definition(List.of("webhookUrl"), Set.of("webhookUrl"), Set.of("webhookUrl")));
    DEFINITIONS.put(
        EndpointType.WEBHOOK,
        new Definition(List.of("webhookUrl"), Set.of("authHeader"), Set.of("webhookUrl")));
    DEFINITIONS.put(
        EndpointType.TELEGRAM,
        new Definition(List.of("botToken", "chatId"), Set.of("botToken"), Set.of()));
    DEFINITIONS.put(
        EndpointType.PUSHOVER,
        new Definition(List.of("userKey", "apiToken"), Set.of("userKey", "apiToken"), Set.of()));
    DEFINITIONS.put(
        EndpointType.PUSHBULLET,
        new Definition(List.of("accessToken"), Set.of("accessToken"), Set.of()));
    DEFINITIONS.put(
        EndpointType.NTFY,
        new Definition(List.of("url", "topic"), Set.of("password", "token"), Set.of("url")));
    DEFINITIONS.put(
        EndpointType.GOTIFY,
        new Definition(List.of("url", "token"), Set.of("token"), Set.of("url")));
    DEFINITIONS.put(
        EndpointType.EMAIL,
        new Definition(
            List.of("senderAddress", "smtpHost", "recipient"), Set.of("authPass"), Set.of()));
    DEFINITIONS.put(
        EndpointType.WEB_PUSH,
        new Definition(List.of("endpoint", "p256dh", "auth"), Set.of("auth"), Set.of("endpoint")));
  }

  private EndpointConfigSchema() {}

  public static Set<String> secretKeys(EndpointType type) {
    return definition(type).secretKeys();
  }

  public static void validate(EndpointType type, EndpointConfig config) {
    final List<String> violations = violations(type, config);
    if (!violations.isEmpty()) {
      throw new InvalidEndpointConfigException(violations);
    }
  }

  public static List<String> violations(EndpointType type, EndpointConfig config) {
    if (type == null) {
      return List.of("type is required");
    }
    final Definition definition = definition(type);
    final List<String> violations = new ArrayList<>();
    for (String key : definition.requiredKeys()) {
      if (config.text(key).isEmpty()) {
        violations.add(key + " is required");
      }
    }
    for (String key : definition.urlKeys()) {
      config.text(key).filter(value -> !isHttpUrl(value)).ifPresent(
          value -> violations.add(key + " must be an http(s) URL"));
    }
    switch (type) {
      case PUSHOVER -> checkRange(config, "priority", -2, 2, violations);
      case NTFY -> validateNtfy(config, violations);
      case GOTIFY -> checkRange(config, "priority", 0, 10, violations);
      case EMAIL -> validateEmail(config, violations);
      case WEBHOOK -> validateWebhookTemplate(config, violations);
      case DISCORD -> {
        if (config.flag("enableMentions") && config.text("roleId").isEmpty()) {
          violations.add("roleId is required when enableMentions is true");
        }
      }
      default -> {
        // 追加検証なし
      }
    }
    return violations;
  }

  private static void validateNtfy(EndpointConfig config, List<String> violations) {
    checkRange(config, "priority", 1, 5, violations);
    final String authMethod = config.text("authMethod").orElse("none").toLowerCase(Locale.ROOT);
    if (!NTFY_AUTH_METHODS.contains(authMethod)) {
      violations.add("authMethod must be one of none, basic, token");
      return;
    }
    if ("basic".equals(authMethod)
        && (config.text("username").isEmpty() || config.text("password").isEmpty())) {
      violations.add("username and password are required for basic auth");
    }
    if ("token".equals(authMethod) && config.text("token").isEmpty()) {
      violations.add("token is required for token auth");
    }
  }

  private static void validateEmail(EndpointConfig config, List<String> violations) {
    checkRange(config, "smtpPort", 1, 65535, violations);
    final String encryption = config.text("encryption").orElse("none").toLowerCase(Locale.ROOT);
    if (!EMAIL_ENCRYPTIONS.contains(encryption)) {
      violations.add("encryption must be one of none, starttls, tls");
    }
    if (config.text("authUser").isPresent() && config.text("authPass").isEmpty()) {
      violations.add("authPass is required when authUser is set");
    }
    config.text("senderAddress").filter(value -> !value.contains("@")).ifPresent(
        value -> violations.add("senderAddress must be an email address"));
    config.text("recipient").filter(value -> !value.contains("@")).ifPresent(
        value -> violations.add("recipient must be an email address"));
  }

  private static void validateWebhookTemplate(EndpointConfig config, List<String> violations) {
    final Optional<String> template = config.text("jsonPayload");
    if (template.isEmpty()) {
      return;
    }
    try {
      TEMPLATE_MAPPER.readTree(template.get());
    } catch (JsonProcessingException ex) {
      violations.add("jsonPayload must be valid JSON");
    }
  }

  private static void checkRange(
      EndpointConfig config, String key, int min, int max, List<String> violations) {
    final Optional<Integer> value;
    try {
      value = config.integer(key);
    } catch (NumberFormatException ex) {
      violations.add(key + " must be a number");
      return;
    }
    value.filter(v -> v < min || v > max).ifPresent(
        v -> violations.add(key + " must be between " + min + " and " + max));
  }

  private static boolean isHttpUrl(String value) {
    try {
      final URI uri = new URI(value);
      final String scheme = uri.getScheme();
      return uri.getHost() != null
          && ("http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme));
    } catch (URISyntaxException ex) {
      return false;
    }
  }

  private static Definition definition(EndpointType type) {
    return DEFINITIONS.get(type);
  }

  private record Definition(
      List<String> requiredKeys, Set<String> secretKeys, Set<String> urlKeys) {}
}
