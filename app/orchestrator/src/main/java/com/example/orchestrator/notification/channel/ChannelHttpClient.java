/*
 * どこで: Notification チャネル層
 * 何を: HTTP 系チャネル共通の POST 実行と失敗分類を行う
 * なぜ: Webhook/トークン型アダプタごとに例外変換を重複させないため
 */
package com.example.orchestrator.notification.channel;

import com.example.orchestrator.config.NotificationDeliveryProperties;
import com.example.orchestrator.notification.model.DeliveryError;
import com.example.orchestrator.notification.model.DeliveryResult;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.net.SocketTimeoutException;
import java.net.URI;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestClientResponseException;

@Component
public class ChannelHttpClient {

  public static final Consumer<HttpHeaders> NO_HEADERS = headers -> {};

  private static final Logger logger = LoggerFactory.getLogger(ChannelHttpClient.class);

  private final RestClient notificationRestClient;
  private final int errorMessageMaxLength;

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "RestClient は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  public ChannelHttpClient(
      RestClient notificationRestClient, NotificationDeliveryProperties properties) {
    this.notificationRestClient = notificationRestClient;
    this.errorMessageMaxLength = properties.errorMessageMaxLength();
  }

  public DeliveryResult postJson(String url, Object body, Consumer<HttpHeaders> headers) {
    return post(url, MediaType.APPLICATION_JSON, body, headers);
  }

  public DeliveryResult postForm(
      String url, MultiValueMap<String, String> form, Consumer<HttpHeaders> headers) {
    return post(url, MediaType.APPLICATION_FORM_URLENCODED, form, headers);
  }

  public DeliveryResult postText(String url, String body, Consumer<HttpHeaders> headers) {
    return post(url, MediaType.TEXT_PLAIN, body, headers);
  }

  private DeliveryResult post(
      String url, MediaType contentType, Object body, Consumer<HttpHeaders> headers) {
    final URI uri;
    try {
      uri = URI.create(url);
    } catch (IllegalArgumentException ex) {
      return DeliveryResult.failure(DeliveryError.Kind.INVALID_CONFIG, "url is invalid");
    }
    try {
      notificationRestClient
          .post()
          .uri(uri)
          .contentType(contentType)
          .headers(headers)
          .body(body)
          .retrieve()
          .toBodilessEntity();
      return DeliveryResult.success();
    } catch (RestClientResponseException ex) {
      logger.warn(
          "notification channel request failed with http status={} host={}",
          ex.getStatusCode().value(),
          uri.getHost());
      return DeliveryResult.failure(
          DeliveryError.httpStatus(
              ex.getStatusCode().value(), truncate(ex.getResponseBodyAsString())));
    } catch (ResourceAccessException ex) {
      if (isTimeout(ex)) {
        logger.warn("notification channel request timed out host={}", uri.getHost());
        return DeliveryResult.failure(DeliveryError.Kind.TIMEOUT, "request timed out");
      }
      logger.warn("notification channel connection failed host={}", uri.getHost(), ex);
      return DeliveryResult.failure(DeliveryError.Kind.NETWORK, truncate(ex.getMessage()));
    } catch (RestClientException ex) {
      logger.warn("notification channel request could not be written host={}", uri.getHost(), ex);
      return DeliveryResult.failure(DeliveryError.Kind.INTERNAL, truncate(ex.getMessage()));
    }
  }

  String truncate(String value) {
    if (value == null) {
      return "";
    }
    return value.length() <= errorMessageMaxLength
        ? value
        : value.substring(0, errorMessageMaxLength);
  }

  static boolean isTimeout(Throwable ex) {
    Throwable current = ex;
    while (current != null) {
      if (current instanceof SocketTimeoutException) {
        return true;
      }
      current = current.getCause();
    }
    return false;
  }
}
