/*
 * どこで: Notification チャネル層
 * 何を: web-push ライブラリで VAPID 署名付きの暗号化 Push を送る
 * なぜ: RFC 8291/8292 の暗号化と署名を自前実装しないため
 */
package com.example.orchestrator.notification.channel;

import com.example.orchestrator.config.NotificationDeliveryProperties;
import com.example.orchestrator.config.WebPushProperties;
import com.google.common.annotations.VisibleForTesting;
import java.io.IOException;
import java.net.SocketTimeoutException;
import java.security.GeneralSecurityException;
import java.security.Security;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import nl.martijndwars.webpush.Encoding;
import nl.martijndwars.webpush.Notification;
import nl.martijndwars.webpush.PushService;
import org.apache.http.HttpResponse;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.jose4j.lang.JoseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

@Component
public class VapidWebPushGateway implements WebPushGateway {

  private static final Logger logger = LoggerFactory.getLogger(VapidWebPushGateway.class);

  private final PushService pushService;
  private final Duration requestTimeout;

  public VapidWebPushGateway(
      WebPushProperties properties, NotificationDeliveryProperties deliveryProperties) {
    // PushService の HTTP クライアントにはソケットタイムアウトが無いため、待ち時間をここで区切る
    this.requestTimeout =
        deliveryProperties.httpConnectTimeout().plus(deliveryProperties.httpReadTimeout());
    if (!properties.configured()) {
      logger.info("web push disabled because VAPID keys are not configured");
      this.pushService = null;
      return;
    }
    if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null) {
      Security.addProvider(new BouncyCastleProvider());
    }
    try {
      this.pushService =
          new PushService(properties.publicKey(), properties.privateKey(), properties.subject());
    } catch (GeneralSecurityException ex) {
      throw new IllegalStateException("VAPID keys are invalid", ex);
    }
  }

  @Override
  public boolean available() {
    return pushService != null;
  }

  @Override
  public int send(String endpoint, String p256dh, String auth, byte[] payload)
      throws IOException, GeneralSecurityException, InterruptedException {
    if (pushService == null) {
      throw new IllegalStateException("web push is not configured");
    }
    final Notification notification = new Notification(endpoint, p256dh, auth, payload);
    final Future<HttpResponse> response;
    try {
      response = pushService.sendAsync(notification, Encoding.AES128GCM);
    } catch (JoseException ex) {
      throw new GeneralSecurityException("VAPID signing failed", ex);
    }
    return awaitStatus(response, requestTimeout);
  }

  /**
   * 応答を最大 {@code timeout} だけ待つ。期限切れなら要求を取り消し、{@link SocketTimeoutException}
   * として返す。
   */
  @VisibleForTesting
  static int awaitStatus(Future<HttpResponse> response, Duration timeout)
      throws IOException, InterruptedException {
    try {
      final HttpResponse answered = response.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
      return answered.getStatusLine().getStatusCode();
    } catch (TimeoutException ex) {
      response.cancel(true);
      final SocketTimeoutException timedOut =
          new SocketTimeoutException(
              "push service did not answer within " + timeout.toMillis() + "ms");
      timedOut.initCause(ex);
      throw timedOut;
    } catch (InterruptedException ex) {
      response.cancel(true);
      throw ex;
    } catch (ExecutionException ex) {
      final Throwable cause = ex.getCause();
      if (cause instanceof IOException io) {
        throw io;
      }
      throw new IOException("web push request failed", cause);
    }
  }
}
