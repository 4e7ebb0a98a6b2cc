/*
 * どこで: Notification チャネル層
 * 何を: ブラウザ Push サービスへの暗号化送信を抽象化する
 * なぜ: VAPID 署名/暗号化ライブラリをアダプタのテストから切り離すため
 */
package com.example.orchestrator.notification.channel;

import java.io.IOException;
import java.security.GeneralSecurityException;

public interface WebPushGateway {

  /** VAPID 鍵が設定済みで送信可能か。 */
  boolean available();

  /**
   * 購読先へ暗号化ペイロードを送り、Push サービスの HTTP ステータスを返す。
   */
  int send(String endpoint, String p256dh, String auth, byte[] payload)
      throws IOException, GeneralSecurityException, InterruptedException;
}
