/*
 * どこで: Orchestrator Web 設定
 * 何を: リクエストの送信元 IP を解決する
 * なぜ: クライアントが送るヘッダをレート制限キーに使うかどうかを設定で切り替えるため
 */
package com.example.orchestrator.config;

import jakarta.servlet.http.HttpServletRequest;

public final class ClientIps {

  private ClientIps() {}

  /** ログ用。X-Forwarded-For があればその先頭を採用する。 */
  public static String resolve(HttpServletRequest request) {
    return resolve(request, true);
  }

  /**
   * レート制限キー用。{@code trustForwardedFor} が false なら X-Forwarded-For を無視し、
   * 接続元アドレスを返す。
   */
  public static String resolve(HttpServletRequest request, boolean trustForwardedFor) {
    if (!trustForwardedFor) {
      return request.getRemoteAddr();
    }
    final String xForwardedFor = request.getHeader("X-Forwarded-For");
    if (xForwardedFor == null || xForwardedFor.isBlank()) {
      return request.getRemoteAddr();
    }
    final int commaIndex = xForwardedFor.indexOf(',');
    if (commaIndex < 0) {
      return xForwardedFor.trim();
    }
    return xForwardedFor.substring(0, commaIndex).trim();
  }
}
