/*
 * どこで: Orchestrator 設定バインド
 * 何を: 管理操作のレート制限と内部トークンのロックアウト設定を保持する
 * なぜ: 閾値を環境ごとに調整できるようにするため
 */
package com.example.orchestrator.config;

import com.example.common.ratelimit.LockoutRule;
import com.example.common.ratelimit.RateLimitRule;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * @param trustForwardedFor true ならレート制限キーに X-Forwarded-For の先頭を使う。信頼できるリバース
 *     プロキシが付け直す構成でのみ有効にする。false なら接続元アドレスを使う
 */
@ConfigurationProperties(prefix = "rate-limit")
public record RateLimitProperties(
    Window adminAction, Lockout internalToken, boolean trustForwardedFor) {

  public RateLimitProperties {
    adminAction = adminAction == null ? new Window(null, 0) : adminAction;
    internalToken = internalToken == null ? new Lockout(null, 0, null) : internalToken;
  }

  public record Window(Duration window, int max) {

    public Window {
      window = window == null ? Duration.ofMinutes(1) : window;
      max = max <= 0 ? 10 : max;
    }

    public RateLimitRule toRule() {
      return RateLimitRule.of(window, max);
    }
  }

  public record Lockout(Duration window, int max, Duration ban) {

    public Lockout {
      window = window == null ? Duration.ofMinutes(10) : window;
      max = max <= 0 ? 5 : max;
      ban = ban == null ? Duration.ofMinutes(15) : ban;
    }

    public LockoutRule toRule() {
      return LockoutRule.of(window, max, ban);
    }
  }
}
