/*
 * どこで: Common レート制限
 * 何を: 失敗回数によるロックアウト閾値 (ウィンドウ/上限/禁止期間) を表現する
 * なぜ: 認証系の失敗カウンタをレート制限とは別の規則で扱うため
 */
package com.example.common.ratelimit;

import java.time.Duration;
import java.util.Objects;

public record LockoutRule(Duration window, int max, Duration ban) {

  public LockoutRule {
    Objects.requireNonNull(window, "window is required");
    Objects.requireNonNull(ban, "ban is required");
    if (window.isZero() || window.isNegative()) {
      throw new IllegalArgumentException("window must be positive");
    }
    if (ban.isZero() || ban.isNegative()) {
      throw new IllegalArgumentException("ban must be positive");
    }
    if (max < 1) {
      throw new IllegalArgumentException("max must be >= 1");
    }
  }

  public static LockoutRule of(Duration window, int max, Duration ban) {
    return new LockoutRule(window, max, ban);
  }
}
