/*
 * どこで: Common レート制限
 * 何を: 固定ウィンドウの上限回数とウィンドウ長を表現する
 * なぜ: 呼び出し側ごとに閾値を型安全に渡すため
 */
package com.example.common.ratelimit;

import java.time.Duration;
import java.util.Objects;

public record RateLimitRule(Duration window, int max) {

  public RateLimitRule {
    Objects.requireNonNull(window, "window is required");
    if (window.isZero() || window.isNegative()) {
      throw new IllegalArgumentException("window must be positive");
    }
    if (max < 1) {
      throw new IllegalArgumentException("max must be >= 1");
    }
  }

  public static RateLimitRule of(Duration window, int max) {
    return new RateLimitRule(window, max);
  }
}
