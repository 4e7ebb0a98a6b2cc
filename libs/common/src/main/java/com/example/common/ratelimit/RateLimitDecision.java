/*
 * どこで: Common レート制限
 * 何を: checkRateLimit の判定結果
 * なぜ: 例外ではなく retry-after 付きの値として呼び出し側に分岐させるため
 */
package com.example.common.ratelimit;

public record RateLimitDecision(boolean ok, long retryAfterSec) {

  private static final RateLimitDecision ALLOWED = new RateLimitDecision(true, 0L);

  public static RateLimitDecision allowed() {
    return ALLOWED;
  }

  public static RateLimitDecision rejected(long retryAfterSec) {
    return new RateLimitDecision(false, retryAfterSec);
  }
}
