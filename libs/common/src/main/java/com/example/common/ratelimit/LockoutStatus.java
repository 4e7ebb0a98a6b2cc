/*
 * どこで: Common レート制限
 * 何を: ロックアウト状態の判定結果
 * なぜ: ロック中かどうかと解除までの秒数を一緒に返すため
 */
package com.example.common.ratelimit;

public record LockoutStatus(boolean locked, long retryAfterSec) {

  private static final LockoutStatus UNLOCKED = new LockoutStatus(false, 0L);

  public static LockoutStatus unlocked() {
    return UNLOCKED;
  }

  public static LockoutStatus locked(long retryAfterSec) {
    return new LockoutStatus(true, retryAfterSec);
  }
}
