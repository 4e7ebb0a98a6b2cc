/*
 * どこで: Common レート制限
 * 何を: キー単位の固定ウィンドウ制限と失敗回数ロックアウトをメモリ上で管理する
 * なぜ: ログインや管理操作など外部公開操作の濫用をプロセス内で同期的に防ぐため
 */
package com.example.common.ratelimit;

import com.google.common.annotations.VisibleForTesting;
import java.time.Clock;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * キー単位のレート制限とロックアウトを提供する。
 *
 * <p>各操作は {@link ConcurrentMap#compute} でキーごとに原子的に評価され、異なるキー同士は互いを待たない。
 * レート制限カウンタと失敗カウンタは別のマップで管理し、同じキーでも独立して数える。
 */
public class RateLimiter {

  private final Clock clock;
  private final ConcurrentMap<String, Window> rateLimits = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Window> lockouts = new ConcurrentHashMap<>();

  public RateLimiter(Clock clock) {
    this.clock = Objects.requireNonNull(clock, "clock is required");
  }

  /**
   * 固定ウィンドウのカウンタを進め、上限超過なら retry-after 秒を返す。
   *
   * <p>ウィンドウが経過した時点でカウンタは 0 からやり直す (部分減衰はしない)。
   */
  public RateLimitDecision checkRateLimit(String key, RateLimitRule rule) {
    requireKey(key);
    Objects.requireNonNull(rule, "rule is required");
    final long now = clock.millis();
    final RateLimitDecision[] decision = new RateLimitDecision[1];
    rateLimits.compute(
        key,
        (ignored, current) -> {
          if (current == null || current.resetAtMillis() <= now) {
            decision[0] = RateLimitDecision.allowed();
            return Window.start(now, rule.window().toMillis());
          }
          if (current.count() >= rule.max()) {
            decision[0] =
                RateLimitDecision.rejected(retryAfterSeconds(current.resetAtMillis() - now));
            return current;
          }
          decision[0] = RateLimitDecision.allowed();
          return current.increment();
        });
    return decision[0];
  }

  /** 読み取り専用のロックアウト判定。禁止期間が過ぎたエントリは解除済みとして扱う。 */
  public LockoutStatus checkLockout(String key, LockoutRule rule) {
    requireKey(key);
    Objects.requireNonNull(rule, "rule is required");
    final long now = clock.millis();
    final Window current = lockouts.get(key);
    if (current == null || !current.isBanned(now)) {
      return LockoutStatus.unlocked();
    }
    return LockoutStatus.locked(retryAfterSeconds(current.bannedUntilMillis() - now));
  }

  /** 失敗を 1 件記録し、ウィンドウ内で max に達したら ban の間ロックする。 */
  public LockoutStatus recordFailure(String key, LockoutRule rule) {
    requireKey(key);
    Objects.requireNonNull(rule, "rule is required");
    final long now = clock.millis();
    final LockoutStatus[] status = new LockoutStatus[1];
    lockouts.compute(
        key,
        (ignored, current) -> {
          if (current != null && current.isBanned(now)) {
            // ロック中の失敗では禁止期間を延長しない
            status[0] = LockoutStatus.locked(retryAfterSeconds(current.bannedUntilMillis() - now));
            return current;
          }
          final Window next =
              current == null || current.isExpired(now)
                  ? Window.start(now, rule.window().toMillis())
                  : current.increment();
          if (next.count() >= rule.max()) {
            final long bannedUntil = now + rule.ban().toMillis();
            status[0] = LockoutStatus.locked(retryAfterSeconds(rule.ban().toMillis()));
            return next.banUntil(bannedUntil);
          }
          status[0] = LockoutStatus.unlocked();
          return next;
        });
    return status[0];
  }

  /** 認証成功などで失敗カウンタとロックを解除する。 */
  public void clearFailures(String key) {
    requireKey(key);
    lockouts.remove(key);
  }

  /**
   * ウィンドウも禁止期間も終わったエントリを削除する。
   *
   * @return 削除したエントリ数
   */
  public int sweepExpired() {
    final long now = clock.millis();
    final int before = rateLimits.size() + lockouts.size();
    rateLimits.entrySet().removeIf(entry -> entry.getValue().isExpired(now));
    lockouts.entrySet().removeIf(entry -> entry.getValue().isExpired(now));
    return Math.max(0, before - rateLimits.size() - lockouts.size());
  }

  public int trackedKeys() {
    return rateLimits.size() + lockouts.size();
  }

  @VisibleForTesting
  static long retryAfterSeconds(long remainingMillis) {
    return Math.max(1L, (remainingMillis + 999L) / 1000L);
  }

  private static void requireKey(String key) {
    if (key == null || key.isBlank()) {
      throw new IllegalArgumentException("key is required");
    }
  }

  /** 不変のカウンタ状態。compute 内で置き換えるため共有しても安全。 */
  private record Window(int count, long resetAtMillis, long bannedUntilMillis) {

    static Window start(long now, long windowMillis) {
      return new Window(1, now + windowMillis, 0L);
    }

    Window increment() {
      return new Window(count + 1, resetAtMillis, bannedUntilMillis);
    }

    Window banUntil(long until) {
      return new Window(count, resetAtMillis, until);
    }

    boolean isBanned(long now) {
      return bannedUntilMillis > now;
    }

    boolean isExpired(long now) {
      // ban が明けた時点で失敗カウンタもリセットする
      return !isBanned(now) && (resetAtMillis <= now || bannedUntilMillis > 0L);
    }
  }
}
