/*
 * どこで: Scheduler 組み込みジョブ
 * 何を: 期限切れのレート制限/ロックアウトエントリを掃除する
 * なぜ: 一度きりのクライアントのキーがメモリに残り続けないようにするため
 */
package com.example.orchestrator.scheduler.handler;

import com.example.common.ratelimit.RateLimiter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RateLimitSweepJobHandler implements JobHandler {

  public static final String NAME = "rate-limit-sweep";

  private final RateLimiter rateLimiter;

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public String description() {
    return "Removes expired rate limit and lockout entries";
  }

  @Override
  public long defaultIntervalSeconds() {
    return 300;
  }

  @Override
  public String run() {
    final int removed = rateLimiter.sweepExpired();
    return "removed " + removed + " entries, tracking " + rateLimiter.trackedKeys();
  }
}
