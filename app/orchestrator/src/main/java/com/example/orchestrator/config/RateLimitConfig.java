/*
 * どこで: Orchestrator 設定
 * 何を: プロセス共有の RateLimiter を Bean 登録する
 * なぜ: インターセプタと掃除ジョブが同じカウンタを参照するため
 */
package com.example.orchestrator.config;

import com.example.common.ratelimit.RateLimiter;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RateLimitConfig {

  @Bean
  public RateLimiter rateLimiter(Clock clock) {
    return new RateLimiter(clock);
  }
}
