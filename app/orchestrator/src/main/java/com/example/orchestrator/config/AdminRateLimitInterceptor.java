/*
 * どこで: Orchestrator Web 設定
 * 何を: ジョブ即時実行/テスト通知などの管理操作を送信元 IP 単位でレート制限する
 * なぜ: 外部チャネルやジョブ実行を連打で過負荷にしないため
 */
package com.example.orchestrator.config;

import com.example.common.ratelimit.RateLimitDecision;
import com.example.common.ratelimit.RateLimiter;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

@Component
@RequiredArgsConstructor
public class AdminRateLimitInterceptor implements HandlerInterceptor {

  private static final Logger logger = LoggerFactory.getLogger(AdminRateLimitInterceptor.class);
  private static final String KEY_PREFIX = "admin-action:";

  private final RateLimiter rateLimiter;
  private final RateLimitProperties properties;
  private final ApiErrorWriter errorWriter;

  @Override
  public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler)
      throws IOException {
    if (!"POST".equalsIgnoreCase(request.getMethod())) {
      return true;
    }
    final String clientIp = ClientIps.resolve(request, properties.trustForwardedFor());
    final RateLimitDecision decision =
        rateLimiter.checkRateLimit(KEY_PREFIX + clientIp, properties.adminAction().toRule());
    if (decision.ok()) {
      return true;
    }
    logger.warn(
        "admin action rate limited path={} retryAfterSec={}",
        request.getRequestURI(),
        decision.retryAfterSec());
    errorWriter.tooManyRequests(response, decision.retryAfterSec(), "too many admin actions");
    return false;
  }
}
