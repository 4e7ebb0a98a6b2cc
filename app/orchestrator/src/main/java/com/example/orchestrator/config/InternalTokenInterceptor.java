/*
 * どこで: Orchestrator Web 設定
 * 何を: 内部イベント受付 API の共有トークンを検証し、失敗が続く送信元をロックアウトする
 * なぜ: ポータル本体以外からの通知送信とトークン総当たりを防ぐため
 */
package com.example.orchestrator.config;

import com.example.common.ratelimit.LockoutRule;
import com.example.common.ratelimit.LockoutStatus;
import com.example.common.ratelimit.RateLimiter;
import com.example.orchestrator.api.ApiErrorCode;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.HandlerInterceptor;

@Component
@RequiredArgsConstructor
public class InternalTokenInterceptor implements HandlerInterceptor {

  private static final Logger logger = LoggerFactory.getLogger(InternalTokenInterceptor.class);
  private static final String KEY_PREFIX = "internal-token:";

  private final RateLimiter rateLimiter;
  private final RateLimitProperties rateLimitProperties;
  private final InternalApiProperties internalApiProperties;
  private final ApiErrorWriter errorWriter;

  @Override
  public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler)
      throws IOException {
    final String key =
        KEY_PREFIX + ClientIps.resolve(request, rateLimitProperties.trustForwardedFor());
    final LockoutRule rule = rateLimitProperties.internalToken().toRule();
    final LockoutStatus lockout = rateLimiter.checkLockout(key, rule);
    if (lockout.locked()) {
      errorWriter.tooManyRequests(response, lockout.retryAfterSec(), "too many failed attempts");
      return false;
    }
    if (matches(request.getHeader(internalApiProperties.tokenHeader()))) {
      rateLimiter.clearFailures(key);
      return true;
    }
    final LockoutStatus status = rateLimiter.recordFailure(key, rule);
    if (status.locked()) {
      logger.warn("internal token lockout engaged retryAfterSec={}", status.retryAfterSec());
      errorWriter.tooManyRequests(response, status.retryAfterSec(), "too many failed attempts");
      return false;
    }
    errorWriter.write(
        response, HttpStatus.UNAUTHORIZED, ApiErrorCode.UNAUTHORIZED, "internal token is invalid");
    return false;
  }

  private boolean matches(String presented) {
    final String expected = internalApiProperties.token();
    // トークン未設定時は全拒否
    if (expected == null || expected.isBlank() || presented == null) {
      return false;
    }
    return MessageDigest.isEqual(
        expected.getBytes(StandardCharsets.UTF_8), presented.getBytes(StandardCharsets.UTF_8));
  }
}
