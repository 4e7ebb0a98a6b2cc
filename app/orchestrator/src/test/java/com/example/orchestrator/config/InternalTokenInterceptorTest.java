package com.example.orchestrator.config;

import static org.assertj.core.api.Assertions.assertThat;

import com.example.common.ratelimit.RateLimiter;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class InternalTokenInterceptorTest {

  private static final String TOKEN = "s3cret";

  private final RateLimitProperties rateLimitProperties =
      new RateLimitProperties(
          null,
          new RateLimitProperties.Lockout(Duration.ofMinutes(10), 3, Duration.ofMinutes(15)),
          false);
  private final InternalTokenInterceptor interceptor =
      new InternalTokenInterceptor(
          new RateLimiter(Clock.fixed(Instant.parse("2026-03-01T00:00:00Z"), ZoneOffset.UTC)),
          rateLimitProperties,
          new InternalApiProperties(null, TOKEN),
          new ApiErrorWriter(new ObjectMapper()));

  @Test
  void acceptsMatchingToken() throws Exception {
    assertThat(interceptor.preHandle(request(TOKEN), new MockHttpServletResponse(), null)).isTrue();
  }

  @Test
  void rejectsWrongTokenWith401() throws Exception {
    final MockHttpServletResponse response = new MockHttpServletResponse();

    assertThat(interceptor.preHandle(request("nope"), response, null)).isFalse();
    assertThat(response.getStatus()).isEqualTo(401);
    assertThat(response.getContentAsString()).contains("UNAUTHORIZED");
  }

  @Test
  void locksOutAfterRepeatedFailuresEvenWithCorrectToken() throws Exception {
    interceptor.preHandle(request("a"), new MockHttpServletResponse(), null);
    interceptor.preHandle(request("b"), new MockHttpServletResponse(), null);

    final MockHttpServletResponse third = new MockHttpServletResponse();
    assertThat(interceptor.preHandle(request("c"), third, null)).isFalse();
    assertThat(third.getStatus()).isEqualTo(429);
    assertThat(third.getHeader("Retry-After")).isEqualTo("900");

    final MockHttpServletResponse afterLock = new MockHttpServletResponse();
    assertThat(interceptor.preHandle(request(TOKEN), afterLock, null)).isFalse();
    assertThat(afterLock.getStatus()).isEqualTo(429);
  }

  @Test
  void rotatingForwardedForDoesNotEscapeLockout() throws Exception {
    for (int i = 0; i < 3; i++) {
      final MockHttpServletRequest attempt = request("guess" + i);
      attempt.addHeader("X-Forwarded-For", "198.51.100." + i);
      interceptor.preHandle(attempt, new MockHttpServletResponse(), null);
    }

    final MockHttpServletRequest rotated = request(TOKEN);
    rotated.addHeader("X-Forwarded-For", "198.51.100.200");
    final MockHttpServletResponse response = new MockHttpServletResponse();

    assertThat(interceptor.preHandle(rotated, response, null)).isFalse();
    assertThat(response.getStatus()).isEqualTo(429);
  }

  @Test
  void successClearsFailureCount() throws Exception {
    interceptor.preHandle(request("a"), new MockHttpServletResponse(), null);
    interceptor.preHandle(request("b"), new MockHttpServletResponse(), null);
    interceptor.preHandle(request(TOKEN), new MockHttpServletResponse(), null);

    final MockHttpServletResponse response = new MockHttpServletResponse();
    interceptor.preHandle(request("c"), response, null);

    assertThat(response.getStatus()).isEqualTo(401);
  }

  @Test
  void blankConfiguredTokenRejectsEverything() throws Exception {
    final InternalTokenInterceptor unconfigured =
        new InternalTokenInterceptor(
            new RateLimiter(Clock.systemUTC()),
            rateLimitProperties,
            new InternalApiProperties(null, ""),
            new ApiErrorWriter(new ObjectMapper()));

    assertThat(unconfigured.preHandle(request(""), new MockHttpServletResponse(), null)).isFalse();
  }

  private static MockHttpServletRequest request(String token) {
    final MockHttpServletRequest request =
        new MockHttpServletRequest("POST", "/internal/v1/notification-events");
    request.setRemoteAddr("10.1.2.3");
    request.addHeader("X-Internal-Token", token);
    return request;
  }
}
