/*
 * どこで: Orchestrator Web 設定
 * 何を: MDC/レート制限/内部トークンのインターセプタを適用する
 * なぜ: 横断的な前処理をコントローラから切り離すため
 */
package com.example.orchestrator.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

  private final RequestMdcInterceptor requestMdcInterceptor;
  private final AdminRateLimitInterceptor adminRateLimitInterceptor;
  private final InternalTokenInterceptor internalTokenInterceptor;

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    registry.addInterceptor(requestMdcInterceptor);
    registry
        .addInterceptor(adminRateLimitInterceptor)
        .addPathPatterns("/v1/admin/jobs/*/run", "/v1/admin/notification-endpoints/*/test");
    registry.addInterceptor(internalTokenInterceptor).addPathPatterns("/internal/**");
  }
}
