/*
 * どこで: Jobs Web 設定
 * 何を: 取込 API と運用 API に RequestMdcInterceptor を適用する
 * なぜ: actuator のスクレイプを除いた API ログへ request_id/trace_id を載せるため
 */
package com.dragonfly.jobs.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.InterceptorRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

@Configuration
@RequiredArgsConstructor
public class WebMvcConfig implements WebMvcConfigurer {

  private static final String[] MDC_PATH_PATTERNS = {"/v1/**", "/ops/**"};

  private final RequestMdcInterceptor requestMdcInterceptor;

  @Override
  public void addInterceptors(InterceptorRegistry registry) {
    registry.addInterceptor(requestMdcInterceptor).addPathPatterns(MDC_PATH_PATTERNS);
  }
}
