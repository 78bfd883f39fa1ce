/*
 * どこで: Common 共通設定
 * 何を: Clock を DI 可能にする
 * なぜ: リース期限や stale 判定の時刻をテストから固定できるようにするため
 */
package com.dragonfly.common.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class TimeConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
