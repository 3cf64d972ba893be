/*
 * Where: shared configuration
 * What: Exposes the UTC Clock as a bean
 * Why: Services read time through one injectable source so tests can pin it
 */
package com.guildcraft.common.config;

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
