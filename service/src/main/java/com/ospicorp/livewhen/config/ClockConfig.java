package com.ospicorp.livewhen.config;

import java.time.Clock;
import java.time.ZoneId;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/** Heatmap bins, week boundaries and week parameters are all resolved in this zone. */
@Configuration
public class ClockConfig {

  @Bean
  Clock clock(@Value("${livewhen.zone:UTC}") String zone) {
    return Clock.system(ZoneId.of(zone));
  }
}
