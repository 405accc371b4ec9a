package dev.pinakes.config;

import java.time.Clock;
import java.time.Instant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * The {@link Clock} behind queue scheduling, pointer timestamps and retention cutoffs: the system
 * clock in {@code pinakes.clock.zone}, or a frozen one when {@code pinakes.clock.fixed-at} is set.
 */
@Configuration
public class ClockConfig {

  private static final Logger log = LoggerFactory.getLogger(ClockConfig.class);

  @Bean
  @ConditionalOnMissingBean
  public Clock clock(ClockProperties properties) {
    Instant fixedAt = properties.fixedInstant();
    if (fixedAt != null) {
      log.warn(
          "Clock frozen at {} ({}); schedules will not advance", fixedAt, properties.getZone());
      return Clock.fixed(fixedAt, properties.zoneId());
    }
    return Clock.system(properties.zoneId());
  }
}
