package dev.pinakes.config;

import jakarta.annotation.PostConstruct;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeParseException;
import org.jspecify.annotations.Nullable;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Clock settings, bound from {@code pinakes.clock.*}.
 *
 * <ul>
 *   <li>{@code zone} - zone of the clock, default {@code UTC}
 *   <li>{@code fixed-at} - ISO-8601 instant to freeze the clock at, for replaying a retention
 *       sweep or queue schedule as of a given moment; unset in normal operation
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "pinakes.clock")
public class ClockProperties {

  private String zone = "UTC";
  private @Nullable String fixedAt;

  @PostConstruct
  void validate() {
    try {
      zoneId();
    } catch (DateTimeException e) {
      throw new IllegalStateException("pinakes.clock.zone is not a zone id: " + zone, e);
    }
    try {
      fixedInstant();
    } catch (DateTimeParseException e) {
      throw new IllegalStateException("pinakes.clock.fixed-at is not an instant: " + fixedAt, e);
    }
  }

  public ZoneId zoneId() {
    return ZoneId.of(zone);
  }

  public @Nullable Instant fixedInstant() {
    return fixedAt == null || fixedAt.isBlank() ? null : Instant.parse(fixedAt);
  }

  public String getZone() {
    return zone;
  }

  public void setZone(String zone) {
    this.zone = zone;
  }

  public @Nullable String getFixedAt() {
    return fixedAt;
  }

  public void setFixedAt(@Nullable String fixedAt) {
    this.fixedAt = fixedAt;
  }
}
