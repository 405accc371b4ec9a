package dev.pinakes.retention;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Retention sweep settings, bound from {@code pinakes.retention.*}.
 *
 * <ul>
 *   <li>{@code enabled} - run the scheduled sweep (default false)
 *   <li>{@code cron} - sweep schedule (default daily at 03:00)
 *   <li>{@code days-old} - minimum age of a pseudo-version before it is removed (default 30)
 *   <li>{@code batch-size} - maximum versions removed per sweep (default 100)
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "pinakes.retention")
public class RetentionProperties {

  private boolean enabled = false;
  private String cron = "0 0 3 * * *";
  private int daysOld = 30;
  private int batchSize = 100;

  @PostConstruct
  void validate() {
    if (daysOld < 1) {
      throw new IllegalStateException(
          "pinakes.retention.days-old must be at least 1, got: " + daysOld);
    }
    if (batchSize < 1) {
      throw new IllegalStateException(
          "pinakes.retention.batch-size must be positive, got: " + batchSize);
    }
  }

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public String getCron() {
    return cron;
  }

  public void setCron(String cron) {
    this.cron = cron;
  }

  public int getDaysOld() {
    return daysOld;
  }

  public void setDaysOld(int daysOld) {
    this.daysOld = daysOld;
  }

  public int getBatchSize() {
    return batchSize;
  }

  public void setBatchSize(int batchSize) {
    this.batchSize = batchSize;
  }
}
