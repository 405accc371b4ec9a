package dev.pinakes.state;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Work queue scheduling, bound from {@code pinakes.queue.*}.
 *
 * <ul>
 *   <li>{@code initial-backoff} - delay after the first recorded attempt (default 1m)
 *   <li>{@code max-backoff} - upper bound of the doubling delay (default 1h)
 *   <li>{@code large-module-package-threshold} - package count above which a version is treated
 *       as oversized (default 1500)
 *   <li>{@code large-modules-limit} - maximum oversized versions per batch (default 100)
 *   <li>{@code candidate-window} - maximum due rows considered per batch (default 5000)
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "pinakes.queue")
public class QueueProperties {

  private Duration initialBackoff = Duration.ofMinutes(1);
  private Duration maxBackoff = Duration.ofHours(1);
  private int largeModulePackageThreshold = 1500;
  private int largeModulesLimit = 100;
  private int candidateWindow = 5000;

  @PostConstruct
  void validate() {
    if (initialBackoff.isNegative() || initialBackoff.isZero()) {
      throw new IllegalStateException(
          "pinakes.queue.initial-backoff must be positive, got: " + initialBackoff);
    }
    if (maxBackoff.compareTo(initialBackoff) < 0) {
      throw new IllegalStateException(
          "pinakes.queue.max-backoff must not be below initial-backoff, got: " + maxBackoff);
    }
    if (largeModulePackageThreshold < 1) {
      throw new IllegalStateException(
          "pinakes.queue.large-module-package-threshold must be positive, got: "
              + largeModulePackageThreshold);
    }
    if (largeModulesLimit < 0) {
      throw new IllegalStateException(
          "pinakes.queue.large-modules-limit must not be negative, got: " + largeModulesLimit);
    }
    if (candidateWindow < 1) {
      throw new IllegalStateException(
          "pinakes.queue.candidate-window must be positive, got: " + candidateWindow);
    }
  }

  public Duration getInitialBackoff() {
    return initialBackoff;
  }

  public void setInitialBackoff(Duration initialBackoff) {
    this.initialBackoff = initialBackoff;
  }

  public Duration getMaxBackoff() {
    return maxBackoff;
  }

  public void setMaxBackoff(Duration maxBackoff) {
    this.maxBackoff = maxBackoff;
  }

  public int getLargeModulePackageThreshold() {
    return largeModulePackageThreshold;
  }

  public void setLargeModulePackageThreshold(int largeModulePackageThreshold) {
    this.largeModulePackageThreshold = largeModulePackageThreshold;
  }

  public int getLargeModulesLimit() {
    return largeModulesLimit;
  }

  public void setLargeModulesLimit(int largeModulesLimit) {
    this.largeModulesLimit = largeModulesLimit;
  }

  public int getCandidateWindow() {
    return candidateWindow;
  }

  public void setCandidateWindow(int candidateWindow) {
    this.candidateWindow = candidateWindow;
  }
}
