package dev.pinakes.worker;

import jakarta.annotation.PostConstruct;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Processing worker settings, bound from {@code pinakes.worker.*}.
 *
 * <ul>
 *   <li>{@code enabled} - poll the queue on a schedule (default false)
 *   <li>{@code batch-size} - versions taken per poll (default 10)
 *   <li>{@code concurrency} - versions processed in parallel (default 4)
 *   <li>{@code poll-interval} - delay between polls (default 30s)
 *   <li>{@code app-version} - recorded with every outcome (default "dev")
 *   <li>{@code ingest-timeout} - per-version limit on fetch plus ingest (default 10m)
 *   <li>{@code record-max-attempts} / {@code record-retry-delay} - retry of queue writes on
 *       transient store errors (default 3, 500ms)
 * </ul>
 */
@Configuration
@ConfigurationProperties(prefix = "pinakes.worker")
public class WorkerProperties {

  private boolean enabled = false;
  private int batchSize = 10;
  private int concurrency = 4;
  private Duration pollInterval = Duration.ofSeconds(30);
  private String appVersion = "dev";
  private Duration ingestTimeout = Duration.ofMinutes(10);
  private int recordMaxAttempts = 3;
  private Duration recordRetryDelay = Duration.ofMillis(500);

  @PostConstruct
  void validate() {
    if (batchSize < 1) {
      throw new IllegalStateException(
          "pinakes.worker.batch-size must be positive, got: " + batchSize);
    }
    if (concurrency < 1) {
      throw new IllegalStateException(
          "pinakes.worker.concurrency must be positive, got: " + concurrency);
    }
    if (ingestTimeout.isNegative() || ingestTimeout.isZero()) {
      throw new IllegalStateException(
          "pinakes.worker.ingest-timeout must be positive, got: " + ingestTimeout);
    }
    if (recordMaxAttempts < 1) {
      throw new IllegalStateException(
          "pinakes.worker.record-max-attempts must be at least 1, got: " + recordMaxAttempts);
    }
  }

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public int getBatchSize() {
    return batchSize;
  }

  public void setBatchSize(int batchSize) {
    this.batchSize = batchSize;
  }

  public int getConcurrency() {
    return concurrency;
  }

  public void setConcurrency(int concurrency) {
    this.concurrency = concurrency;
  }

  public Duration getPollInterval() {
    return pollInterval;
  }

  public void setPollInterval(Duration pollInterval) {
    this.pollInterval = pollInterval;
  }

  public String getAppVersion() {
    return appVersion;
  }

  public void setAppVersion(String appVersion) {
    this.appVersion = appVersion;
  }

  public Duration getIngestTimeout() {
    return ingestTimeout;
  }

  public void setIngestTimeout(Duration ingestTimeout) {
    this.ingestTimeout = ingestTimeout;
  }

  public int getRecordMaxAttempts() {
    return recordMaxAttempts;
  }

  public void setRecordMaxAttempts(int recordMaxAttempts) {
    this.recordMaxAttempts = recordMaxAttempts;
  }

  public Duration getRecordRetryDelay() {
    return recordRetryDelay;
  }

  public void setRecordRetryDelay(Duration recordRetryDelay) {
    this.recordRetryDelay = recordRetryDelay;
  }
}
