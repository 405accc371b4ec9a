package dev.pinakes.retention;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Runs {@link RetentionSweeper#sweep()} on {@code pinakes.retention.cron}. */
@Component
@ConditionalOnProperty(name = "pinakes.retention.enabled", havingValue = "true")
public class RetentionScheduler {

  private final RetentionSweeper sweeper;

  public RetentionScheduler(RetentionSweeper sweeper) {
    this.sweeper = sweeper;
  }

  @Scheduled(cron = "${pinakes.retention.cron:0 0 3 * * *}")
  public void run() {
    sweeper.sweep();
  }
}
