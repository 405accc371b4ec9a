package dev.pinakes.worker;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Polls the work queue every {@code pinakes.worker.poll-interval}. */
@Component
@ConditionalOnProperty(name = "pinakes.worker.enabled", havingValue = "true")
public class WorkerScheduler {

  private final ProcessingWorker worker;

  public WorkerScheduler(ProcessingWorker worker) {
    this.worker = worker;
  }

  @Scheduled(fixedDelayString = "${pinakes.worker.poll-interval:30s}")
  public void poll() {
    worker.processBatch();
  }
}
