package dev.pinakes.worker;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.retry.support.RetryTemplate;

/** Thread pool and retry policy used by {@link ProcessingWorker}. */
@Configuration
public class WorkerConfig {

  @Bean(destroyMethod = "shutdownNow")
  public ExecutorService processingExecutor(WorkerProperties properties) {
    AtomicInteger counter = new AtomicInteger();
    ThreadFactory threads =
        runnable -> {
          Thread thread = new Thread(runnable, "pinakes-worker-" + counter.incrementAndGet());
          thread.setDaemon(true);
          return thread;
        };
    return Executors.newFixedThreadPool(properties.getConcurrency(), threads);
  }

  @Bean
  public RetryTemplate recordRetryTemplate(WorkerProperties properties) {
    return RetryTemplate.builder()
        .maxAttempts(properties.getRecordMaxAttempts())
        .fixedBackoff(properties.getRecordRetryDelay().toMillis())
        .retryOn(TransientDataAccessException.class)
        .retryOn(RecoverableDataAccessException.class)
        .traversingCauses()
        .build();
  }
}
