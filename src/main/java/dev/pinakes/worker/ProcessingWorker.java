package dev.pinakes.worker;

import dev.pinakes.ingestion.IngestResult;
import dev.pinakes.ingestion.IngestionCoordinator;
import dev.pinakes.latest.LatestVersionService;
import dev.pinakes.module.FetchOutcome;
import dev.pinakes.module.LatestVersionsInfo;
import dev.pinakes.module.ModuleFetcher;
import dev.pinakes.module.ModuleGraph;
import dev.pinakes.module.Unit;
import dev.pinakes.state.PendingItem;
import dev.pinakes.state.VersionMapService;
import dev.pinakes.state.VersionStateUpdate;
import dev.pinakes.state.VersionStatus;
import dev.pinakes.state.WorkQueueService;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;

/**
 * Drives the work queue: takes a batch, fetches and ingests each version on the processing pool,
 * and records every outcome in the queue and the version map.
 *
 * <p>An attempt that runs longer than {@code pinakes.worker.ingest-timeout}, counted from its own
 * start, is cancelled and recorded as a transient failure; one that never gets a pool thread is
 * left unrecorded. Queue writes are retried on transient store errors; an outcome that still
 * cannot be recorded leaves the version on its previous schedule.
 */
@Service
public class ProcessingWorker {

  private static final Logger log = LoggerFactory.getLogger(ProcessingWorker.class);

  private static final int NOT_FOUND = 404;

  private final WorkQueueService workQueue;
  private final VersionMapService versionMapService;
  private final IngestionCoordinator ingestionCoordinator;
  private final LatestVersionService latestVersionService;
  private final ObjectProvider<ModuleFetcher> fetcherProvider;
  private final ExecutorService processingExecutor;
  private final RetryTemplate recordRetryTemplate;
  private final WorkerProperties properties;

  public ProcessingWorker(
      WorkQueueService workQueue,
      VersionMapService versionMapService,
      IngestionCoordinator ingestionCoordinator,
      LatestVersionService latestVersionService,
      ObjectProvider<ModuleFetcher> fetcherProvider,
      ExecutorService processingExecutor,
      RetryTemplate recordRetryTemplate,
      WorkerProperties properties) {
    this.workQueue = workQueue;
    this.versionMapService = versionMapService;
    this.ingestionCoordinator = ingestionCoordinator;
    this.latestVersionService = latestVersionService;
    this.fetcherProvider = fetcherProvider;
    this.processingExecutor = processingExecutor;
    this.recordRetryTemplate = recordRetryTemplate;
    this.properties = properties;
  }

  /**
   * Processes one batch.
   *
   * @return the number of outcomes recorded
   */
  public int processBatch() {
    ModuleFetcher fetcher = fetcherProvider.getIfAvailable();
    if (fetcher == null) {
      log.warn("No ModuleFetcher bean available; skipping batch");
      return 0;
    }
    List<PendingItem> batch = workQueue.nextBatch(properties.getBatchSize());
    if (batch.isEmpty()) {
      return 0;
    }

    long budgetNanos = properties.getIngestTimeout().toNanos();
    List<TimedAttempt<VersionStateUpdate>> attempts = new ArrayList<>();
    List<Future<VersionStateUpdate>> futures = new ArrayList<>();
    for (PendingItem item : batch) {
      TimedAttempt<VersionStateUpdate> attempt = new TimedAttempt<>(() -> process(fetcher, item));
      attempts.add(attempt);
      futures.add(processingExecutor.submit(attempt));
    }

    int recorded = 0;
    int neverStarted = 0;
    for (int i = 0; i < batch.size(); i++) {
      Optional<VersionStateUpdate> outcome;
      try {
        outcome = awaitOutcome(batch.get(i), attempts.get(i), futures.get(i), budgetNanos);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        log.warn("Interrupted after {} of {} outcomes", i, batch.size());
        for (Future<VersionStateUpdate> pending : futures.subList(i, futures.size())) {
          pending.cancel(true);
        }
        return recorded;
      }
      if (outcome.isEmpty()) {
        neverStarted++;
      } else if (recordOutcome(outcome.get())) {
        recorded++;
      }
    }
    log.info(
        "Processed batch: {} of {} outcomes recorded, {} never started",
        recorded,
        batch.size(),
        neverStarted);
    return recorded;
  }

  /**
   * Waits for one attempt, giving it the full ingest timeout from the moment it starts. An attempt
   * that no pool thread picks up within the timeout is withdrawn and yields no outcome, so the
   * version stays on its current schedule.
   */
  private Optional<VersionStateUpdate> awaitOutcome(
      PendingItem item,
      TimedAttempt<VersionStateUpdate> attempt,
      Future<VersionStateUpdate> future,
      long budgetNanos)
      throws InterruptedException {
    if (!attempt.awaitStart(budgetNanos, TimeUnit.NANOSECONDS)) {
      log.debug("{}@{}: never started, left for a later batch", item.modulePath(), item.version());
      return Optional.empty();
    }
    try {
      long remaining = Math.max(0, attempt.remainingNanos(budgetNanos));
      return Optional.ofNullable(future.get(remaining, TimeUnit.NANOSECONDS));
    } catch (TimeoutException e) {
      future.cancel(true);
      return Optional.of(
          update(
              item,
              VersionStatus.TRANSIENT_FAILURE,
              "timed out after " + properties.getIngestTimeout(),
              null,
              null));
    } catch (ExecutionException e) {
      return Optional.of(
          update(item, VersionStatus.fromException(e), messageOf(e.getCause()), null, null));
    }
  }

  /**
   * One attempt at one version. Failures are turned into an update, never thrown, so that every
   * attempt leaves a record.
   */
  VersionStateUpdate process(ModuleFetcher fetcher, PendingItem item) {
    String modulePath = item.modulePath();
    String version = item.version();
    try {
      refreshLatestVersions(fetcher, modulePath);
      FetchOutcome outcome = fetcher.fetch(modulePath, version);
      if (outcome.isAlternativePath()) {
        String canonical = outcome.canonicalPath();
        return update(
            item, VersionStatus.ALTERNATIVE_PATH, "module declares " + canonical, canonical, null);
      }
      ModuleGraph graph = Objects.requireNonNull(outcome.graph());
      IngestResult result = ingestionCoordinator.ingest(graph);
      log.debug("{}@{}: ingested, latest={}", modulePath, version, result.isLatest());
      VersionStatus status =
          outcome.hasIncompletePackages()
              ? VersionStatus.HAS_INCOMPLETE_PACKAGES
              : VersionStatus.SUCCESS;
      return update(item, status, "", graph.goModPath(), packageCount(graph));
    } catch (RuntimeException e) {
      VersionStatus status = VersionStatus.fromException(e);
      log.debug("{}@{}: attempt failed with {}", modulePath, version, status, e);
      return update(item, status, messageOf(e), null, null);
    }
  }

  private void refreshLatestVersions(ModuleFetcher fetcher, String modulePath) {
    Optional<LatestVersionsInfo> info = fetcher.fetchLatestVersions(modulePath);
    if (info.isPresent()) {
      latestVersionService.updateLatestModuleVersions(info.get());
    } else {
      latestVersionService.updateLatestModuleVersionsStatus(modulePath, NOT_FOUND);
    }
  }

  private boolean recordOutcome(VersionStateUpdate update) {
    try {
      // each write is retried on its own so a failed upsert never records the attempt twice
      recordRetryTemplate.execute(
          context -> {
            workQueue.record(update);
            return null;
          });
      String resolved = update.status() == VersionStatus.NOT_FOUND ? null : update.version();
      recordRetryTemplate.execute(
          context -> {
            versionMapService.upsert(
                update.modulePath(), update.version(), resolved, update.status(), update.error());
            return null;
          });
      return true;
    } catch (RuntimeException e) {
      log.error(
          "{}@{}: could not record {}: {}",
          update.modulePath(),
          update.version(),
          update.status(),
          e.getMessage());
      return false;
    }
  }

  private VersionStateUpdate update(
      PendingItem item,
      VersionStatus status,
      String error,
      @Nullable String goModPath,
      @Nullable Integer numPackages) {
    return new VersionStateUpdate(
        item.modulePath(),
        item.version(),
        status,
        error,
        properties.getAppVersion(),
        goModPath,
        numPackages);
  }

  private static int packageCount(ModuleGraph graph) {
    int count = 0;
    for (Unit unit : graph.units()) {
      if (unit.isPackage()) {
        count++;
      }
    }
    return count;
  }

  private static String messageOf(Throwable e) {
    return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
  }
}
