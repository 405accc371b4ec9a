package dev.pinakes.state;

import dev.pinakes.NotFoundException;
import dev.pinakes.index.AlternativePathRegistry;
import dev.pinakes.index.SearchIndex;
import dev.pinakes.lock.ModuleLock;
import dev.pinakes.version.SemanticVersion;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * The durable work queue of module versions.
 *
 * <p>Workers pull batches with {@link #nextBatch} and report each attempt with {@link #record}.
 * Nothing is leased: a version handed out but never recorded keeps its schedule and is handed out
 * again when due.
 */
@Service
public class WorkQueueService {

  private static final Logger log = LoggerFactory.getLogger(WorkQueueService.class);

  private static final List<VersionStatus> REPROCESSABLE =
      List.of(
          VersionStatus.SUCCESS,
          VersionStatus.HAS_INCOMPLETE_PACKAGES,
          VersionStatus.VALIDATION_FAILURE,
          VersionStatus.BAD_MODULE,
          VersionStatus.ALTERNATIVE_PATH);

  private final ModuleVersionStateRepository repository;
  private final JdbcTemplate jdbcTemplate;
  private final ModuleLock moduleLock;
  private final SearchIndex searchIndex;
  private final AlternativePathRegistry alternativePathRegistry;
  private final QueueProperties properties;
  private final Clock clock;
  private final RetryBackoff backoff;
  private final BatchPrioritizer prioritizer;

  public WorkQueueService(
      ModuleVersionStateRepository repository,
      JdbcTemplate jdbcTemplate,
      ModuleLock moduleLock,
      SearchIndex searchIndex,
      AlternativePathRegistry alternativePathRegistry,
      QueueProperties properties,
      Clock clock) {
    this.repository = repository;
    this.jdbcTemplate = jdbcTemplate;
    this.moduleLock = moduleLock;
    this.searchIndex = searchIndex;
    this.alternativePathRegistry = alternativePathRegistry;
    this.properties = properties;
    this.clock = clock;
    this.backoff = new RetryBackoff(properties.getInitialBackoff(), properties.getMaxBackoff());
    this.prioritizer =
        new BatchPrioritizer(
            properties.getLargeModulePackageThreshold(), properties.getLargeModulesLimit());
  }

  /**
   * Returns up to {@code limit} due versions in priority order. See {@link BatchPrioritizer} for
   * the ordering rules.
   */
  @Transactional(readOnly = true)
  public List<PendingItem> nextBatch(int limit) {
    if (limit <= 0) {
      return List.of();
    }
    List<ModuleVersionState> due =
        repository.findDue(clock.instant(), PageRequest.of(0, properties.getCandidateWindow()));
    List<PendingItem> batch = prioritizer.prioritize(due, latestVersions(due), limit);
    log.info("Next batch: {} of {} due versions", batch.size(), due.size());
    return batch;
  }

  private Map<String, String> latestVersions(List<ModuleVersionState> due) {
    if (due.isEmpty()) {
      return Map.of();
    }
    Set<String> modulePaths = new HashSet<>();
    for (ModuleVersionState state : due) {
      modulePaths.add(state.getModulePath());
    }
    Map<String, String> latest = new HashMap<>();
    for (Object[] row : repository.findLatestVersions(modulePaths)) {
      latest.put((String) row[0], (String) row[1]);
    }
    return latest;
  }

  /** Records the outcome of one attempt with only a status and an error detail. */
  @Transactional
  public ModuleVersionState record(
      String modulePath, String version, VersionStatus status, String detail) {
    return record(VersionStateUpdate.of(modulePath, version, status, detail));
  }

  /**
   * Records the outcome of one attempt: bumps the try count, stamps the attempt time and schedules
   * the next attempt with exponential backoff. Recording {@link VersionStatus#ALTERNATIVE_PATH}
   * also drops the module's older search rows and registers the canonical path.
   */
  @Transactional
  public ModuleVersionState record(VersionStateUpdate update) {
    Instant now = clock.instant();
    repository.insertIfAbsent(
        update.modulePath(),
        update.version(),
        SemanticVersion.forSorting(update.version()),
        SemanticVersion.isIncompatible(update.version()),
        now);
    ModuleVersionState state =
        repository
            .findForUpdate(update.modulePath(), update.version())
            .orElseThrow(
                () ->
                    new IllegalStateException(
                        "state row vanished for " + update.modulePath() + "@" + update.version()));

    Instant next =
        backoff.nextProcessedAfter(now, state.getLastProcessedAt(), state.getNextProcessedAfter());
    state.setStatus(update.status());
    state.setError(update.error());
    state.setTryCount(state.getTryCount() + 1);
    state.setLastProcessedAt(now);
    state.setNextProcessedAfter(next);
    state.setAppVersion(update.appVersion());
    if (update.goModPath() != null) {
      state.setGoModPath(update.goModPath());
    }
    if (update.numPackages() != null) {
      state.setNumPackages(update.numPackages());
    }
    ModuleVersionState saved = repository.save(state);

    if (update.status().isEligible() && update.status() != VersionStatus.NEW) {
      log.warn(
          "{}@{}: attempt {} failed with {}, next after {}: {}",
          update.modulePath(),
          update.version(),
          saved.getTryCount(),
          update.status(),
          next,
          update.error());
    }
    if (update.status() == VersionStatus.ALTERNATIVE_PATH) {
      suppressAlternative(update.modulePath(), update.version(), update.goModPath());
    }
    return saved;
  }

  private void suppressAlternative(
      String modulePath, String version, @Nullable String canonicalPath) {
    moduleLock.withModuleLock(
        modulePath,
        () -> {
          int removed = searchIndex.deleteOlderVersions(modulePath, version);
          if (canonicalPath != null
              && !canonicalPath.isEmpty()
              && !canonicalPath.equals(modulePath)) {
            alternativePathRegistry.register(modulePath, canonicalPath);
          }
          log.info(
              "{}@{} is an alternative path; removed {} older search rows",
              modulePath,
              version,
              removed);
          return removed;
        });
  }

  /**
   * Adds versions announced by the upstream index. Known versions get their index timestamp
   * refreshed and become due now.
   */
  @Transactional
  public void enqueueIndexVersions(List<IndexVersion> versions) {
    List<IndexVersion> sorted = new ArrayList<>(versions);
    sorted.sort(
        Comparator.comparing(IndexVersion::modulePath).thenComparing(IndexVersion::version));
    Timestamp now = Timestamp.from(clock.instant());
    jdbcTemplate.batchUpdate(
        """
        INSERT INTO module_version_states (module_path, version, sort_version, incompatible,
                                           index_timestamp, status, next_processed_after,
                                           created_at)
        VALUES (?, ?, ?, ?, ?, 0, ?, ?)
        ON CONFLICT (module_path, version) DO UPDATE SET
            index_timestamp = EXCLUDED.index_timestamp,
            next_processed_after = EXCLUDED.next_processed_after
        """,
        new BatchPreparedStatementSetter() {
          @Override
          public void setValues(PreparedStatement ps, int i) throws SQLException {
            IndexVersion v = sorted.get(i);
            ps.setString(1, v.modulePath());
            ps.setString(2, v.version());
            ps.setString(3, SemanticVersion.forSorting(v.version()));
            ps.setBoolean(4, SemanticVersion.isIncompatible(v.version()));
            ps.setTimestamp(5, Timestamp.from(v.timestamp()));
            ps.setTimestamp(6, now);
            ps.setTimestamp(7, now);
          }

          @Override
          public int getBatchSize() {
            return sorted.size();
          }
        });
    log.info("Enqueued {} index versions", sorted.size());
  }

  /**
   * @throws NotFoundException if the version has never been enqueued or recorded
   */
  @Transactional(readOnly = true)
  public ModuleVersionState getState(String modulePath, String version) {
    return repository
        .findById(new ModuleVersionStateId(modulePath, version))
        .orElseThrow(
            () -> new NotFoundException("no state for " + modulePath + "@" + version));
  }

  @Transactional(readOnly = true)
  public List<ModuleVersionState> recentFailures(int limit) {
    return repository.findRecentFailures(PageRequest.of(0, limit));
  }

  @Transactional(readOnly = true)
  public List<ModuleVersionState> recentVersions(int limit) {
    return repository.findRecentlyIndexed(PageRequest.of(0, limit));
  }

  @Transactional(readOnly = true)
  public Optional<Instant> latestIndexTimestamp() {
    return repository.findLatestIndexTimestamp();
  }

  @Transactional(readOnly = true)
  public VersionStats versionStats() {
    Map<VersionStatus, Long> counts = new EnumMap<>(VersionStatus.class);
    for (Object[] row : repository.countByStatus()) {
      counts.put(VersionStatus.fromCode(((Number) row[0]).intValue()), ((Number) row[1]).longValue());
    }
    return new VersionStats(repository.findLatestIndexTimestamp(), counts);
  }

  /**
   * Moves terminal outcomes produced by app versions older than {@code appVersion} to their
   * {@code REPROCESS_*} status and makes them due now.
   *
   * @return the number of rows moved
   */
  @Transactional
  public int resetForReprocessing(String appVersion) {
    Instant now = clock.instant();
    int total = 0;
    for (VersionStatus from : REPROCESSABLE) {
      total +=
          repository.markForReprocessing(
              from.code(), from.toReprocess().code(), appVersion, now);
    }
    log.info("Marked {} versions for reprocessing below app version {}", total, appVersion);
    return total;
  }
}
