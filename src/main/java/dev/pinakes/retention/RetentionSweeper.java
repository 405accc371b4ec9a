package dev.pinakes.retention;

import dev.pinakes.index.DerivedViews;
import dev.pinakes.index.SearchIndex;
import dev.pinakes.latest.GoodVersionChange;
import dev.pinakes.latest.LatestVersionService;
import dev.pinakes.lock.ModuleLock;
import dev.pinakes.module.ModuleVersionRef;
import dev.pinakes.state.ModuleVersionStateRepository;
import dev.pinakes.state.VersionMapRepository;
import dev.pinakes.storage.ModuleQueries;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionOperations;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Removes stored pseudo-versions nobody needs any more.
 *
 * <p>A pseudo-version is kept while it is its module's good version, appears in the search
 * index, or is what {@code master} or {@code main} resolved to. Each removal runs under the
 * module lock in its own transaction, so a failure leaves earlier removals in place. Candidates
 * are checked again under the lock, since ingestion may have made one good or indexed it since it
 * was selected.
 */
@Service
public class RetentionSweeper {

  private static final Logger log = LoggerFactory.getLogger(RetentionSweeper.class);

  private static final List<String> BRANCH_NAMES = List.of("master", "main");

  private final JdbcTemplate jdbcTemplate;
  private final ModuleQueries moduleQueries;
  private final ModuleVersionStateRepository stateRepository;
  private final VersionMapRepository versionMapRepository;
  private final LatestVersionService latestVersionService;
  private final DerivedViews derivedViews;
  private final SearchIndex searchIndex;
  private final ModuleLock moduleLock;
  private final RetentionProperties properties;
  private final Clock clock;
  private final TransactionOperations transactions;

  @Autowired
  public RetentionSweeper(
      JdbcTemplate jdbcTemplate,
      ModuleQueries moduleQueries,
      ModuleVersionStateRepository stateRepository,
      VersionMapRepository versionMapRepository,
      LatestVersionService latestVersionService,
      DerivedViews derivedViews,
      SearchIndex searchIndex,
      ModuleLock moduleLock,
      RetentionProperties properties,
      Clock clock,
      PlatformTransactionManager transactionManager) {
    this.jdbcTemplate = jdbcTemplate;
    this.moduleQueries = moduleQueries;
    this.stateRepository = stateRepository;
    this.versionMapRepository = versionMapRepository;
    this.latestVersionService = latestVersionService;
    this.derivedViews = derivedViews;
    this.searchIndex = searchIndex;
    this.moduleLock = moduleLock;
    this.properties = properties;
    this.clock = clock;
    TransactionTemplate template = new TransactionTemplate(transactionManager);
    template.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
    this.transactions = template;
  }

  /**
   * Pseudo-versions not updated for {@code daysOld} days that are not the good version, not
   * indexed for search and not the resolution of {@code master} or {@code main}. Oldest first.
   */
  public List<ModuleVersionRef> findVersionsToClean(int daysOld, int limit) {
    Instant cutoff = clock.instant().minus(Duration.ofDays(daysOld));
    return jdbcTemplate.query(
        """
        SELECT m.module_path, m.version
        FROM modules m
        LEFT JOIN latest_module_versions l ON l.module_path = m.module_path
        WHERE m.version_type = 'pseudo'
          AND m.updated_at < ?
          AND (l.good_version IS NULL OR l.good_version <> m.version)
          AND NOT EXISTS (
              SELECT 1 FROM search_documents s
              WHERE s.module_path = m.module_path AND s.version = m.version)
          AND NOT EXISTS (
              SELECT 1 FROM version_map vm
              WHERE vm.module_path = m.module_path
                AND vm.resolved_version = m.version
                AND vm.requested_version IN ('master', 'main'))
        ORDER BY m.updated_at, m.module_path, m.version
        LIMIT ?
        """,
        (rs, rowNum) -> new ModuleVersionRef(rs.getString("module_path"), rs.getString("version")),
        Timestamp.from(cutoff),
        limit);
  }

  /**
   * Removes each version that is still unreferenced: marks its queue state {@code CLEANED} with
   * {@code reason}, deletes the module row with everything below it and the version map rows
   * resolving to it. Versions that became the good version, got indexed for search or became the
   * resolution of {@code master} or {@code main} are skipped.
   *
   * @return the number of versions removed
   */
  public int clean(List<ModuleVersionRef> versions, String reason) {
    return clean(versions, reason, true);
  }

  /** Removes every stored version of the module, referenced or not. */
  public int cleanAllVersions(String modulePath, String reason) {
    List<ModuleVersionRef> refs =
        moduleQueries.versions(modulePath).stream()
            .map(v -> new ModuleVersionRef(v.modulePath(), v.version()))
            .toList();
    return clean(refs, reason, false);
  }

  private int clean(List<ModuleVersionRef> versions, String reason, boolean unreferencedOnly) {
    int removed = 0;
    for (ModuleVersionRef ref : versions) {
      Boolean deleted = transactions.execute(status -> cleanOne(ref, reason, unreferencedOnly));
      if (Boolean.TRUE.equals(deleted)) {
        removed++;
      }
    }
    log.info("Cleaned {} of {} module versions ({})", removed, versions.size(), reason);
    return removed;
  }

  /** One scheduled pass with the configured age and batch size. */
  public int sweep() {
    List<ModuleVersionRef> refs =
        findVersionsToClean(properties.getDaysOld(), properties.getBatchSize());
    if (refs.isEmpty()) {
      log.info("Retention sweep: nothing to clean");
      return 0;
    }
    return clean(refs, "pseudo-version older than " + properties.getDaysOld() + " days");
  }

  private boolean cleanOne(ModuleVersionRef ref, String reason, boolean unreferencedOnly) {
    return moduleLock.withModuleLock(
        ref.modulePath(),
        () -> {
          if (unreferencedOnly) {
            Optional<String> reference = referenceTo(ref);
            if (reference.isPresent()) {
              log.debug("Keeping {}: {}", ref, reference.get());
              return false;
            }
          }
          stateRepository.markCleaned(ref.modulePath(), ref.version(), reason);
          boolean deleted = moduleQueries.deleteModule(ref.modulePath(), ref.version());
          versionMapRepository.deleteAllByModulePathAndResolvedVersion(
              ref.modulePath(), ref.version());
          GoodVersionChange change = latestVersionService.recomputeGoodVersion(ref.modulePath());
          if (change.changed() || moduleQueries.countVersions(ref.modulePath()) == 0) {
            derivedViews.refresh(ref.modulePath(), change.current());
          }
          log.debug("Cleaned {} (deleted={})", ref, deleted);
          return deleted;
        });
  }

  private Optional<String> referenceTo(ModuleVersionRef ref) {
    String modulePath = ref.modulePath();
    String version = ref.version();
    if (latestVersionService.goodVersion(modulePath).filter(version::equals).isPresent()) {
      return Optional.of("it is the good version");
    }
    if (searchIndex.containsVersion(modulePath, version)) {
      return Optional.of("it is indexed for search");
    }
    if (versionMapRepository.existsByModulePathAndResolvedVersionAndRequestedVersionIn(
        modulePath, version, BRANCH_NAMES)) {
      return Optional.of("master or main resolves to it");
    }
    return Optional.empty();
  }
}
