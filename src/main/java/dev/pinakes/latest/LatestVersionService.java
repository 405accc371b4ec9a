package dev.pinakes.latest;

import dev.pinakes.NotFoundException;
import dev.pinakes.lock.ModuleLock;
import dev.pinakes.module.LatestVersionsInfo;
import dev.pinakes.storage.ModuleQueries;
import dev.pinakes.version.Retraction;
import dev.pinakes.version.SemanticVersion;
import dev.pinakes.version.VersionMeta;
import dev.pinakes.version.VersionOrder;
import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Owns the {@code latest_module_versions} pointer rows.
 *
 * <p>Upstream facts are written by {@link #updateLatestModuleVersions}; the good version is only
 * ever written by {@link #recomputeGoodVersion}, which callers run under the module lock.
 */
@Service
public class LatestVersionService {

  private static final Logger log = LoggerFactory.getLogger(LatestVersionService.class);

  private final LatestModuleVersionsRepository repository;
  private final ModuleQueries moduleQueries;
  private final ModuleLock moduleLock;
  private final Clock clock;

  public LatestVersionService(
      LatestModuleVersionsRepository repository,
      ModuleQueries moduleQueries,
      ModuleLock moduleLock,
      Clock clock) {
    this.repository = repository;
    this.moduleQueries = moduleQueries;
    this.moduleLock = moduleLock;
    this.clock = clock;
  }

  /**
   * Returns what is known about the module's latest version.
   *
   * @throws NotFoundException if the module has no pointer row
   */
  @Transactional(readOnly = true)
  public ResolvedLatest resolveLatest(String modulePath) {
    return repository
        .findById(modulePath)
        .map(ResolvedLatest::of)
        .orElseThrow(() -> new NotFoundException("no latest version known for " + modulePath));
  }

  /** The module's good version, if it has one. */
  @Transactional(readOnly = true)
  public Optional<String> goodVersion(String modulePath) {
    return repository
        .findById(modulePath)
        .map(LatestModuleVersions::getGoodVersion)
        .filter(v -> !v.isEmpty());
  }

  /**
   * The highest stored version with retractions and compatibility facts ignored, for display when
   * no good version exists.
   */
  @Transactional(readOnly = true)
  public Optional<String> latestIgnoringRetractions(String modulePath) {
    return VersionOrder.latestIgnoringRetractions(moduleQueries.versions(modulePath))
        .map(VersionMeta::version);
  }

  /**
   * Stores upstream facts when they are newer than what the row holds, or when the row holds no
   * valid facts. Never touches the good version.
   *
   * @return the facts held by the row afterwards
   */
  @Transactional
  public ResolvedLatest updateLatestModuleVersions(LatestVersionsInfo info) {
    return moduleLock.withModuleLock(
        info.modulePath(),
        () -> {
          Optional<LatestModuleVersions> current = repository.findById(info.modulePath());
          boolean update =
              current.isEmpty()
                  || !current.get().hasUpstreamFacts()
                  || rawIsMoreRecent(info.rawVersion(), current.get().getRawVersion());
          if (!update) {
            log.debug("{}: not updating latest module versions", info.modulePath());
            return ResolvedLatest.of(current.get());
          }
          LatestModuleVersions row =
              current.orElseGet(() -> new LatestModuleVersions(info.modulePath(), clock.instant()));
          log.debug(
              "{}: latest module versions raw={} cooked={}",
              info.modulePath(),
              info.rawVersion(),
              info.cookedVersion());
          row.setRawVersion(info.rawVersion());
          row.setCookedVersion(info.cookedVersion());
          row.setRetractions(info.retractions());
          row.setDeprecated(info.deprecated());
          row.setDeprecationComment(info.deprecationComment());
          row.setStatus(LatestModuleVersions.STATUS_OK);
          row.setUpdatedAt(clock.instant());
          return ResolvedLatest.of(repository.save(row));
        });
  }

  /**
   * Records a failed upstream lookup. Rows that already hold valid facts keep them.
   */
  @Transactional
  public void updateLatestModuleVersionsStatus(String modulePath, int status) {
    moduleLock.withModuleLock(
        modulePath,
        () -> {
          LatestModuleVersions row =
              repository
                  .findById(modulePath)
                  .orElseGet(() -> new LatestModuleVersions(modulePath, clock.instant()));
          if (row.hasUpstreamFacts()) {
            return null;
          }
          log.debug("{}: latest module versions status {}", modulePath, status);
          row.setStatus(status);
          row.setUpdatedAt(clock.instant());
          return repository.save(row);
        });
  }

  /**
   * Recomputes and persists the module's good version from its stored versions and the pointer's
   * upstream facts. Must run in a transaction that holds the module lock.
   */
  public GoodVersionChange recomputeGoodVersion(String modulePath) {
    Optional<LatestModuleVersions> pointer = repository.findById(modulePath);
    String previous = pointer.map(LatestModuleVersions::getGoodVersion).orElse("");

    List<Retraction> retractions = List.of();
    @Nullable String cooked = null;
    if (pointer.isPresent() && pointer.get().hasUpstreamFacts()) {
      retractions = pointer.get().getRetractions();
      cooked = pointer.get().getCookedVersion();
    }
    Predicate<String> retracted = Retraction.anyOf(retractions);
    String current =
        VersionOrder.resolveLatest(moduleQueries.versions(modulePath), retracted, cooked)
            .map(VersionMeta::version)
            .orElse("");

    repository.upsertGoodVersion(modulePath, current, clock.instant());
    if (!previous.equals(current)) {
      log.debug("{}: good version {} -> {}", modulePath, display(previous), display(current));
    }
    return new GoodVersionChange(previous, current);
  }

  /**
   * Reports whether raw version {@code v1} is more recent than {@code v2}: later in semantic
   * order, or compatible where {@code v2} is {@code +incompatible}. The raw latest can move
   * backwards when a module gains a manifest after publishing incompatible major versions.
   */
  static boolean rawIsMoreRecent(String v1, String v2) {
    return SemanticVersion.later(v1, v2)
        || (SemanticVersion.isIncompatible(v2) && !SemanticVersion.isIncompatible(v1));
  }

  private static String display(String version) {
    return version.isEmpty() ? "<none>" : version;
  }
}
