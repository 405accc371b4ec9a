package dev.pinakes.symbol;

import dev.pinakes.module.Symbol;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Keeps, for every exported symbol, the earliest compatible release it was seen in.
 *
 * <p>Merging is order-independent: ingesting v3, then v1, then v2 leaves the same records as
 * ingesting them in version order. Callers writing a module's symbols hold the module lock.
 */
@Service
public class SymbolHistoryLedger {

  private static final Logger log = LoggerFactory.getLogger(SymbolHistoryLedger.class);

  private final SymbolHistoryRepository repository;
  private final Clock clock;

  public SymbolHistoryLedger(SymbolHistoryRepository repository, Clock clock) {
    this.repository = repository;
    this.clock = clock;
  }

  /**
   * Merges the symbols seen in {@code version}. Does nothing for prereleases, pseudo-versions and
   * {@code +incompatible} versions.
   *
   * @return the number of records created or lowered
   */
  @Transactional
  public int merge(String modulePath, String version, List<UnitSymbols> units) {
    if (!SinceVersionRule.isEligible(version)) {
      return 0;
    }
    Set<String> packagePaths =
        units.stream().map(UnitSymbols::packagePath).collect(Collectors.toCollection(TreeSet::new));
    if (packagePaths.isEmpty()) {
      return 0;
    }
    Map<SymbolKey, SymbolHistoryEntry> existing =
        repository.findAllByPackagePathIn(packagePaths).stream()
            .collect(Collectors.toMap(SymbolHistoryEntry::key, Function.identity()));

    Instant now = clock.instant();
    Map<SymbolKey, SymbolHistoryEntry> changed = new HashMap<>();
    for (UnitSymbols unit : units) {
      for (Symbol symbol : unit.symbols()) {
        SymbolKey key =
            new SymbolKey(unit.packagePath(), symbol.name(), symbol.parentName(), unit.buildContext());
        SymbolHistoryEntry entry = changed.getOrDefault(key, existing.get(key));
        if (entry == null) {
          entry = new SymbolHistoryEntry(key, modulePath, symbol.kind(), version);
          entry.setUpdatedAt(now);
          changed.put(key, entry);
          continue;
        }
        String since = SinceVersionRule.merge(entry.getSinceVersion(), version);
        if (!since.equals(entry.getSinceVersion())) {
          entry.setSinceVersion(since);
          entry.setModulePath(modulePath);
          entry.setSymbolKind(symbol.kind());
          entry.setUpdatedAt(now);
          changed.put(key, entry);
        }
      }
    }
    repository.saveAll(new ArrayList<>(changed.values()));
    log.debug("{}@{}: {} symbol history records written", modulePath, version, changed.size());
    return changed.size();
  }

  /** Every recorded symbol of the package, by name then build context. */
  @Transactional(readOnly = true)
  public List<SymbolSince> history(String packagePath) {
    return repository
        .findAllByPackagePathOrderBySymbolNameAscBuildOsAscBuildArchAsc(packagePath)
        .stream()
        .map(SymbolSince::of)
        .toList();
  }

  @Transactional(readOnly = true)
  public Optional<String> sinceVersion(SymbolKey key) {
    return repository.findAllByPackagePathIn(List.of(key.packagePath())).stream()
        .filter(e -> e.key().equals(key))
        .map(SymbolHistoryEntry::getSinceVersion)
        .findFirst();
  }
}
