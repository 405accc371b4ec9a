package dev.pinakes.ingestion;

import dev.pinakes.index.DerivedViews;
import dev.pinakes.latest.GoodVersionChange;
import dev.pinakes.latest.LatestVersionService;
import dev.pinakes.lock.ModuleLock;
import dev.pinakes.module.Documentation;
import dev.pinakes.module.License;
import dev.pinakes.module.ModuleGraph;
import dev.pinakes.module.Unit;
import dev.pinakes.storage.ModuleQueries;
import dev.pinakes.storage.ModuleWriter;
import dev.pinakes.symbol.SymbolHistoryLedger;
import dev.pinakes.symbol.UnitSymbols;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionOperations;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Stores module versions and keeps each module's good version and derived views in step.
 *
 * <p>Pipeline: validate -> consistency check -> withhold non-redistributable content -> write
 * entity graph -> lock module -> recompute good version -> merge symbol history -> refresh
 * derived tables. Everything after the pre-checks runs in one {@code READ_COMMITTED} transaction,
 * so statements issued after the module lock is acquired see every version committed by the
 * previous holder. A failure anywhere rolls the whole version back.
 *
 * <p>Writers of the same version are serialized by the row lock taken when the {@code modules}
 * row is upserted; the consistency check is repeated after that point.
 */
@Service
public class IngestionCoordinator {

  private static final Logger log = LoggerFactory.getLogger(IngestionCoordinator.class);

  private final ModuleValidator validator;
  private final ModuleQueries moduleQueries;
  private final ModuleWriter moduleWriter;
  private final ModuleLock moduleLock;
  private final LatestVersionService latestVersionService;
  private final SymbolHistoryLedger symbolHistoryLedger;
  private final DerivedViews derivedViews;
  private final IngestionProperties properties;
  private final TransactionOperations transactions;

  @Autowired
  public IngestionCoordinator(
      ModuleValidator validator,
      ModuleQueries moduleQueries,
      ModuleWriter moduleWriter,
      ModuleLock moduleLock,
      LatestVersionService latestVersionService,
      SymbolHistoryLedger symbolHistoryLedger,
      DerivedViews derivedViews,
      IngestionProperties properties,
      PlatformTransactionManager transactionManager) {
    this(
        validator,
        moduleQueries,
        moduleWriter,
        moduleLock,
        latestVersionService,
        symbolHistoryLedger,
        derivedViews,
        properties,
        readCommitted(transactionManager));
  }

  IngestionCoordinator(
      ModuleValidator validator,
      ModuleQueries moduleQueries,
      ModuleWriter moduleWriter,
      ModuleLock moduleLock,
      LatestVersionService latestVersionService,
      SymbolHistoryLedger symbolHistoryLedger,
      DerivedViews derivedViews,
      IngestionProperties properties,
      TransactionOperations transactions) {
    this.validator = validator;
    this.moduleQueries = moduleQueries;
    this.moduleWriter = moduleWriter;
    this.moduleLock = moduleLock;
    this.latestVersionService = latestVersionService;
    this.symbolHistoryLedger = symbolHistoryLedger;
    this.derivedViews = derivedViews;
    this.properties = properties;
    this.transactions = transactions;
  }

  /**
   * Stores one module version.
   *
   * <p>Idempotent: ingesting the same graph twice leaves the store as after the first call.
   * Store failures surface as Spring {@code DataAccessException}s and are not retried here.
   *
   * @return whether the version is now the module's good version, and what that version is
   * @throws InvalidModuleException if the graph is malformed
   * @throws IncompleteResubmissionException if the graph omits units or licenses stored for the
   *     same version earlier
   */
  public IngestResult ingest(ModuleGraph graph) {
    validator.validate(graph);
    checkConsistency(graph);
    ModuleGraph toStore =
        properties.isBypassLicenseCheck() ? graph : RedistributabilityFilter.apply(graph);
    IngestResult result = transactions.execute(status -> write(toStore));
    if (result == null) {
      throw new IllegalStateException("ingest(" + graph.coordinates() + "): no result");
    }
    log.info(
        "Ingested {} ({} units), latest={}, good version {}",
        graph.coordinates(),
        graph.units().size(),
        result.isLatest(),
        result.hasGoodVersion() ? result.goodVersion() : "<none>");
    return result;
  }

  private IngestResult write(ModuleGraph graph) {
    long moduleId = moduleWriter.upsertModule(graph);
    checkConsistency(graph);
    moduleWriter.writeContents(moduleId, graph);

    String modulePath = graph.modulePath();
    return moduleLock.withModuleLock(
        modulePath,
        () -> {
          GoodVersionChange change = latestVersionService.recomputeGoodVersion(modulePath);
          symbolHistoryLedger.merge(modulePath, graph.version(), symbolsOf(graph));

          boolean isLatest = graph.version().equals(change.current());
          if (!isLatest && !change.changed()) {
            return new IngestResult(false, change.current());
          }
          derivedViews.refresh(modulePath, change.current());
          return new IngestResult(isLatest, change.current());
        });
  }

  /**
   * Rejects a resubmission that lacks unit paths or license files already stored for the same
   * version.
   */
  void checkConsistency(ModuleGraph graph) {
    List<String> problems = new ArrayList<>();

    Set<String> incomingUnits = new HashSet<>();
    for (Unit unit : graph.units()) {
      incomingUnits.add(unit.path());
    }
    for (String stored : moduleQueries.unitPaths(graph.modulePath(), graph.version())) {
      if (!incomingUnits.contains(stored)) {
        problems.add("stored unit " + stored + " missing from resubmission");
      }
    }

    Set<String> incomingLicenses = new HashSet<>();
    for (License license : graph.licenses()) {
      incomingLicenses.add(license.filePath());
    }
    for (String stored : moduleQueries.licensePaths(graph.modulePath(), graph.version())) {
      if (!incomingLicenses.contains(stored)) {
        problems.add("stored license " + stored + " missing from resubmission");
      }
    }

    if (!problems.isEmpty()) {
      throw new IncompleteResubmissionException(graph.coordinates(), problems);
    }
  }

  static List<UnitSymbols> symbolsOf(ModuleGraph graph) {
    List<UnitSymbols> result = new ArrayList<>();
    for (Unit unit : graph.units()) {
      if (!unit.isPackage()) {
        continue;
      }
      for (Documentation doc : unit.documentation()) {
        if (!doc.symbols().isEmpty()) {
          result.add(new UnitSymbols(unit.path(), doc.buildContext(), doc.symbols()));
        }
      }
    }
    return result;
  }

  private static TransactionOperations readCommitted(
      PlatformTransactionManager transactionManager) {
    TransactionTemplate template = new TransactionTemplate(transactionManager);
    template.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
    return template;
  }
}
