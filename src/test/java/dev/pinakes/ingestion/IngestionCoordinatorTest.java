package dev.pinakes.ingestion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import dev.pinakes.fixture.ModuleGraphBuilder;
import dev.pinakes.index.DerivedViews;
import dev.pinakes.latest.GoodVersionChange;
import dev.pinakes.latest.LatestVersionService;
import dev.pinakes.lock.ModuleLock;
import dev.pinakes.module.BuildContext;
import dev.pinakes.module.Documentation;
import dev.pinakes.module.ModuleGraph;
import dev.pinakes.module.Symbol;
import dev.pinakes.module.SymbolKind;
import dev.pinakes.module.Unit;
import dev.pinakes.storage.ModuleQueries;
import dev.pinakes.storage.ModuleWriter;
import dev.pinakes.symbol.SymbolHistoryLedger;
import dev.pinakes.symbol.UnitSymbols;
import java.util.List;
import java.util.function.Supplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.transaction.support.TransactionOperations;

@ExtendWith(MockitoExtension.class)
class IngestionCoordinatorTest {

  private static final String MOD = "example.com/mod";

  @Mock ModuleValidator validator;

  @Mock ModuleQueries moduleQueries;

  @Mock ModuleWriter moduleWriter;

  @Mock ModuleLock moduleLock;

  @Mock LatestVersionService latestVersionService;

  @Mock SymbolHistoryLedger symbolHistoryLedger;

  @Mock DerivedViews derivedViews;

  @Captor ArgumentCaptor<ModuleGraph> writtenGraph;

  @Captor ArgumentCaptor<List<UnitSymbols>> mergedSymbols;

  IngestionProperties properties;

  IngestionCoordinator coordinator;

  @BeforeEach
  void setUp() {
    properties = new IngestionProperties();
    coordinator =
        new IngestionCoordinator(
            validator,
            moduleQueries,
            moduleWriter,
            moduleLock,
            latestVersionService,
            symbolHistoryLedger,
            derivedViews,
            properties,
            TransactionOperations.withoutTransaction());
  }

  private void stubEmptyStore() {
    when(moduleQueries.unitPaths(anyString(), anyString())).thenReturn(List.of());
    when(moduleQueries.licensePaths(anyString(), anyString())).thenReturn(List.of());
  }

  private void stubLockRunsBody() {
    when(moduleLock.withModuleLock(anyString(), any()))
        .thenAnswer(inv -> inv.<Supplier<?>>getArgument(1).get());
  }

  // --- Happy path ---

  @Test
  void newLatestVersionRefreshesDerivedViews() {
    ModuleGraph graph =
        new ModuleGraphBuilder().rootSymbols(Symbol.topLevel("Run", SymbolKind.FUNCTION)).build();
    stubEmptyStore();
    stubLockRunsBody();
    when(moduleWriter.upsertModule(graph)).thenReturn(42L);
    when(latestVersionService.recomputeGoodVersion(MOD))
        .thenReturn(new GoodVersionChange("", "v1.0.0"));

    IngestResult result = coordinator.ingest(graph);

    assertThat(result.isLatest()).isTrue();
    assertThat(result.goodVersion()).isEqualTo("v1.0.0");
    InOrder order = inOrder(moduleWriter, latestVersionService, symbolHistoryLedger, derivedViews);
    order.verify(moduleWriter).upsertModule(graph);
    order.verify(moduleWriter).writeContents(42L, graph);
    order.verify(latestVersionService).recomputeGoodVersion(MOD);
    order.verify(symbolHistoryLedger).merge(eq(MOD), eq("v1.0.0"), mergedSymbols.capture());
    order.verify(derivedViews).refresh(MOD, "v1.0.0");
    assertThat(mergedSymbols.getValue())
        .singleElement()
        .extracting(UnitSymbols::packagePath)
        .isEqualTo(MOD);
  }

  @Test
  void olderVersionLeavesDerivedViewsAlone() {
    ModuleGraph graph = new ModuleGraphBuilder().version("v1.0.0").build();
    stubEmptyStore();
    stubLockRunsBody();
    when(latestVersionService.recomputeGoodVersion(MOD))
        .thenReturn(new GoodVersionChange("v2.0.0", "v2.0.0"));

    IngestResult result = coordinator.ingest(graph);

    assertThat(result.isLatest()).isFalse();
    assertThat(result.goodVersion()).isEqualTo("v2.0.0");
    verify(symbolHistoryLedger).merge(eq(MOD), eq("v1.0.0"), anyList());
    verifyNoInteractions(derivedViews);
  }

  @Test
  void goodVersionMovingElsewhereStillRefreshes() {
    ModuleGraph graph = new ModuleGraphBuilder().version("v1.0.0").build();
    stubEmptyStore();
    stubLockRunsBody();
    when(latestVersionService.recomputeGoodVersion(MOD))
        .thenReturn(new GoodVersionChange("v1.1.0", "v1.2.0"));

    IngestResult result = coordinator.ingest(graph);

    assertThat(result.isLatest()).isFalse();
    verify(derivedViews).refresh(MOD, "v1.2.0");
  }

  // --- Rejections ---

  @Test
  void invalidGraphIsRejectedBeforeAnyWrite() {
    ModuleGraph graph = new ModuleGraphBuilder().version("bogus").build();
    doThrow(new InvalidModuleException(graph.coordinates(), List.of("invalid version bogus")))
        .when(validator)
        .validate(graph);

    assertThatThrownBy(() -> coordinator.ingest(graph))
        .isInstanceOf(InvalidModuleException.class);

    verifyNoInteractions(moduleWriter, moduleLock, latestVersionService, derivedViews);
  }

  @Test
  void resubmissionMissingStoredUnitsIsRejected() {
    ModuleGraph graph = new ModuleGraphBuilder().build();
    when(moduleQueries.unitPaths(MOD, "v1.0.0")).thenReturn(List.of(MOD, MOD + "/gone"));
    when(moduleQueries.licensePaths(MOD, "v1.0.0")).thenReturn(List.of("LICENSE", "NOTICE"));

    assertThatThrownBy(() -> coordinator.ingest(graph))
        .isInstanceOf(IncompleteResubmissionException.class)
        .hasMessageContaining("stored unit " + MOD + "/gone missing from resubmission")
        .hasMessageContaining("stored license NOTICE missing from resubmission");

    verifyNoInteractions(moduleWriter);
  }

  @Test
  void supersetResubmissionIsAccepted() {
    ModuleGraph graph = new ModuleGraphBuilder().pkg("extra", "extra").build();
    when(moduleQueries.unitPaths(MOD, "v1.0.0")).thenReturn(List.of(MOD));
    when(moduleQueries.licensePaths(MOD, "v1.0.0")).thenReturn(List.of("LICENSE"));
    stubLockRunsBody();
    when(latestVersionService.recomputeGoodVersion(MOD))
        .thenReturn(new GoodVersionChange("v1.0.0", "v1.0.0"));

    IngestResult result = coordinator.ingest(graph);

    assertThat(result.isLatest()).isTrue();
    verify(derivedViews).refresh(MOD, "v1.0.0");
  }

  // --- License policy ---

  @Test
  void nonRedistributableContentIsWithheldBeforeWriting() {
    ModuleGraph graph = new ModuleGraphBuilder().redistributable(false).build();
    stubEmptyStore();
    stubLockRunsBody();
    when(latestVersionService.recomputeGoodVersion(MOD))
        .thenReturn(new GoodVersionChange("", "v1.0.0"));

    coordinator.ingest(graph);

    verify(moduleWriter).writeContents(any(Long.class), writtenGraph.capture());
    Unit root = writtenGraph.getValue().units().get(0);
    assertThat(root.readme().contents()).isNull();
    assertThat(root.documentation().get(0).html()).isNull();
  }

  @Test
  void bypassKeepsNonRedistributableContent() {
    properties.setBypassLicenseCheck(true);
    ModuleGraph graph = new ModuleGraphBuilder().redistributable(false).build();
    stubEmptyStore();
    stubLockRunsBody();
    when(latestVersionService.recomputeGoodVersion(MOD))
        .thenReturn(new GoodVersionChange("", "v1.0.0"));

    coordinator.ingest(graph);

    verify(moduleWriter).writeContents(any(Long.class), writtenGraph.capture());
    assertThat(writtenGraph.getValue().units().get(0).readme().contents()).isEqualTo("# mod");
  }

  // --- Failure propagation ---

  @Test
  void storeFailureAfterWriteSkipsDerivedViews() {
    ModuleGraph graph = new ModuleGraphBuilder().build();
    stubEmptyStore();
    stubLockRunsBody();
    when(latestVersionService.recomputeGoodVersion(MOD))
        .thenThrow(new QueryTimeoutException("slow"));

    assertThatThrownBy(() -> coordinator.ingest(graph))
        .isInstanceOf(QueryTimeoutException.class);

    verify(symbolHistoryLedger, never()).merge(anyString(), anyString(), anyList());
    verifyNoInteractions(derivedViews);
  }

  // --- symbolsOf ---

  @Test
  void symbolsOfSkipsDirectoriesAndEmptyDocumentation() {
    BuildContext linux = new BuildContext("linux", "amd64");
    Unit withSymbols =
        new Unit(
            MOD + "/a",
            "a",
            true,
            List.of(),
            null,
            List.of(
                new Documentation(
                    BuildContext.ALL, "A.", null, List.of(Symbol.topLevel("A", SymbolKind.TYPE))),
                new Documentation(linux, "A.", null, List.of())),
            List.of());
    Unit directory = new Unit(MOD + "/dir", null, true, List.of(), null, List.of(), List.of());
    ModuleGraph graph =
        new ModuleGraphBuilder().rootDirectory().unit(withSymbols).unit(directory).build();

    List<UnitSymbols> symbols = IngestionCoordinator.symbolsOf(graph);

    assertThat(symbols)
        .singleElement()
        .satisfies(
            u -> {
              assertThat(u.packagePath()).isEqualTo(MOD + "/a");
              assertThat(u.buildContext()).isEqualTo(BuildContext.ALL);
            });
  }
}
