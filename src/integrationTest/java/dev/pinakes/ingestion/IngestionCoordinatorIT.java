package dev.pinakes.ingestion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

import dev.pinakes.BaseIntegrationTest;
import dev.pinakes.NotFoundException;
import dev.pinakes.fixture.ModuleGraphBuilder;
import dev.pinakes.index.AlternativePathRegistry;
import dev.pinakes.index.ImportGraph;
import dev.pinakes.index.SearchDocument;
import dev.pinakes.latest.LatestVersionService;
import dev.pinakes.module.BuildContext;
import dev.pinakes.module.Documentation;
import dev.pinakes.module.LatestVersionsInfo;
import dev.pinakes.module.Symbol;
import dev.pinakes.module.SymbolKind;
import dev.pinakes.storage.ModuleReadService;
import dev.pinakes.symbol.SymbolHistoryLedger;
import dev.pinakes.symbol.SymbolKey;
import dev.pinakes.symbol.SymbolSince;
import dev.pinakes.version.Retraction;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class IngestionCoordinatorIT extends BaseIntegrationTest {

  private static final String MOD = "example.com/mod";

  @Autowired private IngestionCoordinator ingestionCoordinator;

  @Autowired private LatestVersionService latestVersionService;

  @Autowired private ModuleReadService moduleReadService;

  @Autowired private SymbolHistoryLedger symbolHistoryLedger;

  @Autowired private AlternativePathRegistry alternativePathRegistry;

  @Autowired private ImportGraph importGraph;

  @Test
  void highestReleaseBecomesGoodVersionAndFeedsSearch() {
    ingestionCoordinator.ingest(new ModuleGraphBuilder().version("v1.0.0").build());
    IngestResult result =
        ingestionCoordinator.ingest(
            new ModuleGraphBuilder().version("v1.1.0").pkg("sub", "sub").build());

    assertThat(result.isLatest()).isTrue();
    assertThat(latestVersionService.goodVersion(MOD)).contains("v1.1.0");
    assertThat(moduleReadService.searchDocumentsForModule(MOD))
        .extracting(SearchDocument::packagePath, SearchDocument::version)
        .containsExactlyInAnyOrder(
            tuple(MOD, "v1.1.0"),
            tuple(MOD + "/sub", "v1.1.0"));
  }

  @Test
  void olderVersionDoesNotDisplaceGoodVersion() {
    ingestionCoordinator.ingest(new ModuleGraphBuilder().version("v1.1.0").build());

    IngestResult result =
        ingestionCoordinator.ingest(new ModuleGraphBuilder().version("v1.0.0").build());

    assertThat(result.isLatest()).isFalse();
    assertThat(result.goodVersion()).isEqualTo("v1.1.0");
    assertThat(moduleReadService.listUnitPaths(MOD, "v1.0.0")).containsExactly(MOD);
  }

  @Test
  void ingestingTheSameGraphTwiceIsIdempotent() {
    ingestionCoordinator.ingest(
        new ModuleGraphBuilder().pkg("sub", "sub").rootImports("fmt", "example.com/other").build());
    int units = count("units");
    int docs = count("documentation");
    int search = count("search_documents");
    int imports = count("imports_unique");

    ingestionCoordinator.ingest(
        new ModuleGraphBuilder().pkg("sub", "sub").rootImports("fmt", "example.com/other").build());

    assertThat(count("modules")).isEqualTo(1);
    assertThat(count("units")).isEqualTo(units);
    assertThat(count("documentation")).isEqualTo(docs);
    assertThat(count("search_documents")).isEqualTo(search);
    assertThat(count("imports_unique")).isEqualTo(imports).isEqualTo(2);
  }

  @Test
  void retractedLatestFallsBackToEarlierRelease() {
    latestVersionService.updateLatestModuleVersions(
        new LatestVersionsInfo(
            MOD, "v1.1.0", "v1.0.0", List.of(Retraction.single("v1.1.0", "broken")), false, null));

    ingestionCoordinator.ingest(new ModuleGraphBuilder().version("v1.0.0").build());
    IngestResult result =
        ingestionCoordinator.ingest(new ModuleGraphBuilder().version("v1.1.0").build());

    assertThat(result.isLatest()).isFalse();
    assertThat(latestVersionService.goodVersion(MOD)).contains("v1.0.0");
    assertThat(moduleReadService.searchDocumentsForModule(MOD))
        .extracting(SearchDocument::version)
        .containsOnly("v1.0.0");
  }

  @Test
  void alternativePathKeepsRawRowsButNoSearchRows() {
    alternativePathRegistry.register(MOD, "example.com/canonical");

    ingestionCoordinator.ingest(new ModuleGraphBuilder().rootImports("fmt").build());

    assertThat(moduleReadService.searchDocumentsForModule(MOD)).isEmpty();
    assertThat(moduleReadService.getModuleVersion(MOD, "v1.0.0").version()).isEqualTo("v1.0.0");
    assertThat(importGraph.edgesOf(MOD)).containsExactly(new ImportGraph.ImportEdge(MOD, "fmt"));
  }

  @Test
  void symbolHistoryRecordsEarliestRelease() {
    Symbol client = Symbol.topLevel("Client", SymbolKind.TYPE);
    Symbol doMethod = new Symbol("Client.Do", "Client", SymbolKind.METHOD);

    ingestionCoordinator.ingest(
        new ModuleGraphBuilder().version("v1.2.0").rootSymbols(client, doMethod).build());
    ingestionCoordinator.ingest(
        new ModuleGraphBuilder().version("v1.1.0").rootSymbols(client).build());

    assertThat(symbolHistoryLedger.history(MOD))
        .extracting(SymbolSince::symbolName, SymbolSince::sinceVersion)
        .containsExactly(
            tuple("Client", "v1.1.0"),
            tuple("Client.Do", "v1.2.0"));
    assertThat(
            symbolHistoryLedger.sinceVersion(
                new SymbolKey(MOD, "Client.Do", "Client", BuildContext.ALL)))
        .contains("v1.2.0");
  }

  @Test
  void documentationReadsBackPerBuildContext() {
    ingestionCoordinator.ingest(new ModuleGraphBuilder().build());

    Documentation doc =
        moduleReadService.getDocumentation(MOD, MOD, "v1.0.0", BuildContext.ALL);

    assertThat(doc.synopsis()).isEqualTo("Package mod does things.");
    assertThat(doc.html()).isEqualTo("<p>mod</p>");
    assertThatThrownBy(
            () ->
                moduleReadService.getDocumentation(
                    MOD, MOD, "v1.0.0", new BuildContext("windows", "amd64")))
        .isInstanceOf(NotFoundException.class);
  }

  @Test
  void withheldContentReadsAsNotFound() {
    ingestionCoordinator.ingest(new ModuleGraphBuilder().redistributable(false).build());

    assertThat(moduleReadService.getModuleVersion(MOD, "v1.0.0").redistributable()).isFalse();
    assertThatThrownBy(() -> moduleReadService.getReadme(MOD, MOD, "v1.0.0"))
        .isInstanceOf(NotFoundException.class);
    assertThatThrownBy(
            () -> moduleReadService.getDocumentation(MOD, MOD, "v1.0.0", BuildContext.ALL))
        .isInstanceOf(NotFoundException.class);
  }

  @Test
  void resubmissionMissingUnitsIsRejectedAndStoreUnchanged() {
    ingestionCoordinator.ingest(new ModuleGraphBuilder().pkg("sub", "sub").build());

    assertThatThrownBy(() -> ingestionCoordinator.ingest(new ModuleGraphBuilder().build()))
        .isInstanceOf(IncompleteResubmissionException.class)
        .hasMessageContaining(MOD + "/sub");

    assertThat(moduleReadService.listUnitPaths(MOD, "v1.0.0"))
        .containsExactlyInAnyOrder(MOD, MOD + "/sub");
  }
}
