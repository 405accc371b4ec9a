package dev.pinakes;

import static org.assertj.core.api.Assertions.assertThat;

import dev.pinakes.index.AlternativeModulePath;
import dev.pinakes.index.AlternativeModulePathRepository;
import dev.pinakes.latest.LatestModuleVersions;
import dev.pinakes.latest.LatestModuleVersionsRepository;
import dev.pinakes.module.BuildContext;
import dev.pinakes.module.SymbolKind;
import dev.pinakes.state.ModuleVersionState;
import dev.pinakes.state.ModuleVersionStateId;
import dev.pinakes.state.ModuleVersionStateRepository;
import dev.pinakes.state.VersionMapEntry;
import dev.pinakes.state.VersionMapRepository;
import dev.pinakes.state.VersionStatus;
import dev.pinakes.symbol.SymbolHistoryEntry;
import dev.pinakes.symbol.SymbolHistoryRepository;
import dev.pinakes.symbol.SymbolKey;
import dev.pinakes.version.Retraction;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.annotation.Transactional;

/**
 * Compensates for ddl-auto=none by verifying each JPA entity can be persisted and read back
 * against the Flyway schema.
 */
@Transactional
class JpaSchemaDriftIT extends BaseIntegrationTest {

  private static final Instant NOW = Instant.now().truncatedTo(ChronoUnit.MICROS);

  @Autowired private ModuleVersionStateRepository stateRepository;

  @Autowired private LatestModuleVersionsRepository latestRepository;

  @Autowired private SymbolHistoryRepository symbolHistoryRepository;

  @Autowired private VersionMapRepository versionMapRepository;

  @Autowired private AlternativeModulePathRepository alternativeRepository;

  @Test
  void moduleVersionStateRoundtripsAgainstFlywaySchema() {
    ModuleVersionState state = new ModuleVersionState("example.com/a", "v2.0.0+incompatible", NOW);
    state.setStatus(VersionStatus.HAS_INCOMPLETE_PACKAGES);
    state.setError("1 package missing");
    state.setTryCount(3);
    state.setNumPackages(12);
    state.setGoModPath("example.com/a");
    state.setAppVersion("20240301t120000");

    stateRepository.saveAndFlush(state);
    ModuleVersionState found =
        stateRepository
            .findById(new ModuleVersionStateId("example.com/a", "v2.0.0+incompatible"))
            .orElseThrow();

    assertThat(found.getStatus()).isEqualTo(VersionStatus.HAS_INCOMPLETE_PACKAGES);
    assertThat(found.isIncompatible()).isTrue();
    assertThat(found.getSortVersion()).isEqualTo("2,0,0~");
    assertThat(found.getTryCount()).isEqualTo(3);
    assertThat(found.getNumPackages()).isEqualTo(12);
    assertThat(found.getNextProcessedAfter()).isEqualTo(NOW);
  }

  @Test
  void latestModuleVersionsRoundtripsRetractionsAsJson() {
    LatestModuleVersions row = new LatestModuleVersions("example.com/b", NOW);
    row.setRawVersion("v1.3.0");
    row.setCookedVersion("v1.2.0");
    row.setRetractions(
        List.of(Retraction.single("v1.3.0", "broken"), new Retraction("v1.0.0", "v1.0.5", null)));
    row.setDeprecated(true);
    row.setDeprecationComment("use example.com/c");
    row.setStatus(LatestModuleVersions.STATUS_OK);

    latestRepository.saveAndFlush(row);
    LatestModuleVersions found = latestRepository.findById("example.com/b").orElseThrow();

    assertThat(found.getRetractions())
        .containsExactly(
            Retraction.single("v1.3.0", "broken"), new Retraction("v1.0.0", "v1.0.5", null));
    assertThat(found.isDeprecated()).isTrue();
    assertThat(found.getGoodVersion()).isEmpty();
    assertThat(found.hasUpstreamFacts()).isTrue();
  }

  @Test
  void symbolHistoryEntryRoundtripsAgainstFlywaySchema() {
    SymbolKey key =
        new SymbolKey("example.com/c/pkg", "Client.Do", "Client", new BuildContext("linux", "amd64"));
    SymbolHistoryEntry entry =
        new SymbolHistoryEntry(key, "example.com/c", SymbolKind.METHOD, "v1.4.0");
    entry.setUpdatedAt(NOW);

    SymbolHistoryEntry saved = symbolHistoryRepository.saveAndFlush(entry);
    SymbolHistoryEntry found = symbolHistoryRepository.findById(saved.getId()).orElseThrow();

    assertThat(found.key()).isEqualTo(key);
    assertThat(found.getSymbolKind()).isEqualTo(SymbolKind.METHOD);
    assertThat(found.getSinceVersion()).isEqualTo("v1.4.0");
  }

  @Test
  void versionMapEntryRoundtripsAgainstFlywaySchema() {
    VersionMapEntry entry = new VersionMapEntry("example.com/d", "master");
    entry.setResolvedVersion("v0.0.0-20240301120000-abcdef123456");
    entry.setStatus(VersionStatus.SUCCESS);
    entry.setError(null);
    entry.setUpdatedAt(NOW);

    versionMapRepository.saveAndFlush(entry);
    VersionMapEntry found =
        versionMapRepository
            .findById(new VersionMapEntry.Key("example.com/d", "master"))
            .orElseThrow();

    assertThat(found.getResolvedVersion()).isEqualTo("v0.0.0-20240301120000-abcdef123456");
    assertThat(found.getSortVersion()).isNotEmpty();
    assertThat(found.getStatus()).isEqualTo(VersionStatus.SUCCESS);
    assertThat(found.getError()).isEmpty();
  }

  @Test
  void alternativeModulePathRoundtripsAgainstFlywaySchema() {
    alternativeRepository.saveAndFlush(
        new AlternativeModulePath("github.com/Example/mod", "example.com/mod"));

    assertThat(alternativeRepository.findById("github.com/Example/mod"))
        .hasValueSatisfying(row -> assertThat(row.getCanonical()).isEqualTo("example.com/mod"));
  }
}
