package dev.pinakes.retention;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.pinakes.BaseIntegrationTest;
import dev.pinakes.NotFoundException;
import dev.pinakes.fixture.ModuleGraphBuilder;
import dev.pinakes.ingestion.IngestionCoordinator;
import dev.pinakes.latest.LatestVersionService;
import dev.pinakes.module.ModuleVersionRef;
import dev.pinakes.state.VersionMapService;
import dev.pinakes.state.VersionStatus;
import dev.pinakes.state.WorkQueueService;
import dev.pinakes.storage.ModuleReadService;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class RetentionSweeperIT extends BaseIntegrationTest {

  private static final String MOD = "example.com/mod";
  private static final String OLD_PSEUDO = "v0.0.0-20230101000000-abcdef123456";
  private static final String MASTER_PSEUDO = "v0.0.0-20230201000000-0123456789ab";

  @Autowired private RetentionSweeper retentionSweeper;

  @Autowired private IngestionCoordinator ingestionCoordinator;

  @Autowired private WorkQueueService workQueue;

  @Autowired private VersionMapService versionMapService;

  @Autowired private LatestVersionService latestVersionService;

  @Autowired private ModuleReadService moduleReadService;

  @Test
  void sweepRemovesOldUnreferencedPseudoVersionsOnly() {
    ingestionCoordinator.ingest(new ModuleGraphBuilder().version("v1.0.0").build());
    ingestionCoordinator.ingest(new ModuleGraphBuilder().version(OLD_PSEUDO).build());
    ingestionCoordinator.ingest(new ModuleGraphBuilder().version(MASTER_PSEUDO).build());
    workQueue.record(MOD, OLD_PSEUDO, VersionStatus.SUCCESS, "");
    versionMapService.upsert(MOD, "master", MASTER_PSEUDO, VersionStatus.SUCCESS, null);
    ageModules(60);

    assertThat(retentionSweeper.findVersionsToClean(30, 100))
        .containsExactly(new ModuleVersionRef(MOD, OLD_PSEUDO));

    int cleaned = retentionSweeper.sweep();

    assertThat(cleaned).isEqualTo(1);
    assertThatThrownBy(() -> moduleReadService.getModuleVersion(MOD, OLD_PSEUDO))
        .isInstanceOf(NotFoundException.class);
    assertThat(moduleReadService.listUnitPaths(MOD, MASTER_PSEUDO)).containsExactly(MOD);
    assertThat(workQueue.getState(MOD, OLD_PSEUDO).getStatus()).isEqualTo(VersionStatus.CLEANED);
    assertThat(latestVersionService.goodVersion(MOD)).contains("v1.0.0");
  }

  @Test
  void cleanKeepsVersionThatIsStillReferenced() {
    ingestionCoordinator.ingest(new ModuleGraphBuilder().version(OLD_PSEUDO).build());
    assertThat(latestVersionService.goodVersion(MOD)).contains(OLD_PSEUDO);

    int cleaned =
        retentionSweeper.clean(List.of(new ModuleVersionRef(MOD, OLD_PSEUDO)), "manual");

    assertThat(cleaned).isZero();
    assertThat(moduleReadService.listUnitPaths(MOD, OLD_PSEUDO)).containsExactly(MOD);
  }

  @Test
  void recentPseudoVersionsAreKept() {
    ingestionCoordinator.ingest(new ModuleGraphBuilder().version("v1.0.0").build());
    ingestionCoordinator.ingest(new ModuleGraphBuilder().version(OLD_PSEUDO).build());
    ageModules(10);

    assertThat(retentionSweeper.findVersionsToClean(30, 100)).isEmpty();
    assertThat(retentionSweeper.sweep()).isZero();
  }

  @Test
  void cleaningEveryVersionClearsGoodVersionAndDerivedRows() {
    ingestionCoordinator.ingest(
        new ModuleGraphBuilder().version("v1.0.0").rootImports("fmt").build());
    assertThat(count("search_documents")).isEqualTo(1);

    int cleaned = retentionSweeper.cleanAllVersions(MOD, "module removed upstream");

    assertThat(cleaned).isEqualTo(1);
    assertThat(count("modules")).isZero();
    assertThat(count("search_documents")).isZero();
    assertThat(count("imports_unique")).isZero();
    assertThat(latestVersionService.goodVersion(MOD)).isEmpty();
  }

  private void ageModules(int days) {
    jdbcTemplate.update("UPDATE modules SET updated_at = now() - make_interval(days => ?)", days);
  }
}
