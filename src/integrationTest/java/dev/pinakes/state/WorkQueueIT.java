package dev.pinakes.state;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

import dev.pinakes.BaseIntegrationTest;
import dev.pinakes.fixture.ModuleGraphBuilder;
import dev.pinakes.index.AlternativePathRegistry;
import dev.pinakes.ingestion.IngestionCoordinator;
import dev.pinakes.storage.ModuleReadService;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

class WorkQueueIT extends BaseIntegrationTest {

  private static final Instant INDEXED = Instant.parse("2024-03-01T12:00:00Z");

  @Autowired private WorkQueueService workQueue;

  @Autowired private VersionMapService versionMapService;

  @Autowired private IngestionCoordinator ingestionCoordinator;

  @Autowired private ModuleReadService moduleReadService;

  @Autowired private AlternativePathRegistry alternativePathRegistry;

  @Test
  void enqueuedVersionsAreDueWithLatestReleaseFirst() {
    workQueue.enqueueIndexVersions(
        List.of(
            new IndexVersion("example.com/a", "v1.0.0", INDEXED),
            new IndexVersion("example.com/a", "v1.1.0", INDEXED),
            new IndexVersion("example.com/b", "v0.1.0", INDEXED)));

    List<PendingItem> batch = workQueue.nextBatch(10);

    assertThat(batch).hasSize(3);
    assertThat(batch.get(0).bucket()).isEqualTo(1);
    assertThat(batch)
        .filteredOn(item -> item.modulePath().equals("example.com/a"))
        .extracting(PendingItem::version)
        .containsExactly("v1.1.0", "v1.0.0");
    assertThat(workQueue.latestIndexTimestamp()).contains(INDEXED);
  }

  @Test
  void latestIsJudgedOverAllVersionsNotOnlyDueOnes() {
    workQueue.enqueueIndexVersions(
        List.of(
            new IndexVersion("example.com/a", "v1.0.0", INDEXED),
            new IndexVersion("example.com/a", "v2.0.0", INDEXED),
            new IndexVersion("example.com/b", "v1.0.0", INDEXED)));
    workQueue.record("example.com/a", "v2.0.0", VersionStatus.SUCCESS, "");
    workQueue.record(
        new VersionStateUpdate(
            "example.com/a", "v1.0.0", VersionStatus.TRANSIENT_FAILURE, "timeout", "dev", null, 1));
    workQueue.record(
        new VersionStateUpdate(
            "example.com/b", "v1.0.0", VersionStatus.TRANSIENT_FAILURE, "timeout", "dev", null, 10));
    jdbcTemplate.update(
        "UPDATE module_version_states SET next_processed_after = now() - interval '1 minute'");

    List<PendingItem> batch = workQueue.nextBatch(2);

    assertThat(batch)
        .extracting(PendingItem::modulePath, PendingItem::bucket)
        .containsExactly(tuple("example.com/b", 1), tuple("example.com/a", 3));
  }

  @Test
  void failedAttemptIsBackedOffAndSuccessLeavesTheQueue() {
    workQueue.enqueueIndexVersions(
        List.of(
            new IndexVersion("example.com/a", "v1.0.0", INDEXED),
            new IndexVersion("example.com/b", "v1.0.0", INDEXED)));

    workQueue.record("example.com/a", "v1.0.0", VersionStatus.TRANSIENT_FAILURE, "timeout");
    workQueue.record("example.com/b", "v1.0.0", VersionStatus.SUCCESS, "");

    assertThat(workQueue.nextBatch(10)).isEmpty();
    ModuleVersionState failed = workQueue.getState("example.com/a", "v1.0.0");
    assertThat(failed.getTryCount()).isEqualTo(1);
    assertThat(failed.getNextProcessedAfter()).isAfter(failed.getLastProcessedAt());
    assertThat(workQueue.versionStats().count(VersionStatus.SUCCESS)).isEqualTo(1);
    assertThat(workQueue.recentFailures(10))
        .extracting(ModuleVersionState::getModulePath)
        .containsExactly("example.com/a");
  }

  @Test
  void recordingCreatesMissingStateRows() {
    ModuleVersionState state =
        workQueue.record(
            "example.com/new", "v2.0.0+incompatible", VersionStatus.NOT_FOUND, "gone");

    assertThat(state.getStatus()).isEqualTo(VersionStatus.NOT_FOUND);
    assertThat(state.isIncompatible()).isTrue();
    assertThat(state.getError()).isEqualTo("gone");
  }

  @Test
  void outcomesOfOlderAppVersionsAreRequeued() {
    workQueue.record(
        new VersionStateUpdate(
            "example.com/a", "v1.0.0", VersionStatus.SUCCESS, "", "20240101", null, 3));
    workQueue.record(
        new VersionStateUpdate(
            "example.com/b", "v1.0.0", VersionStatus.SUCCESS, "", "20240601", null, 1));

    int moved = workQueue.resetForReprocessing("20240301");

    assertThat(moved).isEqualTo(1);
    assertThat(workQueue.getState("example.com/a", "v1.0.0").getStatus())
        .isEqualTo(VersionStatus.REPROCESS_SUCCESS);
    assertThat(workQueue.nextBatch(10))
        .extracting(PendingItem::modulePath)
        .containsExactly("example.com/a");
  }

  @Test
  void alternativePathOutcomeSuppressesOlderSearchRows() {
    ingestionCoordinator.ingest(new ModuleGraphBuilder().version("v1.0.0").build());
    assertThat(moduleReadService.searchDocumentsForModule("example.com/mod")).hasSize(1);

    workQueue.record(
        new VersionStateUpdate(
            "example.com/mod",
            "v1.1.0",
            VersionStatus.ALTERNATIVE_PATH,
            "module declares example.com/canonical",
            "dev",
            "example.com/canonical",
            null));

    assertThat(moduleReadService.searchDocumentsForModule("example.com/mod")).isEmpty();
    assertThat(alternativePathRegistry.isAlternative("example.com/mod", "v1.0.0")).isTrue();
  }

  @Test
  void versionMapKeepsOneRowPerRequest() {
    versionMapService.upsert(
        "example.com/a", "master", null, VersionStatus.TRANSIENT_FAILURE, "timeout");
    versionMapService.upsert(
        "example.com/a",
        "master",
        "v0.0.0-20240301120000-abcdef123456",
        VersionStatus.SUCCESS,
        null);

    assertThat(versionMapService.find("example.com/a", "master"))
        .hasValueSatisfying(
            entry -> {
              assertThat(entry.getResolvedVersion())
                  .isEqualTo("v0.0.0-20240301120000-abcdef123456");
              assertThat(entry.getStatus()).isEqualTo(VersionStatus.SUCCESS);
              assertThat(entry.getError()).isEmpty();
            });
    assertThat(count("version_map")).isEqualTo(1);
  }
}
