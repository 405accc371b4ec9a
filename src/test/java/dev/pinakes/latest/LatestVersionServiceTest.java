package dev.pinakes.latest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.AdditionalAnswers.returnsFirstArg;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.pinakes.NotFoundException;
import dev.pinakes.lock.ModuleLock;
import dev.pinakes.module.LatestVersionsInfo;
import dev.pinakes.storage.ModuleQueries;
import dev.pinakes.version.Retraction;
import dev.pinakes.version.VersionMeta;
import java.lang.reflect.Field;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class LatestVersionServiceTest {

  private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");
  private static final String MOD = "example.com/mod";

  @Mock LatestModuleVersionsRepository repository;

  @Mock ModuleQueries moduleQueries;

  @Mock ModuleLock moduleLock;

  LatestVersionService service;

  @BeforeEach
  void setUp() {
    service =
        new LatestVersionService(
            repository, moduleQueries, moduleLock, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private void stubLockRunsBody() {
    when(moduleLock.withModuleLock(anyString(), any()))
        .thenAnswer(inv -> inv.<Supplier<?>>getArgument(1).get());
  }

  private static LatestModuleVersions pointer(
      String good, String raw, String cooked, int status, Retraction... retractions) {
    LatestModuleVersions row = new LatestModuleVersions(MOD, NOW);
    row.setRawVersion(raw);
    row.setCookedVersion(cooked);
    row.setStatus(status);
    row.setRetractions(List.of(retractions));
    setGoodVersion(row, good);
    return row;
  }

  private static void setGoodVersion(LatestModuleVersions row, String good) {
    try {
      Field field = LatestModuleVersions.class.getDeclaredField("goodVersion");
      field.setAccessible(true);
      field.set(row, good);
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Failed to set goodVersion", e);
    }
  }

  private static List<VersionMeta> versions(String... versions) {
    return Arrays.stream(versions).map(v -> VersionMeta.of(MOD, v)).toList();
  }

  // --- recomputeGoodVersion ---

  @Test
  void recomputeAppliesUpstreamRetractions() {
    when(repository.findById(MOD))
        .thenReturn(
            Optional.of(
                pointer(
                    "v1.1.0",
                    "v1.1.0",
                    "v1.1.0",
                    LatestModuleVersions.STATUS_OK,
                    Retraction.single("v1.1.0", "broken"))));
    when(moduleQueries.versions(MOD)).thenReturn(versions("v1.0.0", "v1.1.0"));

    GoodVersionChange change = service.recomputeGoodVersion(MOD);

    assertThat(change.previous()).isEqualTo("v1.1.0");
    assertThat(change.current()).isEqualTo("v1.0.0");
    assertThat(change.changed()).isTrue();
    verify(repository).upsertGoodVersion(MOD, "v1.0.0", NOW);
  }

  @Test
  void recomputeIgnoresFactsOfFailedLookup() {
    when(repository.findById(MOD))
        .thenReturn(
            Optional.of(pointer("", "", "v1.0.0", 404, Retraction.single("v2.0.0", null))));
    when(moduleQueries.versions(MOD)).thenReturn(versions("v1.0.0", "v2.0.0+incompatible"));

    GoodVersionChange change = service.recomputeGoodVersion(MOD);

    assertThat(change.current()).isEqualTo("v2.0.0+incompatible");
  }

  @Test
  void recomputeWithoutPointerCreatesOne() {
    when(repository.findById(MOD)).thenReturn(Optional.empty());
    when(moduleQueries.versions(MOD)).thenReturn(versions("v0.1.0"));

    GoodVersionChange change = service.recomputeGoodVersion(MOD);

    assertThat(change).isEqualTo(new GoodVersionChange("", "v0.1.0"));
    verify(repository).upsertGoodVersion(MOD, "v0.1.0", NOW);
  }

  @Test
  void recomputeWithNoStoredVersionsClearsGoodVersion() {
    when(repository.findById(MOD)).thenReturn(Optional.of(pointer("v1.0.0", "", "", 0)));
    when(moduleQueries.versions(MOD)).thenReturn(List.of());

    GoodVersionChange change = service.recomputeGoodVersion(MOD);

    assertThat(change.current()).isEmpty();
    assertThat(change.hasGoodVersion()).isFalse();
    verify(repository).upsertGoodVersion(MOD, "", NOW);
  }

  // --- updateLatestModuleVersions ---

  @Test
  void newerRawVersionReplacesFacts() {
    stubLockRunsBody();
    when(repository.findById(MOD))
        .thenReturn(Optional.of(pointer("v1.0.0", "v1.0.0", "v1.0.0", 200)));
    when(repository.save(any(LatestModuleVersions.class))).then(returnsFirstArg());

    ResolvedLatest resolved =
        service.updateLatestModuleVersions(
            new LatestVersionsInfo(
                MOD,
                "v1.1.0",
                "v1.1.0",
                List.of(Retraction.single("v1.0.0", "bad")),
                true,
                "use v2"));

    assertThat(resolved.rawVersion()).isEqualTo("v1.1.0");
    assertThat(resolved.deprecated()).isTrue();
    assertThat(resolved.retractions()).hasSize(1);
    assertThat(resolved.goodVersion()).contains("v1.0.0");
  }

  @Test
  void olderRawVersionIsIgnored() {
    stubLockRunsBody();
    when(repository.findById(MOD))
        .thenReturn(Optional.of(pointer("v1.1.0", "v1.1.0", "v1.1.0", 200)));

    ResolvedLatest resolved =
        service.updateLatestModuleVersions(
            new LatestVersionsInfo(MOD, "v1.0.0", "v1.0.0", List.of(), false, null));

    assertThat(resolved.rawVersion()).isEqualTo("v1.1.0");
    verify(repository, never()).save(any());
  }

  @Test
  void rowWithoutFactsAcceptsAnyVersion() {
    stubLockRunsBody();
    when(repository.findById(MOD)).thenReturn(Optional.of(pointer("v1.1.0", "v1.1.0", "", 404)));
    when(repository.save(any(LatestModuleVersions.class))).then(returnsFirstArg());

    ResolvedLatest resolved =
        service.updateLatestModuleVersions(
            new LatestVersionsInfo(MOD, "v1.0.0", "v1.0.0", List.of(), false, null));

    assertThat(resolved.rawVersion()).isEqualTo("v1.0.0");
  }

  @Test
  void failedLookupDoesNotOverwriteValidFacts() {
    stubLockRunsBody();
    when(repository.findById(MOD))
        .thenReturn(Optional.of(pointer("v1.0.0", "v1.0.0", "v1.0.0", 200)));

    service.updateLatestModuleVersionsStatus(MOD, 404);

    verify(repository, never()).save(any());
  }

  @Test
  void failedLookupIsRecordedOnNewRow() {
    stubLockRunsBody();
    when(repository.findById(MOD)).thenReturn(Optional.empty());
    ArgumentCaptor<LatestModuleVersions> saved =
        ArgumentCaptor.forClass(LatestModuleVersions.class);
    when(repository.save(saved.capture())).then(returnsFirstArg());

    service.updateLatestModuleVersionsStatus(MOD, 404);

    assertThat(saved.getValue().getStatus()).isEqualTo(404);
    assertThat(saved.getValue().hasUpstreamFacts()).isFalse();
  }

  // --- reads ---

  @Test
  void unknownModuleIsNotFound() {
    when(repository.findById(MOD)).thenReturn(Optional.empty());

    assertThatThrownBy(() -> service.resolveLatest(MOD))
        .isInstanceOf(NotFoundException.class)
        .hasMessageContaining(MOD);
  }

  @Test
  void emptyGoodVersionReadsAsAbsent() {
    when(repository.findById(MOD)).thenReturn(Optional.of(pointer("", "", "", 0)));

    assertThat(service.goodVersion(MOD)).isEmpty();
    assertThat(service.resolveLatest(MOD).goodVersion()).isEmpty();
  }

  @Test
  void rawRecencyPrefersCompatibleOverIncompatible() {
    assertThat(LatestVersionService.rawIsMoreRecent("v1.1.0", "v1.0.0")).isTrue();
    assertThat(LatestVersionService.rawIsMoreRecent("v1.0.0", "v1.1.0")).isFalse();
    assertThat(LatestVersionService.rawIsMoreRecent("v1.0.0", "v2.0.0+incompatible")).isTrue();
    assertThat(LatestVersionService.rawIsMoreRecent("v3.0.0+incompatible", "v1.0.0")).isTrue();
  }
}
