package dev.pinakes.fixture;

import dev.pinakes.state.ModuleVersionState;
import dev.pinakes.state.VersionStatus;
import java.time.Instant;
import org.jspecify.annotations.Nullable;

/** Test builder for the {@link ModuleVersionState} JPA entity. */
public final class ModuleVersionStateBuilder {

  private String modulePath = "example.com/mod";
  private String version = "v1.0.0";
  private Instant now = Instant.parse("2024-03-01T12:00:00Z");
  private VersionStatus status = VersionStatus.NEW;
  private int tryCount = 0;
  private @Nullable Integer numPackages;
  private @Nullable Instant lastProcessedAt;
  private @Nullable Instant nextProcessedAfter;

  public ModuleVersionStateBuilder modulePath(String modulePath) {
    this.modulePath = modulePath;
    return this;
  }

  public ModuleVersionStateBuilder version(String version) {
    this.version = version;
    return this;
  }

  public ModuleVersionStateBuilder now(Instant now) {
    this.now = now;
    return this;
  }

  public ModuleVersionStateBuilder status(VersionStatus status) {
    this.status = status;
    return this;
  }

  public ModuleVersionStateBuilder tryCount(int tryCount) {
    this.tryCount = tryCount;
    return this;
  }

  public ModuleVersionStateBuilder numPackages(@Nullable Integer numPackages) {
    this.numPackages = numPackages;
    return this;
  }

  public ModuleVersionStateBuilder lastProcessedAt(Instant lastProcessedAt) {
    this.lastProcessedAt = lastProcessedAt;
    return this;
  }

  public ModuleVersionStateBuilder nextProcessedAfter(Instant nextProcessedAfter) {
    this.nextProcessedAfter = nextProcessedAfter;
    return this;
  }

  public ModuleVersionState build() {
    ModuleVersionState state = new ModuleVersionState(modulePath, version, now);
    state.setStatus(status);
    state.setTryCount(tryCount);
    state.setNumPackages(numPackages);
    if (lastProcessedAt != null) {
      state.setLastProcessedAt(lastProcessedAt);
    }
    if (nextProcessedAfter != null) {
      state.setNextProcessedAfter(nextProcessedAfter);
    }
    return state;
  }
}
