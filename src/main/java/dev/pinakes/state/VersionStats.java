package dev.pinakes.state;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/** Queue counts per status and the newest index timestamp seen. */
public record VersionStats(Optional<Instant> latestIndexTimestamp, Map<VersionStatus, Long> counts) {

  public long count(VersionStatus status) {
    return counts.getOrDefault(status, 0L);
  }
}
