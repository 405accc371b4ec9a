package dev.pinakes.state;

import java.time.Clock;
import java.util.Optional;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Records how requested versions resolved, one row per module path and requested version. */
@Service
public class VersionMapService {

  private final VersionMapRepository repository;
  private final Clock clock;

  public VersionMapService(VersionMapRepository repository, Clock clock) {
    this.repository = repository;
    this.clock = clock;
  }

  @Transactional
  public VersionMapEntry upsert(
      String modulePath,
      String requestedVersion,
      @Nullable String resolvedVersion,
      VersionStatus status,
      @Nullable String error) {
    VersionMapEntry entry =
        repository
            .findById(new VersionMapEntry.Key(modulePath, requestedVersion))
            .orElseGet(() -> new VersionMapEntry(modulePath, requestedVersion));
    entry.setResolvedVersion(resolvedVersion);
    entry.setStatus(status);
    entry.setError(error);
    entry.setUpdatedAt(clock.instant());
    return repository.save(entry);
  }

  @Transactional(readOnly = true)
  public Optional<VersionMapEntry> find(String modulePath, String requestedVersion) {
    return repository.findById(new VersionMapEntry.Key(modulePath, requestedVersion));
  }
}
