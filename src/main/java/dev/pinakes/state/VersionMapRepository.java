package dev.pinakes.state;

import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

/** Spring Data repository for {@link VersionMapEntry} entities. */
public interface VersionMapRepository extends JpaRepository<VersionMapEntry, VersionMapEntry.Key> {

  List<VersionMapEntry> findAllByModulePath(String modulePath);

  boolean existsByModulePathAndResolvedVersionAndRequestedVersionIn(
      String modulePath, String resolvedVersion, Collection<String> requestedVersions);

  void deleteAllByModulePathAndResolvedVersion(String modulePath, String resolvedVersion);

  void deleteAllByModulePath(String modulePath);
}
