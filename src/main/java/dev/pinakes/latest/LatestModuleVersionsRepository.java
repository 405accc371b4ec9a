package dev.pinakes.latest;

import java.time.Instant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/** Spring Data repository for {@link LatestModuleVersions} entities. */
public interface LatestModuleVersionsRepository
    extends JpaRepository<LatestModuleVersions, String> {

  /**
   * Writes the good version, creating the pointer row if needed. {@code row_version} is bumped
   * only when the value actually changes.
   *
   * @return 1 when the row was inserted or changed, 0 when it already held {@code goodVersion}
   */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      value =
          """
          INSERT INTO latest_module_versions (module_path, good_version, row_version, updated_at)
          VALUES (:modulePath, :goodVersion, 1, :now)
          ON CONFLICT (module_path) DO UPDATE SET
              good_version = EXCLUDED.good_version,
              row_version = latest_module_versions.row_version + 1,
              updated_at = EXCLUDED.updated_at
          WHERE latest_module_versions.good_version IS DISTINCT FROM EXCLUDED.good_version
          """,
      nativeQuery = true)
  int upsertGoodVersion(
      @Param("modulePath") String modulePath,
      @Param("goodVersion") String goodVersion,
      @Param("now") Instant now);
}
