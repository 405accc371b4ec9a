package dev.pinakes.state;

import jakarta.persistence.LockModeType;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

/** Spring Data repository for {@link ModuleVersionState} entities. */
public interface ModuleVersionStateRepository
    extends JpaRepository<ModuleVersionState, ModuleVersionStateId> {

  /** Reads the state and row-locks it until the transaction ends. */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT s FROM ModuleVersionState s WHERE s.modulePath = :modulePath AND s.version = :version")
  Optional<ModuleVersionState> findForUpdate(
      @Param("modulePath") String modulePath, @Param("version") String version);

  /** Creates a new state row unless one exists. */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      value =
          """
          INSERT INTO module_version_states (module_path, version, sort_version, incompatible,
                                             status, next_processed_after, created_at)
          VALUES (:modulePath, :version, :sortVersion, :incompatible, 0, :now, :now)
          ON CONFLICT (module_path, version) DO NOTHING
          """,
      nativeQuery = true)
  int insertIfAbsent(
      @Param("modulePath") String modulePath,
      @Param("version") String version,
      @Param("sortVersion") String sortVersion,
      @Param("incompatible") boolean incompatible,
      @Param("now") Instant now);

  /** Eligible states whose backoff has expired, longest-waiting first. */
  @Query(
      """
      SELECT s FROM ModuleVersionState s
      WHERE (s.status = 0 OR s.status >= 500) AND s.nextProcessedAfter <= :now
      ORDER BY s.nextProcessedAfter
      """)
  List<ModuleVersionState> findDue(@Param("now") Instant now, Pageable page);

  /**
   * The latest known version of each given module as {@code [module_path, version]} rows:
   * compatible before incompatible, releases before other versions, then highest version.
   */
  @Query(
      value =
          """
          SELECT DISTINCT ON (module_path) module_path, version
          FROM module_version_states
          WHERE module_path IN (:modulePaths)
          ORDER BY module_path, incompatible, right(sort_version, 1) = '~' DESC, sort_version DESC
          """,
      nativeQuery = true)
  List<Object[]> findLatestVersions(@Param("modulePaths") Collection<String> modulePaths);

  @Query(
      """
      SELECT s FROM ModuleVersionState s
      WHERE s.status >= 400
      ORDER BY s.lastProcessedAt DESC NULLS LAST
      """)
  List<ModuleVersionState> findRecentFailures(Pageable page);

  @Query("SELECT s FROM ModuleVersionState s ORDER BY s.indexTimestamp DESC NULLS LAST")
  List<ModuleVersionState> findRecentlyIndexed(Pageable page);

  List<ModuleVersionState> findAllByModulePath(String modulePath);

  @Query("SELECT s.status, COUNT(s) FROM ModuleVersionState s GROUP BY s.status")
  List<Object[]> countByStatus();

  @Query("SELECT MAX(s.indexTimestamp) FROM ModuleVersionState s")
  Optional<Instant> findLatestIndexTimestamp();

  /**
   * Moves rows processed by an older app version from {@code from} to {@code to} and makes them
   * due now.
   */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      """
      UPDATE ModuleVersionState s
      SET s.status = :to, s.nextProcessedAfter = :now
      WHERE s.status = :from AND s.appVersion < :appVersion
      """)
  int markForReprocessing(
      @Param("from") int from,
      @Param("to") int to,
      @Param("appVersion") String appVersion,
      @Param("now") Instant now);

  /** Marks a version as removed by the retention sweep. */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query(
      """
      UPDATE ModuleVersionState s
      SET s.status = 493, s.error = :reason
      WHERE s.modulePath = :modulePath AND s.version = :version
      """)
  int markCleaned(
      @Param("modulePath") String modulePath,
      @Param("version") String version,
      @Param("reason") String reason);
}
