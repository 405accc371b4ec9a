package dev.pinakes.storage;

import dev.pinakes.version.VersionMeta;
import dev.pinakes.version.VersionType;
import java.util.List;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

/** Lookups and deletions on stored module versions used by the write paths. */
@Repository
public class ModuleQueries {

  private final JdbcTemplate jdbcTemplate;

  public ModuleQueries(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  /** Unit paths stored for one module version, sorted. Empty when the version is not stored. */
  public List<String> unitPaths(String modulePath, String version) {
    return jdbcTemplate.queryForList(
        """
        SELECT p.path
        FROM units u
        JOIN paths p ON p.id = u.path_id
        JOIN modules m ON m.id = u.module_id
        WHERE m.module_path = ? AND m.version = ?
        ORDER BY p.path
        """,
        String.class,
        modulePath,
        version);
  }

  /** License file paths stored for one module version, sorted. */
  public List<String> licensePaths(String modulePath, String version) {
    return jdbcTemplate.queryForList(
        """
        SELECT l.file_path
        FROM licenses l
        JOIN modules m ON m.id = l.module_id
        WHERE m.module_path = ? AND m.version = ?
        ORDER BY l.file_path
        """,
        String.class,
        modulePath,
        version);
  }

  /** Every stored version of the module, as candidates for latest-version resolution. */
  public List<VersionMeta> versions(String modulePath) {
    return jdbcTemplate.query(
        "SELECT module_path, version, version_type, incompatible FROM modules WHERE module_path = ?",
        (rs, rowNum) ->
            new VersionMeta(
                rs.getString("module_path"),
                rs.getString("version"),
                VersionType.fromDbValue(rs.getString("version_type")),
                rs.getBoolean("incompatible")),
        modulePath);
  }

  public int countVersions(String modulePath) {
    Integer n =
        jdbcTemplate.queryForObject(
            "SELECT count(*) FROM modules WHERE module_path = ?", Integer.class, modulePath);
    return n == null ? 0 : n;
  }

  /**
   * Deletes the module version; units, licenses, readmes, documentation and imports go with it.
   *
   * @return whether a row was deleted
   */
  public boolean deleteModule(String modulePath, String version) {
    return jdbcTemplate.update(
            "DELETE FROM modules WHERE module_path = ? AND version = ?", modulePath, version)
        > 0;
  }
}
