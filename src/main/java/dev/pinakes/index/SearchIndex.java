package dev.pinakes.index;

import dev.pinakes.version.SemanticVersion;
import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.Arrays;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Maintains {@code search_documents}, one row per package path.
 *
 * <p>Rows are built from the stored units of a module version. When two modules contain the same
 * package path (nested modules), the module with the longer path keeps the row.
 */
@Repository
public class SearchIndex {

  private static final Logger log = LoggerFactory.getLogger(SearchIndex.class);

  private final JdbcTemplate jdbcTemplate;
  private final Clock clock;

  public SearchIndex(JdbcTemplate jdbcTemplate, Clock clock) {
    this.jdbcTemplate = jdbcTemplate;
    this.clock = clock;
  }

  /**
   * Replaces the module's search rows with the packages of {@code version}.
   *
   * @return the number of package rows written
   */
  public int replaceForModule(String modulePath, String version) {
    deleteForModule(modulePath);
    int n =
        jdbcTemplate.update(
            """
            INSERT INTO search_documents (package_path, module_path, version, sort_version, name,
                                          synopsis, license_types, redistributable, commit_time,
                                          tsv_search_tokens, version_updated_at)
            SELECT p.path, m.module_path, m.version, m.sort_version, u.name,
                   COALESCE(doc.synopsis, ''), u.license_types, u.redistributable, m.commit_time,
                   setweight(to_tsvector('simple', p.path), 'A')
                       || setweight(to_tsvector('simple', u.name), 'A')
                       || setweight(to_tsvector('simple', COALESCE(doc.synopsis, '')), 'B'),
                   ?
            FROM units u
            JOIN paths p ON p.id = u.path_id
            JOIN modules m ON m.id = u.module_id
            LEFT JOIN LATERAL (
                SELECT d.synopsis
                FROM documentation d
                WHERE d.unit_id = u.id
                ORDER BY d.build_os, d.build_arch
                LIMIT 1
            ) doc ON TRUE
            WHERE m.module_path = ? AND m.version = ? AND u.name IS NOT NULL
            ON CONFLICT (package_path) DO UPDATE SET
                module_path = EXCLUDED.module_path,
                version = EXCLUDED.version,
                sort_version = EXCLUDED.sort_version,
                name = EXCLUDED.name,
                synopsis = EXCLUDED.synopsis,
                license_types = EXCLUDED.license_types,
                redistributable = EXCLUDED.redistributable,
                commit_time = EXCLUDED.commit_time,
                tsv_search_tokens = EXCLUDED.tsv_search_tokens,
                version_updated_at = EXCLUDED.version_updated_at
            WHERE length(EXCLUDED.module_path) >= length(search_documents.module_path)
            """,
            Timestamp.from(clock.instant()),
            modulePath,
            version);
    log.debug("Indexed {} packages of {}@{}", n, modulePath, version);
    return n;
  }

  public int deleteForModule(String modulePath) {
    return jdbcTemplate.update("DELETE FROM search_documents WHERE module_path = ?", modulePath);
  }

  /** Deletes the module's rows whose version sorts before {@code version}. */
  public int deleteOlderVersions(String modulePath, String version) {
    return jdbcTemplate.update(
        "DELETE FROM search_documents WHERE module_path = ? AND sort_version < ?",
        modulePath,
        SemanticVersion.forSorting(version));
  }

  public List<SearchDocument> findByModule(String modulePath) {
    return jdbcTemplate.query(
        """
        SELECT package_path, module_path, version, sort_version, name, synopsis, license_types,
               redistributable, commit_time
        FROM search_documents
        WHERE module_path = ?
        ORDER BY package_path
        """,
        (rs, rowNum) -> toDocument(rs),
        modulePath);
  }

  public boolean containsVersion(String modulePath, String version) {
    Boolean exists =
        jdbcTemplate.queryForObject(
            "SELECT EXISTS (SELECT 1 FROM search_documents WHERE module_path = ? AND version = ?)",
            Boolean.class,
            modulePath,
            version);
    return Boolean.TRUE.equals(exists);
  }

  private static SearchDocument toDocument(ResultSet rs) throws SQLException {
    Array types = rs.getArray("license_types");
    return new SearchDocument(
        rs.getString("package_path"),
        rs.getString("module_path"),
        rs.getString("version"),
        rs.getString("sort_version"),
        rs.getString("name"),
        rs.getString("synopsis"),
        types == null ? List.of() : Arrays.asList((String[]) types.getArray()),
        rs.getBoolean("redistributable"),
        rs.getTimestamp("commit_time").toInstant());
  }
}
