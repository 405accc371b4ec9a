package dev.pinakes.index;

import java.util.List;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

/** Maintains {@code imports_unique}: the deduplicated import edges of each module's good version. */
@Repository
public class ImportGraph {

  private final JdbcTemplate jdbcTemplate;

  public ImportGraph(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  /** Replaces the module's edges with those of {@code version}. */
  public int replaceForModule(String modulePath, String version) {
    deleteForModule(modulePath);
    return jdbcTemplate.update(
        """
        INSERT INTO imports_unique (from_path, from_module_path, to_path)
        SELECT p.path, m.module_path, i.to_path
        FROM package_imports i
        JOIN units u ON u.id = i.unit_id
        JOIN paths p ON p.id = u.path_id
        JOIN modules m ON m.id = u.module_id
        WHERE m.module_path = ? AND m.version = ?
        ON CONFLICT DO NOTHING
        """,
        modulePath,
        version);
  }

  public int deleteForModule(String modulePath) {
    return jdbcTemplate.update("DELETE FROM imports_unique WHERE from_module_path = ?", modulePath);
  }

  /** Edges originating in the module, as {@code from -> to} pairs. */
  public List<ImportEdge> edgesOf(String modulePath) {
    return jdbcTemplate.query(
        """
        SELECT from_path, to_path FROM imports_unique
        WHERE from_module_path = ?
        ORDER BY from_path, to_path
        """,
        (rs, rowNum) -> new ImportEdge(rs.getString("from_path"), rs.getString("to_path")),
        modulePath);
  }

  public record ImportEdge(String fromPath, String toPath) {}
}
