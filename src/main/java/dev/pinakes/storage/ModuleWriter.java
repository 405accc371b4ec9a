package dev.pinakes.storage;

import dev.pinakes.module.Documentation;
import dev.pinakes.module.License;
import dev.pinakes.module.ModuleGraph;
import dev.pinakes.module.ModulePaths;
import dev.pinakes.module.Unit;
import dev.pinakes.version.SemanticVersion;
import dev.pinakes.version.VersionType;
import java.sql.Array;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.BatchPreparedStatementSetter;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

/**
 * Writes a module version's entity graph with batched, idempotent upserts.
 *
 * <p>Must run inside the caller's transaction. Re-writing the same graph leaves the tables
 * unchanged apart from {@code modules.updated_at}. Rows are written in path order so that
 * concurrent writers touching overlapping paths acquire row locks in the same order.
 */
@Repository
public class ModuleWriter {

  private static final Logger log = LoggerFactory.getLogger(ModuleWriter.class);

  private final JdbcTemplate jdbcTemplate;
  private final Clock clock;

  public ModuleWriter(JdbcTemplate jdbcTemplate, Clock clock) {
    this.jdbcTemplate = jdbcTemplate;
    this.clock = clock;
  }

  /**
   * Inserts or updates the {@code modules} row. On conflict only {@code redistributable}, {@code
   * source_info} and {@code updated_at} change. The upsert leaves the row locked until the
   * transaction ends.
   *
   * @return the module id
   */
  public long upsertModule(ModuleGraph graph) {
    Timestamp now = Timestamp.from(clock.instant());
    Long id =
        jdbcTemplate.queryForObject(
            """
            INSERT INTO modules (module_path, version, commit_time, sort_version, version_type,
                                 series_path, incompatible, has_go_mod, redistributable,
                                 source_info, created_at, updated_at)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, CAST(? AS jsonb), ?, ?)
            ON CONFLICT (module_path, version) DO UPDATE SET
                redistributable = EXCLUDED.redistributable,
                source_info = EXCLUDED.source_info,
                updated_at = EXCLUDED.updated_at
            RETURNING id
            """,
            Long.class,
            graph.modulePath(),
            graph.version(),
            Timestamp.from(graph.commitTime()),
            SemanticVersion.forSorting(graph.version()),
            VersionType.of(graph.version()).dbValue(),
            graph.seriesPath(),
            SemanticVersion.isIncompatible(graph.version()),
            graph.hasGoMod(),
            graph.redistributable(),
            graph.sourceInfo(),
            now,
            now);
    if (id == null) {
      throw new IllegalStateException("no id returned for module " + graph.coordinates());
    }
    return id;
  }

  /**
   * Writes units, licenses, readmes, documentation and imports of the module version.
   *
   * @param moduleId the id returned by {@link #upsertModule}
   */
  public void writeContents(long moduleId, ModuleGraph graph) {
    List<Unit> units = new ArrayList<>(graph.units());
    units.sort(Comparator.comparing(Unit::path));

    TreeSet<String> allPaths = new TreeSet<>();
    for (Unit unit : units) {
      allPaths.add(unit.path());
      allPaths.add(ModulePaths.v1Path(unit.path(), graph.modulePath()));
    }
    Map<String, Long> pathIds = upsertPaths(allPaths);

    writeLicenses(moduleId, graph.licenses());
    Map<String, Long> unitIds = writeUnits(moduleId, graph.modulePath(), units, pathIds);
    List<Long> ids = units.stream().map(u -> unitIds.get(u.path())).toList();
    clearUnitContents(ids);
    writeReadmes(units, unitIds);
    writeDocumentation(units, unitIds);
    writeImports(units, unitIds);
    log.debug(
        "Wrote {} units and {} licenses for {}",
        units.size(),
        graph.licenses().size(),
        graph.coordinates());
  }

  Map<String, Long> upsertPaths(Collection<String> paths) {
    List<String> sorted = new ArrayList<>(new TreeSet<>(paths));
    jdbcTemplate.batchUpdate(
        "INSERT INTO paths (path) VALUES (?) ON CONFLICT (path) DO NOTHING",
        new BatchPreparedStatementSetter() {
          @Override
          public void setValues(PreparedStatement ps, int i) throws SQLException {
            ps.setString(1, sorted.get(i));
          }

          @Override
          public int getBatchSize() {
            return sorted.size();
          }
        });
    Map<String, Long> ids = new HashMap<>();
    jdbcTemplate.query(
        "SELECT id, path FROM paths WHERE path = ANY(?)",
        ps -> ps.setArray(1, textArray(ps, sorted)),
        rs -> {
          ids.put(rs.getString("path"), rs.getLong("id"));
        });
    return ids;
  }

  private Map<String, Long> writeUnits(
      long moduleId, String modulePath, List<Unit> units, Map<String, Long> pathIds) {
    jdbcTemplate.batchUpdate(
        """
        INSERT INTO units (path_id, module_id, v1_path_id, name, license_types, license_paths,
                           redistributable)
        VALUES (?, ?, ?, ?, ?, ?, ?)
        ON CONFLICT (path_id, module_id) DO UPDATE SET
            v1_path_id = EXCLUDED.v1_path_id,
            name = EXCLUDED.name,
            license_types = EXCLUDED.license_types,
            license_paths = EXCLUDED.license_paths,
            redistributable = EXCLUDED.redistributable
        """,
        new BatchPreparedStatementSetter() {
          @Override
          public void setValues(PreparedStatement ps, int i) throws SQLException {
            Unit unit = units.get(i);
            ps.setLong(1, pathIds.get(unit.path()));
            ps.setLong(2, moduleId);
            ps.setLong(3, pathIds.get(ModulePaths.v1Path(unit.path(), modulePath)));
            ps.setString(4, unit.name());
            ps.setArray(5, textArray(ps, unit.licenseTypes()));
            ps.setArray(6, textArray(ps, unit.licensePaths()));
            ps.setBoolean(7, unit.redistributable());
          }

          @Override
          public int getBatchSize() {
            return units.size();
          }
        });
    Map<String, Long> unitIds = new HashMap<>();
    jdbcTemplate.query(
        """
        SELECT p.path, u.id
        FROM units u
        JOIN paths p ON p.id = u.path_id
        WHERE u.module_id = ?
        """,
        rs -> {
          unitIds.put(rs.getString("path"), rs.getLong("id"));
        },
        moduleId);
    return unitIds;
  }

  private void writeLicenses(long moduleId, List<License> licenses) {
    List<License> sorted = new ArrayList<>(licenses);
    sorted.sort(Comparator.comparing(License::filePath));
    jdbcTemplate.batchUpdate(
        """
        INSERT INTO licenses (module_id, file_path, types, contents)
        VALUES (?, ?, ?, ?)
        ON CONFLICT (module_id, file_path) DO UPDATE SET
            types = EXCLUDED.types,
            contents = EXCLUDED.contents
        """,
        new BatchPreparedStatementSetter() {
          @Override
          public void setValues(PreparedStatement ps, int i) throws SQLException {
            License license = sorted.get(i);
            ps.setLong(1, moduleId);
            ps.setString(2, license.filePath());
            ps.setArray(3, textArray(ps, license.types()));
            ps.setString(4, license.contents());
          }

          @Override
          public int getBatchSize() {
            return sorted.size();
          }
        });
  }

  private void clearUnitContents(List<Long> unitIds) {
    for (String table : List.of("readmes", "documentation", "package_imports")) {
      jdbcTemplate.update(
          "DELETE FROM " + table + " WHERE unit_id = ANY(?)",
          ps -> ps.setArray(1, ps.getConnection().createArrayOf("bigint", unitIds.toArray())));
    }
  }

  private void writeReadmes(List<Unit> units, Map<String, Long> unitIds) {
    List<Unit> withReadme = units.stream().filter(u -> u.readme() != null).toList();
    jdbcTemplate.batchUpdate(
        "INSERT INTO readmes (unit_id, file_path, contents) VALUES (?, ?, ?)",
        new BatchPreparedStatementSetter() {
          @Override
          public void setValues(PreparedStatement ps, int i) throws SQLException {
            Unit unit = withReadme.get(i);
            ps.setLong(1, unitIds.get(unit.path()));
            ps.setString(2, unit.readme().filePath());
            ps.setString(3, unit.readme().contents());
          }

          @Override
          public int getBatchSize() {
            return withReadme.size();
          }
        });
  }

  private void writeDocumentation(List<Unit> units, Map<String, Long> unitIds) {
    List<Object[]> rows = new ArrayList<>();
    for (Unit unit : units) {
      for (Documentation doc : unit.documentation()) {
        rows.add(
            new Object[] {
              unitIds.get(unit.path()),
              doc.buildContext().os(),
              doc.buildContext().arch(),
              doc.synopsis(),
              doc.html()
            });
      }
    }
    jdbcTemplate.batchUpdate(
        """
        INSERT INTO documentation (unit_id, build_os, build_arch, synopsis, html)
        VALUES (?, ?, ?, ?, ?)
        ON CONFLICT (unit_id, build_os, build_arch) DO UPDATE SET
            synopsis = EXCLUDED.synopsis,
            html = EXCLUDED.html
        """,
        rows);
  }

  private void writeImports(List<Unit> units, Map<String, Long> unitIds) {
    List<Object[]> rows = new ArrayList<>();
    for (Unit unit : units) {
      for (String to : new TreeSet<>(unit.imports())) {
        rows.add(new Object[] {unitIds.get(unit.path()), to});
      }
    }
    jdbcTemplate.batchUpdate(
        "INSERT INTO package_imports (unit_id, to_path) VALUES (?, ?) ON CONFLICT DO NOTHING",
        rows);
  }

  private static Array textArray(PreparedStatement ps, List<String> values) throws SQLException {
    return ps.getConnection().createArrayOf("text", values.toArray());
  }
}
