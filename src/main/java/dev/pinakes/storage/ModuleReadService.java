package dev.pinakes.storage;

import dev.pinakes.NotFoundException;
import dev.pinakes.index.SearchDocument;
import dev.pinakes.index.SearchIndex;
import dev.pinakes.module.BuildContext;
import dev.pinakes.module.Documentation;
import dev.pinakes.module.License;
import dev.pinakes.module.Readme;
import dev.pinakes.version.VersionType;
import java.sql.Array;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Arrays;
import java.util.List;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Read access to stored module versions.
 *
 * <p>Every lookup throws {@link NotFoundException} when the row is missing, and also when its
 * content was withheld because the unit or license is not redistributable. Callers cannot tell
 * the two apart.
 */
@Service
@Transactional(readOnly = true)
public class ModuleReadService {

  private final JdbcTemplate jdbcTemplate;
  private final SearchIndex searchIndex;

  public ModuleReadService(JdbcTemplate jdbcTemplate, SearchIndex searchIndex) {
    this.jdbcTemplate = jdbcTemplate;
    this.searchIndex = searchIndex;
  }

  public ModuleInfo getModuleVersion(String modulePath, String version) {
    try {
      return jdbcTemplate.queryForObject(
          """
          SELECT id, module_path, version, commit_time, version_type, series_path, incompatible,
                 has_go_mod, redistributable, source_info::text AS source_info, updated_at
          FROM modules
          WHERE module_path = ? AND version = ?
          """,
          (rs, rowNum) ->
              new ModuleInfo(
                  rs.getLong("id"),
                  rs.getString("module_path"),
                  rs.getString("version"),
                  rs.getTimestamp("commit_time").toInstant(),
                  VersionType.fromDbValue(rs.getString("version_type")),
                  rs.getString("series_path"),
                  rs.getBoolean("incompatible"),
                  rs.getBoolean("has_go_mod"),
                  rs.getBoolean("redistributable"),
                  rs.getString("source_info"),
                  rs.getTimestamp("updated_at").toInstant()),
          modulePath,
          version);
    } catch (EmptyResultDataAccessException e) {
      throw new NotFoundException("module " + modulePath + "@" + version + " not found", e);
    }
  }

  public UnitInfo getUnit(String unitPath, String modulePath, String version) {
    try {
      return jdbcTemplate.queryForObject(
          """
          SELECT p.path, v1.path AS v1_path, m.module_path, m.version, u.name, u.license_types,
                 u.license_paths, u.redistributable
          FROM units u
          JOIN paths p ON p.id = u.path_id
          JOIN paths v1 ON v1.id = u.v1_path_id
          JOIN modules m ON m.id = u.module_id
          WHERE p.path = ? AND m.module_path = ? AND m.version = ?
          """,
          (rs, rowNum) ->
              new UnitInfo(
                  rs.getString("path"),
                  rs.getString("v1_path"),
                  rs.getString("module_path"),
                  rs.getString("version"),
                  rs.getString("name"),
                  textList(rs, "license_types"),
                  textList(rs, "license_paths"),
                  rs.getBoolean("redistributable")),
          unitPath,
          modulePath,
          version);
    } catch (EmptyResultDataAccessException e) {
      throw new NotFoundException(
          "unit " + unitPath + " not found in " + modulePath + "@" + version, e);
    }
  }

  public Readme getReadme(String unitPath, String modulePath, String version) {
    List<Readme> readmes =
        jdbcTemplate.query(
            """
            SELECT r.file_path, r.contents
            FROM readmes r
            JOIN units u ON u.id = r.unit_id
            JOIN paths p ON p.id = u.path_id
            JOIN modules m ON m.id = u.module_id
            WHERE p.path = ? AND m.module_path = ? AND m.version = ?
            """,
            (rs, rowNum) -> new Readme(rs.getString("file_path"), rs.getString("contents")),
            unitPath,
            modulePath,
            version);
    if (readmes.isEmpty() || readmes.get(0).contents() == null) {
      throw new NotFoundException(
          "readme of " + unitPath + " not found in " + modulePath + "@" + version);
    }
    return readmes.get(0);
  }

  public Documentation getDocumentation(
      String unitPath, String modulePath, String version, BuildContext buildContext) {
    List<Documentation> docs =
        jdbcTemplate.query(
            """
            SELECT d.build_os, d.build_arch, d.synopsis, d.html
            FROM documentation d
            JOIN units u ON u.id = d.unit_id
            JOIN paths p ON p.id = u.path_id
            JOIN modules m ON m.id = u.module_id
            WHERE p.path = ? AND m.module_path = ? AND m.version = ?
              AND d.build_os = ? AND d.build_arch = ?
            """,
            (rs, rowNum) ->
                new Documentation(
                    new BuildContext(rs.getString("build_os"), rs.getString("build_arch")),
                    rs.getString("synopsis"),
                    rs.getString("html"),
                    List.of()),
            unitPath,
            modulePath,
            version,
            buildContext.os(),
            buildContext.arch());
    if (docs.isEmpty() || docs.get(0).html() == null) {
      throw new NotFoundException(
          "documentation of " + unitPath + " (" + buildContext + ") not found in "
              + modulePath + "@" + version);
    }
    return docs.get(0);
  }

  public License getLicense(String modulePath, String version, String filePath) {
    List<License> licenses =
        jdbcTemplate.query(
            """
            SELECT l.types, l.file_path, l.contents
            FROM licenses l
            JOIN modules m ON m.id = l.module_id
            WHERE m.module_path = ? AND m.version = ? AND l.file_path = ?
            """,
            (rs, rowNum) ->
                new License(
                    textList(rs, "types"),
                    rs.getString("file_path"),
                    rs.getString("contents"),
                    rs.getString("contents") != null),
            modulePath,
            version,
            filePath);
    if (licenses.isEmpty() || licenses.get(0).contents() == null) {
      throw new NotFoundException(
          "license " + filePath + " not found in " + modulePath + "@" + version);
    }
    return licenses.get(0);
  }

  /** Unit paths of the module version, sorted. */
  public List<String> listUnitPaths(String modulePath, String version) {
    getModuleVersion(modulePath, version);
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

  /** Search rows of the module; empty when the module is not indexed. */
  public List<SearchDocument> searchDocumentsForModule(String modulePath) {
    return searchIndex.findByModule(modulePath);
  }

  private static List<String> textList(ResultSet rs, String column) throws SQLException {
    Array array = rs.getArray(column);
    return array == null ? List.of() : Arrays.asList((String[]) array.getArray());
  }
}
