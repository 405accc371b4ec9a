package dev.pinakes.index;

import dev.pinakes.version.SemanticVersion;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;

/**
 * Decides whether a module path is an alternative of some canonical path and so must be kept out
 * of the search index.
 */
@Service
public class AlternativePathRegistry {

  private static final Logger log = LoggerFactory.getLogger(AlternativePathRegistry.class);

  /** Status recorded in the work queue when a fetch reports a different canonical path. */
  static final int ALTERNATIVE_PATH_STATUS = 491;

  private final AlternativeModulePathRepository repository;
  private final JdbcTemplate jdbcTemplate;

  public AlternativePathRegistry(
      AlternativeModulePathRepository repository, JdbcTemplate jdbcTemplate) {
    this.repository = repository;
    this.jdbcTemplate = jdbcTemplate;
  }

  /** Records that {@code alternative} is served under {@code canonical}. */
  public void register(String alternative, String canonical) {
    AlternativeModulePath row =
        repository
            .findById(alternative)
            .orElseGet(() -> new AlternativeModulePath(alternative, canonical));
    row.setCanonical(canonical);
    repository.save(row);
    log.info("Registered {} as an alternative path of {}", alternative, canonical);
  }

  /**
   * Reports whether the module's search rows must be suppressed: the path is registered as an
   * alternative, or some version at or above {@code goodVersion} was recorded as an alternative
   * path in the work queue.
   */
  public boolean isAlternative(String modulePath, String goodVersion) {
    if (repository.existsById(modulePath)) {
      return true;
    }
    Boolean flagged =
        jdbcTemplate.queryForObject(
            """
            SELECT EXISTS (
                SELECT 1 FROM module_version_states
                WHERE module_path = ? AND status = ? AND sort_version >= ?
            )
            """,
            Boolean.class,
            modulePath,
            ALTERNATIVE_PATH_STATUS,
            SemanticVersion.forSorting(goodVersion));
    return Boolean.TRUE.equals(flagged);
  }
}
