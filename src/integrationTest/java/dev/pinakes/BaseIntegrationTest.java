package dev.pinakes;

import org.junit.jupiter.api.BeforeEach;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.testcontainers.service.connection.ServiceConnection;
import org.springframework.jdbc.core.JdbcTemplate;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.utility.DockerImageName;

/**
 * Shared base class for all integration tests.
 *
 * <p>Provides a Testcontainers-managed PostgreSQL instance migrated by Flyway and empties every
 * table before each test, so tests may commit freely.
 */
@SpringBootTest
public abstract class BaseIntegrationTest {

  @ServiceConnection
  static PostgreSQLContainer<?> postgres =
      new PostgreSQLContainer<>(DockerImageName.parse("postgres:16-alpine"));

  static {
    postgres.start();
  }

  @Autowired protected JdbcTemplate jdbcTemplate;

  @BeforeEach
  void truncateTables() {
    jdbcTemplate.execute(
        """
        TRUNCATE modules, paths, units, licenses, readmes, documentation, package_imports,
                 latest_module_versions, module_version_states, version_map, symbol_history,
                 search_documents, imports_unique, alternative_module_paths
        RESTART IDENTITY CASCADE
        """);
  }

  protected int count(String table) {
    Integer n = jdbcTemplate.queryForObject("SELECT count(*) FROM " + table, Integer.class);
    return n == null ? 0 : n;
  }
}
