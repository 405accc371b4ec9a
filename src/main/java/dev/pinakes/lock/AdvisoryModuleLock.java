package dev.pinakes.lock;

import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowCallbackHandler;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * {@link ModuleLock} backed by PostgreSQL transaction-level advisory locks. Works across any
 * number of processes sharing the database; the server releases the lock at transaction end.
 */
@Component
@ConditionalOnProperty(name = "pinakes.lock.mode", havingValue = "advisory", matchIfMissing = true)
public class AdvisoryModuleLock implements ModuleLock {

  private static final Logger log = LoggerFactory.getLogger(AdvisoryModuleLock.class);

  private final JdbcTemplate jdbcTemplate;

  public AdvisoryModuleLock(JdbcTemplate jdbcTemplate) {
    this.jdbcTemplate = jdbcTemplate;
  }

  @Override
  public <T> T withModuleLock(String modulePath, Supplier<T> body) {
    if (!TransactionSynchronizationManager.isActualTransactionActive()) {
      throw new NotInTransactionException(modulePath);
    }
    long key = ModuleLockKey.of(modulePath);
    log.debug("Acquiring advisory lock {} for {}", key, modulePath);
    jdbcTemplate.query("SELECT pg_advisory_xact_lock(?)", (RowCallbackHandler) rs -> {}, key);
    log.debug("Acquired advisory lock {} for {}", key, modulePath);
    return body.get();
  }
}
