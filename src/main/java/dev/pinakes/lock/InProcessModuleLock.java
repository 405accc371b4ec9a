package dev.pinakes.lock;

import java.util.concurrent.Semaphore;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * {@link ModuleLock} for a single process: a fixed array of binary semaphores indexed by the
 * module's lock key. The permit is returned after the surrounding transaction completes.
 *
 * <p>Not reentrant: locking the same stripe twice in one transaction deadlocks.
 */
@Component
@ConditionalOnProperty(name = "pinakes.lock.mode", havingValue = "in-process")
public class InProcessModuleLock implements ModuleLock {

  private static final Logger log = LoggerFactory.getLogger(InProcessModuleLock.class);

  private final Semaphore[] stripes;

  public InProcessModuleLock(LockProperties properties) {
    this(properties.getStripes());
  }

  InProcessModuleLock(int stripeCount) {
    if (stripeCount < 1) {
      throw new IllegalArgumentException("stripe count must be positive, got: " + stripeCount);
    }
    this.stripes = new Semaphore[stripeCount];
    for (int i = 0; i < stripeCount; i++) {
      stripes[i] = new Semaphore(1);
    }
  }

  @Override
  public <T> T withModuleLock(String modulePath, Supplier<T> body) {
    if (!TransactionSynchronizationManager.isSynchronizationActive()
        || !TransactionSynchronizationManager.isActualTransactionActive()) {
      throw new NotInTransactionException(modulePath);
    }
    Semaphore stripe = stripeFor(modulePath);
    stripe.acquireUninterruptibly();
    TransactionSynchronizationManager.registerSynchronization(
        new TransactionSynchronization() {
          @Override
          public void afterCompletion(int status) {
            stripe.release();
          }
        });
    log.debug("Acquired in-process lock for {}", modulePath);
    return body.get();
  }

  Semaphore stripeFor(String modulePath) {
    long key = ModuleLockKey.of(modulePath);
    return stripes[(int) Long.remainderUnsigned(key, stripes.length)];
  }
}
