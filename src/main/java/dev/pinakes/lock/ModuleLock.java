package dev.pinakes.lock;

import java.util.function.Supplier;

/**
 * Serializes writers of the same module across workers.
 *
 * <p>The lock is scoped to the caller's transaction: it is acquired when {@link #withModuleLock}
 * is entered and released when that transaction commits or rolls back, never before. Different
 * module paths may share a lock when their keys collide, which only adds serialization.
 */
public interface ModuleLock {

  /**
   * Acquires the lock for {@code modulePath}, blocking until it is available, and runs {@code
   * body}.
   *
   * @throws NotInTransactionException if no transaction is active on the calling thread
   */
  <T> T withModuleLock(String modulePath, Supplier<T> body);
}
