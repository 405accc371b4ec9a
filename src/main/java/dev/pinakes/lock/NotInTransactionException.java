package dev.pinakes.lock;

/** A transaction-scoped lock was requested outside of any transaction. */
public class NotInTransactionException extends IllegalStateException {

  public NotInTransactionException(String modulePath) {
    super("module lock for " + modulePath + " requested outside a transaction");
  }
}
