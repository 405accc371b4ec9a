package dev.pinakes.module;

/**
 * Thrown by a {@link ModuleFetcher} when a module version exists but cannot be processed, for
 * example because its archive is corrupt or its manifest cannot be parsed.
 */
public class BadModuleException extends RuntimeException {

  public BadModuleException(String message) {
    super(message);
  }

  public BadModuleException(String message, Throwable cause) {
    super(message, cause);
  }
}
