package dev.pinakes;

/**
 * Thrown when a requested module, version, unit or piece of content does not exist or has been
 * withheld.
 */
public class NotFoundException extends RuntimeException {

  public NotFoundException(String message) {
    super(message);
  }

  public NotFoundException(String message, Throwable cause) {
    super(message, cause);
  }
}
