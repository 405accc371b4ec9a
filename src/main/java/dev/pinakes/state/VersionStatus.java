package dev.pinakes.state;

import dev.pinakes.NotFoundException;
import dev.pinakes.ingestion.InvalidModuleException;
import dev.pinakes.lock.NotInTransactionException;
import dev.pinakes.module.BadModuleException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Processing status of a module version in the work queue, stored as an HTTP-like code.
 *
 * <p>Codes below 500 (other than {@link #NEW}) are terminal: the version is not attempted again
 * until it is reset for reprocessing. Codes of 500 and above are retried with backoff. The
 * {@code REPROCESS_*} codes mark versions whose previous outcome was produced by an older
 * release of the processor.
 */
public enum VersionStatus {
  NEW(0),
  SUCCESS(200),
  HAS_INCOMPLETE_PACKAGES(290),
  NOT_FOUND(404),
  /** The processor broke its own contract, e.g. took a module lock outside a transaction. */
  INTERNAL_ERROR(470),
  VALIDATION_FAILURE(480),
  BAD_MODULE(490),
  ALTERNATIVE_PATH(491),
  CLEANED(493),
  TRANSIENT_FAILURE(500),
  SHEDDING_LOAD(503),
  REPROCESS_SUCCESS(520),
  REPROCESS_HAS_INCOMPLETE_PACKAGES(521),
  REPROCESS_BAD_MODULE(540),
  REPROCESS_ALTERNATIVE(541),
  REPROCESS_VALIDATION_FAILURE(542);

  private final int code;

  VersionStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  /** Whether a version in this status is picked up by the queue once its backoff expires. */
  public boolean isEligible() {
    return isEligible(code);
  }

  public static boolean isEligible(int code) {
    return code == 0 || code >= 500;
  }

  /** The status to move to when forcing reprocessing; statuses without a counterpart map to themselves. */
  public VersionStatus toReprocess() {
    return switch (this) {
      case SUCCESS -> REPROCESS_SUCCESS;
      case HAS_INCOMPLETE_PACKAGES -> REPROCESS_HAS_INCOMPLETE_PACKAGES;
      case BAD_MODULE -> REPROCESS_BAD_MODULE;
      case ALTERNATIVE_PATH -> REPROCESS_ALTERNATIVE;
      case VALIDATION_FAILURE -> REPROCESS_VALIDATION_FAILURE;
      default -> this;
    };
  }

  public static VersionStatus fromCode(int code) {
    for (VersionStatus status : values()) {
      if (status.code == code) {
        return status;
      }
    }
    throw new IllegalArgumentException("unknown version status code: " + code);
  }

  /**
   * Maps a processing failure to the status recorded for it. Wrapper exceptions from executors
   * are unwrapped first. Contract violations by the processor are terminal; anything unrecognized
   * is treated as transient.
   */
  public static VersionStatus fromException(Throwable error) {
    Throwable e = error;
    while ((e instanceof ExecutionException || e instanceof CompletionException)
        && e.getCause() != null) {
      e = e.getCause();
    }
    if (e instanceof NotFoundException) {
      return NOT_FOUND;
    }
    if (e instanceof InvalidModuleException) {
      return VALIDATION_FAILURE;
    }
    if (e instanceof BadModuleException) {
      return BAD_MODULE;
    }
    if (e instanceof NotInTransactionException) {
      return INTERNAL_ERROR;
    }
    return TRANSIENT_FAILURE;
  }
}
