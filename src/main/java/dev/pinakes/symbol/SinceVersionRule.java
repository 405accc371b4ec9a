package dev.pinakes.symbol;

import dev.pinakes.version.SemanticVersion;
import dev.pinakes.version.VersionType;
import org.jspecify.annotations.Nullable;

/**
 * The monotonic rule for a symbol's "available since" version: it only ever moves to a strictly
 * earlier version. Only compatible releases count.
 */
public final class SinceVersionRule {

  private SinceVersionRule() {}

  /** Whether symbols of {@code version} may be recorded at all. */
  public static boolean isEligible(String version) {
    return VersionType.of(version) == VersionType.RELEASE
        && !SemanticVersion.isIncompatible(version);
  }

  /**
   * The since-version after observing the symbol at {@code observed}.
   *
   * @param current the recorded since-version, or null when none is recorded
   * @param observed the version the symbol was just seen in
   */
  public static String merge(@Nullable String current, String observed) {
    if (current == null || SemanticVersion.compare(observed, current) < 0) {
      return observed;
    }
    return current;
  }
}
