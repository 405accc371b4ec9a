package dev.pinakes.version;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Predicate;
import org.jspecify.annotations.Nullable;

/**
 * Chooses the authoritative version of a module among its stored versions.
 *
 * <p>Preference order: releases over prereleases over pseudo-versions, then the highest semantic
 * version. Versions of the same precedence published under different module paths (e.g. a major
 * version suffix) prefer the longer path, then the lexically smaller one.
 */
public final class VersionOrder {

  /** Best candidate first. */
  public static final Comparator<VersionMeta> PREFERENCE =
      Comparator.comparing(VersionMeta::type)
          .thenComparing((a, b) -> SemanticVersion.compare(b.version(), a.version()))
          .thenComparing(
              (VersionMeta a, VersionMeta b) ->
                  Integer.compare(b.modulePath().length(), a.modulePath().length()))
          .thenComparing(VersionMeta::modulePath);

  private VersionOrder() {}

  /**
   * Resolves the latest good version.
   *
   * @param candidates every stored version of the module
   * @param retracted true for versions the author has retracted
   * @param cookedLatest the latest version reported by the module proxy, if known; when it is a
   *     compatible version, {@code +incompatible} candidates are not eligible
   * @return the latest good version, or empty when every candidate is excluded
   */
  public static Optional<VersionMeta> resolveLatest(
      List<VersionMeta> candidates, Predicate<String> retracted, @Nullable String cookedLatest) {
    List<VersionMeta> remaining =
        candidates.stream().filter(c -> !retracted.test(c.version())).toList();
    if (remaining.isEmpty()) {
      return Optional.empty();
    }
    if (cookedLatest != null
        && !cookedLatest.isEmpty()
        && !SemanticVersion.isIncompatible(cookedLatest)) {
      remaining = remaining.stream().filter(c -> !c.incompatible()).toList();
    }
    return remaining.stream().min(PREFERENCE);
  }

  /** The preferred candidate with retractions and compatibility facts ignored. */
  public static Optional<VersionMeta> latestIgnoringRetractions(List<VersionMeta> candidates) {
    return candidates.stream().min(PREFERENCE);
  }
}
