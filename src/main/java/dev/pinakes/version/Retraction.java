package dev.pinakes.version;

import java.util.List;
import java.util.function.Predicate;
import org.jspecify.annotations.Nullable;

/**
 * An inclusive range of versions withdrawn by the module author. A single retracted version has
 * {@code low} equal to {@code high}.
 */
public record Retraction(String low, String high, @Nullable String rationale) {

  public static Retraction single(String version, @Nullable String rationale) {
    return new Retraction(version, version, rationale);
  }

  /** Reports whether {@code low <= version <= high} in semantic-version order. */
  public boolean covers(String version) {
    return SemanticVersion.compare(low, version) <= 0 && SemanticVersion.compare(version, high) <= 0;
  }

  /** A predicate that is true for versions covered by any of the retractions. */
  public static Predicate<String> anyOf(List<Retraction> retractions) {
    List<Retraction> copy = List.copyOf(retractions);
    return version -> copy.stream().anyMatch(r -> r.covers(version));
  }
}
