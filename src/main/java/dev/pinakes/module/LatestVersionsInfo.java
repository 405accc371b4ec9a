package dev.pinakes.module;

import dev.pinakes.version.Retraction;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Upstream facts about a module's latest versions.
 *
 * @param modulePath the module path
 * @param rawVersion the highest version the proxy lists, ignoring retractions and compatibility
 * @param cookedVersion the proxy's notion of latest after retractions and compatibility rules
 * @param retractions ranges retracted in the raw version's manifest
 * @param deprecated whether the raw version's manifest deprecates the module
 * @param deprecationComment the deprecation message, if any
 */
public record LatestVersionsInfo(
    String modulePath,
    String rawVersion,
    String cookedVersion,
    List<Retraction> retractions,
    boolean deprecated,
    @Nullable String deprecationComment) {

  public LatestVersionsInfo {
    retractions = retractions == null ? List.of() : List.copyOf(retractions);
  }
}
