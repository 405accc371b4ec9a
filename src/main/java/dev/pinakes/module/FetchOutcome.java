package dev.pinakes.module;

import org.jspecify.annotations.Nullable;

/**
 * Result of {@link ModuleFetcher#fetch}.
 *
 * <p>A fetch either yields a graph (possibly with some packages that could not be processed) or
 * reports that the module declares a different canonical path in its manifest, in which case
 * nothing should be stored under the requested path.
 */
public record FetchOutcome(
    @Nullable ModuleGraph graph, boolean hasIncompletePackages, @Nullable String canonicalPath) {

  public static FetchOutcome found(ModuleGraph graph) {
    return new FetchOutcome(graph, false, null);
  }

  public static FetchOutcome foundIncomplete(ModuleGraph graph) {
    return new FetchOutcome(graph, true, null);
  }

  public static FetchOutcome alternativePath(String canonicalPath) {
    return new FetchOutcome(null, false, canonicalPath);
  }

  public boolean isAlternativePath() {
    return graph == null;
  }
}
