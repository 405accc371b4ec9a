package dev.pinakes.latest;

import dev.pinakes.version.Retraction;
import java.util.List;
import java.util.Optional;
import org.jspecify.annotations.Nullable;

/**
 * What is known about a module's latest version.
 *
 * @param modulePath the module path
 * @param goodVersion the authoritative version, empty when no stored version qualifies
 * @param rawVersion upstream raw latest version, empty string when unknown
 * @param cookedVersion upstream cooked latest version, empty string when unknown
 * @param retractions retracted version ranges
 * @param deprecated whether the module is deprecated
 * @param deprecationComment the deprecation message, if any
 * @param rowVersion number of times the good version has changed
 */
public record ResolvedLatest(
    String modulePath,
    Optional<String> goodVersion,
    String rawVersion,
    String cookedVersion,
    List<Retraction> retractions,
    boolean deprecated,
    @Nullable String deprecationComment,
    long rowVersion) {

  static ResolvedLatest of(LatestModuleVersions row) {
    String good = row.getGoodVersion();
    return new ResolvedLatest(
        row.getModulePath(),
        good.isEmpty() ? Optional.empty() : Optional.of(good),
        row.getRawVersion(),
        row.getCookedVersion(),
        List.copyOf(row.getRetractions()),
        row.isDeprecated(),
        row.getDeprecationComment(),
        row.getRowVersion());
  }
}
