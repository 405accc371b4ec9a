package dev.pinakes.state;

import org.jspecify.annotations.Nullable;

/**
 * The outcome of one processing attempt.
 *
 * @param modulePath the module path
 * @param version the module version
 * @param status the resulting status
 * @param error error detail, empty on success
 * @param appVersion version of the processor that made the attempt
 * @param goModPath module path declared by the manifest, when known
 * @param numPackages number of packages found, when known
 */
public record VersionStateUpdate(
    String modulePath,
    String version,
    VersionStatus status,
    String error,
    String appVersion,
    @Nullable String goModPath,
    @Nullable Integer numPackages) {

  public static VersionStateUpdate of(
      String modulePath, String version, VersionStatus status, String error) {
    return new VersionStateUpdate(modulePath, version, status, error, "", null, null);
  }
}
