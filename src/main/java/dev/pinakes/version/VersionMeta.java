package dev.pinakes.version;

/**
 * A candidate for a module's latest version.
 *
 * @param modulePath the module path the version was published under
 * @param version the version string
 * @param type release, prerelease or pseudo
 * @param incompatible whether the version carries {@code +incompatible}
 */
public record VersionMeta(
    String modulePath, String version, VersionType type, boolean incompatible) {

  public static VersionMeta of(String modulePath, String version) {
    return new VersionMeta(
        modulePath, version, VersionType.of(version), SemanticVersion.isIncompatible(version));
  }
}
