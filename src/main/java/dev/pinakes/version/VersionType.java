package dev.pinakes.version;

/**
 * Class of a module version. The declaration order is the preference order when choosing a
 * module's latest version: any release beats any prerelease, which beats any pseudo-version.
 */
public enum VersionType {
  /** A tagged version without prerelease identifiers, e.g. {@code v1.2.3}. */
  RELEASE("release"),
  /** A tagged version with prerelease identifiers, e.g. {@code v1.2.3-rc.1}. */
  PRERELEASE("prerelease"),
  /** A commit-derived version, e.g. {@code v0.0.0-20190311183353-d8887717615a}. */
  PSEUDO("pseudo");

  private final String dbValue;

  VersionType(String dbValue) {
    this.dbValue = dbValue;
  }

  /** The value stored in the {@code version_type} column. */
  public String dbValue() {
    return dbValue;
  }

  /**
   * Classifies a version string. Standard-library tags are classified as the version they stand
   * for; any other invalid string is treated as a release.
   */
  public static VersionType of(String version) {
    if (SemanticVersion.isPseudo(version)) {
      return PSEUDO;
    }
    return SemanticVersion.parse(version)
        .or(() -> SemanticVersion.forGoTag(version).flatMap(SemanticVersion::parse))
        .map(v -> v.isPrerelease() ? PRERELEASE : RELEASE)
        .orElse(RELEASE);
  }

  public static VersionType fromDbValue(String value) {
    for (VersionType type : values()) {
      if (type.dbValue.equals(value)) {
        return type;
      }
    }
    throw new IllegalArgumentException("unknown version type: " + value);
  }
}
