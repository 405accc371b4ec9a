package dev.pinakes.version;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jspecify.annotations.Nullable;
import org.semver4j.Semver;

/**
 * A module version in {@code vMAJOR.MINOR.PATCH[-PRERELEASE][+BUILD]} form.
 *
 * <p>Parsing and precedence are those of semver4j, with the conventions of module proxies on top:
 * a leading {@code v} is required, the shorthands {@code v1} and {@code v1.2} are accepted and
 * canonicalized to {@code v1.0.0} and {@code v1.2.0}, and build metadata is ignored for
 * precedence. Version components must fit in an {@code int}.
 */
public final class SemanticVersion implements Comparable<SemanticVersion> {

  private static final String INCOMPATIBLE_SUFFIX = "+incompatible";

  private static final Pattern PSEUDO_VERSION =
      Pattern.compile(
          "^v[0-9]+\\.(0\\.0-|\\d+\\.\\d+-([^+]*\\.)?0\\.)\\d{14}-[A-Za-z0-9]+"
              + "(\\+[0-9A-Za-z-]+(\\.[0-9A-Za-z-]+)*)?$");

  private static final Pattern MAJOR_ONLY = Pattern.compile("\\d+");
  private static final Pattern MAJOR_MINOR = Pattern.compile("\\d+\\.\\d+");

  /** Standard-library tags: {@code go1}, {@code go1.21}, {@code go1.21.3}, {@code go1.22rc1}. */
  private static final Pattern GO_TAG =
      Pattern.compile("^go(\\d+)(?:\\.(\\d+))?(?:\\.(\\d+))?(?:(beta|rc)(\\d+))?$");

  private final String original;
  private final Semver semver;
  private final Semver precedence;

  private SemanticVersion(String original, Semver semver) {
    this.original = original;
    this.semver = semver;
    this.precedence = semver.withClearedBuild();
  }

  /**
   * Parses a version string.
   *
   * @param version the version, e.g. {@code v1.2.3-rc.1}
   * @return the parsed version, or empty if the string is not a valid semantic version
   */
  public static Optional<SemanticVersion> parse(@Nullable String version) {
    if (version == null || version.length() < 2 || version.charAt(0) != 'v') {
      return Optional.empty();
    }
    String body = version.substring(1);
    if (!isDigit(body.charAt(0)) || Character.isWhitespace(body.charAt(body.length() - 1))) {
      return Optional.empty();
    }
    if (MAJOR_ONLY.matcher(body).matches()) {
      body = body + ".0.0";
    } else if (MAJOR_MINOR.matcher(body).matches()) {
      body = body + ".0";
    }
    Semver semver;
    try {
      semver = Semver.parse(body);
    } catch (NumberFormatException e) {
      // a component beyond the int range
      return Optional.empty();
    }
    return semver == null ? Optional.empty() : Optional.of(new SemanticVersion(version, semver));
  }

  /** Reports whether the string is a valid semantic version. */
  public static boolean isValid(@Nullable String version) {
    return parse(version).isPresent();
  }

  /**
   * Compares two version strings by semantic-version precedence. Standard-library tags are
   * compared as the versions they stand for ({@code go1.21rc2} as {@code v1.21.0-rc.2}). Any
   * other invalid version is less than every valid one, and invalid versions compare by their
   * text.
   */
  public static int compare(@Nullable String v1, @Nullable String v2) {
    Optional<SemanticVersion> p1 = parseOrGoTag(v1);
    Optional<SemanticVersion> p2 = parseOrGoTag(v2);
    if (p1.isPresent() && p2.isPresent()) {
      return p1.get().compareTo(p2.get());
    }
    if (p1.isPresent() || p2.isPresent()) {
      return p1.isPresent() ? 1 : -1;
    }
    return Integer.signum(Objects.toString(v1, "").compareTo(Objects.toString(v2, "")));
  }

  /** Reports whether {@code v1} has strictly higher precedence than {@code v2}. */
  public static boolean later(String v1, String v2) {
    return compare(v1, v2) > 0;
  }

  /** Reports whether the version carries {@code +incompatible} build metadata. */
  public static boolean isIncompatible(@Nullable String version) {
    return version != null && version.endsWith(INCOMPATIBLE_SUFFIX);
  }

  /** Reports whether the version is a pseudo-version derived from a commit. */
  public static boolean isPseudo(@Nullable String version) {
    return version != null && isValid(version) && PSEUDO_VERSION.matcher(version).matches();
  }

  /**
   * The semantic version a standard-library tag stands for: {@code go1.21.3} is {@code v1.21.3},
   * {@code go1.21} is {@code v1.21.0}, {@code go1.22rc1} is {@code v1.22.0-rc.1}.
   */
  public static Optional<String> forGoTag(@Nullable String tag) {
    if (tag == null) {
      return Optional.empty();
    }
    Matcher m = GO_TAG.matcher(tag);
    if (!m.matches()) {
      return Optional.empty();
    }
    StringBuilder sb = new StringBuilder("v").append(m.group(1));
    sb.append('.').append(m.group(2) == null ? "0" : m.group(2));
    sb.append('.').append(m.group(3) == null ? "0" : m.group(3));
    if (m.group(4) != null) {
      sb.append('-').append(m.group(4)).append('.').append(m.group(5));
    }
    return Optional.of(sb.toString());
  }

  /**
   * Returns a string whose lexical order matches the precedence order of valid versions.
   *
   * <p>Numeric components are prefixed with their digit count minus one, encoded as letters
   * ({@code a} = 1 ... {@code z} = 26, with extra {@code z}s beyond that). Components are joined by
   * {@code ,}; non-numeric prerelease identifiers are prefixed with {@code ~}; release versions
   * end in {@code ~}, which sorts after any prerelease suffix. Build metadata is dropped.
   * Standard-library tags get the key of the version they stand for; other invalid strings are
   * returned unchanged.
   */
  public static String forSorting(String version) {
    return parseOrGoTag(version).map(SemanticVersion::sortKey).orElse(version);
  }

  private static Optional<SemanticVersion> parseOrGoTag(@Nullable String version) {
    Optional<SemanticVersion> parsed = parse(version);
    return parsed.isPresent() ? parsed : forGoTag(version).flatMap(SemanticVersion::parse);
  }

  /** The canonical {@code vMAJOR.MINOR.PATCH[-PRERELEASE]} form, without build metadata. */
  public String canonical() {
    return "v" + precedence.getVersion();
  }

  /** The sortable key of this version; see {@link #forSorting(String)}. */
  public String sortKey() {
    StringBuilder sb = new StringBuilder();
    appendNumeric(sb, String.valueOf(semver.getMajor()));
    sb.append(',');
    appendNumeric(sb, String.valueOf(semver.getMinor()));
    sb.append(',');
    appendNumeric(sb, String.valueOf(semver.getPatch()));
    List<String> identifiers = semver.getPreRelease();
    if (identifiers.isEmpty()) {
      return sb.append('~').toString();
    }
    for (String part : identifiers) {
      sb.append(',');
      if (isNumeric(part)) {
        appendNumeric(sb, part);
      } else {
        sb.append('~').append(part);
      }
    }
    return sb.toString();
  }

  public String original() {
    return original;
  }

  public int major() {
    return semver.getMajor();
  }

  public int minor() {
    return semver.getMinor();
  }

  public int patch() {
    return semver.getPatch();
  }

  /** The prerelease identifiers without the leading {@code -}, or empty for a release. */
  public String prerelease() {
    return String.join(".", semver.getPreRelease());
  }

  /** The build metadata without the leading {@code +}, or empty. */
  public String build() {
    return String.join(".", semver.getBuild());
  }

  public boolean isPrerelease() {
    return !semver.getPreRelease().isEmpty();
  }

  @Override
  public int compareTo(SemanticVersion other) {
    return Integer.signum(precedence.compareTo(other.precedence));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SemanticVersion that)) {
      return false;
    }
    return original.equals(that.original);
  }

  @Override
  public int hashCode() {
    return Objects.hash(original);
  }

  @Override
  public String toString() {
    return original;
  }

  static void appendNumericPrefix(StringBuilder sb, int digits) {
    int n = digits - 1;
    while (n > 26) {
      sb.append('z');
      n -= 26;
    }
    if (n > 0) {
      sb.append((char) ('a' + n - 1));
    }
  }

  private static void appendNumeric(StringBuilder sb, String digits) {
    appendNumericPrefix(sb, digits.length());
    sb.append(digits);
  }

  private static boolean isNumeric(String s) {
    if (s.isEmpty()) {
      return false;
    }
    for (int i = 0; i < s.length(); i++) {
      if (!isDigit(s.charAt(i))) {
        return false;
      }
    }
    return true;
  }

  private static boolean isDigit(char c) {
    return c >= '0' && c <= '9';
  }
}
