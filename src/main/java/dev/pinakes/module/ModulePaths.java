package dev.pinakes.module;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Rules for module paths and the import paths of their units. */
public final class ModulePaths {

  /** Module path of the standard library, whose versions are not semantic versions. */
  public static final String STDLIB = "std";

  private static final Pattern MAJOR_SUFFIX = Pattern.compile("^(.+)/(v[0-9]+)$");

  private ModulePaths() {}

  /**
   * Checks that a module path is well formed: slash-separated non-empty elements of letters,
   * digits and {@code -._~}, none starting or ending with a dot, a first element that looks like
   * a lowercase host name, and a major version suffix (if any) of {@code v2} or higher.
   *
   * @return a description of the first problem found, or empty when the path is valid
   */
  public static Optional<String> checkPath(String path) {
    if (STDLIB.equals(path)) {
      return Optional.empty();
    }
    if (path == null || path.isEmpty()) {
      return Optional.of("empty module path");
    }
    if (path.startsWith("/") || path.endsWith("/")) {
      return Optional.of("leading or trailing slash in module path " + path);
    }
    String[] elems = path.split("/", -1);
    for (String elem : elems) {
      Optional<String> problem = checkElement(elem);
      if (problem.isPresent()) {
        return problem.map(p -> p + " in module path " + path);
      }
    }
    String first = elems[0];
    if (!first.contains(".")) {
      return Optional.of("missing dot in first path element of " + path);
    }
    if (first.startsWith("-")) {
      return Optional.of("leading dash in first path element of " + path);
    }
    for (int i = 0; i < first.length(); i++) {
      char c = first.charAt(i);
      if (!(c >= 'a' && c <= 'z') && !(c >= '0' && c <= '9') && c != '-' && c != '.') {
        return Optional.of("invalid char '" + c + "' in first path element of " + path);
      }
    }
    Matcher m = MAJOR_SUFFIX.matcher(path);
    if (elems.length > 1 && m.matches()) {
      String suffix = m.group(2);
      if (suffix.equals("v0") || suffix.equals("v1") || suffix.startsWith("v0")) {
        return Optional.of("invalid major version suffix " + suffix + " in " + path);
      }
    }
    return Optional.empty();
  }

  /** The module path with its major version suffix removed: {@code a.com/m/v3} becomes {@code a.com/m}. */
  public static String seriesPath(String modulePath) {
    Matcher m = MAJOR_SUFFIX.matcher(modulePath);
    if (m.matches() && checkMajor(m.group(2))) {
      return m.group(1);
    }
    return modulePath;
  }

  /**
   * The import path a unit would have at major version 1: the module path prefix is replaced by
   * the series path.
   */
  public static String v1Path(String unitPath, String modulePath) {
    String series = seriesPath(modulePath);
    if (series.equals(modulePath) || !unitPath.startsWith(modulePath)) {
      return unitPath;
    }
    return series + unitPath.substring(modulePath.length());
  }

  private static boolean checkMajor(String suffix) {
    return !suffix.equals("v0") && !suffix.equals("v1") && !suffix.startsWith("v0");
  }

  private static Optional<String> checkElement(String elem) {
    if (elem.isEmpty()) {
      return Optional.of("empty path element");
    }
    if (elem.startsWith(".") || elem.endsWith(".")) {
      return Optional.of("leading or trailing dot in path element " + elem);
    }
    for (int i = 0; i < elem.length(); i++) {
      char c = elem.charAt(i);
      boolean ok =
          (c >= 'a' && c <= 'z')
              || (c >= 'A' && c <= 'Z')
              || (c >= '0' && c <= '9')
              || c == '-'
              || c == '.'
              || c == '_'
              || c == '~';
      if (!ok) {
        return Optional.of("invalid char '" + c + "'");
      }
    }
    return Optional.empty();
  }
}
