package dev.pinakes.module;

/** Identifies one version of one module. */
public record ModuleVersionRef(String modulePath, String version) {

  @Override
  public String toString() {
    return modulePath + "@" + version;
  }
}
