package dev.pinakes.storage;

import java.util.List;
import org.jspecify.annotations.Nullable;

/** A stored unit with the module version it belongs to. */
public record UnitInfo(
    String path,
    String v1Path,
    String modulePath,
    String version,
    @Nullable String name,
    List<String> licenseTypes,
    List<String> licensePaths,
    boolean redistributable) {

  public boolean isPackage() {
    return name != null;
  }
}
