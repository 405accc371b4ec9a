package dev.pinakes.module;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Everything extracted from one version of a module, ready to be stored.
 *
 * <p>Built by a {@link ModuleFetcher} and consumed by the ingestion coordinator.
 *
 * @param modulePath the module path, e.g. {@code example.com/mod/v2}
 * @param version the module version, e.g. {@code v2.1.0}
 * @param commitTime when the version's commit was made; must not be the epoch
 * @param hasGoMod whether the module ships its own manifest
 * @param goModPath the module path declared by the manifest, when present
 * @param redistributable whether the module as a whole may be redistributed
 * @param sourceInfo opaque JSON describing where the source is hosted
 * @param licenses license files found in the module
 * @param units the module root, directories and packages of the module
 */
public record ModuleGraph(
    @NotBlank String modulePath,
    @NotBlank String version,
    @NotNull Instant commitTime,
    boolean hasGoMod,
    @Nullable String goModPath,
    boolean redistributable,
    @Nullable String sourceInfo,
    @NotNull @Valid List<@NotNull License> licenses,
    @NotEmpty @Valid List<@NotNull Unit> units) {

  public ModuleGraph {
    // null elements are kept so that validation can report them
    licenses = copyOf(licenses);
    units = copyOf(units);
  }

  static <T> List<T> copyOf(@Nullable List<T> list) {
    return list == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(list));
  }

  /** The module path without its major version suffix. */
  public String seriesPath() {
    return ModulePaths.seriesPath(modulePath);
  }

  /** {@code modulePath@version}, used in log and error messages. */
  public String coordinates() {
    return modulePath + "@" + version;
  }

  public ModuleGraph withContent(List<License> licenses, List<Unit> units) {
    return new ModuleGraph(
        modulePath,
        version,
        commitTime,
        hasGoMod,
        goModPath,
        redistributable,
        sourceInfo,
        licenses,
        units);
  }
}
