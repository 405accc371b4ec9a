package dev.pinakes.module;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A directory of a module: the module root, a plain directory, or a package.
 *
 * @param path the full import path of the directory
 * @param name the package name, or null when the directory is not a package
 * @param redistributable whether the unit's content may be shown
 * @param licenses the license files that apply to this unit
 * @param readme the unit's readme, if any
 * @param documentation one entry per build context the package was documented for
 * @param imports import paths of the package, unordered
 */
public record Unit(
    @NotBlank String path,
    @Nullable String name,
    boolean redistributable,
    @Valid List<@NotNull LicenseMeta> licenses,
    @Nullable @Valid Readme readme,
    @Valid List<@NotNull Documentation> documentation,
    List<@NotNull String> imports) {

  public Unit {
    licenses = ModuleGraph.copyOf(licenses);
    documentation = ModuleGraph.copyOf(documentation);
    imports = ModuleGraph.copyOf(imports);
  }

  public boolean isPackage() {
    return name != null;
  }

  public List<String> licenseTypes() {
    return licenses.stream().flatMap(l -> l.types().stream()).toList();
  }

  public List<String> licensePaths() {
    return licenses.stream().map(LicenseMeta::filePath).toList();
  }

  /** Synopsis of the first documented build context, or empty. */
  public String synopsis() {
    return documentation.isEmpty() ? "" : documentation.get(0).synopsis();
  }

  public Unit withContent(@Nullable Readme readme, List<Documentation> documentation) {
    return new Unit(path, name, redistributable, licenses, readme, documentation, imports);
  }
}
