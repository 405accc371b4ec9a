package dev.pinakes.module;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A license file of a module.
 *
 * @param types detected license types, e.g. {@code MIT}
 * @param filePath path of the file relative to the module root
 * @param contents the file text; null when withheld
 * @param redistributable whether the detected types permit redistribution
 */
public record License(
    List<@NotNull String> types,
    @NotBlank String filePath,
    @Nullable String contents,
    boolean redistributable) {

  public License {
    types = ModuleGraph.copyOf(types);
  }

  public LicenseMeta meta() {
    return new LicenseMeta(types, filePath);
  }

  public License withoutContents() {
    return new License(types, filePath, null, redistributable);
  }
}
