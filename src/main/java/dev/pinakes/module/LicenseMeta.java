package dev.pinakes.module;

import jakarta.validation.constraints.NotNull;
import java.util.List;

/** The detected types and file path of a license, without its text. */
public record LicenseMeta(List<@NotNull String> types, String filePath) {

  public LicenseMeta {
    types = ModuleGraph.copyOf(types);
  }
}
