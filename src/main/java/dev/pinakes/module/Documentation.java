package dev.pinakes.module;

import jakarta.validation.constraints.NotNull;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * Rendered documentation of a package for one build context.
 *
 * @param buildContext the platform the documentation applies to
 * @param synopsis one-line package summary
 * @param html rendered documentation; null when withheld
 * @param symbols exported symbols of the package in this build context
 */
public record Documentation(
    @NotNull BuildContext buildContext,
    String synopsis,
    @Nullable String html,
    List<@NotNull Symbol> symbols) {

  public Documentation {
    synopsis = synopsis == null ? "" : synopsis;
    symbols = ModuleGraph.copyOf(symbols);
  }

  public Documentation withoutContent() {
    return new Documentation(buildContext, "", null, symbols);
  }
}
