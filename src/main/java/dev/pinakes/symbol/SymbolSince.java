package dev.pinakes.symbol;

import dev.pinakes.module.BuildContext;
import dev.pinakes.module.SymbolKind;

/** A symbol of a package with the earliest release it appeared in. */
public record SymbolSince(
    String symbolName,
    String parentName,
    SymbolKind kind,
    BuildContext buildContext,
    String sinceVersion) {

  static SymbolSince of(SymbolHistoryEntry entry) {
    return new SymbolSince(
        entry.getSymbolName(),
        entry.getParentName(),
        entry.getSymbolKind(),
        new BuildContext(entry.getBuildOs(), entry.getBuildArch()),
        entry.getSinceVersion());
  }
}
