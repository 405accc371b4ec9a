package dev.pinakes.symbol;

import dev.pinakes.module.BuildContext;

/** Identity of a symbol history record. */
public record SymbolKey(
    String packagePath, String symbolName, String parentName, BuildContext buildContext) {}
