package dev.pinakes.module;

/**
 * An exported identifier of a package. Methods and fields carry the name of their type in {@code
 * parentName}; top-level symbols use their own name as parent.
 */
public record Symbol(String name, String parentName, SymbolKind kind) {

  public static Symbol topLevel(String name, SymbolKind kind) {
    return new Symbol(name, name, kind);
  }
}
