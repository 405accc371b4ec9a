package dev.pinakes.module;

public enum SymbolKind {
  CONSTANT,
  VARIABLE,
  FUNCTION,
  TYPE,
  FIELD,
  METHOD
}
