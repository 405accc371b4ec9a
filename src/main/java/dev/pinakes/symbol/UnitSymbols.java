package dev.pinakes.symbol;

import dev.pinakes.module.BuildContext;
import dev.pinakes.module.Symbol;
import java.util.List;

/** The exported symbols of one package in one build context. */
public record UnitSymbols(String packagePath, BuildContext buildContext, List<Symbol> symbols) {

  public UnitSymbols {
    symbols = List.copyOf(symbols);
  }
}
