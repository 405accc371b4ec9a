package dev.pinakes.ingestion;

import dev.pinakes.module.Documentation;
import dev.pinakes.module.License;
import dev.pinakes.module.ModuleGraph;
import dev.pinakes.module.Readme;
import dev.pinakes.module.Unit;
import java.util.List;

/**
 * Withholds content that may not be redistributed: readme bodies, documentation and synopses of
 * non-redistributable units, and the text of non-redistributable license files. Unit rows,
 * package names, license types and exported symbols are kept.
 */
public final class RedistributabilityFilter {

  private RedistributabilityFilter() {}

  /** Returns a copy of the graph with withheld content removed; the input is not modified. */
  public static ModuleGraph apply(ModuleGraph graph) {
    List<License> licenses =
        graph.licenses().stream()
            .map(l -> l.redistributable() ? l : l.withoutContents())
            .toList();
    List<Unit> units = graph.units().stream().map(RedistributabilityFilter::apply).toList();
    return graph.withContent(licenses, units);
  }

  static Unit apply(Unit unit) {
    if (unit.redistributable()) {
      return unit;
    }
    Readme readme =
        unit.readme() == null ? null : new Readme(unit.readme().filePath(), null);
    List<Documentation> docs =
        unit.documentation().stream().map(Documentation::withoutContent).toList();
    return unit.withContent(readme, docs);
  }
}
