package dev.pinakes.ingestion;

import dev.pinakes.module.ModuleGraph;
import dev.pinakes.module.ModulePaths;
import dev.pinakes.module.Unit;
import dev.pinakes.version.SemanticVersion;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import org.springframework.stereotype.Component;

/**
 * Rejects malformed module graphs before anything is written. All problems are collected and
 * reported together.
 */
@Component
public class ModuleValidator {

  private final Validator validator;

  public ModuleValidator(Validator validator) {
    this.validator = validator;
  }

  /**
   * @throws InvalidModuleException if the graph has any problem
   */
  public void validate(ModuleGraph graph) {
    List<String> problems = new ArrayList<>();
    Set<ConstraintViolation<ModuleGraph>> violations = validator.validate(graph);
    violations.stream()
        .map(v -> v.getPropertyPath() + ": " + v.getMessage())
        .sorted()
        .forEach(problems::add);

    String modulePath = graph.modulePath();
    String version = graph.version();
    boolean stdlib = ModulePaths.STDLIB.equals(modulePath);
    if (modulePath != null && !modulePath.isBlank()) {
      ModulePaths.checkPath(modulePath).ifPresent(problems::add);
    }
    if (version != null && !version.isBlank() && !stdlib && !SemanticVersion.isValid(version)) {
      problems.add("invalid version " + version);
    }
    if (Instant.EPOCH.equals(graph.commitTime())) {
      problems.add("commitTime: must not be the zero time");
    }

    Set<String> seen = new HashSet<>();
    Set<String> duplicates = new TreeSet<>();
    for (Unit unit : graph.units()) {
      if (unit == null || unit.path() == null) {
        continue;
      }
      if (!seen.add(unit.path())) {
        duplicates.add(unit.path());
      }
      if (!stdlib && modulePath != null && !isWithinModule(unit.path(), modulePath)) {
        problems.add("unit " + unit.path() + " is outside module " + modulePath);
      }
    }
    duplicates.forEach(d -> problems.add("duplicate unit path " + d));

    if (!problems.isEmpty()) {
      throw new InvalidModuleException(modulePath + "@" + version, problems);
    }
  }

  private static boolean isWithinModule(String unitPath, String modulePath) {
    return unitPath.equals(modulePath) || unitPath.startsWith(modulePath + "/");
  }
}
