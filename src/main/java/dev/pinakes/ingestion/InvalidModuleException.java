package dev.pinakes.ingestion;

import java.util.List;

/**
 * A module graph failed validation and was not stored. The message lists every problem found,
 * prefixed with the module coordinates.
 */
public class InvalidModuleException extends RuntimeException {

  private final List<String> problems;

  public InvalidModuleException(String coordinates, List<String> problems) {
    super("ingest(" + coordinates + "): " + String.join("; ", problems));
    this.problems = List.copyOf(problems);
  }

  public List<String> getProblems() {
    return problems;
  }
}
