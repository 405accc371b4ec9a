package dev.pinakes.ingestion;

/**
 * Outcome of a successful ingestion.
 *
 * @param isLatest whether the ingested version is now the module's good version
 * @param goodVersion the module's good version after ingestion, empty when there is none
 */
public record IngestResult(boolean isLatest, String goodVersion) {

  public boolean hasGoodVersion() {
    return !goodVersion.isEmpty();
  }
}
