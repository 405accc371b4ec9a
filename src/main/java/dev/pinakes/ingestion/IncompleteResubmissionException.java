package dev.pinakes.ingestion;

import java.util.List;

/**
 * A module version was resubmitted with fewer units or license files than were stored for it
 * before. Accepting it would leave stale rows behind, so the whole submission is rejected.
 */
public class IncompleteResubmissionException extends InvalidModuleException {

  public IncompleteResubmissionException(String coordinates, List<String> problems) {
    super(coordinates, problems);
  }
}
