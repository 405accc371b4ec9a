package dev.pinakes.module;

import java.util.Optional;

/**
 * Source of module content: a module proxy or a version control host.
 *
 * <p>No implementation ships with this project; deployments provide one as a Spring bean.
 * Implementations signal a missing module or version by throwing {@link
 * dev.pinakes.NotFoundException}.
 */
public interface ModuleFetcher {

  /**
   * Downloads and analyzes one version of a module.
   *
   * @param modulePath the module path
   * @param version the resolved version
   * @return the fetched graph, or an indication that the module lives under another path
   */
  FetchOutcome fetch(String modulePath, String version);

  /**
   * Asks upstream for the module's raw and cooked latest versions, retractions and deprecation.
   *
   * @return the facts, or empty when upstream knows nothing about the module
   */
  Optional<LatestVersionsInfo> fetchLatestVersions(String modulePath);
}
