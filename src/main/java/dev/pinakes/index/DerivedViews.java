package dev.pinakes.index;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Brings the search index and the import graph of a module in line with its good version. Callers
 * hold the module lock.
 */
@Service
public class DerivedViews {

  private static final Logger log = LoggerFactory.getLogger(DerivedViews.class);

  private final SearchIndex searchIndex;
  private final ImportGraph importGraph;
  private final AlternativePathRegistry alternativePathRegistry;

  public DerivedViews(
      SearchIndex searchIndex,
      ImportGraph importGraph,
      AlternativePathRegistry alternativePathRegistry) {
    this.searchIndex = searchIndex;
    this.importGraph = importGraph;
    this.alternativePathRegistry = alternativePathRegistry;
  }

  /**
   * Rebuilds the module's derived rows from the stored rows of {@code goodVersion}. An empty good
   * version removes them. Alternative module paths get import edges but no search rows.
   */
  public void refresh(String modulePath, String goodVersion) {
    if (goodVersion.isEmpty()) {
      searchIndex.deleteForModule(modulePath);
      importGraph.deleteForModule(modulePath);
      log.info("{} has no good version; removed its derived rows", modulePath);
      return;
    }
    importGraph.replaceForModule(modulePath, goodVersion);
    if (alternativePathRegistry.isAlternative(modulePath, goodVersion)) {
      int removed = searchIndex.deleteForModule(modulePath);
      log.info("{} is an alternative module path; suppressed {} search rows", modulePath, removed);
      return;
    }
    searchIndex.replaceForModule(modulePath, goodVersion);
  }
}
