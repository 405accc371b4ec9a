package dev.pinakes.state;

import dev.pinakes.version.VersionType;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Orders due module versions into a batch.
 *
 * <p>Buckets, highest priority first:
 *
 * <ol>
 *   <li>the latest version of its module, a release, not oversized
 *   <li>the latest version of its module, a prerelease or pseudo-version, not oversized
 *   <li>any other version that is not oversized
 *   <li>oversized versions (more packages than the threshold)
 * </ol>
 *
 * <p>Within a bucket, cheaper versions (fewer packages) come first, then higher versions. A first
 * pass takes at most one version per module so that one module with many versions cannot starve
 * the others; a second pass fills the remaining slots. At most {@code largeModulesLimit}
 * oversized versions are taken.
 *
 * <p>"Latest" is judged over every known version of the module, not only the due ones: a due
 * version whose newer sibling already succeeded is not the latest.
 */
public class BatchPrioritizer {

  private static final Comparator<ModuleVersionState> LATEST_FIRST =
      Comparator.comparing(ModuleVersionState::isIncompatible)
          .thenComparing(s -> !isRelease(s))
          .thenComparing(ModuleVersionState::getSortVersion, Comparator.reverseOrder());

  private static final Comparator<Candidate> PRIORITY =
      Comparator.comparingInt(Candidate::bucket)
          .thenComparingInt(Candidate::cost)
          .thenComparing(c -> c.state().getSortVersion(), Comparator.reverseOrder())
          .thenComparing(c -> c.state().getModulePath());

  private final int largeModulePackageThreshold;
  private final int largeModulesLimit;

  public BatchPrioritizer(int largeModulePackageThreshold, int largeModulesLimit) {
    this.largeModulePackageThreshold = largeModulePackageThreshold;
    this.largeModulesLimit = largeModulesLimit;
  }

  /**
   * Picks up to {@code limit} versions from {@code due}.
   *
   * @param latestVersions latest version per module path over all state rows; modules missing
   *     from the map fall back to their latest due version
   */
  public List<PendingItem> prioritize(
      List<ModuleVersionState> due, Map<String, String> latestVersions, int limit) {
    Map<String, ModuleVersionState> latestDue = new HashMap<>();
    for (ModuleVersionState state : due) {
      latestDue.merge(
          state.getModulePath(),
          state,
          (a, b) -> LATEST_FIRST.compare(a, b) <= 0 ? a : b);
    }

    List<Candidate> candidates = new ArrayList<>(due.size());
    for (ModuleVersionState state : due) {
      String latest = latestVersions.get(state.getModulePath());
      boolean isLatest =
          latest != null
              ? latest.equals(state.getVersion())
              : latestDue.get(state.getModulePath()) == state;
      candidates.add(classify(state, isLatest));
    }
    candidates.sort(PRIORITY);

    List<Candidate> chosen = new ArrayList<>();
    Set<String> chosenModules = new HashSet<>();
    boolean[] taken = new boolean[candidates.size()];
    int large = 0;

    for (int i = 0; i < candidates.size() && chosen.size() < limit; i++) {
      Candidate c = candidates.get(i);
      if (chosenModules.contains(c.state().getModulePath())) {
        continue;
      }
      if (c.oversized() && large >= largeModulesLimit) {
        continue;
      }
      taken[i] = true;
      chosen.add(c);
      chosenModules.add(c.state().getModulePath());
      if (c.oversized()) {
        large++;
      }
    }
    for (int i = 0; i < candidates.size() && chosen.size() < limit; i++) {
      Candidate c = candidates.get(i);
      if (taken[i] || (c.oversized() && large >= largeModulesLimit)) {
        continue;
      }
      taken[i] = true;
      chosen.add(c);
      if (c.oversized()) {
        large++;
      }
    }

    chosen.sort(PRIORITY);
    return chosen.stream().map(Candidate::toItem).toList();
  }

  private Candidate classify(ModuleVersionState state, boolean isLatest) {
    int cost = state.getNumPackages() == null ? 0 : state.getNumPackages();
    boolean oversized = cost > largeModulePackageThreshold;
    int bucket;
    if (oversized) {
      bucket = 4;
    } else if (isLatest && isRelease(state)) {
      bucket = 1;
    } else if (isLatest) {
      bucket = 2;
    } else {
      bucket = 3;
    }
    return new Candidate(state, bucket, cost, oversized);
  }

  private static boolean isRelease(ModuleVersionState state) {
    return VersionType.of(state.getVersion()) == VersionType.RELEASE;
  }

  private record Candidate(ModuleVersionState state, int bucket, int cost, boolean oversized) {

    PendingItem toItem() {
      return new PendingItem(
          state.getModulePath(),
          state.getVersion(),
          state.getStatus(),
          state.getTryCount(),
          cost,
          bucket);
    }
  }
}
