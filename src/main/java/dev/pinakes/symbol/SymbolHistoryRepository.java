package dev.pinakes.symbol;

import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

/** Spring Data repository for {@link SymbolHistoryEntry} entities. */
public interface SymbolHistoryRepository extends JpaRepository<SymbolHistoryEntry, Long> {

  List<SymbolHistoryEntry> findAllByPackagePathIn(Collection<String> packagePaths);

  List<SymbolHistoryEntry> findAllByPackagePathOrderBySymbolNameAscBuildOsAscBuildArchAsc(
      String packagePath);
}
