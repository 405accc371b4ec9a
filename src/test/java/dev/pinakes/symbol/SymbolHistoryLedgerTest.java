package dev.pinakes.symbol;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import dev.pinakes.module.BuildContext;
import dev.pinakes.module.Symbol;
import dev.pinakes.module.SymbolKind;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SymbolHistoryLedgerTest {

  private static final String MOD = "example.com/mod";
  private static final String PKG = "example.com/mod/pkg";
  private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

  @Mock SymbolHistoryRepository repository;

  @Captor ArgumentCaptor<List<SymbolHistoryEntry>> saved;

  SymbolHistoryLedger ledger;

  @BeforeEach
  void setUp() {
    ledger = new SymbolHistoryLedger(repository, Clock.fixed(NOW, ZoneOffset.UTC));
  }

  private static List<UnitSymbols> symbols(Symbol... symbols) {
    return List.of(new UnitSymbols(PKG, BuildContext.ALL, List.of(symbols)));
  }

  private static SymbolHistoryEntry recorded(String name, String since) {
    return new SymbolHistoryEntry(
        new SymbolKey(PKG, name, name, BuildContext.ALL), MOD, SymbolKind.FUNCTION, since);
  }

  private List<SymbolHistoryEntry> savedEntries() {
    verify(repository).saveAll(saved.capture());
    return new ArrayList<>(saved.getValue());
  }

  @Test
  void newSymbolsAreRecordedAtObservedVersion() {
    when(repository.findAllByPackagePathIn(anyCollection())).thenReturn(List.of());

    int changed =
        ledger.merge(
            MOD,
            "v1.2.0",
            symbols(
                Symbol.topLevel("New", SymbolKind.FUNCTION),
                new Symbol("Close", "Client", SymbolKind.METHOD)));

    assertThat(changed).isEqualTo(2);
    assertThat(savedEntries())
        .extracting(SymbolHistoryEntry::getSinceVersion)
        .containsOnly("v1.2.0");
  }

  @Test
  void olderReleaseLowersSinceVersion() {
    when(repository.findAllByPackagePathIn(anyCollection()))
        .thenReturn(List.of(recorded("New", "v2.0.0")));

    int changed =
        ledger.merge(MOD, "v1.0.0", symbols(Symbol.topLevel("New", SymbolKind.FUNCTION)));

    assertThat(changed).isEqualTo(1);
    assertThat(savedEntries())
        .singleElement()
        .extracting(SymbolHistoryEntry::getSinceVersion)
        .isEqualTo("v1.0.0");
  }

  @Test
  void newerReleaseDoesNotRaiseSinceVersion() {
    when(repository.findAllByPackagePathIn(anyCollection()))
        .thenReturn(List.of(recorded("New", "v1.0.0")));

    int changed =
        ledger.merge(MOD, "v3.0.0", symbols(Symbol.topLevel("New", SymbolKind.FUNCTION)));

    assertThat(changed).isZero();
    assertThat(savedEntries()).isEmpty();
  }

  @Test
  void remergingSameVersionIsNoOp() {
    when(repository.findAllByPackagePathIn(anyCollection()))
        .thenReturn(List.of(recorded("New", "v1.0.0")));

    int changed =
        ledger.merge(MOD, "v1.0.0", symbols(Symbol.topLevel("New", SymbolKind.FUNCTION)));

    assertThat(changed).isZero();
  }

  @Test
  void prereleaseAndIncompatibleVersionsAreSkipped() {
    assertThat(ledger.merge(MOD, "v2.0.0-rc.1", symbols(Symbol.topLevel("X", SymbolKind.TYPE))))
        .isZero();
    assertThat(
            ledger.merge(
                MOD, "v2.0.0+incompatible", symbols(Symbol.topLevel("X", SymbolKind.TYPE))))
        .isZero();

    verifyNoInteractions(repository);
  }

  @Test
  void buildContextsAreTrackedSeparately() {
    when(repository.findAllByPackagePathIn(anyCollection()))
        .thenReturn(List.of(recorded("New", "v1.0.0")));
    BuildContext linux = new BuildContext("linux", "amd64");

    int changed =
        ledger.merge(
            MOD,
            "v1.5.0",
            List.of(
                new UnitSymbols(PKG, linux, List.of(Symbol.topLevel("New", SymbolKind.FUNCTION)))));

    assertThat(changed).isEqualTo(1);
    assertThat(savedEntries())
        .singleElement()
        .satisfies(
            e -> {
              assertThat(e.getBuildOs()).isEqualTo("linux");
              assertThat(e.getSinceVersion()).isEqualTo("v1.5.0");
            });
  }

  @Test
  void sinceVersionMatchesOnTheWholeKey() {
    when(repository.findAllByPackagePathIn(List.of(PKG)))
        .thenReturn(List.of(recorded("New", "v1.1.0"), recorded("Old", "v1.0.0")));

    assertThat(ledger.sinceVersion(new SymbolKey(PKG, "New", "New", BuildContext.ALL)))
        .contains("v1.1.0");
    assertThat(
            ledger.sinceVersion(
                new SymbolKey(PKG, "New", "New", new BuildContext("linux", "amd64"))))
        .isEmpty();
  }
}
