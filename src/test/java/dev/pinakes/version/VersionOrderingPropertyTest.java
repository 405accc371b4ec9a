package dev.pinakes.version;

import static org.assertj.core.api.Assertions.assertThat;

import net.jqwik.api.Arbitraries;
import net.jqwik.api.Arbitrary;
import net.jqwik.api.Combinators;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.Provide;

/**
 * Property-based checks that sortable keys and stored ordering agree with semantic-version
 * precedence for arbitrary valid versions.
 */
class VersionOrderingPropertyTest {

  @Provide
  Arbitrary<String> versions() {
    Arbitrary<Integer> numbers =
        Arbitraries.oneOf(
            Arbitraries.integers().between(0, 12), Arbitraries.integers().between(0, 2_000_000));
    Arbitrary<String> identifier =
        Arbitraries.oneOf(
            Arbitraries.integers().between(0, 5000).map(String::valueOf),
            Arbitraries.strings()
                .withCharRange('a', 'z')
                .withChars('-')
                .ofMinLength(1)
                .ofMaxLength(6));
    Arbitrary<String> prerelease =
        Arbitraries.oneOf(
            Arbitraries.just(""),
            identifier.list().ofMinSize(1).ofMaxSize(3).map(ids -> "-" + String.join(".", ids)));
    Arbitrary<String> build = Arbitraries.of("", "+meta", "+incompatible", "+b.1");
    return Combinators.combine(numbers, numbers, numbers, prerelease, build)
        .as((major, minor, patch, pre, b) -> "v" + major + "." + minor + "." + patch + pre + b);
  }

  @Property
  void generatedVersionsAreValid(@ForAll("versions") String version) {
    assertThat(SemanticVersion.isValid(version)).isTrue();
  }

  @Property
  void sortKeyOrderMatchesPrecedence(
      @ForAll("versions") String a, @ForAll("versions") String b) {
    int byPrecedence = Integer.signum(SemanticVersion.compare(a, b));
    int byKey =
        Integer.signum(SemanticVersion.forSorting(a).compareTo(SemanticVersion.forSorting(b)));

    assertThat(byKey).isEqualTo(byPrecedence);
  }

  @Property
  void compareIsAntisymmetric(@ForAll("versions") String a, @ForAll("versions") String b) {
    assertThat(Integer.signum(SemanticVersion.compare(a, b)))
        .isEqualTo(-Integer.signum(SemanticVersion.compare(b, a)));
  }

  @Property
  void laterVersionIsNeverPreferredLessWithinSameType(
      @ForAll("versions") String a, @ForAll("versions") String b) {
    VersionMeta ma = VersionMeta.of("example.com/mod", a);
    VersionMeta mb = VersionMeta.of("example.com/mod", b);
    if (ma.type() == mb.type() && SemanticVersion.later(a, b)) {
      assertThat(VersionOrder.PREFERENCE.compare(ma, mb)).isNegative();
    }
  }
}
