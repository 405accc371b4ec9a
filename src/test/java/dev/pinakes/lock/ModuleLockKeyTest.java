package dev.pinakes.lock;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ModuleLockKeyTest {

  @Test
  void emptyPathHashesToOffsetBasis() {
    assertThat(ModuleLockKey.of("")).isEqualTo(0xcbf29ce484222325L);
  }

  @Test
  void matchesKnownFnv1Value() {
    assertThat(ModuleLockKey.of("a")).isEqualTo(0xaf63bd4c8601b7beL);
  }

  @Test
  void isStableAndDistinguishesPaths() {
    assertThat(ModuleLockKey.of("example.com/mod")).isEqualTo(ModuleLockKey.of("example.com/mod"));
    assertThat(ModuleLockKey.of("example.com/mod"))
        .isNotEqualTo(ModuleLockKey.of("example.com/mod/v2"));
  }
}
