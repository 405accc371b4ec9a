package dev.pinakes.symbol;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class SinceVersionRuleTest {

  @Test
  void onlyCompatibleReleasesAreEligible() {
    assertThat(SinceVersionRule.isEligible("v1.2.0")).isTrue();
    assertThat(SinceVersionRule.isEligible("v1.2.0-rc.1")).isFalse();
    assertThat(SinceVersionRule.isEligible("v0.0.0-20190311183353-d8887717615a")).isFalse();
    assertThat(SinceVersionRule.isEligible("v2.0.0+incompatible")).isFalse();
  }

  @Test
  void earlierObservationLowersSinceVersion() {
    assertThat(SinceVersionRule.merge("v2.0.0", "v1.0.0")).isEqualTo("v1.0.0");
  }

  @Test
  void laterObservationNeverRaisesSinceVersion() {
    assertThat(SinceVersionRule.merge("v1.0.0", "v3.0.0")).isEqualTo("v1.0.0");
  }

  @Test
  void equalObservationIsNoOp() {
    assertThat(SinceVersionRule.merge("v1.0.0", "v1.0.0")).isEqualTo("v1.0.0");
  }

  @Test
  void firstObservationIsRecorded() {
    assertThat(SinceVersionRule.merge(null, "v1.4.0")).isEqualTo("v1.4.0");
  }
}
