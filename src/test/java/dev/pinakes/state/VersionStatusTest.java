package dev.pinakes.state;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.pinakes.NotFoundException;
import dev.pinakes.ingestion.IncompleteResubmissionException;
import dev.pinakes.ingestion.InvalidModuleException;
import dev.pinakes.lock.NotInTransactionException;
import dev.pinakes.module.BadModuleException;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import org.junit.jupiter.api.Test;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.dao.TransientDataAccessResourceException;

class VersionStatusTest {

  @Test
  void mapsDomainExceptionsToTerminalStatuses() {
    assertThat(VersionStatus.fromException(new NotFoundException("gone")))
        .isEqualTo(VersionStatus.NOT_FOUND);
    assertThat(VersionStatus.fromException(new InvalidModuleException("m@v1.0.0", List.of("bad"))))
        .isEqualTo(VersionStatus.VALIDATION_FAILURE);
    assertThat(
            VersionStatus.fromException(
                new IncompleteResubmissionException("m@v1.0.0", List.of("missing"))))
        .isEqualTo(VersionStatus.VALIDATION_FAILURE);
    assertThat(VersionStatus.fromException(new BadModuleException("zip bomb")))
        .isEqualTo(VersionStatus.BAD_MODULE);
  }

  @Test
  void storeErrorsAreTransient() {
    assertThat(VersionStatus.fromException(new TransientDataAccessResourceException("down")))
        .isEqualTo(VersionStatus.TRANSIENT_FAILURE);
    assertThat(VersionStatus.fromException(new QueryTimeoutException("slow")))
        .isEqualTo(VersionStatus.TRANSIENT_FAILURE);
    assertThat(VersionStatus.fromException(new IllegalStateException("unexpected")))
        .isEqualTo(VersionStatus.TRANSIENT_FAILURE);
  }

  @Test
  void lockContractViolationIsTerminal() {
    VersionStatus status =
        VersionStatus.fromException(
            new ExecutionException(new NotInTransactionException("example.com/m")));

    assertThat(status).isEqualTo(VersionStatus.INTERNAL_ERROR);
    assertThat(status.isEligible()).isFalse();
  }

  @Test
  void unwrapsExecutorWrappers() {
    Throwable wrapped =
        new ExecutionException(new CompletionException(new NotFoundException("gone")));

    assertThat(VersionStatus.fromException(wrapped)).isEqualTo(VersionStatus.NOT_FOUND);
  }

  @Test
  void eligibilityFollowsCodes() {
    assertThat(VersionStatus.NEW.isEligible()).isTrue();
    assertThat(VersionStatus.TRANSIENT_FAILURE.isEligible()).isTrue();
    assertThat(VersionStatus.REPROCESS_SUCCESS.isEligible()).isTrue();
    assertThat(VersionStatus.SUCCESS.isEligible()).isFalse();
    assertThat(VersionStatus.ALTERNATIVE_PATH.isEligible()).isFalse();
    assertThat(VersionStatus.CLEANED.isEligible()).isFalse();
  }

  @Test
  void terminalOutcomesHaveReprocessCounterparts() {
    assertThat(VersionStatus.SUCCESS.toReprocess()).isEqualTo(VersionStatus.REPROCESS_SUCCESS);
    assertThat(VersionStatus.ALTERNATIVE_PATH.toReprocess())
        .isEqualTo(VersionStatus.REPROCESS_ALTERNATIVE);
    assertThat(VersionStatus.NOT_FOUND.toReprocess()).isEqualTo(VersionStatus.NOT_FOUND);
  }

  @Test
  void fromCodeRoundTripsAndRejectsUnknown() {
    assertThat(VersionStatus.fromCode(491)).isEqualTo(VersionStatus.ALTERNATIVE_PATH);
    assertThatThrownBy(() -> VersionStatus.fromCode(999))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
