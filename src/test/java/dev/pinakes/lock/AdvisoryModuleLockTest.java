package dev.pinakes.lock;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.verifyNoInteractions;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.core.JdbcTemplate;

@ExtendWith(MockitoExtension.class)
class AdvisoryModuleLockTest {

  @Mock JdbcTemplate jdbcTemplate;

  @InjectMocks AdvisoryModuleLock lock;

  @Test
  void refusesToLockOutsideTransaction() {
    assertThatThrownBy(() -> lock.withModuleLock("example.com/mod", () -> 1))
        .isInstanceOf(NotInTransactionException.class);

    verifyNoInteractions(jdbcTemplate);
  }
}
