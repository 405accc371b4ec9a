package dev.pinakes.lock;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import dev.pinakes.BaseIntegrationTest;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

class AdvisoryModuleLockIT extends BaseIntegrationTest {

  @Autowired private ModuleLock moduleLock;

  @Autowired private PlatformTransactionManager transactionManager;

  @Test
  void advisoryLockIsTheDefault() {
    assertThat(moduleLock).isInstanceOf(AdvisoryModuleLock.class);
  }

  @Test
  void holdersOfTheSameModuleNeverOverlap() throws Exception {
    TransactionTemplate tx = new TransactionTemplate(transactionManager);
    AtomicInteger inside = new AtomicInteger();
    AtomicInteger maxInside = new AtomicInteger();
    CountDownLatch start = new CountDownLatch(1);
    ExecutorService pool = Executors.newFixedThreadPool(4);
    try {
      List<Future<?>> futures = new ArrayList<>();
      for (int i = 0; i < 8; i++) {
        futures.add(
            pool.submit(
                () -> {
                  start.await();
                  return tx.execute(
                      status ->
                          moduleLock.withModuleLock(
                              "example.com/locked",
                              () -> {
                                maxInside.accumulateAndGet(inside.incrementAndGet(), Math::max);
                                sleep(20);
                                inside.decrementAndGet();
                                return null;
                              }));
                }));
      }
      start.countDown();
      for (Future<?> f : futures) {
        f.get(30, TimeUnit.SECONDS);
      }
    } finally {
      pool.shutdownNow();
    }

    assertThat(maxInside).hasValue(1);
  }

  @Test
  void lockOutsideTransactionIsRejected() {
    assertThatThrownBy(() -> moduleLock.withModuleLock("example.com/x", () -> "never"))
        .isInstanceOf(NotInTransactionException.class);
  }

  private static void sleep(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException(e);
    }
  }
}
