package rendezvous.test.waitgroup;

import rendezvous.api.ConcurrentReuseException;
import rendezvous.api.synchronizer.WaitGroup;
import rendezvous.api.synchronizer.WakeChannel;
import rendezvous.core.RendezvousClient;
import rendezvous.core.SemaphoreWakeChannel;
import rendezvous.test.BaseTest;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ConcurrentReuseDetectionTest extends BaseTest {

  @DisplayName("WG-TC-009: starting a new cycle before the released waiter resumed is reported")
  @Test
  public void testNewCycleBeforeWaiterResumed() throws Exception {
    CountDownLatch releasing = new CountDownLatch(1);
    CountDownLatch proceed = new CountDownLatch(1);
    SemaphoreWakeChannel delegate = new SemaphoreWakeChannel();
    WakeChannel held =
        new WakeChannel() {
          @Override
          public void acquire() {
            delegate.acquire();
          }

          @Override
          public void release() {
            releasing.countDown();
            try {
              proceed.await(10, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
              Thread.currentThread().interrupt();
            }
            delegate.release();
          }
        };

    RendezvousClient client = new RendezvousClient(() -> held);
    ExecutorService pool = newWorkerPool(2);
    WaitGroup waitGroup = client.getWaitGroup("TestWaitGroup-009");

    try {
      waitGroup.increment(1);
      Future<?> waiter = pool.submit(waitGroup::await);
      awaitTrue(() -> waitGroup.getWaiterCount() == 1, Duration.ofSeconds(5), "waiter registered");

      Future<?> finisher = pool.submit(waitGroup::decrement);
      assertThat(releasing.await(5, TimeUnit.SECONDS)).isTrue();

      waitGroup.increment(1);
      proceed.countDown();
      finisher.get(5, TimeUnit.SECONDS);

      assertThatThrownBy(() -> waiter.get(5, TimeUnit.SECONDS))
          .isInstanceOf(ExecutionException.class)
          .hasCauseInstanceOf(ConcurrentReuseException.class);
    } finally {
      pool.shutdownNow();
      client.close();
    }
  }
}
