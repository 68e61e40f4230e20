package rendezvous.core;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

public class SemaphoreWakeChannelTest {

  @Test
  @DisplayName("A release issued before the acquire is not lost")
  void testReleaseBeforeAcquire() {
    SemaphoreWakeChannel channel = new SemaphoreWakeChannel();
    channel.release();
    assertThat(channel.pendingReleases()).isEqualTo(1);

    channel.acquire();
    assertThat(channel.pendingReleases()).isZero();
  }

  @Test
  @DisplayName("acquire keeps waiting through an interrupt and preserves the interrupt status")
  void testAcquireIsUninterruptible() throws Exception {
    SemaphoreWakeChannel channel = new SemaphoreWakeChannel(true);
    AtomicBoolean interruptedOnReturn = new AtomicBoolean();

    Thread waiter =
        new Thread(
            () -> {
              channel.acquire();
              interruptedOnReturn.set(Thread.currentThread().isInterrupted());
            });
    waiter.start();
    awaitParked(channel, 1);

    waiter.interrupt();
    waiter.join(200L);
    assertThat(waiter.isAlive()).isTrue();

    channel.release();
    waiter.join(TimeUnit.SECONDS.toMillis(5));
    assertThat(waiter.isAlive()).isFalse();
    assertThat(interruptedOnReturn.get()).isTrue();
  }

  @Test
  @DisplayName("Each release wakes one acquirer")
  void testOneReleasePerAcquirer() throws Exception {
    SemaphoreWakeChannel channel = new SemaphoreWakeChannel();
    ExecutorService executor = Executors.newFixedThreadPool(2);
    CompletableFuture<Void> first = CompletableFuture.runAsync(channel::acquire, executor);
    CompletableFuture<Void> second = CompletableFuture.runAsync(channel::acquire, executor);
    awaitParked(channel, 2);

    channel.release();
    assertTimeoutPreemptively(
        Duration.ofSeconds(5),
        () -> {
          while (!first.isDone() && !second.isDone()) Thread.sleep(2L);
        });
    Thread.sleep(100L);
    assertThat(first.isDone() && second.isDone()).isFalse();

    channel.release();
    CompletableFuture.allOf(first, second).get(5, TimeUnit.SECONDS);
    assertThat(channel.pendingReleases()).isZero();
    executor.shutdownNow();
  }

  private static void awaitParked(SemaphoreWakeChannel channel, int threads) {
    assertTimeoutPreemptively(
        Duration.ofSeconds(5),
        () -> {
          while (channel.parkedThreads() < threads) Thread.sleep(2L);
        });
  }
}
