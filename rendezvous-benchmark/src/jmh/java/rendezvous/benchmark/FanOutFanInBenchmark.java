package rendezvous.benchmark;

import rendezvous.api.synchronizer.WaitGroup;
import rendezvous.core.RendezvousClient;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.LongAdder;
import org.openjdk.jmh.annotations.*;
import org.openjdk.jmh.infra.Blackhole;

/** One full cycle: fan out {@code tasks} tasks to a pool, then block until all of them finished. */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(1)
@Warmup(iterations = 3, time = 5)
@Measurement(iterations = 5, time = 10)
@State(Scope.Benchmark)
public class FanOutFanInBenchmark {

  @Param({"8", "64", "512"})
  public int tasks;

  private final LongAdder sink = new LongAdder();

  private ExecutorService executor;
  private RendezvousClient client;
  private WaitGroup waitGroup;

  @Setup(Level.Trial)
  public void setup() {
    executor = Executors.newFixedThreadPool(8);
    client = new RendezvousClient();
    waitGroup = client.getWaitGroup("fan-out-fan-in");
  }

  @TearDown(Level.Trial)
  public void tearDown() throws InterruptedException {
    client.close();
    executor.shutdownNow();
    executor.awaitTermination(10, TimeUnit.SECONDS);
  }

  @Benchmark
  public void waitGroupCycle(Blackhole blackhole) {
    for (int i = 0; i < tasks; i++) {
      int task = i;
      waitGroup.go(executor, () -> sink.add(task));
    }
    waitGroup.await();
    blackhole.consume(sink.sum());
  }

  @Benchmark
  public void countDownLatchCycle(Blackhole blackhole) throws InterruptedException {
    CountDownLatch latch = new CountDownLatch(tasks);
    for (int i = 0; i < tasks; i++) {
      int task = i;
      executor.execute(
          () -> {
            try {
              sink.add(task);
            } finally {
              latch.countDown();
            }
          });
    }
    latch.await();
    blackhole.consume(sink.sum());
  }
}
