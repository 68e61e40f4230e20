package rendezvous.benchmark;

import rendezvous.api.synchronizer.WaitGroup;
import rendezvous.core.RendezvousClient;
import java.util.concurrent.TimeUnit;
import org.openjdk.jmh.annotations.*;

@BenchmarkMode({Mode.AverageTime, Mode.Throughput})
@OutputTimeUnit(TimeUnit.MICROSECONDS)
@Fork(
    value = 1,
    jvmArgs = {"-Xms2G", "-Xmx2G"})
@Warmup(iterations = 3, time = 5)
@Measurement(iterations = 5, time = 10)
@State(Scope.Benchmark)
public class WaitGroupBenchmark {

  private RendezvousClient client;
  private WaitGroup waitGroup;

  @Setup(Level.Trial)
  public void setupClient() {
    client = new RendezvousClient();
  }

  @TearDown(Level.Trial)
  public void tearDownClient() {
    if (client != null) client.close();
  }

  @Setup(Level.Iteration)
  public void setupWaitGroup() {
    // Use a unique name for each iteration to ensure the group starts fresh.
    waitGroup = client.getWaitGroup("benchmark-wait-group-" + System.nanoTime());
  }

  @TearDown(Level.Iteration)
  public void tearDownWaitGroup() {
    waitGroup.close();
  }

  /** All threads hammer the packed state word with register/complete pairs. */
  @Benchmark
  @Threads(32)
  public void contendedIncrementAndDecrement() {
    waitGroup.increment(1);
    waitGroup.decrement();
  }

  /** Await on a group with nothing outstanding only reads the state word. */
  @Benchmark
  @Threads(4)
  public void awaitIdle() {
    waitGroup.await();
  }
}
