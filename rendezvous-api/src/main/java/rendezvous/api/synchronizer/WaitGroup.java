/*
 * Copyright 2025 XueFeng Ma
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package rendezvous.api.synchronizer;

import rendezvous.api.ConcurrentReuseException;
import rendezvous.api.NegativeCounterException;
import rendezvous.api.RendezvousStateException;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * A synchronization aid that lets one or more threads wait until a dynamically sized set of
 * concurrent workers has finished.
 *
 * <p>A producer registers outstanding work with {@link #increment(int)} before launching workers,
 * each worker calls {@link #decrement()} on completion, and any number of observers call {@link
 * #await()}. Observers are released once the outstanding-work counter drops to zero. Unlike {@link
 * java.util.concurrent.CountDownLatch} the count is not fixed up front and may grow while work is
 * in flight:
 *
 * <pre>{@code
 * WaitGroup group = client.getWaitGroup("import-batch");
 * for (Path file : files) {
 *   group.go(executor, () -> importFile(file));
 * }
 * group.await();
 * // every file has been imported
 * }</pre>
 *
 * <h3>Reuse</h3>
 *
 * A wait group can serve several completion cycles, but a new cycle may only be started after the
 * counter of the previous one has returned to zero <em>and</em> every waiter of that cycle has
 * returned from {@link #await()}. Starting a new cycle earlier is a caller error; when it is
 * observed the affected waiter fails with {@link ConcurrentReuseException}.
 *
 * <h3>Liveness</h3>
 *
 * The wait group cannot tell a counter that is legitimately zero from one that was never
 * registered, nor can it detect work that will never complete. Waiters blocked on work that is
 * never signaled stay blocked forever; there is no timeout and no cancellation.
 */
public abstract class WaitGroup implements AutoCloseable {

  /**
   * @return The name of this wait group.
   */
  public abstract String getResourceId();

  /**
   * Adds {@code delta}, which may be negative, to the outstanding-work counter. If the counter
   * becomes zero every thread blocked in {@link #await()} is released.
   *
   * <p>Calls with a positive delta that start a new cycle must happen before the corresponding
   * {@link #await()}. This method never blocks.
   *
   * @param delta the number of units of work to register, or to mark complete when negative
   * @throws NegativeCounterException if the counter would become negative; the counter is left
   *     unchanged
   * @throws IllegalArgumentException if the counter would overflow
   * @throws RendezvousStateException if {@code delta} is positive and this wait group is closed
   */
  public abstract void increment(int delta);

  /**
   * Marks one unit of work as complete. Equivalent to {@code increment(-1)}.
   *
   * @throws NegativeCounterException if no unit of work is outstanding
   */
  public final void decrement() {
    increment(-1);
  }

  /**
   * Blocks until the outstanding-work counter is zero. Returns immediately if it already is.
   *
   * <p>The wait is not interruptible. If the calling thread is interrupted while waiting it keeps
   * waiting and its interrupt status is set on return.
   *
   * @throws ConcurrentReuseException if, on wake-up, a new cycle has already been started
   */
  public abstract void await();

  /**
   * Runs {@code task} on {@code executor} as one unit of work of this wait group.
   *
   * <p>The unit is registered before the task is handed over and marked complete when the task
   * finishes, normally or exceptionally. If the executor refuses the task the registration is
   * rolled back before the rejection propagates. The unit is marked complete exactly once, also
   * when the executor runs the task in the calling thread and the task throws {@link
   * RejectedExecutionException} itself.
   *
   * @param executor the executor to run the task on
   * @param task the work to run
   * @throws RejectedExecutionException if the executor does not accept the task
   */
  public void go(Executor executor, Runnable task) {
    checkNotNull(executor, "executor");
    checkNotNull(task, "task");

    increment(1);
    // Marks the unit complete at most once: an executor may run the task in the calling thread
    // and the task itself may throw RejectedExecutionException.
    AtomicBoolean completed = new AtomicBoolean(false);
    Runnable complete =
        () -> {
          if (completed.compareAndSet(false, true)) decrement();
        };
    try {
      executor.execute(
          () -> {
            try {
              task.run();
            } finally {
              complete.run();
            }
          });
    } catch (RejectedExecutionException e) {
      complete.run();
      throw e;
    }
  }

  /**
   * Returns the current number of outstanding units of work.
   *
   * <p>This method is typically used for debugging and testing purposes.
   *
   * @return The current count.
   */
  public abstract int getCount();

  /**
   * Returns the number of threads currently registered in {@link #await()}.
   *
   * <p>This method is typically used for debugging and testing purposes.
   *
   * @return The current number of waiters.
   */
  public abstract int getWaiterCount();

  /**
   * @return The current wait group is closed.
   */
  public abstract boolean isClosed();

  /**
   * Closes this wait group. No new work can be registered afterward, but outstanding work may
   * still be marked complete and waiters are still released when it is. Closing twice has no
   * effect.
   *
   * <p>Closing is not ordered with concurrent {@link #increment(int)} calls: an increment racing
   * with {@code close} may still be accepted. Stop producers before closing if that matters.
   */
  @Override
  public abstract void close();
}
