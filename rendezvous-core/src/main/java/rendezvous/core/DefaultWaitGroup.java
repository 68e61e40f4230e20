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

package rendezvous.core;

import rendezvous.api.ConcurrentReuseException;
import rendezvous.api.NegativeCounterException;
import rendezvous.api.RendezvousStateException;
import rendezvous.api.synchronizer.WaitGroup;
import rendezvous.api.synchronizer.WakeChannel;
import com.google.common.annotations.Beta;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.MoreObjects;
import com.google.errorprone.annotations.ThreadSafe;

import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * The default lock-free implementation of a {@link WaitGroup}.
 *
 * <h4>Implementation Details</h4>
 *
 * The outstanding-work counter and the number of registered waiters share a single {@link
 * AtomicLong}: the high 32 bits hold the signed counter, the low 32 bits the unsigned waiter
 * count. Every mutation is a compare-and-set over the whole word, so the two fields are always
 * observed and updated consistently with each other. No lock is taken anywhere.
 *
 * <ul>
 *   <li>{@link #increment(int)} computes the next counter, rejects it if it is negative or
 *       overflows, and commits it. The call that moves the counter from positive to zero while
 *       waiters are registered commits the empty word {@code 0L} instead, capturing the waiter
 *       count in the same step, and then releases the {@link WakeChannel} once per captured
 *       waiter. A waiter can therefore never register after the count was captured.
 *   <li>{@link #await()} returns at once if the counter is zero. Otherwise it registers itself by
 *       incrementing the waiter count with compare-and-set, retrying on contention, and parks on
 *       the wake channel until released.
 * </ul>
 *
 * <p>Because the state word is reset in the same compare-and-set that observes the zero-crossing,
 * a counter of zero always implies a waiter count of zero.
 */
@Beta
@ThreadSafe
final class DefaultWaitGroup extends WaitGroup {

  private static final int COUNTER_SHIFT = 32;
  private static final long WAITER_MASK = 0xFFFF_FFFFL;

  private final String resourceId;
  private final WakeChannel wakeChannel;
  private final Consumer<WaitGroup> onCloseListener;

  private final AtomicLong state = new AtomicLong(0L);
  private final AtomicBoolean closed = new AtomicBoolean(false);

  /**
   * @param resourceId The name of the wait group.
   * @param wakeChannel The channel waiters park on; must start with no pending releases.
   * @param onCloseListener Invoked once, when the wait group is first closed.
   */
  DefaultWaitGroup(
      String resourceId, WakeChannel wakeChannel, Consumer<WaitGroup> onCloseListener) {
    this.resourceId = resourceId;
    this.wakeChannel = wakeChannel;
    this.onCloseListener = onCloseListener;
  }

  @VisibleForTesting
  static int counterOf(long state) {
    return (int) (state >> COUNTER_SHIFT);
  }

  @VisibleForTesting
  static int waitersOf(long state) {
    return (int) (state & WAITER_MASK);
  }

  @VisibleForTesting
  static long pack(int counter, int waiters) {
    return ((long) counter << COUNTER_SHIFT) | (waiters & WAITER_MASK);
  }

  @Override
  public String getResourceId() {
    return resourceId;
  }

  @Override
  public void increment(int delta) {
    for (; ; ) {
      // Re-checked on every retry; still best-effort against a close racing the final CAS.
      if (delta > 0 && closed.get()) {
        throw new RendezvousStateException(
            String.format("WaitGroup [%s] is closed and accepts no new work", resourceId));
      }

      long current = state.get();
      long next = (long) counterOf(current) + delta;
      if (next < 0L) throw new NegativeCounterException(resourceId, next);
      if (next > Integer.MAX_VALUE) throw new IllegalArgumentException("counter overflow");

      int waiters = waitersOf(current);
      if (next > 0L || waiters == 0) {
        if (state.compareAndSet(current, pack((int) next, waiters))) return;
        continue;
      }

      // Zero-crossing with registered waiters. Whoever resets the word owns the releases.
      if (state.compareAndSet(current, 0L)) {
        for (int i = 0; i < waiters; i++) {
          wakeChannel.release();
        }
        return;
      }
    }
  }

  @Override
  public void await() {
    for (; ; ) {
      long current = state.get();
      if (counterOf(current) == 0) return;

      if (state.compareAndSet(current, current + 1L)) {
        wakeChannel.acquire();
        if (state.get() != 0L) throw new ConcurrentReuseException(resourceId);
        return;
      }
    }
  }

  @Override
  public int getCount() {
    return counterOf(state.get());
  }

  @Override
  public int getWaiterCount() {
    return waitersOf(state.get());
  }

  @Override
  public boolean isClosed() {
    return closed.get();
  }

  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      onCloseListener.accept(this);
    }
  }

  @Override
  public String toString() {
    long current = state.get();
    return MoreObjects.toStringHelper(WaitGroup.class)
        .add("resourceId", resourceId)
        .add("count", counterOf(current))
        .add("waiters", waitersOf(current))
        .add("closed", closed.get())
        .toString();
  }
}
