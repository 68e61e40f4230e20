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

import rendezvous.api.synchronizer.WakeChannel;
import com.google.errorprone.annotations.ThreadSafe;

import java.util.concurrent.Semaphore;

/**
 * A {@link WakeChannel} backed by a {@link Semaphore} that starts with zero permits.
 *
 * <p>Each release adds one permit and each acquire takes one, so a release issued before its
 * waiter actually parks is not lost: the waiter finds the permit and returns without blocking.
 */
@ThreadSafe
public final class SemaphoreWakeChannel implements WakeChannel {

  private final Semaphore semaphore;

  /** Creates a non-fair channel. */
  public SemaphoreWakeChannel() {
    this(false);
  }

  /**
   * @param fair {@code true} to hand out releases to waiters in first-in first-out order
   */
  public SemaphoreWakeChannel(boolean fair) {
    this.semaphore = new Semaphore(0, fair);
  }

  @Override
  public void acquire() {
    semaphore.acquireUninterruptibly();
  }

  @Override
  public void release() {
    semaphore.release();
  }

  /**
   * @return The number of releases issued but not yet consumed.
   */
  public int pendingReleases() {
    return semaphore.availablePermits();
  }

  /**
   * @return An estimate of the number of threads parked in {@link #acquire()}.
   */
  public int parkedThreads() {
    return semaphore.getQueueLength();
  }
}
