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

/**
 * A blocking counter used by a {@link WaitGroup} to park waiters and to wake them again.
 *
 * <p>The channel carries no semantics of its own beyond counting releases: {@link #acquire()}
 * blocks until the count is positive and then takes one, {@link #release()} adds one and wakes at
 * most one blocked acquirer. Each registered waiter of a wait group calls {@code acquire} exactly
 * once and the wait group calls {@code release} exactly once per registered waiter.
 *
 * @see java.util.concurrent.Semaphore
 */
public interface WakeChannel {

  /**
   * Blocks the calling thread until a release is available, then consumes it.
   *
   * <p>Implementations must not return early on interruption: a registered waiter has to consume
   * exactly one release, otherwise the release it was owed would be left for an unrelated waiter.
   */
  void acquire();

  /** Makes one release available, waking at most one blocked acquirer. */
  void release();
}
