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

import rendezvous.api.RendezvousStateException;
import rendezvous.api.synchronizer.WaitGroup;
import rendezvous.api.synchronizer.WakeChannel;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.MustBeClosed;
import com.google.errorprone.annotations.ThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Entry point for obtaining {@link WaitGroup} instances.
 *
 * <p>The client keeps a registry of live wait groups keyed by name, so that independent components
 * asking for the same name coordinate on the same instance. A wait group leaves the registry when
 * it is closed; asking for the same name afterward creates a fresh one.
 *
 * <p>Every wait group created by a client gets its own {@link WakeChannel} from the client's
 * factory. By default that is a non-fair {@link SemaphoreWakeChannel}.
 */
@ThreadSafe
public class RendezvousClient implements AutoCloseable {
  private final Logger log = LoggerFactory.getLogger(RendezvousClient.class);

  private final Supplier<? extends WakeChannel> wakeChannelFactory;

  private final Map<String, WaitGroup> waitGroups = new ConcurrentHashMap<>();

  // Written under the monitor in close(), read without it.
  private volatile boolean closed = false;

  public RendezvousClient() {
    this(SemaphoreWakeChannel::new);
  }

  public RendezvousClient(Supplier<? extends WakeChannel> wakeChannelFactory) {
    this.wakeChannelFactory = checkNotNull(wakeChannelFactory, "wakeChannelFactory");
  }

  /**
   * Returns the live wait group registered under {@code resourceId}, creating it on first use.
   *
   * <p>The instance is shared by every caller that asks for the same name. Closing it through any
   * of them closes it for all of them and removes the name from this client; only the owner of
   * the name should close it.
   *
   * @param resourceId the name of the wait group
   * @return the wait group registered under that name
   * @throws IllegalArgumentException if {@code resourceId} is blank
   * @throws RendezvousStateException if this client is closed
   */
  public WaitGroup getWaitGroup(String resourceId) {
    checkNotNull(resourceId, "resourceId");
    checkArgument(!resourceId.isBlank(), "resourceId must not be blank");
    ensureOpen();

    WaitGroup waitGroup = waitGroups.computeIfAbsent(resourceId, this::createWaitGroup);

    // close() may have taken its snapshot before this group was registered.
    if (closed) {
      waitGroup.close();
      throw new RendezvousStateException("RendezvousClient is closed");
    }
    return waitGroup;
  }

  /**
   * Creates and registers a wait group under a random name. The caller is its only holder.
   *
   * @return the new wait group
   * @throws RendezvousStateException if this client is closed
   */
  @MustBeClosed
  public WaitGroup newWaitGroup() {
    return getWaitGroup(UUID.randomUUID().toString());
  }

  private WaitGroup createWaitGroup(String resourceId) {
    WakeChannel wakeChannel =
        checkNotNull(wakeChannelFactory.get(), "wakeChannelFactory returned null");
    WaitGroup waitGroup = new DefaultWaitGroup(resourceId, wakeChannel, this::deregister);
    if (log.isDebugEnabled()) {
      log.debug(
          "WaitGroup [{}] created with wake channel {}",
          resourceId,
          wakeChannel.getClass().getSimpleName());
    }
    return waitGroup;
  }

  private void deregister(WaitGroup waitGroup) {
    // Only remove the mapping if it still points at this very instance.
    boolean removed = waitGroups.remove(waitGroup.getResourceId(), waitGroup);
    if (log.isDebugEnabled()) {
      log.debug(
          "WaitGroup [{}] closed. Deregistered: {} Outstanding: {} Waiters: {}",
          waitGroup.getResourceId(),
          removed,
          waitGroup.getCount(),
          waitGroup.getWaiterCount());
    }
  }

  private void ensureOpen() {
    if (closed) throw new RendezvousStateException("RendezvousClient is closed");
  }

  /**
   * @return The names of the wait groups currently registered with this client.
   */
  public ImmutableList<String> getResourceIds() {
    return ImmutableList.copyOf(waitGroups.keySet());
  }

  public boolean isClosed() {
    return closed;
  }

  /** Closes this client and every wait group still registered with it. */
  @Override
  public synchronized void close() {
    if (closed) return;
    closed = true;

    // Closing a wait group deregisters it, so iterate over a copy.
    ImmutableList<WaitGroup> snapshot = ImmutableList.copyOf(waitGroups.values());
    snapshot.forEach(WaitGroup::close);

    if (log.isDebugEnabled()) {
      log.debug("RendezvousClient closed. Wait groups closed: {}", snapshot.size());
    }
  }
}
