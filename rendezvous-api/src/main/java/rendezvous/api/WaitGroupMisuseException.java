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

package rendezvous.api;

/**
 * Signals that a wait group has been used in a way that violates its contract.
 *
 * <p>Misuse always indicates a programming error in the caller, never a transient condition. The
 * primitive does not retry or repair the offending operation; the exception propagates to the
 * caller of that operation.
 */
public class WaitGroupMisuseException extends RendezvousException {

  private final String resourceId;

  public WaitGroupMisuseException(String resourceId, String message) {
    super(String.format("WaitGroup [%s] misuse: %s", resourceId, message));
    this.resourceId = resourceId;
  }

  /**
   * @return The id of the wait group that detected the misuse.
   */
  public String getResourceId() {
    return resourceId;
  }
}
